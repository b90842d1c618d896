package org.mediatagger.controller.util;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Shared utility for running external processes with output capture.
 *
 * <p>Handles the common pattern of: start process, drain its output on a
 * separate thread, wait (optionally bounded), check exit code, clean up on
 * failure.
 * A timeout of zero or less waits for the process indefinitely, which is
 * what the metadata codec does for its read and write calls.
 */
public final class ProcessRunner {

    private static final Logger logger = Logger.getLogger(ProcessRunner.class.getName());

    private static final long DRAIN_GRACE_MILLIS = 500;

    private ProcessRunner() {
        // utility class
    }

    /**
     * Result of running an external process.
     *
     * @param success    true if the process exited with code 0 (within the timeout, if any)
     * @param exitCode   the process exit code, or -1 if it timed out or failed to start
     * @param output     captured output, or empty string on failure
     */
    public record Result(boolean success, int exitCode, String output) {

        /** Convenience: a failed result for when the process could not start. */
        static Result failure() {
            return new Result(false, -1, "");
        }
    }

    /**
     * Run an external command, capturing combined stdout/stderr.
     *
     * @param command        the command and arguments
     * @param timeoutSeconds maximum time to wait for the process; zero or less waits forever
     * @return a {@link Result} with success status, exit code, and output
     */
    public static Result run(List<String> command, int timeoutSeconds) {
        return run(command, timeoutSeconds, true);
    }

    /**
     * Run an external command, capturing only stdout. Anything the process
     * writes to stderr is discarded, so the captured text can be handed to a
     * parser that expects structured output.
     *
     * @param command        the command and arguments
     * @param timeoutSeconds maximum time to wait for the process; zero or less waits forever
     * @return a {@link Result} with success status, exit code, and stdout
     */
    public static Result runForOutput(List<String> command, int timeoutSeconds) {
        return run(command, timeoutSeconds, false);
    }

    private static Thread drain(Process process, StringBuffer output) {
        Thread drainer = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    output.append(line).append('\n');
                }
            } catch (IOException e) {
                logger.log(Level.FINE, "Output stream closed early", e);
            }
        }, "process-output");
        drainer.setDaemon(true);
        drainer.start();
        return drainer;
    }

    private static Result run(List<String> command, int timeoutSeconds, boolean mergeErrors) {
        Process process = null;
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            if (mergeErrors) {
                pb.redirectErrorStream(true);
            } else {
                pb.redirectError(ProcessBuilder.Redirect.DISCARD);
            }

            process = pb.start();

            // Drained on its own thread so a process that never closes its
            // output cannot hold us past the timeout.
            StringBuffer output = new StringBuffer();
            Thread drainer = drain(process, output);

            if (timeoutSeconds > 0) {
                boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
                if (!finished) {
                    process.destroyForcibly();
                    drainer.join(DRAIN_GRACE_MILLIS);
                    logger.warning("Timed out after " + timeoutSeconds + "s: " + command);
                    return new Result(false, -1, output.toString());
                }
                drainer.join(TimeUnit.SECONDS.toMillis(timeoutSeconds));
            } else {
                process.waitFor();
                drainer.join();
            }

            int exitCode = process.exitValue();
            return new Result(exitCode == 0, exitCode, output.toString());

        } catch (IOException e) {
            logger.log(Level.FINE, "Failed to run: " + command, e);
            return Result.failure();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.log(Level.FINE, "Interrupted running: " + command, e);
            return Result.failure();
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }
}
