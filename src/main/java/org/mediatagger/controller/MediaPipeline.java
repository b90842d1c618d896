package org.mediatagger.controller;

import static org.mediatagger.model.util.Constants.MAX_COLLISION_SEQUENCE;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.mediatagger.controller.metadata.MetadataCodec;
import org.mediatagger.controller.metadata.SidecarReader;
import org.mediatagger.controller.metadata.TagTable;
import org.mediatagger.controller.util.FileOperations;
import org.mediatagger.controller.util.StringUtils;
import org.mediatagger.model.MediaMetadata;
import org.mediatagger.model.PipelineOutcome;
import org.mediatagger.model.PipelineState;

/**
 * Writes a file's aggregated metadata into it, verifies the write, then
 * deletes the sidecar and renames the file.
 *
 * <p>Each file runs through {@link PipelineState} one transition at a time
 * until a terminal state is reached.  The sidecar is always deleted before
 * the rename, because its path is derived from the original filename.
 * A failed write or verification leaves both the sidecar and the filename
 * untouched, so the file is picked up again on the next pass.  Metadata
 * without a date is written but the file keeps its name.
 *
 * <p>Still images also get their rating and export keywords written.
 */
public class MediaPipeline {

    private static final Logger logger = Logger.getLogger(MediaPipeline.class.getName());

    private final MetadataCodec codec;
    private final MetadataAggregator aggregator;
    private final FilenameGenerator generator;
    private final MetadataVerifier verifier;
    private final FileOperations fileOperations;
    private final ExportKeywords exportKeywords;
    private final String completionMarker;

    public MediaPipeline(MetadataCodec codec,
                         MetadataAggregator aggregator,
                         FilenameGenerator generator,
                         MetadataVerifier verifier,
                         FileOperations fileOperations,
                         ExportKeywords exportKeywords,
                         String completionMarker) {
        this.codec = codec;
        this.aggregator = aggregator;
        this.generator = generator;
        this.verifier = verifier;
        this.fileOperations = fileOperations;
        this.exportKeywords = exportKeywords;
        this.completionMarker = completionMarker;
    }

    /** What one file carries from state to state. */
    private static class Run {
        final Path original;
        final Integer sequence;
        MediaMetadata metadata = MediaMetadata.EMPTY;
        TagTable table;
        Path current;

        Run(Path original, Integer sequence) {
            this.original = original;
            this.sequence = sequence;
            this.current = original;
        }
    }

    /**
     * Process one file.  Never throws.
     *
     * @param file the media file
     * @return the terminal state reached and the file's path afterwards
     */
    public PipelineOutcome process(Path file) {
        return process(file, null);
    }

    /**
     * Process one file, using the given sequence token in its new name.
     * With an explicit sequence no other token is tried on a name collision.
     *
     * @param file the media file
     * @param sequence the sequence token; null to pick one only if needed
     * @return the terminal state reached and the file's path afterwards
     */
    public PipelineOutcome process(Path file, Integer sequence) {
        Run run = new Run(file, sequence);
        PipelineState state = null;
        try {
            state = initialState(run);
            while (!state.isTerminal()) {
                PipelineState next = transition(run, state);
                logger.fine(file.getFileName() + ": " + state + " -> " + next);
                state = next;
            }
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Unexpected error processing " + file, e);
            state = failureFor(state);
        }
        logger.info(file.getFileName() + ": " + state
            + (run.current.equals(file) ? "" : " as " + run.current.getFileName()));
        return new PipelineOutcome(state, run.current);
    }

    private PipelineState initialState(Run run) {
        String stem = StringUtils.removeExtension(run.original.getFileName().toString());
        if (stem.contains(completionMarker)) {
            logger.fine("Skipping already processed file: " + run.original);
            return PipelineState.SKIP;
        }
        run.metadata = aggregator.aggregate(run.original);
        run.table = TagTable.forFile(run.original);
        if (MetadataAggregator.isEmpty(run.metadata)) {
            return PipelineState.EMPTY;
        }
        if (run.table == TagTable.IMAGE) {
            run.metadata = exportKeywords.addTo(run.metadata);
        }
        return PipelineState.WRITE_PENDING;
    }

    private PipelineState transition(Run run, PipelineState state) {
        switch (state) {
            case EMPTY:
                logger.fine("No metadata to write for " + run.original);
                return PipelineState.CLEANUP;
            case WRITE_PENDING:
                return write(run);
            case WRITTEN:
                return verify(run);
            case VERIFIED:
                return PipelineState.CLEANUP;
            case CLEANUP:
                return cleanup(run);
            default:
                throw new IllegalStateException("no transition out of " + state);
        }
    }

    private PipelineState write(Run run) {
        Map<String, String> tags = run.table.buildWriteTags(run.metadata);
        if (!codec.writeTags(run.original, tags)) {
            logger.warning("Could not write metadata to " + run.original);
            return PipelineState.WRITE_FAILED;
        }
        return PipelineState.WRITTEN;
    }

    private PipelineState verify(Run run) {
        Map<String, String> actual = codec.readTags(run.original);
        if (!verifier.verify(run.metadata, actual, run.table)) {
            logger.warning("Metadata verification failed for " + run.original);
            return PipelineState.VERIFY_FAILED;
        }
        return PipelineState.VERIFIED;
    }

    private PipelineState cleanup(Run run) {
        Path sidecar = SidecarReader.findSidecar(run.original);
        if (sidecar != null && !fileOperations.deleteFile(sidecar)) {
            // The file is renamed anyway; the sidecar is left orphaned.
            logger.warning("Could not delete sidecar " + sidecar + ", renaming anyway");
        }

        Path target = chooseTarget(run);
        if (target == null) {
            return PipelineState.RENAME_FAILED;
        }
        Path renamed = fileOperations.renameFile(run.original, target);
        if (renamed == null) {
            logger.warning("Could not rename " + run.original + " to " + target.getFileName());
            return PipelineState.RENAME_FAILED;
        }
        run.current = renamed;
        return PipelineState.RENAMED;
    }

    private Path chooseTarget(Run run) {
        String name = targetName(run, run.sequence);
        if (name == null) {
            logger.warning("No date for " + run.original + ", keeping its original name");
            return null;
        }
        Path target = run.original.resolveSibling(name);
        if (run.sequence != null || Files.notExists(target)) {
            return target;
        }
        for (int seq = 1; seq <= MAX_COLLISION_SEQUENCE; seq++) {
            Path candidate = run.original.resolveSibling(targetName(run, seq));
            if (Files.notExists(candidate)) {
                return candidate;
            }
        }
        logger.warning("No free name for " + run.original + " after " + MAX_COLLISION_SEQUENCE + " tries");
        return null;
    }

    /**
     * @return the new filename; null if the metadata has no date, in which
     *         case the file keeps its name
     */
    private String targetName(Run run, Integer sequence) {
        String filename = run.original.getFileName().toString();
        if (MetadataAggregator.isEmpty(run.metadata)) {
            return generator.fallback(filename, sequence);
        }
        return generator.generate(run.metadata, filename, sequence);
    }

    private static PipelineState failureFor(PipelineState reached) {
        if (reached == PipelineState.WRITTEN) {
            return PipelineState.VERIFY_FAILED;
        }
        if (reached == PipelineState.VERIFIED || reached == PipelineState.CLEANUP) {
            return PipelineState.RENAME_FAILED;
        }
        return PipelineState.WRITE_FAILED;
    }
}
