package org.mediatagger.model;

/**
 * States of the write/verify/cleanup sequence a single media file goes through.
 */
public enum PipelineState {
    /** The file already carries the completion marker; nothing is done. */
    SKIP(true, true),
    /** No metadata was found; writing is skipped and the file goes to cleanup. */
    EMPTY(false, false),
    /** Metadata is known and about to be written. */
    WRITE_PENDING(false, false),
    /** The codec reported success writing the tags. */
    WRITTEN(false, false),
    /** The codec failed; sidecar and filename are left untouched. */
    WRITE_FAILED(true, false),
    /** The tags read back match what was written. */
    VERIFIED(false, false),
    /** A required field did not read back; sidecar and filename are left untouched. */
    VERIFY_FAILED(true, false),
    /** Sidecar deletion, then rename. */
    CLEANUP(false, false),
    /** The file carries its final name. */
    RENAMED(true, true),
    /** Tags are written but the file keeps its original name. */
    RENAME_FAILED(true, false);

    private final boolean terminal;
    private final boolean success;

    PipelineState(boolean terminal, boolean success) {
        this.terminal = terminal;
        this.success = success;
    }

    public boolean isTerminal() {
        return terminal;
    }

    /** @return true for the terminal states that need no retry */
    public boolean isSuccess() {
        return success;
    }
}
