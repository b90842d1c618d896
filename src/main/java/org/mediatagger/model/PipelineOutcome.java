package org.mediatagger.model;

import java.nio.file.Path;

/**
 * Where a media file ended up after a pipeline run.
 *
 * @param state the terminal state reached
 * @param path  the file's path after the run (the original path unless renamed)
 */
public record PipelineOutcome(PipelineState state, Path path) {

    public boolean isSuccess() {
        return state.isSuccess();
    }
}
