package org.mediatagger.controller;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.mediatagger.controller.util.FileOperations;

/**
 * Performs real file operations, recording each call and whether the
 * sidecar still existed when the rename was requested.
 */
class RecordingFileOperations implements FileOperations {

    final List<String> calls = new ArrayList<>();
    final List<Path> deleted = new ArrayList<>();
    boolean failDeletes = false;
    boolean failRenames = false;
    Boolean sidecarExistedAtRename = null;
    Path sidecarToWatch = null;

    @Override
    public boolean deleteFile(Path file) {
        calls.add("delete " + file.getFileName());
        if (failDeletes) {
            return false;
        }
        deleted.add(file);
        return FileOperations.DEFAULT.deleteFile(file);
    }

    @Override
    public Path renameFile(Path srcFile, Path destFile) {
        calls.add("rename " + srcFile.getFileName() + " -> " + destFile.getFileName());
        if (sidecarToWatch != null) {
            sidecarExistedAtRename = Files.exists(sidecarToWatch);
        }
        if (failRenames) {
            return null;
        }
        return FileOperations.DEFAULT.renameFile(srcFile, destFile);
    }
}
