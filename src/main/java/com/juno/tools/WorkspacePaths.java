package com.juno.tools;

import java.nio.file.Path;

/**
 * Resolves tool-supplied file names inside a workspace directory.
 */
final class WorkspacePaths {

    private WorkspacePaths() {}

    /**
     * @throws IllegalArgumentException when the name escapes the workspace
     */
    static Path resolve(Path workspace, String fileName) {
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("file name is required");
        }
        Path root = workspace.toAbsolutePath().normalize();
        Path resolved = root.resolve(fileName).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new IllegalArgumentException("path " + fileName + " is outside the workspace");
        }
        return resolved;
    }
}
