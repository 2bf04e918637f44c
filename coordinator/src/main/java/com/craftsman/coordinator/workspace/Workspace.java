package com.craftsman.coordinator.workspace;

import java.nio.file.Path;

/**
 * Directory the local file operations work in. Every path argument is
 * resolved against it and must stay inside it.
 */
public final class Workspace {

    private final Path root;

    public Workspace(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() { return root; }

    /**
     * @throws IllegalArgumentException if {@code relative} is blank or escapes the root
     */
    public Path resolve(String relative) {
        if (relative == null || relative.isBlank()) {
            throw new IllegalArgumentException("path argument is required");
        }
        Path resolved = root.resolve(relative).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Path escapes the workspace: " + relative);
        }
        return resolved;
    }

    public String relativize(Path absolute) {
        return root.relativize(absolute).toString().replace('\\', '/');
    }
}
