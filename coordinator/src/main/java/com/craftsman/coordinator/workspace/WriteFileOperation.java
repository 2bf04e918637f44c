package com.craftsman.coordinator.workspace;

import com.craftsman.coordinator.tool.OperationKind;
import com.craftsman.coordinator.tool.ToolCall;
import com.craftsman.coordinator.tool.ToolManifest;
import com.craftsman.coordinator.tool.ToolOperation;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * WRITE_FILE against the local workspace. Creates parent directories.
 * Not idempotent, so failures are never retried.
 *
 * Args: {@code path}, {@code content}.
 */
public class WriteFileOperation implements ToolOperation {

    private static final ToolManifest MANIFEST = ToolManifest.mutating(
            OperationKind.WRITE_FILE, "Write content to a file, creating parent directories.");

    private final Workspace workspace;

    public WriteFileOperation(Workspace workspace) {
        this.workspace = workspace;
    }

    @Override public ToolManifest manifest() { return MANIFEST; }

    @Override
    public Object execute(ToolCall call) throws IOException {
        Path file = workspace.resolve(call.stringArg("path"));
        String content = call.stringArg("content");
        if (content == null) {
            content = "";
        }
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return "Wrote " + content.length() + " chars to " + workspace.relativize(file);
    }
}
