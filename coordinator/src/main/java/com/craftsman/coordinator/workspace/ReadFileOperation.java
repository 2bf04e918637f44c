package com.craftsman.coordinator.workspace;

import com.craftsman.coordinator.tool.OperationKind;
import com.craftsman.coordinator.tool.ToolCall;
import com.craftsman.coordinator.tool.ToolManifest;
import com.craftsman.coordinator.tool.ToolOperation;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

/**
 * READ_FILE against the local workspace.
 *
 * Args: {@code path} (required), {@code startLine} and {@code endLine}
 * (optional, 1-based, inclusive).
 */
public class ReadFileOperation implements ToolOperation {

    private static final ToolManifest MANIFEST = ToolManifest.readOnly(
            OperationKind.READ_FILE, "Read a file relative to the workspace root, optionally a line range.");

    private final Workspace workspace;
    private final long      maxBytes;

    public ReadFileOperation(Workspace workspace, long maxBytes) {
        this.workspace = workspace;
        this.maxBytes  = maxBytes;
    }

    @Override public ToolManifest manifest() { return MANIFEST; }

    @Override
    public Object execute(ToolCall call) throws IOException {
        Path file = workspace.resolve(call.stringArg("path"));
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(workspace.relativize(file));
        }
        if (Files.size(file) > maxBytes) {
            throw new IOException("File is larger than " + maxBytes + " bytes: " + workspace.relativize(file));
        }
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);

        int from = intArg(call, "startLine", 1);
        int to   = intArg(call, "endLine", lines.size());
        from = Math.max(1, from);
        to   = Math.min(lines.size(), to);
        if (from > to) {
            return "";
        }
        return String.join("\n", lines.subList(from - 1, to));
    }

    private static int intArg(ToolCall call, String name, int fallback) {
        String v = call.stringArg(name);
        return v == null ? fallback : Integer.parseInt(v.strip());
    }
}
