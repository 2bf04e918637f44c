package com.craftsman.coordinator.workspace;

import com.craftsman.coordinator.tool.OperationKind;
import com.craftsman.coordinator.tool.ToolCall;
import com.craftsman.coordinator.tool.ToolManifest;
import com.craftsman.coordinator.tool.ToolOperation;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * SEARCH: regex search over the workspace, returning
 * {@code [{file, line, text}, ...]} capped at a configured number of hits.
 *
 * Args: {@code pattern} (required), {@code path} (optional, defaults to the
 * workspace root), {@code caseInsensitive} (optional).
 */
public class SearchOperation implements ToolOperation {

    private static final ToolManifest MANIFEST = new ToolManifest(
            OperationKind.SEARCH, "1.0.0",
            "Search workspace files for a regex; returns [{file, line, text}, ...].",
            true, "path");

    /** One match. */
    public record Hit(String file, int line, String text) {}

    private final Workspace workspace;
    private final int       maxResults;

    public SearchOperation(Workspace workspace, int maxResults) {
        this.workspace  = workspace;
        this.maxResults = maxResults;
    }

    @Override public ToolManifest manifest() { return MANIFEST; }

    @Override
    public Object execute(ToolCall call) throws IOException {
        String regex = call.stringArg("pattern");
        if (regex == null || regex.isEmpty()) {
            throw new IllegalArgumentException("pattern argument is required");
        }
        int flags = Boolean.parseBoolean(call.stringArg("caseInsensitive")) ? Pattern.CASE_INSENSITIVE : 0;
        Pattern pattern = Pattern.compile(regex, flags);

        String base = call.stringArg("path");
        Path start = base == null || base.isBlank() ? workspace.root() : workspace.resolve(base);

        List<Hit> hits = new ArrayList<>();
        try (Stream<Path> files = Files.walk(start)) {
            Iterator<Path> it = files.filter(Files::isRegularFile).sorted().iterator();
            while (it.hasNext() && hits.size() < maxResults) {
                scan(it.next(), pattern, hits);
            }
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        return hits;
    }

    private void scan(Path file, Pattern pattern, List<Hit> hits) throws IOException {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (MalformedInputException e) {
            // binary file
            return;
        }
        for (int i = 0; i < lines.size() && hits.size() < maxResults; i++) {
            if (pattern.matcher(lines.get(i)).find()) {
                hits.add(new Hit(workspace.relativize(file), i + 1, lines.get(i).strip()));
            }
        }
    }
}
