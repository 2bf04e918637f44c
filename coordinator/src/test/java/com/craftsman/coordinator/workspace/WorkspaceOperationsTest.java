package com.craftsman.coordinator.workspace;

import com.craftsman.coordinator.tool.OperationKind;
import com.craftsman.coordinator.tool.ToolCall;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Local file operations against a temporary workspace.
 */
class WorkspaceOperationsTest {

    @TempDir Path root;

    Workspace workspace;

    @BeforeEach
    void setUp() throws IOException {
        workspace = new Workspace(root);
        Files.createDirectories(root.resolve("src"));
        Files.writeString(root.resolve("src/Parser.java"), "class Parser {\n  void parse() { helper(); }\n}\n");
        Files.writeString(root.resolve("src/Main.java"), "class Main {\n  // calls helper\n  void run() { helper(); }\n}\n");
    }

    static ToolCall call(OperationKind kind, Map<String, Object> args) {
        return new ToolCall("root-1", "coder", kind, args);
    }

    @Test
    void readFile_lineRange_isOneBasedInclusive() throws Exception {
        ReadFileOperation read = new ReadFileOperation(workspace, 10_000);

        Object all = read.execute(call(OperationKind.READ_FILE, Map.of("path", "src/Parser.java")));
        Object middle = read.execute(call(OperationKind.READ_FILE,
                Map.of("path", "src/Parser.java", "startLine", 2, "endLine", 2)));

        assertThat(all).asString().startsWith("class Parser {").contains("parse()");
        assertThat(middle).isEqualTo("  void parse() { helper(); }");
    }

    @Test
    void readFile_missingFile_throwsNoSuchFile() {
        ReadFileOperation read = new ReadFileOperation(workspace, 10_000);

        assertThatThrownBy(() -> read.execute(call(OperationKind.READ_FILE, Map.of("path", "src/Nope.java"))))
                .isInstanceOf(NoSuchFileException.class);
    }

    @Test
    void anyOperation_pathEscapingWorkspace_rejected() {
        ReadFileOperation read = new ReadFileOperation(workspace, 10_000);

        assertThatThrownBy(() -> read.execute(call(OperationKind.READ_FILE, Map.of("path", "../outside.txt"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("escapes");
    }

    @Test
    void writeFile_createsParentDirectories() throws Exception {
        WriteFileOperation write = new WriteFileOperation(workspace);

        Object result = write.execute(call(OperationKind.WRITE_FILE,
                Map.of("path", "docs/plans/PLAN.md", "content", "# Plan")));

        assertThat(Files.readString(root.resolve("docs/plans/PLAN.md"))).isEqualTo("# Plan");
        assertThat(result).asString().contains("docs/plans/PLAN.md");
        assertThat(write.manifest().idempotent()).isFalse();
    }

    @Test
    void search_returnsHitsSortedByFileWithLineNumbers() throws Exception {
        SearchOperation search = new SearchOperation(workspace, 50);

        @SuppressWarnings("unchecked")
        List<SearchOperation.Hit> hits = (List<SearchOperation.Hit>) search.execute(
                call(OperationKind.SEARCH, Map.of("pattern", "helper\\(\\)")));

        assertThat(hits).extracting(SearchOperation.Hit::file, SearchOperation.Hit::line)
                .containsExactly(
                        tuple("src/Main.java", 3),
                        tuple("src/Parser.java", 2));
    }

    @Test
    void search_respectsResultCap() throws Exception {
        SearchOperation search = new SearchOperation(workspace, 1);

        List<?> hits = (List<?>) search.execute(call(OperationKind.SEARCH, Map.of("pattern", "helper")));

        assertThat(hits).hasSize(1);
    }
}
