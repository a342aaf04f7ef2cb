package com.phillippitts.n8nsync.service.watch;

import com.phillippitts.n8nsync.domain.Workflow;
import com.phillippitts.n8nsync.exception.WorkflowFileException;
import com.phillippitts.n8nsync.util.Jsons;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.phillippitts.n8nsync.testutil.WorkflowFixtures.workflow;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowFilesTest {

    @TempDir
    Path dir;

    @Test
    void derivesFilenameFromWorkflowName() {
        assertThat(WorkflowFiles.filenameFor("Orders")).isEqualTo("Orders.json");
        assertThat(WorkflowFiles.filenameFor("a/b\\c:d")).isEqualTo("a_b_c_d.json");
        assertThat(WorkflowFiles.filenameFor("  two   words ")).isEqualTo("two words.json");
        assertThat(WorkflowFiles.stem("Orders.json")).isEqualTo("Orders");
    }

    @Test
    void tracksOnlyVisibleJsonFiles() {
        assertThat(WorkflowFiles.isWorkflowFilename("Orders.json")).isTrue();
        assertThat(WorkflowFiles.isWorkflowFilename(".n8n-state.json")).isFalse();
        assertThat(WorkflowFiles.isWorkflowFilename("notes.txt")).isFalse();
        assertThat(WorkflowFiles.isWorkflowFilename(null)).isFalse();
    }

    @Test
    void listsSortedAndSkipsStateAndTempFiles() throws IOException {
        WorkflowFiles files = new WorkflowFiles(dir, Jsons.newMapper());
        files.write("b.json", workflow("b", "x"));
        files.write("a.json", workflow("a", "x"));
        Files.writeString(dir.resolve(".n8n-state.json"), "{}");
        Files.writeString(dir.resolve("readme.md"), "hi");
        Files.createDirectories(dir.resolve(".archive"));

        assertThat(files.list()).containsExactly("a.json", "b.json");
    }

    @Test
    void missingDirectoryListsEmpty() {
        WorkflowFiles files = new WorkflowFiles(dir.resolve("absent"), Jsons.newMapper());
        assertThat(files.list()).isEmpty();
    }

    @Test
    void writeCreatesDirectoryAndLeavesNoTempFile() throws IOException {
        Path nested = dir.resolve("nested");
        WorkflowFiles files = new WorkflowFiles(nested, Jsons.newMapper());

        files.write("Orders.json", workflow("wf-1", "Orders", "v0"));

        Workflow read = files.read("Orders.json");
        assertThat(read.id()).isEqualTo("wf-1");
        assertThat(read.name()).isEqualTo("Orders");
        try (var stream = Files.list(nested)) {
            assertThat(stream.map(p -> p.getFileName().toString())).containsExactly("Orders.json");
        }
    }

    @Test
    void readRejectsMissingEmptyAndMalformedFiles() throws IOException {
        WorkflowFiles files = new WorkflowFiles(dir, Jsons.newMapper());
        Files.writeString(dir.resolve("empty.json"), "");
        Files.writeString(dir.resolve("broken.json"), "{\"name\": ");

        assertThatThrownBy(() -> files.read("missing.json")).isInstanceOf(WorkflowFileException.class);
        assertThatThrownBy(() -> files.read("empty.json")).isInstanceOf(WorkflowFileException.class);
        assertThatThrownBy(() -> files.read("broken.json"))
                .isInstanceOf(WorkflowFileException.class)
                .satisfies(e -> assertThat(((WorkflowFileException) e).getPath()).isEqualTo(dir.resolve("broken.json")));
    }
}
