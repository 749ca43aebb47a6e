package de.ovgu.bugfixminimizer.input;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommitMetadataReaderTest {

    @TempDir
    Path tmp;

    private void writeMetadata(String json) throws IOException {
        Files.write(tmp.resolve(CommitMetadataReader.FILE_NAME), json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void missingFileYieldsEmptyMetadata() throws IOException {
        CommitMetadata metadata = new CommitMetadataReader().read(tmp.toFile());

        assertThat(metadata).isSameAs(CommitMetadata.EMPTY);
        assertThat(metadata.getParents()).isEqualTo(1);
        assertThat(metadata.getModifiedFiles()).isEmpty();
    }

    @Test
    void readsKnownFieldsAndIgnoresOthers() throws IOException {
        writeMetadata("{\"id\": 17, \"human_id\": \"Cirq#3497\", \"project_name\": \"Cirq\","
                + " \"commit_hash\": \"abc\", \"parents\": 2, \"bug_in_test_code\": true,"
                + " \"modified_files\": [\"cirq>ops>gate.py\", \"setup.py\"],"
                + " \"issue_reference\": \"#3497\", \"stars\": {\"count\": 3}}");

        CommitMetadata metadata = new CommitMetadataReader().read(tmp.toFile());

        assertThat(metadata.getId()).contains("17");
        assertThat(metadata.getHumanId()).contains("Cirq#3497");
        assertThat(metadata.getProjectName()).contains("Cirq");
        assertThat(metadata.getCommitHash()).contains("abc");
        assertThat(metadata.getParents()).isEqualTo(2);
        assertThat(metadata.getBugInTestCode()).contains(true);
        assertThat(metadata.getModifiedFiles()).containsExactly("cirq/ops/gate.py", "setup.py");
        assertThat(metadata.getIssueReference()).contains("#3497");
    }

    @Test
    void nullFieldsAreAbsent() throws IOException {
        writeMetadata("{\"commit_hash\": null, \"parents\": null}");

        CommitMetadata metadata = new CommitMetadataReader().read(tmp.toFile());

        assertThat(metadata.getCommitHash()).isEmpty();
        assertThat(metadata.getParents()).isEqualTo(1);
    }

    @Test
    void rejectsNonObject() throws IOException {
        writeMetadata("[1, 2]");

        assertThatThrownBy(() -> new CommitMetadataReader().read(tmp.toFile()))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("JSON object");
    }
}
