package de.ovgu.bugfixminimizer.input;

import de.ovgu.bugfixminimizer.classify.ClassificationRules;
import de.ovgu.bugfixminimizer.data.Commit;
import de.ovgu.bugfixminimizer.data.CommitId;
import de.ovgu.bugfixminimizer.data.FilePair;
import de.ovgu.bugfixminimizer.data.ModificationType;
import de.ovgu.bugfixminimizer.data.SourceState;
import de.ovgu.bugfixminimizer.error.MissingSideException;
import de.ovgu.bugfixminimizer.error.ZeroFileCommitException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DirectoryFilePairSourceTest {

    @TempDir
    Path tmp;

    private DirectoryFilePairSource source(List<CommitListEntry> commitList, String repositoryFilter) {
        return new DirectoryFilePairSource(tmp.toFile(), new FilePairFactory(ClassificationRules.loadDefaults()),
                commitList, repositoryFilter);
    }

    @Test
    void listsCommitsInOrderWithMetadata() throws IOException {
        DatasetBuilder ds = new DatasetBuilder(tmp);
        ds.commit("qiskit", "qiskit#2").before("a.py", "x\n").after("a.py", "y\n");
        ds.commit("Cirq", "Cirq#9").before("a.py", "x\n").after("a.py", "y\n")
                .metadata("{\"commit_hash\": \"deadbeef\", \"unknown_field\": [1, 2]}");
        ds.commit("Cirq", "Cirq#10").before("a.py", "x\n").after("a.py", "y\n");
        ds.commit("Cirq", "notes").write("README", "not a commit");

        try (DirectoryFilePairSource source = source(null, null)) {
            List<CommitId> ids = source.listCommits();

            assertThat(ids).containsExactly(
                    new CommitId("Cirq", "", "Cirq#10"),
                    new CommitId("Cirq", "deadbeef", "Cirq#9"),
                    new CommitId("qiskit", "", "qiskit#2"));
        }
    }

    @Test
    void decodesFlattenedPathsAndPairsSides() throws Exception {
        DatasetBuilder ds = new DatasetBuilder(tmp);
        ds.commit("qsharp-runtime", "qsharp-runtime#1")
                .before("src>Simulation>Z.cs", "class Z {}\n")
                .after("src>Simulation>Z.cs", "class Z { }\n")
                .after("src/Simulation/New.cs", "class New {}\n")
                .before("Old.cs", "class Old {}\n");

        try (DirectoryFilePairSource source = source(null, null)) {
            CommitId id = source.listCommits().get(0);
            Commit commit = source.load(id);

            assertThat(commit.getFilePairs()).extracting(FilePair::getPath)
                    .containsExactly("Old.cs", "src/Simulation/New.cs", "src/Simulation/Z.cs");
            assertThat(commit.getFilePairs()).extracting(FilePair::getModificationType)
                    .containsExactly(ModificationType.DELETE, ModificationType.ADD, ModificationType.MODIFY);
            assertThat(commit.getSourceState()).isEqualTo(SourceState.MINED_DIFF_AVAILABLE);
            assertThat(commit.isBugInTestCode()).isFalse();
        }
    }

    @Test
    void mergeCommitFallsBackToRenderedContent() throws Exception {
        DatasetBuilder ds = new DatasetBuilder(tmp);
        ds.commit("Cirq", "Cirq#5")
                .metadata("{\"parents\": 2, \"issue_reference\": \"Fixes #5, see also #4\"}")
                .emptyDirectory("before")
                .emptyDirectory("after")
                .write("rendered/before/cirq>sim.py", "x = 1\n")
                .write("rendered/after/cirq>sim.py", "x = 2\n");

        try (DirectoryFilePairSource source = source(null, null)) {
            CommitId id = source.listCommits().get(0);
            Commit commit = source.load(id);

            assertThat(commit.getSourceState()).isEqualTo(SourceState.FALLBACK_REQUIRED);
            assertThat(commit.isMerge()).isTrue();
            assertThat(commit.getIssueReference()).isEqualTo("Fixes #5, see also #4");
            assertThat(commit.getFilePairs()).hasSize(1);
            FilePair pair = commit.getFilePairs().get(0);
            assertThat(pair.getPath()).isEqualTo("cirq/sim.py");
            assertThat(pair.getBeforeText()).contains("x = 1\n");
            assertThat(pair.getAfterText()).contains("x = 2\n");
        }
    }

    @Test
    void mergeCommitWithoutAnyFilesIsNoDefect() throws Exception {
        DatasetBuilder ds = new DatasetBuilder(tmp);
        ds.commit("Cirq", "Cirq#6").metadata("{\"parents\": 2}").emptyDirectory("before");

        try (DirectoryFilePairSource source = source(null, null)) {
            Commit commit = source.load(source.listCommits().get(0));
            assertThat(commit.getFilePairs()).isEmpty();
        }
    }

    @Test
    void nonMergeCommitWithoutFilesIsADefect() throws IOException {
        DatasetBuilder ds = new DatasetBuilder(tmp);
        ds.commit("Cirq", "Cirq#7").emptyDirectory("before").emptyDirectory("after");

        try (DirectoryFilePairSource source = source(null, null)) {
            CommitId id = source.listCommits().get(0);
            assertThatThrownBy(() -> source.load(id)).isInstanceOf(ZeroFileCommitException.class);
        }
    }

    @Test
    void declaredModificationWithMissingSideIsDetected() throws Exception {
        DatasetBuilder ds = new DatasetBuilder(tmp);
        ds.commit("Cirq", "Cirq#8")
                .metadata("{\"modified_files\": [\"cirq>ops.py\"]}")
                .after("cirq>ops.py", "x = 2\n");

        try (DirectoryFilePairSource source = source(null, null)) {
            Commit commit = source.load(source.listCommits().get(0));
            FilePair pair = commit.getFilePairs().get(0);

            assertThat(pair.getModificationType()).isEqualTo(ModificationType.MODIFY);
            assertThatThrownBy(pair::requireSides).isInstanceOf(MissingSideException.class);
        }
    }

    @Test
    void undecodableContentIsFlagged() throws Exception {
        DatasetBuilder ds = new DatasetBuilder(tmp);
        ds.commit("Cirq", "Cirq#11")
                .write("before/data.py", new byte[]{(byte) 0xff, (byte) 0xfe, 0x00})
                .after("data.py", "x\n");

        try (DirectoryFilePairSource source = source(null, null)) {
            FilePair pair = source.load(source.listCommits().get(0)).getFilePairs().get(0);
            assertThat(pair.getEncodingProblem()).isPresent();
            assertThat(pair.getBeforeText()).isEmpty();
        }
    }

    @Test
    void commitListRestrictsAndOverridesFlags() throws Exception {
        DatasetBuilder ds = new DatasetBuilder(tmp);
        ds.commit("Cirq", "Cirq#1").before("a.py", "x\n").after("a.py", "y\n")
                .metadata("{\"bug_in_test_code\": false}");
        ds.commit("Cirq", "Cirq#2").before("a.py", "x\n").after("a.py", "y\n");

        List<CommitListEntry> list = Arrays.asList(
                new CommitListEntry("Cirq", "Cirq#1", "", true),
                new CommitListEntry("Cirq", "Cirq#404", "", null));
        try (DirectoryFilePairSource source = source(list, null)) {
            List<CommitId> ids = source.listCommits();

            assertThat(ids).extracting(CommitId::getHumanId).containsExactly("Cirq#1");
            assertThat(source.load(ids.get(0)).isBugInTestCode()).isTrue();
        }
    }

    @Test
    void repositoryFilterSelectsOneRepository() throws IOException {
        DatasetBuilder ds = new DatasetBuilder(tmp);
        ds.commit("Cirq", "Cirq#1").before("a.py", "x\n");
        ds.commit("qiskit", "qiskit#1").before("a.py", "x\n");

        try (DirectoryFilePairSource source = source(null, "qiskit")) {
            assertThat(source.listCommits()).extracting(CommitId::getRepository).containsExactly("qiskit");
        }
    }

    @Test
    void testFlagIsTakenFromMetadata() throws Exception {
        DatasetBuilder ds = new DatasetBuilder(tmp);
        ds.commit("Cirq", "Cirq#3").before("a.py", "x\n").after("a.py", "y\n")
                .metadata("{\"bug_in_test_code\": true}");

        try (DirectoryFilePairSource source = source(null, null)) {
            assertThat(source.load(source.listCommits().get(0)).isBugInTestCode()).isTrue();
        }
    }
}
