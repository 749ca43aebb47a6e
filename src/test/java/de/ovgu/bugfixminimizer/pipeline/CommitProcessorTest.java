package de.ovgu.bugfixminimizer.pipeline;

import de.ovgu.bugfixminimizer.classify.ClassificationRules;
import de.ovgu.bugfixminimizer.data.ChangeRecord;
import de.ovgu.bugfixminimizer.data.Commit;
import de.ovgu.bugfixminimizer.data.CommitId;
import de.ovgu.bugfixminimizer.data.CommitStatus;
import de.ovgu.bugfixminimizer.data.CommitSummary;
import de.ovgu.bugfixminimizer.data.FilePair;
import de.ovgu.bugfixminimizer.data.ModificationType;
import de.ovgu.bugfixminimizer.data.SourceState;
import de.ovgu.bugfixminimizer.error.ZeroFileCommitException;
import de.ovgu.bugfixminimizer.input.FilePairFactory;
import de.ovgu.bugfixminimizer.input.FilePairSource;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CommitProcessorTest {
    private static final CommitId COMMIT = new CommitId("Cirq", "abc123", "Cirq#42");

    private final FilePairFactory factory = new FilePairFactory(ClassificationRules.loadDefaults());
    private final StubSource source = new StubSource();
    private final CommitProcessor processor = new CommitProcessor(source);

    /**
     * Serves prepared commits and fails for everything else.
     */
    private static class StubSource implements FilePairSource {
        final Map<CommitId, Commit> commits = new HashMap<>();

        @Override
        public List<CommitId> listCommits() {
            List<CommitId> ids = new ArrayList<>(commits.keySet());
            Collections.sort(ids);
            return ids;
        }

        @Override
        public Commit load(CommitId commitId) throws ZeroFileCommitException, IOException {
            Commit commit = commits.get(commitId);
            if (commit == null) {
                throw new IOException("no such commit");
            }
            if (commit.getFilePairs().isEmpty() && !commit.isMerge()) {
                throw new ZeroFileCommitException(commitId);
            }
            return commit;
        }

        @Override
        public void close() {
        }
    }

    private FilePair pair(String path, String before, String after) {
        ModificationType type = before == null ? ModificationType.ADD
                : after == null ? ModificationType.DELETE : ModificationType.MODIFY;
        return factory.create(COMMIT.getRepository(), path, bytes(before), bytes(after), type);
    }

    private static byte[] bytes(String s) {
        return s == null ? null : s.getBytes(StandardCharsets.UTF_8);
    }

    private void addCommit(FilePair... pairs) {
        source.commits.put(COMMIT, new Commit(COMMIT, Arrays.asList(pairs), 1, false,
                SourceState.MINED_DIFF_AVAILABLE, "#42"));
    }

    @Test
    void commentAndRegressionTestAreNotCounted() {
        addCommit(
                pair("cirq/f.py", "def f(x):\n  return x+1\n", "def f(x):\n  # fixed off-by-one\n  return x+2\n"),
                pair("cirq/f_test.py", null, "from cirq.f import f\n\ndef test_f():\n  assert f(1) == 3\n"));

        CommitResult result = processor.process(COMMIT);

        assertThat(result.getRecords()).hasSize(1);
        ChangeRecord record = result.getRecords().get(0);
        assertThat(record.getPath()).isEqualTo("cirq/f.py");
        assertThat(record.getChangeUnits()).isEqualTo(1);
        assertThat(record.isRepeatedElsewhere()).isFalse();

        CommitSummary summary = result.getSummary();
        assertThat(summary.getStatus()).isEqualTo(CommitStatus.ok());
        assertThat(summary.getIssueReference()).isEqualTo("#42");
        assertThat(summary.getNFiles()).isEqualTo(1);
        assertThat(summary.getNHunks()).isEqualTo(1);
    }

    @Test
    void derivedMockIsNotCountedWhateverItsDiff() {
        StringBuilder before = new StringBuilder("{\n");
        StringBuilder after = new StringBuilder("{\n");
        for (int i = 0; i < 200; i++) {
            before.append("  \"gate_").append(i).append("\": ").append(i).append(",\n");
            after.append("  \"gate_").append(i).append("\": ").append(i * 2).append(",\n");
        }
        addCommit(pair("qiskit/providers/fake/props_mock.json", before.append("}\n").toString(),
                after.append("}\n").toString()));

        CommitResult result = processor.process(COMMIT);

        assertThat(result.getRecords()).isEmpty();
        assertThat(result.getSummary().getStatus().getKind()).isEqualTo(CommitStatus.Kind.OK);
        assertThat(result.getSummary().getNHunks()).isZero();
    }

    @Test
    void testFilesCountWhenTheBugIsInTestCode() {
        source.commits.put(COMMIT, new Commit(COMMIT,
                Collections.singletonList(pair("tests/conftest.py", "X = 1\n", "X = 2\n")), 1, true,
                SourceState.MINED_DIFF_AVAILABLE, ""));

        CommitResult result = processor.process(COMMIT);

        assertThat(result.getRecords()).extracting(ChangeRecord::getPath).containsExactly("tests/conftest.py");
    }

    @Test
    void undecodableFileMakesTheCommitPartial() {
        FilePair broken = factory.create(COMMIT.getRepository(), "cirq/blob.py", bytes("x = 1\n"),
                new byte[]{(byte) 0xff}, ModificationType.MODIFY);
        addCommit(broken, pair("cirq/g.py", "y = 1\n", "y = 2\n"));

        CommitResult result = processor.process(COMMIT);

        assertThat(result.getRecords()).extracting(ChangeRecord::getPath).containsExactly("cirq/g.py");
        CommitStatus status = result.getSummary().getStatus();
        assertThat(status.getKind()).isEqualTo(CommitStatus.Kind.PARTIAL_WITH_WARNINGS);
        assertThat(status.getMessages()).anyMatch(m -> m.contains("cirq/blob.py"));
    }

    @Test
    void missingSideSkipsTheFile() {
        FilePair oneSided = new FilePair("cirq/h.py", null, "z = 1\n", ModificationType.MODIFY, false, false);
        addCommit(oneSided, pair("cirq/g.py", "y = 1\n", "y = 2\n"));

        CommitResult result = processor.process(COMMIT);

        assertThat(result.getRecords()).extracting(ChangeRecord::getPath).containsExactly("cirq/g.py");
        assertThat(result.getSummary().getStatus().getKind()).isEqualTo(CommitStatus.Kind.PARTIAL_WITH_WARNINGS);
    }

    @Test
    void unknownLanguageIsCountedConservatively() {
        addCommit(pair("build/config.xyz", "a\n", "b\n"));

        CommitResult result = processor.process(COMMIT);

        assertThat(result.getRecords()).hasSize(1);
        assertThat(result.getSummary().getStatus().getMessages())
                .containsExactly("build/config.xyz: unknown language, counted conservatively");
    }

    @Test
    void zeroFileCommitFails() {
        addCommit();

        CommitResult result = processor.process(COMMIT);

        assertThat(result.getRecords()).isEmpty();
        assertThat(result.getSummary().getStatus().isFailed()).isTrue();
    }

    @Test
    void unreadableCommitFails() {
        CommitResult result = processor.process(new CommitId("Cirq", "", "Cirq#404"));

        assertThat(result.getSummary().getStatus().isFailed()).isTrue();
        assertThat(result.getSummary().getStatus().getMessages().get(0)).contains("no such commit");
    }

    @Test
    void emptyMergeIsPartialNotFailed() {
        source.commits.put(COMMIT, new Commit(COMMIT, Collections.emptyList(), 2, false,
                SourceState.FALLBACK_REQUIRED, ""));

        CommitResult result = processor.process(COMMIT);

        assertThat(result.getSummary().getStatus().getKind()).isEqualTo(CommitStatus.Kind.PARTIAL_WITH_WARNINGS);
        assertThat(result.getSummary().getNFiles()).isZero();
    }
}
