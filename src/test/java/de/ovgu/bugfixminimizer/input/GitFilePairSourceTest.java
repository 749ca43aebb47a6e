package de.ovgu.bugfixminimizer.input;

import de.ovgu.bugfixminimizer.classify.ClassificationRules;
import de.ovgu.bugfixminimizer.data.Commit;
import de.ovgu.bugfixminimizer.data.CommitId;
import de.ovgu.bugfixminimizer.data.FilePair;
import de.ovgu.bugfixminimizer.data.ModificationType;
import de.ovgu.bugfixminimizer.data.SourceState;
import de.ovgu.bugfixminimizer.error.ZeroFileCommitException;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.MergeCommand;
import org.eclipse.jgit.api.MergeResult;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.revwalk.RevCommit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GitFilePairSourceTest {
    private static final PersonIdent AUTHOR = new PersonIdent("Tester", "tester@example.org");

    @TempDir
    Path tmp;

    private Git git;

    @BeforeEach
    void initRepository() throws Exception {
        git = Git.init().setDirectory(tmp.toFile()).call();
    }

    @AfterEach
    void closeRepository() {
        git.close();
    }

    private void writeFile(String path, String content) throws IOException {
        Path file = tmp.resolve(path);
        Files.createDirectories(file.getParent());
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
    }

    private RevCommit commitAll(String message) throws Exception {
        git.add().addFilepattern(".").call();
        git.add().addFilepattern(".").setUpdate(true).call();
        return git.commit().setMessage(message).setAuthor(AUTHOR).setCommitter(AUTHOR).call();
    }

    private GitFilePairSource source(List<String> revisions, List<CommitListEntry> commitList) throws IOException {
        return new GitFilePairSource(tmp.toFile(), "sample", revisions, commitList,
                new FilePairFactory(ClassificationRules.loadDefaults()));
    }

    @Test
    void rootCommitAddsEveryFile() throws Exception {
        writeFile("src/app.py", "print('hi')\n");
        writeFile("README.md", "# sample\n");
        RevCommit root = commitAll("initial");

        try (GitFilePairSource source = source(Collections.singletonList(root.getName()), Collections.emptyList())) {
            Commit commit = source.load(source.listCommits().get(0));

            assertThat(commit.getParentCount()).isZero();
            assertThat(commit.getSourceState()).isEqualTo(SourceState.MINED_DIFF_AVAILABLE);
            assertThat(commit.getFilePairs()).extracting(FilePair::getPath)
                    .containsExactlyInAnyOrder("src/app.py", "README.md");
            assertThat(commit.getFilePairs()).extracting(FilePair::getModificationType)
                    .containsOnly(ModificationType.ADD);
        }
    }

    @Test
    void singleParentCommitYieldsItsDiff() throws Exception {
        writeFile("src/app.py", "x = 1\n");
        writeFile("src/old.py", "y = 1\n");
        commitAll("initial");
        writeFile("src/app.py", "x = 2\n");
        Files.delete(tmp.resolve("src/old.py"));
        writeFile("src/new.py", "z = 1\n");
        RevCommit fix = commitAll("fix");

        try (GitFilePairSource source = source(Collections.singletonList(fix.getName().substring(0, 10)),
                Collections.emptyList())) {
            List<CommitId> ids = source.listCommits();
            assertThat(ids).containsExactly(new CommitId("sample", fix.getName(), ""));

            Commit commit = source.load(ids.get(0));
            assertThat(commit.getFilePairs()).hasSize(3);
            FilePair modified = pair(commit, "src/app.py");
            assertThat(modified.getModificationType()).isEqualTo(ModificationType.MODIFY);
            assertThat(modified.getBeforeText()).contains("x = 1\n");
            assertThat(modified.getAfterText()).contains("x = 2\n");
            assertThat(pair(commit, "src/old.py").getModificationType()).isEqualTo(ModificationType.DELETE);
            assertThat(pair(commit, "src/old.py").getAfterText()).isEmpty();
            assertThat(pair(commit, "src/new.py").getModificationType()).isEqualTo(ModificationType.ADD);
        }
    }

    @Test
    void commitListSuppliesHumanIdAndTestFlag() throws Exception {
        writeFile("a.py", "x = 1\n");
        commitAll("initial");
        writeFile("a.py", "x = 2\n");
        RevCommit fix = commitAll("fix");

        List<CommitListEntry> list = Arrays.asList(
                new CommitListEntry("sample", "sample#4", fix.getName(), true),
                new CommitListEntry("sample", "sample#5", "", null));
        try (GitFilePairSource source = source(Collections.emptyList(), list)) {
            List<CommitId> ids = source.listCommits();

            assertThat(ids).containsExactly(new CommitId("sample", fix.getName(), "sample#4"));
            assertThat(source.load(ids.get(0)).isBugInTestCode()).isTrue();
        }
    }

    @Test
    void emptyCommitIsADefect() throws Exception {
        writeFile("a.py", "x = 1\n");
        commitAll("initial");
        RevCommit empty = git.commit().setMessage("nothing").setAllowEmpty(true)
                .setAuthor(AUTHOR).setCommitter(AUTHOR).call();

        try (GitFilePairSource source = source(Collections.singletonList(empty.getName()), Collections.emptyList())) {
            CommitId id = source.listCommits().get(0);
            assertThatThrownBy(() -> source.load(id)).isInstanceOf(ZeroFileCommitException.class);
        }
    }

    @Test
    void mergeCommitIsDiffedAgainstFirstParent() throws Exception {
        writeFile("a.py", "x = 1\n");
        commitAll("initial");
        String mainBranch = git.getRepository().getBranch();

        git.checkout().setCreateBranch(true).setName("topic").call();
        writeFile("b.py", "y = 1\n");
        commitAll("topic work");

        git.checkout().setName(mainBranch).call();
        writeFile("a.py", "x = 2\n");
        commitAll("main work");

        MergeResult merge = git.merge()
                .include(git.getRepository().resolve("topic"))
                .setFastForward(MergeCommand.FastForwardMode.NO_FF)
                .setCommit(true)
                .setMessage("merge topic")
                .call();
        assertThat(merge.getMergeStatus().isSuccessful()).isTrue();

        try (GitFilePairSource source = source(Collections.singletonList(merge.getNewHead().getName()),
                Collections.emptyList())) {
            Commit commit = source.load(source.listCommits().get(0));

            assertThat(commit.getParentCount()).isEqualTo(2);
            assertThat(commit.getSourceState()).isEqualTo(SourceState.FALLBACK_REQUIRED);
            assertThat(commit.getFilePairs()).extracting(FilePair::getPath).containsExactly("b.py");
        }
    }

    private static FilePair pair(Commit commit, String path) {
        return commit.getFilePairs().stream()
                .filter(p -> p.getPath().equals(path))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No pair for " + path));
    }
}
