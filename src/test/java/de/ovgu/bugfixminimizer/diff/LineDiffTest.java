package de.ovgu.bugfixminimizer.diff;

import de.ovgu.bugfixminimizer.data.ChangeHunk;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LineDiffTest {

    @Test
    void identicalTextsHaveNoHunks() {
        List<String> lines = Arrays.asList("a", "b");
        assertThat(LineDiff.hunks(lines, lines)).isEmpty();
    }

    @Test
    void separatedChangesBecomeSeparateHunks() {
        List<String> before = Arrays.asList("a", "b", "c", "d", "e");
        List<String> after = Arrays.asList("A", "b", "c", "d", "E");

        List<ChangeHunk> hunks = LineDiff.hunks(before, after);

        assertThat(hunks).hasSize(2);
        assertThat(hunks.get(0).getHunkNo()).isEqualTo(0);
        assertThat(hunks.get(0).getBeginBefore()).isEqualTo(0);
        assertThat(hunks.get(1).getHunkNo()).isEqualTo(1);
        assertThat(hunks.get(1).getBeginAfter()).isEqualTo(4);
    }

    @Test
    void adjacentChangedLinesFormOneHunk() {
        List<String> before = Arrays.asList("a", "b", "c", "d");
        List<String> after = Arrays.asList("a", "B", "C", "x", "d");

        List<ChangeHunk> hunks = LineDiff.hunks(before, after);

        assertThat(hunks).hasSize(1);
        ChangeHunk h = hunks.get(0);
        assertThat(h.getLinesDeleted()).isEqualTo(2);
        assertThat(h.getLinesAdded()).isEqualTo(3);
        assertThat(h.getModifiedLines()).isEqualTo(3);
    }

    @Test
    void fingerprintIgnoresIndentation() {
        List<ChangeHunk> left = LineDiff.hunks(Arrays.asList("    if x:", "        pass"),
                Arrays.asList("    if x is None:", "        pass"));
        List<ChangeHunk> right = LineDiff.hunks(Arrays.asList("if x:", "    pass"),
                Arrays.asList("if x is None:", "    pass"));

        assertThat(left.get(0).getFingerprint()).isEqualTo(right.get(0).getFingerprint());
    }
}
