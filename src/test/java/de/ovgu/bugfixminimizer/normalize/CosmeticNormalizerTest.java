package de.ovgu.bugfixminimizer.normalize;

import de.ovgu.bugfixminimizer.data.FilePair;
import de.ovgu.bugfixminimizer.data.ModificationType;
import de.ovgu.bugfixminimizer.data.NormalizedPair;
import org.apache.commons.lang3.StringUtils;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CosmeticNormalizerTest {

    private final CosmeticNormalizer normalizer = new CosmeticNormalizer();

    private static FilePair source(String path, String before, String after) {
        return new FilePair(path, before, after, ModificationType.MODIFY, false, false);
    }

    private static FilePair testFile(String path, String before, String after) {
        return new FilePair(path, before, after, ModificationType.MODIFY, true, false);
    }

    @Test
    void stripsNewCommentLines() {
        NormalizedPair np = normalizer.normalize(source("f.py",
                "def f(x):\n  return x+1\n",
                "def f(x):\n  # fixed off-by-one\n  return x+2\n"));

        assertThat(np.getAfterNormalized()).isEqualTo("def f(x):\n  return x+2\n");
        assertThat(np.isLanguageRulesKnown()).isTrue();
    }

    @Test
    void neverTouchesTheBeforeVersion() {
        String before = "def f(x):\n  # old note\n\n  return x+1\n";
        NormalizedPair np = normalizer.normalize(source("f.py", before, "def f(x):\n  return x+2\n"));
        assertThat(np.getBeforeNormalized()).isEqualTo(before);
    }

    @Test
    void keepsCommentsThatAlreadyExisted() {
        NormalizedPair np = normalizer.normalize(source("f.py",
                "x = 1  # the answer\n",
                "x = 2  # the answer\n"));
        assertThat(np.getAfterNormalized()).isEqualTo("x = 2  # the answer\n");
    }

    @Test
    void stripsNewTrailingAndBlockComments() {
        NormalizedPair np = normalizer.normalize(source("F.cs",
                "int F(int x) {\n    return x + 1;\n}\n",
                "int F(int x) {\n    // off by one\n    return x + 2; /* was 1 */\n}\n"));
        assertThat(np.getAfterNormalized()).isEqualTo("int F(int x) {\n    return x + 2;\n}\n");
    }

    @Test
    void commentMarkersInStringsSurvive() {
        NormalizedPair np = normalizer.normalize(source("u.py",
                "URL = 'http://a'\n",
                "URL = 'http://b#frag'\n"));
        assertThat(np.getAfterNormalized()).isEqualTo("URL = 'http://b#frag'\n");
    }

    @Test
    void dropsBlankLinesAddedInsideChanges() {
        NormalizedPair np = normalizer.normalize(source("f.py",
                "a = 1\nb = 2\n",
                "a = 1\n\nb = 3\n"));
        assertThat(np.getAfterNormalized()).isEqualTo("a = 1\nb = 3\n");
    }

    @Test
    void keepsBlankLinesOfUnchangedRegions() {
        NormalizedPair np = normalizer.normalize(source("f.py",
                "a = 1\n\nb = 2\n",
                "a = 1\n\nb = 3\n"));
        assertThat(np.getAfterNormalized()).isEqualTo("a = 1\n\nb = 3\n");
    }

    @Test
    void revertsDebugPrintsThatWereOnlyCommentedOut() {
        String before = "x = compute()\nprint(x)\nreturn x\n";
        NormalizedPair np = normalizer.normalize(source("f.py", before, "x = compute()\n# print(x)\nreturn x\n"));
        assertThat(np.getAfterNormalized()).isEqualTo(before);
    }

    @Test
    void dropsDocstringsOfFunctionsIntroducedBySplit() {
        String before = "def f(x):\n"
                + "    \"\"\"Compute f.\"\"\"\n"
                + "    return g(x) + 1\n";
        String after = "def f(x):\n"
                + "    \"\"\"Compute f.\"\"\"\n"
                + "    return helper(x) + 1\n"
                + "\n"
                + "\n"
                + "def helper(x):\n"
                + "    \"\"\"Compute f.\"\"\"\n"
                + "    return g(x)\n";

        NormalizedPair np = normalizer.normalize(source("f.py", before, after));

        assertThat(StringUtils.countMatches(np.getAfterNormalized(), "Compute f.")).isEqualTo(1);
        assertThat(np.getAfterNormalized()).contains("def helper(x):\n    return g(x)\n");
    }

    @Test
    void dropsNewRegressionTestsFromTestFiles() {
        String before = "def test_old():\n    assert f(0) == 1\n";
        String after = before + "\n\ndef test_new():\n    assert f(1) == 3\n";

        NormalizedPair np = normalizer.normalize(testFile("tests/test_f.py", before, after));

        assertThat(np.getAfterNormalized()).isEqualTo(before);
    }

    @Test
    void keepsNewFunctionsNamedLikeTestsInSourceFiles() {
        String before = "def old():\n    return 1\n";
        String after = before + "def test_mode():\n    return 2\n";

        NormalizedPair np = normalizer.normalize(source("src/modes.py", before, after));

        assertThat(np.getAfterNormalized()).contains("def test_mode():");
    }

    @Test
    void unknownLanguagesOnlyLoseAddedBlankLines() {
        NormalizedPair np = normalizer.normalize(source("notes.txt", "a\n", "a\n# new\n\n"));

        assertThat(np.getAfterNormalized()).isEqualTo("a\n# new\n");
        assertThat(np.isLanguageRulesKnown()).isFalse();
    }

    @Test
    void keepsUnchangedLastLineBelowStrippedComment() {
        NormalizedPair np = normalizer.normalize(source("m.c",
                "int a;\nint b;\n",
                "// n\nint a;\nint b;\n"));
        assertThat(np.getAfterNormalized()).isEqualTo("int a;\nint b;\n");
    }

    @Test
    void keepsLastLineWhenCommentIsAddedAboveIt() {
        NormalizedPair np = normalizer.normalize(source("f.py",
                "def f(x):\n  y = x+1\n  return y",
                "def f(x):\n  y = x+2\n  # fixed\n  return y"));
        assertThat(np.getAfterNormalized()).isEqualTo("def f(x):\n  y = x+2\n  return y\n");
    }

    @Test
    void normalizingTwiceChangesNothing() {
        FilePair pair = source("f.py",
                "def f(x):\n  return x+1\n",
                "def f(x):\n\n  # fixed off-by-one\n  return x+2  # really\n\n");
        NormalizedPair once = normalizer.normalize(pair);
        NormalizedPair twice = normalizer.normalize(pair.withTexts(pair.beforeTextOrEmpty(),
                once.getAfterNormalized()));

        assertThat(twice.getAfterNormalized()).isEqualTo(once.getAfterNormalized());
    }
}
