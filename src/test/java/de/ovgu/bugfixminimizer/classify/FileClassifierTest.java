package de.ovgu.bugfixminimizer.classify;

import de.ovgu.bugfixminimizer.data.ClassificationOutcome;
import de.ovgu.bugfixminimizer.data.ExclusionReason;
import de.ovgu.bugfixminimizer.data.FilePair;
import de.ovgu.bugfixminimizer.data.ModificationType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FileClassifierTest {

    private final FileClassifier classifier = new FileClassifier();

    private static FilePair pair(String path, String before, String after, boolean test, boolean derived) {
        return new FilePair(path, before, after, ModificationType.MODIFY, test, derived);
    }

    @Test
    void includesAnOrdinaryModification() {
        ClassificationOutcome outcome = classifier.classify(pair("a.py", "x = 1\n", "x = 2\n", false, false), false);
        assertThat(outcome.isIncluded()).isTrue();
        assertThat(outcome.getReason()).isEmpty();
    }

    @Test
    void excludesPairsWithoutContent() {
        FilePair absent = new FilePair("a.py", null, null, ModificationType.MODIFY, false, false);
        FilePair empty = pair("a.py", "", "", false, false);
        assertThat(classifier.classify(absent, false).getReason()).contains(ExclusionReason.EMPTY);
        assertThat(classifier.classify(empty, false).getReason()).contains(ExclusionReason.EMPTY);
    }

    @Test
    void excludesIdenticalVersions() {
        assertThat(classifier.classify(pair("a.py", "x\n", "x\n", false, false), false).getReason())
                .contains(ExclusionReason.IDENTICAL);
    }

    @Test
    void testFilesDependOnWhereTheBugIs() {
        FilePair test = pair("tests/test_a.py", "", "def test_a():\n    assert f(1) == 3\n", true, false);
        assertThat(classifier.classify(test, false).getReason()).contains(ExclusionReason.TEST_NOT_BUG);
        assertThat(classifier.classify(test, true).isIncluded()).isTrue();
    }

    @Test
    void excludesDerivedMocksWhateverTheirDiff() {
        StringBuilder huge = new StringBuilder();
        for (int i = 0; i < 1000; i++) {
            huge.append("{\"qubit\": ").append(i).append("}\n");
        }
        FilePair mock = pair("mocks/fake_backend.json", "{}\n", huge.toString(), false, true);
        assertThat(classifier.classify(mock, false).getReason()).contains(ExclusionReason.DERIVED_MOCK);
    }

    @Test
    void firstApplicableRuleWins() {
        // identical test file in a commit whose bug is not in the tests
        FilePair p = pair("tests/test_a.py", "x\n", "x\n", true, true);
        assertThat(classifier.classify(p, false).getReason()).contains(ExclusionReason.IDENTICAL);
    }

    @Test
    void undecodablePairsAreReportedAsErrors() {
        FilePair p = FilePair.undecodable("img.py", ModificationType.MODIFY, false, false, "bad UTF-8");
        ClassificationOutcome outcome = classifier.classify(p, false);
        assertThat(outcome.getReason()).contains(ExclusionReason.UNDECODABLE);
        assertThat(outcome.getReason().get().isError()).isTrue();
    }
}
