package de.ovgu.bugfixminimizer.classify;

import de.ovgu.bugfixminimizer.data.ClassificationOutcome;
import de.ovgu.bugfixminimizer.data.ExclusionReason;
import de.ovgu.bugfixminimizer.data.FilePair;
import org.apache.log4j.Logger;

/**
 * Decides whether a file pair takes part in counting.  Rules are checked in a fixed order and the first one that
 * applies decides:
 * <ol>
 * <li>both sides empty or absent: {@link ExclusionReason#EMPTY}</li>
 * <li>before equals after: {@link ExclusionReason#IDENTICAL}</li>
 * <li>test file while the bug is not in test code: {@link ExclusionReason#TEST_NOT_BUG}</li>
 * <li>derived artifact: {@link ExclusionReason#DERIVED_MOCK}</li>
 * </ol>
 * Pairs that failed to decode are excluded as {@link ExclusionReason#UNDECODABLE} before any of these rules.
 */
public class FileClassifier {
    private static final Logger LOG = Logger.getLogger(FileClassifier.class);

    public ClassificationOutcome classify(FilePair pair, boolean bugIsInTestCode) {
        ClassificationOutcome outcome = decide(pair, bugIsInTestCode);
        if (LOG.isDebugEnabled()) {
            LOG.debug(pair.getPath() + ": " + outcome);
        }
        return outcome;
    }

    private static ClassificationOutcome decide(FilePair pair, boolean bugIsInTestCode) {
        if (pair.getEncodingProblem().isPresent()) {
            return ClassificationOutcome.excluded(ExclusionReason.UNDECODABLE);
        }
        final String before = pair.beforeTextOrEmpty();
        final String after = pair.afterTextOrEmpty();
        if (before.isEmpty() && after.isEmpty()) {
            return ClassificationOutcome.excluded(ExclusionReason.EMPTY);
        }
        if (before.equals(after)) {
            return ClassificationOutcome.excluded(ExclusionReason.IDENTICAL);
        }
        if (pair.isTestFile() && !bugIsInTestCode) {
            return ClassificationOutcome.excluded(ExclusionReason.TEST_NOT_BUG);
        }
        if (pair.isDerivedArtifact()) {
            return ClassificationOutcome.excluded(ExclusionReason.DERIVED_MOCK);
        }
        return ClassificationOutcome.INCLUDED;
    }
}
