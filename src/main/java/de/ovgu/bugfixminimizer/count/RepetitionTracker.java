package de.ovgu.bugfixminimizer.count;

import de.ovgu.bugfixminimizer.data.ChangeHunk;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Remembers the fingerprints of the hunks seen so far within one commit.
 */
class RepetitionTracker {
    private final Set<String> seen = new HashSet<>();

    /**
     * Records the hunks of one file in order.
     *
     * @return <code>true</code> if any of the hunks repeats an edit seen at an earlier position, be it in an earlier
     * file or earlier in the same file
     */
    boolean observe(List<ChangeHunk> hunks) {
        boolean repeated = false;
        for (ChangeHunk h : hunks) {
            if (!seen.add(h.getFingerprint())) {
                repeated = true;
            }
        }
        return repeated;
    }
}
