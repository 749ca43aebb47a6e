package de.ovgu.bugfixminimizer.data;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of comparing a normalized pair: either the difference is semantically inert (the before version is
 * propagated and nothing is counted) or the pair is distinct and carries its change hunks.
 */
public final class EquivalenceVerdict {
    private final String path;
    private final boolean equivalent;
    private final List<String> matchedPatterns;
    private final List<ChangeHunk> hunks;

    private EquivalenceVerdict(String path, boolean equivalent, List<String> matchedPatterns,
                               List<ChangeHunk> hunks) {
        this.path = Objects.requireNonNull(path, "path");
        this.equivalent = equivalent;
        this.matchedPatterns = Collections.unmodifiableList(matchedPatterns);
        this.hunks = Collections.unmodifiableList(hunks);
    }

    /**
     * @param matchedPatterns Names of the equivalence patterns needed to reconcile the two sides.  Empty if the
     *                        sides agree line by line after normalization.
     */
    public static EquivalenceVerdict equivalent(String path, List<String> matchedPatterns) {
        return new EquivalenceVerdict(path, true, matchedPatterns, Collections.emptyList());
    }

    public static EquivalenceVerdict distinct(String path, List<ChangeHunk> hunks) {
        if (hunks.isEmpty()) {
            throw new IllegalArgumentException("A distinct verdict needs at least one change hunk: " + path);
        }
        return new EquivalenceVerdict(path, false, Collections.emptyList(), hunks);
    }

    public String getPath() {
        return path;
    }

    public boolean isEquivalent() {
        return equivalent;
    }

    public List<String> getMatchedPatterns() {
        return matchedPatterns;
    }

    public List<ChangeHunk> getHunks() {
        return hunks;
    }

    /**
     * @return Number of change units: 0 for equivalent pairs, the number of hunks otherwise
     */
    public int getChangeUnits() {
        return hunks.size();
    }

    public int getModifiedLines() {
        int sum = 0;
        for (ChangeHunk h : hunks) {
            sum += h.getModifiedLines();
        }
        return sum;
    }

    @Override
    public String toString() {
        if (equivalent) {
            return "Equivalent{" + path + ", patterns=" + matchedPatterns + '}';
        }
        return "Distinct{" + path + ", changeUnits=" + getChangeUnits() + '}';
    }
}
