package de.ovgu.bugfixminimizer.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A bug-fix commit together with the files it touches, ordered by path.  Immutable once loaded.
 */
public final class Commit {
    private final CommitId id;
    private final List<FilePair> filePairs;
    private final int parentCount;
    private final boolean bugInTestCode;
    private final SourceState sourceState;
    private final String issueReference;

    public Commit(CommitId id, List<FilePair> filePairs, int parentCount, boolean bugInTestCode,
                  SourceState sourceState, String issueReference) {
        this.id = Objects.requireNonNull(id, "id");
        List<FilePair> sorted = new ArrayList<>(filePairs);
        sorted.sort(Comparator.comparing(FilePair::getPath));
        this.filePairs = Collections.unmodifiableList(sorted);
        this.parentCount = parentCount;
        this.bugInTestCode = bugInTestCode;
        this.sourceState = Objects.requireNonNull(sourceState, "sourceState");
        this.issueReference = issueReference == null ? "" : issueReference;
    }

    public CommitId getId() {
        return id;
    }

    public List<FilePair> getFilePairs() {
        return filePairs;
    }

    public int getParentCount() {
        return parentCount;
    }

    public boolean isMerge() {
        return parentCount > 1;
    }

    /**
     * @return <code>true</code> if the bug under study resides in the test suite itself, in which case test files
     * count like any other file
     */
    public boolean isBugInTestCode() {
        return bugInTestCode;
    }

    public SourceState getSourceState() {
        return sourceState;
    }

    /**
     * @return Free-text issue cross-reference from the dataset metadata, carried verbatim.  Empty if there is none.
     */
    public String getIssueReference() {
        return issueReference;
    }

    @Override
    public String toString() {
        return "Commit{" + id + ", " + filePairs.size() + " file(s), " + sourceState + '}';
    }
}
