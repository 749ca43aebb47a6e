package de.ovgu.bugfixminimizer.data;

import java.util.Objects;

/**
 * The counted changes of one file of one commit.  Terminal artifact of the pipeline.
 */
public final class ChangeRecord {
    private final CommitId commitId;
    private final String path;
    private final int changeUnits;
    private final int modifiedLines;
    private final boolean repeatedElsewhere;

    public ChangeRecord(CommitId commitId, String path, int changeUnits, int modifiedLines,
                        boolean repeatedElsewhere) {
        if (changeUnits < 1) {
            throw new IllegalArgumentException("Change records need at least one change unit: " + path);
        }
        this.commitId = Objects.requireNonNull(commitId, "commitId");
        this.path = Objects.requireNonNull(path, "path");
        this.changeUnits = changeUnits;
        this.modifiedLines = modifiedLines;
        this.repeatedElsewhere = repeatedElsewhere;
    }

    public CommitId getCommitId() {
        return commitId;
    }

    public String getPath() {
        return path;
    }

    public int getChangeUnits() {
        return changeUnits;
    }

    /**
     * @return Sum over all hunks of the larger of lines deleted and lines added
     */
    public int getModifiedLines() {
        return modifiedLines;
    }

    /**
     * @return <code>true</code> if an edit of this file repeats an edit seen at an earlier position of the same
     * commit.  Such records are still counted.
     */
    public boolean isRepeatedElsewhere() {
        return repeatedElsewhere;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChangeRecord)) return false;
        ChangeRecord that = (ChangeRecord) o;
        return changeUnits == that.changeUnits && modifiedLines == that.modifiedLines
                && repeatedElsewhere == that.repeatedElsewhere && commitId.equals(that.commitId)
                && path.equals(that.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(commitId, path, changeUnits, modifiedLines, repeatedElsewhere);
    }

    @Override
    public String toString() {
        return "ChangeRecord{" + commitId +
                ", " + path +
                ", changeUnits=" + changeUnits +
                ", modifiedLines=" + modifiedLines +
                (repeatedElsewhere ? ", repeated" : "") +
                '}';
    }
}
