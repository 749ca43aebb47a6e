package de.ovgu.bugfixminimizer.data;

import java.util.Objects;

/**
 * Per-commit totals over the change records of one commit.
 */
public final class CommitSummary {
    private final CommitId commitId;
    private final String issueReference;
    private final CommitStatus status;
    /**
     * Number of files with at least one change unit
     */
    private final int nFiles;
    /**
     * Sum of change units
     */
    private final int nHunks;
    /**
     * Sum of modified lines
     */
    private final int nLines;
    /**
     * Number of files flagged as repeating an edit made elsewhere in the commit
     */
    private final int nRepeated;

    public CommitSummary(CommitId commitId, String issueReference, CommitStatus status, int nFiles, int nHunks,
                         int nLines, int nRepeated) {
        this.commitId = Objects.requireNonNull(commitId, "commitId");
        this.issueReference = issueReference == null ? "" : issueReference;
        this.status = Objects.requireNonNull(status, "status");
        this.nFiles = nFiles;
        this.nHunks = nHunks;
        this.nLines = nLines;
        this.nRepeated = nRepeated;
    }

    public static CommitSummary failed(CommitId commitId, String issueReference, String reason) {
        return new CommitSummary(commitId, issueReference, CommitStatus.failed(reason), 0, 0, 0, 0);
    }

    public CommitId getCommitId() {
        return commitId;
    }

    public String getIssueReference() {
        return issueReference;
    }

    public CommitStatus getStatus() {
        return status;
    }

    public int getNFiles() {
        return nFiles;
    }

    public int getNHunks() {
        return nHunks;
    }

    public int getNLines() {
        return nLines;
    }

    public int getNRepeated() {
        return nRepeated;
    }

    @Override
    public String toString() {
        return "CommitSummary{" + commitId +
                ", " + status +
                ", files=" + nFiles +
                ", hunks=" + nHunks +
                ", lines=" + nLines +
                ", repeated=" + nRepeated +
                '}';
    }
}
