package de.ovgu.bugfixminimizer.error;

import de.ovgu.bugfixminimizer.data.CommitId;

/**
 * Thrown if a commit that is not a merge yields no file pairs at all.  This always points to a defect in the dataset
 * or in mining.
 */
public class ZeroFileCommitException extends MinimizationException {
    private final CommitId commitId;

    public ZeroFileCommitException(CommitId commitId) {
        super("Non-merge commit " + commitId + " does not touch any files");
        this.commitId = commitId;
    }

    public CommitId getCommitId() {
        return commitId;
    }
}
