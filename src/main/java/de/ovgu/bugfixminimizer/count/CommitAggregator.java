package de.ovgu.bugfixminimizer.count;

import de.ovgu.bugfixminimizer.data.ChangeRecord;
import de.ovgu.bugfixminimizer.data.CommitId;
import de.ovgu.bugfixminimizer.data.CommitStatus;
import de.ovgu.bugfixminimizer.data.CommitSummary;

import java.util.List;

/**
 * Sums the change records of one commit into per-commit totals.
 */
public class CommitAggregator {
    public CommitSummary aggregate(CommitId commitId, String issueReference, List<ChangeRecord> records,
                                   CommitStatus status) {
        int nHunks = 0;
        int nLines = 0;
        int nRepeated = 0;
        for (ChangeRecord r : records) {
            if (!r.getCommitId().equals(commitId)) {
                throw new IllegalArgumentException("Record " + r + " does not belong to commit " + commitId);
            }
            nHunks += r.getChangeUnits();
            nLines += r.getModifiedLines();
            if (r.isRepeatedElsewhere()) {
                nRepeated++;
            }
        }
        return new CommitSummary(commitId, issueReference, status, records.size(), nHunks, nLines, nRepeated);
    }
}
