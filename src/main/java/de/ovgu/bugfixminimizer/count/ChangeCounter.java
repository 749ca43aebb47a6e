package de.ovgu.bugfixminimizer.count;

import de.ovgu.bugfixminimizer.data.ChangeRecord;
import de.ovgu.bugfixminimizer.data.Commit;
import de.ovgu.bugfixminimizer.data.CommitId;
import de.ovgu.bugfixminimizer.data.EquivalenceVerdict;
import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns the verdicts of one commit into change records: one record per distinct file, ordered by path.  Edits that
 * recur at several positions are flagged on every occurrence but the first.  They are never deduplicated.
 */
public class ChangeCounter {
    private static final Logger LOG = Logger.getLogger(ChangeCounter.class);

    public List<ChangeRecord> count(Commit commit, List<EquivalenceVerdict> verdicts) {
        return count(commit.getId(), verdicts);
    }

    public List<ChangeRecord> count(CommitId commitId, List<EquivalenceVerdict> verdicts) {
        List<EquivalenceVerdict> ordered = new ArrayList<>(verdicts);
        ordered.sort(Comparator.comparing(EquivalenceVerdict::getPath));
        RepetitionTracker tracker = new RepetitionTracker();
        List<ChangeRecord> records = new ArrayList<>();
        for (EquivalenceVerdict v : ordered) {
            if (v.isEquivalent()) {
                continue;
            }
            boolean repeated = tracker.observe(v.getHunks());
            if (repeated && LOG.isDebugEnabled()) {
                LOG.debug(commitId + ": " + v.getPath() + " repeats an edit made elsewhere");
            }
            records.add(new ChangeRecord(commitId, v.getPath(), v.getChangeUnits(), v.getModifiedLines(), repeated));
        }
        return records;
    }
}
