package de.ovgu.bugfixminimizer.pipeline;

import de.ovgu.bugfixminimizer.data.ChangeRecord;
import de.ovgu.bugfixminimizer.data.CommitSummary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Everything processing one commit produced: its change records and its summary.  Failed commits have no records.
 */
public final class CommitResult {
    private final CommitSummary summary;
    private final List<ChangeRecord> records;

    public CommitResult(CommitSummary summary, List<ChangeRecord> records) {
        this.summary = Objects.requireNonNull(summary, "summary");
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
    }

    public static CommitResult failed(CommitSummary summary) {
        return new CommitResult(summary, Collections.emptyList());
    }

    public CommitSummary getSummary() {
        return summary;
    }

    public List<ChangeRecord> getRecords() {
        return records;
    }

    @Override
    public String toString() {
        return "CommitResult{" + summary + ", records=" + records + '}';
    }
}
