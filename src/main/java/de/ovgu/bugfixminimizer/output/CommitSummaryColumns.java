package de.ovgu.bugfixminimizer.output;

import de.ovgu.bugfixminimizer.data.CommitSummary;
import org.apache.commons.lang3.StringUtils;

/**
 * Columns of the CSV file with one line of totals per processed commit, failed ones included.
 */
public enum CommitSummaryColumns implements CsvColumnValueProvider<CommitSummary, Void> {
    REPOSITORY {
        @Override
        public String csvColumnValue(CommitSummary s, Void ctx) {
            return s.getCommitId().getRepository();
        }
    },
    HUMAN_ID {
        @Override
        public String csvColumnValue(CommitSummary s, Void ctx) {
            return s.getCommitId().getHumanId();
        }
    },
    COMMIT_HASH {
        @Override
        public String csvColumnValue(CommitSummary s, Void ctx) {
            return s.getCommitId().getHash();
        }
    },
    /**
     * Cross-reference to the issue tracker as recorded in the commit's metadata, copied verbatim
     */
    ISSUE_REFERENCE {
        @Override
        public String csvColumnValue(CommitSummary s, Void ctx) {
            return s.getIssueReference();
        }
    },
    /**
     * One of <code>OK</code>, <code>PARTIAL_WITH_WARNINGS</code>, <code>FAILED</code>
     */
    STATUS {
        @Override
        public String csvColumnValue(CommitSummary s, Void ctx) {
            return s.getStatus().getKind().name();
        }
    },
    N_FILES {
        @Override
        public Integer csvColumnValue(CommitSummary s, Void ctx) {
            return s.getNFiles();
        }
    },
    N_HUNKS {
        @Override
        public Integer csvColumnValue(CommitSummary s, Void ctx) {
            return s.getNHunks();
        }
    },
    N_LINES {
        @Override
        public Integer csvColumnValue(CommitSummary s, Void ctx) {
            return s.getNLines();
        }
    },
    N_REPEATED {
        @Override
        public Integer csvColumnValue(CommitSummary s, Void ctx) {
            return s.getNRepeated();
        }
    },
    /**
     * Warnings of a partial commit or the reason of a failed one, separated by <code>; </code>
     */
    MESSAGES {
        @Override
        public String csvColumnValue(CommitSummary s, Void ctx) {
            return StringUtils.join(s.getStatus().getMessages(), "; ");
        }
    };

    public static CsvRowProvider<CommitSummary, Void, CommitSummaryColumns> newCsvRowProvider() {
        return new CsvRowProvider<>(CommitSummaryColumns.class, null);
    }

    public static final String FILE_BASENAME = "commit_summaries.csv";
}
