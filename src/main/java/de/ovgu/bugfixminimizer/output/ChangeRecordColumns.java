package de.ovgu.bugfixminimizer.output;

import de.ovgu.bugfixminimizer.data.ChangeRecord;

/**
 * <p>Columns of the CSV file that lists, for every bug-fix commit, the files containing at least one change unit.</p>
 * <p>The context is unused.</p>
 */
public enum ChangeRecordColumns implements CsvColumnValueProvider<ChangeRecord, Void> {
    REPOSITORY {
        @Override
        public String csvColumnValue(ChangeRecord r, Void ctx) {
            return r.getCommitId().getRepository();
        }
    },
    /**
     * Human-readable ID of the commit, e.g. <code>Cirq#3497</code>.  Empty if unknown.
     */
    HUMAN_ID {
        @Override
        public String csvColumnValue(ChangeRecord r, Void ctx) {
            return r.getCommitId().getHumanId();
        }
    },
    COMMIT_HASH {
        @Override
        public String csvColumnValue(ChangeRecord r, Void ctx) {
            return r.getCommitId().getHash();
        }
    },
    /**
     * Path of the file, relative to the repository root, with <code>/</code> as separator
     */
    FILE {
        @Override
        public String csvColumnValue(ChangeRecord r, Void ctx) {
            return r.getPath();
        }
    },
    /**
     * Number of change units (hunks) left after minimization
     */
    CHANGE_UNITS {
        @Override
        public Integer csvColumnValue(ChangeRecord r, Void ctx) {
            return r.getChangeUnits();
        }
    },
    /**
     * Sum over all hunks of the larger of lines deleted and lines added
     */
    N_LINES {
        @Override
        public Integer csvColumnValue(ChangeRecord r, Void ctx) {
            return r.getModifiedLines();
        }
    },
    /**
     * <code>1</code> if the file repeats an edit made in a file listed before it, else <code>0</code>
     */
    REPEATED_ELSEWHERE {
        @Override
        public Integer csvColumnValue(ChangeRecord r, Void ctx) {
            return r.isRepeatedElsewhere() ? 1 : 0;
        }
    };

    public static CsvRowProvider<ChangeRecord, Void, ChangeRecordColumns> newCsvRowProvider() {
        return new CsvRowProvider<>(ChangeRecordColumns.class, null);
    }

    /**
     * Basename of the CSV file that will hold this information, within the output directory
     */
    public static final String FILE_BASENAME = "change_records.csv";
}
