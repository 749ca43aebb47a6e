package de.ovgu.bugfixminimizer.input;

import de.ovgu.bugfixminimizer.util.SimpleCsvFileReader;
import org.apache.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a commit list.  The file has a header row; columns are found by name, in any order:
 * <ul>
 * <li><code>repository</code> (required)</li>
 * <li><code>human_id</code>: e.g. <code>Cirq#3497</code></li>
 * <li><code>commit_hash</code></li>
 * <li><code>bug_in_test_code</code>: <code>true</code>/<code>false</code>, <code>1</code>/<code>0</code> or
 * <code>yes</code>/<code>no</code>; empty if unknown</li>
 * </ul>
 */
public class CommitListCsvReader extends SimpleCsvFileReader<List<CommitListEntry>> {
    private static final Logger LOG = Logger.getLogger(CommitListCsvReader.class);

    public static final String COL_REPOSITORY = "repository";
    public static final String COL_HUMAN_ID = "human_id";
    public static final String COL_COMMIT_HASH = "commit_hash";
    public static final String COL_BUG_IN_TEST_CODE = "bug_in_test_code";

    private List<CommitListEntry> result;
    private Map<String, Integer> columns;
    private int lineNo;

    public List<CommitListEntry> read(File file) throws IOException {
        List<CommitListEntry> entries = readFile(file);
        LOG.debug("Read " + entries.size() + " entries from commit list " + file);
        return entries;
    }

    @Override
    protected void initializeResult() {
        result = new ArrayList<>();
        columns = new HashMap<>();
        lineNo = 1;
    }

    @Override
    protected boolean hasHeader() {
        return true;
    }

    @Override
    protected void processHeader(String[] headerLine) {
        for (int i = 0; i < headerLine.length; i++) {
            columns.put(headerLine[i].trim().toLowerCase(Locale.ROOT), i);
        }
        if (!columns.containsKey(COL_REPOSITORY)) {
            throw new IllegalArgumentException("Commit list lacks the column `" + COL_REPOSITORY + "'");
        }
    }

    @Override
    protected void processContentLine(String[] line) {
        lineNo++;
        String repository = column(line, COL_REPOSITORY);
        if (repository.isEmpty()) {
            throw new IllegalArgumentException("Missing repository in line " + lineNo + " of commit list");
        }
        result.add(new CommitListEntry(repository, column(line, COL_HUMAN_ID), column(line, COL_COMMIT_HASH),
                parseFlag(column(line, COL_BUG_IN_TEST_CODE))));
    }

    private String column(String[] line, String name) {
        Integer ix = columns.get(name);
        if (ix == null || ix >= line.length) {
            return "";
        }
        return line[ix].trim();
    }

    private Boolean parseFlag(String value) {
        switch (value.toLowerCase(Locale.ROOT)) {
            case "":
                return null;
            case "1":
            case "true":
            case "yes":
            case "y":
                return Boolean.TRUE;
            case "0":
            case "false":
            case "no":
            case "n":
                return Boolean.FALSE;
            default:
                throw new IllegalArgumentException("Invalid value `" + value + "' of column `"
                        + COL_BUG_IN_TEST_CODE + "' in line " + lineNo + " of commit list");
        }
    }

    @Override
    protected List<CommitListEntry> finalizeResult() {
        return result;
    }
}
