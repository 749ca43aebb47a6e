package de.ovgu.bugfixminimizer.output;

import de.ovgu.bugfixminimizer.data.ChangeRecord;
import de.ovgu.bugfixminimizer.data.CommitId;
import de.ovgu.bugfixminimizer.data.CommitStatus;
import de.ovgu.bugfixminimizer.data.CommitSummary;
import org.apache.commons.csv.CSVPrinter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CsvOutputTest {
    private static final CommitId COMMIT = new CommitId("Cirq", "abc123", "Cirq#7");

    @TempDir
    Path tmp;

    private static <T, C extends Enum<C> & CsvColumnValueProvider<T, Void>> String write(
            File file, CsvRowProvider<T, Void, C> rows, List<T> data) throws IOException {
        new CsvFileWriterHelper() {
            @Override
            protected void actuallyDoStuff(CSVPrinter csv) throws IOException {
                csv.printRecord(rows.headerRow());
                for (T d : data) {
                    csv.printRecord(rows.dataRow(d));
                }
            }
        }.write(file);
        return new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);
    }

    @Test
    void changeRecordsAreOneRowPerFile() throws IOException {
        List<ChangeRecord> records = Arrays.asList(
                new ChangeRecord(COMMIT, "a/run.py", 1, 2, false),
                new ChangeRecord(COMMIT, "b/sim.py", 1, 2, true));

        String content = write(tmp.resolve("out").resolve(ChangeRecordColumns.FILE_BASENAME).toFile(),
                ChangeRecordColumns.newCsvRowProvider(), records);

        assertThat(content).isEqualTo(
                "REPOSITORY,HUMAN_ID,COMMIT_HASH,FILE,CHANGE_UNITS,N_LINES,REPEATED_ELSEWHERE\n"
                        + "Cirq,Cirq#7,abc123,a/run.py,1,2,0\n"
                        + "Cirq,Cirq#7,abc123,b/sim.py,1,2,1\n");
    }

    @Test
    void summariesJoinMessagesAndQuoteWhereNeeded() throws IOException {
        CommitSummary partial = new CommitSummary(COMMIT, "Fixes #7, #8",
                CommitStatus.fromWarnings(Arrays.asList("x.py: missing before side", "y.py: UNDECODABLE")),
                1, 3, 5, 0);
        CommitSummary failed = CommitSummary.failed(new CommitId("Cirq", "", "Cirq#9"), "", "zero files");

        String content = write(tmp.resolve(CommitSummaryColumns.FILE_BASENAME).toFile(),
                CommitSummaryColumns.newCsvRowProvider(), Arrays.asList(partial, failed));

        assertThat(content.split("\n")).containsExactly(
                "REPOSITORY,HUMAN_ID,COMMIT_HASH,ISSUE_REFERENCE,STATUS,N_FILES,N_HUNKS,N_LINES,N_REPEATED,MESSAGES",
                "Cirq,Cirq#7,abc123,\"Fixes #7, #8\",PARTIAL_WITH_WARNINGS,1,3,5,0,"
                        + "x.py: missing before side; y.py: UNDECODABLE",
                "Cirq,Cirq#9,,,FAILED,0,0,0,0,zero files");
    }
}
