package de.ovgu.bugfixminimizer.output;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * Opens a CSV file for writing, lets a subclass fill it and closes it again.  Records are separated by a single
 * newline on every platform so that output files can be compared byte by byte.
 */
public abstract class CsvFileWriterHelper {
    private static final Logger LOG = Logger.getLogger(CsvFileWriterHelper.class);

    public static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder().setRecordSeparator('\n').build();

    public void write(File outputFile) throws IOException {
        File parent = outputFile.getAbsoluteFile().getParentFile();
        if (parent != null && !parent.isDirectory()) {
            Files.createDirectories(parent.toPath());
        }
        LOG.debug("Writing " + outputFile.getAbsolutePath());
        try (Writer out = Files.newBufferedWriter(outputFile.toPath(), StandardCharsets.UTF_8);
             CSVPrinter csv = new CSVPrinter(out, FORMAT)) {
            actuallyDoStuff(csv);
            csv.flush();
        }
        LOG.info("Wrote " + outputFile.getAbsolutePath());
    }

    protected abstract void actuallyDoStuff(CSVPrinter csv) throws IOException;
}
