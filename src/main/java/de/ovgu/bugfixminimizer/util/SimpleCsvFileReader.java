package de.ovgu.bugfixminimizer.util;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * Template for reading a CSV file line by line into a result object.  Subclasses override the hooks they need.
 */
public abstract class SimpleCsvFileReader<TResult> {
    protected TResult readFile(File file) throws IOException {
        try (Reader fileReader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8);
             CSVReader reader = new CSVReader(fileReader)) {
            String[] nextLine;
            initializeResult();
            if (hasHeader()) {
                nextLine = reader.readNext();
                if (nextLine != null) {
                    processHeader(nextLine);
                }
            }
            while ((nextLine = reader.readNext()) != null) {
                if (isBlankLine(nextLine)) {
                    continue;
                }
                processContentLine(nextLine);
            }
            return finalizeResult();
        } catch (CsvValidationException e) {
            throw new IOException("Malformed CSV file " + file.getAbsolutePath(), e);
        }
    }

    private static boolean isBlankLine(String[] line) {
        return line.length == 0 || (line.length == 1 && line[0].trim().isEmpty());
    }

    protected void initializeResult() {
    }

    protected TResult finalizeResult() {
        return null;
    }

    protected boolean hasHeader() {
        return false;
    }

    protected void processHeader(String[] headerLine) {
    }

    protected abstract void processContentLine(String[] line);
}
