package de.ovgu.bugfixminimizer.main;

import de.ovgu.bugfixminimizer.classify.ClassificationRules;
import de.ovgu.bugfixminimizer.data.ChangeRecord;
import de.ovgu.bugfixminimizer.data.CommitId;
import de.ovgu.bugfixminimizer.data.CommitSummary;
import de.ovgu.bugfixminimizer.input.CommitListCsvReader;
import de.ovgu.bugfixminimizer.input.CommitListEntry;
import de.ovgu.bugfixminimizer.input.DirectoryFilePairSource;
import de.ovgu.bugfixminimizer.input.FilePairFactory;
import de.ovgu.bugfixminimizer.input.FilePairSource;
import de.ovgu.bugfixminimizer.input.GitFilePairSource;
import de.ovgu.bugfixminimizer.output.ChangeRecordColumns;
import de.ovgu.bugfixminimizer.output.CommitSummaryColumns;
import de.ovgu.bugfixminimizer.output.CsvFileWriterHelper;
import de.ovgu.bugfixminimizer.output.CsvRowProvider;
import de.ovgu.bugfixminimizer.pipeline.BatchProcessor;
import de.ovgu.bugfixminimizer.pipeline.CommitProcessor;
import de.ovgu.bugfixminimizer.pipeline.CommitResult;
import de.ovgu.bugfixminimizer.util.UncaughtWorkerThreadException;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.csv.CSVPrinter;
import org.apache.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Reduces bug-fix commits to their minimal bugfix and counts what remains.  Writes one CSV file with the change
 * records of all files and one with the totals of all commits.  The exit code is the number of commits that could not
 * be processed, capped at 255.
 */
public class MinimizeBugfixes {
    private static final Logger LOG = Logger.getLogger(MinimizeBugfixes.class);

    static final int MAX_EXIT_CODE = 255;
    static final int EXIT_FATAL = 1;

    public static void main(String[] args) {
        MinimizeBugfixes me = new MinimizeBugfixes();
        MinimizeBugfixesConfig conf = me.parseCommandLine(args);
        int failedCommits;
        try {
            failedCommits = me.execute(conf);
        } catch (IOException | UncaughtWorkerThreadException | RuntimeException e) {
            LOG.error("Aborting: " + e.getMessage(), e);
            System.exit(EXIT_FATAL);
            // We will never get here.
            return;
        }
        System.exit(Math.min(failedCommits, MAX_EXIT_CODE));
    }

    /**
     * Processes all selected commits and writes the output files.
     *
     * @return Number of commits whose processing failed
     * @throws IOException if the input cannot be listed or the output cannot be written
     */
    public int execute(MinimizeBugfixesConfig conf) throws IOException, UncaughtWorkerThreadException {
        ensureOutputWritable(conf);

        ClassificationRules rules = conf.getRulesFile().isPresent()
                ? ClassificationRules.load(conf.getRulesFile().get())
                : ClassificationRules.loadDefaults();
        FilePairFactory filePairFactory = new FilePairFactory(rules);
        List<CommitListEntry> commitList = null;
        if (conf.getCommitsFile().isPresent()) {
            commitList = new CommitListCsvReader().read(conf.getCommitsFile().get());
            LOG.info("Read " + commitList.size() + " commit(s) from " + conf.getCommitsFile().get());
        }

        final List<CommitResult> results;
        try (FilePairSource source = openSource(conf, filePairFactory, commitList)) {
            List<CommitId> commitIds = source.listCommits();
            BatchProcessor batch = new BatchProcessor(new CommitProcessor(source));
            results = batch.processAll(commitIds, conf.getNumThreads());
        }

        writeChangeRecords(conf.changeRecordsCsv(), results);
        writeCommitSummaries(conf.commitSummariesCsv(), results);

        int failed = 0;
        for (CommitResult r : results) {
            if (r.getSummary().getStatus().isFailed()) {
                failed++;
            }
        }
        if (failed > 0) {
            LOG.warn(failed + " of " + results.size() + " commit(s) failed.  See previous messages for details.");
        } else {
            LOG.info("Processed " + results.size() + " commit(s).");
        }
        return failed;
    }

    private static FilePairSource openSource(MinimizeBugfixesConfig conf, FilePairFactory filePairFactory,
                                             List<CommitListEntry> commitList) throws IOException {
        if (conf.getDatasetDir().isPresent()) {
            return new DirectoryFilePairSource(conf.getDatasetDir().get(), filePairFactory, commitList,
                    conf.getRepositoryFilter().orElse(null));
        }
        File repoDir = conf.getRepoDir().orElseThrow(() ->
                new IllegalStateException("Neither dataset nor repository configured"));
        List<CommitListEntry> entries = commitList == null ? Collections.emptyList() : commitList;
        return new GitFilePairSource(repoDir, conf.getRepositoryName(), conf.getRevisions(), entries,
                filePairFactory);
    }

    private static void ensureOutputWritable(MinimizeBugfixesConfig conf) throws IOException {
        File outputDir = conf.getOutputDir();
        if (outputDir.exists() && !outputDir.isDirectory()) {
            throw new IOException("Output location exists, but is not a directory: " + outputDir);
        }
        if (conf.isForceOverwriteOutput()) {
            return;
        }
        for (File f : Arrays.asList(conf.changeRecordsCsv(), conf.commitSummariesCsv())) {
            if (f.exists()) {
                throw new IOException("Output file already exists: " + f.getAbsolutePath()
                        + ". Use --" + MinimizeBugfixesConfig.OPT_FORCE_L + " to overwrite.");
            }
        }
    }

    private static void writeChangeRecords(File outputFile, final List<CommitResult> results) throws IOException {
        new CsvFileWriterHelper() {
            final CsvRowProvider<ChangeRecord, Void, ChangeRecordColumns> rows =
                    ChangeRecordColumns.newCsvRowProvider();

            @Override
            protected void actuallyDoStuff(CSVPrinter csv) throws IOException {
                csv.printRecord(rows.headerRow());
                for (CommitResult r : results) {
                    for (ChangeRecord record : r.getRecords()) {
                        csv.printRecord(rows.dataRow(record));
                    }
                }
            }
        }.write(outputFile);
    }

    private static void writeCommitSummaries(File outputFile, final List<CommitResult> results) throws IOException {
        new CsvFileWriterHelper() {
            final CsvRowProvider<CommitSummary, Void, CommitSummaryColumns> rows =
                    CommitSummaryColumns.newCsvRowProvider();

            @Override
            protected void actuallyDoStuff(CSVPrinter csv) throws IOException {
                csv.printRecord(rows.headerRow());
                for (CommitResult r : results) {
                    csv.printRecord(rows.dataRow(r.getSummary()));
                }
            }
        }.write(outputFile);
    }

    MinimizeBugfixesConfig parseCommandLine(String[] args) {
        CommandLineParser parser = new DefaultParser();
        Options fakeOptionsForHelp = makeOptions(true);
        Options actualOptions = makeOptions(false);

        try {
            CommandLine dummyLine = parser.parse(fakeOptionsForHelp, args);
            if (dummyLine.hasOption(MinimizeBugfixesConfig.OPT_HELP)) {
                HelpFormatter formatter = new HelpFormatter();
                System.err.flush();
                formatter.printHelp(progName() + " [OPTIONS] [COMMIT...]",
                        "Reduce bug-fix commits to the minimal bugfix and count the remaining changes. Commits are"
                                + " read either from a dataset directory or from a GIT repository. In the latter"
                                + " case, the commits to process are given as positional arguments and/or via"
                                + " --" + MinimizeBugfixesConfig.OPT_COMMITS_L + ".\n\nOptions:\n",
                        actualOptions, null, false);
                System.out.flush();
                System.exit(0);
                // We will never get here.
                return null;
            }
            CommandLine line = parser.parse(actualOptions, args);
            return configFromCommandLine(line);
        } catch (ParseException e) {
            System.err.println("Error in command line: " + e.getMessage());
            HelpFormatter formatter = new HelpFormatter();
            formatter.printUsage(new PrintWriter(System.err, true), 80, progName(), actualOptions);
            System.exit(EXIT_FATAL);
            // We will never get here.
            return null;
        }
    }

    static MinimizeBugfixesConfig configFromCommandLine(CommandLine line) throws ParseException {
        MinimizeBugfixesConfig conf = new MinimizeBugfixesConfig();
        final boolean hasDataset = line.hasOption(MinimizeBugfixesConfig.OPT_DATASET);
        final boolean hasRepo = line.hasOption(MinimizeBugfixesConfig.OPT_REPO);
        if (hasDataset == hasRepo) {
            throw new ParseException("Exactly one of `--" + MinimizeBugfixesConfig.OPT_DATASET_L + "' and `--"
                    + MinimizeBugfixesConfig.OPT_REPO_L + "' must be given.");
        }

        if (hasDataset) {
            File datasetDir = new File(line.getOptionValue(MinimizeBugfixesConfig.OPT_DATASET));
            if (!datasetDir.isDirectory()) {
                throw new ParseException("Dataset directory does not exist: " + datasetDir);
            }
            conf.setDatasetDir(datasetDir);
            if (!line.getArgList().isEmpty()) {
                throw new ParseException("Positional commit arguments are only allowed together with `--"
                        + MinimizeBugfixesConfig.OPT_REPO_L + "'.");
            }
        } else {
            File repoDir = new File(line.getOptionValue(MinimizeBugfixesConfig.OPT_REPO));
            if (!repoDir.isDirectory()) {
                throw new ParseException("Repository directory does not exist: " + repoDir);
            }
            conf.setRepoDir(repoDir);
            conf.setRevisions(line.getArgList());
            if (line.getArgList().isEmpty() && !line.hasOption(MinimizeBugfixesConfig.OPT_COMMITS)) {
                throw new ParseException("No commits given. Name them as arguments or via `--"
                        + MinimizeBugfixesConfig.OPT_COMMITS_L + "'.");
            }
        }

        if (line.hasOption(MinimizeBugfixesConfig.OPT_NAME)) {
            conf.setRepositoryName(line.getOptionValue(MinimizeBugfixesConfig.OPT_NAME));
        }
        if (line.hasOption(MinimizeBugfixesConfig.OPT_PROJECT)) {
            conf.setRepositoryFilter(line.getOptionValue(MinimizeBugfixesConfig.OPT_PROJECT));
        }
        if (line.hasOption(MinimizeBugfixesConfig.OPT_COMMITS)) {
            conf.setCommitsFile(existingFile(line.getOptionValue(MinimizeBugfixesConfig.OPT_COMMITS)));
        }
        if (line.hasOption(MinimizeBugfixesConfig.OPT_RULES_L)) {
            conf.setRulesFile(existingFile(line.getOptionValue(MinimizeBugfixesConfig.OPT_RULES_L)));
        }
        conf.setOutputDir(new File(line.getOptionValue(MinimizeBugfixesConfig.OPT_OUTPUT)));
        conf.setForceOverwriteOutput(line.hasOption(MinimizeBugfixesConfig.OPT_FORCE));

        if (line.hasOption(MinimizeBugfixesConfig.OPT_THREADS)) {
            String threadsString = line.getOptionValue(MinimizeBugfixesConfig.OPT_THREADS);
            final int numThreads;
            try {
                numThreads = Integer.parseInt(threadsString);
            } catch (NumberFormatException e) {
                throw new ParseException("Invalid value for option `--" + MinimizeBugfixesConfig.OPT_THREADS_L
                        + "': Not a valid integer: " + threadsString);
            }
            if (numThreads < 1) {
                throw new ParseException("Invalid value for option `--" + MinimizeBugfixesConfig.OPT_THREADS_L
                        + "': Number of threads must be an integer >= 1.");
            }
            conf.setNumThreads(numThreads);
        }
        return conf;
    }

    private static File existingFile(String name) throws ParseException {
        File f = new File(name);
        if (!f.isFile()) {
            throw new ParseException("File does not exist: " + name);
        }
        return f;
    }

    static Options makeOptions(boolean forHelp) {
        boolean required = !forHelp;
        Options options = new Options();
        //@formatter:off
        // --help= option
        options.addOption(Option.builder(String.valueOf(MinimizeBugfixesConfig.OPT_HELP))
                .longOpt("help")
                .desc("print this help screen and exit")
                .build());
        // --dataset= option
        options.addOption(Option.builder(String.valueOf(MinimizeBugfixesConfig.OPT_DATASET))
                .longOpt(MinimizeBugfixesConfig.OPT_DATASET_L)
                .desc("dataset directory with one sub-directory per repository and, within those, one per commit,"
                        + " each holding `before' and `after' trees")
                .hasArg()
                .argName("DIR")
                .build());
        // --repo= option
        options.addOption(Option.builder(String.valueOf(MinimizeBugfixesConfig.OPT_REPO))
                .longOpt(MinimizeBugfixesConfig.OPT_REPO_L)
                .desc("local GIT repository to mine the commits from")
                .hasArg()
                .argName("DIR")
                .build());
        // --name= option
        options.addOption(Option.builder(String.valueOf(MinimizeBugfixesConfig.OPT_NAME))
                .longOpt(MinimizeBugfixesConfig.OPT_NAME_L)
                .desc("repository name to report for commits mined from GIT [default: name of the repository"
                        + " directory]")
                .hasArg()
                .argName("NAME")
                .build());
        // --project= option
        options.addOption(Option.builder(String.valueOf(MinimizeBugfixesConfig.OPT_PROJECT))
                .longOpt(MinimizeBugfixesConfig.OPT_PROJECT_L)
                .desc("only process the commits of this repository of the dataset")
                .hasArg()
                .argName("NAME")
                .build());
        // --commits= option
        options.addOption(Option.builder(String.valueOf(MinimizeBugfixesConfig.OPT_COMMITS))
                .longOpt(MinimizeBugfixesConfig.OPT_COMMITS_L)
                .desc("CSV file listing the commits to process, with columns `"
                        + CommitListCsvReader.COL_REPOSITORY + "', `" + CommitListCsvReader.COL_HUMAN_ID + "', `"
                        + CommitListCsvReader.COL_COMMIT_HASH + "' and `" + CommitListCsvReader.COL_BUG_IN_TEST_CODE
                        + "'")
                .hasArg()
                .argName("FILE")
                .build());
        // --rules= option
        options.addOption(Option.builder()
                .longOpt(MinimizeBugfixesConfig.OPT_RULES_L)
                .desc("properties file overriding the rules that identify test files and derived artifacts")
                .hasArg()
                .argName("FILE")
                .build());
        // --output= option
        options.addOption(Option.builder(String.valueOf(MinimizeBugfixesConfig.OPT_OUTPUT))
                .longOpt(MinimizeBugfixesConfig.OPT_OUTPUT_L)
                .desc("directory to write `" + ChangeRecordColumns.FILE_BASENAME + "' and `"
                        + CommitSummaryColumns.FILE_BASENAME + "' to")
                .hasArg()
                .argName("DIR")
                .required(required)
                .build());
        // --threads= option
        options.addOption(Option.builder(String.valueOf(MinimizeBugfixesConfig.OPT_THREADS))
                .longOpt(MinimizeBugfixesConfig.OPT_THREADS_L)
                .desc("number of commits processed in parallel. Must be at least 1. [default="
                        + MinimizeBugfixesConfig.DEFAULT_NUM_THREADS + "]")
                .hasArg()
                .argName("NUM")
                .build());
        // --force option
        options.addOption(Option.builder(String.valueOf(MinimizeBugfixesConfig.OPT_FORCE))
                .longOpt(MinimizeBugfixesConfig.OPT_FORCE_L)
                .desc("overwrite output files that already exist")
                .build());
        //@formatter:on
        return options;
    }

    private String progName() {
        return this.getClass().getSimpleName();
    }
}
