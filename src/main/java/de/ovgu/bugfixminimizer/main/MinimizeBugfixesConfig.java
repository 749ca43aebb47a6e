package de.ovgu.bugfixminimizer.main;

import de.ovgu.bugfixminimizer.output.ChangeRecordColumns;
import de.ovgu.bugfixminimizer.output.CommitSummaryColumns;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Settings of one run of {@link MinimizeBugfixes}.  Exactly one of {@link #getDatasetDir()} and
 * {@link #getRepoDir()} is set.
 */
public class MinimizeBugfixesConfig {
    public static final char OPT_HELP = 'h';
    public static final char OPT_DATASET = 'd';
    public static final String OPT_DATASET_L = "dataset";
    public static final char OPT_REPO = 'r';
    public static final String OPT_REPO_L = "repo";
    public static final char OPT_NAME = 'n';
    public static final String OPT_NAME_L = "name";
    public static final char OPT_COMMITS = 'c';
    public static final String OPT_COMMITS_L = "commits";
    public static final char OPT_OUTPUT = 'o';
    public static final String OPT_OUTPUT_L = "output";
    public static final char OPT_THREADS = 't';
    public static final String OPT_THREADS_L = "threads";
    public static final String OPT_RULES_L = "rules";
    public static final char OPT_PROJECT = 'p';
    public static final String OPT_PROJECT_L = "project";
    public static final char OPT_FORCE = 'f';
    public static final String OPT_FORCE_L = "force";

    public static final int DEFAULT_NUM_THREADS = 1;

    private File datasetDir;
    private File repoDir;
    private String repositoryName;
    private List<String> revisions = new ArrayList<>();
    private File commitsFile;
    private File outputDir;
    private int numThreads = DEFAULT_NUM_THREADS;
    private File rulesFile;
    private String repositoryFilter;
    private boolean forceOverwriteOutput = false;

    /**
     * @return Root of a dataset laid out as <code>repository/commit/{before,after}</code>, if running on a dataset
     */
    public Optional<File> getDatasetDir() {
        return Optional.ofNullable(datasetDir);
    }

    public void setDatasetDir(File datasetDir) {
        this.datasetDir = datasetDir;
    }

    /**
     * @return Local GIT repository, if mining commits straight from GIT
     */
    public Optional<File> getRepoDir() {
        return Optional.ofNullable(repoDir);
    }

    public void setRepoDir(File repoDir) {
        this.repoDir = repoDir;
    }

    /**
     * @return The name under which commits mined from GIT are reported.  Defaults to the name of the repository
     * directory.
     */
    public String getRepositoryName() {
        if (repositoryName != null) {
            return repositoryName;
        }
        if (repoDir == null) {
            return null;
        }
        File dir = repoDir.getAbsoluteFile();
        if (dir.getName().equals(".git") && dir.getParentFile() != null) {
            dir = dir.getParentFile();
        }
        return dir.getName();
    }

    public void setRepositoryName(String repositoryName) {
        this.repositoryName = repositoryName;
    }

    /**
     * @return Commits to mine from GIT, in addition to those of the commit list
     */
    public List<String> getRevisions() {
        return Collections.unmodifiableList(revisions);
    }

    public void setRevisions(List<String> revisions) {
        this.revisions = new ArrayList<>(revisions);
    }

    public Optional<File> getCommitsFile() {
        return Optional.ofNullable(commitsFile);
    }

    public void setCommitsFile(File commitsFile) {
        this.commitsFile = commitsFile;
    }

    public File getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(File outputDir) {
        this.outputDir = outputDir;
    }

    public int getNumThreads() {
        return numThreads;
    }

    public void setNumThreads(int numThreads) {
        this.numThreads = numThreads;
    }

    /**
     * @return Properties file overriding the built-in test-file and derived-artifact rules
     */
    public Optional<File> getRulesFile() {
        return Optional.ofNullable(rulesFile);
    }

    public void setRulesFile(File rulesFile) {
        this.rulesFile = rulesFile;
    }

    /**
     * @return Name of the only repository of the dataset to process
     */
    public Optional<String> getRepositoryFilter() {
        return Optional.ofNullable(repositoryFilter);
    }

    public void setRepositoryFilter(String repositoryFilter) {
        this.repositoryFilter = repositoryFilter;
    }

    public boolean isForceOverwriteOutput() {
        return forceOverwriteOutput;
    }

    public void setForceOverwriteOutput(boolean forceOverwriteOutput) {
        this.forceOverwriteOutput = forceOverwriteOutput;
    }

    public File changeRecordsCsv() {
        return new File(outputDir, ChangeRecordColumns.FILE_BASENAME);
    }

    public File commitSummariesCsv() {
        return new File(outputDir, CommitSummaryColumns.FILE_BASENAME);
    }
}
