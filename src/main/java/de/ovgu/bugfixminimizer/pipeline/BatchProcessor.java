package de.ovgu.bugfixminimizer.pipeline;

import de.ovgu.bugfixminimizer.data.CommitId;
import de.ovgu.bugfixminimizer.util.ThreadProcessor;
import de.ovgu.bugfixminimizer.util.UncaughtWorkerThreadException;
import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Processes a batch of commits on several worker threads.  Results come back in {@link CommitId} order, whatever the
 * number of threads and whatever order the workers finish in.  Progress is logged each time another percent of the
 * batch is done.
 */
public class BatchProcessor extends ThreadProcessor<CommitId> {
    private static final Logger LOG = Logger.getLogger(BatchProcessor.class);

    private final CommitProcessor commitProcessor;
    private final Map<CommitId, CommitResult> results = new TreeMap<>();
    private final Object progressLock = new Object();
    private int commitsTotal;
    private int commitsDone;
    private int lastReportedPercent;

    public BatchProcessor(CommitProcessor commitProcessor) {
        this.commitProcessor = commitProcessor;
    }

    public synchronized List<CommitResult> processAll(List<CommitId> commitIds, int numThreads)
            throws UncaughtWorkerThreadException {
        synchronized (results) {
            results.clear();
        }
        synchronized (progressLock) {
            commitsTotal = commitIds.size();
            commitsDone = 0;
            lastReportedPercent = 0;
        }
        LOG.info("Processing " + commitIds.size() + " commits on " + numThreads + " thread(s).");
        processItems(commitIds.iterator(), numThreads);
        synchronized (results) {
            return new ArrayList<>(results.values());
        }
    }

    @Override
    protected void processItem(CommitId commitId) {
        CommitResult result = commitProcessor.process(commitId);
        synchronized (results) {
            if (results.put(commitId, result) != null) {
                LOG.warn("Commit processed more than once: " + commitId);
            }
        }
        commitDone();
    }

    private void commitDone() {
        synchronized (progressLock) {
            commitsDone++;
            if (commitsDone == commitsTotal) {
                LOG.info("Done processing " + commitsTotal + " commits.");
                return;
            }
            int percent = percentDone();
            if (percent > lastReportedPercent) {
                lastReportedPercent = percent;
                LOG.info("Processed " + commitsDone + "/" + commitsTotal + " commits (" + percent + "%)");
            }
        }
    }

    private int percentDone() {
        return (int) (100L * commitsDone / Math.max(commitsTotal, 1));
    }

    /**
     * @return Number of commits of the current or last batch that have been processed so far
     */
    public int getCommitsDone() {
        synchronized (progressLock) {
            return commitsDone;
        }
    }
}
