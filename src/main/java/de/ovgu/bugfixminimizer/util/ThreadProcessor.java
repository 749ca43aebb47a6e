package de.ovgu.bugfixminimizer.util;

import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Distributes work items over a fixed number of worker threads.  Workers pull items from a shared iterator until it
 * is exhausted.  If one worker dies, the others are asked to stop after their current item and the first failure is
 * rethrown to the caller.
 */
public abstract class ThreadProcessor<TWorkItem> {
    private static final Logger LOG = Logger.getLogger(ThreadProcessor.class);

    public void processItems(final Iterator<TWorkItem> itemIterator, final int numThreads)
            throws UncaughtWorkerThreadException {
        if (numThreads < 1) {
            throw new IllegalArgumentException("Number of threads must be at least 1, got " + numThreads);
        }
        final TerminableThread[] workers = new TerminableThread[numThreads];
        final List<Throwable> uncaughtExceptions = new ArrayList<>();

        Thread.UncaughtExceptionHandler handler = (th, ex) -> {
            LOG.error("Worker " + th.getName() + " died", ex);
            synchronized (uncaughtExceptions) {
                uncaughtExceptions.add(ex);
            }
            for (TerminableThread wt : workers) {
                wt.requestTermination();
            }
        };

        for (int i = 0; i < numThreads; i++) {
            TerminableThread t = new TerminableThread("worker-" + (i + 1)) {
                @Override
                public void run() {
                    while (!terminationRequested) {
                        final TWorkItem nextItem;
                        synchronized (itemIterator) {
                            if (!itemIterator.hasNext()) {
                                break;
                            }
                            nextItem = itemIterator.next();
                        }
                        processItem(nextItem);
                    }

                    if (terminationRequested) {
                        LOG.info("Terminating " + getName() + ": termination requested.");
                    }
                }
            };
            t.setUncaughtExceptionHandler(handler);
            workers[i] = t;
        }

        executeWorkers(workers);

        synchronized (uncaughtExceptions) {
            if (!uncaughtExceptions.isEmpty()) {
                throw new UncaughtWorkerThreadException(uncaughtExceptions.get(0));
            }
        }
    }

    private void executeWorkers(Thread[] workers) {
        for (Thread worker : workers) {
            worker.start();
        }

        for (Thread worker : workers) {
            try {
                worker.join();
            } catch (InterruptedException e) {
                LOG.warn("Interrupted while waiting for " + worker.getName() + " to finish.", e);
                Thread.currentThread().interrupt();
            }
        }
    }

    protected abstract void processItem(TWorkItem item);
}
