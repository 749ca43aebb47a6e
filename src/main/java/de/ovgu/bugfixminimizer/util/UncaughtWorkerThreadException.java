package de.ovgu.bugfixminimizer.util;

/**
 * Thrown when a worker thread of a {@link ThreadProcessor} dies abnormally, e.g., due to an out of memory error or
 * a bug that escapes the per-commit error handling.
 */
public class UncaughtWorkerThreadException extends Exception {
    public UncaughtWorkerThreadException(Throwable cause) {
        super(cause);
    }
}
