package de.ovgu.bugfixminimizer.error;

/**
 * Base class of the checked exceptions that arise while reducing a bug-fix commit.  None of them stops a batch run;
 * each one is recorded against the file or commit it concerns.
 */
public abstract class MinimizationException extends Exception {
    protected MinimizationException(String message) {
        super(message);
    }

    protected MinimizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
