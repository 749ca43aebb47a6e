package de.ovgu.bugfixminimizer.util;

/**
 * Worker thread whose main loop polls a flag to find out whether it should stop early.
 */
public class TerminableThread extends Thread {
    protected volatile boolean terminationRequested = false;

    public TerminableThread(String name) {
        super(name);
    }

    public void requestTermination() {
        this.terminationRequested = true;
    }
}
