package de.ovgu.bugfixminimizer.data;

import java.util.List;
import java.util.Objects;

/**
 * One maximal contiguous region in which the normalized before and after texts of a file differ.  This is the unit
 * that is counted.
 */
public final class ChangeHunk {
    /**
     * Number of the hunk within its file, counted from 0
     */
    private final int hunkNo;
    /**
     * First line of the region in the before text (0-based, inclusive)
     */
    private final int beginBefore;
    /**
     * End of the region in the before text (exclusive)
     */
    private final int endBefore;
    private final int beginAfter;
    private final int endAfter;
    /**
     * Deleted and added text with whitespace runs collapsed.  Two hunks with the same fingerprint apply the same
     * edit.
     */
    private final String fingerprint;

    public ChangeHunk(int hunkNo, int beginBefore, int endBefore, int beginAfter, int endAfter, String fingerprint) {
        this.hunkNo = hunkNo;
        this.beginBefore = beginBefore;
        this.endBefore = endBefore;
        this.beginAfter = beginAfter;
        this.endAfter = endAfter;
        this.fingerprint = Objects.requireNonNull(fingerprint, "fingerprint");
    }

    /**
     * Computes the fingerprint of an edit that replaces <code>deleted</code> by <code>added</code>.
     */
    public static String fingerprintOf(List<String> deleted, List<String> added) {
        StringBuilder sb = new StringBuilder();
        for (String line : deleted) {
            sb.append('-').append(collapseWhitespace(line)).append('\n');
        }
        for (String line : added) {
            sb.append('+').append(collapseWhitespace(line)).append('\n');
        }
        return sb.toString();
    }

    private static String collapseWhitespace(String line) {
        return line.trim().replaceAll("\\s+", " ");
    }

    public int getHunkNo() {
        return hunkNo;
    }

    public int getBeginBefore() {
        return beginBefore;
    }

    public int getEndBefore() {
        return endBefore;
    }

    public int getBeginAfter() {
        return beginAfter;
    }

    public int getEndAfter() {
        return endAfter;
    }

    public int getLinesDeleted() {
        return endBefore - beginBefore;
    }

    public int getLinesAdded() {
        return endAfter - beginAfter;
    }

    /**
     * @return Lines touched by this hunk: the larger of lines deleted and lines added
     */
    public int getModifiedLines() {
        return Math.max(getLinesDeleted(), getLinesAdded());
    }

    public String getFingerprint() {
        return fingerprint;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + '{' +
                "hunkNo=" + hunkNo +
                ", -" + beginBefore + "," + getLinesDeleted() +
                " +" + beginAfter + "," + getLinesAdded() +
                '}';
    }
}
