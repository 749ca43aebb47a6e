package de.ovgu.bugfixminimizer.normalize;

import java.util.Arrays;

/**
 * Maps character offsets of a text to 0-based line numbers.  Lines are numbered the same way as by
 * {@link de.ovgu.bugfixminimizer.diff.TextLines#split(String)}.
 */
public final class LineIndex {
    private final int[] lineStarts;
    private final int length;
    private final boolean terminated;

    public LineIndex(String text) {
        this.length = text.length();
        this.terminated = length > 0 && text.charAt(length - 1) == '\n';
        int[] starts = new int[16];
        int count = 0;
        if (length > 0) {
            starts[count++] = 0;
        }
        for (int i = 0; i < length; i++) {
            if (text.charAt(i) == '\n' && i + 1 < length) {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        this.lineStarts = Arrays.copyOf(starts, count);
    }

    public int lineCount() {
        return lineStarts.length;
    }

    public int lineOf(int offset) {
        int pos = Arrays.binarySearch(lineStarts, offset);
        if (pos >= 0) {
            return pos;
        }
        return Math.max(0, -pos - 2);
    }

    public int lineStart(int line) {
        return lineStarts[line];
    }

    /**
     * @return Offset of the line feed ending the line, or the text length for an unterminated last line.  The line
     * feed itself is never part of the line.
     */
    public int lineEnd(int line) {
        if (line + 1 < lineStarts.length) {
            return lineStarts[line + 1] - 1;
        }
        return terminated ? length - 1 : length;
    }
}
