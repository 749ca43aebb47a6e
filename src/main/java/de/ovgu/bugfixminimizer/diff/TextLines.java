package de.ovgu.bugfixminimizer.diff;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits texts into lines and joins them back.  A trailing line terminator does not start another line, and a
 * carriage return before the line feed is not part of the line.
 */
public final class TextLines {
    private TextLines() {
    }

    public static List<String> split(String text) {
        if (text == null || text.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<>();
        int start = 0;
        final int len = text.length();
        while (start < len) {
            int nl = text.indexOf('\n', start);
            int end = nl < 0 ? len : nl;
            int contentEnd = end;
            if (contentEnd > start && text.charAt(contentEnd - 1) == '\r') {
                contentEnd--;
            }
            result.add(text.substring(start, contentEnd));
            start = end + 1;
        }
        return result;
    }

    /**
     * @return The lines, each terminated by a line feed
     */
    public static String join(List<String> lines) {
        StringBuilder sb = new StringBuilder();
        for (String line : lines) {
            sb.append(line).append('\n');
        }
        return sb.toString();
    }

    public static boolean isBlank(String line) {
        return line.trim().isEmpty();
    }

    /**
     * @return Number of leading spaces and tabs
     */
    public static int indentation(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }
}
