package de.ovgu.bugfixminimizer.normalize;

import java.util.ArrayList;
import java.util.List;

/**
 * Common scanning helpers of the concrete lexers.  Lexers keep no state between calls and may be shared between
 * threads.
 */
abstract class AbstractSourceLexer implements SourceLexer {
    @Override
    public List<Segment> lex(String text) {
        Segments out = new Segments();
        scan(text, out);
        out.finish(text.length());
        return out.list;
    }

    protected abstract void scan(String text, Segments out);

    /**
     * Collects the segments of one text.  Subclasses report every literal or comment they find; the code in between
     * is filled in automatically.
     */
    protected static final class Segments {
        private final List<Segment> list = new ArrayList<>();
        private int codeStart = 0;

        void emit(Segment.Kind kind, int start, int end) {
            if (start > codeStart) {
                list.add(new Segment(Segment.Kind.CODE, codeStart, start));
            }
            list.add(new Segment(kind, start, end));
            codeStart = end;
        }

        private void finish(int length) {
            if (codeStart < length) {
                list.add(new Segment(Segment.Kind.CODE, codeStart, length));
            }
        }
    }

    /**
     * Scans a quoted literal that may not span lines.  Backslashes escape the following character.
     *
     * @param from Position after the opening quote
     * @return Position after the closing quote, or of the line end if the literal is unterminated
     */
    protected static int scanSingleLineQuoted(String text, int from, char quote) {
        final int n = text.length();
        int j = from;
        while (j < n) {
            char ch = text.charAt(j);
            if (ch == '\\') {
                if (j + 1 < n && text.charAt(j + 1) == '\n') {
                    j += 2;
                    continue;
                }
                j += 2;
            } else if (ch == quote) {
                return j + 1;
            } else if (ch == '\n') {
                return j;
            } else {
                j++;
            }
        }
        return n;
    }

    /**
     * @return Position after the first occurrence of <code>terminator</code> at or after <code>from</code> that is
     * not escaped by a backslash, or the text length
     */
    protected static int scanUntil(String text, int from, String terminator, boolean backslashEscapes) {
        final int n = text.length();
        int j = from;
        while (j < n) {
            if (backslashEscapes && text.charAt(j) == '\\') {
                j += 2;
                continue;
            }
            if (text.startsWith(terminator, j)) {
                return j + terminator.length();
            }
            j++;
        }
        return n;
    }

    protected static int lineEnd(String text, int from) {
        int nl = text.indexOf('\n', from);
        return nl < 0 ? text.length() : nl;
    }

    protected static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
