package de.ovgu.bugfixminimizer.normalize;

/**
 * Lexer for Python sources.  A string literal that stands alone as a statement (it is the only thing on its lines,
 * outside of any bracket) is reported as {@link Segment.Kind#DOCSTRING}.
 */
public class PythonLexer extends AbstractSourceLexer {
    private static final String PREFIX_CHARS = "rRbBuUfF";

    @Override
    protected void scan(String text, Segments out) {
        final int n = text.length();
        int depth = 0;
        int i = 0;
        while (i < n) {
            char c = text.charAt(i);
            if (c == '#') {
                int end = lineEnd(text, i);
                out.emit(Segment.Kind.COMMENT, i, end);
                i = end;
                continue;
            }
            int quotePos = stringStart(text, i);
            if (quotePos >= 0) {
                char quote = text.charAt(quotePos);
                final int end;
                if (text.startsWith(tripleOf(quote), quotePos)) {
                    end = scanUntil(text, quotePos + 3, tripleOf(quote), true);
                } else {
                    end = scanSingleLineQuoted(text, quotePos + 1, quote);
                }
                boolean statement = depth == 0 && onlyWhitespaceBefore(text, i) && nothingAfter(text, end);
                out.emit(statement ? Segment.Kind.DOCSTRING : Segment.Kind.STRING, i, end);
                i = end;
                continue;
            }
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if ((c == ')' || c == ']' || c == '}') && depth > 0) {
                depth--;
            }
            i++;
        }
    }

    private static String tripleOf(char quote) {
        return quote == '"' ? "\"\"\"" : "'''";
    }

    /**
     * @return Position of the opening quote if a string literal (possibly prefixed) starts at <code>i</code>, else
     * <code>-1</code>
     */
    private static int stringStart(String text, int i) {
        char c = text.charAt(i);
        if (c == '"' || c == '\'') {
            return i;
        }
        if (PREFIX_CHARS.indexOf(c) < 0 || (i > 0 && isIdentifierChar(text.charAt(i - 1)))) {
            return -1;
        }
        final int n = text.length();
        int j = i + 1;
        if (j < n && PREFIX_CHARS.indexOf(text.charAt(j)) >= 0) {
            j++;
        }
        if (j < n && (text.charAt(j) == '"' || text.charAt(j) == '\'')) {
            return j;
        }
        return -1;
    }

    private static boolean onlyWhitespaceBefore(String text, int pos) {
        for (int j = pos - 1; j >= 0; j--) {
            char ch = text.charAt(j);
            if (ch == '\n') {
                return true;
            }
            if (ch != ' ' && ch != '\t') {
                return false;
            }
        }
        return true;
    }

    private static boolean nothingAfter(String text, int pos) {
        final int n = text.length();
        for (int j = pos; j < n; j++) {
            char ch = text.charAt(j);
            if (ch == '\n' || ch == '#') {
                return true;
            }
            if (ch != ' ' && ch != '\t' && ch != '\r' && ch != ';') {
                return false;
            }
        }
        return true;
    }
}
