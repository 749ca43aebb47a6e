package de.ovgu.bugfixminimizer.normalize;

/**
 * Lexer for languages with <code>//</code> line comments and <code>/* *&#47;</code> block comments.  Recognizes
 * double-quoted strings, triple-quoted text blocks, C# verbatim strings, backtick template strings and character
 * literals.  Apostrophes that follow an identifier character (C++ digit separators) or that do not close within a
 * few characters (Rust lifetimes) are treated as code.
 */
public class CStyleLexer extends AbstractSourceLexer {
    private static final int MAX_CHAR_LITERAL_LENGTH = 12;

    @Override
    protected void scan(String text, Segments out) {
        final int n = text.length();
        int i = 0;
        while (i < n) {
            char c = text.charAt(i);
            char next = i + 1 < n ? text.charAt(i + 1) : '\0';
            if (c == '/' && next == '/') {
                int end = lineEnd(text, i);
                out.emit(Segment.Kind.COMMENT, i, end);
                i = end;
            } else if (c == '/' && next == '*') {
                int end = scanUntil(text, i + 2, "*/", false);
                out.emit(Segment.Kind.COMMENT, i, end);
                i = end;
            } else if (c == '"' && text.startsWith("\"\"\"", i)) {
                int end = scanUntil(text, i + 3, "\"\"\"", true);
                out.emit(Segment.Kind.STRING, i, end);
                i = end;
            } else if (c == '@' && next == '"') {
                int end = scanVerbatim(text, i + 2);
                out.emit(Segment.Kind.STRING, i, end);
                i = end;
            } else if (c == '"') {
                int end = scanSingleLineQuoted(text, i + 1, '"');
                out.emit(Segment.Kind.STRING, i, end);
                i = end;
            } else if (c == '`') {
                int end = scanUntil(text, i + 1, "`", true);
                out.emit(Segment.Kind.STRING, i, end);
                i = end;
            } else if (c == '\'') {
                int end = charLiteralEnd(text, i);
                if (end > 0) {
                    out.emit(Segment.Kind.STRING, i, end);
                    i = end;
                } else {
                    i++;
                }
            } else {
                i++;
            }
        }
    }

    private static int scanVerbatim(String text, int from) {
        final int n = text.length();
        int j = from;
        while (j < n) {
            if (text.charAt(j) == '"') {
                if (j + 1 < n && text.charAt(j + 1) == '"') {
                    j += 2;
                    continue;
                }
                return j + 1;
            }
            j++;
        }
        return n;
    }

    /**
     * @return End of the character literal starting at <code>start</code>, or <code>-1</code> if the apostrophe does
     * not open one
     */
    private static int charLiteralEnd(String text, int start) {
        if (start > 0 && isIdentifierChar(text.charAt(start - 1))) {
            return -1;
        }
        final int n = text.length();
        final int limit = Math.min(n, start + MAX_CHAR_LITERAL_LENGTH);
        int j = start + 1;
        if (j < n && text.charAt(j) == '\\') {
            j += 2;
        } else if (j + 1 < n && text.charAt(j) != '\n' && text.charAt(j + 1) == '\'') {
            return j + 2;
        } else {
            return -1;
        }
        while (j < limit) {
            char ch = text.charAt(j);
            if (ch == '\n') {
                return -1;
            }
            if (ch == '\'') {
                return j + 1;
            }
            j++;
        }
        return -1;
    }
}
