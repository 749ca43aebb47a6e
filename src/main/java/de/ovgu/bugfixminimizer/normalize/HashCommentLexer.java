package de.ovgu.bugfixminimizer.normalize;

/**
 * Lexer for shell scripts, configuration files and Quil programs.  A <code>#</code> starts a comment at the beginning
 * of a line or after whitespace.  Quoted strings do not span lines.
 */
public class HashCommentLexer extends AbstractSourceLexer {
    @Override
    protected void scan(String text, Segments out) {
        final int n = text.length();
        int i = 0;
        while (i < n) {
            char c = text.charAt(i);
            if (c == '#' && (i == 0 || Character.isWhitespace(text.charAt(i - 1)))) {
                int end = lineEnd(text, i);
                out.emit(Segment.Kind.COMMENT, i, end);
                i = end;
            } else if (c == '"' || (c == '\'' && (i == 0 || !isIdentifierChar(text.charAt(i - 1))))) {
                int end = scanSingleLineQuoted(text, i + 1, c);
                out.emit(Segment.Kind.STRING, i, end);
                i = end;
            } else {
                i++;
            }
        }
    }
}
