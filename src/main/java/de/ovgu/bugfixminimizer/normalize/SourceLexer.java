package de.ovgu.bugfixminimizer.normalize;

import java.util.List;

/**
 * Splits a source text into code, string literals and comments.  Lexers are lenient: unterminated literals and
 * comments extend to the end of the line or the text, and no input makes them fail.
 */
public interface SourceLexer {
    /**
     * @return Segments that cover the text without gaps, in ascending order
     */
    List<Segment> lex(String text);
}
