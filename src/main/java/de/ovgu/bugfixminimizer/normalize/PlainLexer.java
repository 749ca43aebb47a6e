package de.ovgu.bugfixminimizer.normalize;

/**
 * Lexer for files of unknown language: everything is code.
 */
public class PlainLexer extends AbstractSourceLexer {
    @Override
    protected void scan(String text, Segments out) {
        // nothing to recognize
    }
}
