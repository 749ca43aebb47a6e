package de.ovgu.bugfixminimizer.normalize;

/**
 * A lexical region of a source text, given as half-open character range.
 */
public final class Segment {
    public enum Kind {
        CODE,
        STRING,
        COMMENT,
        /**
         * A string literal that forms a statement of its own, such as a Python docstring
         */
        DOCSTRING
    }

    private final Kind kind;
    private final int start;
    private final int end;

    public Segment(Kind kind, int start, int end) {
        this.kind = kind;
        this.start = start;
        this.end = end;
    }

    public Kind getKind() {
        return kind;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    /**
     * @return <code>true</code> for comments and docstrings, i.e., for text that has no effect on program behavior
     */
    public boolean isCommentLike() {
        return kind == Kind.COMMENT || kind == Kind.DOCSTRING;
    }

    public boolean isLiteral() {
        return kind == Kind.STRING || kind == Kind.DOCSTRING;
    }

    public String textIn(String text) {
        return text.substring(start, end);
    }

    @Override
    public String toString() {
        return kind + "[" + start + "," + end + ")";
    }
}
