package de.ovgu.bugfixminimizer.normalize;

import de.ovgu.bugfixminimizer.diff.TextLines;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds comments by means of a {@link SourceLexer}, so comment markers inside string literals are left alone.
 */
public class LexingCommentStripper implements CommentStripper {
    private final SourceLexer lexer;

    public LexingCommentStripper(SourceLexer lexer) {
        this.lexer = lexer;
    }

    static String identityOf(String commentText) {
        return StringUtils.normalizeSpace(commentText);
    }

    @Override
    public Set<String> commentIdentities(String text) {
        Set<String> result = new HashSet<>();
        for (Segment s : lexer.lex(text)) {
            if (s.isCommentLike()) {
                result.add(identityOf(s.textIn(text)));
            }
        }
        return result;
    }

    @Override
    public List<String> stripComments(String text, Set<String> keep) {
        BitSet removed = new BitSet(text.length());
        for (Segment s : lexer.lex(text)) {
            if (s.isCommentLike() && !keep.contains(identityOf(s.textIn(text)))) {
                removed.set(s.getStart(), s.getEnd());
            }
        }
        if (removed.isEmpty()) {
            return TextLines.split(text);
        }
        LineIndex index = new LineIndex(text);
        List<String> result = new ArrayList<>(index.lineCount());
        for (int line = 0; line < index.lineCount(); line++) {
            final int start = index.lineStart(line);
            final int end = index.lineEnd(line);
            int firstRemoved = removed.nextSetBit(start);
            boolean touched = firstRemoved >= 0 && firstRemoved < end;
            if (!touched) {
                result.add(StringUtils.removeEnd(text.substring(start, end), "\r"));
                continue;
            }
            StringBuilder kept = new StringBuilder(end - start);
            for (int i = start; i < end; i++) {
                if (!removed.get(i)) {
                    kept.append(text.charAt(i));
                }
            }
            String remainder = StringUtils.stripEnd(kept.toString(), null);
            if (!remainder.isEmpty()) {
                result.add(remainder);
            }
        }
        return result;
    }
}
