package de.ovgu.bugfixminimizer.normalize;

import de.ovgu.bugfixminimizer.diff.TextLines;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Used when the comment syntax of a file is unknown.  Leaves texts alone.
 */
public class NoCommentStripper implements CommentStripper {
    @Override
    public Set<String> commentIdentities(String text) {
        return Collections.emptySet();
    }

    @Override
    public List<String> stripComments(String text, Set<String> keep) {
        return TextLines.split(text);
    }
}
