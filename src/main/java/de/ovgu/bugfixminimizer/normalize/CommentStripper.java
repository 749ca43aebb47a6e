package de.ovgu.bugfixminimizer.normalize;

import java.util.List;
import java.util.Set;

/**
 * Removes comments from source texts.  Comments are identified by their text with whitespace runs collapsed, so a
 * comment that was merely moved or reindented keeps its identity.
 */
public interface CommentStripper {
    /**
     * @return Identities of all comments (and docstrings) in the text
     */
    Set<String> commentIdentities(String text);

    /**
     * Removes every comment whose identity is not in <code>keep</code>.  Lines that held nothing but removed comments
     * are dropped; lines that lost a trailing comment are right-trimmed.  All other lines are returned unchanged.
     */
    List<String> stripComments(String text, Set<String> keep);
}
