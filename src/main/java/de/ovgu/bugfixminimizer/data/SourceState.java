package de.ovgu.bugfixminimizer.data;

/**
 * How the before/after pairs of a commit were obtained.
 */
public enum SourceState {
    /**
     * Normal path: the pairs come from the commit's single-parent diff.
     */
    MINED_DIFF_AVAILABLE,
    /**
     * The commit has more than one parent, so there is no single linear diff.  The before side is the content at
     * the merge's first parent (or the pre-merge branch tip if that is unavailable), the after side the post-merge
     * content.
     */
    FALLBACK_REQUIRED
}
