package de.ovgu.bugfixminimizer.equivalence;

import de.ovgu.bugfixminimizer.data.Language;
import de.ovgu.bugfixminimizer.normalize.LanguageRules;

import java.util.List;

/**
 * A kind of semantically inert difference, expressed as a canonicalization: two texts that differ only in this way
 * have the same canonical form.
 */
public interface EquivalencePattern {
    /**
     * @return Name under which matches of this pattern are reported
     */
    String getName();

    boolean appliesTo(Language language);

    /**
     * @param lines Lines of one version of a file
     * @param rules Rules of the file's language family
     * @param path Relative path of the file, for rules that differ between languages of one family
     * @return The canonical form of <code>lines</code>
     */
    List<String> canonicalize(List<String> lines, LanguageRules rules, String path);
}
