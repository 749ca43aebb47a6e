package de.ovgu.bugfixminimizer.data;

import java.util.Objects;

/**
 * An included file pair after cosmetic stripping.  The before text is the original one; only the after text is
 * normalized.
 */
public final class NormalizedPair {
    private final FilePair filePair;
    private final String beforeNormalized;
    private final String afterNormalized;
    private final boolean languageRulesKnown;

    public NormalizedPair(FilePair filePair, String beforeNormalized, String afterNormalized,
                          boolean languageRulesKnown) {
        this.filePair = Objects.requireNonNull(filePair, "filePair");
        this.beforeNormalized = Objects.requireNonNull(beforeNormalized, "beforeNormalized");
        this.afterNormalized = Objects.requireNonNull(afterNormalized, "afterNormalized");
        this.languageRulesKnown = languageRulesKnown;
    }

    public FilePair getFilePair() {
        return filePair;
    }

    public String getPath() {
        return filePair.getPath();
    }

    public Language getLanguage() {
        return filePair.getLanguage();
    }

    public String getBeforeNormalized() {
        return beforeNormalized;
    }

    public String getAfterNormalized() {
        return afterNormalized;
    }

    /**
     * @return <code>false</code> if the file's language is unknown and only blank lines were stripped
     */
    public boolean isLanguageRulesKnown() {
        return languageRulesKnown;
    }

    /**
     * @return The same pair with before and after exchanged
     */
    public NormalizedPair swapped() {
        return new NormalizedPair(filePair, afterNormalized, beforeNormalized, languageRulesKnown);
    }
}
