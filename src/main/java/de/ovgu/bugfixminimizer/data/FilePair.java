package de.ovgu.bugfixminimizer.data;

import de.ovgu.bugfixminimizer.error.MissingSideException;

import java.util.Objects;
import java.util.Optional;

/**
 * The before and after versions of one file touched by a commit.  Instances are created by a
 * {@link de.ovgu.bugfixminimizer.input.FilePairSource} and never modified afterwards.
 */
public final class FilePair {
    private final String path;
    private final Language language;
    private final String beforeText;
    private final String afterText;
    private final ModificationType modificationType;
    private final boolean testFile;
    private final boolean derivedArtifact;
    /**
     * Set if one of the sides could not be decoded.  The undecodable side is absent in that case.
     */
    private final String encodingProblem;

    public FilePair(String path, String beforeText, String afterText, ModificationType modificationType,
                    boolean testFile, boolean derivedArtifact) {
        this(path, beforeText, afterText, modificationType, testFile, derivedArtifact, null);
    }

    private FilePair(String path, String beforeText, String afterText, ModificationType modificationType,
                     boolean testFile, boolean derivedArtifact, String encodingProblem) {
        this.path = Objects.requireNonNull(path, "path");
        this.language = Language.fromPath(path);
        this.beforeText = beforeText;
        this.afterText = afterText;
        this.modificationType = Objects.requireNonNull(modificationType, "modificationType");
        this.testFile = testFile;
        this.derivedArtifact = derivedArtifact;
        this.encodingProblem = encodingProblem;
    }

    /**
     * Creates a pair for a file one of whose sides could not be decoded as text.
     */
    public static FilePair undecodable(String path, ModificationType modificationType, boolean testFile,
                                       boolean derivedArtifact, String problem) {
        return new FilePair(path, null, null, modificationType, testFile, derivedArtifact,
                Objects.requireNonNull(problem, "problem"));
    }

    /**
     * @return A pair with the same path and flags but different texts
     */
    public FilePair withTexts(String newBeforeText, String newAfterText) {
        return new FilePair(path, newBeforeText, newAfterText, modificationType, testFile, derivedArtifact,
                encodingProblem);
    }

    public String getPath() {
        return path;
    }

    public Language getLanguage() {
        return language;
    }

    public Optional<String> getBeforeText() {
        return Optional.ofNullable(beforeText);
    }

    public Optional<String> getAfterText() {
        return Optional.ofNullable(afterText);
    }

    /**
     * @return The before text, or the empty string for an absent before side
     */
    public String beforeTextOrEmpty() {
        return beforeText == null ? "" : beforeText;
    }

    /**
     * @return The after text, or the empty string for an absent after side
     */
    public String afterTextOrEmpty() {
        return afterText == null ? "" : afterText;
    }

    public ModificationType getModificationType() {
        return modificationType;
    }

    public boolean isTestFile() {
        return testFile;
    }

    public boolean isDerivedArtifact() {
        return derivedArtifact;
    }

    public Optional<String> getEncodingProblem() {
        return Optional.ofNullable(encodingProblem);
    }

    /**
     * Checks that the sides the modification type promises are actually present.  Pairs that failed to decode are
     * not checked; their missing side is reported as an encoding problem instead.
     *
     * @throws MissingSideException if a modified file lacks its before or after side
     */
    public void requireSides() throws MissingSideException {
        if (encodingProblem != null || modificationType != ModificationType.MODIFY) {
            return;
        }
        if (beforeText == null) {
            throw new MissingSideException(path, "before");
        }
        if (afterText == null) {
            throw new MissingSideException(path, "after");
        }
    }

    @Override
    public String toString() {
        return "FilePair{" + path +
                ", " + modificationType +
                ", " + language +
                (testFile ? ", test" : "") +
                (derivedArtifact ? ", derived" : "") +
                (encodingProblem != null ? ", undecodable" : "") +
                '}';
    }
}
