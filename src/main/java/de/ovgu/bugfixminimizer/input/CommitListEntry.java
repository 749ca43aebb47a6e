package de.ovgu.bugfixminimizer.input;

import java.util.Optional;

/**
 * One row of a commit list: selects a commit for processing and may state whether its bug is in test code.
 */
public final class CommitListEntry {
    private final String repository;
    private final String humanId;
    private final String commitHash;
    private final Boolean bugInTestCode;

    public CommitListEntry(String repository, String humanId, String commitHash, Boolean bugInTestCode) {
        this.repository = repository;
        this.humanId = humanId == null ? "" : humanId;
        this.commitHash = commitHash == null ? "" : commitHash;
        this.bugInTestCode = bugInTestCode;
    }

    public String getRepository() {
        return repository;
    }

    public String getHumanId() {
        return humanId;
    }

    public String getCommitHash() {
        return commitHash;
    }

    /**
     * @return Empty if the list does not say
     */
    public Optional<Boolean> getBugInTestCode() {
        return Optional.ofNullable(bugInTestCode);
    }

    @Override
    public String toString() {
        return "CommitListEntry{" + repository + ", " + humanId + ", " + commitHash + ", bugInTestCode="
                + bugInTestCode + '}';
    }
}
