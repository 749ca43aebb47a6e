package de.ovgu.bugfixminimizer.data;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identifies a bug-fix commit: the repository it belongs to, its hash and, where known, the human-readable ID
 * combining repository name and referenced issue (e.g., <code>Cirq#3497</code>).
 */
public final class CommitId implements Comparable<CommitId> {
    private static final Comparator<CommitId> ORDER = Comparator
            .comparing(CommitId::getRepository)
            .thenComparing(CommitId::getHumanId)
            .thenComparing(CommitId::getHash);

    private final String repository;
    private final String hash;
    private final String humanId;

    public CommitId(String repository, String hash, String humanId) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.hash = hash == null ? "" : hash;
        this.humanId = humanId == null ? "" : humanId;
    }

    public CommitId(String repository, String hash) {
        this(repository, hash, "");
    }

    public String getRepository() {
        return repository;
    }

    /**
     * @return The commit hash, or the empty string if the dataset does not record it
     */
    public String getHash() {
        return hash;
    }

    /**
     * @return The human-readable ID, or the empty string if there is none
     */
    public String getHumanId() {
        return humanId;
    }

    @Override
    public int compareTo(CommitId o) {
        return ORDER.compare(this, o);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CommitId)) return false;
        CommitId other = (CommitId) o;
        return repository.equals(other.repository) && hash.equals(other.hash) && humanId.equals(other.humanId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(repository, hash, humanId);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(repository);
        if (!humanId.isEmpty()) {
            sb.append(' ').append(humanId);
        }
        if (!hash.isEmpty()) {
            sb.append(" (").append(hash).append(')');
        }
        return sb.toString();
    }
}
