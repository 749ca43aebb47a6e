package de.ovgu.bugfixminimizer.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Processing status of a commit.  A commit is {@link Kind#OK} if every file was processed cleanly,
 * {@link Kind#PARTIAL_WITH_WARNINGS} if some files had to be skipped or were treated conservatively, and
 * {@link Kind#FAILED} if the commit could not be processed at all.
 */
public final class CommitStatus {
    public enum Kind {
        OK, PARTIAL_WITH_WARNINGS, FAILED
    }

    private static final CommitStatus OK = new CommitStatus(Kind.OK, Collections.emptyList());

    private final Kind kind;
    private final List<String> messages;

    private CommitStatus(Kind kind, List<String> messages) {
        this.kind = kind;
        this.messages = Collections.unmodifiableList(new ArrayList<>(messages));
    }

    public static CommitStatus ok() {
        return OK;
    }

    /**
     * @return {@link #ok()} if there are no warnings, else a partial status carrying the warnings
     */
    public static CommitStatus fromWarnings(List<String> warnings) {
        if (warnings.isEmpty()) {
            return OK;
        }
        return new CommitStatus(Kind.PARTIAL_WITH_WARNINGS, warnings);
    }

    public static CommitStatus failed(String reason) {
        return new CommitStatus(Kind.FAILED, Collections.singletonList(Objects.requireNonNull(reason, "reason")));
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isFailed() {
        return kind == Kind.FAILED;
    }

    /**
     * @return The warnings of a partial status, the reason of a failed one, nothing for an OK status
     */
    public List<String> getMessages() {
        return messages;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CommitStatus)) return false;
        CommitStatus that = (CommitStatus) o;
        return kind == that.kind && messages.equals(that.messages);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, messages);
    }

    @Override
    public String toString() {
        return messages.isEmpty() ? kind.name() : kind + messages.toString();
    }
}
