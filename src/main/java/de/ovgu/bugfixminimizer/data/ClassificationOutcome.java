package de.ovgu.bugfixminimizer.data;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of classifying one file pair: either included in counting or excluded for a reason.
 */
public final class ClassificationOutcome {
    public static final ClassificationOutcome INCLUDED = new ClassificationOutcome(null);

    private static final Map<ExclusionReason, ClassificationOutcome> EXCLUDED = new EnumMap<>(ExclusionReason.class);

    static {
        for (ExclusionReason r : ExclusionReason.values()) {
            EXCLUDED.put(r, new ClassificationOutcome(r));
        }
    }

    private final ExclusionReason reason;

    private ClassificationOutcome(ExclusionReason reason) {
        this.reason = reason;
    }

    public static ClassificationOutcome excluded(ExclusionReason reason) {
        return EXCLUDED.get(Objects.requireNonNull(reason, "reason"));
    }

    public boolean isIncluded() {
        return reason == null;
    }

    public Optional<ExclusionReason> getReason() {
        return Optional.ofNullable(reason);
    }

    @Override
    public String toString() {
        return reason == null ? "Included" : "Excluded(" + reason + ")";
    }
}
