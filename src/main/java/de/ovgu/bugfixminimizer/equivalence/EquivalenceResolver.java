package de.ovgu.bugfixminimizer.equivalence;

import de.ovgu.bugfixminimizer.data.ChangeHunk;
import de.ovgu.bugfixminimizer.data.EquivalenceVerdict;
import de.ovgu.bugfixminimizer.data.Language;
import de.ovgu.bugfixminimizer.data.NormalizedPair;
import de.ovgu.bugfixminimizer.diff.LineDiff;
import de.ovgu.bugfixminimizer.diff.TextLines;
import de.ovgu.bugfixminimizer.normalize.LanguageRules;
import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Decides whether the normalized before and after versions of a file differ in a way that matters.
 * <p>
 * The pair is equivalent if both versions consist of the same lines, or if they have the same canonical form under
 * the closed set of {@link EquivalencePattern}s.  Equivalence means the before version stands and nothing is counted.
 * <p>
 * Otherwise the pair is distinct.  Its changes are the hunks of a line-level alignment, minus the hunks that are
 * inert on their own: each hunk whose reversal leaves the canonical form of the after version unchanged is reverted
 * before counting.
 * <p>
 * The decision does not depend on which side is called before and which after.
 */
public class EquivalenceResolver {
    private static final Logger LOG = Logger.getLogger(EquivalenceResolver.class);

    private final List<EquivalencePattern> patterns;

    public EquivalenceResolver() {
        this(Arrays.asList(
                new LiteralReindentationPattern(),
                new DeclarationReorderingPattern(),
                new IncidentalWhitespacePattern()));
    }

    EquivalenceResolver(List<EquivalencePattern> patterns) {
        this.patterns = Collections.unmodifiableList(new ArrayList<>(patterns));
    }

    public EquivalenceVerdict resolve(NormalizedPair pair) {
        final String path = pair.getPath();
        final List<String> before = TextLines.split(pair.getBeforeNormalized());
        final List<String> after = TextLines.split(pair.getAfterNormalized());
        if (before.equals(after)) {
            return EquivalenceVerdict.equivalent(path, Collections.emptyList());
        }

        final LanguageRules rules = LanguageRules.forLanguage(pair.getLanguage());
        final List<EquivalencePattern> applicable = applicablePatterns(pair.getLanguage());
        final List<String> canonicalAfter = canonicalize(after, applicable, rules, path, null);
        if (canonicalize(before, applicable, rules, path, null).equals(canonicalAfter)) {
            List<String> names = namesOfNeededPatterns(before, after, applicable, rules, path);
            LOG.info(path + ": equivalent by " + String.join(", ", names));
            return EquivalenceVerdict.equivalent(path, names);
        }

        List<ChangeHunk> hunks = refinedHunks(before, after, canonicalAfter, applicable, rules, path);
        if (LOG.isDebugEnabled()) {
            LOG.debug(path + ": " + hunks.size() + " change unit(s)");
        }
        return EquivalenceVerdict.distinct(path, hunks);
    }

    private List<EquivalencePattern> applicablePatterns(Language language) {
        List<EquivalencePattern> result = new ArrayList<>(patterns.size());
        for (EquivalencePattern p : patterns) {
            if (p.appliesTo(language)) {
                result.add(p);
            }
        }
        return result;
    }

    private static List<String> canonicalize(List<String> lines, List<EquivalencePattern> patterns,
                                             LanguageRules rules, String path, EquivalencePattern skipped) {
        List<String> current = lines;
        for (EquivalencePattern p : patterns) {
            if (p != skipped) {
                current = p.canonicalize(current, rules, path);
            }
        }
        return current;
    }

    /**
     * @return Names of the patterns without which the two versions would not be equivalent.  If no single pattern
     * is indispensable, the names of all patterns that change either version.
     */
    private static List<String> namesOfNeededPatterns(List<String> before, List<String> after,
                                                      List<EquivalencePattern> applicable, LanguageRules rules,
                                                      String path) {
        List<String> needed = new ArrayList<>();
        for (EquivalencePattern p : applicable) {
            List<String> canonicalBefore = canonicalize(before, applicable, rules, path, p);
            if (!canonicalBefore.equals(canonicalize(after, applicable, rules, path, p))) {
                needed.add(p.getName());
            }
        }
        if (!needed.isEmpty()) {
            return needed;
        }
        for (EquivalencePattern p : applicable) {
            if (!p.canonicalize(before, rules, path).equals(before)
                    || !p.canonicalize(after, rules, path).equals(after)) {
                needed.add(p.getName());
            }
        }
        return needed;
    }

    private static List<ChangeHunk> refinedHunks(List<String> before, List<String> after, List<String> canonicalAfter,
                                                 List<EquivalencePattern> applicable, LanguageRules rules,
                                                 String path) {
        List<ChangeHunk> hunks = LineDiff.hunks(before, after);
        if (applicable.isEmpty() || hunks.size() < 2) {
            return hunks;
        }
        List<String> current = after;
        boolean reverted = false;
        // bottom up, so the positions of the remaining hunks stay valid
        for (int i = hunks.size() - 1; i >= 0; i--) {
            ChangeHunk h = hunks.get(i);
            List<String> candidate = new ArrayList<>(current.size());
            candidate.addAll(current.subList(0, h.getBeginAfter()));
            candidate.addAll(before.subList(h.getBeginBefore(), h.getEndBefore()));
            candidate.addAll(current.subList(h.getEndAfter(), current.size()));
            if (canonicalize(candidate, applicable, rules, path, null).equals(canonicalAfter)) {
                current = candidate;
                reverted = true;
            }
        }
        return reverted ? LineDiff.hunks(before, current) : hunks;
    }
}
