package de.ovgu.bugfixminimizer.pipeline;

import de.ovgu.bugfixminimizer.classify.FileClassifier;
import de.ovgu.bugfixminimizer.count.ChangeCounter;
import de.ovgu.bugfixminimizer.count.CommitAggregator;
import de.ovgu.bugfixminimizer.data.ChangeRecord;
import de.ovgu.bugfixminimizer.data.ClassificationOutcome;
import de.ovgu.bugfixminimizer.data.Commit;
import de.ovgu.bugfixminimizer.data.CommitId;
import de.ovgu.bugfixminimizer.data.CommitStatus;
import de.ovgu.bugfixminimizer.data.CommitSummary;
import de.ovgu.bugfixminimizer.data.EquivalenceVerdict;
import de.ovgu.bugfixminimizer.data.ExclusionReason;
import de.ovgu.bugfixminimizer.data.FilePair;
import de.ovgu.bugfixminimizer.data.NormalizedPair;
import de.ovgu.bugfixminimizer.data.SourceState;
import de.ovgu.bugfixminimizer.equivalence.EquivalenceResolver;
import de.ovgu.bugfixminimizer.error.MissingSideException;
import de.ovgu.bugfixminimizer.error.ZeroFileCommitException;
import de.ovgu.bugfixminimizer.input.FilePairSource;
import de.ovgu.bugfixminimizer.normalize.CosmeticNormalizer;
import org.apache.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs one commit through the whole pipeline: load, classify, normalize, resolve equivalences, count and aggregate.
 * Problems with single files are recorded as warnings and make the commit partial.  Problems with the commit as a
 * whole make it fail.  Nothing thrown while processing a commit escapes {@link #process(CommitId)}.
 * <p>
 * Instances are stateless apart from their collaborators and may be shared between threads.
 */
public class CommitProcessor {
    private static final Logger LOG = Logger.getLogger(CommitProcessor.class);

    private final FilePairSource source;
    private final FileClassifier classifier;
    private final CosmeticNormalizer normalizer;
    private final EquivalenceResolver resolver;
    private final ChangeCounter counter;
    private final CommitAggregator aggregator;

    public CommitProcessor(FilePairSource source) {
        this(source, new FileClassifier(), new CosmeticNormalizer(), new EquivalenceResolver(), new ChangeCounter(),
                new CommitAggregator());
    }

    public CommitProcessor(FilePairSource source, FileClassifier classifier, CosmeticNormalizer normalizer,
                           EquivalenceResolver resolver, ChangeCounter counter, CommitAggregator aggregator) {
        this.source = source;
        this.classifier = classifier;
        this.normalizer = normalizer;
        this.resolver = resolver;
        this.counter = counter;
        this.aggregator = aggregator;
    }

    public CommitResult process(CommitId commitId) {
        final Commit commit;
        try {
            commit = source.load(commitId);
        } catch (ZeroFileCommitException e) {
            LOG.error(e.getMessage());
            return fail(commitId, "", e.getMessage());
        } catch (IOException e) {
            LOG.error("Error loading commit " + commitId, e);
            return fail(commitId, "", "error loading commit: " + e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Unexpected error loading commit " + commitId, e);
            return fail(commitId, "", "unexpected error loading commit: " + e);
        }

        try {
            return process(commit);
        } catch (RuntimeException e) {
            LOG.error("Unexpected error processing commit " + commitId, e);
            return fail(commitId, commit.getIssueReference(), "unexpected error: " + e);
        }
    }

    public CommitResult process(Commit commit) {
        final CommitId commitId = commit.getId();
        LOG.debug("Processing " + commit);
        if (commit.getSourceState() == SourceState.FALLBACK_REQUIRED) {
            LOG.info(commitId + ": " + commit.getParentCount() + " parents, using the content rendered at the "
                    + "first parent as the before side.");
        }

        final List<String> warnings = new ArrayList<>();
        final List<EquivalenceVerdict> verdicts = new ArrayList<>();
        for (FilePair pair : commit.getFilePairs()) {
            try {
                EquivalenceVerdict verdict = processFile(commit, pair, warnings);
                if (verdict != null) {
                    verdicts.add(verdict);
                }
            } catch (RuntimeException e) {
                LOG.warn(commitId + ": error processing " + pair.getPath() + ". Skipping file.", e);
                warnings.add(pair.getPath() + ": processing error: " + e);
            }
        }

        if (commit.getFilePairs().isEmpty()) {
            warnings.add("merge commit without any file pairs");
        }

        List<ChangeRecord> records = counter.count(commit, verdicts);
        CommitSummary summary = aggregator.aggregate(commitId, commit.getIssueReference(), records,
                CommitStatus.fromWarnings(warnings));
        LOG.debug(summary);
        return new CommitResult(summary, records);
    }

    /**
     * @return The verdict for the pair, or <code>null</code> if it does not take part in counting
     */
    private EquivalenceVerdict processFile(Commit commit, FilePair pair, List<String> warnings) {
        final CommitId commitId = commit.getId();
        try {
            pair.requireSides();
        } catch (MissingSideException e) {
            LOG.warn(commitId + ": " + e.getMessage() + ". Skipping file.");
            warnings.add(e.getMessage());
            return null;
        }

        ClassificationOutcome outcome = classifier.classify(pair, commit.isBugInTestCode());
        if (!outcome.isIncluded()) {
            ExclusionReason reason = outcome.getReason().get();
            if (reason.isError()) {
                String problem = pair.getEncodingProblem().orElse(reason.name());
                LOG.warn(commitId + ": " + problem);
                warnings.add(pair.getPath() + ": " + reason + ": " + problem);
            }
            return null;
        }

        NormalizedPair normalized = normalizer.normalize(pair);
        if (!normalized.isLanguageRulesKnown()) {
            warnings.add(pair.getPath() + ": unknown language, counted conservatively");
        }
        return resolver.resolve(normalized);
    }

    private static CommitResult fail(CommitId commitId, String issueReference, String reason) {
        return CommitResult.failed(CommitSummary.failed(commitId, issueReference, reason));
    }
}
