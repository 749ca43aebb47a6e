package de.ovgu.bugfixminimizer.normalize;

import de.ovgu.bugfixminimizer.data.FilePair;
import de.ovgu.bugfixminimizer.data.NormalizedPair;
import de.ovgu.bugfixminimizer.diff.TextLines;
import org.apache.log4j.Logger;

import java.util.List;
import java.util.Set;

/**
 * Strips cosmetic noise from the after version of an included file pair.  The before version is never touched.
 * Steps, in this order:
 * <ol>
 * <li>documentation of functions that a split introduced</li>
 * <li>debug statements that were only commented in or out</li>
 * <li>comments whose text does not occur in the before version</li>
 * <li>new regression tests, in test files only</li>
 * <li>blank lines that the after version inserted</li>
 * </ol>
 * For files of unknown language, only the last step is performed.  Normalizing an already normalized pair changes
 * nothing.
 */
public class CosmeticNormalizer {
    private static final Logger LOG = Logger.getLogger(CosmeticNormalizer.class);

    private final SplitMethodDocstringFilter splitMethodDocstringFilter = new SplitMethodDocstringFilter();
    private final DebugStatementFilter debugStatementFilter = new DebugStatementFilter();
    private final RegressionTestFilter regressionTestFilter = new RegressionTestFilter();

    public NormalizedPair normalize(FilePair pair) {
        final LanguageRules rules = LanguageRules.forLanguage(pair.getLanguage());
        final String beforeText = pair.beforeTextOrEmpty();
        final List<String> before = TextLines.split(beforeText);
        List<String> after = TextLines.split(pair.afterTextOrEmpty());

        if (rules.isKnown()) {
            after = splitMethodDocstringFilter.dropDocumentationOfNewFunctions(before, after, rules);
            after = debugStatementFilter.revertToggledDebugStatements(before, after, rules);
            CommentStripper comments = rules.getCommentStripper();
            Set<String> existingComments = comments.commentIdentities(beforeText);
            after = comments.stripComments(TextLines.join(after), existingComments);
            if (pair.isTestFile()) {
                after = regressionTestFilter.dropNewTests(beforeText, after, rules);
            }
        } else {
            LOG.info("Unknown language of " + pair.getPath() + ". Only stripping blank lines.");
        }
        after = rules.getBlankLineStripper().stripAddedBlankLines(before, after);

        return new NormalizedPair(pair, beforeText, TextLines.join(after), rules.isKnown());
    }
}
