package de.ovgu.bugfixminimizer.equivalence;

import de.ovgu.bugfixminimizer.data.Language;
import de.ovgu.bugfixminimizer.diff.TextLines;
import de.ovgu.bugfixminimizer.normalize.LanguageRules;
import de.ovgu.bugfixminimizer.normalize.LineIndex;
import de.ovgu.bugfixminimizer.normalize.Segment;

import java.util.ArrayList;
import java.util.List;

/**
 * Multi-line string literals and docstrings whose continuation lines were shifted by a common amount of
 * indentation.  The continuation lines of every such literal are dedented.
 */
public class LiteralReindentationPattern implements EquivalencePattern {
    public static final String NAME = "literal-reindentation";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean appliesTo(Language language) {
        return language == Language.PYTHON || language == Language.C_FAMILY;
    }

    @Override
    public List<String> canonicalize(List<String> lines, LanguageRules rules, String path) {
        String text = TextLines.join(lines);
        LineIndex index = new LineIndex(text);
        List<String> result = null;
        for (Segment s : rules.getLexer().lex(text)) {
            if (!s.isLiteral() || s.getEnd() <= s.getStart()) {
                continue;
            }
            final int first = index.lineOf(s.getStart()) + 1;
            final int last = index.lineOf(s.getEnd() - 1);
            if (last < first) {
                continue;
            }
            int common = Integer.MAX_VALUE;
            for (int line = first; line <= last; line++) {
                String l = lines.get(line);
                if (!TextLines.isBlank(l)) {
                    common = Math.min(common, TextLines.indentation(l));
                }
            }
            if (common == 0 || common == Integer.MAX_VALUE) {
                continue;
            }
            if (result == null) {
                result = new ArrayList<>(lines);
            }
            for (int line = first; line <= last; line++) {
                String l = result.get(line);
                result.set(line, TextLines.isBlank(l) ? "" : l.substring(common));
            }
        }
        return result == null ? lines : result;
    }
}
