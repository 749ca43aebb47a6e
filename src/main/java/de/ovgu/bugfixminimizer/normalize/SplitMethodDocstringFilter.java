package de.ovgu.bugfixminimizer.normalize;

import de.ovgu.bugfixminimizer.data.Language;
import de.ovgu.bugfixminimizer.diff.TextLines;
import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Set;

/**
 * When a fix splits a function, the new functions often receive copies of existing documentation.  This filter drops
 * the docstrings directly below (Python) or the comments above (C family) every function that the after version
 * defines and the before version does not, regardless of whether their text existed before.  Comments above a
 * function reach up to the preceding line of code; annotations and blank lines in between are kept.
 */
public class SplitMethodDocstringFilter {
    private static final Logger LOG = Logger.getLogger(SplitMethodDocstringFilter.class);

    public List<String> dropDocumentationOfNewFunctions(List<String> before, List<String> after, LanguageRules rules) {
        final Language language = rules.getLanguage();
        if (language != Language.PYTHON && language != Language.C_FAMILY) {
            return after;
        }
        Set<String> beforeFunctions = SourceStructure.definedFunctions(before, language);
        SourceStructure structure = null;
        BitSet drop = new BitSet(after.size());
        for (int line = 0; line < after.size(); line++) {
            String name = SourceStructure.definedFunction(after.get(line), language);
            if (name == null || beforeFunctions.contains(name)) {
                continue;
            }
            if (structure == null) {
                structure = new SourceStructure(after, rules.getLexer());
            }
            if (language == Language.PYTHON) {
                markDocstringBelow(structure, line, drop);
            } else {
                markDocCommentAbove(structure, line, drop);
            }
        }
        if (drop.isEmpty()) {
            return after;
        }
        LOG.debug("Dropping " + drop.cardinality() + " line(s) of documentation of new functions");
        List<String> result = new ArrayList<>(after.size());
        for (int i = 0; i < after.size(); i++) {
            if (!drop.get(i)) {
                result.add(after.get(i));
            }
        }
        return result;
    }

    private static void markDocstringBelow(SourceStructure structure, int defLine, BitSet drop) {
        List<String> lines = structure.getLines();
        int candidate = structure.endOfPythonHeader(defLine) + 1;
        while (candidate < lines.size() && TextLines.isBlank(lines.get(candidate))) {
            candidate++;
        }
        if (candidate >= lines.size()) {
            return;
        }
        Segment docstring = structure.docstringStartingOn(candidate);
        if (docstring == null) {
            return;
        }
        int lastLine = structure.lineOf(docstring.getEnd() - 1);
        drop.set(candidate, lastLine + 1);
    }

    private static void markDocCommentAbove(SourceStructure structure, int defLine, BitSet drop) {
        List<String> lines = structure.getLines();
        boolean[] commentOnly = structure.commentOnlyLines();
        int line = defLine - 1;
        while (line >= 0) {
            String trimmed = lines.get(line).trim();
            if (commentOnly[line]) {
                drop.set(line);
            } else if (!(trimmed.isEmpty() || trimmed.startsWith("@")
                    || (trimmed.startsWith("[") && trimmed.endsWith("]")))) {
                break;
            }
            line--;
        }
    }
}
