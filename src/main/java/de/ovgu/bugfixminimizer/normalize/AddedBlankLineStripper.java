package de.ovgu.bugfixminimizer.normalize;

import de.ovgu.bugfixminimizer.diff.LineDiff;
import de.ovgu.bugfixminimizer.diff.TextLines;
import org.eclipse.jgit.diff.Edit;
import org.eclipse.jgit.diff.EditList;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * Aligns before and after line by line and drops every blank after line that falls into a changed region.  Since
 * dropping lines can change the alignment, this is repeated until nothing more is dropped.  Blank lines in unchanged
 * regions are kept.
 */
public class AddedBlankLineStripper implements BlankLineStripper {
    @Override
    public List<String> stripAddedBlankLines(List<String> before, List<String> after) {
        List<String> current = after;
        while (true) {
            List<String> next = stripOnce(before, current);
            if (next.size() == current.size()) {
                return current;
            }
            current = next;
        }
    }

    private static List<String> stripOnce(List<String> before, List<String> after) {
        EditList edits = LineDiff.edits(before, after);
        BitSet drop = new BitSet(after.size());
        for (Edit e : edits) {
            for (int i = e.getBeginB(); i < e.getEndB(); i++) {
                if (TextLines.isBlank(after.get(i))) {
                    drop.set(i);
                }
            }
        }
        if (drop.isEmpty()) {
            return after;
        }
        List<String> result = new ArrayList<>(after.size() - drop.cardinality());
        for (int i = 0; i < after.size(); i++) {
            if (!drop.get(i)) {
                result.add(after.get(i));
            }
        }
        return result;
    }
}
