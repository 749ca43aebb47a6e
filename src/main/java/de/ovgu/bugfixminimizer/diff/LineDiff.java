package de.ovgu.bugfixminimizer.diff;

import de.ovgu.bugfixminimizer.data.ChangeHunk;
import org.eclipse.jgit.diff.DiffAlgorithm;
import org.eclipse.jgit.diff.Edit;
import org.eclipse.jgit.diff.EditList;
import org.eclipse.jgit.diff.RawText;
import org.eclipse.jgit.diff.RawTextComparator;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Line-level alignment of two texts using the Myers algorithm.  Every maximal contiguous region in which the two
 * texts differ becomes one {@link Edit}.
 */
public final class LineDiff {
    private static final DiffAlgorithm ALGORITHM = DiffAlgorithm.getAlgorithm(DiffAlgorithm.SupportedAlgorithm.MYERS);
    private static final RawTextComparator COMPARATOR = RawTextComparator.DEFAULT;

    private LineDiff() {
    }

    /**
     * @return Edits that turn <code>a</code> into <code>b</code>, in ascending order, with touching edits merged
     */
    public static EditList edits(List<String> a, List<String> b) {
        EditList raw = ALGORITHM.diff(COMPARATOR, toRawText(a), toRawText(b));
        return coalesce(raw);
    }

    /**
     * @return One hunk per edit between <code>a</code> and <code>b</code>, numbered from 0
     */
    public static List<ChangeHunk> hunks(List<String> a, List<String> b) {
        EditList edits = edits(a, b);
        List<ChangeHunk> result = new ArrayList<>(edits.size());
        int hunkNo = 0;
        for (Edit e : edits) {
            String fingerprint = ChangeHunk.fingerprintOf(
                    a.subList(e.getBeginA(), e.getEndA()),
                    b.subList(e.getBeginB(), e.getEndB()));
            result.add(new ChangeHunk(hunkNo++, e.getBeginA(), e.getEndA(), e.getBeginB(), e.getEndB(),
                    fingerprint));
        }
        return result;
    }

    private static RawText toRawText(List<String> lines) {
        return new RawText(TextLines.join(lines).getBytes(StandardCharsets.UTF_8));
    }

    private static EditList coalesce(EditList edits) {
        EditList result = new EditList();
        Edit pending = null;
        for (Edit e : edits) {
            if (pending == null) {
                pending = new Edit(e.getBeginA(), e.getEndA(), e.getBeginB(), e.getEndB());
            } else if (pending.getEndA() == e.getBeginA() && pending.getEndB() == e.getBeginB()) {
                pending = new Edit(pending.getBeginA(), e.getEndA(), pending.getBeginB(), e.getEndB());
            } else {
                result.add(pending);
                pending = new Edit(e.getBeginA(), e.getEndA(), e.getBeginB(), e.getEndB());
            }
        }
        if (pending != null) {
            result.add(pending);
        }
        return result;
    }
}
