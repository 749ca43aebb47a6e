package de.ovgu.bugfixminimizer.input;

import de.ovgu.bugfixminimizer.data.Commit;
import de.ovgu.bugfixminimizer.data.CommitId;
import de.ovgu.bugfixminimizer.error.ZeroFileCommitException;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * Supplies the before/after file pairs of bug-fix commits.  For commits with more than one parent, the source
 * substitutes the content rendered at the first parent for the before side and marks the commit as
 * {@link de.ovgu.bugfixminimizer.data.SourceState#FALLBACK_REQUIRED}.
 * <p>
 * Implementations must allow {@link #load(CommitId)} to be called from several threads at once.
 */
public interface FilePairSource extends Closeable {
    /**
     * @return The commits this source can load, in ascending order
     */
    List<CommitId> listCommits() throws IOException;

    /**
     * @throws ZeroFileCommitException if the commit is not a merge and yields no file pairs
     * @throws IOException             if the commit cannot be read
     */
    Commit load(CommitId commitId) throws ZeroFileCommitException, IOException;
}
