package de.ovgu.bugfixminimizer.input;

import de.ovgu.bugfixminimizer.data.Commit;
import de.ovgu.bugfixminimizer.data.CommitId;
import de.ovgu.bugfixminimizer.data.FilePair;
import de.ovgu.bugfixminimizer.data.ModificationType;
import de.ovgu.bugfixminimizer.data.SourceState;
import de.ovgu.bugfixminimizer.error.ZeroFileCommitException;
import org.apache.log4j.Logger;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.diff.DiffEntry;
import org.eclipse.jgit.diff.DiffFormatter;
import org.eclipse.jgit.errors.MissingObjectException;
import org.eclipse.jgit.lib.AbbreviatedObjectId;
import org.eclipse.jgit.lib.FileMode;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.treewalk.TreeWalk;
import org.eclipse.jgit.util.io.DisabledOutputStream;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Mines file pairs straight from a local GIT repository.
 * <ul>
 * <li>No parent: every file of the commit is an addition.</li>
 * <li>One parent: the pairs of the diff between parent and commit.</li>
 * <li>Several parents: the pairs of the diff between the first parent and the merge result, marked as
 * {@link SourceState#FALLBACK_REQUIRED}.  If the first parent cannot be read, the next readable one is used.</li>
 * </ul>
 * Submodule entries are skipped.  Renames are not detected; a renamed file yields a deletion and an addition.
 */
public class GitFilePairSource implements FilePairSource {
    private static final Logger LOG = Logger.getLogger(GitFilePairSource.class);

    private final Git git;
    private final Repository repo;
    private final String repositoryName;
    private final List<String> revisions;
    private final FilePairFactory filePairFactory;
    private final Map<String, CommitListEntry> entriesByHash = new HashMap<>();

    /**
     * @param revisions   Commits to mine, as (possibly abbreviated) hashes or other revision strings
     * @param commitList  Additional information about the commits, matched by hash.  May be empty.
     */
    public GitFilePairSource(File repoDir, String repositoryName, List<String> revisions,
                             List<CommitListEntry> commitList, FilePairFactory filePairFactory) throws IOException {
        this.git = Git.open(repoDir);
        this.repo = git.getRepository();
        this.repositoryName = repositoryName;
        this.filePairFactory = filePairFactory;
        List<String> allRevisions = new ArrayList<>(revisions);
        for (CommitListEntry e : commitList) {
            if (!e.getCommitHash().isEmpty()) {
                allRevisions.add(e.getCommitHash());
            }
        }
        this.revisions = Collections.unmodifiableList(allRevisions);
        for (CommitListEntry e : commitList) {
            if (e.getCommitHash().isEmpty()) {
                LOG.warn("Ignoring commit list entry without commit hash: " + e);
                continue;
            }
            ObjectId id = repo.resolve(e.getCommitHash());
            entriesByHash.put(id == null ? e.getCommitHash() : id.getName(), e);
        }
    }

    @Override
    public List<CommitId> listCommits() throws IOException {
        List<CommitId> result = new ArrayList<>();
        for (String revision : revisions) {
            ObjectId id = repo.resolve(revision);
            final String hash;
            if (id == null) {
                LOG.error("Cannot resolve revision " + revision + " in repository " + repositoryName);
                hash = revision;
            } else {
                hash = id.getName();
            }
            CommitListEntry entry = entriesByHash.get(hash);
            CommitId commitId = new CommitId(repositoryName, hash, entry == null ? "" : entry.getHumanId());
            if (!result.contains(commitId)) {
                result.add(commitId);
            }
        }
        Collections.sort(result);
        return result;
    }

    @Override
    public Commit load(CommitId commitId) throws ZeroFileCommitException, IOException {
        ObjectId id = repo.resolve(commitId.getHash());
        if (id == null) {
            throw new IOException("Unknown commit " + commitId.getHash() + " in repository " + repositoryName);
        }
        try (RevWalk rw = new RevWalk(repo)) {
            RevCommit commit = rw.parseCommit(id);
            final int parentCount = commit.getParentCount();
            final List<FilePair> pairs;
            if (parentCount == 0) {
                LOG.debug("Parent-less commit " + commitId);
                pairs = pairsOfParentLessCommit(commit);
            } else {
                RevCommit parent = firstReadableParent(rw, commit);
                pairs = pairsOfDiff(parent, commit);
            }
            if (pairs.isEmpty() && parentCount <= 1) {
                throw new ZeroFileCommitException(commitId);
            }
            SourceState state = parentCount > 1 ? SourceState.FALLBACK_REQUIRED : SourceState.MINED_DIFF_AVAILABLE;
            CommitListEntry entry = entriesByHash.get(id.getName());
            boolean bugInTestCode = entry != null && entry.getBugInTestCode().orElse(false);
            return new Commit(commitId, pairs, parentCount, bugInTestCode, state, "");
        }
    }

    private RevCommit firstReadableParent(RevWalk rw, RevCommit commit) throws IOException {
        IOException firstProblem = null;
        for (int i = 0; i < commit.getParentCount(); i++) {
            try {
                return rw.parseCommit(commit.getParent(i).getId());
            } catch (MissingObjectException e) {
                LOG.warn("Parent " + i + " of commit " + commit.getName() + " is not available", e);
                if (firstProblem == null) {
                    firstProblem = e;
                }
            }
        }
        throw firstProblem;
    }

    private List<FilePair> pairsOfParentLessCommit(RevCommit commit) throws IOException {
        List<FilePair> pairs = new ArrayList<>();
        try (TreeWalk tw = new TreeWalk(repo)) {
            tw.addTree(commit.getTree());
            tw.setRecursive(true);
            while (tw.next()) {
                if (tw.getFileMode(0) == FileMode.GITLINK) {
                    continue;
                }
                byte[] content = readBlob(tw.getObjectId(0));
                pairs.add(filePairFactory.create(repositoryName, tw.getPathString(), null, content,
                        ModificationType.ADD));
            }
        }
        return pairs;
    }

    private List<FilePair> pairsOfDiff(RevCommit parent, RevCommit commit) throws IOException {
        final List<DiffEntry> entries;
        try (DiffFormatter formatter = new DiffFormatter(DisabledOutputStream.INSTANCE)) {
            formatter.setRepository(repo);
            formatter.setDetectRenames(false);
            entries = formatter.scan(parent.getTree(), commit.getTree());
        }
        List<FilePair> pairs = new ArrayList<>(entries.size());
        for (DiffEntry e : entries) {
            if (e.getOldMode() == FileMode.GITLINK || e.getNewMode() == FileMode.GITLINK) {
                LOG.debug("Skipping submodule " + e.getNewPath());
                continue;
            }
            final ModificationType type;
            final String path;
            switch (e.getChangeType()) {
                case ADD:
                    type = ModificationType.ADD;
                    path = e.getNewPath();
                    break;
                case DELETE:
                    type = ModificationType.DELETE;
                    path = e.getOldPath();
                    break;
                default:
                    type = ModificationType.MODIFY;
                    path = e.getNewPath();
                    break;
            }
            byte[] before = type == ModificationType.ADD ? null : readBlob(e.getOldId());
            byte[] after = type == ModificationType.DELETE ? null : readBlob(e.getNewId());
            pairs.add(filePairFactory.create(repositoryName, path, before, after, type));
        }
        return pairs;
    }

    private byte[] readBlob(AbbreviatedObjectId id) throws IOException {
        if (id == null || !id.isComplete()) {
            return null;
        }
        return readBlob(id.toObjectId());
    }

    /**
     * @return The blob's content, or <code>null</code> if the object is missing
     */
    private byte[] readBlob(ObjectId id) throws IOException {
        try {
            return repo.open(id).getBytes();
        } catch (MissingObjectException e) {
            LOG.warn("Missing blob " + id.getName() + " in repository " + repositoryName);
            return null;
        }
    }

    @Override
    public void close() {
        try {
            repo.close();
        } finally {
            git.close();
        }
    }
}
