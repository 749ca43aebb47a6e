package de.ovgu.bugfixminimizer.input;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Contents of the <code>metadata.json</code> file of a curated commit.  All fields are optional.
 */
public final class CommitMetadata {
    public static final CommitMetadata EMPTY = new CommitMetadata(null, null, null, null, null, null,
            Collections.emptySet(), null);

    private final String id;
    private final String humanId;
    private final String projectName;
    private final String commitHash;
    private final Integer parents;
    private final Boolean bugInTestCode;
    private final Set<String> modifiedFiles;
    private final String issueReference;

    public CommitMetadata(String id, String humanId, String projectName, String commitHash, Integer parents,
                          Boolean bugInTestCode, Set<String> modifiedFiles, String issueReference) {
        this.id = id;
        this.humanId = humanId;
        this.projectName = projectName;
        this.commitHash = commitHash;
        this.parents = parents;
        this.bugInTestCode = bugInTestCode;
        this.modifiedFiles = Collections.unmodifiableSet(new LinkedHashSet<>(modifiedFiles));
        this.issueReference = issueReference;
    }

    public Optional<String> getId() {
        return Optional.ofNullable(id);
    }

    public Optional<String> getHumanId() {
        return Optional.ofNullable(humanId);
    }

    public Optional<String> getProjectName() {
        return Optional.ofNullable(projectName);
    }

    public Optional<String> getCommitHash() {
        return Optional.ofNullable(commitHash);
    }

    /**
     * @return Number of parents of the commit, 1 unless stated otherwise
     */
    public int getParents() {
        return parents == null ? 1 : parents;
    }

    public Optional<Boolean> getBugInTestCode() {
        return Optional.ofNullable(bugInTestCode);
    }

    /**
     * @return Repository paths the commit is known to modify.  A file listed here must have both sides.
     */
    public Set<String> getModifiedFiles() {
        return modifiedFiles;
    }

    public Optional<String> getIssueReference() {
        return Optional.ofNullable(issueReference);
    }
}
