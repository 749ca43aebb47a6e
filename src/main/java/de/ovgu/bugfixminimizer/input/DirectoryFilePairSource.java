package de.ovgu.bugfixminimizer.input;

import de.ovgu.bugfixminimizer.data.Commit;
import de.ovgu.bugfixminimizer.data.CommitId;
import de.ovgu.bugfixminimizer.data.FilePair;
import de.ovgu.bugfixminimizer.data.ModificationType;
import de.ovgu.bugfixminimizer.data.SourceState;
import de.ovgu.bugfixminimizer.error.ZeroFileCommitException;
import org.apache.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads commits from a curated dataset laid out as
 * <pre>
 * &lt;dataset&gt;/&lt;repository&gt;/&lt;human id&gt;/before/...
 *                                   /after/...
 *                                   /metadata.json
 *                                   /rendered/{before,branch-tip,after}/...
 * </pre>
 * The <code>rendered</code> trees hold the content shown by the hosting platform for merge commits and are only used
 * when the metadata reports more than one parent.
 */
public class DirectoryFilePairSource implements FilePairSource {
    private static final Logger LOG = Logger.getLogger(DirectoryFilePairSource.class);

    public static final String DIR_BEFORE = "before";
    public static final String DIR_AFTER = "after";
    public static final String DIR_RENDERED = "rendered";
    public static final String DIR_BRANCH_TIP = "branch-tip";

    private final File datasetDir;
    private final FilePairFactory filePairFactory;
    private final CommitMetadataReader metadataReader = new CommitMetadataReader();
    /**
     * Restricts the commits to those listed, if not <code>null</code>.  Keyed by repository and human ID.
     */
    private final Map<String, CommitListEntry> commitList;
    private final String repositoryFilter;

    private final Map<CommitId, CommitLocation> locations = new HashMap<>();

    private static final class CommitLocation {
        final File dir;
        final CommitMetadata metadata;
        final CommitListEntry listEntry;

        CommitLocation(File dir, CommitMetadata metadata, CommitListEntry listEntry) {
            this.dir = dir;
            this.metadata = metadata;
            this.listEntry = listEntry;
        }
    }

    /**
     * @param commitList       Commits to process, or <code>null</code> to process all commits of the dataset
     * @param repositoryFilter Name of the only repository to process, or <code>null</code>
     */
    public DirectoryFilePairSource(File datasetDir, FilePairFactory filePairFactory, List<CommitListEntry> commitList,
                                   String repositoryFilter) {
        this.datasetDir = datasetDir;
        this.filePairFactory = filePairFactory;
        this.repositoryFilter = repositoryFilter;
        if (commitList == null) {
            this.commitList = null;
        } else {
            this.commitList = new HashMap<>();
            for (CommitListEntry e : commitList) {
                this.commitList.put(listKey(e.getRepository(), e.getHumanId()), e);
            }
        }
    }

    private static String listKey(String repository, String humanId) {
        return repository + "\u0000" + humanId;
    }

    @Override
    public synchronized List<CommitId> listCommits() throws IOException {
        if (!datasetDir.isDirectory()) {
            throw new IOException("Not a directory: " + datasetDir.getAbsolutePath());
        }
        locations.clear();
        for (File repoDir : sortedSubdirectories(datasetDir)) {
            final String repository = repoDir.getName();
            if (repositoryFilter != null && !repositoryFilter.equals(repository)) {
                continue;
            }
            for (File commitDir : sortedSubdirectories(repoDir)) {
                if (!isCommitDir(commitDir)) {
                    LOG.debug("Ignoring directory " + commitDir);
                    continue;
                }
                final String humanId = commitDir.getName();
                CommitListEntry entry = null;
                if (commitList != null) {
                    entry = commitList.get(listKey(repository, humanId));
                    if (entry == null) {
                        continue;
                    }
                }
                CommitMetadata metadata = metadataReader.read(commitDir);
                String hash = metadata.getCommitHash().orElse(entry == null ? "" : entry.getCommitHash());
                locations.put(new CommitId(repository, hash, humanId), new CommitLocation(commitDir, metadata, entry));
            }
        }
        warnAboutMissingListedCommits();
        List<CommitId> result = new ArrayList<>(locations.keySet());
        Collections.sort(result);
        LOG.info("Found " + result.size() + " commit(s) in " + datasetDir);
        return result;
    }

    private void warnAboutMissingListedCommits() {
        if (commitList == null) {
            return;
        }
        TreeSet<String> found = new TreeSet<>();
        for (CommitId id : locations.keySet()) {
            found.add(listKey(id.getRepository(), id.getHumanId()));
        }
        for (CommitListEntry e : commitList.values()) {
            if (!found.contains(listKey(e.getRepository(), e.getHumanId()))) {
                LOG.warn("Listed commit not found in dataset: " + e.getRepository() + " " + e.getHumanId());
            }
        }
    }

    private static boolean isCommitDir(File dir) {
        return new File(dir, DIR_BEFORE).isDirectory() || new File(dir, DIR_AFTER).isDirectory()
                || new File(dir, DIR_RENDERED).isDirectory();
    }

    private static List<File> sortedSubdirectories(File dir) {
        File[] children = dir.listFiles(File::isDirectory);
        if (children == null) {
            return Collections.emptyList();
        }
        Arrays.sort(children);
        return Arrays.asList(children);
    }

    @Override
    public Commit load(CommitId commitId) throws ZeroFileCommitException, IOException {
        final CommitLocation location;
        synchronized (this) {
            location = locations.get(commitId);
        }
        if (location == null) {
            throw new IOException("Unknown commit " + commitId + ". Call listCommits() first.");
        }
        final CommitMetadata metadata = location.metadata;
        final int parents = metadata.getParents();

        final SourceState state;
        final File beforeDir;
        final File afterDir;
        if (parents > 1) {
            state = SourceState.FALLBACK_REQUIRED;
            File rendered = new File(location.dir, DIR_RENDERED);
            beforeDir = firstDirectory(new File(rendered, DIR_BEFORE), new File(rendered, DIR_BRANCH_TIP),
                    new File(location.dir, DIR_BEFORE));
            afterDir = firstDirectory(new File(rendered, DIR_AFTER), new File(location.dir, DIR_AFTER));
            LOG.info(commitId + " has " + parents + " parents. Reading before side from " + beforeDir
                    + " and after side from " + afterDir);
        } else {
            state = SourceState.MINED_DIFF_AVAILABLE;
            beforeDir = new File(location.dir, DIR_BEFORE);
            afterDir = new File(location.dir, DIR_AFTER);
        }

        Map<String, Path> beforeFiles = listFiles(beforeDir);
        Map<String, Path> afterFiles = listFiles(afterDir);
        TreeSet<String> paths = new TreeSet<>(beforeFiles.keySet());
        paths.addAll(afterFiles.keySet());

        List<FilePair> pairs = new ArrayList<>(paths.size());
        for (String path : paths) {
            Path before = beforeFiles.get(path);
            Path after = afterFiles.get(path);
            ModificationType type = modificationType(path, before != null, after != null, metadata);
            pairs.add(filePairFactory.create(commitId.getRepository(), path,
                    before == null ? null : TextFileReader.readBytes(before),
                    after == null ? null : TextFileReader.readBytes(after),
                    type));
        }

        if (pairs.isEmpty() && parents <= 1) {
            throw new ZeroFileCommitException(commitId);
        }

        boolean bugInTestCode = bugInTestCode(location);
        String issueReference = metadata.getIssueReference().orElse("");
        return new Commit(commitId, pairs, parents, bugInTestCode, state, issueReference);
    }

    private static boolean bugInTestCode(CommitLocation location) {
        if (location.listEntry != null && location.listEntry.getBugInTestCode().isPresent()) {
            return location.listEntry.getBugInTestCode().get();
        }
        return location.metadata.getBugInTestCode().orElse(false);
    }

    private static ModificationType modificationType(String path, boolean hasBefore, boolean hasAfter,
                                                     CommitMetadata metadata) {
        if (hasBefore && hasAfter) {
            return ModificationType.MODIFY;
        }
        if (metadata.getModifiedFiles().contains(path)) {
            return ModificationType.MODIFY;
        }
        return hasAfter ? ModificationType.ADD : ModificationType.DELETE;
    }

    private static File firstDirectory(File... candidates) {
        for (File f : candidates) {
            if (f.isDirectory()) {
                return f;
            }
        }
        return candidates[candidates.length - 1];
    }

    /**
     * @return Regular files below <code>root</code>, keyed by their repository path
     */
    private static Map<String, Path> listFiles(File root) throws IOException {
        if (!root.isDirectory()) {
            return Collections.emptyMap();
        }
        final Path rootPath = root.toPath();
        try (Stream<Path> files = Files.walk(rootPath)) {
            List<Path> regularFiles = files.filter(Files::isRegularFile).collect(Collectors.toList());
            Map<String, Path> result = new TreeMap<>();
            for (Path p : regularFiles) {
                result.put(FlattenedPathCodec.repositoryPath(rootPath, p), p);
            }
            return result;
        }
    }

    @Override
    public void close() {
        synchronized (this) {
            locations.clear();
        }
    }
}
