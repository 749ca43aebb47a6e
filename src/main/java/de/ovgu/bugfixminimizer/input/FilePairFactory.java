package de.ovgu.bugfixminimizer.input;

import de.ovgu.bugfixminimizer.classify.ClassificationRules;
import de.ovgu.bugfixminimizer.data.FilePair;
import de.ovgu.bugfixminimizer.data.ModificationType;
import de.ovgu.bugfixminimizer.error.EncodingException;
import org.apache.log4j.Logger;

/**
 * Builds file pairs from raw file contents: decodes both sides and derives the path-based flags from the
 * classification rules of the commit's repository.
 */
public class FilePairFactory {
    private static final Logger LOG = Logger.getLogger(FilePairFactory.class);

    private final ClassificationRules rules;

    public FilePairFactory(ClassificationRules rules) {
        this.rules = rules;
    }

    /**
     * @param before Content of the before side, <code>null</code> if absent
     * @param after  Content of the after side, <code>null</code> if absent
     */
    public FilePair create(String repository, String path, byte[] before, byte[] after, ModificationType type) {
        final boolean testFile = rules.isTestFile(path);
        final boolean derived = rules.isDerivedArtifact(repository, path);
        try {
            String beforeText = before == null ? null : TextFileReader.decode(before, "before version of " + path);
            String afterText = after == null ? null : TextFileReader.decode(after, "after version of " + path);
            return new FilePair(path, beforeText, afterText, type, testFile, derived);
        } catch (EncodingException e) {
            LOG.debug("Cannot decode " + path, e);
            return FilePair.undecodable(path, type, testFile, derived, e.getMessage());
        }
    }
}
