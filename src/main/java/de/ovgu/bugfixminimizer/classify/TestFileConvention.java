package de.ovgu.bugfixminimizer.classify;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Decides by path alone whether a file belongs to a test suite: either one of its directories carries a test name,
 * or its file name follows a test naming convention.
 */
public class TestFileConvention {
    private final Set<String> testDirectoryNames;
    private final List<GlobPattern> fileNamePatterns;

    public TestFileConvention(Collection<String> testDirectoryNames, Collection<String> fileNameGlobs) {
        Set<String> dirs = new HashSet<>();
        for (String d : testDirectoryNames) {
            dirs.add(d.toLowerCase(Locale.ROOT));
        }
        this.testDirectoryNames = Collections.unmodifiableSet(dirs);
        List<GlobPattern> patterns = new ArrayList<>();
        for (String g : fileNameGlobs) {
            patterns.add(new GlobPattern(g));
        }
        this.fileNamePatterns = Collections.unmodifiableList(patterns);
    }

    public boolean isTestPath(String path) {
        String[] segments = path.split("/");
        final int lastDir = segments.length - 1;
        for (int i = 0; i < lastDir; i++) {
            if (testDirectoryNames.contains(segments[i].toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        String fileName = segments[lastDir];
        for (GlobPattern p : fileNamePatterns) {
            if (p.isFileNameGlob() ? p.matches(fileName) : p.matches(path)) {
                return true;
            }
        }
        return false;
    }
}
