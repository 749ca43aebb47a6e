package de.ovgu.bugfixminimizer.classify;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Recognizes artifacts that are regenerated mechanically from source code, such as recorded JSON mocks of a backend.
 * Each repository may have its own list of path globs; repositories without one use the default list.
 */
public class DerivedArtifactRule {
    private final List<GlobPattern> defaultPatterns;
    private final Map<String, List<GlobPattern>> patternsByRepository;

    public DerivedArtifactRule(Collection<String> defaultGlobs, Map<String, ? extends Collection<String>> globsByRepository) {
        this.defaultPatterns = compile(defaultGlobs);
        Map<String, List<GlobPattern>> byRepo = new HashMap<>();
        for (Map.Entry<String, ? extends Collection<String>> e : globsByRepository.entrySet()) {
            byRepo.put(e.getKey(), compile(e.getValue()));
        }
        this.patternsByRepository = Collections.unmodifiableMap(byRepo);
    }

    private static List<GlobPattern> compile(Collection<String> globs) {
        List<GlobPattern> result = new ArrayList<>(globs.size());
        for (String g : globs) {
            result.add(new GlobPattern(g));
        }
        return Collections.unmodifiableList(result);
    }

    public boolean isDerivedArtifact(String repository, String path) {
        List<GlobPattern> patterns = patternsByRepository.getOrDefault(repository, defaultPatterns);
        String fileName = path.substring(path.lastIndexOf('/') + 1);
        for (GlobPattern p : patterns) {
            if (p.isFileNameGlob() ? p.matches(fileName) : p.matches(path)) {
                return true;
            }
        }
        return false;
    }
}
