package de.ovgu.bugfixminimizer.input;

import java.nio.file.Path;

/**
 * The curated dataset stores files of nested directories flat, encoding each directory separator of the original
 * path as <code>&gt;</code> (e.g., <code>src&gt;Simulation&gt;Z.cs</code> for <code>src/Simulation/Z.cs</code>).
 * Real subdirectories are accepted as well.
 */
public final class FlattenedPathCodec {
    public static final char FLAT_SEPARATOR = '>';

    private FlattenedPathCodec() {
    }

    /**
     * @param root Root of a before or after tree
     * @param file File below <code>root</code>
     * @return The original repository path of the file, with <code>/</code> as separator
     */
    public static String repositoryPath(Path root, Path file) {
        StringBuilder sb = new StringBuilder();
        for (Path part : root.relativize(file)) {
            if (sb.length() > 0) {
                sb.append('/');
            }
            sb.append(part.toString());
        }
        return decode(sb.toString());
    }

    public static String decode(String flattened) {
        return flattened.replace(FLAT_SEPARATOR, '/');
    }

    public static String encode(String repositoryPath) {
        return repositoryPath.replace('/', FLAT_SEPARATOR);
    }
}
