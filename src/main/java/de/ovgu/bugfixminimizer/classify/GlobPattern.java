package de.ovgu.bugfixminimizer.classify;

import java.util.regex.Pattern;

/**
 * A path glob, matched case-insensitively against paths that use <code>/</code> as separator.
 * <ul>
 * <li><code>**&#47;</code> matches zero or more directories</li>
 * <li><code>**</code> matches any sequence of characters, including <code>/</code></li>
 * <li><code>*</code> matches any sequence of characters except <code>/</code></li>
 * <li><code>?</code> matches a single character other than <code>/</code></li>
 * </ul>
 */
public final class GlobPattern {
    private final String glob;
    private final Pattern regex;

    public GlobPattern(String glob) {
        this.glob = glob;
        this.regex = Pattern.compile(toRegex(glob), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    public boolean matches(String path) {
        return regex.matcher(path).matches();
    }

    /**
     * @return <code>true</code> if the glob contains no directory part and should thus be matched against bare file
     * names
     */
    public boolean isFileNameGlob() {
        return glob.indexOf('/') < 0;
    }

    public String getGlob() {
        return glob;
    }

    static String toRegex(String glob) {
        StringBuilder sb = new StringBuilder();
        final int len = glob.length();
        int i = 0;
        while (i < len) {
            char c = glob.charAt(i);
            if (c == '*') {
                if (i + 1 < len && glob.charAt(i + 1) == '*') {
                    if (i + 2 < len && glob.charAt(i + 2) == '/') {
                        sb.append("(?:.*/)?");
                        i += 3;
                    } else {
                        sb.append(".*");
                        i += 2;
                    }
                    continue;
                }
                sb.append("[^/]*");
            } else if (c == '?') {
                sb.append("[^/]");
            } else {
                sb.append(Pattern.quote(String.valueOf(c)));
            }
            i++;
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return glob;
    }
}
