package de.ovgu.bugfixminimizer.normalize;

import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Undoes debug statements that were merely switched on or off: an after line that is the commented-out form of a
 * live debug print of the before version, or the live form of a commented-out one, is replaced by the before line.
 * Debug prints without a counterpart in the before version are left alone.
 */
public class DebugStatementFilter {
    private static final Logger LOG = Logger.getLogger(DebugStatementFilter.class);

    public List<String> revertToggledDebugStatements(List<String> before, List<String> after, LanguageRules rules) {
        final String marker = rules.getLineCommentMarker();
        if (marker == null) {
            return after;
        }

        Set<String> beforeVerbatim = new HashSet<>(before);
        Map<String, String> liveInBefore = new HashMap<>();
        Map<String, String> commentedInBefore = new HashMap<>();
        for (String line : before) {
            String trimmed = line.trim();
            String uncommented = uncomment(trimmed, marker);
            if (uncommented == null) {
                liveInBefore.putIfAbsent(trimmed, line);
            } else {
                commentedInBefore.putIfAbsent(uncommented, line);
            }
        }

        List<String> result = new ArrayList<>(after.size());
        for (String line : after) {
            result.add(beforeVerbatim.contains(line) ? line
                    : counterpartOf(line, marker, liveInBefore, commentedInBefore, rules));
        }
        return result;
    }

    private static String counterpartOf(String line, String marker, Map<String, String> liveInBefore,
                                        Map<String, String> commentedInBefore, LanguageRules rules) {
        final String trimmed = line.trim();
        String uncommented = uncomment(trimmed, marker);
        final String replacement;
        if (uncommented != null) {
            replacement = rules.isDebugStatement(uncommented) ? liveInBefore.get(uncommented) : null;
        } else {
            replacement = rules.isDebugStatement(trimmed) ? commentedInBefore.get(trimmed) : null;
        }
        if (replacement == null) {
            return line;
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("Reverting toggled debug statement `" + trimmed + "'");
        }
        return replacement;
    }

    /**
     * @return The line without its comment marker, or <code>null</code> if the line is not commented out
     */
    static String uncomment(String trimmedLine, String marker) {
        if (trimmedLine.startsWith(marker)) {
            return trimmedLine.substring(marker.length()).trim();
        }
        if ("//".equals(marker) && trimmedLine.startsWith("/*") && trimmedLine.endsWith("*/")
                && trimmedLine.length() >= 4) {
            return trimmedLine.substring(2, trimmedLine.length() - 2).trim();
        }
        return null;
    }
}
