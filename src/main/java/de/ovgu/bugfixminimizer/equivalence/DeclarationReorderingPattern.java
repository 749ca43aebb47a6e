package de.ovgu.bugfixminimizer.equivalence;

import de.ovgu.bugfixminimizer.data.Language;
import de.ovgu.bugfixminimizer.normalize.LanguageRules;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Import, include and using declarations that were merely reordered.  Declarations are sorted within each contiguous
 * run of declaration lines, where blank and comment lines may sit between them.  Runs keep their place among the
 * other lines, so no declaration moves past code or a preprocessor conditional.  The names within a Python import
 * statement are sorted as well.
 */
public class DeclarationReorderingPattern implements EquivalencePattern {
    public static final String NAME = "declaration-reordering";

    private static final Pattern PYTHON_FROM_IMPORT = Pattern.compile("^from\\s+(\\S+)\\s+import\\s+(.+)$");
    private static final Pattern PYTHON_IMPORT = Pattern.compile("^import\\s+(.+)$");

    private static final List<Pattern> C_FAMILY_DECLARATIONS = Collections.unmodifiableList(Arrays.asList(
            Pattern.compile("^\\s*#\\s*include\\s*[<\"].*$"),
            Pattern.compile("^\\s*(?:global\\s+)?using\\s+(?:static\\s+)?[\\w.]+(?:\\s*=\\s*[\\w.<>, ]+)?\\s*;\\s*$"),
            Pattern.compile("^\\s*import\\s+(?:static\\s+)?[\\w.*]+\\s*;\\s*$"),
            Pattern.compile("^\\s*import\\s+.*\\bfrom\\s+['\"][^'\"]+['\"]\\s*;?\\s*$"),
            Pattern.compile("^\\s*import\\s+['\"][^'\"]+['\"]\\s*;?\\s*$"),
            Pattern.compile("^\\s*open\\s+[\\w.]+\\s*;\\s*$"),
            Pattern.compile("^\\s*use\\s+[\\w:{}, *]+\\s*;\\s*$")));

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean appliesTo(Language language) {
        return language == Language.PYTHON || language == Language.C_FAMILY;
    }

    @Override
    public List<String> canonicalize(List<String> lines, LanguageRules rules, String path) {
        final boolean python = rules.getLanguage() == Language.PYTHON;
        List<String> result = new ArrayList<>(lines.size());
        List<String> run = new ArrayList<>();
        List<String> interspersed = new ArrayList<>();
        List<String> pending = new ArrayList<>();
        boolean changed = false;
        int i = 0;
        while (i < lines.size()) {
            String line = lines.get(i);
            int consumed = declarationAt(lines, i, python, run);
            if (consumed > 0) {
                interspersed.addAll(pending);
                pending.clear();
                i += consumed;
                continue;
            }
            if (!run.isEmpty() && isFiller(line, python)) {
                pending.add(line);
                i++;
                continue;
            }
            changed |= flushRun(run, interspersed, result);
            result.addAll(pending);
            pending.clear();
            result.add(line);
            i++;
        }
        changed |= flushRun(run, interspersed, result);
        result.addAll(pending);
        return changed ? result : lines;
    }

    /**
     * Appends the sorted declarations of a run followed by the blank and comment lines found between them, then
     * empties the run.
     *
     * @return <code>true</code> if the run contained any declaration
     */
    private static boolean flushRun(List<String> run, List<String> interspersed, List<String> result) {
        if (run.isEmpty()) {
            return false;
        }
        Collections.sort(run);
        result.addAll(run);
        result.addAll(interspersed);
        run.clear();
        interspersed.clear();
        return true;
    }

    private static int declarationAt(List<String> lines, int start, boolean python, List<String> run) {
        if (python) {
            return collectPythonImport(lines, start, run);
        }
        String line = lines.get(start);
        if (isCFamilyDeclaration(line)) {
            run.add(StringUtils.normalizeSpace(line));
            return 1;
        }
        return 0;
    }

    /**
     * Blank and comment lines may separate the declarations of one run.  Preprocessor directives other than
     * includes are neither, so a conditional always ends a run.
     */
    private static boolean isFiller(String line, boolean python) {
        String s = line.trim();
        if (s.isEmpty()) {
            return true;
        }
        if (python) {
            return s.startsWith("#");
        }
        return s.startsWith("//") || s.startsWith("/*") || s.startsWith("*");
    }

    private static boolean isCFamilyDeclaration(String line) {
        for (Pattern p : C_FAMILY_DECLARATIONS) {
            if (p.matcher(line).matches()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Recognizes an unindented Python import statement starting at <code>start</code>, including parenthesized
     * name lists spanning several lines.  Single-line statements carrying a comment are left in place.
     *
     * @return Number of lines the statement spans, or 0 if there is none
     */
    private static int collectPythonImport(List<String> lines, int start, List<String> declarations) {
        final boolean commented = lines.get(start).indexOf('#') >= 0;
        String line = stripComment(lines.get(start));
        if (line.isEmpty() || Character.isWhitespace(line.charAt(0)) || line.endsWith("\\")) {
            return 0;
        }
        Matcher from = PYTHON_FROM_IMPORT.matcher(line);
        if (from.matches()) {
            String names = from.group(2).trim();
            int consumed = 1;
            if (names.startsWith("(")) {
                StringBuilder sb = new StringBuilder(names);
                while (sb.indexOf(")") < 0 && start + consumed < lines.size()) {
                    sb.append(' ').append(stripComment(lines.get(start + consumed)));
                    consumed++;
                }
                names = StringUtils.strip(sb.toString().trim(), "()");
            } else if (commented) {
                return 0;
            }
            declarations.add("from " + from.group(1) + " import " + sortedNames(names));
            return consumed;
        }
        Matcher plain = PYTHON_IMPORT.matcher(line);
        if (plain.matches() && !commented) {
            declarations.add("import " + sortedNames(plain.group(1)));
            return 1;
        }
        return 0;
    }

    private static String sortedNames(String nameList) {
        List<String> names = new ArrayList<>();
        for (String n : StringUtils.split(nameList, ',')) {
            String normalized = StringUtils.normalizeSpace(n);
            if (!normalized.isEmpty()) {
                names.add(normalized);
            }
        }
        Collections.sort(names);
        return String.join(", ", names);
    }

    private static String stripComment(String line) {
        int hash = line.indexOf('#');
        return StringUtils.stripEnd(hash < 0 ? line : line.substring(0, hash), null);
    }
}
