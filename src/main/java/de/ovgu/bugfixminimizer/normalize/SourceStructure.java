package de.ovgu.bugfixminimizer.normalize;

import de.ovgu.bugfixminimizer.data.Language;
import de.ovgu.bugfixminimizer.diff.TextLines;

import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented view of a source text together with its lexical segments.  Answers the structural questions the
 * normalization filters ask: where functions are defined, which lines hold only comments, where a brace block ends.
 */
final class SourceStructure {
    private static final Pattern PYTHON_DEF = Pattern.compile("^\\s*(?:async\\s+)?def\\s+([A-Za-z_]\\w*)\\s*\\(");
    private static final Pattern C_FAMILY_DEF = Pattern.compile(
            "^\\s*(?:[\\w:<>\\[\\],*&~.]+\\s+)+([A-Za-z_]\\w*)\\s*(?:<[^>()]*>)?\\s*\\(");
    private static final Set<String> NOT_A_DEFINITION = new HashSet<>(Arrays.asList(
            "if", "else", "for", "foreach", "while", "do", "switch", "case", "return", "new", "throw", "catch",
            "using", "sizeof", "typeof", "delete", "await", "yield", "goto", "elif", "lock", "fixed", "in",
            "repeat", "until", "within", "apply", "let", "mutable", "set", "use", "borrow"));

    private final List<String> lines;
    private final String text;
    private final LineIndex index;
    private final List<Segment> segments;
    private boolean[] commentOnly;

    SourceStructure(List<String> lines, SourceLexer lexer) {
        this.lines = lines;
        this.text = TextLines.join(lines);
        this.index = new LineIndex(text);
        this.segments = lexer.lex(text);
    }

    List<String> getLines() {
        return lines;
    }

    List<Segment> getSegments() {
        return segments;
    }

    int lineOf(int offset) {
        return index.lineOf(offset);
    }

    int lineStart(int line) {
        return index.lineStart(line);
    }

    String getText() {
        return text;
    }

    /**
     * @return Name of the function defined on the given line, or <code>null</code> if the line does not start a
     * function definition
     */
    static String definedFunction(String line, Language language) {
        if (language == Language.PYTHON) {
            Matcher m = PYTHON_DEF.matcher(line);
            return m.find() ? m.group(1) : null;
        }
        if (language != Language.C_FAMILY) {
            return null;
        }
        String trimmed = line.trim();
        if (trimmed.startsWith("*") || trimmed.startsWith("/") || trimmed.startsWith("#")
                || trimmed.endsWith(";")) {
            return null;
        }
        Matcher m = C_FAMILY_DEF.matcher(line);
        if (!m.find()) {
            return null;
        }
        String firstWord = trimmed.split("[^\\w]", 2)[0];
        String name = m.group(1);
        if (NOT_A_DEFINITION.contains(firstWord) || NOT_A_DEFINITION.contains(name)) {
            return null;
        }
        return name;
    }

    static Set<String> definedFunctions(List<String> lines, Language language) {
        Set<String> result = new LinkedHashSet<>();
        for (String line : lines) {
            String name = definedFunction(line, language);
            if (name != null) {
                result.add(name);
            }
        }
        return result;
    }

    /**
     * @return For each line, whether all its non-blank content lies in comments.  Blank lines are not comment lines.
     */
    boolean[] commentOnlyLines() {
        if (commentOnly == null) {
            commentOnly = computeCommentOnlyLines();
        }
        return commentOnly;
    }

    private boolean[] computeCommentOnlyLines() {
        boolean[] hasComment = new boolean[lines.size()];
        boolean[] hasOther = new boolean[lines.size()];
        for (Segment s : segments) {
            boolean comment = s.isCommentLike();
            for (int i = s.getStart(); i < s.getEnd(); i++) {
                char ch = text.charAt(i);
                if (Character.isWhitespace(ch)) {
                    continue;
                }
                int line = index.lineOf(i);
                if (comment) {
                    hasComment[line] = true;
                } else {
                    hasOther[line] = true;
                }
            }
        }
        boolean[] result = new boolean[lines.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = hasComment[i] && !hasOther[i];
        }
        return result;
    }

    /**
     * @return The docstring segment that starts on the given line, or <code>null</code>
     */
    Segment docstringStartingOn(int line) {
        for (Segment s : segments) {
            if (s.getKind() == Segment.Kind.DOCSTRING && index.lineOf(s.getStart()) == line) {
                return s;
            }
        }
        return null;
    }

    /**
     * @return Line holding the closing brace of the first brace block that opens at or after the start of
     * <code>fromLine</code>, or <code>-1</code> if there is no such block or it never closes
     */
    int endOfBraceBlock(int fromLine) {
        final int from = index.lineStart(fromLine);
        int depth = 0;
        boolean opened = false;
        for (Segment s : segments) {
            if (s.getKind() != Segment.Kind.CODE || s.getEnd() <= from) {
                continue;
            }
            for (int i = Math.max(from, s.getStart()); i < s.getEnd(); i++) {
                char ch = text.charAt(i);
                if (ch == '{') {
                    depth++;
                    opened = true;
                } else if (ch == '}' && opened) {
                    depth--;
                    if (depth == 0) {
                        return index.lineOf(i);
                    }
                }
            }
        }
        return -1;
    }

    /**
     * @return The last line of the header of the Python definition that starts on <code>defLine</code>: the line
     * where all brackets are closed again
     */
    int endOfPythonHeader(int defLine) {
        return endOfPythonHeader(lines, defLine);
    }

    static int endOfPythonHeader(List<String> lines, int defLine) {
        int depth = 0;
        for (int line = defLine; line < lines.size(); line++) {
            for (char ch : lines.get(line).toCharArray()) {
                if (ch == '(' || ch == '[' || ch == '{') {
                    depth++;
                } else if (ch == ')' || ch == ']' || ch == '}') {
                    depth--;
                }
            }
            if (depth <= 0) {
                return line;
            }
        }
        return lines.size() - 1;
    }
}
