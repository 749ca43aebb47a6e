package de.ovgu.bugfixminimizer.equivalence;

import de.ovgu.bugfixminimizer.data.Language;
import de.ovgu.bugfixminimizer.diff.TextLines;
import de.ovgu.bugfixminimizer.normalize.LanguageRules;
import de.ovgu.bugfixminimizer.normalize.Segment;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Whitespace that does not separate tokens.  The canonical form keeps a single space only where two word tokens
 * meet or where two operator characters would otherwise fuse into a different operator, and keeps line breaks only
 * where they end a statement:
 * <ul>
 * <li>Python: line breaks outside of brackets, and the indentation of each logical line</li>
 * <li>C family: line breaks that end preprocessor directives; indentation is dropped</li>
 * <li>JavaScript, TypeScript, Go, Swift, Kotlin and Scala: also every line break outside of parentheses and square
 * brackets, since any of them may end a statement</li>
 * </ul>
 * In a <code>#define</code> directive, a space between the macro name and an opening parenthesis is kept, as it
 * separates an object-like macro from a function-like one.
 * Line comments always end a canonical line.  Blank lines are dropped.  String literals are kept verbatim.
 */
public class IncidentalWhitespacePattern implements EquivalencePattern {
    public static final String NAME = "incidental-whitespace";

    private static final char LINE_BREAK_IN_LITERAL = '\u0001';

    private static final Pattern DEFINE_NAME = Pattern.compile("#define [A-Za-z_$][\\w$]*");

    private static final Set<String> FUSING_OPERATORS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "++", "--", "<<", ">>", "<=", ">=", "==", "!=", "&&", "||", "->", "+=", "-=", "*=", "/=", "%=", "&=",
            "|=", "^=", "**", "//", "::", "..", "=>", "/*", "*/")));

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
        final String text = TextLines.join(lines);
        final boolean python = rules.getLanguage() == Language.PYTHON;
        Canonicalizer c = new Canonicalizer(python, !python && Language.endsStatementsAtLineBreaks(path));
        for (Segment s : rules.getLexer().lex(text)) {
            switch (s.getKind()) {
                case CODE:
                    c.code(text, s.getStart(), s.getEnd());
                    break;
                case STRING:
                case DOCSTRING:
                    c.visible(StringUtils.remove(s.textIn(text), '\r').replace('\n', LINE_BREAK_IN_LITERAL));
                    break;
                case COMMENT:
                    String comment = s.textIn(text);
                    c.comment(StringUtils.normalizeSpace(comment), python || comment.startsWith("//"));
                    break;
                default:
                    throw new IllegalStateException("Unhandled segment kind " + s.getKind());
            }
        }
        List<String> result = new ArrayList<>();
        for (String line : TextLines.split(c.out.toString())) {
            if (!TextLines.isBlank(line)) {
                result.add(line);
            }
        }
        return result;
    }

    static boolean needsSpace(char left, char right) {
        if (left == 0) {
            return false;
        }
        if (isWordChar(left) && isWordChar(right)) {
            return true;
        }
        return FUSING_OPERATORS.contains(new String(new char[]{left, right}));
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    private static final class Canonicalizer {
        private final boolean python;
        private final boolean lineBreaksEndStatements;
        private final StringBuilder out = new StringBuilder();
        private final StringBuilder indent = new StringBuilder();
        private boolean atLineStart = true;
        private boolean pendingSpace = false;
        private boolean breakAfterComment = false;
        private boolean continuation = false;
        private boolean inPreprocessor = false;
        private int depth = 0;
        private int parenDepth = 0;
        private char last = 0;

        Canonicalizer(boolean python, boolean lineBreaksEndStatements) {
            this.python = python;
            this.lineBreaksEndStatements = lineBreaksEndStatements;
        }

        void code(String text, int start, int end) {
            for (int i = start; i < end; i++) {
                char c = text.charAt(i);
                if (c == '\r') {
                    continue;
                }
                if (c == '\n') {
                    newline();
                } else if (c == ' ' || c == '\t' || c == '\f') {
                    if (atLineStart) {
                        if (python) {
                            indent.append(c);
                        }
                    } else {
                        pendingSpace = true;
                    }
                } else if (c == '\\' && (python || inPreprocessor) && nextIsLineBreak(text, i + 1, end)) {
                    continuation = true;
                } else {
                    visible(String.valueOf(c));
                    if (c == '(' || c == '[' || c == '{') {
                        depth++;
                    } else if ((c == ')' || c == ']' || c == '}') && depth > 0) {
                        depth--;
                    }
                    if (c == '(' || c == '[') {
                        parenDepth++;
                    } else if ((c == ')' || c == ']') && parenDepth > 0) {
                        parenDepth--;
                    }
                }
            }
        }

        private static boolean nextIsLineBreak(String text, int from, int end) {
            int i = from;
            if (i < end && text.charAt(i) == '\r') {
                i++;
            }
            return i < end && text.charAt(i) == '\n';
        }

        void visible(String token) {
            if (token.isEmpty()) {
                return;
            }
            final char first = token.charAt(0);
            if (atLineStart) {
                atLineStart = false;
                if (python) {
                    out.append(indent);
                    indent.setLength(0);
                } else if (first == '#') {
                    lineBreak();
                    inPreprocessor = true;
                } else if (pendingSpace && needsSpace(last, first)) {
                    out.append(' ');
                }
            } else if (pendingSpace && (needsSpace(last, first) || first == '(' && followsMacroName())) {
                out.append(' ');
            }
            pendingSpace = false;
            out.append(token);
            last = token.charAt(token.length() - 1);
        }

        void comment(String comment, boolean lineComment) {
            if (atLineStart) {
                atLineStart = false;
                indent.setLength(0);
            }
            pendingSpace = false;
            out.append(comment);
            last = comment.isEmpty() ? last : comment.charAt(comment.length() - 1);
            if (lineComment) {
                breakAfterComment = true;
            }
        }

        private void newline() {
            if (continuation) {
                continuation = false;
                pendingSpace = true;
                return;
            }
            if (breakAfterComment) {
                breakAfterComment = false;
                if (python && depth == 0) {
                    logicalBreak();
                } else {
                    lineBreak();
                    inPreprocessor = false;
                    atLineStart = !python;
                }
                return;
            }
            if (python) {
                if (depth == 0) {
                    logicalBreak();
                } else {
                    pendingSpace = true;
                }
            } else if (inPreprocessor || lineBreaksEndStatements && parenDepth == 0) {
                lineBreak();
                inPreprocessor = false;
                atLineStart = true;
            } else {
                atLineStart = true;
                pendingSpace = true;
            }
        }

        private boolean followsMacroName() {
            if (!inPreprocessor) {
                return false;
            }
            int lineStart = out.lastIndexOf("\n") + 1;
            return DEFINE_NAME.matcher(out.subSequence(lineStart, out.length())).matches();
        }

        private void logicalBreak() {
            lineBreak();
            atLineStart = true;
            indent.setLength(0);
        }

        private void lineBreak() {
            if (out.length() > 0 && out.charAt(out.length() - 1) != '\n') {
                out.append('\n');
            }
            pendingSpace = false;
            last = 0;
        }
    }
}
