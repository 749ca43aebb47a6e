package de.ovgu.bugfixminimizer.normalize;

import de.ovgu.bugfixminimizer.data.Language;
import de.ovgu.bugfixminimizer.diff.TextLines;
import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Removes regression tests that a fix adds to a test file: whole test functions, test methods and test classes whose
 * names do not occur in the before version.  Tests that existed before and were modified are kept.
 */
public class RegressionTestFilter {
    private static final Logger LOG = Logger.getLogger(RegressionTestFilter.class);

    private static final Pattern PYTHON_TEST_DEF = Pattern.compile("^(\\s*)(?:async\\s+)?def\\s+(test\\w*)\\s*\\(");
    private static final Pattern PYTHON_TEST_CLASS = Pattern.compile("^(\\s*)class\\s+(Test\\w*)\\s*[(:]");

    private static final Pattern TEST_ANNOTATION = Pattern.compile(
            "^\\s*(?:@(?:Test|ParameterizedTest|RepeatedTest)\\b"
                    + "|\\[(?:Test|Fact|Theory|TestMethod|DataTestMethod|TestCase)\\b[^\\]]*\\])");
    private static final Pattern GTEST_MACRO = Pattern.compile(
            "^\\s*(TEST|TEST_F|TEST_P|TYPED_TEST)\\s*\\(\\s*(\\w+)\\s*,\\s*(\\w+)\\s*\\)");
    private static final Pattern GO_TEST_FUNC = Pattern.compile("^\\s*func\\s+(Test\\w*)\\s*\\(");
    private static final Pattern CALLABLE_NAME = Pattern.compile("([A-Za-z_]\\w*)\\s*(?:<[^>()]*>)?\\s*\\(");

    public List<String> dropNewTests(String before, List<String> after, LanguageRules rules) {
        final BitSet drop;
        if (rules.getLanguage() == Language.PYTHON) {
            drop = newPythonTests(before, after);
        } else if (rules.getLanguage() == Language.C_FAMILY) {
            drop = newBraceTests(before, new SourceStructure(after, rules.getLexer()));
        } else {
            return after;
        }
        if (drop.isEmpty()) {
            return after;
        }
        LOG.debug("Dropping " + drop.cardinality() + " line(s) of new regression tests");
        List<String> result = new ArrayList<>(after.size() - drop.cardinality());
        for (int i = 0; i < after.size(); i++) {
            if (!drop.get(i)) {
                result.add(after.get(i));
            }
        }
        return result;
    }

    private static BitSet newPythonTests(String before, List<String> after) {
        BitSet drop = new BitSet(after.size());
        int line = 0;
        while (line < after.size()) {
            String current = after.get(line);
            Matcher def = PYTHON_TEST_DEF.matcher(current);
            Matcher cls = PYTHON_TEST_CLASS.matcher(current);
            final boolean isNewTest;
            if (def.find()) {
                isNewTest = !occursIn(before, "\\bdef\\s+" + Pattern.quote(def.group(2)) + "\\s*\\(");
            } else if (cls.find()) {
                isNewTest = !occursIn(before, "\\bclass\\s+" + Pattern.quote(cls.group(2)) + "\\b");
            } else {
                isNewTest = false;
            }
            if (!isNewTest) {
                line++;
                continue;
            }
            int indent = TextLines.indentation(current);
            int start = firstDecoratorLine(after, line, indent);
            int bodyStart = SourceStructure.endOfPythonHeader(after, line) + 1;
            int end = bodyStart;
            while (end < after.size()) {
                String l = after.get(end);
                if (!TextLines.isBlank(l) && TextLines.indentation(l) <= indent) {
                    break;
                }
                end++;
            }
            while (end > bodyStart && TextLines.isBlank(after.get(end - 1))) {
                end--;
            }
            drop.set(start, end);
            line = end;
        }
        return drop;
    }

    private static int firstDecoratorLine(List<String> lines, int defLine, int indent) {
        int start = defLine;
        for (int j = defLine - 1; j >= 0; j--) {
            String l = lines.get(j);
            if (TextLines.isBlank(l)) {
                break;
            }
            int ind = TextLines.indentation(l);
            String trimmed = l.trim();
            if (ind == indent && trimmed.startsWith("@")) {
                start = j;
            } else if (ind <= indent && !trimmed.startsWith(")")) {
                break;
            }
        }
        return start;
    }

    private static BitSet newBraceTests(String before, SourceStructure after) {
        List<String> lines = after.getLines();
        BitSet drop = new BitSet(lines.size());
        int line = 0;
        while (line < lines.size()) {
            String current = lines.get(line);
            int end = -1;
            Matcher gtest = GTEST_MACRO.matcher(current);
            Matcher goTest = GO_TEST_FUNC.matcher(current);
            if (gtest.find()) {
                String identity = "\\b" + gtest.group(1) + "\\s*\\(\\s*" + Pattern.quote(gtest.group(2))
                        + "\\s*,\\s*" + Pattern.quote(gtest.group(3)) + "\\s*\\)";
                if (!occursIn(before, identity)) {
                    end = after.endOfBraceBlock(line);
                }
            } else if (goTest.find()) {
                if (!occursIn(before, "\\bfunc\\s+" + Pattern.quote(goTest.group(1)) + "\\s*\\(")) {
                    end = after.endOfBraceBlock(line);
                }
            } else if (TEST_ANNOTATION.matcher(current).find()) {
                int signature = line + 1;
                while (signature < lines.size() && isAnnotationOrBlank(lines.get(signature))) {
                    signature++;
                }
                if (signature < lines.size()) {
                    Matcher name = CALLABLE_NAME.matcher(lines.get(signature));
                    if (name.find() && !occursIn(before, "\\b" + Pattern.quote(name.group(1)) + "\\b")) {
                        end = after.endOfBraceBlock(signature);
                    }
                }
            }
            if (end < 0) {
                line++;
                continue;
            }
            int start = line;
            while (start > 0 && TEST_ANNOTATION.matcher(lines.get(start - 1)).find()) {
                start--;
            }
            drop.set(start, end + 1);
            line = end + 1;
        }
        return drop;
    }

    private static boolean isAnnotationOrBlank(String line) {
        String trimmed = line.trim();
        return trimmed.isEmpty() || trimmed.startsWith("@") || trimmed.startsWith("[");
    }

    private static boolean occursIn(String text, String regex) {
        return Pattern.compile(regex).matcher(text).find();
    }
}
