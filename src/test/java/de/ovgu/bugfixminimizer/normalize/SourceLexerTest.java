package de.ovgu.bugfixminimizer.normalize;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SourceLexerTest {

    private static List<String> textsOf(SourceLexer lexer, String text, Segment.Kind kind) {
        List<String> result = new ArrayList<>();
        for (Segment s : lexer.lex(text)) {
            if (s.getKind() == kind) {
                result.add(s.textIn(text));
            }
        }
        return result;
    }

    @Test
    void segmentsCoverTheWholeText() {
        String text = "x = '#' # comment\ny = \"\"\"doc\n\"\"\"\n";
        List<Segment> segments = new PythonLexer().lex(text);
        int expectedStart = 0;
        for (Segment s : segments) {
            assertThat(s.getStart()).isEqualTo(expectedStart);
            expectedStart = s.getEnd();
        }
        assertThat(expectedStart).isEqualTo(text.length());
    }

    @Test
    void pythonHashInsideStringIsNoComment() {
        String text = "x = '#not a comment'  # real comment\n";
        PythonLexer lexer = new PythonLexer();
        assertThat(textsOf(lexer, text, Segment.Kind.COMMENT)).containsExactly("# real comment");
        assertThat(textsOf(lexer, text, Segment.Kind.STRING)).containsExactly("'#not a comment'");
    }

    @Test
    void pythonStandaloneStringIsDocstring() {
        String text = "def f():\n    \"\"\"Does f.\n    \"\"\"\n    return g(\"\"\"not a doc\"\"\")\n";
        PythonLexer lexer = new PythonLexer();
        assertThat(textsOf(lexer, text, Segment.Kind.DOCSTRING)).containsExactly("\"\"\"Does f.\n    \"\"\"");
        assertThat(textsOf(lexer, text, Segment.Kind.STRING)).containsExactly("\"\"\"not a doc\"\"\"");
    }

    @Test
    void pythonPrefixedStringsAreStrings() {
        String text = "p = rb'\\d#' + f\"{x}\"\n";
        assertThat(textsOf(new PythonLexer(), text, Segment.Kind.STRING)).containsExactly("rb'\\d#'", "f\"{x}\"");
        assertThat(textsOf(new PythonLexer(), text, Segment.Kind.COMMENT)).isEmpty();
    }

    @Test
    void cStyleRecognizesBothCommentForms() {
        String text = "int a = 1; // one\n/* two\n   lines */ int b = '/';\n";
        CStyleLexer lexer = new CStyleLexer();
        assertThat(textsOf(lexer, text, Segment.Kind.COMMENT)).containsExactly("// one", "/* two\n   lines */");
        assertThat(textsOf(lexer, text, Segment.Kind.STRING)).containsExactly("'/'");
    }

    @Test
    void cStyleCommentMarkersInsideStringsAreCode() {
        String text = "var url = \"http://example.org\"; var v = @\"C:\\\"\"\"; // done\n";
        CStyleLexer lexer = new CStyleLexer();
        assertThat(textsOf(lexer, text, Segment.Kind.COMMENT)).containsExactly("// done");
        assertThat(textsOf(lexer, text, Segment.Kind.STRING))
                .containsExactly("\"http://example.org\"", "@\"C:\\\"\"\"");
    }

    @Test
    void cStyleDigitSeparatorsAreNoCharLiterals() {
        String text = "auto n = 1'000'000; // big\n";
        assertThat(textsOf(new CStyleLexer(), text, Segment.Kind.STRING)).isEmpty();
        assertThat(textsOf(new CStyleLexer(), text, Segment.Kind.COMMENT)).containsExactly("// big");
    }

    @Test
    void hashCommentNeedsPrecedingWhitespace() {
        String text = "url=http://x/#anchor # note\n";
        assertThat(textsOf(new HashCommentLexer(), text, Segment.Kind.COMMENT)).containsExactly("# note");
    }
}
