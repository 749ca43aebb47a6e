package de.ovgu.bugfixminimizer.normalize;

import de.ovgu.bugfixminimizer.data.Language;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * The language-specific strategies used during normalization, looked up per {@link Language}.  Files of unknown
 * language get conservative rules that only touch blank lines.
 */
public final class LanguageRules {
    private static final Map<Language, LanguageRules> REGISTRY = new EnumMap<>(Language.class);

    static {
        BlankLineStripper blankLines = new AddedBlankLineStripper();

        SourceLexer python = new PythonLexer();
        REGISTRY.put(Language.PYTHON, new LanguageRules(Language.PYTHON, python,
                new LexingCommentStripper(python), blankLines, "#", patterns(
                "(?:print|pprint|pp|breakpoint|ic)\\s*\\(.*",
                "(?:logging|logger|log|LOG|LOGGER)\\.debug\\s*\\(.*",
                "(?:i?pdb)\\.set_trace\\s*\\(.*",
                "import\\s+i?pdb\\b.*"), true));

        SourceLexer cStyle = new CStyleLexer();
        REGISTRY.put(Language.C_FAMILY, new LanguageRules(Language.C_FAMILY, cStyle,
                new LexingCommentStripper(cStyle), blankLines, "//", patterns(
                "(?:std::)?(?:cout|cerr|clog)\\s*<<.*",
                "(?:std::)?(?:printf|fprintf|puts)\\s*\\(.*",
                "Console\\.(?:Write|WriteLine|Error\\.WriteLine)\\s*\\(.*",
                "System\\.(?:out|err)\\.print(?:ln|f)?\\s*\\(.*",
                "console\\.(?:log|debug|error|warn|info)\\s*\\(.*",
                "fmt\\.(?:Print|Println|Printf)\\s*\\(.*",
                "(?:println|print|eprintln|eprint|dbg)!\\s*\\(.*",
                "(?:Debug|Trace)\\.(?:Log|WriteLine|Print)\\s*\\(.*",
                "(?:Message|DumpMachine|DumpRegister)\\s*\\(.*"), true));

        SourceLexer hash = new HashCommentLexer();
        REGISTRY.put(Language.HASH_COMMENTED, new LanguageRules(Language.HASH_COMMENTED, hash,
                new LexingCommentStripper(hash), blankLines, "#", patterns(
                "(?:echo|printf|print|puts)\\b.*"), true));

        REGISTRY.put(Language.UNKNOWN, new LanguageRules(Language.UNKNOWN, new PlainLexer(),
                new NoCommentStripper(), blankLines, null, Collections.emptyList(), false));
    }

    private final Language language;
    private final SourceLexer lexer;
    private final CommentStripper commentStripper;
    private final BlankLineStripper blankLineStripper;
    private final String lineCommentMarker;
    private final List<Pattern> debugStatementPatterns;
    private final boolean known;

    private LanguageRules(Language language, SourceLexer lexer, CommentStripper commentStripper,
                          BlankLineStripper blankLineStripper, String lineCommentMarker,
                          List<Pattern> debugStatementPatterns, boolean known) {
        this.language = language;
        this.lexer = lexer;
        this.commentStripper = commentStripper;
        this.blankLineStripper = blankLineStripper;
        this.lineCommentMarker = lineCommentMarker;
        this.debugStatementPatterns = debugStatementPatterns;
        this.known = known;
    }

    private static List<Pattern> patterns(String... regexes) {
        Pattern[] result = new Pattern[regexes.length];
        for (int i = 0; i < regexes.length; i++) {
            result[i] = Pattern.compile(regexes[i]);
        }
        return Collections.unmodifiableList(Arrays.asList(result));
    }

    public static LanguageRules forLanguage(Language language) {
        return REGISTRY.get(language);
    }

    public Language getLanguage() {
        return language;
    }

    public SourceLexer getLexer() {
        return lexer;
    }

    public CommentStripper getCommentStripper() {
        return commentStripper;
    }

    public BlankLineStripper getBlankLineStripper() {
        return blankLineStripper;
    }

    /**
     * @return The marker that comments out a single line, or <code>null</code> if unknown
     */
    public String getLineCommentMarker() {
        return lineCommentMarker;
    }

    /**
     * @param trimmedLine A line of live code without surrounding whitespace
     * @return <code>true</code> if the line prints or traces something for debugging
     */
    public boolean isDebugStatement(String trimmedLine) {
        for (Pattern p : debugStatementPatterns) {
            if (p.matcher(trimmedLine).matches()) {
                return true;
            }
        }
        return false;
    }

    public boolean isKnown() {
        return known;
    }
}
