package de.ovgu.bugfixminimizer.data;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Families of source languages that share comment and string-literal syntax.  The family is derived from the file
 * extension.
 */
public enum Language {
    /**
     * Python and Cython: <code>#</code> comments, docstrings, triple-quoted strings
     */
    PYTHON("py", "pyx", "pxd", "pyi"),
    /**
     * Languages with <code>//</code> and <code>/* *&#47;</code> comments: C, C++, CUDA, C#, Q#, Java, JavaScript,
     * TypeScript, Go, Rust, Swift, Scala, Kotlin, OpenQASM
     */
    C_FAMILY("c", "h", "cc", "cpp", "cxx", "c++", "hpp", "hh", "hxx", "inl", "cu", "cuh", "cs", "qs", "java",
            "js", "jsx", "ts", "tsx", "go", "rs", "swift", "scala", "kt", "qasm"),
    /**
     * Shell scripts, build and configuration files with <code>#</code> comments, Quil programs
     */
    HASH_COMMENTED("sh", "bash", "zsh", "yml", "yaml", "toml", "cfg", "cmake", "r", "pl", "rb", "quil"),
    /**
     * Anything else.  Comment syntax is unknown.
     */
    UNKNOWN();

    private static final Set<String> HASH_COMMENTED_FILE_NAMES = Collections.unmodifiableSet(new HashSet<>(
            Arrays.asList("makefile", "dockerfile", "cmakelists.txt", "requirements.txt", ".gitignore")));

    /**
     * Extensions of languages where a line break may end a statement without a semicolon
     */
    private static final Set<String> LINE_BREAK_TERMINATED_EXTENSIONS = Collections.unmodifiableSet(new HashSet<>(
            Arrays.asList("js", "jsx", "ts", "tsx", "go", "swift", "kt", "scala")));

    private final Set<String> extensions;

    Language(String... extensions) {
        this.extensions = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(extensions)));
    }

    public Set<String> getExtensions() {
        return extensions;
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }

    /**
     * @param path Relative path of a file, using <code>/</code> as separator
     * @return The language family of the file
     */
    public static Language fromPath(String path) {
        String fileName = path.substring(path.lastIndexOf('/') + 1).toLowerCase(Locale.ROOT);
        if (HASH_COMMENTED_FILE_NAMES.contains(fileName)) {
            return HASH_COMMENTED;
        }
        String extension = extensionOf(fileName);
        if (extension == null) {
            return UNKNOWN;
        }
        for (Language l : values()) {
            if (l.extensions.contains(extension)) {
                return l;
            }
        }
        return UNKNOWN;
    }

    /**
     * @param path Relative path of a file, using <code>/</code> as separator
     * @return <code>true</code> if line breaks outside of parentheses can end a statement in the file's language
     */
    public static boolean endsStatementsAtLineBreaks(String path) {
        String extension = extensionOf(path.substring(path.lastIndexOf('/') + 1).toLowerCase(Locale.ROOT));
        return extension != null && LINE_BREAK_TERMINATED_EXTENSIONS.contains(extension);
    }

    private static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return null;
        }
        return fileName.substring(dot + 1);
    }
}
