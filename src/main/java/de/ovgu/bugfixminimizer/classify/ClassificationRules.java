package de.ovgu.bugfixminimizer.classify;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Path-based rules that tell test files and derived artifacts apart from ordinary source files.  The built-in rules
 * live in <code>bugfix-minimizer-defaults.properties</code> on the class path; a user-supplied properties file
 * replaces individual keys.
 * <p>
 * Keys:
 * <ul>
 * <li><code>test.directories</code>: comma-separated directory names that mark test code</li>
 * <li><code>test.fileNames</code>: comma-separated file-name globs that mark test code</li>
 * <li><code>derived.default</code>: comma-separated path globs of derived artifacts</li>
 * <li><code>derived.repo.&lt;repository&gt;</code>: the same, for one repository only</li>
 * </ul>
 */
public class ClassificationRules {
    private static final Logger LOG = Logger.getLogger(ClassificationRules.class);

    public static final String DEFAULTS_RESOURCE = "/bugfix-minimizer-defaults.properties";

    static final String KEY_TEST_DIRECTORIES = "test.directories";
    static final String KEY_TEST_FILE_NAMES = "test.fileNames";
    static final String KEY_DERIVED_DEFAULT = "derived.default";
    static final String KEY_DERIVED_REPO_PREFIX = "derived.repo.";

    private final TestFileConvention testFileConvention;
    private final DerivedArtifactRule derivedArtifactRule;

    public ClassificationRules(TestFileConvention testFileConvention, DerivedArtifactRule derivedArtifactRule) {
        this.testFileConvention = testFileConvention;
        this.derivedArtifactRule = derivedArtifactRule;
    }

    public static ClassificationRules loadDefaults() {
        return fromProperties(readDefaultProperties());
    }

    /**
     * @param overrides Properties file whose keys replace the built-in ones
     */
    public static ClassificationRules load(File overrides) throws IOException {
        Properties props = readDefaultProperties();
        Properties userProps = new Properties();
        try (Reader r = Files.newBufferedReader(overrides.toPath(), StandardCharsets.UTF_8)) {
            userProps.load(r);
        }
        LOG.debug("Read " + userProps.size() + " classification rule(s) from " + overrides);
        for (String key : userProps.stringPropertyNames()) {
            props.setProperty(key, userProps.getProperty(key));
        }
        return fromProperties(props);
    }

    static ClassificationRules fromProperties(Properties props) {
        TestFileConvention tests = new TestFileConvention(
                list(props, KEY_TEST_DIRECTORIES),
                list(props, KEY_TEST_FILE_NAMES));
        Map<String, List<String>> byRepo = new HashMap<>();
        for (String key : props.stringPropertyNames()) {
            if (key.startsWith(KEY_DERIVED_REPO_PREFIX)) {
                String repository = key.substring(KEY_DERIVED_REPO_PREFIX.length());
                byRepo.put(repository, list(props, key));
            }
        }
        DerivedArtifactRule derived = new DerivedArtifactRule(list(props, KEY_DERIVED_DEFAULT), byRepo);
        return new ClassificationRules(tests, derived);
    }

    private static Properties readDefaultProperties() {
        Properties props = new Properties();
        try (InputStream in = ClassificationRules.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing class path resource " + DEFAULTS_RESOURCE);
            }
            props.load(new InputStreamReader(in, StandardCharsets.UTF_8));
        } catch (IOException ioe) {
            throw new RuntimeException("Error reading class path resource " + DEFAULTS_RESOURCE, ioe);
        }
        return props;
    }

    private static List<String> list(Properties props, String key) {
        String value = props.getProperty(key);
        if (StringUtils.isBlank(value)) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<>();
        for (String item : Arrays.asList(StringUtils.split(value, ','))) {
            String trimmed = item.trim();
            if (!trimmed.isEmpty()) {
                result.add(trimmed);
            }
        }
        return result;
    }

    public boolean isTestFile(String path) {
        return testFileConvention.isTestPath(path);
    }

    public boolean isDerivedArtifact(String repository, String path) {
        return derivedArtifactRule.isDerivedArtifact(repository, path);
    }
}
