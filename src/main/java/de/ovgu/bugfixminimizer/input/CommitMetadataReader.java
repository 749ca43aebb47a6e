package de.ovgu.bugfixminimizer.input;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Reads the <code>metadata.json</code> file of a curated commit.  Unknown fields are ignored.
 */
public class CommitMetadataReader {
    public static final String FILE_NAME = "metadata.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * @return The metadata in <code>commitDir</code>, or {@link CommitMetadata#EMPTY} if there is no metadata file
     */
    public CommitMetadata read(File commitDir) throws IOException {
        File file = new File(commitDir, FILE_NAME);
        if (!file.isFile()) {
            return CommitMetadata.EMPTY;
        }
        JsonNode root = MAPPER.readTree(file);
        if (root == null || !root.isObject()) {
            throw new IOException("Expected a JSON object in " + file.getAbsolutePath());
        }
        Set<String> modifiedFiles = new LinkedHashSet<>();
        JsonNode modified = root.get("modified_files");
        if (modified != null && modified.isArray()) {
            for (JsonNode n : modified) {
                modifiedFiles.add(FlattenedPathCodec.decode(n.asText()));
            }
        }
        return new CommitMetadata(
                text(root, "id"),
                text(root, "human_id"),
                text(root, "project_name"),
                text(root, "commit_hash"),
                root.hasNonNull("parents") ? root.get("parents").asInt(1) : null,
                root.hasNonNull("bug_in_test_code") ? root.get("bug_in_test_code").asBoolean() : null,
                modifiedFiles,
                text(root, "issue_reference"));
    }

    private static String text(JsonNode root, String field) {
        JsonNode n = root.get(field);
        return n == null || n.isNull() ? null : n.asText();
    }
}
