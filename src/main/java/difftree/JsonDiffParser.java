package difftree;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the JSON lines output of an archive diff. Every line is one object:
 *
 * <pre>
 * {"path": "home/user/file", "changes": [{"type": "modified", "added": 32, "removed": 36},
 *                                        {"type": "mode", "old_mode": "-r--rw----", "new_mode": "-rwxrwx--x"}]}
 * </pre>
 * <p>
 * Change types: {@code modified} (optionally with {@code added} and {@code removed}),
 * {@code changed link}, {@code added}/{@code removed} (optionally with {@code size}),
 * {@code added link}/{@code removed link}, {@code added directory}/{@code removed directory},
 * {@code mode} and {@code owner}.
 */
public class JsonDiffParser implements DiffParser {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public List<PathTree.Entry<DiffPayload>> parse(String output) {
        List<JsonNode> records = new ArrayList<>();
        for (String line : output.lines().toList()) {
            if (line.isBlank()) {
                continue;
            }
            try {
                records.add(objectMapper.readTree(line));
            } catch (JsonProcessingException e) {
                throw new DiffParseException("Invalid JSON in diff output", line, e);
            }
        }
        return parse(records);
    }

    public List<PathTree.Entry<DiffPayload>> parse(List<JsonNode> records) {
        List<PathTree.Entry<DiffPayload>> result = new ArrayList<>(records.size());
        for (JsonNode record : records) {
            result.add(parseRecord(record));
        }
        return result;
    }

    /**
     * Parses a single record that was already read, e.g. when the output consisted of one line only.
     */
    public PathTree.Entry<DiffPayload> parseRecord(JsonNode record) {
        JsonNode path = record.get("path");
        JsonNode changes = record.get("changes");
        if (path == null || !path.isTextual() || TreePath.of(path.asText()).isRoot()) {
            throw new DiffParseException("Missing path in diff record", record.toString());
        }
        if (changes == null || !changes.isArray() || changes.isEmpty()) {
            throw new DiffParseException("Missing changes in diff record", record.toString());
        }

        DiffPayload.Builder builder = DiffPayload.builder();
        for (JsonNode change : changes) {
            applyChange(builder, change, record);
        }
        return new PathTree.Entry<>(TreePath.of(path.asText()), builder.build());
    }

    private void applyChange(DiffPayload.Builder builder, JsonNode change, JsonNode record) {
        String type = text(change, "type", record);
        switch (type) {
            case "modified" -> {
                if (change.has("added") && change.has("removed")) {
                    builder.modified(number(change, "added", record), number(change, "removed", record));
                } else {
                    // chunk ids couldn't be compared, no amounts
                    builder.modified();
                }
            }
            case "changed link" -> builder.changedLink();
            case "added", "added link", "added directory" ->
                    builder.added(fileType(type), change.has("size") ? number(change, "size", record) : 0);
            case "removed", "removed link", "removed directory" ->
                    builder.removed(fileType(type), change.has("size") ? number(change, "size", record) : 0);
            case "mode" -> builder.mode(text(change, "old_mode", record), text(change, "new_mode", record));
            case "owner" -> builder.owner(text(change, "old_user", record), text(change, "old_group", record),
                    text(change, "new_user", record), text(change, "new_group", record));
            default -> throw new DiffParseException("Unknown change type '" + type + "'", record.toString());
        }
    }

    private static FileType fileType(String type) {
        if (type.endsWith("directory")) {
            return FileType.DIRECTORY;
        }
        if (type.endsWith("link")) {
            return FileType.LINK;
        }
        return FileType.FILE;
    }

    private static String text(JsonNode change, String field, JsonNode record) {
        JsonNode value = change.get(field);
        if (value == null || !value.isTextual()) {
            throw new DiffParseException("Missing '" + field + "' in diff record", record.toString());
        }
        return value.asText();
    }

    private static long number(JsonNode change, String field, JsonNode record) {
        JsonNode value = change.get(field);
        if (value == null || !value.isIntegralNumber()) {
            throw new DiffParseException("Missing '" + field + "' in diff record", record.toString());
        }
        return value.asLong();
    }
}
