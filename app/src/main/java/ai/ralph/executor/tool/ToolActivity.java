package ai.ralph.executor.tool;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * Progress-display summary of one {@code tool_use} item, already mapped to the status event type the job queue
 * understands.
 */
public record ToolActivity(String toolName, String eventType, String message, Map<String, String> metadata) {
    public static final String READ_FILE = "read_file";
    public static final String EDIT_FILE = "edit_file";
    public static final String WRITE_FILE = "write_file";
    public static final String BASH_COMMAND = "bash_command";
    public static final String SEARCH = "search";
    public static final String PROGRESS_UPDATE = "progress_update";

    static final int COMMAND_MESSAGE_LIMIT = 50;
    static final int COMMAND_METADATA_LIMIT = 200;

    public ToolActivity {
        metadata = Map.copyOf(metadata);
    }

    public static ToolActivity fromToolUse(String toolName, @Nullable JsonNode input) {
        var metadata = new LinkedHashMap<String, String>();
        switch (toolName) {
            case "Read" -> {
                var file = text(input, "file_path");
                putIfPresent(metadata, "file", file);
                return new ToolActivity(toolName, READ_FILE, "Reading: " + baseName(file), metadata);
            }
            case "Edit" -> {
                var file = text(input, "file_path");
                putIfPresent(metadata, "file", file);
                return new ToolActivity(toolName, EDIT_FILE, "Editing: " + baseName(file), metadata);
            }
            case "Write" -> {
                var file = text(input, "file_path");
                putIfPresent(metadata, "file", file);
                return new ToolActivity(toolName, WRITE_FILE, "Creating: " + baseName(file), metadata);
            }
            case "Bash" -> {
                var command = text(input, "command");
                putIfPresent(metadata, "command", command == null ? null : truncate(command, COMMAND_METADATA_LIMIT));
                var shown = command == null
                        ? "command"
                        : truncate(command, COMMAND_MESSAGE_LIMIT)
                                + (command.length() > COMMAND_MESSAGE_LIMIT ? "..." : "");
                return new ToolActivity(toolName, BASH_COMMAND, "Running: " + shown, metadata);
            }
            case "Grep", "Glob" -> {
                var pattern = text(input, "pattern");
                if (pattern == null) {
                    pattern = text(input, "glob");
                }
                putIfPresent(metadata, "pattern", pattern);
                var target = pattern == null ? "files" : pattern;
                return new ToolActivity(toolName, SEARCH, "Searching: " + target, metadata);
            }
            case "Task" -> {
                var description = text(input, "description");
                putIfPresent(metadata, "subagent", text(input, "subagent_type"));
                var shown = description == null ? "working..." : truncate(description, COMMAND_MESSAGE_LIMIT);
                return new ToolActivity(toolName, PROGRESS_UPDATE, "Subtask: " + shown, metadata);
            }
            default -> {
                metadata.put("tool", toolName);
                return new ToolActivity(toolName, PROGRESS_UPDATE, "Using: " + toolName, metadata);
            }
        }
    }

    private static @Nullable String text(@Nullable JsonNode input, String field) {
        if (input == null) {
            return null;
        }
        var node = input.get(field);
        return node != null && node.isTextual() ? node.asText() : null;
    }

    private static String baseName(@Nullable String path) {
        if (path == null || path.isBlank()) {
            return "file";
        }
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    private static String truncate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max);
    }

    private static void putIfPresent(Map<String, String> metadata, String key, @Nullable String value) {
        if (value != null) {
            metadata.put(key, value);
        }
    }
}
