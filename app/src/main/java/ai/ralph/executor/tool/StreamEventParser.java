package ai.ralph.executor.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Incremental parser for the tool's newline-delimited JSON event stream.
 *
 * <p>Chunks may split lines anywhere; the trailing fragment is held until the next chunk (or {@link #finish()}).
 * Each complete non-blank line goes to the listener verbatim and is then parsed on its own. A line that is not a JSON
 * object is kept as raw output and never fails the session.
 */
public final class StreamEventParser {
    private static final Logger logger = LogManager.getLogger(StreamEventParser.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ToolOutputListener listener;
    private final StringBuilder pending = new StringBuilder();
    private final StringBuilder narrative = new StringBuilder();
    private final StringBuilder rawOutput = new StringBuilder();

    @Nullable
    private String resultText;

    @Nullable
    private ResultEvent resultEvent;

    private int lineCount;
    private int malformedCount;

    public StreamEventParser(ToolOutputListener listener) {
        this.listener = listener;
    }

    /** Feeds a chunk of stdout exactly as it was read. */
    public synchronized void accept(String chunk) {
        pending.append(chunk);
        int newline;
        while ((newline = pending.indexOf("\n")) >= 0) {
            var line = pending.substring(0, newline);
            pending.delete(0, newline + 1);
            handleLine(line);
        }
    }

    /** Parses the trailing fragment left after end of stream. Safe to call more than once. */
    public synchronized void finish() {
        if (pending.length() > 0) {
            var line = pending.toString();
            pending.setLength(0);
            handleLine(line);
        }
        logger.debug("Stream finished: {} lines, {} not JSON", lineCount, malformedCount);
    }

    /**
     * Final text of the session: the trimmed assistant narrative, else the {@code result} field of the result event,
     * else the raw non-JSON output.
     */
    public synchronized String resolvedText() {
        var trimmed = narrative.toString().trim();
        if (!trimmed.isEmpty()) {
            return trimmed;
        }
        if (resultText != null && !resultText.isBlank()) {
            return resultText;
        }
        return rawOutput.toString();
    }

    public synchronized @Nullable ResultEvent resultEvent() {
        return resultEvent;
    }

    public synchronized @Nullable String resultText() {
        return resultText;
    }

    public synchronized String rawOutput() {
        return rawOutput.toString();
    }

    private void handleLine(String rawLine) {
        var line = rawLine.endsWith("\r") ? rawLine.substring(0, rawLine.length() - 1) : rawLine;
        if (line.isBlank()) {
            return;
        }
        lineCount++;
        try {
            listener.onLine(line);
        } catch (RuntimeException e) {
            logger.warn("Output listener failed on line {}", lineCount, e);
        }

        JsonNode event;
        try {
            event = MAPPER.readTree(line);
        } catch (JsonProcessingException e) {
            event = null;
        }
        if (event == null || !event.isObject()) {
            malformedCount++;
            logger.debug("Non-JSON output line: {}", preview(line));
            rawOutput.append(line).append('\n');
            return;
        }

        var type = event.path("type").asText("");
        switch (type) {
            case "system" -> handleSystem(event);
            case "assistant" -> handleAssistant(event);
            case "result" -> handleResult(event);
            default -> logger.trace("Ignoring stream event of type '{}'", type);
        }
    }

    private void handleSystem(JsonNode event) {
        if ("init".equals(event.path("subtype").asText())) {
            logger.info("Tool session initialized (model={})", event.path("model").asText("unknown"));
        }
    }

    private void handleAssistant(JsonNode event) {
        var content = event.path("message").path("content");
        if (!content.isArray()) {
            return;
        }
        for (var item : content) {
            var itemType = item.path("type").asText("");
            if ("text".equals(itemType)) {
                var text = item.path("text").asText("");
                if (text.isEmpty()) {
                    continue;
                }
                if (narrative.length() > 0) {
                    narrative.append('\n');
                }
                narrative.append(text);
            } else if ("tool_use".equals(itemType)) {
                var activity = ToolActivity.fromToolUse(item.path("name").asText("unknown"), item.get("input"));
                logger.debug("Tool activity: {}", activity.message());
                try {
                    listener.onActivity(activity);
                } catch (RuntimeException e) {
                    logger.warn("Output listener failed on tool activity {}", activity.toolName(), e);
                }
            }
        }
    }

    private void handleResult(JsonNode event) {
        var result = event.get("result");
        if (result != null && result.isTextual()) {
            resultText = result.asText();
        }
        resultEvent = new ResultEvent(
                textOrNull(event, "subtype"),
                event.hasNonNull("duration_ms") ? event.get("duration_ms").asLong() : null,
                event.hasNonNull("num_turns") ? event.get("num_turns").asInt() : null,
                event.hasNonNull("total_cost_usd") ? event.get("total_cost_usd").asDouble() : null,
                event.path("is_error").asBoolean(false),
                textOrNull(event, "error"));
        logger.info(
                "Tool result: subtype={}, turns={}, durationMs={}, costUsd={}",
                resultEvent.subtype(),
                resultEvent.numTurns(),
                resultEvent.durationMs(),
                resultEvent.totalCostUsd());
    }

    private static @Nullable String textOrNull(JsonNode node, String field) {
        var value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }

    private static String preview(String line) {
        return line.length() <= 100 ? line : line.substring(0, 100) + "...";
    }
}
