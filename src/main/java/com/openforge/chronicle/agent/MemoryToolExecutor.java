package com.openforge.chronicle.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.chronicle.llm.model.Tool;
import com.openforge.chronicle.llm.model.ToolCall;
import com.openforge.chronicle.llm.model.ToolFunction;
import com.openforge.chronicle.memory.MemoryProperties;
import com.openforge.chronicle.memory.ObservationRecord;
import com.openforge.chronicle.memory.retrieval.RetrievalResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Exposes {@link MemoryQueryTools} to the model as three function-calling tools
 * and renders their answers as plain text.
 *
 *   query_memories       {"query": "...", "top_k": 5}
 *   get_recent_memories  {"count": 5}
 *   check_memory_exists  {"topic": "..."}
 */
@Slf4j
@Component
public class MemoryToolExecutor {

    public static final String QUERY_MEMORIES      = "query_memories";
    public static final String GET_RECENT_MEMORIES = "get_recent_memories";
    public static final String CHECK_MEMORY_EXISTS = "check_memory_exists";

    static final int DEFAULT_LIMIT       = 5;
    static final int RESULT_TEXT_LIMIT   = 300;
    static final int EXAMPLE_TEXT_LIMIT  = 150;

    private final MemoryQueryTools  tools;
    private final ObjectMapper      objectMapper;
    private final DateTimeFormatter dateFormat;
    private final List<Tool>        definitions;

    public MemoryToolExecutor(MemoryQueryTools tools,
                              ObjectMapper objectMapper,
                              MemoryProperties properties) {
        this.tools        = tools;
        this.objectMapper = objectMapper;
        this.dateFormat   = DateTimeFormatter.ofPattern("MMMM dd, yyyy", Locale.ENGLISH)
                .withZone(ZoneId.of(properties.displayZone()));
        this.definitions  = List.of(
                buildTool(QUERY_MEMORIES,
                        "Query your memory for similar past observations by searching for specific, concrete "
                        + "details you see (objects, clothing, group sizes, time patterns). Vary what you search for.",
                        """
                        {
                          "type":"object",
                          "properties":{
                            "query":{
                              "type":"string",
                              "description":"Specific, concrete detail to search for in past observations, e.g. 'men in red shirts' or 'tuesday night'."
                            },
                            "top_k":{
                              "type":"integer",
                              "description":"Number of most relevant memories to return (default: 5, max: 10)",
                              "default":5,
                              "minimum":1,
                              "maximum":10
                            }
                          },
                          "required":["query"]
                        }
                        """),
                buildTool(GET_RECENT_MEMORIES,
                        "Get your most recent observations for temporal continuity, e.g. morning vs evening "
                        + "comparisons or day-to-day changes.",
                        """
                        {
                          "type":"object",
                          "properties":{
                            "count":{
                              "type":"integer",
                              "description":"Number of recent memories to retrieve (default: 5, max: 10)",
                              "default":5,
                              "minimum":1,
                              "maximum":10
                            }
                          },
                          "required":[]
                        }
                        """),
                buildTool(CHECK_MEMORY_EXISTS,
                        "Quickly check if you have any memories about a specific topic. Returns yes/no with a "
                        + "brief example if found. Use this before doing a full query.",
                        """
                        {
                          "type":"object",
                          "properties":{
                            "topic":{
                              "type":"string",
                              "description":"Topic to check, e.g. 'rain', 'crowds', 'morning observations'"
                            }
                          },
                          "required":["topic"]
                        }
                        """));
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /** Tool declarations for the "tools" array of a chat request. */
    public List<Tool> toolDefinitions() {
        return definitions;
    }

    /**
     * Runs one tool call and returns the text handed back to the model.
     *
     * @throws ToolExecutionException for unknown tools, malformed arguments or a failing tool
     */
    public String execute(ToolCall toolCall) {
        if (toolCall == null || toolCall.function() == null || toolCall.function().name() == null) {
            throw new ToolExecutionException(null, "Tool call carries no function name");
        }
        String name = toolCall.function().name();
        JsonNode args = parseArguments(name, toolCall.function().arguments());
        log.info("[Tools] Executing {} args={}", name, args);

        try {
            return switch (name) {
                case QUERY_MEMORIES      -> queryMemories(args);
                case GET_RECENT_MEMORIES -> recentMemories(args);
                case CHECK_MEMORY_EXISTS -> checkMemoryExists(args);
                default -> throw new ToolExecutionException(name, "Unknown tool: " + name);
            };
        } catch (ToolExecutionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ToolExecutionException(name, "%s failed: %s".formatted(name, e.getMessage()), e);
        }
    }

    // ── Tool bodies ──────────────────────────────────────────────────────────

    private String queryMemories(JsonNode args) {
        String query = requireText(QUERY_MEMORIES, args, "query");
        int topK = optionalInt(QUERY_MEMORIES, args, "top_k");
        List<RetrievalResult> results = tools.queryMemories(query, topK);
        if (results.isEmpty()) {
            return "No memories found matching query: '%s'".formatted(query);
        }
        return results.stream()
                .map(r -> formatRecord(r.record()))
                .collect(Collectors.joining("\n\n"));
    }

    private String recentMemories(JsonNode args) {
        int count = optionalInt(GET_RECENT_MEMORIES, args, "count");
        List<ObservationRecord> recent = tools.getRecentMemories(count);
        if (recent.isEmpty()) {
            return "No recent observations found.";
        }
        return recent.stream()
                .map(this::formatRecord)
                .collect(Collectors.joining("\n\n"));
    }

    private String checkMemoryExists(JsonNode args) {
        String topic = requireText(CHECK_MEMORY_EXISTS, args, "topic");
        MemoryQueryTools.ExistenceCheck check = tools.checkMemoryExists(topic);
        if (!check.exists() || check.example() == null) {
            return "No, I don't have any memories about '%s'.".formatted(topic);
        }
        return "Yes, I have memories about '%s'. Example: Observation #%d: %s".formatted(
                topic, check.example().id(), clip(check.example().promptText(), EXAMPLE_TEXT_LIMIT));
    }

    // ── Formatting ───────────────────────────────────────────────────────────

    public String formatRecord(ObservationRecord record) {
        String date = record.timestamp() == null ? "Unknown date" : dateFormat.format(record.timestamp());
        return "Observation #%d (%s): %s".formatted(
                record.id(), date, clip(record.promptText(), RESULT_TEXT_LIMIT));
    }

    private static String clip(String text, int limit) {
        if (text.codePointCount(0, text.length()) <= limit) return text;
        return text.substring(0, text.offsetByCodePoints(0, limit)) + "...";
    }

    // ── Argument parsing ─────────────────────────────────────────────────────

    private JsonNode parseArguments(String toolName, String argumentsJson) {
        if (argumentsJson == null || argumentsJson.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            JsonNode node = objectMapper.readTree(argumentsJson);
            if (node == null || !node.isObject()) {
                throw new ToolExecutionException(toolName, "Arguments must be a JSON object: " + argumentsJson);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new ToolExecutionException(toolName, "Malformed arguments: " + argumentsJson, e);
        }
    }

    private static String requireText(String toolName, JsonNode args, String field) {
        JsonNode value = args.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new ToolExecutionException(toolName, "Missing required string argument '%s'".formatted(field));
        }
        return value.asText().strip();
    }

    private static int optionalInt(String toolName, JsonNode args, String field) {
        JsonNode value = args.get(field);
        if (value == null || value.isNull()) {
            return DEFAULT_LIMIT;
        }
        if (value.isIntegralNumber()) {
            return value.asInt();
        }
        if (value.isTextual()) {
            try {
                return Integer.parseInt(value.asText().strip());
            } catch (NumberFormatException e) {
                throw new ToolExecutionException(toolName, "Argument '%s' is not an integer: %s".formatted(field, value), e);
            }
        }
        throw new ToolExecutionException(toolName, "Argument '%s' is not an integer: %s".formatted(field, value));
    }

    private Tool buildTool(String name, String description, String schema) {
        try {
            return Tool.ofFunction(new ToolFunction(name, description, objectMapper.readTree(schema)));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to build " + name + " tool schema", e);
        }
    }
}
