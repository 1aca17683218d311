package com.openforge.chronicle.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * The request body sent to an OpenAI-compatible /chat/completions endpoint.
 *
 * toolChoice accepts:
 *   "none"     - model will not call any tool
 *   "auto"     - model decides (default when tools are declared)
 *   "required" - model MUST call at least one tool
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatRequest(
        String model,
        List<Message> messages,
        List<Tool> tools,
        String toolChoice,
        Double temperature,
        Integer maxTokens
) {

    /** Short, low-temperature completion used for observation synopses. */
    public static ChatRequest summary(List<Message> messages, int maxTokens) {
        return ChatRequest.builder()
                .messages(messages)
                .temperature(0.3)
                .maxTokens(maxTokens)
                .build();
    }

    /** Generation round of the tool-call loop; the router fills in the provider's model. */
    public static ChatRequest withTools(List<Message> messages, List<Tool> tools) {
        return ChatRequest.builder()
                .messages(messages)
                .tools(tools)
                .toolChoice(tools == null || tools.isEmpty() ? null : "auto")
                .temperature(0.8)
                .maxTokens(4096)
                .build();
    }
}
