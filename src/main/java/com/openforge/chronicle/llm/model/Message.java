package com.openforge.chronicle.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * A single entry in the LLM conversation history.
 *
 * role variants:
 *   "system"    - persona / instructions
 *   "user"      - the observation request
 *   "assistant" - model reply; may carry tool_calls instead of (or alongside) content
 *   "tool"      - result of one memory tool call, linked by tool_call_id
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Message(
        String role,

        /** Text content. Null for assistant messages that only contain tool_calls. */
        String content,

        /** Present only in assistant messages that request tools ("tool_calls" on the wire). */
        List<ToolCall> toolCalls,

        /** Present only in tool-result messages; matches the id of the originating ToolCall. */
        String toolCallId
) {

    public static Message system(String content) {
        return Message.builder().role("system").content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role("user").content(content).build();
    }

    public static Message assistantText(String content) {
        return Message.builder().role("assistant").content(content).build();
    }

    public static Message assistantToolCalls(String content, List<ToolCall> toolCalls) {
        return Message.builder().role("assistant").content(content).toolCalls(toolCalls).build();
    }

    public static Message toolResult(String toolCallId, String result) {
        return Message.builder().role("tool").toolCallId(toolCallId).content(result).build();
    }

    public boolean hasText() {
        return content != null && !content.isBlank();
    }
}
