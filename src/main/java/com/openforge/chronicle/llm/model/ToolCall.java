package com.openforge.chronicle.llm.model;

/**
 * A single tool invocation request produced by the LLM.
 * The tool-call loop answers each one with a Message.toolResult(id, output).
 */
public record ToolCall(
        String id,
        String type,
        FunctionCallResult function
) {
    public static ToolCall function(String id, String name, String arguments) {
        return new ToolCall(id, "function", new FunctionCallResult(name, arguments));
    }
}
