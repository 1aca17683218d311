package com.openforge.chronicle.llm.model;

/**
 * The "function" sub-object inside a ToolCall returned by the LLM.
 *
 * "arguments" is a raw JSON string, e.g. {"query":"people with umbrellas","top_k":3};
 * the tool executor parses it.
 */
public record FunctionCallResult(
        String name,
        String arguments
) {}
