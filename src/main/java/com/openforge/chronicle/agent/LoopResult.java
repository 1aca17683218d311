package com.openforge.chronicle.agent;

import com.openforge.chronicle.llm.model.Message;

import java.util.List;

/**
 * Outcome of a {@link ToolCallLoop} run.
 *
 * @param text            final text; when the budget ran out, the last model text plus a note
 * @param iterationCount  completed tool rounds
 * @param generationCalls chat round-trips made, never more than the iteration budget
 * @param budgetExhausted true when the loop was finalized by the iteration budget
 * @param turns           full conversation history
 */
public record LoopResult(
        String        text,
        int           iterationCount,
        int           generationCalls,
        boolean       budgetExhausted,
        List<Message> turns
) {}
