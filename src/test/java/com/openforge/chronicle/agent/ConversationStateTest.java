package com.openforge.chronicle.agent;

import com.openforge.chronicle.llm.model.Message;
import com.openforge.chronicle.llm.model.ToolCall;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConversationStateTest {

    private static Message toolRequest(String text) {
        return Message.assistantToolCalls(text, List.of(ToolCall.function("c1", "get_recent_memories", "{}")));
    }

    @Test
    void shouldWalkThroughOneToolRound() {
        ConversationState state = new ConversationState(List.of(Message.user("hi")), 3);

        state.recordGenerationCall();
        state.requestTools(toolRequest("Let me check."));
        assertEquals(LoopState.TOOL_REQUESTED, state.state());
        state.addToolResult(Message.toolResult("c1", "No recent observations found."));
        state.completeToolRound();
        assertEquals(LoopState.TOOL_EXECUTED, state.state());
        state.resumeGenerating();
        state.recordGenerationCall();
        state.finalizeWith(Message.assistantText("Done."));

        assertTrue(state.isTerminal());
        assertEquals(1, state.iterationCount());
        assertEquals(2, state.generationCalls());
        assertEquals("Done.", state.finalText());
        assertFalse(state.finalizedByBudget());
        assertEquals(4, state.turns().size());
    }

    @Test
    void shouldRejectOutOfOrderTransitions() {
        ConversationState state = new ConversationState(List.of(), 3);

        assertThrows(IllegalStateException.class, state::completeToolRound);
        assertThrows(IllegalStateException.class, () -> state.addToolResult(Message.toolResult("c1", "x")));
        assertThrows(IllegalStateException.class, () -> state.forceFinalize("x"));

        state.finalizeWith(Message.assistantText("Done."));

        assertThrows(IllegalStateException.class, state::recordGenerationCall);
        assertThrows(IllegalStateException.class, () -> state.requestTools(toolRequest(null)));
    }

    @Test
    void shouldForceFinalizeOnceBudgetIsSpent() {
        ConversationState state = new ConversationState(List.of(), 1);
        state.recordGenerationCall();
        state.requestTools(toolRequest("Partial thought"));
        state.completeToolRound();

        assertTrue(state.budgetExhausted());
        assertEquals("Partial thought", state.lastText());

        state.forceFinalize("Partial thought + note");

        assertTrue(state.finalizedByBudget());
        assertEquals(LoopState.FINALIZED, state.state());
    }

    @Test
    void shouldTreatMissingFinalContentAsEmpty() {
        ConversationState state = new ConversationState(List.of(), 2);

        state.finalizeWith(Message.assistantText(null));

        assertEquals("", state.finalText());
    }

    @Test
    void shouldRequirePositiveBudget() {
        assertThrows(IllegalArgumentException.class, () -> new ConversationState(List.of(), 0));
    }

    @Test
    void shouldNotExposeInternalHistory() {
        ConversationState state = new ConversationState(List.of(Message.user("hi")), 2);

        assertThrows(UnsupportedOperationException.class, () -> state.turns().add(Message.user("sneaky")));
    }
}
