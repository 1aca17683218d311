package com.openforge.chronicle.agent;

import com.openforge.chronicle.llm.model.Message;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Mutable state of a single {@link ToolCallLoop} run. Not thread-safe; owned by one run.
 *
 * Every transition checks the current state and fails with IllegalStateException
 * when called out of order.
 */
public class ConversationState {

    private final List<Message> turns;
    private final int           maxIterations;

    private LoopState state = LoopState.GENERATING;
    private int       iterationCount;
    private int       generationCalls;
    private String    lastText;
    private String    finalText;
    private boolean   forced;

    public ConversationState(List<Message> initialTurns, int maxIterations) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1, was " + maxIterations);
        }
        this.turns         = new ArrayList<>(initialTurns);
        this.maxIterations = maxIterations;
    }

    // ── Transitions ──────────────────────────────────────────────────────────

    /** Counts one generation round-trip; only legal while GENERATING. */
    public void recordGenerationCall() {
        expect(EnumSet.of(LoopState.GENERATING));
        generationCalls++;
    }

    /** GENERATING → TOOL_REQUESTED, keeping the assistant message in the history. */
    public void requestTools(Message assistantMessage) {
        expect(EnumSet.of(LoopState.GENERATING));
        turns.add(assistantMessage);
        if (assistantMessage.hasText()) {
            lastText = assistantMessage.content();
        }
        state = LoopState.TOOL_REQUESTED;
    }

    public void addToolResult(Message toolResult) {
        expect(EnumSet.of(LoopState.TOOL_REQUESTED));
        turns.add(toolResult);
    }

    /** TOOL_REQUESTED → TOOL_EXECUTED; one full tool round is done. */
    public void completeToolRound() {
        expect(EnumSet.of(LoopState.TOOL_REQUESTED));
        iterationCount++;
        state = LoopState.TOOL_EXECUTED;
    }

    /** TOOL_EXECUTED → GENERATING. */
    public void resumeGenerating() {
        expect(EnumSet.of(LoopState.TOOL_EXECUTED));
        state = LoopState.GENERATING;
    }

    /** GENERATING → FINALIZED with the model's plain answer. */
    public void finalizeWith(Message assistantMessage) {
        expect(EnumSet.of(LoopState.GENERATING));
        turns.add(assistantMessage);
        finalText = assistantMessage.content() == null ? "" : assistantMessage.content();
        lastText  = finalText;
        state = LoopState.FINALIZED;
    }

    /** TOOL_EXECUTED → FINALIZED without another generation call. */
    public void forceFinalize(String text) {
        expect(EnumSet.of(LoopState.TOOL_EXECUTED));
        finalText = text;
        forced    = true;
        state = LoopState.FINALIZED;
    }

    // ── Queries ──────────────────────────────────────────────────────────────

    public boolean budgetExhausted() {
        return iterationCount >= maxIterations;
    }

    /** True when the run ended because the budget ran out rather than with a plain answer. */
    public boolean finalizedByBudget() {
        return forced;
    }

    public LoopState state() {
        return state;
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    public int iterationCount() {
        return iterationCount;
    }

    public int generationCalls() {
        return generationCalls;
    }

    public int maxIterations() {
        return maxIterations;
    }

    /** Most recent non-blank text the model produced, or null. */
    public String lastText() {
        return lastText;
    }

    public String finalText() {
        return finalText;
    }

    /** Snapshot of the history, safe to hand to a request. */
    public List<Message> turns() {
        return List.copyOf(turns);
    }

    private void expect(Set<LoopState> allowed) {
        if (!allowed.contains(state)) {
            throw new IllegalStateException("Illegal transition from " + state + ", expected one of " + allowed);
        }
    }
}
