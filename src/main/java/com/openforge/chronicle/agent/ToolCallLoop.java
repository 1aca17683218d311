package com.openforge.chronicle.agent;

import com.openforge.chronicle.llm.LlmClient;
import com.openforge.chronicle.llm.LlmRouter;
import com.openforge.chronicle.llm.model.ChatRequest;
import com.openforge.chronicle.llm.model.ChatResponse;
import com.openforge.chronicle.llm.model.Message;
import com.openforge.chronicle.llm.model.ToolCall;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Bounded generate / call-tools / generate conversation.
 *
 * Loop shape:
 *   while not FINALIZED:
 *     1. GENERATE  - chat round-trip with the memory tools declared
 *     2. DECIDE    - plain answer? → FINALIZED
 *     3. ACT       - run every requested tool, append one tool message per call
 *     4. CHECK     - max-iterations rounds done? → FINALIZED with the last text
 *
 * Tool failures come back to the model as "[ToolError] ..." messages. Failures of
 * the chat call itself, including a response without an assistant message, propagate
 * as {@link LlmClient.LlmException}.
 */
@Slf4j
@Service
public class ToolCallLoop {

    static final String BUDGET_NOTE = "[iteration budget exhausted after %d rounds]";

    private final LlmRouter          llmRouter;
    private final MemoryToolExecutor toolExecutor;
    private final int                maxIterations;

    public ToolCallLoop(LlmRouter llmRouter,
                        MemoryToolExecutor toolExecutor,
                        GenerationProperties properties) {
        this.llmRouter     = llmRouter;
        this.toolExecutor  = toolExecutor;
        this.maxIterations = Math.max(1, properties.maxIterations());
    }

    public LoopResult run(String systemPrompt, String userPrompt) {
        return run(List.of(Message.system(systemPrompt), Message.user(userPrompt)));
    }

    public LoopResult run(List<Message> initialMessages) {
        ConversationState conversation = new ConversationState(initialMessages, maxIterations);

        while (!conversation.isTerminal()) {
            conversation.recordGenerationCall();
            ChatResponse response = llmRouter.chat(
                    ChatRequest.withTools(conversation.turns(), toolExecutor.toolDefinitions()));
            Message assistant = assistantMessage(response);

            if (!response.hasToolCalls()) {
                conversation.finalizeWith(assistant);
                log.info("[Loop] Finalized after {} tool round(s), {} generation call(s).",
                        conversation.iterationCount(), conversation.generationCalls());
                break;
            }

            conversation.requestTools(assistant);
            for (ToolCall call : assistant.toolCalls()) {
                conversation.addToolResult(Message.toolResult(call.id(), executeTool(call)));
            }
            conversation.completeToolRound();

            if (conversation.budgetExhausted()) {
                log.warn("[Loop] Iteration budget ({}) exhausted, finalizing with last model text.", maxIterations);
                conversation.forceFinalize(budgetText(conversation));
            } else {
                conversation.resumeGenerating();
            }
        }

        return new LoopResult(
                conversation.finalText(),
                conversation.iterationCount(),
                conversation.generationCalls(),
                conversation.finalizedByBudget(),
                conversation.turns());
    }

    public int maxIterations() {
        return maxIterations;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private static Message assistantMessage(ChatResponse response) {
        if (response == null) {
            throw new LlmClient.LlmException("Generation call returned no response");
        }
        try {
            return response.firstMessage();
        } catch (IllegalStateException e) {
            throw new LlmClient.LlmException("Generation call returned no assistant message: " + e.getMessage(), e);
        }
    }

    private String executeTool(ToolCall call) {
        String name = call.function() == null ? null : call.function().name();
        try {
            return toolExecutor.execute(call);
        } catch (ToolExecutionException e) {
            log.warn("[Loop] Tool {} failed: {}", name, e.getMessage());
            return "[ToolError] " + e.getMessage();
        } catch (RuntimeException e) {
            log.warn("[Loop] Tool {} failed unexpectedly: {}", name, e.getMessage());
            return "[ToolError] %s failed: %s".formatted(name, e.getMessage());
        }
    }

    private static String budgetText(ConversationState conversation) {
        String note = BUDGET_NOTE.formatted(conversation.iterationCount());
        String last = conversation.lastText();
        return last == null || last.isBlank() ? note : last.strip() + "\n\n" + note;
    }
}
