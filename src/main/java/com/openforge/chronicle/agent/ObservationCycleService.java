package com.openforge.chronicle.agent;

import com.openforge.chronicle.memory.ObservationRecord;
import com.openforge.chronicle.memory.ObservationRecorder;
import com.openforge.chronicle.memory.retrieval.HybridRetriever;
import com.openforge.chronicle.memory.retrieval.QueryContext;
import com.openforge.chronicle.memory.retrieval.RankSource;
import com.openforge.chronicle.memory.retrieval.RetrievalResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One observation cycle:
 *
 *   1. RECALL   - hybrid retrieval for the situational context
 *   2. PROMPT   - observation notes plus the recalled memories
 *   3. GENERATE - tool-call loop, which may query memory further
 *   4. RECORD   - the final text becomes a new observation
 *
 * At most one cycle runs at a time; a concurrent request fails fast.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ObservationCycleService {

    private final HybridRetriever      retriever;
    private final ToolCallLoop         toolCallLoop;
    private final ObservationRecorder  recorder;
    private final MemoryToolExecutor   toolExecutor;
    private final GenerationProperties generationProperties;

    private final ReentrantLock cycleLock = new ReentrantLock();

    /**
     * @param observationNotes what the diarist is looking at now (scene description, weather, news ...)
     * @param sourceRef        reference stored with the new observation; may be null
     * @param context          situational hints for the semantic half of retrieval; may be null
     * @throws CycleInProgressException if another cycle is running
     * @throws com.openforge.chronicle.memory.StoreIOException if the new observation could not be stored
     */
    public CycleOutcome runCycle(String observationNotes, String sourceRef, QueryContext context) {
        if (!cycleLock.tryLock()) {
            throw new CycleInProgressException();
        }
        try {
            List<RetrievalResult> memories = retriever.retrieve(context == null ? QueryContext.empty() : context);
            log.info("[Cycle] Recalled {} memories for the prompt.", memories.size());

            LoopResult loopResult = toolCallLoop.run(
                    generationProperties.systemPrompt(), buildUserPrompt(observationNotes, memories));

            if (loopResult.text() == null || loopResult.text().isBlank()) {
                log.warn("[Cycle] Generation produced no text; nothing recorded.");
                return new CycleOutcome(null, loopResult, memories);
            }
            ObservationRecord record = recorder.record(loopResult.text(), sourceRef);
            log.info("[Cycle] Recorded observation #{} ({} tool round(s){}).", record.id(),
                    loopResult.iterationCount(), loopResult.budgetExhausted() ? ", budget exhausted" : "");
            return new CycleOutcome(record, loopResult, memories);
        } finally {
            cycleLock.unlock();
        }
    }

    public boolean isRunning() {
        return cycleLock.isLocked();
    }

    // ── Prompt assembly ──────────────────────────────────────────────────────

    String buildUserPrompt(String observationNotes, List<RetrievalResult> memories) {
        StringBuilder sb = new StringBuilder();
        sb.append("## Current observation\n")
          .append(observationNotes == null || observationNotes.isBlank() ? "(no notes)" : observationNotes.strip())
          .append("\n\n## Recent memories\n");

        List<RetrievalResult> recent  = memories.stream().filter(r -> r.rankSource() == RankSource.RECENCY).toList();
        List<RetrievalResult> related = memories.stream().filter(r -> r.rankSource() == RankSource.SEMANTIC).toList();

        if (recent.isEmpty()) {
            sb.append("No recent observations.\n");
        }
        for (RetrievalResult r : recent) {
            sb.append("- ").append(toolExecutor.formatRecord(r.record())).append('\n');
        }
        if (!related.isEmpty()) {
            sb.append("\n## Related memories\n");
            for (RetrievalResult r : related) {
                sb.append("- ").append(toolExecutor.formatRecord(r.record()))
                  .append(String.format(Locale.ROOT, " (relevance: %.2f)", r.score()))
                  .append('\n');
            }
        }
        sb.append("\nWrite today's observation. Use the memory tools if an earlier observation might connect.");
        return sb.toString();
    }

    /**
     * @param record   the stored observation; null when generation produced no text
     * @param memories what hybrid retrieval put into the prompt
     */
    public record CycleOutcome(
            ObservationRecord     record,
            LoopResult            loopResult,
            List<RetrievalResult> memories
    ) {}
}
