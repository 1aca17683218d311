package com.openforge.chronicle.memory.retrieval;

import com.openforge.chronicle.memory.MemoryProperties;
import com.openforge.chronicle.memory.ObservationRecord;
import com.openforge.chronicle.memory.ObservationStore;
import com.openforge.chronicle.memory.index.SemanticHit;
import com.openforge.chronicle.memory.index.SemanticIndex;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;

/**
 * Selects the memories placed in a generation prompt.
 *
 * Merge order:
 *
 *   1. the N most recent records (RECENCY), always included, most recent first
 *   2. up to K semantic hits for the situational query (SEMANTIC), descending score,
 *      minus anything already in (1) and minus hits whose record was pruned
 *
 * The semantic half runs under a time limiter on the memory executor. A timeout,
 * an unavailable index or any backend error reduces the answer to (1); the
 * method itself never throws.
 */
@Slf4j
@Service
public class HybridRetriever {

    /**
     * The index is asked for this many times the requested hits, so that entries of
     * pruned records that have not been removed yet do not crowd out live ones.
     */
    static final int OVERFETCH_FACTOR = 3;

    private final ObservationStore    store;
    private final SemanticIndex       index;
    private final ContextQueryBuilder queryBuilder;
    private final TimeLimiter         timeLimiter;
    private final ExecutorService     executor;
    private final MemoryProperties    properties;

    public HybridRetriever(ObservationStore store,
                           SemanticIndex index,
                           ContextQueryBuilder queryBuilder,
                           TimeLimiter semanticRetrievalTimeLimiter,
                           @Qualifier("memoryTaskExecutor") ExecutorService executor,
                           MemoryProperties properties) {
        this.store        = store;
        this.index        = index;
        this.queryBuilder = queryBuilder;
        this.timeLimiter  = semanticRetrievalTimeLimiter;
        this.executor     = executor;
        this.properties   = properties;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /** Hybrid retrieval with the configured recent and semantic counts. */
    public List<RetrievalResult> retrieve(QueryContext context) {
        MemoryProperties.Retrieval cfg = properties.retrieval();
        return retrieve(cfg.recentCount(), cfg.semanticTopK(), context);
    }

    public List<RetrievalResult> retrieve(int recentCount, int semanticTopK, QueryContext context) {
        List<RetrievalResult> results = new ArrayList<>();
        Set<Long> seen = new HashSet<>();
        for (ObservationRecord record : store.recent(recentCount)) {
            results.add(RetrievalResult.recency(record));
            seen.add(record.id());
        }
        if (semanticTopK <= 0) {
            return results;
        }

        String query;
        try {
            query = queryBuilder.build(context == null ? QueryContext.empty() : context);
        } catch (RuntimeException e) {
            log.warn("[Retriever] Could not build semantic query, using recency only: {}", e.getMessage());
            return results;
        }

        Optional<List<SemanticHit>> hits = searchIndex(query, overfetch(semanticTopK));
        if (hits.isEmpty()) {
            return results;
        }

        List<RetrievalResult> semantic = resolve(hits.get(), seen, semanticTopK);
        int budget = properties.retrieval().maxPromptRecords();
        if (budget > 0) {
            int room = Math.max(0, budget - results.size());
            if (semantic.size() > room) {
                log.debug("[Retriever] Prompt budget {} reached, dropping {} semantic result(s).",
                        budget, semantic.size() - room);
                semantic = semantic.subList(0, room);
            }
        }
        results.addAll(semantic);

        log.debug("[Retriever] query='{}' → {} recent + {} semantic", query,
                results.size() - semantic.size(), semantic.size());
        return results;
    }

    /**
     * Semantic-only lookup.
     *
     * @return empty when the semantic path is unavailable for this call; otherwise the
     *         resolved hits (possibly none), descending score
     */
    public Optional<List<RetrievalResult>> searchSemantic(String query, int topK) {
        if (query == null || query.isBlank() || topK <= 0) {
            return Optional.of(List.of());
        }
        return searchIndex(query.strip(), overfetch(topK)).map(hits -> resolve(hits, new HashSet<>(), topK));
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private Optional<List<SemanticHit>> searchIndex(String query, int topK) {
        if (!index.isAvailable()) {
            log.debug("[Retriever] Semantic index [{}] unavailable, skipping.", index.backendName());
            return Optional.empty();
        }
        try {
            List<SemanticHit> hits = timeLimiter.executeFutureSupplier(
                    () -> CompletableFuture.supplyAsync(() -> index.query(query, topK), executor));
            return Optional.of(hits == null ? List.of() : hits);
        } catch (TimeoutException e) {
            log.warn("[Retriever] Semantic lookup timed out after {} ms, using recency only.",
                    properties.retrieval().timeoutMillis());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Retriever] Interrupted during semantic lookup, using recency only.");
            return Optional.empty();
        } catch (Exception e) {
            log.warn("[Retriever] Semantic lookup failed ({}), using recency only: {}",
                    e.getClass().getSimpleName(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Resolves the best {@code limit} hits whose record is still stored, best first.
     * Hits for ids in {@code seen} use up a slot but are not returned again.
     */
    private List<RetrievalResult> resolve(List<SemanticHit> hits, Set<Long> seen, int limit) {
        List<SemanticHit> ordered = new ArrayList<>(hits);
        ordered.sort(Comparator.comparingDouble(SemanticHit::score).reversed());

        List<RetrievalResult> resolved = new ArrayList<>();
        int live = 0;
        for (SemanticHit hit : ordered) {
            if (live >= limit) break;
            Optional<ObservationRecord> record = store.findById(hit.recordId());
            if (record.isEmpty()) continue;
            live++;
            if (seen.add(hit.recordId())) {
                resolved.add(RetrievalResult.semantic(record.get(), hit.score()));
            }
        }
        return resolved;
    }

    private static int overfetch(int topK) {
        return topK > Integer.MAX_VALUE / OVERFETCH_FACTOR ? topK : topK * OVERFETCH_FACTOR;
    }
}
