package com.openforge.chronicle.agent;

import com.openforge.chronicle.memory.MemoryProperties;
import com.openforge.chronicle.memory.ObservationRecord;
import com.openforge.chronicle.memory.ObservationStore;
import com.openforge.chronicle.memory.retrieval.HybridRetriever;
import com.openforge.chronicle.memory.retrieval.RetrievalResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Read-only memory lookups a generation step can request on demand.
 *
 * Semantic search is preferred; whenever the semantic path is unavailable the
 * lookups fall back to a keyword scan over the most recent records. None of
 * these methods throw for backend failures.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MemoryQueryTools {

    static final int MIN_LIMIT = 1;

    /** Query words of this length or shorter are ignored by the keyword scan. */
    private static final int MIN_KEYWORD_LENGTH = 4;

    private final HybridRetriever  retriever;
    private final ObservationStore store;
    private final MemoryProperties properties;

    /**
     * Records most related to {@code query}, best first.
     *
     * @param topK clamped to 1..max-results
     */
    public List<RetrievalResult> queryMemories(String query, int topK) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        int limit = clamp(topK);
        Optional<List<RetrievalResult>> semantic = retriever.searchSemantic(query, limit);
        if (semantic.isPresent()) {
            return semantic.get();
        }
        log.debug("[Tools] Semantic path unavailable, keyword scan for '{}'.", query);
        return keywordScan(query, limit).stream()
                .map(RetrievalResult::keyword)
                .toList();
    }

    /**
     * The most recent records, newest first.
     *
     * @param count clamped to 1..max-results
     */
    public List<ObservationRecord> getRecentMemories(int count) {
        return store.recent(clamp(count));
    }

    /**
     * Whether anything is remembered about {@code topic}: a semantic hit at or above
     * min-relevance, or else a keyword match.
     */
    public ExistenceCheck checkMemoryExists(String topic) {
        if (topic == null || topic.isBlank()) {
            return ExistenceCheck.none(topic);
        }
        Optional<List<RetrievalResult>> semantic = retriever.searchSemantic(topic, 1);
        if (semantic.isPresent() && !semantic.get().isEmpty()) {
            RetrievalResult best = semantic.get().get(0);
            if (best.score() != null && best.score() >= properties.tools().minRelevance()) {
                return new ExistenceCheck(topic, true, best.record(), best.score());
            }
        }
        List<ObservationRecord> matches = keywordScan(topic, 1);
        if (!matches.isEmpty()) {
            return new ExistenceCheck(topic, true, matches.get(0), null);
        }
        return ExistenceCheck.none(topic);
    }

    // ── Keyword fallback ─────────────────────────────────────────────────────

    /**
     * Scans the keyword-scan-depth most recent records, newest first. A record matches when
     * the whole query is a substring of its text, or any query word longer than three
     * characters is.
     */
    List<ObservationRecord> keywordScan(String query, int limit) {
        String needle = query.toLowerCase(Locale.ROOT).strip();
        List<String> words = Arrays.stream(needle.split("\\s+"))
                .filter(w -> w.length() >= MIN_KEYWORD_LENGTH)
                .toList();

        List<ObservationRecord> matches = new ArrayList<>();
        for (ObservationRecord record : store.recent(properties.tools().keywordScanDepth())) {
            String text = record.promptText().toLowerCase(Locale.ROOT);
            if (text.contains(needle) || words.stream().anyMatch(text::contains)) {
                matches.add(record);
                if (matches.size() >= limit) break;
            }
        }
        return matches;
    }

    private int clamp(int requested) {
        int max = Math.max(MIN_LIMIT, properties.tools().maxResults());
        return Math.max(MIN_LIMIT, Math.min(requested, max));
    }

    /**
     * @param example a matching record when {@code exists}
     * @param score   semantic score of the example; null when it came from the keyword scan
     */
    public record ExistenceCheck(
            String            topic,
            boolean           exists,
            ObservationRecord example,
            Double            score
    ) {
        static ExistenceCheck none(String topic) {
            return new ExistenceCheck(topic, false, null, null);
        }
    }
}
