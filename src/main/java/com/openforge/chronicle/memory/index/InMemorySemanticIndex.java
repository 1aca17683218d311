package com.openforge.chronicle.memory.index;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local semantic index: brute-force cosine similarity over normalized vectors.
 *
 * Intended for small stores and for running without a vector database. Entries
 * live only as long as the process, so pair it with
 * {@code chronicle.memory.index.rebuild-on-startup=true}.
 */
@Slf4j
public class InMemorySemanticIndex extends AbstractSemanticIndex {

    private final EmbeddingClient                embeddingClient;
    private final Map<Long, EmbeddingEntry>      entries = new ConcurrentHashMap<>();

    public InMemorySemanticIndex(EmbeddingClient embeddingClient) {
        super(IndexAvailability.UNKNOWN);
        this.embeddingClient = embeddingClient;
    }

    @Override
    public void add(long recordId, String text) {
        requireAvailable();
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Cannot index blank text for record " + recordId);
        }
        float[] vector;
        try {
            vector = VectorMath.normalize(embeddingClient.embed(text));
        } catch (Exception e) {
            throw markUnavailable("add", e);
        }
        entries.put(recordId, new EmbeddingEntry(recordId, vector));
        markAvailable();
        log.debug("[Index] Stored record #{} in memory ({} entries).", recordId, entries.size());
    }

    @Override
    public List<SemanticHit> query(String text, int topK) {
        requireAvailable();
        if (text == null || text.isBlank() || topK <= 0 || entries.isEmpty()) {
            return List.of();
        }
        float[] queryVector;
        try {
            queryVector = VectorMath.normalize(embeddingClient.embed(text));
        } catch (Exception e) {
            throw markUnavailable("query", e);
        }
        markAvailable();

        List<SemanticHit> hits = new ArrayList<>(entries.size());
        for (EmbeddingEntry entry : entries.values()) {
            if (entry.vector().length != queryVector.length) continue;
            hits.add(new SemanticHit(entry.recordId(), VectorMath.dot(queryVector, entry.vector())));
        }
        hits.sort(Comparator.comparingDouble(SemanticHit::score).reversed()
                .thenComparing(Comparator.comparingLong(SemanticHit::recordId).reversed()));
        return hits.size() > topK ? List.copyOf(hits.subList(0, topK)) : hits;
    }

    @Override
    public void reset() {
        requireAvailable();
        entries.clear();
    }

    @Override
    public void remove(Collection<Long> recordIds) {
        requireAvailable();
        if (recordIds == null || recordIds.isEmpty()) return;
        entries.keySet().removeAll(recordIds);
        log.debug("[Index] Removed {} record(s) from memory ({} entries).", recordIds.size(), entries.size());
    }

    @Override
    public String backendName() {
        return "in-memory";
    }

    public int size() {
        return entries.size();
    }
}
