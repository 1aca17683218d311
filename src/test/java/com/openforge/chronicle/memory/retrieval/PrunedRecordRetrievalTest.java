package com.openforge.chronicle.memory.retrieval;

import com.openforge.chronicle.config.AppConfig;
import com.openforge.chronicle.memory.MemoryProperties;
import com.openforge.chronicle.memory.ObservationRecord;
import com.openforge.chronicle.memory.ObservationStore;
import com.openforge.chronicle.memory.ObservationSummarizer;
import com.openforge.chronicle.memory.index.EmbeddingClient;
import com.openforge.chronicle.memory.index.InMemorySemanticIndex;
import com.openforge.chronicle.memory.index.SemanticIndexWriter;
import com.openforge.chronicle.support.MutableClock;
import com.openforge.chronicle.support.TestProperties;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Store retention and the in-memory index wired together: records dropped by
 * count pruning must not keep their embeddings competing for top-K slots.
 */
class PrunedRecordRetrievalTest {

    private static final Set<Long> LIVE_IDS = Set.of(16L, 17L, 18L, 19L, 20L);

    @TempDir
    Path tempDir;

    private ExecutorService indexExecutor;
    private ExecutorService queryExecutor;
    private ObservationStore store;
    private InMemorySemanticIndex index;
    private MemoryProperties properties;

    @BeforeEach
    void setUp() {
        properties = TestProperties.memory(tempDir.resolve("observations.json"), 0, 5);
        store = new ObservationStore(properties, mock(ObservationSummarizer.class),
                new AppConfig().objectMapper(), new MutableClock(Instant.parse("2025-11-03T18:00:00Z")));

        // Old observations sit right on the query vector; fresh ones are weaker matches.
        EmbeddingClient embeddingClient = mock(EmbeddingClient.class);
        when(embeddingClient.embed(anyString())).thenAnswer(invocation ->
                invocation.getArgument(0, String.class).startsWith("fresh")
                        ? List.of(0.6f, 0.8f, 0f)
                        : List.of(1f, 0f, 0f));
        index = new InMemorySemanticIndex(embeddingClient);

        indexExecutor = Executors.newSingleThreadExecutor();
        queryExecutor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() throws Exception {
        indexExecutor.shutdownNow();
        queryExecutor.shutdownNow();
        indexExecutor.awaitTermination(5, TimeUnit.SECONDS);
        queryExecutor.awaitTermination(5, TimeUnit.SECONDS);
    }

    private void appendAndIndex(SemanticIndexWriter writer) throws Exception {
        for (int i = 1; i <= 20; i++) {
            String summary = (i <= 15 ? "old rain " : "fresh rain ") + i;
            ObservationRecord record = store.append("observation " + i, null, summary);
            writer.submit(record);
        }
        indexExecutor.submit(() -> { }).get(5, TimeUnit.SECONDS);
    }

    private HybridRetriever retriever() {
        TimeLimiter limiter = TimeLimiter.of("test", TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofSeconds(2))
                .build());
        return new HybridRetriever(store, index, new SituationalQueryBuilder(), limiter, queryExecutor, properties);
    }

    private static Set<Long> ids(List<RetrievalResult> results) {
        return results.stream().map(r -> r.record().id()).collect(Collectors.toSet());
    }

    @Test
    void shouldDropEmbeddingsOfPrunedRecords() throws Exception {
        appendAndIndex(new SemanticIndexWriter(index, store, indexExecutor, properties));

        assertEquals(5, store.size());
        assertEquals(5, index.size());
    }

    @Test
    void shouldReturnLiveRecordsAfterPruning() throws Exception {
        appendAndIndex(new SemanticIndexWriter(index, store, indexExecutor, properties));
        HybridRetriever retriever = retriever();

        List<RetrievalResult> semantic = retriever.searchSemantic("rain", 5).orElseThrow();
        List<RetrievalResult> hybrid = retriever.retrieve(0, 5, QueryContext.ofQuery("rain"));

        assertEquals(LIVE_IDS, ids(semantic));
        assertEquals(5, semantic.size());
        assertEquals(LIVE_IDS, ids(hybrid));
        assertTrue(hybrid.stream().allMatch(r -> r.rankSource() == RankSource.SEMANTIC));
    }

    @Test
    void shouldStillFillTopKWhenStaleEntriesRemain() throws Exception {
        // Removal is skipped here, as if the index was down when the records were pruned.
        for (int i = 1; i <= 8; i++) {
            String summary = (i <= 3 ? "old rain " : "fresh rain ") + i;
            ObservationRecord record = store.append("observation " + i, null, summary);
            index.add(record.id(), summary);
        }
        assertEquals(5, store.size());
        assertEquals(8, index.size());

        List<RetrievalResult> semantic = retriever().searchSemantic("rain", 2).orElseThrow();

        assertEquals(2, semantic.size());
        assertTrue(Set.of(4L, 5L, 6L, 7L, 8L).containsAll(ids(semantic)));
    }
}
