package com.openforge.chronicle.memory.index;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class InMemorySemanticIndexTest {

    private EmbeddingClient embeddingClient;
    private InMemorySemanticIndex index;

    @BeforeEach
    void setUp() {
        embeddingClient = mock(EmbeddingClient.class);
        when(embeddingClient.embed("rain on the street")).thenReturn(List.of(1f, 0f, 0f));
        when(embeddingClient.embed("sunny park")).thenReturn(List.of(0f, 1f, 0f));
        when(embeddingClient.embed("drizzle and wet roads")).thenReturn(List.of(0.9f, 0.1f, 0f));
        when(embeddingClient.embed("rainy weather")).thenReturn(List.of(1f, 0f, 0.01f));
        index = new InMemorySemanticIndex(embeddingClient);
    }

    @Test
    void shouldStartUnknownAndBecomeAvailable() {
        assertEquals(IndexAvailability.UNKNOWN, index.availability());
        assertTrue(index.isAvailable());

        index.add(1L, "rain on the street");

        assertEquals(IndexAvailability.AVAILABLE, index.availability());
    }

    @Test
    void shouldRankBySimilarity() {
        index.add(1L, "rain on the street");
        index.add(2L, "sunny park");
        index.add(3L, "drizzle and wet roads");

        List<SemanticHit> hits = index.query("rainy weather", 2);

        assertEquals(2, hits.size());
        assertEquals(1L, hits.get(0).recordId());
        assertEquals(3L, hits.get(1).recordId());
        assertTrue(hits.get(0).score() >= hits.get(1).score());
    }

    @Test
    void shouldReturnEmptyWhenNothingIndexed() {
        assertTrue(index.query("rainy weather", 5).isEmpty());
        verify(embeddingClient, never()).embed(anyString());
    }

    @Test
    void shouldReplaceEntryOnRepeatedAdd() {
        index.add(1L, "rain on the street");
        index.add(1L, "sunny park");

        List<SemanticHit> hits = index.query("sunny park", 5);

        assertEquals(1, index.size());
        assertEquals(1L, hits.get(0).recordId());
        assertEquals(1.0, hits.get(0).score(), 1e-5);
    }

    @Test
    void shouldBecomeUnavailableForGoodWhenEmbeddingFails() {
        when(embeddingClient.embed("broken")).thenThrow(new EmbeddingClient.EmbeddingException("HTTP 500"));

        assertThrows(SemanticIndexUnavailableException.class, () -> index.add(9L, "broken"));
        assertEquals(IndexAvailability.UNAVAILABLE, index.availability());
        assertFalse(index.isAvailable());

        assertThrows(SemanticIndexUnavailableException.class, () -> index.add(1L, "rain on the street"));
        assertThrows(SemanticIndexUnavailableException.class, () -> index.query("rainy weather", 3));
        verify(embeddingClient, never()).embed("rain on the street");
    }

    @Test
    void shouldClearEntriesOnReset() {
        index.add(1L, "rain on the street");

        index.reset();

        assertEquals(0, index.size());
        assertTrue(index.query("rainy weather", 3).isEmpty());
    }

    @Test
    void shouldRemoveEntriesOfPrunedRecords() {
        index.add(1L, "rain on the street");
        index.add(3L, "drizzle and wet roads");

        index.remove(List.of(1L, 99L));

        assertEquals(1, index.size());
        assertEquals(List.of(3L), index.query("rainy weather", 5).stream().map(SemanticHit::recordId).toList());
    }

    @Test
    void shouldScoreNonUnitVectorsAsCosine() {
        when(embeddingClient.embed("loud traffic")).thenReturn(List.of(30f, 40f, 0f));
        when(embeddingClient.embed("traffic noise")).thenReturn(List.of(3f, 4f, 0f));
        index.add(5L, "loud traffic");

        List<SemanticHit> hits = index.query("traffic noise", 1);

        assertEquals(1.0, hits.get(0).score(), 1e-5);
    }

    @Test
    void shouldRejectBlankText() {
        assertThrows(IllegalArgumentException.class, () -> index.add(1L, " "));
        assertTrue(index.isAvailable());
    }
}
