package com.openforge.chronicle.memory.index;

/**
 * Vector held by the in-memory backend for one observation.
 *
 * @param recordId weak reference to an ObservationRecord id; the record may have been pruned since
 * @param vector   L2-normalized embedding
 */
public record EmbeddingEntry(long recordId, float[] vector) {}
