package com.openforge.chronicle.memory.index;

import java.util.Collection;
import java.util.List;

/**
 * Similarity search over observation synopses.
 *
 * The index is a derived cache of the observation store: entries reference
 * record ids, may lag behind the store, and can be rebuilt from it at any time.
 * Once an implementation reports {@link IndexAvailability#UNAVAILABLE}, every
 * call fails fast with {@link SemanticIndexUnavailableException}.
 */
public interface SemanticIndex {

    /**
     * Embeds {@code text} and stores it under {@code recordId}, replacing any previous entry.
     *
     * @throws SemanticIndexUnavailableException if the backend is or became unavailable
     */
    void add(long recordId, String text);

    /**
     * At most {@code topK} hits ordered by descending score; empty when nothing is indexed.
     *
     * @throws SemanticIndexUnavailableException if the backend is or became unavailable
     */
    List<SemanticHit> query(String text, int topK);

    /**
     * Drops the entries of records that left the store. Unknown ids are ignored.
     *
     * @throws SemanticIndexUnavailableException if the backend is or became unavailable
     */
    void remove(Collection<Long> recordIds);

    /** Drops every entry. Used before a full rebuild from the store. */
    void reset();

    IndexAvailability availability();

    /** True unless the backend is known to be unavailable. */
    default boolean isAvailable() {
        return availability() != IndexAvailability.UNAVAILABLE;
    }

    /** Short backend label for logs and stats. */
    String backendName();
}
