package com.openforge.chronicle.memory;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Snapshot statistics of the observation log.
 *
 * @param lastAssignedId high-water mark; the next append gets a larger id
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StoreStats(
        int     totalEntries,
        Instant oldestEntry,
        Instant newestEntry,
        long    lastAssignedId
) {}
