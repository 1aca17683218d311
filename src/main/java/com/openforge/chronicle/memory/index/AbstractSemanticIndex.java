package com.openforge.chronicle.memory.index;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Availability bookkeeping shared by the index backends.
 */
@Slf4j
abstract class AbstractSemanticIndex implements SemanticIndex {

    private final AtomicReference<IndexAvailability> availability;

    protected AbstractSemanticIndex(IndexAvailability initial) {
        this.availability = new AtomicReference<>(initial);
    }

    @Override
    public IndexAvailability availability() {
        return availability.get();
    }

    protected void requireAvailable() {
        if (availability.get() == IndexAvailability.UNAVAILABLE) {
            throw new SemanticIndexUnavailableException("Semantic index [%s] is unavailable".formatted(backendName()));
        }
    }

    protected void markAvailable() {
        if (availability.compareAndSet(IndexAvailability.UNKNOWN, IndexAvailability.AVAILABLE)) {
            log.info("[Index] Backend [{}] is available.", backendName());
        }
    }

    /**
     * Flips the index to UNAVAILABLE and returns the exception the caller should throw.
     */
    protected SemanticIndexUnavailableException markUnavailable(String operation, Exception cause) {
        if (availability.getAndSet(IndexAvailability.UNAVAILABLE) != IndexAvailability.UNAVAILABLE) {
            log.warn("[Index] Backend [{}] failed during {} and is now DISABLED for this process. Cause: {}",
                    backendName(), operation, cause.getMessage());
        }
        return new SemanticIndexUnavailableException(
                "Semantic index [%s] failed during %s".formatted(backendName(), operation), cause);
    }
}
