package com.openforge.chronicle.memory.index;

import com.openforge.chronicle.memory.MemoryProperties;
import com.openforge.chronicle.memory.ObservationRecord;
import com.openforge.chronicle.memory.ObservationStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps the semantic index in step with the observation store.
 *
 * Index writes are best-effort and off the caller's thread: the store append
 * has already succeeded by the time {@link #submit} runs, and an index failure
 * only means the record will be found by recency alone until the next rebuild.
 * Records dropped by retention are removed from the index the same way.
 */
@Slf4j
@Component
public class SemanticIndexWriter {

    private final SemanticIndex    index;
    private final ObservationStore store;
    private final ExecutorService  executor;
    private final MemoryProperties properties;

    private final ReentrantLock rebuildLock = new ReentrantLock();

    public SemanticIndexWriter(SemanticIndex index,
                               ObservationStore store,
                               @Qualifier("memoryTaskExecutor") ExecutorService executor,
                               MemoryProperties properties) {
        this.index      = index;
        this.store      = store;
        this.executor   = executor;
        this.properties = properties;
        store.onPrune(this::removePruned);
    }

    /**
     * Schedules indexing of one record.
     *
     * @return completes with true when the entry was written; never completes exceptionally
     */
    public CompletableFuture<Boolean> submit(ObservationRecord record) {
        if (!index.isAvailable()) {
            log.debug("[Index] Skipped record #{}, index unavailable.", record.id());
            return CompletableFuture.completedFuture(false);
        }
        try {
            return CompletableFuture.supplyAsync(() -> indexQuietly(record), executor);
        } catch (RejectedExecutionException e) {
            log.warn("[Index] Executor rejected record #{}: {}", record.id(), e.getMessage());
            return CompletableFuture.completedFuture(false);
        }
    }

    /**
     * Schedules removal of entries whose records were pruned from the store.
     *
     * @return completes with true when the entries were removed; never completes exceptionally
     */
    public CompletableFuture<Boolean> removePruned(List<Long> recordIds) {
        if (recordIds == null || recordIds.isEmpty() || !index.isAvailable()) {
            return CompletableFuture.completedFuture(false);
        }
        try {
            return CompletableFuture.supplyAsync(() -> removeQuietly(recordIds), executor);
        } catch (RejectedExecutionException e) {
            log.warn("[Index] Executor rejected removal of {} pruned record(s): {}", recordIds.size(), e.getMessage());
            return CompletableFuture.completedFuture(false);
        }
    }

    /**
     * Drops the index and re-adds every stored record. Stops early if the
     * backend becomes unavailable part-way.
     */
    public RebuildReport rebuild() {
        if (!rebuildLock.tryLock()) {
            log.info("[Index] Rebuild already running, request ignored.");
            return new RebuildReport(store.size(), 0, 0, false, index.availability());
        }
        try {
            List<ObservationRecord> records = store.findAll();
            log.info("[Index] Rebuilding [{}] index from {} stored observation(s)...",
                    index.backendName(), records.size());
            try {
                index.reset();
            } catch (SemanticIndexUnavailableException e) {
                log.warn("[Index] Rebuild aborted, reset failed: {}", e.getMessage());
                return new RebuildReport(records.size(), 0, 0, true, index.availability());
            }

            int indexed = 0;
            int failed  = 0;
            for (ObservationRecord record : records) {
                if (!index.isAvailable()) break;
                if (indexQuietly(record)) indexed++;
                else failed++;
            }
            log.info("[Index] Rebuild finished: {}/{} indexed, {} failed, availability={}.",
                    indexed, records.size(), failed, index.availability());
            return new RebuildReport(records.size(), indexed, failed, true, index.availability());
        } finally {
            rebuildLock.unlock();
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void rebuildOnStartup() {
        if (!properties.index().rebuildOnStartup()) return;
        try {
            executor.execute(this::rebuild);
        } catch (RejectedExecutionException e) {
            log.warn("[Index] Startup rebuild could not be scheduled: {}", e.getMessage());
        }
    }

    private boolean indexQuietly(ObservationRecord record) {
        try {
            index.add(record.id(), record.promptText());
            return true;
        } catch (SemanticIndexUnavailableException e) {
            log.debug("[Index] Record #{} not indexed: {}", record.id(), e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.warn("[Index] Record #{} not indexed: {}", record.id(), e.getMessage());
            return false;
        }
    }

    private boolean removeQuietly(List<Long> recordIds) {
        try {
            index.remove(recordIds);
            log.debug("[Index] Removed {} pruned record(s): {}", recordIds.size(), recordIds);
            return true;
        } catch (RuntimeException e) {
            log.warn("[Index] Pruned record(s) {} not removed, a rebuild will clear them: {}",
                    recordIds, e.getMessage());
            return false;
        }
    }

    /**
     * @param started false when another rebuild was already running
     */
    public record RebuildReport(
            int               total,
            int               indexed,
            int               failed,
            boolean           started,
            IndexAvailability availability
    ) {}
}
