package com.openforge.chronicle.memory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Append-only, retention-bounded observation log. This is the source of truth for memory;
 * the semantic index is derived from it.
 *
 * On-disk layout:
 * <pre>
 * {store-path}          JSON array of ObservationRecord, ascending id
 * {store-path}.seq      id high-water mark, so pruned ids are never handed out again
 * </pre>
 *
 * Writers are serialized by a single lock; every write replaces the file through
 * write-to-temp + atomic rename, and the in-memory snapshot is swapped only after
 * the rename succeeded. Readers work on the immutable snapshot without locking.
 */
@Slf4j
@Component
public class ObservationStore {

    private static final TypeReference<List<ObservationRecord>> RECORD_LIST = new TypeReference<>() {};

    private final Path                  storeFile;
    private final Path                  sequenceFile;
    private final ObservationSummarizer summarizer;
    private final ObjectMapper          objectMapper;
    private final Clock                 clock;
    private final int                   retentionDays;
    private final int                   maxEntries;

    private final ReentrantLock writeLock = new ReentrantLock();
    private final List<Consumer<List<Long>>> pruneListeners = new CopyOnWriteArrayList<>();

    /** Committed records, ascending id. Replaced wholesale, never mutated. */
    private volatile List<ObservationRecord> snapshot;
    private volatile long lastAssignedId;

    public ObservationStore(MemoryProperties properties,
                            ObservationSummarizer summarizer,
                            ObjectMapper objectMapper,
                            Clock clock) {
        this.storeFile     = Path.of(properties.storePath()).toAbsolutePath();
        this.sequenceFile  = storeFile.resolveSibling(storeFile.getFileName() + ".seq");
        this.summarizer    = summarizer;
        this.objectMapper  = objectMapper;
        this.clock         = clock;
        this.retentionDays = properties.retentionDays();
        this.maxEntries    = properties.maxEntries();
        load();
    }

    // ── Writes ───────────────────────────────────────────────────────────────

    /**
     * Summarizes the content synchronously, then appends it.
     *
     * @throws StoreIOException if the log could not be persisted; nothing changed on disk
     */
    public ObservationRecord append(String content, String sourceRef) {
        return append(content, sourceRef, summarizer.summarize(content));
    }

    /**
     * Appends with a precomputed summary, then applies the retention policy.
     *
     * @throws StoreIOException if the log could not be persisted; nothing changed on disk
     */
    public ObservationRecord append(String content, String sourceRef, String summary) {
        Objects.requireNonNull(content, "content");
        String effectiveSummary = summary == null || summary.isBlank() ? summarizer.fallback(content) : summary;

        writeLock.lock();
        try {
            long id = lastAssignedId + 1;
            // Reserve the id before any I/O: a failed write may leave a gap, never a duplicate.
            lastAssignedId = id;
            ObservationRecord record = new ObservationRecord(
                    id, clock.instant(), content, effectiveSummary, sourceRef);
            try {
                writeAtomically(sequenceFile, Long.toString(id).getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new StoreIOException("Failed to persist id high-water mark " + id, e, record);
            }
            commit(record);
            return record;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Re-attempts persisting a record whose append failed with {@link StoreIOException}.
     * Returns the record unchanged if it is already committed.
     */
    public ObservationRecord retry(ObservationRecord pending) {
        Objects.requireNonNull(pending, "pending");
        writeLock.lock();
        try {
            if (findById(pending.id()).isPresent()) {
                return pending;
            }
            if (pending.id() > lastAssignedId) {
                throw new IllegalArgumentException("Record id " + pending.id() + " was never issued by this store");
            }
            commit(pending);
            return pending;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Drops records older than the retention age and beyond the maximum count, oldest first.
     * Runs automatically inside every append; exposed for scheduled maintenance.
     *
     * @return number of records removed
     */
    public int prune() {
        writeLock.lock();
        try {
            List<ObservationRecord> current  = snapshot;
            List<ObservationRecord> retained = applyRetention(current, clock.instant());
            int removed = current.size() - retained.size();
            if (removed == 0) {
                return 0;
            }
            try {
                writeRecords(retained);
            } catch (IOException e) {
                throw new StoreIOException("Failed to persist pruned observation log", e);
            }
            snapshot = List.copyOf(retained);
            log.info("[Store] Pruned {} observation(s), {} remain.", removed, retained.size());
            notifyPruned(removedIds(current, retained));
            return removed;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Registers a callback that receives the ids of records dropped by retention, after the
     * pruned log was persisted. Callbacks run on the writing thread while the write lock is
     * held, so they must hand off any slow work.
     */
    public void onPrune(Consumer<List<Long>> listener) {
        pruneListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    // ── Reads ────────────────────────────────────────────────────────────────

    /** Up to {@code n} records, most recent first. Fewer records than asked is not an error. */
    public List<ObservationRecord> recent(int n) {
        List<ObservationRecord> current = snapshot;
        if (n <= 0 || current.isEmpty()) {
            return List.of();
        }
        int from = Math.max(0, current.size() - n);
        List<ObservationRecord> result = new ArrayList<>(current.size() - from);
        for (int i = current.size() - 1; i >= from; i--) {
            result.add(current.get(i));
        }
        return result;
    }

    public Optional<ObservationRecord> findById(long id) {
        for (ObservationRecord r : snapshot) {
            if (r.id() == id) return Optional.of(r);
        }
        return Optional.empty();
    }

    /** All committed records, oldest first. */
    public List<ObservationRecord> findAll() {
        return snapshot;
    }

    public int size() {
        return snapshot.size();
    }

    public StoreStats stats() {
        List<ObservationRecord> current = snapshot;
        if (current.isEmpty()) {
            return new StoreStats(0, null, null, lastAssignedId);
        }
        return new StoreStats(current.size(),
                current.get(0).timestamp(),
                current.get(current.size() - 1).timestamp(),
                lastAssignedId);
    }

    public Path storeFile() {
        return storeFile;
    }

    // ── Persistence ──────────────────────────────────────────────────────────

    private void commit(ObservationRecord record) {
        List<ObservationRecord> next = new ArrayList<>(snapshot);
        next.add(record);
        next.sort(Comparator.comparingLong(ObservationRecord::id));
        List<ObservationRecord> retained = applyRetention(next, clock.instant());
        try {
            writeRecords(retained);
        } catch (IOException e) {
            throw new StoreIOException("Failed to persist observation " + record.id(), e, record);
        }
        snapshot = List.copyOf(retained);

        int pruned = next.size() - retained.size();
        log.info("[Store] Appended observation #{} ({} stored{}).", record.id(), retained.size(),
                pruned > 0 ? ", pruned " + pruned : "");
        if (pruned > 0) {
            notifyPruned(removedIds(next, retained));
        }
    }

    private static List<Long> removedIds(List<ObservationRecord> before, List<ObservationRecord> after) {
        Set<Long> kept = new HashSet<>();
        for (ObservationRecord r : after) kept.add(r.id());
        List<Long> removed = new ArrayList<>();
        for (ObservationRecord r : before) {
            if (!kept.contains(r.id())) removed.add(r.id());
        }
        return removed;
    }

    private void notifyPruned(List<Long> ids) {
        if (ids.isEmpty()) return;
        List<Long> view = List.copyOf(ids);
        for (Consumer<List<Long>> listener : pruneListeners) {
            try {
                listener.accept(view);
            } catch (RuntimeException e) {
                log.warn("[Store] Prune listener failed for {} id(s): {}", view.size(), e.getMessage());
            }
        }
    }

    private List<ObservationRecord> applyRetention(List<ObservationRecord> records, Instant now) {
        List<ObservationRecord> retained = records;
        if (retentionDays > 0) {
            Instant cutoff = now.minus(Duration.ofDays(retentionDays));
            retained = retained.stream()
                    .filter(r -> r.timestamp() != null && !r.timestamp().isBefore(cutoff))
                    .toList();
        }
        if (maxEntries > 0 && retained.size() > maxEntries) {
            retained = retained.subList(retained.size() - maxEntries, retained.size());
        }
        return retained;
    }

    private void writeRecords(List<ObservationRecord> records) throws IOException {
        writeAtomically(storeFile, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(records));
    }

    /**
     * Writes to a sibling temp file and renames it over the target, so readers see
     * either the old or the new content, never a partial file.
     */
    private void writeAtomically(Path target, byte[] data) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.write(tmp, data);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    private void load() {
        try {
            Files.createDirectories(storeFile.getParent());
            List<ObservationRecord> records = List.of();
            if (Files.exists(storeFile)) {
                String json = Files.readString(storeFile).strip();
                if (!json.isEmpty()) {
                    records = new ArrayList<>(objectMapper.readValue(json, RECORD_LIST));
                }
            } else {
                writeRecords(List.of());
            }
            List<ObservationRecord> sorted = new ArrayList<>(records);
            sorted.sort(Comparator.comparingLong(ObservationRecord::id));
            snapshot = List.copyOf(sorted);

            long maxId = sorted.isEmpty() ? 0L : sorted.get(sorted.size() - 1).id();
            lastAssignedId = Math.max(maxId, readSequence());
            log.info("[Store] Loaded {} observation(s) from {} (last id={}).",
                    snapshot.size(), storeFile, lastAssignedId);
        } catch (IOException e) {
            throw new StoreIOException("Failed to load observation log " + storeFile, e);
        }
    }

    private long readSequence() throws IOException {
        if (!Files.exists(sequenceFile)) {
            return 0L;
        }
        String raw = Files.readString(sequenceFile).strip();
        try {
            return raw.isEmpty() ? 0L : Long.parseLong(raw);
        } catch (NumberFormatException e) {
            log.warn("[Store] Ignoring unreadable id high-water mark in {}: '{}'", sequenceFile, raw);
            return 0L;
        }
    }
}
