package com.openforge.chronicle.memory;

import com.openforge.chronicle.memory.index.SemanticIndexWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for new observations: durable append first, then best-effort indexing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ObservationRecorder {

    private final ObservationStore    store;
    private final SemanticIndexWriter indexWriter;

    /**
     * Appends the observation, retrying the write once with the same record if the
     * first attempt could not be persisted, then schedules it for indexing.
     *
     * @throws StoreIOException if both attempts failed; nothing is indexed then
     */
    public ObservationRecord record(String content, String sourceRef) {
        ObservationRecord record;
        try {
            record = store.append(content, sourceRef);
        } catch (StoreIOException e) {
            if (e.getPendingRecord() == null) throw e;
            log.warn("[Store] Write of observation #{} failed, retrying once: {}",
                    e.getPendingRecord().id(), e.getMessage());
            record = store.retry(e.getPendingRecord());
        }
        indexWriter.submit(record);
        return record;
    }
}
