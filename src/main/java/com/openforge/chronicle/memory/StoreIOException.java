package com.openforge.chronicle.memory;

/**
 * Persisting the observation log failed. The file on disk and the in-memory
 * snapshot are unchanged; the record that could not be committed is carried
 * along so the caller can hand it to {@link ObservationStore#retry}.
 */
public class StoreIOException extends RuntimeException {

    private final transient ObservationRecord pendingRecord;

    public StoreIOException(String message, Throwable cause) {
        this(message, cause, null);
    }

    public StoreIOException(String message, Throwable cause, ObservationRecord pendingRecord) {
        super(message, cause);
        this.pendingRecord = pendingRecord;
    }

    /** The record that was built but not persisted; null for failures outside append. */
    public ObservationRecord getPendingRecord() {
        return pendingRecord;
    }
}
