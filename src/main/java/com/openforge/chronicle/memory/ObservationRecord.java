package com.openforge.chronicle.memory;

import java.time.Instant;

/**
 * One persisted observation.
 *
 * Serialized into the observation log as
 * {"id":1,"timestamp":"2025-01-01T15:00:00Z","content":"…","summary":"…","source_ref":"…"}.
 *
 * @param id        store-assigned, strictly increasing, never reused
 * @param timestamp when the observation was made (UTC)
 * @param content   full narrative text
 * @param summary   short synopsis; may be the truncation fallback of {@code content}
 * @param sourceRef opaque reference to the originating artifact (e.g. an image name); may be null
 */
public record ObservationRecord(
        long    id,
        Instant timestamp,
        String  content,
        String  summary,
        String  sourceRef
) {

    /** Text used for prompts and embeddings: the synopsis when present, else the full content. */
    public String promptText() {
        if (summary != null && !summary.isBlank()) return summary;
        return content == null ? "" : content;
    }
}
