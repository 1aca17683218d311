package com.openforge.chronicle.memory.retrieval;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.openforge.chronicle.memory.ObservationRecord;

/**
 * One record selected for a prompt.
 *
 * @param score similarity score, present only for {@link RankSource#SEMANTIC} results
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RetrievalResult(
        ObservationRecord record,
        RankSource        rankSource,
        Double            score
) {

    public static RetrievalResult recency(ObservationRecord record) {
        return new RetrievalResult(record, RankSource.RECENCY, null);
    }

    public static RetrievalResult keyword(ObservationRecord record) {
        return new RetrievalResult(record, RankSource.KEYWORD, null);
    }

    public static RetrievalResult semantic(ObservationRecord record, double score) {
        return new RetrievalResult(record, RankSource.SEMANTIC, score);
    }
}
