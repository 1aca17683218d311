package com.openforge.chronicle.memory.index;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Body of POST /embeddings.
 *
 * {"input": "text", "model": "text-embedding-3-small", "dimensions": 1536}
 *
 * dimensions is omitted when not positive; only text-embedding-3-* honours it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EmbeddingRequest(
        String  input,
        String  model,
        Integer dimensions
) {
    public static EmbeddingRequest of(String input, String model, int dimensions) {
        return new EmbeddingRequest(input, model, dimensions > 0 ? dimensions : null);
    }
}
