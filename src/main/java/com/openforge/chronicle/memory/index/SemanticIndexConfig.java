package com.openforge.chronicle.memory.index;

import io.milvus.v2.client.MilvusClientV2;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.Nullable;

/**
 * Selects the semantic index backend from {@code chronicle.memory.index.backend}:
 * {@code milvus} (default) or {@code in-memory}.
 */
@Configuration
public class SemanticIndexConfig {

    @Bean
    @ConditionalOnProperty(name = "chronicle.memory.index.backend", havingValue = "milvus", matchIfMissing = true)
    public SemanticIndex milvusSemanticIndex(@Nullable MilvusClientV2 milvusClient,
                                             EmbeddingClient embeddingClient,
                                             MilvusProperties milvusProperties) {
        return new MilvusSemanticIndex(milvusClient, embeddingClient, milvusProperties);
    }

    @Bean
    @ConditionalOnProperty(name = "chronicle.memory.index.backend", havingValue = "in-memory")
    public SemanticIndex inMemorySemanticIndex(EmbeddingClient embeddingClient) {
        return new InMemorySemanticIndex(embeddingClient);
    }
}
