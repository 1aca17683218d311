package com.openforge.chronicle.memory.index;

import io.milvus.v2.client.ConnectConfig;
import io.milvus.v2.client.MilvusClientV2;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.Nullable;

/**
 * Milvus client bean, only when the Milvus index backend is selected.
 *
 * A failed connection does not fail startup: the bean is null, the Milvus
 * index starts out UNAVAILABLE, and retrieval runs on recency alone.
 * The collection itself is bootstrapped lazily by {@link MilvusSemanticIndex}.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "chronicle.memory.index.backend", havingValue = "milvus", matchIfMissing = true)
public class MilvusConfig {

    @Bean(destroyMethod = "close")
    @Nullable
    public MilvusClientV2 milvusClient(MilvusProperties props) {
        if (!props.enabled()) {
            log.info("[Milvus] Disabled by chronicle.milvus.enabled=false; semantic retrieval is off.");
            return null;
        }
        log.info("[Milvus] Connecting to {}:{}...", props.host(), props.port());
        try {
            MilvusClientV2 client = new MilvusClientV2(
                    ConnectConfig.builder()
                            .uri("http://%s:%d".formatted(props.host(), props.port()))
                            .connectTimeoutMs(props.connectTimeoutMs())
                            .build()
            );
            log.info("[Milvus] Connected successfully.");
            return client;
        } catch (Exception e) {
            log.warn("[Milvus] Connection failed, semantic retrieval will be DISABLED. Cause: {}. " +
                     "To suppress this warning, set chronicle.milvus.enabled=false " +
                     "or chronicle.memory.index.backend=in-memory.",
                    e.getMessage());
            return null;
        }
    }
}
