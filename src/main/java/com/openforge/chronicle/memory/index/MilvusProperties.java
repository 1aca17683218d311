package com.openforge.chronicle.memory.index;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Connection parameters for the Milvus backend.
 *
 * application.yml:
 *
 * chronicle:
 *   milvus:
 *     enabled: true
 *     host: localhost
 *     port: 19530
 *     collection-name: observation_memories
 *     vector-dimensions: 1536
 *     connect-timeout-ms: 15000
 */
@ConfigurationProperties(prefix = "chronicle.milvus")
public record MilvusProperties(
        @DefaultValue("true")                 boolean enabled,
        @DefaultValue("localhost")            String  host,
        @DefaultValue("19530")                int     port,
        @DefaultValue("observation_memories") String  collectionName,
        @DefaultValue("1536")                 int     vectorDimensions,
        @DefaultValue("15000")                long    connectTimeoutMs
) {}
