package com.openforge.chronicle.memory;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Memory engine configuration.
 *
 * application.yml:
 *
 * chronicle:
 *   memory:
 *     store-path: ./data/memory/observations.json
 *     retention-days: 30        # 0 disables age-based pruning
 *     max-entries: 50           # 0 disables count-based pruning
 *     display-zone: America/Chicago
 *     summary:
 *       enabled: true
 *       max-length: 400
 *       fallback-length: 200
 *     retrieval:
 *       recent-count: 5
 *       semantic-top-k: 5
 *       max-prompt-records: 10
 *       timeout-millis: 5000
 *     tools:
 *       keyword-scan-depth: 50
 *       min-relevance: 0.3
 *       max-results: 10
 *     index:
 *       backend: milvus         # milvus | in-memory
 *       rebuild-on-startup: false
 */
@ConfigurationProperties(prefix = "chronicle.memory")
public record MemoryProperties(
        @DefaultValue("./data/memory/observations.json") String storePath,
        @DefaultValue("30") int retentionDays,
        @DefaultValue("50") int maxEntries,
        @DefaultValue("UTC") String displayZone,
        @DefaultValue Summary summary,
        @DefaultValue Retrieval retrieval,
        @DefaultValue Tools tools,
        @DefaultValue Index index
) {

    public record Summary(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("400") int maxLength,
            @DefaultValue("200") int fallbackLength
    ) {}

    /**
     * @param maxPromptRecords upper bound on one retrieval result; semantic results are trimmed first
     */
    public record Retrieval(
            @DefaultValue("5") int recentCount,
            @DefaultValue("5") int semanticTopK,
            @DefaultValue("10") int maxPromptRecords,
            @DefaultValue("5000") long timeoutMillis
    ) {}

    public record Tools(
            @DefaultValue("50") int keywordScanDepth,
            @DefaultValue("0.3") double minRelevance,
            @DefaultValue("10") int maxResults
    ) {}

    public record Index(
            @DefaultValue("milvus") Backend backend,
            @DefaultValue("false") boolean rebuildOnStartup
    ) {}

    public enum Backend {
        MILVUS,
        IN_MEMORY
    }
}
