package com.openforge.chronicle.config;

import com.openforge.chronicle.llm.LlmProperties;
import com.openforge.chronicle.memory.MemoryProperties;
import com.openforge.chronicle.memory.ObservationStore;
import com.openforge.chronicle.memory.index.EmbeddingProperties;
import com.openforge.chronicle.memory.index.MilvusProperties;
import com.openforge.chronicle.memory.index.SemanticIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Prints a structured startup summary once the context is ready.
 *
 * Reported:
 *   - Observation store: file, record count, retention policy
 *   - Semantic index: backend, availability, Milvus address when relevant
 *   - LLM providers: primary + fallback (API key masked)
 *   - Embedding: model + dimensions
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final LlmProperties       llmProperties;
    private final EmbeddingProperties embeddingProperties;
    private final MilvusProperties    milvusProperties;
    private final MemoryProperties    memoryProperties;
    private final ObservationStore    store;
    private final SemanticIndex       index;
    private final Environment         env;

    @Override
    public void run(ApplicationArguments args) {
        LlmProperties.ProviderConfig primary  = llmProperties.primary();
        LlmProperties.ProviderConfig fallback = llmProperties.fallback();

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║              Chronicle  ·  Startup Summary               ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Observation Store                                       ║
                ║    File           : {}
                ║    Records        : {}  (last id={})
                ║    Retention      : {} days, max {} entries
                ╠══════════════════════════════════════════════════════════╣
                ║  Semantic Index                                          ║
                ║    Backend        : {}  [{}]
                ║    Milvus         : {}:{}  collection={}  dim={}
                ╠══════════════════════════════════════════════════════════╣
                ║  LLM Providers                                           ║
                ║    Primary        : {}  [{}]  key={}
                ║    Fallback       : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Embedding                                               ║
                ║    Model          : {}  dim={}
                ║    Endpoint       : {}
                ╚══════════════════════════════════════════════════════════╝
                """,
                env.getProperty("server.port", "8080"),
                System.getProperty("java.version"),

                store.storeFile(),
                store.size(), store.stats().lastAssignedId(),
                memoryProperties.retentionDays(), memoryProperties.maxEntries(),

                index.backendName(), index.availability(),
                milvusProperties.host(), milvusProperties.port(),
                milvusProperties.collectionName(), milvusProperties.vectorDimensions(),

                primary.name(), primary.model(), maskKey(primary.apiKey()),
                fallback == null || fallback.baseUrl() == null
                        ? "(not configured)"
                        : "%s  [%s]  key=%s".formatted(fallback.name(), fallback.model(), maskKey(fallback.apiKey())),

                embeddingProperties.model(), embeddingProperties.dimensions(),
                embeddingProperties.baseUrl()
        );
    }

    /**
     * Shows the first 6 and last 4 characters; "(not set)" for blanks and placeholders.
     */
    static String maskKey(String key) {
        if (key == null || key.isBlank() || key.startsWith("sk-placeholder")) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
