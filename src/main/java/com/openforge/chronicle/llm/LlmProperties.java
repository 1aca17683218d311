package com.openforge.chronicle.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Externalised LLM provider configuration.
 *
 * Reads from application.yml under the "chronicle.llm" prefix:
 *
 * chronicle:
 *   llm:
 *     primary:
 *       name: groq
 *       base-url: https://api.groq.com/openai/v1
 *       api-key: gsk-...
 *       model: openai/gpt-oss-20b
 *       timeout-seconds: 60
 *     fallback:            # optional
 *       name: openai
 *       base-url: https://api.openai.com/v1
 *       api-key: sk-...
 *       model: gpt-4o-mini
 *       timeout-seconds: 60
 */
@ConfigurationProperties(prefix = "chronicle.llm")
public record LlmProperties(
        ProviderConfig primary,
        ProviderConfig fallback
) {

    public record ProviderConfig(
            String name,
            String baseUrl,
            String apiKey,
            String model,
            @DefaultValue("60") int timeoutSeconds
    ) {}
}
