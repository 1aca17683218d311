package com.openforge.chronicle.agent;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Generation settings for the observation cycle.
 *
 * application.yml:
 *
 * chronicle:
 *   generation:
 *     max-iterations: 10
 *     system-prompt: |
 *       You are ...
 */
@ConfigurationProperties(prefix = "chronicle.generation")
public record GenerationProperties(
        @DefaultValue("You are a robot diarist who writes short narrative observations of what you see. "
                + "You have a memory of earlier observations and tools to search it. "
                + "Refer back to earlier observations when something genuinely connects.")
        String systemPrompt,
        @DefaultValue("10") int maxIterations
) {}
