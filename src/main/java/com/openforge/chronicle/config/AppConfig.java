package com.openforge.chronicle.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Core infrastructure beans:
 *  - memoryTaskExecutor → background index writes and time-limited semantic lookups
 *  - Java HttpClient    → the ONLY HTTP engine; no WebClient, no RestTemplate
 *  - Jackson ObjectMapper → snake_case ↔ camelCase, Java time, tolerant deserialization
 *  - Clock              → UTC; replaced in tests to control retention
 */
@Configuration
public class AppConfig {

    private static final int MEMORY_WORKER_THREADS = 4;

    /**
     * Bounded pool shared by the semantic index writer and the retriever's time limiter.
     * Named "memoryTaskExecutor" to stay clear of Spring Boot's "applicationTaskExecutor".
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService memoryTaskExecutor() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("memory-");
        threadFactory.setDaemon(true);
        return Executors.newFixedThreadPool(MEMORY_WORKER_THREADS, threadFactory);
    }

    /**
     * Single, shared HttpClient instance for LLM and embedding calls.
     * Per-request read timeouts are set at call site.
     */
    @Bean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * Shared ObjectMapper, used for the OpenAI-compatible wire format and the observation log:
     *  - snake_case property names (tool_calls, finish_reason, source_ref …)
     *  - ISO-8601 dates, NOT timestamps
     *  - Unknown properties silently ignored (API can add fields without breaking us)
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
