package com.openforge.chronicle.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.chronicle.llm.model.ChatRequest;
import com.openforge.chronicle.llm.model.ChatResponse;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.function.Supplier;

/**
 * High-availability LLM request router shared by the summarizer and the tool-call loop.
 *
 * Call graph:
 *
 *   chat(request)
 *     └─ primaryCircuitBreaker + primaryRetry
 *           └─ primaryLlmClient.chat(request)
 *                 ↓ (on CallNotPermittedException or any exception)
 *     └─ fallbackCircuitBreaker + fallbackRetry      (only when a fallback is configured)
 *           └─ fallbackLlmClient.chat(request)
 */
@Slf4j
@Component
@EnableConfigurationProperties(LlmProperties.class)
public class LlmRouter {

    private final LlmClient      primaryClient;
    private final LlmClient      fallbackClient;
    private final CircuitBreaker primaryCb;
    private final CircuitBreaker fallbackCb;
    private final Retry          primaryRetry;
    private final Retry          fallbackRetry;

    public LlmRouter(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties properties,
                     CircuitBreaker primaryLlmCircuitBreaker,
                     CircuitBreaker fallbackLlmCircuitBreaker,
                     Retry primaryLlmRetry,
                     Retry fallbackLlmRetry) {
        if (properties.primary() == null) {
            throw new IllegalStateException("chronicle.llm.primary must be configured");
        }
        this.primaryClient  = new LlmClient(httpClient, objectMapper, properties.primary());
        this.fallbackClient = properties.fallback() == null || properties.fallback().baseUrl() == null
                ? null
                : new LlmClient(httpClient, objectMapper, properties.fallback());
        this.primaryCb      = primaryLlmCircuitBreaker;
        this.fallbackCb     = fallbackLlmCircuitBreaker;
        this.primaryRetry   = primaryLlmRetry;
        this.fallbackRetry  = fallbackLlmRetry;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * Route a chat request through primary → fallback with full resilience.
     *
     * The model field in ChatRequest is overridden by the provider's own
     * configured model name, so callers only pass messages and tools.
     */
    public ChatResponse chat(ChatRequest request) {
        try {
            ChatRequest primaryRequest = overrideModel(request, primaryClient.modelName());
            return executeWithResilience(primaryCb, primaryRetry,
                    () -> primaryClient.chat(primaryRequest), "primary");
        } catch (RuntimeException primaryException) {
            if (fallbackClient == null) {
                throw primaryException;
            }
            log.warn("[LlmRouter] Primary provider failed ({}), engaging fallback. Cause: {}",
                    primaryException.getClass().getSimpleName(), primaryException.getMessage());

            ChatRequest fallbackRequest = overrideModel(request, fallbackClient.modelName());
            return executeWithResilience(fallbackCb, fallbackRetry,
                    () -> fallbackClient.chat(fallbackRequest), "fallback");
        }
    }

    public String primaryProvider() {
        return primaryClient.providerName();
    }

    public boolean hasFallback() {
        return fallbackClient != null;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    /**
     * Decorates a supplier with circuit-breaker + retry, then executes it.
     */
    private ChatResponse executeWithResilience(CircuitBreaker cb,
                                               Retry retry,
                                               Supplier<ChatResponse> call,
                                               String label) {
        Supplier<ChatResponse> decorated =
                CircuitBreaker.decorateSupplier(cb,
                        Retry.decorateSupplier(retry, call));
        try {
            return decorated.get();
        } catch (LlmClient.LlmException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new LlmClient.LlmException(
                    "[LlmRouter] %s provider ultimately failed: %s".formatted(label, e.getMessage()), e);
        }
    }

    private ChatRequest overrideModel(ChatRequest original, String modelName) {
        return original.toBuilder().model(modelName).build();
    }
}
