package com.openforge.chronicle.llm;

import com.openforge.chronicle.config.AppConfig;
import com.openforge.chronicle.llm.model.ChatRequest;
import com.openforge.chronicle.llm.model.ChatResponse;
import com.openforge.chronicle.llm.model.Message;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class LlmRouterTest {

    private static final String ANSWER = """
            {"id":"r1","model":"m","choices":[{"index":0,"message":{"role":"assistant","content":"%s"},
             "finish_reason":"stop"}]}
            """;

    private HttpClient httpClient;

    private final LlmProperties.ProviderConfig primary =
            new LlmProperties.ProviderConfig("groq", "https://primary.example.com/v1", "k1", "small-model", 5);
    private final LlmProperties.ProviderConfig fallback =
            new LlmProperties.ProviderConfig("openai", "https://fallback.example.com/v1", "k2", "big-model", 5);

    @BeforeEach
    void setUp() {
        httpClient = mock(HttpClient.class);
    }

    private LlmRouter router(LlmProperties.ProviderConfig fallbackConfig) {
        RetryConfig once = RetryConfig.custom().maxAttempts(1).build();
        return new LlmRouter(httpClient, new AppConfig().objectMapper(),
                new LlmProperties(primary, fallbackConfig),
                CircuitBreaker.ofDefaults("primaryLlm"),
                CircuitBreaker.ofDefaults("fallbackLlm"),
                Retry.of("primaryLlm", once),
                Retry.of("fallbackLlm", once));
    }

    @SuppressWarnings("unchecked")
    private static HttpResponse<String> response(int status, String body) {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        return response;
    }

    private void stubHost(String host, HttpResponse<String> response) throws Exception {
        doReturn(response).when(httpClient).send(argThat(req -> req != null && host.equals(req.uri().getHost())), any());
    }

    private static ChatRequest request() {
        return ChatRequest.summary(List.of(Message.user("hello")), 64);
    }

    @Test
    void shouldAnswerFromPrimary() throws Exception {
        stubHost("primary.example.com", response(200, ANSWER.formatted("from primary")));

        ChatResponse response = router(fallback).chat(request());

        assertEquals("from primary", response.firstMessage().content());
        verify(httpClient, times(1)).send(any(HttpRequest.class), any());
    }

    @Test
    void shouldEngageFallbackWhenPrimaryFails() throws Exception {
        stubHost("primary.example.com", response(500, "{\"error\":\"down\"}"));
        stubHost("fallback.example.com", response(200, ANSWER.formatted("from fallback")));

        ChatResponse response = router(fallback).chat(request());

        assertEquals("from fallback", response.firstMessage().content());
    }

    @Test
    void shouldPropagateWhenNoFallbackConfigured() throws Exception {
        stubHost("primary.example.com", response(429, "slow down"));

        LlmRouter router = router(null);

        assertFalse(router.hasFallback());
        assertThrows(LlmClient.LlmException.class, () -> router.chat(request()));
    }

    @Test
    void shouldFailWhenBothProvidersFail() throws Exception {
        stubHost("primary.example.com", response(500, "down"));
        stubHost("fallback.example.com", response(503, "also down"));

        assertThrows(LlmClient.LlmException.class, () -> router(fallback).chat(request()));
    }

    @Test
    void shouldRequirePrimaryProvider() {
        assertThrows(IllegalStateException.class, () -> new LlmRouter(httpClient, new AppConfig().objectMapper(),
                new LlmProperties(null, null),
                CircuitBreaker.ofDefaults("p"), CircuitBreaker.ofDefaults("f"),
                Retry.ofDefaults("p"), Retry.ofDefaults("f")));
    }
}
