package com.openforge.chronicle.memory.index;

import com.openforge.chronicle.config.AppConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class EmbeddingClientTest {

    private HttpClient httpClient;
    private HttpResponse<String> response;
    private EmbeddingClient client;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        httpClient = mock(HttpClient.class);
        response = mock(HttpResponse.class);
        client = new EmbeddingClient(httpClient, new AppConfig().objectMapper(),
                new EmbeddingProperties("https://embed.example.com/v1", "sk-test", "text-embedding-3-small", 3, 5));
    }

    @Test
    void shouldReturnFirstEmbedding() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("""
                {"object":"list","model":"text-embedding-3-small",
                 "data":[{"object":"embedding","index":0,"embedding":[0.1,0.2,0.3]}]}
                """);
        doReturn(response).when(httpClient).send(any(HttpRequest.class), any());

        List<Float> vector = client.embed("rain on the plaza");

        assertEquals(List.of(0.1f, 0.2f, 0.3f), vector);
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any());
        assertEquals("https://embed.example.com/v1/embeddings", captor.getValue().uri().toString());
        assertEquals("Bearer sk-test", captor.getValue().headers().firstValue("Authorization").orElseThrow());
    }

    @Test
    void shouldFailOnHttpError() throws Exception {
        when(response.statusCode()).thenReturn(500);
        when(response.body()).thenReturn("{\"error\":\"boom\"}");
        doReturn(response).when(httpClient).send(any(HttpRequest.class), any());

        assertThrows(EmbeddingClient.EmbeddingException.class, () -> client.embed("rain"));
    }

    @Test
    void shouldFailOnEmptyData() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"data\":[]}");
        doReturn(response).when(httpClient).send(any(HttpRequest.class), any());

        assertThrows(EmbeddingClient.EmbeddingException.class, () -> client.embed("rain"));
    }

    @Test
    void shouldWrapNetworkErrors() throws Exception {
        doThrow(new IOException("connection reset")).when(httpClient).send(any(HttpRequest.class), any());

        EmbeddingClient.EmbeddingException e =
                assertThrows(EmbeddingClient.EmbeddingException.class, () -> client.embed("rain"));
        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    void shouldRequireBaseUrl() {
        EmbeddingClient unconfigured = new EmbeddingClient(httpClient, new AppConfig().objectMapper(),
                new EmbeddingProperties(null, null, "m", 3, 5));

        assertThrows(EmbeddingClient.EmbeddingException.class, () -> unconfigured.embed("rain"));
        verifyNoInteractions(httpClient);
    }

    @Test
    void shouldRejectBlankText() {
        assertThrows(IllegalArgumentException.class, () -> client.embed(" "));
    }
}
