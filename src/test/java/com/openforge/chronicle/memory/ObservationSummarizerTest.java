package com.openforge.chronicle.memory;

import com.openforge.chronicle.llm.LlmClient;
import com.openforge.chronicle.llm.LlmRouter;
import com.openforge.chronicle.llm.model.ChatRequest;
import com.openforge.chronicle.llm.model.ChatResponse;
import com.openforge.chronicle.llm.model.Message;
import com.openforge.chronicle.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ObservationSummarizerTest {

    private LlmRouter llmRouter;
    private ObservationSummarizer summarizer;

    @BeforeEach
    void setUp() {
        llmRouter = mock(LlmRouter.class);
        summarizer = new ObservationSummarizer(llmRouter, TestProperties.memory(Path.of("unused.json")));
    }

    @Test
    void shouldReturnModelSynopsis() {
        when(llmRouter.chat(any())).thenReturn(ChatResponse.of(Message.assistantText("  A rainy street, two cyclists.  ")));

        assertEquals("A rainy street, two cyclists.", summarizer.summarize("Long observation about rain and cyclists."));
    }

    @Test
    void shouldAskForSynopsisWithinMaxLength() {
        when(llmRouter.chat(any())).thenReturn(ChatResponse.of(Message.assistantText("ok")));

        summarizer.summarize("Some observation.");

        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(llmRouter).chat(captor.capture());
        String prompt = captor.getValue().messages().get(1).content();
        assertTrue(prompt.contains("400 characters"));
        assertTrue(prompt.contains("Some observation."));
    }

    @Test
    void shouldStripWrappingQuotes() {
        when(llmRouter.chat(any())).thenReturn(ChatResponse.of(Message.assistantText("\"Quoted synopsis\"")));

        assertEquals("Quoted synopsis", summarizer.summarize("content"));
    }

    @Test
    void shouldCapModelOutputAtMaxLength() {
        when(llmRouter.chat(any())).thenReturn(ChatResponse.of(Message.assistantText("x".repeat(1000))));

        assertEquals(400, summarizer.summarize("content").length());
    }

    @Test
    void shouldFallBackToTruncationWhenModelFails() {
        when(llmRouter.chat(any())).thenThrow(new LlmClient.LlmException("quota exceeded"));
        String content = "y".repeat(1000);

        String summary = summarizer.summarize(content);

        assertEquals("y".repeat(200) + "...", summary);
    }

    @Test
    void shouldFallBackWhenModelReturnsBlank() {
        when(llmRouter.chat(any())).thenReturn(ChatResponse.of(Message.assistantText("   ")));

        assertEquals("short content", summarizer.summarize("short content"));
    }

    @Test
    void shouldFallBackWhenResponseHasNoChoices() {
        when(llmRouter.chat(any())).thenReturn(new ChatResponse("id", "m", java.util.List.of(), null));

        assertEquals("short content", summarizer.summarize("short content"));
    }

    @Test
    void shouldReturnPlaceholderForEmptyContentWithoutCallingModel() {
        assertEquals(ObservationSummarizer.EMPTY_PLACEHOLDER, summarizer.summarize(""));
        assertEquals(ObservationSummarizer.EMPTY_PLACEHOLDER, summarizer.summarize("   "));
        assertEquals(ObservationSummarizer.EMPTY_PLACEHOLDER, summarizer.summarize(null));
        verifyNoInteractions(llmRouter);
    }

    @Test
    void shouldNotSplitSurrogatePairsWhenTruncating() {
        when(llmRouter.chat(any())).thenThrow(new LlmClient.LlmException("down"));
        String content = "🌧".repeat(250);

        String summary = summarizer.summarize(content);

        assertTrue(summary.endsWith("..."));
        String body = summary.substring(0, summary.length() - 3);
        assertEquals(200, body.codePointCount(0, body.length()));
        assertFalse(Character.isHighSurrogate(body.charAt(body.length() - 1)));
    }

    @Test
    void shouldUseFallbackWhenSummariesDisabled() {
        ObservationSummarizer disabled = new ObservationSummarizer(llmRouter,
                TestProperties.withSummary(TestProperties.memory(Path.of("unused.json")),
                        new MemoryProperties.Summary(false, 400, 200)));

        assertEquals("text", disabled.summarize("text"));
        verifyNoInteractions(llmRouter);
    }
}
