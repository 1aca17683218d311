package com.openforge.chronicle.memory;

import com.openforge.chronicle.llm.LlmRouter;
import com.openforge.chronicle.llm.model.ChatRequest;
import com.openforge.chronicle.llm.model.ChatResponse;
import com.openforge.chronicle.llm.model.Message;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Distills a raw observation into a dense synopsis through the language model.
 *
 * Summaries are an optimization: every failure path (provider down, quota,
 * blank or malformed answer) degrades to a deterministic truncation of the
 * content, and {@link #summarize} never throws.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ObservationSummarizer {

    static final String TRUNCATION_MARKER = "...";
    static final String EMPTY_PLACEHOLDER = "(empty observation)";

    private static final String SYSTEM_PROMPT =
            "You write compact memory notes. Output only the note, no preamble, no quotes.";

    private static final String USER_TEMPLATE = """
            Produce a dense synopsis of the observation below. Preserve notable details
            (people, objects, weather, time of day), the tone, and any references to earlier
            observations. Stay within %d characters.

            Observation:
            %s
            """;

    private final LlmRouter        llmRouter;
    private final MemoryProperties properties;

    public String summarize(String content) {
        if (content == null || content.isBlank()) {
            return EMPTY_PLACEHOLDER;
        }
        MemoryProperties.Summary cfg = properties.summary();
        if (!cfg.enabled()) {
            return fallback(content);
        }
        try {
            ChatResponse response = llmRouter.chat(ChatRequest.summary(List.of(
                    Message.system(SYSTEM_PROMPT),
                    Message.user(USER_TEMPLATE.formatted(cfg.maxLength(), content))
            ), Math.max(64, cfg.maxLength() / 2)));

            String raw = response == null ? null : response.firstMessage().content();
            String synopsis = clean(raw);
            if (synopsis.isEmpty()) {
                log.warn("[Summarizer] Model returned an empty synopsis, using truncation fallback.");
                return fallback(content);
            }
            return truncateCodePoints(synopsis, cfg.maxLength());
        } catch (Exception e) {
            log.warn("[Summarizer] Summarization failed ({}), using truncation fallback: {}",
                    e.getClass().getSimpleName(), e.getMessage());
            return fallback(content);
        }
    }

    /**
     * First {@code fallback-length} code points of the content, plus a marker when cut.
     */
    public String fallback(String content) {
        if (content == null || content.isBlank()) {
            return EMPTY_PLACEHOLDER;
        }
        String trimmed = content.strip();
        int limit = Math.max(1, properties.summary().fallbackLength());
        if (trimmed.codePointCount(0, trimmed.length()) <= limit) {
            return trimmed;
        }
        return truncateCodePoints(trimmed, limit) + TRUNCATION_MARKER;
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static String clean(String raw) {
        if (raw == null) return "";
        String s = raw.strip();
        if (s.length() >= 2 && s.startsWith("\"") && s.endsWith("\"")) {
            s = s.substring(1, s.length() - 1).strip();
        }
        return s;
    }

    static String truncateCodePoints(String text, int maxCodePoints) {
        if (text.codePointCount(0, text.length()) <= maxCodePoints) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, maxCodePoints));
    }
}
