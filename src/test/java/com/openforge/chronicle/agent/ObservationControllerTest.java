package com.openforge.chronicle.agent;

import com.openforge.chronicle.config.AppConfig;
import com.openforge.chronicle.config.GlobalExceptionHandler;
import com.openforge.chronicle.llm.LlmClient;
import com.openforge.chronicle.memory.ObservationRecord;
import com.openforge.chronicle.memory.retrieval.QueryContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ObservationControllerTest {

    private ObservationCycleService cycleService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        cycleService = mock(ObservationCycleService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new ObservationController(cycleService))
                .setMessageConverters(new MappingJackson2HttpMessageConverter(new AppConfig().objectMapper()))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void shouldRunCycleAndReturnCreatedRecord() throws Exception {
        ObservationRecord record = new ObservationRecord(
                8, Instant.parse("2025-11-03T18:00:00Z"), "Rain again.", "Rain.", "img_8.jpg");
        LoopResult loopResult = new LoopResult("Rain again.", 1, 2, false, List.of());
        when(cycleService.runCycle(anyString(), any(), any(QueryContext.class)))
                .thenReturn(new ObservationCycleService.CycleOutcome(record, loopResult, List.of()));

        mockMvc.perform(post("/api/observations/cycle")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"notes": "Wet street.", "source_ref": "img_8.jpg", "context": {"weather": "rainy"}}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.record.id").value(8))
                .andExpect(jsonPath("$.loop_result.iteration_count").value(1))
                .andExpect(jsonPath("$.loop_result.generation_calls").value(2));

        verify(cycleService).runCycle("Wet street.", "img_8.jpg",
                new QueryContext(null, Map.of("weather", "rainy")));
    }

    @Test
    void shouldReturnOkWhenNothingWasRecorded() throws Exception {
        when(cycleService.runCycle(anyString(), any(), any(QueryContext.class)))
                .thenReturn(new ObservationCycleService.CycleOutcome(
                        null, new LoopResult("", 0, 1, false, List.of()), List.of()));

        mockMvc.perform(post("/api/observations/cycle")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"notes\": \"Nothing happening.\"}"))
                .andExpect(status().isOk());
    }

    @Test
    void shouldRejectBlankNotes() throws Exception {
        mockMvc.perform(post("/api/observations/cycle")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"notes\": \"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_request"));

        verifyNoInteractions(cycleService);
    }

    @Test
    void shouldReportConflictWhileCycleRuns() throws Exception {
        when(cycleService.runCycle(anyString(), any(), any(QueryContext.class)))
                .thenThrow(new CycleInProgressException());

        mockMvc.perform(post("/api/observations/cycle")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"notes\": \"Wet street.\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("cycle_in_progress"));
    }

    @Test
    void shouldReportBadGatewayWhenModelFails() throws Exception {
        when(cycleService.runCycle(anyString(), any(), any(QueryContext.class)))
                .thenThrow(new LlmClient.LlmException("all providers down"));

        mockMvc.perform(post("/api/observations/cycle")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"notes\": \"Wet street.\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("llm_unavailable"));
    }
}
