package com.openforge.chronicle.agent;

import com.openforge.chronicle.memory.retrieval.QueryContext;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Triggers observation cycles.
 *
 *   POST /api/observations/cycle   run one cycle synchronously; 409 while another is running
 *
 * Scheduling cycles is left to the caller (cron, CI job, another service).
 */
@Slf4j
@RestController
@RequestMapping("/api/observations")
@RequiredArgsConstructor
public class ObservationController {

    private final ObservationCycleService cycleService;

    @PostMapping("/cycle")
    public ResponseEntity<ObservationCycleService.CycleOutcome> runCycle(@Valid @RequestBody CycleRequest req) {
        ObservationCycleService.CycleOutcome outcome = cycleService.runCycle(
                req.notes(),
                req.sourceRef(),
                new QueryContext(req.query(), req.context()));
        HttpStatus status = outcome.record() == null ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(outcome);
    }

    /**
     * @param notes     description of what is being observed now
     * @param sourceRef stored with the new observation, e.g. an image file name
     * @param query     explicit semantic query; overrides {@code context}
     * @param context   situational hints: weather, time_of_day, date
     */
    public record CycleRequest(
            @NotBlank(message = "notes must not be blank")
            @Size(max = 8000, message = "notes must not exceed 8000 characters")
            String notes,
            String sourceRef,
            String query,
            Map<String, String> context
    ) {}
}
