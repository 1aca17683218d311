package com.openforge.chronicle.config;

import com.openforge.chronicle.agent.CycleInProgressException;
import com.openforge.chronicle.llm.LlmClient;
import com.openforge.chronicle.memory.StoreIOException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * JSON error bodies for the REST surface.
 *
 *   StoreIOException          → 503  observation log could not be written
 *   CycleInProgressException  → 409  another cycle is running
 *   LlmException              → 502  every configured provider failed
 *   validation / bad input    → 400
 */
@Slf4j
@RestControllerAdvice(annotations = RestController.class)
public class GlobalExceptionHandler {

    @ExceptionHandler(StoreIOException.class)
    public ResponseEntity<Map<String, Object>> handleStoreFailure(StoreIOException ex, HttpServletRequest request) {
        log.error("[Api] Observation store failure on {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        Map<String, Object> out = body(HttpStatus.SERVICE_UNAVAILABLE, "store_unavailable", ex.getMessage(), request);
        if (ex.getPendingRecord() != null) {
            out.put("pending_record_id", ex.getPendingRecord().id());
        }
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(out);
    }

    @ExceptionHandler(CycleInProgressException.class)
    public ResponseEntity<Map<String, Object>> handleCycleConflict(CycleInProgressException ex,
                                                                   HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(body(HttpStatus.CONFLICT, "cycle_in_progress", ex.getMessage(), request));
    }

    @ExceptionHandler(LlmClient.LlmException.class)
    public ResponseEntity<Map<String, Object>> handleLlmFailure(LlmClient.LlmException ex,
                                                                HttpServletRequest request) {
        log.warn("[Api] Language model unavailable on {}: {}", request.getRequestURI(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(body(HttpStatus.BAD_GATEWAY, "llm_unavailable", ex.getMessage(), request));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidBody(MethodArgumentNotValidException ex,
                                                                 HttpServletRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return badRequest(message, request);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidParameter(HandlerMethodValidationException ex,
                                                                      HttpServletRequest request) {
        String message = ex.getAllValidationResults().stream()
                .flatMap(r -> r.getResolvableErrors().stream()
                        .map(e -> r.getMethodParameter().getParameterName() + ": " + e.getDefaultMessage()))
                .collect(Collectors.joining("; "));
        return badRequest(message, request);
    }

    @ExceptionHandler({
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<Map<String, Object>> handleMalformedRequest(Exception ex, HttpServletRequest request) {
        return badRequest(ex.getMessage(), request);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static ResponseEntity<Map<String, Object>> badRequest(String message, HttpServletRequest request) {
        return ResponseEntity.badRequest().body(body(HttpStatus.BAD_REQUEST, "invalid_request", message, request));
    }

    private static Map<String, Object> body(HttpStatus status, String code, String message,
                                            HttpServletRequest request) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", status.value());
        out.put("error", code);
        out.put("message", message);
        out.put("path", request.getRequestURI());
        out.put("timestamp", Instant.now().toString());
        return out;
    }
}
