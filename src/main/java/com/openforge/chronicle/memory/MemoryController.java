package com.openforge.chronicle.memory;

import com.openforge.chronicle.agent.MemoryQueryTools;
import com.openforge.chronicle.memory.index.IndexAvailability;
import com.openforge.chronicle.memory.index.SemanticIndex;
import com.openforge.chronicle.memory.index.SemanticIndexWriter;
import com.openforge.chronicle.memory.retrieval.HybridRetriever;
import com.openforge.chronicle.memory.retrieval.QueryContext;
import com.openforge.chronicle.memory.retrieval.RetrievalResult;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST API over the observation memory.
 *
 * ┌──────────────────────────────────────────────────────────────────────┐
 * │  Endpoint                                 Description                │
 * ├──────────────────────────────────────────────────────────────────────┤
 * │  GET  /api/memories/recent?count=5        most recent observations   │
 * │  GET  /api/memories/search?q=..&topK=5    semantic / keyword search  │
 * │  GET  /api/memories/exists?topic=..       yes/no with an example     │
 * │  GET  /api/memories/stats                 store + index status       │
 * │  POST /api/memories                       record a new observation   │
 * │  POST /api/memories/retrieve              hybrid retrieval           │
 * │  POST /api/memories/prune                 apply retention now        │
 * │  POST /api/memories/index/rebuild         rebuild index from store   │
 * └──────────────────────────────────────────────────────────────────────┘
 */
@RestController
@RequestMapping("/api/memories")
@RequiredArgsConstructor
public class MemoryController {

    private final ObservationStore    store;
    private final ObservationRecorder recorder;
    private final HybridRetriever     retriever;
    private final MemoryQueryTools    queryTools;
    private final SemanticIndex       index;
    private final SemanticIndexWriter indexWriter;
    private final MemoryProperties    properties;

    // ── Reads ────────────────────────────────────────────────────────────────

    @GetMapping("/recent")
    public ResponseEntity<List<ObservationRecord>> recent(
            @RequestParam(defaultValue = "5") @Min(1) @Max(100) int count) {
        return ResponseEntity.ok(store.recent(count));
    }

    /** Same lookup the query_memories tool performs, topK clamped to 1..max-results. */
    @GetMapping("/search")
    public ResponseEntity<List<RetrievalResult>> search(
            @RequestParam @NotBlank String q,
            @RequestParam(defaultValue = "5") @Min(1) @Max(50) int topK) {
        return ResponseEntity.ok(queryTools.queryMemories(q, topK));
    }

    @GetMapping("/exists")
    public ResponseEntity<MemoryQueryTools.ExistenceCheck> exists(@RequestParam @NotBlank String topic) {
        return ResponseEntity.ok(queryTools.checkMemoryExists(topic));
    }

    @GetMapping("/stats")
    public ResponseEntity<StatsResponse> stats() {
        return ResponseEntity.ok(new StatsResponse(store.stats(), index.backendName(), index.availability()));
    }

    // ── Writes ───────────────────────────────────────────────────────────────

    @PostMapping
    public ResponseEntity<ObservationRecord> add(@Valid @RequestBody AddObservationRequest req) {
        ObservationRecord record = recorder.record(req.content(), req.sourceRef());
        return ResponseEntity.status(HttpStatus.CREATED).body(record);
    }

    /**
     * Hybrid retrieval as an observation cycle would run it. Omitted counts default
     * to chronicle.memory.retrieval.*.
     */
    @PostMapping("/retrieve")
    public ResponseEntity<List<RetrievalResult>> retrieve(@Valid @RequestBody RetrieveRequest req) {
        QueryContext context = new QueryContext(req.query(), req.context());
        MemoryProperties.Retrieval defaults = properties.retrieval();
        return ResponseEntity.ok(retriever.retrieve(
                req.recentCount()  == null ? defaults.recentCount()  : req.recentCount(),
                req.semanticTopK() == null ? defaults.semanticTopK() : req.semanticTopK(),
                context));
    }

    @PostMapping("/prune")
    public ResponseEntity<PruneResponse> prune() {
        int removed = store.prune();
        return ResponseEntity.ok(new PruneResponse(removed, store.size()));
    }

    @PostMapping("/index/rebuild")
    public ResponseEntity<SemanticIndexWriter.RebuildReport> rebuildIndex() {
        SemanticIndexWriter.RebuildReport report = indexWriter.rebuild();
        return ResponseEntity.status(report.started() ? HttpStatus.OK : HttpStatus.CONFLICT).body(report);
    }

    // ── Inner DTOs ────────────────────────────────────────────────────────────

    public record AddObservationRequest(
            @NotBlank(message = "content must not be blank")
            @Size(max = 20000, message = "content must not exceed 20000 characters")
            String content,
            String sourceRef
    ) {}

    public record RetrieveRequest(
            @Min(0) @Max(50) Integer recentCount,
            @Min(0) @Max(50) Integer semanticTopK,
            String query,
            Map<String, String> context
    ) {}

    public record StatsResponse(
            StoreStats        store,
            String            indexBackend,
            IndexAvailability indexAvailability
    ) {}

    public record PruneResponse(
            int removed,
            int remaining
    ) {}
}
