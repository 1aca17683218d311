package com.openforge.chronicle.memory.index;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.common.DataType;
import io.milvus.v2.common.IndexParam;
import io.milvus.v2.service.collection.request.AddFieldReq;
import io.milvus.v2.service.collection.request.CreateCollectionReq;
import io.milvus.v2.service.collection.request.DropCollectionReq;
import io.milvus.v2.service.collection.request.HasCollectionReq;
import io.milvus.v2.service.collection.request.LoadCollectionReq;
import io.milvus.v2.service.vector.request.DeleteReq;
import io.milvus.v2.service.vector.request.SearchReq;
import io.milvus.v2.service.vector.request.UpsertReq;
import io.milvus.v2.service.vector.request.data.FloatVec;
import io.milvus.v2.service.vector.response.SearchResp;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Semantic index stored in a Milvus collection.
 *
 * Collection schema (observation_memories):
 * ┌──────────────┬───────────────┬──────────────────────────────────────┐
 * │ Field        │ Type          │ Notes                                │
 * ├──────────────┼───────────────┼──────────────────────────────────────┤
 * │ record_id    │ INT64 PK      │ ObservationRecord id, auto_id = false│
 * │ summary      │ VARCHAR(4096) │ indexed text, for inspection only    │
 * │ embedding    │ FLOAT_VECTOR  │ dim = vectorDimensions               │
 * └──────────────┴───────────────┴──────────────────────────────────────┘
 *
 * Index: HNSW on embedding, metric IP. Vectors are L2-normalized before upsert
 * and search, so scores are cosine similarities. Writes use upsert keyed by
 * record_id, so re-adding a record replaces its vector.
 */
@Slf4j
public class MilvusSemanticIndex extends AbstractSemanticIndex {

    static final String FIELD_ID        = "record_id";
    static final String FIELD_SUMMARY   = "summary";
    static final String FIELD_EMBEDDING = "embedding";

    private static final int MAX_SUMMARY_CHARS = 4000;

    @Nullable
    private final MilvusClientV2   milvusClient;
    private final EmbeddingClient  embeddingClient;
    private final MilvusProperties props;

    private volatile boolean collectionReady;

    public MilvusSemanticIndex(@Nullable MilvusClientV2 milvusClient,
                               EmbeddingClient embeddingClient,
                               MilvusProperties props) {
        super(milvusClient == null ? IndexAvailability.UNAVAILABLE : IndexAvailability.UNKNOWN);
        this.milvusClient    = milvusClient;
        this.embeddingClient = embeddingClient;
        this.props           = props;
        if (milvusClient == null) {
            log.warn("[Index] MilvusClientV2 is not available; semantic retrieval disabled.");
        }
    }

    // ── SemanticIndex ────────────────────────────────────────────────────────

    @Override
    public void add(long recordId, String text) {
        requireAvailable();
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Cannot index blank text for record " + recordId);
        }
        try {
            ensureCollection();
            List<Float> vector = VectorMath.normalizedList(embeddingClient.embed(text));

            JsonObject row = new JsonObject();
            row.addProperty(FIELD_ID, recordId);
            row.addProperty(FIELD_SUMMARY, text.length() > MAX_SUMMARY_CHARS ? text.substring(0, MAX_SUMMARY_CHARS) : text);
            JsonArray embeddingArray = new JsonArray();
            for (Float f : vector) embeddingArray.add(f);
            row.add(FIELD_EMBEDDING, embeddingArray);

            milvusClient.upsert(UpsertReq.builder()
                    .collectionName(props.collectionName())
                    .data(List.of(row))
                    .build());
            markAvailable();
            log.debug("[Index] Upserted record #{} into '{}'.", recordId, props.collectionName());
        } catch (SemanticIndexUnavailableException e) {
            throw e;
        } catch (Exception e) {
            throw markUnavailable("add", e);
        }
    }

    @Override
    public List<SemanticHit> query(String text, int topK) {
        requireAvailable();
        if (text == null || text.isBlank() || topK <= 0) {
            return List.of();
        }
        try {
            ensureCollection();
            List<Float> vector = VectorMath.normalizedList(embeddingClient.embed(text));

            SearchResp resp = milvusClient.search(SearchReq.builder()
                    .collectionName(props.collectionName())
                    .data(List.of(new FloatVec(vector)))
                    .annsField(FIELD_EMBEDDING)
                    .topK(topK)
                    .outputFields(List.of(FIELD_ID))
                    .build());
            markAvailable();
            return toHits(resp, topK);
        } catch (Exception e) {
            throw markUnavailable("query", e);
        }
    }

    @Override
    public void remove(Collection<Long> recordIds) {
        requireAvailable();
        if (recordIds == null || recordIds.isEmpty()) return;
        try {
            ensureCollection();
            milvusClient.delete(DeleteReq.builder()
                    .collectionName(props.collectionName())
                    .ids(new ArrayList<>(recordIds))
                    .build());
            log.debug("[Index] Deleted {} record(s) from '{}'.", recordIds.size(), props.collectionName());
        } catch (Exception e) {
            throw markUnavailable("remove", e);
        }
    }

    @Override
    public void reset() {
        requireAvailable();
        try {
            String name = props.collectionName();
            if (milvusClient.hasCollection(HasCollectionReq.builder().collectionName(name).build())) {
                milvusClient.dropCollection(DropCollectionReq.builder().collectionName(name).build());
                log.info("[Index] Dropped collection '{}'.", name);
            }
            collectionReady = false;
            ensureCollection();
            markAvailable();
        } catch (Exception e) {
            throw markUnavailable("reset", e);
        }
    }

    @Override
    public String backendName() {
        return "milvus";
    }

    // ── Collection bootstrap ─────────────────────────────────────────────────

    private void ensureCollection() {
        if (collectionReady) return;
        synchronized (this) {
            if (collectionReady) return;
            String name = props.collectionName();
            if (milvusClient.hasCollection(HasCollectionReq.builder().collectionName(name).build())) {
                milvusClient.loadCollection(LoadCollectionReq.builder().collectionName(name).build());
                log.info("[Index] Collection '{}' confirmed existing.", name);
            } else {
                createCollection(name);
            }
            collectionReady = true;
        }
    }

    private void createCollection(String name) {
        log.info("[Index] Creating collection '{}' (dim={})...", name, props.vectorDimensions());

        CreateCollectionReq.CollectionSchema schema =
                CreateCollectionReq.CollectionSchema.builder().build();
        schema.addField(AddFieldReq.builder().fieldName(FIELD_ID)
                .dataType(DataType.Int64).isPrimaryKey(true).autoID(false).build());
        schema.addField(AddFieldReq.builder().fieldName(FIELD_SUMMARY)
                .dataType(DataType.VarChar).maxLength(4096).build());
        schema.addField(AddFieldReq.builder().fieldName(FIELD_EMBEDDING)
                .dataType(DataType.FloatVector).dimension(props.vectorDimensions()).build());

        // IP on L2-normalized embeddings ranks like cosine similarity.
        IndexParam vectorIndex = IndexParam.builder()
                .fieldName(FIELD_EMBEDDING)
                .indexType(IndexParam.IndexType.HNSW)
                .metricType(IndexParam.MetricType.IP)
                .extraParams(Map.of("M", 16, "efConstruction", 256))
                .build();

        milvusClient.createCollection(CreateCollectionReq.builder()
                .collectionName(name)
                .collectionSchema(schema)
                .indexParams(List.of(vectorIndex))
                .build());

        log.info("[Index] Collection '{}' created successfully.", name);
    }

    // ── Result mapping ───────────────────────────────────────────────────────

    private List<SemanticHit> toHits(SearchResp resp, int topK) {
        List<SemanticHit> hits = new ArrayList<>();
        if (resp == null || resp.getSearchResults() == null) return hits;

        for (List<SearchResp.SearchResult> row : resp.getSearchResults()) {
            for (SearchResp.SearchResult hit : row) {
                Long id = recordId(hit);
                if (id == null) continue;
                Float score = hit.getScore();
                hits.add(new SemanticHit(id, score == null ? 0.0 : score.doubleValue()));
            }
        }
        hits.sort(Comparator.comparingDouble(SemanticHit::score).reversed());
        return hits.size() > topK ? hits.subList(0, topK) : hits;
    }

    private static Long recordId(SearchResp.SearchResult hit) {
        Object raw = hit.getId();
        if (raw == null && hit.getEntity() != null) {
            raw = hit.getEntity().get(FIELD_ID);
        }
        if (raw instanceof Number n) return n.longValue();
        if (raw instanceof String s) {
            try {
                return Long.parseLong(s);
            } catch (NumberFormatException e) {
                log.debug("[Index] Ignoring hit with non-numeric id '{}'.", s);
            }
        }
        return null;
    }
}
