package com.imperium.agentpiazza.service.impl;

import com.imperium.agentpiazza.model.dto.search.VectorMatch;
import com.imperium.agentpiazza.service.VectorIndexService;
import io.qdrant.client.PointIdFactory;
import io.qdrant.client.QdrantClient;
import io.qdrant.client.ValueFactory;
import io.qdrant.client.VectorsFactory;
import io.qdrant.client.WithPayloadSelectorFactory;
import io.qdrant.client.grpc.JsonWithInt;
import io.qdrant.client.grpc.Points.PointStruct;
import io.qdrant.client.grpc.Points.ScoredPoint;
import io.qdrant.client.grpc.Points.SearchPoints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Qdrant 向量索引适配。仅当 {@code app.vector.enabled=true} 时才有 {@link QdrantClient} bean；
 * 未启用时写入与删除为空操作，查询返回空列表。
 */
@Service
public class QdrantVectorIndexService implements VectorIndexService {

    private static final Logger log = LoggerFactory.getLogger(QdrantVectorIndexService.class);

    @Nullable
    private final QdrantClient qdrantClient;
    private final String collectionName;
    private final Duration timeout;

    public QdrantVectorIndexService(@Nullable QdrantClient qdrantClient,
                                    @Value("${app.vector.collection:insights-index}") String collectionName,
                                    @Value("${app.vector.timeout:10s}") Duration timeout) {
        this.qdrantClient = qdrantClient;
        this.collectionName = collectionName;
        this.timeout = timeout;
    }

    @Override
    public void upsert(String id, float[] vector, Map<String, Object> metadata) {
        if (qdrantClient == null) {
            log.debug("Vector index disabled, skip upsert of {}", id);
            return;
        }
        PointStruct point = PointStruct.newBuilder()
                .setId(PointIdFactory.id(UUID.fromString(id)))
                .setVectors(VectorsFactory.vectors(vector))
                .putAllPayload(toPayload(metadata))
                .build();
        await(qdrantClient.upsertAsync(collectionName, List.of(point)), "upsert");
    }

    @Override
    public List<VectorMatch> query(float[] vector, int topK) {
        if (qdrantClient == null) {
            return List.of();
        }
        List<Float> values = new ArrayList<>(vector.length);
        for (float v : vector) {
            values.add(v);
        }
        SearchPoints request = SearchPoints.newBuilder()
                .setCollectionName(collectionName)
                .addAllVector(values)
                .setLimit(topK)
                .setWithPayload(WithPayloadSelectorFactory.enable(true))
                .build();
        List<ScoredPoint> points = await(qdrantClient.searchAsync(request), "search");
        List<VectorMatch> matches = new ArrayList<>(points.size());
        for (ScoredPoint p : points) {
            String pointId = p.getId().hasUuid() ? p.getId().getUuid() : String.valueOf(p.getId().getNum());
            matches.add(new VectorMatch(pointId, p.getScore(), fromPayload(p.getPayloadMap())));
        }
        return matches;
    }

    @Override
    public void delete(String id) {
        if (qdrantClient == null) {
            return;
        }
        await(qdrantClient.deleteAsync(collectionName, List.of(PointIdFactory.id(UUID.fromString(id)))), "delete");
    }

    private <T> T await(Future<T> future, String operation) {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during Qdrant " + operation, e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Qdrant " + operation + " failed: " + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new IllegalStateException("Timed out during Qdrant " + operation, e);
        }
    }

    static Map<String, JsonWithInt.Value> toPayload(Map<String, Object> metadata) {
        Map<String, JsonWithInt.Value> payload = new LinkedHashMap<>();
        if (metadata == null) {
            return payload;
        }
        metadata.forEach((k, v) -> {
            if (v != null) {
                payload.put(k, toValue(v));
            }
        });
        return payload;
    }

    private static JsonWithInt.Value toValue(Object v) {
        if (v instanceof Integer || v instanceof Long || v instanceof Short) {
            return ValueFactory.value(((Number) v).longValue());
        }
        if (v instanceof Number n) {
            return ValueFactory.value(n.doubleValue());
        }
        if (v instanceof Boolean b) {
            return ValueFactory.value(b);
        }
        if (v instanceof Collection<?> c) {
            List<JsonWithInt.Value> items = new ArrayList<>(c.size());
            for (Object item : c) {
                if (item != null) {
                    items.add(toValue(item));
                }
            }
            return ValueFactory.list(items);
        }
        return ValueFactory.value(String.valueOf(v));
    }

    static Map<String, Object> fromPayload(Map<String, JsonWithInt.Value> payload) {
        Map<String, Object> out = new LinkedHashMap<>();
        payload.forEach((k, v) -> out.put(k, fromValue(v)));
        return out;
    }

    private static Object fromValue(JsonWithInt.Value v) {
        return switch (v.getKindCase()) {
            case STRING_VALUE -> v.getStringValue();
            case INTEGER_VALUE -> v.getIntegerValue();
            case DOUBLE_VALUE -> v.getDoubleValue();
            case BOOL_VALUE -> v.getBoolValue();
            case LIST_VALUE -> {
                List<Object> items = new ArrayList<>();
                for (JsonWithInt.Value item : v.getListValue().getValuesList()) {
                    items.add(fromValue(item));
                }
                yield items;
            }
            default -> null;
        };
    }
}
