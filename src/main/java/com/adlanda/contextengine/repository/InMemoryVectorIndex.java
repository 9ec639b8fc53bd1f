package com.adlanda.contextengine.repository;

import com.adlanda.contextengine.model.VectorFilter;
import com.adlanda.contextengine.model.VectorHit;
import com.adlanda.contextengine.model.VectorPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory vector index.
 *
 * Brute-force cosine similarity over a concurrent map. Suitable for local runs
 * and tests; contents are lost on restart.
 */
@Repository
@ConditionalOnProperty(prefix = "contextengine.vector-index", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemoryVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(InMemoryVectorIndex.class);

    private final Map<String, VectorPoint> points = new ConcurrentHashMap<>();

    @Override
    public void upsert(String id, List<Double> vector, Map<String, Object> payload) {
        if (vector == null || vector.isEmpty()) {
            throw new IllegalArgumentException("Cannot index point without vector: " + id);
        }
        points.put(id, new VectorPoint(id, List.copyOf(vector), new LinkedHashMap<>(payload)));
    }

    @Override
    public void upsertBatch(List<VectorPoint> batch) {
        batch.forEach(point -> upsert(point.id(), point.vector(), point.payload()));
        log.debug("Upserted {} points", batch.size());
    }

    @Override
    public boolean updatePayload(String id, Map<String, Object> payload) {
        return points.computeIfPresent(id,
                (key, existing) -> new VectorPoint(key, existing.vector(), new LinkedHashMap<>(payload))) != null;
    }

    @Override
    public List<VectorHit> search(List<Double> vector, int limit, VectorFilter filter) {
        return points.values().stream()
                .filter(point -> filter == null || filter.matches(point.payload()))
                .map(point -> new VectorHit(point.id(), cosineSimilarity(vector, point.vector()),
                        Collections.unmodifiableMap(point.payload())))
                .sorted(Comparator.comparingDouble(VectorHit::score).reversed()
                        .thenComparing(VectorHit::id))
                .limit(limit)
                .toList();
    }

    @Override
    public void delete(String id) {
        points.remove(id);
    }

    @Override
    public void deleteBatch(Collection<String> ids) {
        ids.forEach(points::remove);
    }

    @Override
    public int deleteByFilter(VectorFilter filter) {
        if (filter == null || filter.isEmpty()) {
            throw new IllegalArgumentException("Refusing to delete by an empty filter");
        }
        List<String> matching = listIds(filter);
        matching.forEach(points::remove);
        log.debug("Deleted {} points by filter {}", matching.size(), filter);
        return matching.size();
    }

    @Override
    public List<String> listIds(VectorFilter filter) {
        return points.values().stream()
                .filter(point -> filter == null || filter.matches(point.payload()))
                .map(VectorPoint::id)
                .sorted()
                .toList();
    }

    @Override
    public long count() {
        return points.size();
    }

    /**
     * Computes cosine similarity between two vectors.
     *
     * @return Similarity in [-1, 1]; 0 when either vector has zero norm
     */
    private double cosineSimilarity(List<Double> a, List<Double> b) {
        if (a.size() != b.size()) {
            throw new IllegalArgumentException("Vectors must have same dimension");
        }

        double dotProduct = 0.0;
        double normA = 0.0;
        double normB = 0.0;

        for (int i = 0; i < a.size(); i++) {
            dotProduct += a.get(i) * b.get(i);
            normA += a.get(i) * a.get(i);
            normB += b.get(i) * b.get(i);
        }

        if (normA == 0 || normB == 0) {
            return 0.0;
        }

        return dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
