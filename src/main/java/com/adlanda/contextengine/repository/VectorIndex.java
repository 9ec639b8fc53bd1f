package com.adlanda.contextengine.repository;

import com.adlanda.contextengine.model.VectorFilter;
import com.adlanda.contextengine.model.VectorHit;
import com.adlanda.contextengine.model.VectorPoint;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Vector index holding a derived, repairable projection of stored contexts.
 *
 * Implementations throw {@link com.adlanda.contextengine.exception.IndexUnavailableException}
 * when the index cannot be reached.
 */
public interface VectorIndex {

    /**
     * Inserts or replaces a point.
     */
    void upsert(String id, List<Double> vector, Map<String, Object> payload);

    void upsertBatch(List<VectorPoint> points);

    /**
     * Replaces the payload of an existing point, keeping its vector.
     *
     * @return false if no point exists for the id
     */
    boolean updatePayload(String id, Map<String, Object> payload);

    /**
     * Nearest points by cosine similarity, highest score first.
     */
    List<VectorHit> search(List<Double> vector, int limit, VectorFilter filter);

    void delete(String id);

    void deleteBatch(Collection<String> ids);

    /**
     * Deletes every point matching a non-empty filter.
     *
     * @return number of points deleted
     * @throws IllegalArgumentException if the filter is empty
     */
    int deleteByFilter(VectorFilter filter);

    /**
     * Ids of the points matching the filter, ascending.
     */
    List<String> listIds(VectorFilter filter);

    long count();
}
