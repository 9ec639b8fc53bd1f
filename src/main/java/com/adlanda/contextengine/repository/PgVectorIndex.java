package com.adlanda.contextengine.repository;

import com.adlanda.contextengine.config.VectorIndexProperties;
import com.adlanda.contextengine.exception.IndexUnavailableException;
import com.adlanda.contextengine.model.ContextType;
import com.adlanda.contextengine.model.VectorFilter;
import com.adlanda.contextengine.model.VectorHit;
import com.adlanda.contextengine.model.VectorPoint;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Vector index backed by PostgreSQL with the pgvector extension.
 *
 * One row per context: {@code id}, {@code embedding vector(N)} and a
 * {@code payload jsonb} holding the filterable projection. Similarity is
 * {@code 1 - (embedding <=> query)}, i.e. cosine similarity.
 */
@Repository
@ConditionalOnProperty(prefix = "contextengine.vector-index", name = "type", havingValue = "pgvector")
public class PgVectorIndex implements VectorIndex, InitializingBean {

    private static final Logger log = LoggerFactory.getLogger(PgVectorIndex.class);

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final VectorIndexProperties properties;
    private final String table;

    public PgVectorIndex(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, VectorIndexProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.table = properties.getTableName();
    }

    @Override
    public void afterPropertiesSet() {
        if (properties.isInitializeSchema()) {
            initializeSchema();
        }
    }

    /**
     * Creates the extension, the table and its indexes if they don't exist yet.
     */
    public void initializeSchema() {
        execute("initializeSchema", () -> {
            jdbcTemplate.execute("CREATE EXTENSION IF NOT EXISTS vector");
            jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + table + " ("
                    + "id VARCHAR(64) PRIMARY KEY, "
                    + "embedding vector(" + properties.getDimensions() + ") NOT NULL, "
                    + "payload jsonb NOT NULL)");
            jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS " + table + "_embedding_idx ON " + table
                    + " USING hnsw (embedding vector_cosine_ops)");
            jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS " + table + "_workspace_tier_idx ON " + table
                    + " ((payload->>'workspaceId'), (payload->>'tier'))");
            return null;
        });
        log.info("Initialized pgvector schema: table={}, dimensions={}", table, properties.getDimensions());
    }

    @Override
    public void upsert(String id, List<Double> vector, Map<String, Object> payload) {
        String literal = toVectorLiteral(vector);
        String json = toJson(payload);
        execute("upsert", () -> jdbcTemplate.update(upsertSql(), id, literal, json));
        log.debug("Upserted vector for context {}", id);
    }

    @Override
    public void upsertBatch(List<VectorPoint> points) {
        if (points.isEmpty()) {
            return;
        }
        List<Object[]> rows = points.stream()
                .map(point -> new Object[]{point.id(), toVectorLiteral(point.vector()), toJson(point.payload())})
                .toList();
        execute("upsertBatch", () -> jdbcTemplate.batchUpdate(upsertSql(), rows));
        log.debug("Upserted {} vectors", points.size());
    }

    @Override
    public boolean updatePayload(String id, Map<String, Object> payload) {
        String json = toJson(payload);
        int rows = execute("updatePayload",
                () -> jdbcTemplate.update("UPDATE " + table + " SET payload = ?::jsonb WHERE id = ?", json, id));
        return rows > 0;
    }

    @Override
    public List<VectorHit> search(List<Double> vector, int limit, VectorFilter filter) {
        String literal = toVectorLiteral(vector);
        SqlFilter where = buildFilter(filter);

        String sql = "SELECT id, payload::text AS payload, 1 - (embedding <=> ?::vector) AS score FROM " + table
                + where.clause()
                + " ORDER BY embedding <=> ?::vector, id LIMIT ?";

        List<Object> args = new ArrayList<>();
        args.add(literal);
        args.addAll(where.args());
        args.add(literal);
        args.add(limit);

        return execute("search", () -> jdbcTemplate.query(sql,
                (rs, rowNum) -> new VectorHit(rs.getString("id"), rs.getDouble("score"), fromJson(rs.getString("payload"))),
                args.toArray()));
    }

    @Override
    public void delete(String id) {
        execute("delete", () -> jdbcTemplate.update("DELETE FROM " + table + " WHERE id = ?", id));
    }

    @Override
    public void deleteBatch(Collection<String> ids) {
        if (ids.isEmpty()) {
            return;
        }
        String placeholders = ids.stream().map(id -> "?").collect(Collectors.joining(", "));
        execute("deleteBatch", () -> jdbcTemplate.update(
                "DELETE FROM " + table + " WHERE id IN (" + placeholders + ")", ids.toArray()));
    }

    @Override
    public int deleteByFilter(VectorFilter filter) {
        if (filter == null || filter.isEmpty()) {
            throw new IllegalArgumentException("Refusing to delete by an empty filter");
        }
        SqlFilter where = buildFilter(filter);
        int deleted = execute("deleteByFilter",
                () -> jdbcTemplate.update("DELETE FROM " + table + where.clause(), where.args().toArray()));
        log.debug("Deleted {} vectors by filter {}", deleted, filter);
        return deleted;
    }

    @Override
    public List<String> listIds(VectorFilter filter) {
        SqlFilter where = buildFilter(filter);
        return execute("listIds", () -> jdbcTemplate.queryForList(
                "SELECT id FROM " + table + where.clause() + " ORDER BY id", String.class, where.args().toArray()));
    }

    @Override
    public long count() {
        Long count = execute("count", () -> jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Long.class));
        return count != null ? count : 0L;
    }

    /**
     * Translates a filter into a WHERE clause over the jsonb payload.
     */
    SqlFilter buildFilter(VectorFilter filter) {
        if (filter == null || filter.isEmpty()) {
            return new SqlFilter("", List.of());
        }
        List<String> conditions = new ArrayList<>();
        List<Object> args = new ArrayList<>();

        if (filter.workspaceId() != null) {
            conditions.add("payload->>'" + VectorFilter.WORKSPACE_ID + "' = ?");
            args.add(filter.workspaceId());
        }
        if (filter.tier() != null) {
            conditions.add("payload->>'" + VectorFilter.TIER + "' = ?");
            args.add(filter.tier().value());
        }
        if (!filter.types().isEmpty()) {
            List<String> types = filter.types().stream().map(ContextType::value).sorted().toList();
            conditions.add("payload->>'" + VectorFilter.TYPE + "' IN ("
                    + types.stream().map(t -> "?").collect(Collectors.joining(", ")) + ")");
            args.addAll(types);
        }
        if (filter.source() != null) {
            conditions.add("payload->>'" + VectorFilter.SOURCE + "' = ?");
            args.add(filter.source());
        }
        if (!filter.tags().isEmpty()) {
            conditions.add("(" + filter.tags().stream()
                    .map(tag -> "payload->'" + VectorFilter.TAGS + "' @> ?::jsonb")
                    .collect(Collectors.joining(" OR ")) + ")");
            filter.tags().forEach(tag -> args.add(toJson(List.of(tag))));
        }
        if (filter.minConfidence() != null) {
            conditions.add("COALESCE((payload->>'" + VectorFilter.CONFIDENCE + "')::float8, 1.0) >= ?");
            args.add(filter.minConfidence());
        }
        return new SqlFilter(" WHERE " + String.join(" AND ", conditions), args);
    }

    private String upsertSql() {
        return "INSERT INTO " + table + " (id, embedding, payload) VALUES (?, ?::vector, ?::jsonb) "
                + "ON CONFLICT (id) DO UPDATE SET embedding = EXCLUDED.embedding, payload = EXCLUDED.payload";
    }

    private String toVectorLiteral(List<Double> vector) {
        if (vector == null || vector.size() != properties.getDimensions()) {
            throw new IllegalArgumentException("Expected vector of " + properties.getDimensions()
                    + " dimensions but got " + (vector == null ? 0 : vector.size()));
        }
        return vector.stream().map(String::valueOf).collect(Collectors.joining(",", "[", "]"));
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload is not serializable", e);
        }
    }

    private Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, PAYLOAD_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored payload is not valid JSON", e);
        }
    }

    private <T> T execute(String operation, Supplier<T> work) {
        try {
            return work.get();
        } catch (DataAccessException e) {
            throw new IndexUnavailableException("Vector index unavailable during " + operation, e);
        }
    }

    /**
     * WHERE clause (empty or starting with a space) and its positional arguments.
     */
    record SqlFilter(String clause, List<Object> args) {}
}
