package com.adlanda.contextengine.service;

import com.adlanda.contextengine.config.StorageProperties;
import com.adlanda.contextengine.exception.ContextNotFoundException;
import com.adlanda.contextengine.exception.ContextValidationException;
import com.adlanda.contextengine.model.BatchResult;
import com.adlanda.contextengine.model.Context;
import com.adlanda.contextengine.model.ContextCreateRequest;
import com.adlanda.contextengine.model.ContextMetadata;
import com.adlanda.contextengine.model.ContextTier;
import com.adlanda.contextengine.model.ContextType;
import com.adlanda.contextengine.model.ContextUpdateRequest;
import com.adlanda.contextengine.model.ContextVersion;
import com.adlanda.contextengine.model.IndexFailure;
import com.adlanda.contextengine.model.VectorPoint;
import com.adlanda.contextengine.repository.ContextStore;
import com.adlanda.contextengine.repository.VectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Writes contexts to the primary store and keeps the vector index in step.
 *
 * The primary store is written first and is the source of truth: its failures
 * propagate. Vector index failures after a successful primary write are logged,
 * recorded in {@link IndexFailureTracker} and leave the context marked as not
 * indexed, so the call still succeeds and {@link IndexReconciler} can repair it.
 */
@Service
public class ContextStorage {

    private static final Logger log = LoggerFactory.getLogger(ContextStorage.class);

    private final ContextStore contextStore;
    private final VectorIndex vectorIndex;
    private final EmbeddingProvider embeddingProvider;
    private final IndexFailureTracker failureTracker;
    private final StorageProperties properties;

    public ContextStorage(ContextStore contextStore,
                          VectorIndex vectorIndex,
                          EmbeddingProvider embeddingProvider,
                          IndexFailureTracker failureTracker,
                          StorageProperties properties) {
        this.contextStore = contextStore;
        this.vectorIndex = vectorIndex;
        this.embeddingProvider = embeddingProvider;
        this.failureTracker = failureTracker;
        this.properties = properties;
    }

    /**
     * Creates a context: embed, write the primary store, then index.
     *
     * @return the stored context, carrying its embedding when one was generated
     * @throws ContextValidationException if a required field is missing
     */
    public Context create(ContextCreateRequest request) {
        validateCreate(request);

        Context draft = toDraft(request, Instant.now());
        List<Double> embedding = request.generateEmbeddings() ? embeddingProvider.embed(draft.content()) : null;

        Context stored = contextStore.insert(draft).withEmbedding(embedding);

        if (stored.indexable() && embedding != null) {
            stored = index(stored);
        }

        log.info("Created context {} in workspace {} (tier={}, type={}, indexed={})",
                stored.id(), stored.workspaceId(), stored.tier().value(), stored.type().value(), stored.indexed());
        return stored;
    }

    /**
     * Applies an update, snapshotting the previous state in the same store write.
     *
     * Confidence-only updates are not versioned. When content changes and
     * re-embedding is requested the vector point is replaced; otherwise only
     * its payload is patched. Contexts created without indexing stay out of
     * the vector index.
     *
     * @return the updated context, or null if the id is unknown
     */
    public Context update(ContextUpdateRequest request) {
        validateUpdate(request);

        Optional<Context> found = contextStore.findById(request.contextId());
        if (found.isEmpty()) {
            log.debug("Update skipped, context {} not found", request.contextId());
            return null;
        }
        Context current = found.get();
        Instant now = Instant.now();

        String content = request.content() != null ? request.content() : current.content();
        boolean contentChanged = !content.equals(current.content());
        List<Double> embedding = contentChanged && request.regenerateEmbeddings()
                ? embeddingProvider.embed(content)
                : null;

        ContextMetadata metadata = current.metadata();
        ContextMetadata updatedMetadata = new ContextMetadata(
                request.source() != null ? request.source() : metadata.source(),
                request.tags() != null ? request.tags() : metadata.tags(),
                metadata.usageCount(),
                request.confidence() != null ? request.confidence() : metadata.confidence(),
                request.attributes() != null ? request.attributes() : metadata.attributes()
        );

        // Until the vector write below succeeds, a new or stale vector means "not indexed"
        boolean indexed = current.indexed() && !contentChanged;

        Context candidate = new Context(
                current.id(),
                current.workspaceId(),
                request.tier() != null ? request.tier() : current.tier(),
                request.type() != null ? request.type() : current.type(),
                content,
                updatedMetadata,
                null,
                current.createdAt(),
                request.preserveUpdatedAt() ? current.updatedAt() : now,
                current.lastAccessed(),
                indexed,
                current.indexable()
        );

        Optional<Context> written = properties.isVersioningEnabled() && !request.isConfidenceOnly()
                ? contextStore.updateVersioned(candidate, now, properties.getMaxVersions())
                : contextStore.update(candidate);
        if (written.isEmpty()) {
            log.debug("Update skipped, context {} deleted concurrently", request.contextId());
            return null;
        }
        Context updated = written.get().withEmbedding(embedding);

        if (embedding != null && updated.indexable()) {
            updated = index(updated);
        } else if (current.indexed()) {
            patchPayload(updated);
        }

        log.info("Updated context {} (contentChanged={}, reembedded={}, indexed={})",
                updated.id(), contentChanged, embedding != null, updated.indexed());
        return updated;
    }

    /**
     * Deletes a context from the primary store, then best-effort from the vector index.
     *
     * @return false if the id is unknown
     */
    public boolean delete(String contextId) {
        requireId(contextId);

        if (!contextStore.deleteById(contextId)) {
            log.debug("Delete skipped, context {} not found", contextId);
            return false;
        }

        try {
            vectorIndex.delete(contextId);
            failureTracker.resolve(contextId);
        } catch (RuntimeException e) {
            failureTracker.record(contextId, IndexFailure.Operation.DELETE, e.getMessage());
        }

        log.info("Deleted context {}", contextId);
        return true;
    }

    public Optional<Context> getContext(String contextId) {
        requireId(contextId);
        return contextStore.findById(contextId);
    }

    /**
     * First {@code limit} contexts of a workspace, ordered by id.
     */
    public List<Context> getContextsByWorkspace(String workspaceId, ContextTier tier, ContextType type, int limit) {
        requireWorkspace(workspaceId);
        if (limit < 1) {
            throw new ContextValidationException("limit must be positive");
        }
        return contextStore.findByWorkspace(workspaceId, tier, type, null, limit);
    }

    public long countContextsByWorkspace(String workspaceId, ContextTier tier, ContextType type) {
        requireWorkspace(workspaceId);
        return contextStore.countByWorkspace(workspaceId, tier, type);
    }

    /**
     * Creates contexts in consecutive chunks of {@code batch-size}.
     *
     * Not atomic: invalid items and items whose embedding failed are reported
     * as failures by input position while the rest are stored.
     */
    public BatchResult<Context> createContextsBatch(List<ContextCreateRequest> requests) {
        if (requests == null) {
            throw new ContextValidationException("requests are required");
        }

        List<Context> succeeded = new ArrayList<>();
        List<BatchResult.Failure> failed = new ArrayList<>();

        for (int from = 0; from < requests.size(); from += properties.getBatchSize()) {
            int to = Math.min(from + properties.getBatchSize(), requests.size());
            createChunk(requests, from, to, succeeded, failed);
        }

        log.info("Batch create: {} stored, {} failed", succeeded.size(), failed.size());
        return new BatchResult<>(succeeded, failed);
    }

    /**
     * Loads contexts in chunks of {@code batch-size}, in input order. Unknown ids are omitted.
     */
    public List<Context> getContextsBatch(List<String> contextIds) {
        if (contextIds == null) {
            throw new ContextValidationException("contextIds are required");
        }
        List<String> ids = new ArrayList<>(new LinkedHashSet<>(contextIds));

        List<Context> found = new ArrayList<>();
        for (int from = 0; from < ids.size(); from += properties.getBatchSize()) {
            List<String> chunk = ids.subList(from, Math.min(from + properties.getBatchSize(), ids.size()));
            Map<String, Context> byId = contextStore.findAllByIds(chunk).stream()
                    .collect(Collectors.toMap(Context::id, Function.identity()));
            chunk.stream().map(byId::get).filter(Objects::nonNull).forEach(found::add);
        }
        return found;
    }

    /**
     * Deletes contexts in chunks of {@code batch-size}.
     *
     * @return number of contexts deleted from the primary store
     */
    public int deleteContextsBatch(List<String> contextIds) {
        if (contextIds == null) {
            throw new ContextValidationException("contextIds are required");
        }
        List<String> ids = new ArrayList<>(new LinkedHashSet<>(contextIds));

        int deleted = 0;
        for (int from = 0; from < ids.size(); from += properties.getBatchSize()) {
            List<String> chunk = ids.subList(from, Math.min(from + properties.getBatchSize(), ids.size()));
            deleted += contextStore.deleteAllByIds(chunk);
            try {
                vectorIndex.deleteBatch(chunk);
                chunk.forEach(failureTracker::resolve);
            } catch (RuntimeException e) {
                chunk.forEach(id -> failureTracker.record(id, IndexFailure.Operation.DELETE, e.getMessage()));
            }
        }

        log.info("Batch delete: {} of {} contexts deleted", deleted, ids.size());
        return deleted;
    }

    /**
     * Version snapshots of a context, newest first. Empty when versioning is disabled.
     *
     * @param limit maximum versions to return; non-positive means all retained
     */
    public List<ContextVersion> getContextVersions(String contextId, int limit) {
        requireId(contextId);
        if (!properties.isVersioningEnabled()) {
            return List.of();
        }
        return contextStore.findVersions(contextId, limit > 0 ? limit : properties.getMaxVersions());
    }

    /**
     * Re-applies a snapshot's content, source, tags and attributes through {@link #update}.
     *
     * The restore itself is versioned. Usage count and confidence keep their current values.
     *
     * @return the restored context, or null if the context is unknown
     * @throws ContextNotFoundException if the version does not exist
     * @throws IllegalStateException    if versioning is disabled
     */
    public Context restoreContextVersion(String contextId, int versionNumber) {
        requireId(contextId);
        if (!properties.isVersioningEnabled()) {
            throw new IllegalStateException("Versioning is disabled");
        }
        if (contextStore.findById(contextId).isEmpty()) {
            log.debug("Restore skipped, context {} not found", contextId);
            return null;
        }

        ContextVersion version = contextStore.findVersion(contextId, versionNumber)
                .orElseThrow(() -> new ContextNotFoundException(contextId,
                        "Version " + versionNumber + " of context " + contextId + " not found"));

        ContextMetadata snapshot = version.metadata();
        Context restored = update(ContextUpdateRequest.builder(contextId)
                .content(version.content())
                .source(snapshot.source())
                .tags(snapshot.tags())
                .attributes(snapshot.attributes())
                .build());

        log.info("Restored context {} to version {}", contextId, versionNumber);
        return restored;
    }

    /**
     * Re-embeds and re-indexes the given contexts. Used by the repair path.
     * Contexts created without indexing are skipped.
     *
     * @return ids of the contexts now indexed
     */
    public List<String> reindex(List<String> contextIds) {
        List<String> indexed = new ArrayList<>();
        for (Context context : getContextsBatch(contextIds)) {
            if (!context.indexable()) {
                log.debug("Skipping reindex of context {}, created without indexing", context.id());
                continue;
            }
            try {
                Context embedded = context.withEmbedding(embeddingProvider.embed(context.content()));
                if (index(embedded).indexed()) {
                    indexed.add(context.id());
                }
            } catch (RuntimeException e) {
                failureTracker.record(context.id(), IndexFailure.Operation.UPSERT, e.getMessage());
            }
        }
        return indexed;
    }

    private void createChunk(List<ContextCreateRequest> requests, int from, int to,
                             List<Context> succeeded, List<BatchResult.Failure> failed) {
        Instant now = Instant.now();
        List<Integer> positions = new ArrayList<>();
        List<Context> drafts = new ArrayList<>();

        for (int i = from; i < to; i++) {
            ContextCreateRequest request = requests.get(i);
            try {
                validateCreate(request);
            } catch (ContextValidationException e) {
                failed.add(new BatchResult.Failure(i, e.getMessage()));
                continue;
            }
            positions.add(i);
            drafts.add(toDraft(request, now));
        }

        List<List<Double>> embeddings = embedChunk(requests, positions, drafts, failed);

        List<Integer> storedPositions = new ArrayList<>();
        List<Context> toStore = new ArrayList<>();
        for (int k = 0; k < drafts.size(); k++) {
            if (drafts.get(k) != null) {
                storedPositions.add(k);
                toStore.add(drafts.get(k));
            }
        }
        if (toStore.isEmpty()) {
            return;
        }

        List<Context> stored = contextStore.insertAll(toStore);
        List<Context> results = new ArrayList<>(stored.size());
        List<VectorPoint> points = new ArrayList<>();
        for (int s = 0; s < stored.size(); s++) {
            int k = storedPositions.get(s);
            Context context = stored.get(s).withEmbedding(embeddings.get(k));
            results.add(context);
            if (context.indexable() && context.hasEmbedding()) {
                points.add(VectorPoint.of(context));
            }
        }

        if (!points.isEmpty()) {
            try {
                vectorIndex.upsertBatch(points);
                points.forEach(point -> contextStore.markIndexed(point.id(), true));
                List<String> indexedIds = points.stream().map(VectorPoint::id).toList();
                results.replaceAll(c -> indexedIds.contains(c.id()) ? c.withIndexed(true) : c);
            } catch (RuntimeException e) {
                points.forEach(point -> failureTracker.record(point.id(), IndexFailure.Operation.UPSERT, e.getMessage()));
            }
        }

        succeeded.addAll(results);
    }

    /**
     * Embeds the drafts that asked for it. On failure those drafts are nulled out and reported.
     */
    private List<List<Double>> embedChunk(List<ContextCreateRequest> requests, List<Integer> positions,
                                          List<Context> drafts, List<BatchResult.Failure> failed) {
        List<List<Double>> embeddings = new ArrayList<>(Collections.nCopies(drafts.size(), null));
        List<Integer> toEmbed = new ArrayList<>();
        for (int k = 0; k < drafts.size(); k++) {
            if (requests.get(positions.get(k)).generateEmbeddings()) {
                toEmbed.add(k);
            }
        }
        if (toEmbed.isEmpty()) {
            return embeddings;
        }

        try {
            List<List<Double>> vectors = embeddingProvider.embedBatch(
                    toEmbed.stream().map(k -> drafts.get(k).content()).toList());
            for (int j = 0; j < toEmbed.size(); j++) {
                embeddings.set(toEmbed.get(j), vectors.get(j));
            }
        } catch (RuntimeException e) {
            log.error("Embedding failed for {} contexts in batch: {}", toEmbed.size(), e.getMessage());
            for (int k : toEmbed) {
                failed.add(new BatchResult.Failure(positions.get(k), "Embedding failed: " + e.getMessage()));
                drafts.set(k, null);
            }
        }
        return embeddings;
    }

    /**
     * Upserts the context's vector and flips its indexed flag. Failures are recorded, not thrown.
     */
    private Context index(Context context) {
        try {
            vectorIndex.upsert(context.id(), context.embedding(), context.indexPayload());
        } catch (RuntimeException e) {
            failureTracker.record(context.id(), IndexFailure.Operation.UPSERT, e.getMessage());
            if (context.indexed()) {
                contextStore.markIndexed(context.id(), false);
            }
            return context.withIndexed(false);
        }
        contextStore.markIndexed(context.id(), true);
        failureTracker.resolve(context.id());
        return context.withIndexed(true);
    }

    private void patchPayload(Context context) {
        String failure;
        try {
            if (vectorIndex.updatePayload(context.id(), context.indexPayload())) {
                return;
            }
            failure = "point missing from index";
        } catch (RuntimeException e) {
            failure = e.getMessage();
        }
        failureTracker.record(context.id(), IndexFailure.Operation.PAYLOAD_UPDATE, failure);
        if (context.indexed()) {
            contextStore.markIndexed(context.id(), false);
        }
    }

    private static Context toDraft(ContextCreateRequest request, Instant now) {
        ContextMetadata metadata = request.metadata().withUsageCount(0);
        boolean indexable = request.generateEmbeddings() && request.indexInVectorDB();
        return Context.draft(request.workspaceId(), request.tier(), request.type(), request.content(), metadata,
                now, indexable);
    }

    private static void validateCreate(ContextCreateRequest request) {
        if (request == null) {
            throw new ContextValidationException("request is required");
        }
        requireWorkspace(request.workspaceId());
        if (request.tier() == null) {
            throw new ContextValidationException("tier is required");
        }
        if (request.type() == null) {
            throw new ContextValidationException("type is required");
        }
        if (request.content() == null || request.content().isBlank()) {
            throw new ContextValidationException("content must not be empty");
        }
        validateConfidence(request.metadata().confidence());
    }

    private static void validateUpdate(ContextUpdateRequest request) {
        if (request == null) {
            throw new ContextValidationException("request is required");
        }
        requireId(request.contextId());
        if (request.content() != null && request.content().isBlank()) {
            throw new ContextValidationException("content must not be empty");
        }
        validateConfidence(request.confidence());
    }

    private static void validateConfidence(Double confidence) {
        if (confidence != null && (confidence.isNaN() || confidence < 0.0 || confidence > 1.0)) {
            throw new ContextValidationException("confidence must be within [0, 1]: " + confidence);
        }
    }

    private static void requireId(String contextId) {
        if (contextId == null || contextId.isBlank()) {
            throw new ContextValidationException("contextId is required");
        }
    }

    private static void requireWorkspace(String workspaceId) {
        if (workspaceId == null || workspaceId.isBlank()) {
            throw new ContextValidationException("workspaceId is required");
        }
    }
}
