package com.adlanda.contextengine.service;

import com.adlanda.contextengine.config.RetrievalProperties;
import com.adlanda.contextengine.exception.ContextEngineException;
import com.adlanda.contextengine.exception.ContextValidationException;
import com.adlanda.contextengine.model.Context;
import com.adlanda.contextengine.model.ContextTier;
import com.adlanda.contextengine.model.IndexFailure;
import com.adlanda.contextengine.model.QueryEntity;
import com.adlanda.contextengine.model.RetrievalRequest;
import com.adlanda.contextengine.model.RetrievalResult;
import com.adlanda.contextengine.model.ScoredContext;
import com.adlanda.contextengine.model.VectorFilter;
import com.adlanda.contextengine.model.VectorHit;
import com.adlanda.contextengine.repository.ContextStore;
import com.adlanda.contextengine.repository.VectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Retrieves the most relevant contexts for a query.
 *
 * Orchestrates the retrieval flow:
 * 1. Expand the query with high-confidence entities
 * 2. Embed the query
 * 3. Search the tiers in order (workspace, hybrid, global), stopping early
 *    once enough strong hits are in
 * 4. Hydrate hits from the primary store, dropping stale index entries
 * 5. Re-rank, then drop near-duplicates
 * 6. Record usage in the background
 *
 * Tier searches share the request's deadline. When it expires the remaining
 * tiers are skipped and the result is marked degraded. The first tier is always
 * submitted and gets at least the configured grace period, so an expired
 * deadline still yields workspace results. Searches never run on the caller's
 * thread: if the search pool rejects a tier, retrieval stops there, degraded.
 */
@Service
public class ContextRetriever {

    private static final Logger log = LoggerFactory.getLogger(ContextRetriever.class);

    private final EmbeddingProvider embeddingProvider;
    private final VectorIndex vectorIndex;
    private final ContextStore contextStore;
    private final UsageTracker usageTracker;
    private final IndexFailureTracker failureTracker;
    private final AsyncTaskExecutor searchExecutor;
    private final RetrievalProperties properties;
    private final ContextReRanker reRanker;
    private final DiversitySelector diversitySelector;

    public ContextRetriever(EmbeddingProvider embeddingProvider,
                            VectorIndex vectorIndex,
                            ContextStore contextStore,
                            UsageTracker usageTracker,
                            IndexFailureTracker failureTracker,
                            @Qualifier("retrievalExecutor") AsyncTaskExecutor searchExecutor,
                            RetrievalProperties properties) {
        this.embeddingProvider = embeddingProvider;
        this.vectorIndex = vectorIndex;
        this.contextStore = contextStore;
        this.usageTracker = usageTracker;
        this.failureTracker = failureTracker;
        this.searchExecutor = searchExecutor;
        this.properties = properties;
        this.reRanker = new ContextReRanker(properties.getWeights(), properties.getFreshnessDecayRate());
        this.diversitySelector = new DiversitySelector(properties.getDuplicateThreshold());
    }

    /**
     * Retrieves ranked, de-duplicated contexts for the request.
     *
     * @throws ContextValidationException if the workspace is missing or a numeric field is out of range
     * @throws com.adlanda.contextengine.exception.IndexUnavailableException if the vector index cannot be searched
     * @throws com.adlanda.contextengine.exception.StoreUnavailableException if hits cannot be hydrated
     */
    public RetrievalResult retrieve(RetrievalRequest request) {
        long startTime = System.nanoTime();
        validate(request);

        String query = request.query();
        if (query == null || query.isBlank()) {
            log.debug("Empty query for workspace {}, returning no contexts", request.workspaceId());
            return RetrievalResult.empty(query, elapsedMs(startTime));
        }

        int limit = request.limit() != null ? request.limit() : properties.getDefaultLimit();
        double minSimilarity = request.minSimilarity() != null
                ? request.minSimilarity()
                : properties.getDefaultMinSimilarity();
        Duration timeout = request.timeout() != null ? request.timeout() : properties.getSearchTimeout();

        // 1-2. Expand and embed
        String expandedQuery = expandQuery(query, request.entities());
        List<Double> queryEmbedding = embeddingProvider.embed(expandedQuery);

        // 3. Walk the tiers
        TierSearch search = searchTiers(request, queryEmbedding, limit, minSimilarity, startTime + timeout.toNanos());

        // 4. Hydrate
        Instant now = Instant.now();
        List<ContextReRanker.Candidate> candidates = hydrate(request.workspaceId(), search.hits(), now);

        // 5. Rank and diversify
        List<ScoredContext> ranked = reRanker.rank(candidates, now);
        List<ScoredContext> selected = properties.isDiversityEnabled()
                ? diversitySelector.select(ranked, limit)
                : ranked.stream().limit(limit).toList();

        // 6. Usage side effect, off the request path
        usageTracker.trackUsage(selected.stream().map(sc -> sc.context().id()).toList(), now);

        long latencyMs = elapsedMs(startTime);
        log.info("Retrieved {} of {} candidates for workspace {} in {}ms (tiers={}, degraded={})",
                selected.size(), candidates.size(), request.workspaceId(), latencyMs,
                search.tiersSearched().stream().map(ContextTier::value).toList(), search.degraded());

        return new RetrievalResult(selected, query, candidates.size(), latencyMs,
                search.tiersSearched(), search.degraded());
    }

    /**
     * Appends the values of entities whose confidence is strictly above the
     * configured threshold. Other entities are ignored.
     */
    public String expandQuery(String query, List<QueryEntity> entities) {
        if (!properties.isQueryExpansionEnabled() || entities == null || entities.isEmpty()) {
            return query;
        }
        String expansion = entities.stream()
                .filter(entity -> entity.confidence() > properties.getEntityConfidenceThreshold())
                .map(QueryEntity::value)
                .filter(value -> value != null && !value.isBlank())
                .collect(Collectors.joining(" "));
        return expansion.isEmpty() ? query : query + " " + expansion;
    }

    private TierSearch searchTiers(RetrievalRequest request, List<Double> queryEmbedding,
                                   int limit, double minSimilarity, long deadlineNanos) {
        List<ContextTier> tiers = request.tier() != null ? List.of(request.tier()) : ContextTier.SEARCH_ORDER;
        int perTier = limit * properties.getCandidateMultiplier();

        Map<String, VectorHit> hits = new LinkedHashMap<>();
        List<ContextTier> tiersSearched = new ArrayList<>();
        boolean degraded = false;

        long graceNanos = properties.getFirstTierGrace().toNanos();
        boolean firstTier = true;
        for (ContextTier tier : tiers) {
            long remaining = deadlineNanos - System.nanoTime();
            if (firstTier) {
                remaining = Math.max(remaining, graceNanos);
                firstTier = false;
            }
            if (remaining <= 0) {
                log.warn("Retrieval deadline reached before tier {} for workspace {}",
                        tier.value(), request.workspaceId());
                degraded = true;
                break;
            }

            VectorFilter filter = VectorFilter.forTier(request.workspaceId(), tier, request.types());
            Future<List<VectorHit>> future;
            try {
                future = searchExecutor.submit(() -> vectorIndex.search(queryEmbedding, perTier, filter));
            } catch (TaskRejectedException e) {
                log.warn("Search pool saturated, skipping tier {} for workspace {}: {}",
                        tier.value(), request.workspaceId(), e.getMessage());
                degraded = true;
                break;
            }

            List<VectorHit> tierHits;
            try {
                tierHits = future.get(remaining, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("Tier {} search timed out for workspace {}, returning partial results",
                        tier.value(), request.workspaceId());
                degraded = true;
                break;
            } catch (ExecutionException e) {
                if (e.getCause() instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new ContextEngineException("Tier " + tier.value() + " search failed", e.getCause());
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                throw new ContextEngineException("Retrieval interrupted", e);
            }

            tiersSearched.add(tier);
            int kept = 0;
            for (VectorHit hit : tierHits) {
                if (hit.score() >= minSimilarity) {
                    hits.merge(hit.id(), hit, (a, b) -> a.score() >= b.score() ? a : b);
                    kept++;
                }
            }
            log.debug("Tier {} returned {} hits ({} above {})", tier.value(), tierHits.size(), kept, minSimilarity);

            long strongHits = hits.values().stream()
                    .filter(hit -> hit.score() >= properties.getEarlyStopSimilarity())
                    .count();
            if (strongHits >= limit) {
                log.debug("Stopping after tier {}: {} hits at or above {}",
                        tier.value(), strongHits, properties.getEarlyStopSimilarity());
                break;
            }
        }

        return new TierSearch(new ArrayList<>(hits.values()), tiersSearched, degraded);
    }

    private List<ContextReRanker.Candidate> hydrate(String workspaceId, List<VectorHit> hits, Instant now) {
        if (hits.isEmpty()) {
            return List.of();
        }
        Map<String, Context> contexts = contextStore.findAllByIds(hits.stream().map(VectorHit::id).toList())
                .stream()
                .collect(Collectors.toMap(Context::id, Function.identity()));

        List<ContextReRanker.Candidate> candidates = new ArrayList<>(hits.size());
        for (VectorHit hit : hits) {
            Context context = contexts.get(hit.id());
            if (context == null) {
                failureTracker.record(hit.id(), IndexFailure.Operation.STALE_ENTRY,
                        "Vector hit has no matching context");
                continue;
            }
            if (!workspaceId.equals(context.workspaceId())) {
                log.debug("Dropping context {} from another workspace", context.id());
                continue;
            }
            if (isTooOld(context, now)) {
                continue;
            }
            candidates.add(new ContextReRanker.Candidate(context, hit.score()));
        }
        return candidates;
    }

    private boolean isTooOld(Context context, Instant now) {
        int maxAgeDays = properties.getMaxContextAgeDays();
        if (maxAgeDays <= 0 || context.recencyTimestamp() == null) {
            return false;
        }
        return context.recencyTimestamp().isBefore(now.minus(Duration.ofDays(maxAgeDays)));
    }

    private static void validate(RetrievalRequest request) {
        if (request == null) {
            throw new ContextValidationException("request is required");
        }
        if (request.workspaceId() == null || request.workspaceId().isBlank()) {
            throw new ContextValidationException("workspaceId is required");
        }
        if (request.limit() != null && request.limit() < 1) {
            throw new ContextValidationException("limit must be positive: " + request.limit());
        }
        Double minSimilarity = request.minSimilarity();
        if (minSimilarity != null && !(minSimilarity >= 0.0 && minSimilarity <= 1.0)) {
            throw new ContextValidationException("minSimilarity must be within [0, 1]: " + minSimilarity);
        }
        if (request.timeout() != null && request.timeout().isNegative()) {
            throw new ContextValidationException("timeout must not be negative");
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private record TierSearch(List<VectorHit> hits, List<ContextTier> tiersSearched, boolean degraded) {}
}
