package com.adlanda.contextengine.service;

import com.adlanda.contextengine.config.RetrievalProperties.Weights;
import com.adlanda.contextengine.model.Context;
import com.adlanda.contextengine.model.ScoredContext;
import com.adlanda.contextengine.model.ScoredContext.ScoreBreakdown;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Blends raw similarity with freshness, usage and confidence into one score.
 *
 * <pre>
 * score = w.semantic * clamp(similarity)
 *       + w.freshness * exp(-ageDays * decayRate)
 *       + w.usage * minMax(usageCount)
 *       + w.confidence * confidence
 * </pre>
 *
 * Usage is min-max normalized over the candidates passed to {@link #rank}, not
 * over the workspace, so the same context can score differently depending on
 * which other candidates it competes with. All-equal usage counts normalize to 0.
 *
 * Stateless and thread-safe.
 */
public class ContextReRanker {

    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    /**
     * Score descending, then most recent {@code lastAccessed} (never accessed last), then id.
     */
    public static final Comparator<ScoredContext> RANKING_ORDER = Comparator
            .comparingDouble(ScoredContext::score).reversed()
            .thenComparing((ScoredContext sc) -> sc.context().lastAccessed(),
                    Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing((ScoredContext sc) -> sc.context().id(),
                    Comparator.nullsLast(Comparator.<String>naturalOrder()));

    private final double semanticWeight;
    private final double freshnessWeight;
    private final double usageWeight;
    private final double confidenceWeight;
    private final double decayRate;

    /**
     * @throws IllegalArgumentException if a weight is negative or not finite, all weights are 0,
     *                                  or the decay rate is negative or not finite
     */
    public ContextReRanker(Weights weights, double decayRate) {
        if (weights == null) {
            throw new IllegalArgumentException("weights are required");
        }
        this.semanticWeight = requireWeight("semantic", weights.getSemantic());
        this.freshnessWeight = requireWeight("freshness", weights.getFreshness());
        this.usageWeight = requireWeight("usage", weights.getUsage());
        this.confidenceWeight = requireWeight("confidence", weights.getConfidence());
        if (semanticWeight + freshnessWeight + usageWeight + confidenceWeight <= 0.0) {
            throw new IllegalArgumentException("At least one ranking weight must be positive");
        }
        if (!Double.isFinite(decayRate) || decayRate < 0.0) {
            throw new IllegalArgumentException("Freshness decay rate must be a non-negative number: " + decayRate);
        }
        this.decayRate = decayRate;
    }

    /**
     * Scores and sorts the candidates.
     *
     * @param candidates hydrated contexts with their raw vector similarity
     * @param now        reference time for freshness
     * @return scored contexts in {@link #RANKING_ORDER}
     */
    public List<ScoredContext> rank(List<Candidate> candidates, Instant now) {
        if (candidates.isEmpty()) {
            return List.of();
        }

        long minUsage = Long.MAX_VALUE;
        long maxUsage = Long.MIN_VALUE;
        for (Candidate candidate : candidates) {
            long usage = candidate.context().metadata().usageCount();
            minUsage = Math.min(minUsage, usage);
            maxUsage = Math.max(maxUsage, usage);
        }
        long usageRange = maxUsage - minUsage;

        final long floor = minUsage;
        return candidates.stream()
                .map(candidate -> {
                    Context context = candidate.context();
                    double usage = usageRange == 0
                            ? 0.0
                            : (double) (context.metadata().usageCount() - floor) / usageRange;
                    ScoreBreakdown breakdown = new ScoreBreakdown(
                            clamp(candidate.similarity()),
                            freshness(context, now),
                            usage,
                            clamp(context.metadata().effectiveConfidence())
                    );
                    return new ScoredContext(context, candidate.similarity(), breakdown, blend(breakdown));
                })
                .sorted(RANKING_ORDER)
                .toList();
    }

    /**
     * exp(-ageDays * decayRate), age taken from {@code lastAccessed} falling back to {@code updatedAt}.
     */
    public double freshness(Context context, Instant now) {
        Instant timestamp = context.recencyTimestamp();
        if (timestamp == null) {
            return 0.0;
        }
        double ageDays = Math.max(0.0, (now.toEpochMilli() - timestamp.toEpochMilli()) / MILLIS_PER_DAY);
        return Math.exp(-ageDays * decayRate);
    }

    private double blend(ScoreBreakdown breakdown) {
        return semanticWeight * breakdown.semantic()
                + freshnessWeight * breakdown.freshness()
                + usageWeight * breakdown.usage()
                + confidenceWeight * breakdown.confidence();
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static double requireWeight(String name, double value) {
        if (!Double.isFinite(value) || value < 0.0) {
            throw new IllegalArgumentException("Ranking weight '" + name + "' must be a non-negative number: " + value);
        }
        return value;
    }

    /**
     * A hydrated context with its raw vector similarity.
     */
    public record Candidate(Context context, double similarity) {}
}
