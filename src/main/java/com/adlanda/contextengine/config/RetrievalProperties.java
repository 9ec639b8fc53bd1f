package com.adlanda.contextengine.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for context retrieval.
 *
 * Maps to properties prefixed with 'contextengine.retrieval' in application.properties.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "contextengine.retrieval")
public class RetrievalProperties {

    /**
     * Number of contexts returned when the request does not specify a limit.
     */
    @Min(1)
    private int defaultLimit = 10;

    /**
     * Vector hits below this raw similarity are discarded before hydration.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double defaultMinSimilarity = 0.0;

    /**
     * Whether to append high-confidence entities to the query text.
     */
    private boolean queryExpansionEnabled = true;

    /**
     * Entities must have a confidence strictly above this value to expand the query.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double entityConfidenceThreshold = 0.7;

    /**
     * Whether to filter near-duplicate contexts out of the final list.
     */
    private boolean diversityEnabled = true;

    /**
     * Token-overlap similarity above which two contexts count as duplicates.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double duplicateThreshold = 0.85;

    /**
     * Hits at or above this similarity count towards stopping the tier walk early.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double earlyStopSimilarity = 0.8;

    /**
     * Candidates fetched per tier, as a multiple of the requested limit.
     */
    @Min(1)
    private int candidateMultiplier = 1;

    /**
     * Per-day rate for the freshness signal: freshness = exp(-ageDays * rate).
     */
    @DecimalMin("0.0")
    private double freshnessDecayRate = 0.01;

    /**
     * Candidates older than this many days are dropped. 0 disables the limit.
     */
    @Min(0)
    private int maxContextAgeDays = 0;

    /**
     * Overall tier search deadline when the request does not carry one.
     */
    @NotNull
    private Duration searchTimeout = Duration.ofSeconds(5);

    /**
     * Minimum wait for the first tier, even when the deadline has already passed.
     */
    @NotNull
    private Duration firstTierGrace = Duration.ofMillis(250);

    @Valid
    @NotNull
    private Weights weights = new Weights();

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
        this.defaultLimit = defaultLimit;
    }

    public double getDefaultMinSimilarity() {
        return defaultMinSimilarity;
    }

    public void setDefaultMinSimilarity(double defaultMinSimilarity) {
        this.defaultMinSimilarity = defaultMinSimilarity;
    }

    public boolean isQueryExpansionEnabled() {
        return queryExpansionEnabled;
    }

    public void setQueryExpansionEnabled(boolean queryExpansionEnabled) {
        this.queryExpansionEnabled = queryExpansionEnabled;
    }

    public double getEntityConfidenceThreshold() {
        return entityConfidenceThreshold;
    }

    public void setEntityConfidenceThreshold(double entityConfidenceThreshold) {
        this.entityConfidenceThreshold = entityConfidenceThreshold;
    }

    public boolean isDiversityEnabled() {
        return diversityEnabled;
    }

    public void setDiversityEnabled(boolean diversityEnabled) {
        this.diversityEnabled = diversityEnabled;
    }

    public double getDuplicateThreshold() {
        return duplicateThreshold;
    }

    public void setDuplicateThreshold(double duplicateThreshold) {
        this.duplicateThreshold = duplicateThreshold;
    }

    public double getEarlyStopSimilarity() {
        return earlyStopSimilarity;
    }

    public void setEarlyStopSimilarity(double earlyStopSimilarity) {
        this.earlyStopSimilarity = earlyStopSimilarity;
    }

    public int getCandidateMultiplier() {
        return candidateMultiplier;
    }

    public void setCandidateMultiplier(int candidateMultiplier) {
        this.candidateMultiplier = candidateMultiplier;
    }

    public double getFreshnessDecayRate() {
        return freshnessDecayRate;
    }

    public void setFreshnessDecayRate(double freshnessDecayRate) {
        this.freshnessDecayRate = freshnessDecayRate;
    }

    public int getMaxContextAgeDays() {
        return maxContextAgeDays;
    }

    public void setMaxContextAgeDays(int maxContextAgeDays) {
        this.maxContextAgeDays = maxContextAgeDays;
    }

    public Duration getSearchTimeout() {
        return searchTimeout;
    }

    public void setSearchTimeout(Duration searchTimeout) {
        this.searchTimeout = searchTimeout;
    }

    public Duration getFirstTierGrace() {
        return firstTierGrace;
    }

    public void setFirstTierGrace(Duration firstTierGrace) {
        this.firstTierGrace = firstTierGrace;
    }

    public Weights getWeights() {
        return weights;
    }

    public void setWeights(Weights weights) {
        this.weights = weights;
    }

    /**
     * Re-ranking weights. Expected to sum to 1 so scores stay in [0, 1].
     */
    public static class Weights {

        @DecimalMin("0.0")
        private double semantic = 0.6;

        @DecimalMin("0.0")
        private double freshness = 0.2;

        @DecimalMin("0.0")
        private double usage = 0.1;

        @DecimalMin("0.0")
        private double confidence = 0.1;

        public Weights() {
        }

        public Weights(double semantic, double freshness, double usage, double confidence) {
            this.semantic = semantic;
            this.freshness = freshness;
            this.usage = usage;
            this.confidence = confidence;
        }

        public double getSemantic() {
            return semantic;
        }

        public void setSemantic(double semantic) {
            this.semantic = semantic;
        }

        public double getFreshness() {
            return freshness;
        }

        public void setFreshness(double freshness) {
            this.freshness = freshness;
        }

        public double getUsage() {
            return usage;
        }

        public void setUsage(double usage) {
            this.usage = usage;
        }

        public double getConfidence() {
            return confidence;
        }

        public void setConfidence(double confidence) {
            this.confidence = confidence;
        }

        @Override
        public String toString() {
            return "semantic=" + semantic + ", freshness=" + freshness
                    + ", usage=" + usage + ", confidence=" + confidence;
        }
    }
}
