package com.adlanda.contextengine.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for context evolution.
 *
 * Maps to properties prefixed with 'contextengine.evolution' in application.properties.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "contextengine.evolution")
public class EvolutionProperties {

    /**
     * Per-day temporal decay rate: confidence *= exp(-rate * ageDays).
     */
    @DecimalMin("0.0")
    private double temporalDecayRate = 0.01;

    /**
     * Contexts below this confidence are flagged by a decay sweep.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double minConfidenceThreshold = 0.3;

    /**
     * Weight of a new feedback signal: confidence = confidence * (1 - a) + signal * a.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double feedbackSmoothing = 0.2;

    /**
     * Contexts read and written per batch during a sweep.
     */
    @Min(1)
    private int batchSize = 100;

    /**
     * Confidence changes at or below this value are not persisted.
     */
    @DecimalMin("0.0")
    private double changeEpsilon = 1e-6;

    /**
     * Whether flagged contexts are deleted instead of only reported.
     */
    private boolean deleteBelowThreshold = false;

    /**
     * Whether the scheduler runs decay sweeps over all workspaces.
     */
    private boolean autoEnabled = false;

    /**
     * Delay between scheduled sweeps.
     */
    @NotNull
    private Duration interval = Duration.ofHours(24);

    public double getTemporalDecayRate() {
        return temporalDecayRate;
    }

    public void setTemporalDecayRate(double temporalDecayRate) {
        this.temporalDecayRate = temporalDecayRate;
    }

    public double getMinConfidenceThreshold() {
        return minConfidenceThreshold;
    }

    public void setMinConfidenceThreshold(double minConfidenceThreshold) {
        this.minConfidenceThreshold = minConfidenceThreshold;
    }

    public double getFeedbackSmoothing() {
        return feedbackSmoothing;
    }

    public void setFeedbackSmoothing(double feedbackSmoothing) {
        this.feedbackSmoothing = feedbackSmoothing;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public double getChangeEpsilon() {
        return changeEpsilon;
    }

    public void setChangeEpsilon(double changeEpsilon) {
        this.changeEpsilon = changeEpsilon;
    }

    public boolean isDeleteBelowThreshold() {
        return deleteBelowThreshold;
    }

    public void setDeleteBelowThreshold(boolean deleteBelowThreshold) {
        this.deleteBelowThreshold = deleteBelowThreshold;
    }

    public boolean isAutoEnabled() {
        return autoEnabled;
    }

    public void setAutoEnabled(boolean autoEnabled) {
        this.autoEnabled = autoEnabled;
    }

    public Duration getInterval() {
        return interval;
    }

    public void setInterval(Duration interval) {
        this.interval = interval;
    }
}
