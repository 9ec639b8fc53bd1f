package com.adlanda.contextengine.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for embedding generation.
 *
 * Maps to properties prefixed with 'contextengine.embedding' in application.properties.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "contextengine.embedding")
public class EmbeddingProperties {

    /**
     * Texts sent to the embedding model per call.
     */
    @Min(1)
    private int maxBatchSize = 32;

    /**
     * Whether to cache embeddings by content hash.
     */
    private boolean cacheEnabled = true;

    @Min(1)
    private long cacheMaxSize = 10_000;

    @NotNull
    private Duration cacheTtl = Duration.ofHours(24);

    public int getMaxBatchSize() {
        return maxBatchSize;
    }

    public void setMaxBatchSize(int maxBatchSize) {
        this.maxBatchSize = maxBatchSize;
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public void setCacheEnabled(boolean cacheEnabled) {
        this.cacheEnabled = cacheEnabled;
    }

    public long getCacheMaxSize() {
        return cacheMaxSize;
    }

    public void setCacheMaxSize(long cacheMaxSize) {
        this.cacheMaxSize = cacheMaxSize;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public void setCacheTtl(Duration cacheTtl) {
        this.cacheTtl = cacheTtl;
    }
}
