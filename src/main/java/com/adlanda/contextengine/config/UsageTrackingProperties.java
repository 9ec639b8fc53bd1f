package com.adlanda.contextengine.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the background usage-tracking pool.
 *
 * Maps to properties prefixed with 'contextengine.usage-tracking' in application.properties.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "contextengine.usage-tracking")
public class UsageTrackingProperties {

    @Min(1)
    private int corePoolSize = 2;

    @Min(1)
    private int maxPoolSize = 4;

    /**
     * Pending updates beyond this are dropped (and logged), never blocking retrieval.
     */
    @Min(0)
    private int queueCapacity = 500;

    public int getCorePoolSize() {
        return corePoolSize;
    }

    public void setCorePoolSize(int corePoolSize) {
        this.corePoolSize = corePoolSize;
    }

    public int getMaxPoolSize() {
        return maxPoolSize;
    }

    public void setMaxPoolSize(int maxPoolSize) {
        this.maxPoolSize = maxPoolSize;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }
}
