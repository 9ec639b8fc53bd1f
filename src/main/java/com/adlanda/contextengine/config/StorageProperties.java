package com.adlanda.contextengine.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for context storage.
 *
 * Maps to properties prefixed with 'contextengine.storage' in application.properties.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "contextengine.storage")
public class StorageProperties {

    /**
     * Maximum items sent to a collaborator in one batch call.
     */
    @Min(1)
    @Max(1000)
    private int batchSize = 50;

    /**
     * Whether updates snapshot the previous content and metadata.
     */
    private boolean versioningEnabled = true;

    /**
     * Snapshots kept per context; older ones are pruned.
     */
    @Min(1)
    private int maxVersions = 10;

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public boolean isVersioningEnabled() {
        return versioningEnabled;
    }

    public void setVersioningEnabled(boolean versioningEnabled) {
        this.versioningEnabled = versioningEnabled;
    }

    public int getMaxVersions() {
        return maxVersions;
    }

    public void setMaxVersions(int maxVersions) {
        this.maxVersions = maxVersions;
    }
}
