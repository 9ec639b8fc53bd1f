package com.adlanda.contextengine.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the vector index adapter.
 *
 * Maps to properties prefixed with 'contextengine.vector-index' in application.properties.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "contextengine.vector-index")
public class VectorIndexProperties {

    /**
     * Which adapter to use: "memory" or "pgvector".
     */
    @Pattern(regexp = "memory|pgvector")
    private String type = "memory";

    /**
     * Table holding the vectors (pgvector only).
     */
    @Pattern(regexp = "[A-Za-z_][A-Za-z0-9_]*")
    private String tableName = "context_vectors";

    /**
     * Embedding dimensions (1536 for text-embedding-3-small).
     */
    @Min(1)
    private int dimensions = 1536;

    /**
     * Whether to create the extension, table and index on startup (pgvector only).
     */
    private boolean initializeSchema = false;

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public int getDimensions() {
        return dimensions;
    }

    public void setDimensions(int dimensions) {
        this.dimensions = dimensions;
    }

    public boolean isInitializeSchema() {
        return initializeSchema;
    }

    public void setInitializeSchema(boolean initializeSchema) {
        this.initializeSchema = initializeSchema;
    }
}
