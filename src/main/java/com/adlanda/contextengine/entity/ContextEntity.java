package com.adlanda.contextengine.entity;

import com.adlanda.contextengine.model.ContextTier;
import com.adlanda.contextengine.model.ContextType;
import jakarta.persistence.*;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * JPA entity for a stored context.
 *
 * The primary store is the source of truth; the vector index holds a derived
 * projection. {@code indexed} records whether that projection is known to be current.
 *
 * Updates only write changed columns, so usage counters moved by bulk queries
 * are not overwritten by a concurrent metadata update.
 */
@Entity
@DynamicUpdate
@Table(name = "contexts", indexes = {
        @Index(name = "idx_contexts_workspace_tier", columnList = "workspace_id, tier"),
        @Index(name = "idx_contexts_workspace_type", columnList = "workspace_id, context_type")
})
public class ContextEntity {

    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "workspace_id", nullable = false, updatable = false, length = 128)
    private String workspaceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "tier", nullable = false, length = 16)
    private ContextTier tier;

    @Enumerated(EnumType.STRING)
    @Column(name = "context_type", nullable = false, length = 32)
    private ContextType type;

    @Column(name = "content", nullable = false, length = 1_000_000)
    private String content;

    @Column(name = "source", length = 1000)
    private String source;

    @Convert(converter = TagsConverter.class)
    @Column(name = "tags", length = 4000)
    private List<String> tags = new ArrayList<>();

    @Column(name = "usage_count", nullable = false)
    private long usageCount;

    @Column(name = "confidence")
    private Double confidence;

    @Convert(converter = AttributesConverter.class)
    @Column(name = "attributes", length = 8000)
    private Map<String, String> attributes = new LinkedHashMap<>();

    @Column(name = "indexed", nullable = false)
    private boolean indexed;

    // Fixed at create time; false keeps the context out of the vector index and out of repair
    @ColumnDefault("true")
    @Column(name = "indexable", nullable = false, updatable = false)
    private boolean indexable = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "last_accessed")
    private Instant lastAccessed;

    // Default constructor for JPA; a fresh entity gets its id here
    public ContextEntity() {
        this.id = UUID.randomUUID().toString();
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getWorkspaceId() {
        return workspaceId;
    }

    public void setWorkspaceId(String workspaceId) {
        this.workspaceId = workspaceId;
    }

    public ContextTier getTier() {
        return tier;
    }

    public void setTier(ContextTier tier) {
        this.tier = tier;
    }

    public ContextType getType() {
        return type;
    }

    public void setType(ContextType type) {
        this.type = type;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public List<String> getTags() {
        return tags;
    }

    public void setTags(List<String> tags) {
        this.tags = tags;
    }

    public long getUsageCount() {
        return usageCount;
    }

    public void setUsageCount(long usageCount) {
        this.usageCount = usageCount;
    }

    public Double getConfidence() {
        return confidence;
    }

    public void setConfidence(Double confidence) {
        this.confidence = confidence;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public void setAttributes(Map<String, String> attributes) {
        this.attributes = attributes;
    }

    public boolean isIndexed() {
        return indexed;
    }

    public void setIndexed(boolean indexed) {
        this.indexed = indexed;
    }

    public boolean isIndexable() {
        return indexable;
    }

    public void setIndexable(boolean indexable) {
        this.indexable = indexable;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Instant getLastAccessed() {
        return lastAccessed;
    }

    public void setLastAccessed(Instant lastAccessed) {
        this.lastAccessed = lastAccessed;
    }

    @Override
    public String toString() {
        return "ContextEntity{" +
                "id='" + id + '\'' +
                ", workspaceId='" + workspaceId + '\'' +
                ", tier=" + tier +
                ", type=" + type +
                ", usageCount=" + usageCount +
                ", confidence=" + confidence +
                ", indexed=" + indexed +
                ", updatedAt=" + updatedAt +
                '}';
    }
}
