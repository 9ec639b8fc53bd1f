package com.adlanda.contextengine.entity;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * JPA entity for a pre-update snapshot of a context.
 */
@Entity
@Table(name = "context_versions",
        uniqueConstraints = @UniqueConstraint(name = "uk_context_versions_number",
                columnNames = {"context_id", "version_number"}),
        indexes = @Index(name = "idx_context_versions_context", columnList = "context_id"))
public class ContextVersionEntity {

    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "context_id", nullable = false, length = 36)
    private String contextId;

    @Column(name = "version_number", nullable = false)
    private int versionNumber;

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

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public ContextVersionEntity() {
        this.id = UUID.randomUUID().toString();
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getContextId() {
        return contextId;
    }

    public void setContextId(String contextId) {
        this.contextId = contextId;
    }

    public int getVersionNumber() {
        return versionNumber;
    }

    public void setVersionNumber(int versionNumber) {
        this.versionNumber = versionNumber;
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

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
