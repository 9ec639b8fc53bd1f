package com.adlanda.contextengine.model;

import java.util.List;
import java.util.Map;

/**
 * Partial update of a context. Null fields are left unchanged.
 *
 * Usage count is not part of the request: it only moves through retrieval.
 *
 * @param contextId             Context to update
 * @param content               New content
 * @param tier                  New tier
 * @param type                  New type
 * @param source                New metadata source
 * @param tags                  New tags (replaces)
 * @param attributes            New extension attributes (replaces)
 * @param confidence            New confidence in [0, 1]
 * @param regenerateEmbeddings  Re-embed when content changed (default true)
 * @param preserveUpdatedAt     Keep the current {@code updatedAt} (confidence-only writes)
 */
public record ContextUpdateRequest(
        String contextId,
        String content,
        ContextTier tier,
        ContextType type,
        String source,
        List<String> tags,
        Map<String, String> attributes,
        Double confidence,
        boolean regenerateEmbeddings,
        boolean preserveUpdatedAt
) {
    public static Builder builder(String contextId) {
        return new Builder(contextId);
    }

    /**
     * True when only confidence is being changed.
     */
    public boolean isConfidenceOnly() {
        return content == null && tier == null && type == null && source == null
                && tags == null && attributes == null && confidence != null;
    }

    public static final class Builder {
        private final String contextId;
        private String content;
        private ContextTier tier;
        private ContextType type;
        private String source;
        private List<String> tags;
        private Map<String, String> attributes;
        private Double confidence;
        private boolean regenerateEmbeddings = true;
        private boolean preserveUpdatedAt;

        private Builder(String contextId) {
            this.contextId = contextId;
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder tier(ContextTier tier) {
            this.tier = tier;
            return this;
        }

        public Builder type(ContextType type) {
            this.type = type;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder attributes(Map<String, String> attributes) {
            this.attributes = attributes;
            return this;
        }

        public Builder confidence(Double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder regenerateEmbeddings(boolean regenerateEmbeddings) {
            this.regenerateEmbeddings = regenerateEmbeddings;
            return this;
        }

        public Builder preserveUpdatedAt(boolean preserveUpdatedAt) {
            this.preserveUpdatedAt = preserveUpdatedAt;
            return this;
        }

        public ContextUpdateRequest build() {
            return new ContextUpdateRequest(contextId, content, tier, type, source, tags, attributes,
                    confidence, regenerateEmbeddings, preserveUpdatedAt);
        }
    }
}
