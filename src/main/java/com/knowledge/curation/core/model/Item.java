package com.knowledge.curation.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A knowledge unit contributed by a user ("experience" or "skill").
 * Core domain object for curation.
 *
 * <p>Items are compared only within their category. Mutation happens exclusively through
 * merge and update decisions; every mutation bumps {@link #getVersion()}.</p>
 */
public class Item {
    private final String id;
    private final String category;
    private String title;
    private String body;
    private String embeddingRef;
    private boolean embeddingStale;
    private ItemStatus status;
    private String canonicalOf;
    private final Instant createdAt;
    private Instant updatedAt;
    private long version;

    private Item(Builder builder) {
        this.id = builder.id;
        this.category = builder.category;
        this.title = builder.title;
        this.body = builder.body != null ? builder.body : "";
        this.embeddingRef = builder.embeddingRef != null ? builder.embeddingRef : builder.id;
        this.embeddingStale = builder.embeddingStale;
        this.status = builder.status != null ? builder.status : ItemStatus.PENDING;
        this.canonicalOf = builder.canonicalOf;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
        this.version = builder.version;
    }

    public String getId() {
        return id;
    }

    public String getCategory() {
        return category;
    }

    public String getTitle() {
        return title;
    }

    public String getBody() {
        return body;
    }

    public String getEmbeddingRef() {
        return embeddingRef;
    }

    public boolean isEmbeddingStale() {
        return embeddingStale;
    }

    public ItemStatus getStatus() {
        return status;
    }

    public String getCanonicalOf() {
        return canonicalOf;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public long getVersion() {
        return version;
    }

    /**
     * Active items (PENDING or SYNCED) take part in similarity and merging.
     */
    public boolean isActive() {
        return status != ItemStatus.REJECTED;
    }

    /**
     * A merged item is REJECTED and points at its surviving canonical item.
     */
    public boolean isMerged() {
        return status == ItemStatus.REJECTED && canonicalOf != null;
    }

    public void markMergedInto(String canonicalId) {
        Objects.requireNonNull(canonicalId, "canonicalId is required");
        if (canonicalId.equals(id)) {
            throw new IllegalArgumentException("Item cannot be merged into itself: " + id);
        }
        this.status = ItemStatus.REJECTED;
        this.canonicalOf = canonicalId;
        touch();
    }

    public void markRejected() {
        this.status = ItemStatus.REJECTED;
        this.canonicalOf = null;
        touch();
    }

    /**
     * Re-points an already merged item at a new canonical (chain flattening).
     */
    public void repointCanonical(String canonicalId) {
        if (!isMerged()) {
            throw new IllegalStateException("Only merged items can be re-pointed: " + id);
        }
        this.canonicalOf = Objects.requireNonNull(canonicalId, "canonicalId is required");
        touch();
    }

    public void updateContent(String newTitle, String newBody) {
        if (newTitle != null) {
            this.title = newTitle;
        }
        if (newBody != null) {
            this.body = newBody;
        }
        this.embeddingStale = true;
        touch();
    }

    private void touch() {
        this.updatedAt = Instant.now();
        this.version++;
    }

    /**
     * Creates a detached copy, used for snapshots and compensation.
     */
    public Item copy() {
        return builder(this).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Item item = (Item) o;
        return Objects.equals(id, item.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Item{" +
                "id='" + id + '\'' +
                ", category='" + category + '\'' +
                ", title='" + title + '\'' +
                ", status=" + status +
                ", canonicalOf='" + canonicalOf + '\'' +
                ", version=" + version +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Item item) {
        return new Builder()
                .id(item.id)
                .category(item.category)
                .title(item.title)
                .body(item.body)
                .embeddingRef(item.embeddingRef)
                .embeddingStale(item.embeddingStale)
                .status(item.status)
                .canonicalOf(item.canonicalOf)
                .createdAt(item.createdAt)
                .updatedAt(item.updatedAt)
                .version(item.version);
    }

    public static class Builder {
        private String id;
        private String category;
        private String title;
        private String body;
        private String embeddingRef;
        private boolean embeddingStale;
        private ItemStatus status;
        private String canonicalOf;
        private Instant createdAt;
        private Instant updatedAt;
        private long version;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder body(String body) {
            this.body = body;
            return this;
        }

        public Builder embeddingRef(String embeddingRef) {
            this.embeddingRef = embeddingRef;
            return this;
        }

        public Builder embeddingStale(boolean embeddingStale) {
            this.embeddingStale = embeddingStale;
            return this;
        }

        public Builder status(ItemStatus status) {
            this.status = status;
            return this;
        }

        public Builder canonicalOf(String canonicalOf) {
            this.canonicalOf = canonicalOf;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Item build() {
            Objects.requireNonNull(id, "id is required");
            Objects.requireNonNull(category, "category is required");
            Objects.requireNonNull(title, "title is required");
            return new Item(this);
        }
    }
}
