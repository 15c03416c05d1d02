package com.clipfeed.sampler.filter;

import java.util.List;
import java.util.Objects;

public final class FilterSpec {
    public static final int DEFAULT_LIMIT = 20;

    private final String query;
    private final List<Long> tagIds;
    private final List<Long> excludedTagIds;
    private final List<Long> performerIds;
    private final List<Long> studioIds;
    private final String savedFilterId;
    private final boolean shuffleMode;
    private final boolean includeScenesWithoutMarkers;
    private final Integer offset;
    private final int limit;
    private final String sortSeed;
    private final Double maxDurationSeconds;

    private FilterSpec(Builder builder) {
        this.query = builder.query;
        this.tagIds = builder.tagIds == null ? List.of() : List.copyOf(builder.tagIds);
        this.excludedTagIds = builder.excludedTagIds == null ? List.of() : List.copyOf(builder.excludedTagIds);
        this.performerIds = builder.performerIds == null ? List.of() : List.copyOf(builder.performerIds);
        this.studioIds = builder.studioIds == null ? List.of() : List.copyOf(builder.studioIds);
        this.savedFilterId = builder.savedFilterId;
        this.shuffleMode = builder.shuffleMode;
        this.includeScenesWithoutMarkers = builder.includeScenesWithoutMarkers;
        this.offset = builder.offset;
        this.limit = builder.limit > 0 ? builder.limit : DEFAULT_LIMIT;
        this.sortSeed = builder.sortSeed;
        this.maxDurationSeconds = builder.maxDurationSeconds;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.query = query;
        builder.tagIds = tagIds;
        builder.excludedTagIds = excludedTagIds;
        builder.performerIds = performerIds;
        builder.studioIds = studioIds;
        builder.savedFilterId = savedFilterId;
        builder.shuffleMode = shuffleMode;
        builder.includeScenesWithoutMarkers = includeScenesWithoutMarkers;
        builder.offset = offset;
        builder.limit = limit;
        builder.sortSeed = sortSeed;
        builder.maxDurationSeconds = maxDurationSeconds;
        return builder;
    }

    public FilterSpec withSortSeed(String seed) {
        return toBuilder().sortSeed(seed).build();
    }

    public FilterSpec withOffset(Integer nextOffset) {
        return toBuilder().offset(nextOffset).build();
    }

    // true when tags, a saved filter or a text query narrow the result set
    public boolean hasActiveFilters() {
        return !tagIds.isEmpty() || hasSavedFilter() || hasQuery();
    }

    public boolean hasQuery() {
        return query != null && !query.isBlank();
    }

    public boolean hasSavedFilter() {
        return savedFilterId != null && !savedFilterId.isBlank();
    }

    public boolean hasOffset() {
        return offset != null;
    }

    public boolean isShortForm() {
        return maxDurationSeconds != null && maxDurationSeconds > 0;
    }

    public String getQuery() {
        return query;
    }

    public List<Long> getTagIds() {
        return tagIds;
    }

    public List<Long> getExcludedTagIds() {
        return excludedTagIds;
    }

    public List<Long> getPerformerIds() {
        return performerIds;
    }

    public List<Long> getStudioIds() {
        return studioIds;
    }

    public String getSavedFilterId() {
        return savedFilterId;
    }

    public boolean isShuffleMode() {
        return shuffleMode;
    }

    public boolean isIncludeScenesWithoutMarkers() {
        return includeScenesWithoutMarkers;
    }

    public Integer getOffset() {
        return offset;
    }

    public int getLimit() {
        return limit;
    }

    public String getSortSeed() {
        return sortSeed;
    }

    public Double getMaxDurationSeconds() {
        return maxDurationSeconds;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FilterSpec)) {
            return false;
        }
        FilterSpec other = (FilterSpec) o;
        return shuffleMode == other.shuffleMode
            && includeScenesWithoutMarkers == other.includeScenesWithoutMarkers
            && limit == other.limit
            && Objects.equals(query, other.query)
            && tagIds.equals(other.tagIds)
            && excludedTagIds.equals(other.excludedTagIds)
            && performerIds.equals(other.performerIds)
            && studioIds.equals(other.studioIds)
            && Objects.equals(savedFilterId, other.savedFilterId)
            && Objects.equals(offset, other.offset)
            && Objects.equals(sortSeed, other.sortSeed)
            && Objects.equals(maxDurationSeconds, other.maxDurationSeconds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(query, tagIds, excludedTagIds, performerIds, studioIds, savedFilterId,
            shuffleMode, includeScenesWithoutMarkers, offset, limit, sortSeed, maxDurationSeconds);
    }

    public static final class Builder {
        private String query;
        private List<Long> tagIds;
        private List<Long> excludedTagIds;
        private List<Long> performerIds;
        private List<Long> studioIds;
        private String savedFilterId;
        private boolean shuffleMode;
        private boolean includeScenesWithoutMarkers;
        private Integer offset;
        private int limit = DEFAULT_LIMIT;
        private String sortSeed;
        private Double maxDurationSeconds;

        private Builder() {
        }

        public Builder query(String query) {
            this.query = query;
            return this;
        }

        public Builder tagIds(List<Long> tagIds) {
            this.tagIds = tagIds;
            return this;
        }

        public Builder excludedTagIds(List<Long> excludedTagIds) {
            this.excludedTagIds = excludedTagIds;
            return this;
        }

        public Builder performerIds(List<Long> performerIds) {
            this.performerIds = performerIds;
            return this;
        }

        public Builder studioIds(List<Long> studioIds) {
            this.studioIds = studioIds;
            return this;
        }

        public Builder savedFilterId(String savedFilterId) {
            this.savedFilterId = savedFilterId;
            return this;
        }

        public Builder shuffleMode(boolean shuffleMode) {
            this.shuffleMode = shuffleMode;
            return this;
        }

        public Builder includeScenesWithoutMarkers(boolean includeScenesWithoutMarkers) {
            this.includeScenesWithoutMarkers = includeScenesWithoutMarkers;
            return this;
        }

        public Builder offset(Integer offset) {
            this.offset = offset;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public Builder sortSeed(String sortSeed) {
            this.sortSeed = sortSeed;
            return this;
        }

        public Builder maxDurationSeconds(Double maxDurationSeconds) {
            this.maxDurationSeconds = maxDurationSeconds;
            return this;
        }

        public FilterSpec build() {
            return new FilterSpec(this);
        }
    }
}
