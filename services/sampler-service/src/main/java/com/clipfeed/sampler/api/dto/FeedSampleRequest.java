package com.clipfeed.sampler.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class FeedSampleRequest {
    private String query;

    @JsonProperty("tag_ids")
    private List<String> tagIds;

    @JsonProperty("excluded_tag_ids")
    private List<String> excludedTagIds;

    @JsonProperty("performer_ids")
    private List<String> performerIds;

    @JsonProperty("studio_ids")
    private List<String> studioIds;

    @JsonProperty("saved_filter_id")
    private String savedFilterId;

    @JsonProperty("shuffle_mode")
    private Boolean shuffleMode;

    @JsonProperty("include_scenes_without_markers")
    private Boolean includeScenesWithoutMarkers;

    private Integer offset;
    private Integer limit;

    @JsonProperty("sort_seed")
    private String sortSeed;

    @JsonProperty("max_duration_seconds")
    private Double maxDurationSeconds;

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public List<String> getTagIds() {
        return tagIds;
    }

    public void setTagIds(List<String> tagIds) {
        this.tagIds = tagIds;
    }

    public List<String> getExcludedTagIds() {
        return excludedTagIds;
    }

    public void setExcludedTagIds(List<String> excludedTagIds) {
        this.excludedTagIds = excludedTagIds;
    }

    public List<String> getPerformerIds() {
        return performerIds;
    }

    public void setPerformerIds(List<String> performerIds) {
        this.performerIds = performerIds;
    }

    public List<String> getStudioIds() {
        return studioIds;
    }

    public void setStudioIds(List<String> studioIds) {
        this.studioIds = studioIds;
    }

    public String getSavedFilterId() {
        return savedFilterId;
    }

    public void setSavedFilterId(String savedFilterId) {
        this.savedFilterId = savedFilterId;
    }

    public Boolean getShuffleMode() {
        return shuffleMode;
    }

    public void setShuffleMode(Boolean shuffleMode) {
        this.shuffleMode = shuffleMode;
    }

    public Boolean getIncludeScenesWithoutMarkers() {
        return includeScenesWithoutMarkers;
    }

    public void setIncludeScenesWithoutMarkers(Boolean includeScenesWithoutMarkers) {
        this.includeScenesWithoutMarkers = includeScenesWithoutMarkers;
    }

    public Integer getOffset() {
        return offset;
    }

    public void setOffset(Integer offset) {
        this.offset = offset;
    }

    public Integer getLimit() {
        return limit;
    }

    public void setLimit(Integer limit) {
        this.limit = limit;
    }

    public String getSortSeed() {
        return sortSeed;
    }

    public void setSortSeed(String sortSeed) {
        this.sortSeed = sortSeed;
    }

    public Double getMaxDurationSeconds() {
        return maxDurationSeconds;
    }

    public void setMaxDurationSeconds(Double maxDurationSeconds) {
        this.maxDurationSeconds = maxDurationSeconds;
    }
}
