package com.clipfeed.sampler.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class SceneUpdateResponse {
    @JsonProperty("scene_id")
    private String sceneId;

    private Integer rating100;

    @JsonProperty("tag_ids")
    private List<String> tagIds;

    public String getSceneId() {
        return sceneId;
    }

    public void setSceneId(String sceneId) {
        this.sceneId = sceneId;
    }

    public Integer getRating100() {
        return rating100;
    }

    public void setRating100(Integer rating100) {
        this.rating100 = rating100;
    }

    public List<String> getTagIds() {
        return tagIds;
    }

    public void setTagIds(List<String> tagIds) {
        this.tagIds = tagIds;
    }
}
