package com.clipfeed.sampler.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

public class FeedSampleResponse {
    private List<Item> items;

    @JsonProperty("total_count")
    private long totalCount;

    private FeedSampleRequest next;
    private String status;

    @JsonProperty("trace_id")
    private String traceId;

    @JsonProperty("request_id")
    private String requestId;

    public List<Item> getItems() {
        return items;
    }

    public void setItems(List<Item> items) {
        this.items = items;
    }

    public long getTotalCount() {
        return totalCount;
    }

    public void setTotalCount(long totalCount) {
        this.totalCount = totalCount;
    }

    public FeedSampleRequest getNext() {
        return next;
    }

    public void setNext(FeedSampleRequest next) {
        this.next = next;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getTraceId() {
        return traceId;
    }

    public void setTraceId(String traceId) {
        this.traceId = traceId;
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Item {
        private String id;

        @JsonProperty("scene_id")
        private String sceneId;

        private String title;

        @JsonProperty("start_seconds")
        private Double startSeconds;

        @JsonProperty("duration_seconds")
        private Double durationSeconds;

        private JsonNode source;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getSceneId() {
            return sceneId;
        }

        public void setSceneId(String sceneId) {
            this.sceneId = sceneId;
        }

        public String getTitle() {
            return title;
        }

        public void setTitle(String title) {
            this.title = title;
        }

        public Double getStartSeconds() {
            return startSeconds;
        }

        public void setStartSeconds(Double startSeconds) {
            this.startSeconds = startSeconds;
        }

        public Double getDurationSeconds() {
            return durationSeconds;
        }

        public void setDurationSeconds(Double durationSeconds) {
            this.durationSeconds = durationSeconds;
        }

        public JsonNode getSource() {
            return source;
        }

        public void setSource(JsonNode source) {
            this.source = source;
        }
    }
}
