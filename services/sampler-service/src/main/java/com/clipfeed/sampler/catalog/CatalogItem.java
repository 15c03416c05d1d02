package com.clipfeed.sampler.catalog;

import com.fasterxml.jackson.databind.JsonNode;

public class CatalogItem {
    private final String id;
    private final String sceneId;
    private final String title;
    private final Double startSeconds;
    private final Double durationSeconds;
    private final JsonNode source;

    public CatalogItem(String id, String sceneId, String title, Double startSeconds, Double durationSeconds, JsonNode source) {
        this.id = id;
        this.sceneId = sceneId;
        this.title = title;
        this.startSeconds = startSeconds;
        this.durationSeconds = durationSeconds;
        this.source = source;
    }

    public static CatalogItem fromNode(CatalogTarget target, JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        String id = node.path("id").asText(null);
        if (id == null || id.isBlank()) {
            return null;
        }
        if (target == CatalogTarget.SCENES) {
            return new CatalogItem(id, id, titleOf(node), 0.0, fileDuration(node), node);
        }
        JsonNode scene = node.path("scene");
        String title = node.path("title").asText("");
        if (title.isBlank()) {
            title = titleOf(scene);
        }
        double start = node.path("seconds").asDouble(0.0);
        Double duration = null;
        if (node.path("end_seconds").isNumber()) {
            duration = Math.max(0.0, node.path("end_seconds").asDouble() - start);
        } else {
            Double sceneDuration = fileDuration(scene);
            if (sceneDuration != null) {
                duration = Math.max(0.0, sceneDuration - start);
            }
        }
        return new CatalogItem(id, scene.path("id").asText(null), title, start, duration, node);
    }

    private static String titleOf(JsonNode scene) {
        String title = scene.path("title").asText("");
        return title.isBlank() ? "Untitled" : title;
    }

    private static Double fileDuration(JsonNode scene) {
        JsonNode duration = scene.path("files").path(0).path("duration");
        return duration.isNumber() ? duration.asDouble() : null;
    }

    public String getId() {
        return id;
    }

    public String getSceneId() {
        return sceneId;
    }

    public String getTitle() {
        return title;
    }

    public Double getStartSeconds() {
        return startSeconds;
    }

    public Double getDurationSeconds() {
        return durationSeconds;
    }

    public JsonNode getSource() {
        return source;
    }
}
