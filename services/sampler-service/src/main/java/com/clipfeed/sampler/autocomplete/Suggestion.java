package com.clipfeed.sampler.autocomplete;

import com.fasterxml.jackson.databind.JsonNode;

public class Suggestion {
    private final String id;
    private final String name;
    private final String imagePath;

    public Suggestion(String id, String name, String imagePath) {
        this.id = id;
        this.name = name;
        this.imagePath = imagePath;
    }

    static Suggestion fromNode(JsonNode node) {
        String id = node.path("id").asText(null);
        if (id == null || id.isBlank()) {
            return null;
        }
        String imagePath = node.path("image_path").asText(null);
        return new Suggestion(id, node.path("name").asText(""), imagePath);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getImagePath() {
        return imagePath;
    }
}
