package com.clipfeed.sampler.savedfilter;

import com.fasterxml.jackson.databind.JsonNode;

public class SavedFilterSummary {
    private final String id;
    private final String name;
    private final String mode;

    public SavedFilterSummary(String id, String name, String mode) {
        this.id = id;
        this.name = name;
        this.mode = mode;
    }

    static SavedFilterSummary fromNode(JsonNode node) {
        String id = node.path("id").asText(null);
        if (id == null || id.isBlank()) {
            return null;
        }
        return new SavedFilterSummary(id, node.path("name").asText(""), node.path("mode").asText(null));
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getMode() {
        return mode;
    }
}
