package com.clipfeed.sampler.autocomplete;

import com.clipfeed.sampler.catalog.CatalogQueries;
import java.util.Locale;
import java.util.Map;

public enum SuggestionKind {
    TAGS("tags", CatalogQueries.FIND_TAGS, "findTags", "tags", "tag_filter"),
    PERFORMERS("performers", CatalogQueries.FIND_PERFORMERS, "findPerformers", "performers", "performer_filter");

    private final String key;
    private final String document;
    private final String rootField;
    private final String itemsField;
    private final String filterVariable;

    SuggestionKind(String key, String document, String rootField, String itemsField, String filterVariable) {
        this.key = key;
        this.document = document;
        this.rootField = rootField;
        this.itemsField = itemsField;
        this.filterVariable = filterVariable;
    }

    public static SuggestionKind fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SuggestionKind kind : values()) {
            if (kind.key.equals(normalized)) {
                return kind;
            }
        }
        return null;
    }

    // popularity floor applied to the lookup
    Map<String, Object> filterFor(boolean hasTerm) {
        if (this == TAGS) {
            return hasTerm ? Map.of() : Map.of("marker_count", Map.of("value", 10, "modifier", "GREATER_THAN"));
        }
        return Map.of("scene_count", Map.of("value", 0, "modifier", "GREATER_THAN"));
    }

    public String getKey() {
        return key;
    }

    public String getDocument() {
        return document;
    }

    public String getRootField() {
        return rootField;
    }

    public String getItemsField() {
        return itemsField;
    }

    public String getFilterVariable() {
        return filterVariable;
    }
}
