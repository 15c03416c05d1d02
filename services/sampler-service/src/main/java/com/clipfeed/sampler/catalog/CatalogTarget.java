package com.clipfeed.sampler.catalog;

public enum CatalogTarget {
    SCENES(CatalogQueries.FIND_SCENES, CatalogQueries.GET_SCENE_COUNT, "findScenes", "scenes", "scene_filter"),
    SCENE_MARKERS(
        CatalogQueries.FIND_SCENE_MARKERS,
        CatalogQueries.GET_MARKER_COUNT,
        "findSceneMarkers",
        "scene_markers",
        "scene_marker_filter"
    );

    private final String findDocument;
    private final String countDocument;
    private final String rootField;
    private final String itemsField;
    private final String filterVariable;

    CatalogTarget(String findDocument, String countDocument, String rootField, String itemsField, String filterVariable) {
        this.findDocument = findDocument;
        this.countDocument = countDocument;
        this.rootField = rootField;
        this.itemsField = itemsField;
        this.filterVariable = filterVariable;
    }

    public String getFindDocument() {
        return findDocument;
    }

    public String getCountDocument() {
        return countDocument;
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
