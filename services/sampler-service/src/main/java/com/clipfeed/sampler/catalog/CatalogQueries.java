package com.clipfeed.sampler.catalog;

public final class CatalogQueries {
    private CatalogQueries() {
    }

    private static final String SCENE_FIELDS =
        "fragment SceneFields on Scene { "
            + "id title date rating100 o_counter "
            + "studio { id name } "
            + "performers { id name image_path } "
            + "tags { id name } "
            + "files { id path duration width height } "
            + "paths { screenshot preview stream } "
            + "} ";

    public static final String FIND_SCENES = SCENE_FIELDS
        + "query FindScenes($filter: FindFilterType, $scene_filter: SceneFilterType) { "
        + "findScenes(filter: $filter, scene_filter: $scene_filter) { "
        + "count scenes { ...SceneFields scene_markers { id } } "
        + "} }";

    public static final String GET_SCENE_COUNT =
        "query GetSceneCount($filter: FindFilterType, $scene_filter: SceneFilterType) { "
            + "findScenes(filter: $filter, scene_filter: $scene_filter) { count } }";

    public static final String FIND_SCENE_MARKERS = SCENE_FIELDS
        + "query FindSceneMarkers($filter: FindFilterType, $scene_marker_filter: SceneMarkerFilterType) { "
        + "findSceneMarkers(filter: $filter, scene_marker_filter: $scene_marker_filter) { "
        + "count scene_markers { "
        + "id title seconds end_seconds stream "
        + "primary_tag { id name } tags { id name } "
        + "scene { ...SceneFields } "
        + "} } }";

    public static final String GET_MARKER_COUNT =
        "query GetMarkerCount($filter: FindFilterType, $scene_marker_filter: SceneMarkerFilterType) { "
            + "findSceneMarkers(filter: $filter, scene_marker_filter: $scene_marker_filter) { count } }";

    public static final String FIND_TAGS =
        "query FindTags($filter: FindFilterType, $tag_filter: TagFilterType) { "
            + "findTags(filter: $filter, tag_filter: $tag_filter) { tags { id name image_path } } }";

    public static final String FIND_PERFORMERS =
        "query FindPerformers($filter: FindFilterType, $performer_filter: PerformerFilterType) { "
            + "findPerformers(filter: $filter, performer_filter: $performer_filter) { "
            + "performers { id name image_path } } }";

    public static final String FIND_SAVED_FILTER =
        "query FindSavedFilter($id: ID!) { "
            + "findSavedFilter(id: $id) { id name mode find_filter { q sort direction } object_filter } }";

    public static final String FIND_SAVED_FILTERS =
        "query FindSavedFilters($mode: FilterMode) { findSavedFilters(mode: $mode) { id name mode } }";

    public static final String FIND_SCENE_TAG_IDS =
        "query FindSceneTagIds($id: ID!) { findScene(id: $id) { id tags { id } } }";

    public static final String SCENE_UPDATE =
        "mutation SceneUpdate($input: SceneUpdateInput!) { "
            + "sceneUpdate(input: $input) { id rating100 tags { id } } }";
}
