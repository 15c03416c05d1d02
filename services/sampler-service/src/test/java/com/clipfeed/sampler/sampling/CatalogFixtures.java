package com.clipfeed.sampler.sampling;

import com.clipfeed.sampler.catalog.GraphQlResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Builds catalog GraphQL payloads for sampling tests.
 */
public final class CatalogFixtures {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private CatalogFixtures() {
    }

    public static GraphQlResult scenes(long count, Object... scenes) {
        ObjectNode data = MAPPER.createObjectNode();
        ObjectNode root = data.putObject("findScenes");
        root.put("count", count);
        ArrayNode items = root.putArray("scenes");
        for (Object scene : scenes) {
            items.add(scene instanceof ObjectNode node ? node : scene(String.valueOf(scene), 30.0));
        }
        return GraphQlResult.of(data);
    }

    public static GraphQlResult markers(long count, String... ids) {
        ObjectNode data = MAPPER.createObjectNode();
        ObjectNode root = data.putObject("findSceneMarkers");
        root.put("count", count);
        ArrayNode items = root.putArray("scene_markers");
        for (String id : ids) {
            ObjectNode marker = items.addObject();
            marker.put("id", id);
            marker.put("title", "marker " + id);
            marker.put("seconds", 10.0);
            marker.set("scene", scene("s" + id, 120.0));
        }
        return GraphQlResult.of(data);
    }

    public static GraphQlResult count(String rootField, long count) {
        ObjectNode data = MAPPER.createObjectNode();
        data.putObject(rootField).put("count", count);
        return GraphQlResult.of(data);
    }

    public static ObjectNode scene(String id, Double duration) {
        ObjectNode scene = MAPPER.createObjectNode();
        scene.put("id", id);
        scene.put("title", "scene " + id);
        ObjectNode file = scene.putArray("files").addObject();
        if (duration != null) {
            file.put("duration", duration);
        }
        return scene;
    }
}
