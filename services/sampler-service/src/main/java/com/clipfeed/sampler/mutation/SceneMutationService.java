package com.clipfeed.sampler.mutation;

import com.clipfeed.sampler.catalog.CatalogClient;
import com.clipfeed.sampler.catalog.CatalogException;
import com.clipfeed.sampler.catalog.CatalogQueries;
import com.clipfeed.sampler.catalog.CatalogResponseException;
import com.clipfeed.sampler.catalog.GraphQlResult;
import com.clipfeed.sampler.common.InvalidRequestException;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SceneMutationService {
    private static final Logger logger = LoggerFactory.getLogger(SceneMutationService.class);

    private final CatalogClient catalogClient;

    public SceneMutationService(CatalogClient catalogClient) {
        this.catalogClient = catalogClient;
    }

    public int updateRating(long sceneId, double rating10) {
        requireId("scene_id", sceneId);
        if (!Double.isFinite(rating10) || rating10 < 0 || rating10 > 10) {
            throw new InvalidRequestException("rating must be between 0 and 10");
        }
        int rating100 = (int) Math.round(rating10 * 10);
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("id", String.valueOf(sceneId));
        input.put("rating100", rating100);
        try {
            catalogClient.mutate(CatalogQueries.SCENE_UPDATE, Map.of("input", input), null);
            return rating100;
        } catch (CatalogException e) {
            logger.warn("{} failed: {}", "updateRating", e.getMessage());
            throw e;
        }
    }

    public List<Long> addTag(long sceneId, long tagId) {
        requireId("scene_id", sceneId);
        requireId("tag_id", tagId);
        try {
            List<Long> current = currentTagIds(sceneId);
            if (current.contains(tagId)) {
                return current;
            }
            List<Long> next = new ArrayList<>(current);
            next.add(tagId);
            writeTags(sceneId, next);
            return next;
        } catch (CatalogException e) {
            logger.warn("{} failed: {}", "addTag", e.getMessage());
            throw e;
        }
    }

    public List<Long> removeTag(long sceneId, long tagId) {
        requireId("scene_id", sceneId);
        requireId("tag_id", tagId);
        try {
            List<Long> current = currentTagIds(sceneId);
            List<Long> next = new ArrayList<>(current);
            next.remove(Long.valueOf(tagId));
            writeTags(sceneId, next);
            return next;
        } catch (CatalogException e) {
            logger.warn("{} failed: {}", "removeTag", e.getMessage());
            throw e;
        }
    }

    private List<Long> currentTagIds(long sceneId) {
        GraphQlResult result = catalogClient.query(
            CatalogQueries.FIND_SCENE_TAG_IDS,
            Map.of("id", String.valueOf(sceneId)),
            null
        );
        JsonNode scene = result.getData().path("findScene");
        if (scene.isMissingNode() || scene.isNull()) {
            throw new CatalogResponseException("scene not found: " + sceneId, List.of());
        }
        List<Long> ids = new ArrayList<>();
        for (JsonNode tag : scene.path("tags")) {
            String raw = tag.path("id").asText("");
            try {
                ids.add(Long.parseLong(raw.trim()));
            } catch (NumberFormatException e) {
                logger.debug("Skipping non-numeric tag id {} on scene {}", raw, sceneId);
            }
        }
        return ids;
    }

    private void writeTags(long sceneId, List<Long> tagIds) {
        List<String> values = new ArrayList<>(tagIds.size());
        for (Long id : tagIds) {
            values.add(String.valueOf(id));
        }
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("id", String.valueOf(sceneId));
        input.put("tag_ids", values);
        catalogClient.mutate(CatalogQueries.SCENE_UPDATE, Map.of("input", input), null);
    }

    private static void requireId(String name, long id) {
        if (id <= 0) {
            throw new InvalidRequestException(name + " must be a positive id");
        }
    }
}
