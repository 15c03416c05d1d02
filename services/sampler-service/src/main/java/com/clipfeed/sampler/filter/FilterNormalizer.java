package com.clipfeed.sampler.filter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns user filters and saved-filter object filters into {@link CanonicalFilter}s.
 *
 * <p>Each id field is classified into one {@link FieldShape} before decoding. Unrecognized shapes,
 * and recognized shapes that carry no valid id, decode to an absent field. Nothing here throws.
 */
@Component
public class FilterNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(FilterNormalizer.class);

    static final int ALL_DESCENDANTS = -1;

    private final ObjectMapper objectMapper;

    public FilterNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    enum FieldShape {
        ID_LIST,
        STRUCTURED,
        UNRECOGNIZED
    }

    public CanonicalFilter normalize(JsonNode rawObjectFilter) {
        if (rawObjectFilter != null && rawObjectFilter.isTextual()) {
            rawObjectFilter = parseEmbedded(rawObjectFilter.asText());
        }
        if (rawObjectFilter == null || !rawObjectFilter.isObject()) {
            return CanonicalFilter.empty();
        }
        Map<String, IdCriterion> criteria = new LinkedHashMap<>();
        Map<String, Object> passthrough = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = rawObjectFilter.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            try {
                if (CanonicalFilter.ID_FIELDS.contains(name)) {
                    decodeCriterion(field.getValue()).ifPresent(criterion -> criteria.put(name, criterion));
                } else if (field.getValue() != null && !field.getValue().isNull()) {
                    passthrough.put(name, objectMapper.convertValue(field.getValue(), Object.class));
                }
            } catch (RuntimeException e) {
                logger.debug("Dropping unreadable filter field {}: {}", name, e.getMessage());
            }
        }
        return new CanonicalFilter(criteria, passthrough);
    }

    // older catalogs return saved object filters as a JSON string
    private JsonNode parseEmbedded(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            logger.debug("Ignoring unparseable object filter: {}", e.getMessage());
            return null;
        }
    }

    public Optional<IdCriterion> decodeCriterion(JsonNode node) {
        switch (classify(node)) {
            case ID_LIST:
                return toCriterion(extractIds(node), null, List.of(), null);
            case STRUCTURED:
                return decodeStructured(node);
            default:
                return Optional.empty();
        }
    }

    public List<Long> normalizeIds(Collection<String> rawIds) {
        if (rawIds == null || rawIds.isEmpty()) {
            return List.of();
        }
        Set<Long> ids = new LinkedHashSet<>();
        for (String raw : rawIds) {
            parseId(raw).ifPresent(ids::add);
        }
        return new ArrayList<>(ids);
    }

    FieldShape classify(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return FieldShape.UNRECOGNIZED;
        }
        if (node.isArray()) {
            return FieldShape.ID_LIST;
        }
        if (node.isObject() && node.has("value")) {
            return FieldShape.STRUCTURED;
        }
        if (node.isObject()) {
            CriterionModifier modifier = CriterionModifier.fromValue(node.path("modifier").asText(null));
            if (modifier != null && !modifier.requiresIds()) {
                return FieldShape.STRUCTURED;
            }
        }
        return FieldShape.UNRECOGNIZED;
    }

    private Optional<IdCriterion> decodeStructured(JsonNode node) {
        JsonNode value = node.get("value");
        JsonNode wrapper = null;
        JsonNode idSource = value;
        if (value != null && value.isObject() && value.path("items").isArray()) {
            wrapper = value;
            idSource = value.get("items");
        }

        CriterionModifier modifier = CriterionModifier.fromValue(node.path("modifier").asText(null));

        JsonNode excludesNode = firstPresent(node.get("excludes"), node.get("excluded"));
        if (excludesNode == null && wrapper != null) {
            excludesNode = firstPresent(wrapper.get("excluded"), wrapper.get("excludes"));
        }

        JsonNode depthNode = node.get("depth");
        if ((depthNode == null || depthNode.isNull()) && wrapper != null) {
            depthNode = wrapper.get("depth");
        }

        return toCriterion(extractIds(idSource), modifier, extractIds(excludesNode), coerceDepth(depthNode));
    }

    private Optional<IdCriterion> toCriterion(List<Long> ids, CriterionModifier modifier, List<Long> excludes, Integer depth) {
        if (ids.isEmpty() && (modifier == null || modifier.requiresIds())) {
            return Optional.empty();
        }
        return Optional.of(new IdCriterion(ids, modifier, excludes, depth));
    }

    List<Long> extractIds(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return List.of();
        }
        Set<Long> ids = new LinkedHashSet<>();
        if (node.isArray()) {
            for (JsonNode element : node) {
                extractId(element).ifPresent(ids::add);
            }
        } else {
            extractId(node).ifPresent(ids::add);
        }
        return new ArrayList<>(ids);
    }

    private Optional<Long> extractId(JsonNode element) {
        if (element == null || element.isNull()) {
            return Optional.empty();
        }
        JsonNode scalar = element;
        if (element.isObject()) {
            scalar = firstPresent(element.get("id"), element.get("value"));
            if (scalar == null || scalar.isContainerNode()) {
                return Optional.empty();
            }
        }
        if (scalar.isIntegralNumber()) {
            return nonNegative(scalar.asLong());
        }
        if (scalar.isNumber()) {
            double value = scalar.asDouble();
            return value == Math.rint(value) ? nonNegative((long) value) : Optional.empty();
        }
        if (scalar.isTextual()) {
            return parseId(scalar.asText());
        }
        return Optional.empty();
    }

    private Optional<Long> parseId(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        try {
            return nonNegative(Long.parseLong(raw.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Optional<Long> nonNegative(long value) {
        return value >= 0 ? Optional.of(value) : Optional.empty();
    }

    Integer coerceDepth(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isBoolean()) {
            return node.asBoolean() ? ALL_DESCENDANTS : 0;
        }
        if (node.isNumber()) {
            return node.asInt();
        }
        if (node.isTextual()) {
            String text = node.asText().trim();
            if ("true".equalsIgnoreCase(text)) {
                return ALL_DESCENDANTS;
            }
            if ("false".equalsIgnoreCase(text)) {
                return 0;
            }
            try {
                return Integer.parseInt(text);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static JsonNode firstPresent(JsonNode first, JsonNode second) {
        if (first != null && !first.isNull()) {
            return first;
        }
        if (second != null && !second.isNull()) {
            return second;
        }
        return null;
    }
}
