package com.clipfeed.sampler.filter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public final class CanonicalFilter {
    public static final String TAGS = "tags";
    public static final String SCENE_TAGS = "scene_tags";
    public static final String PERFORMERS = "performers";
    public static final String SCENE_PERFORMERS = "scene_performers";
    public static final String STUDIOS = "studios";

    static final Set<String> ID_FIELDS = Set.of(TAGS, SCENE_TAGS, PERFORMERS, SCENE_PERFORMERS, STUDIOS);

    // Tag-like ids travel as GraphQL ID strings, performer ids as ints.
    private static final Set<String> STRING_ID_FIELDS = Set.of(TAGS, SCENE_TAGS, STUDIOS);

    private static final CanonicalFilter EMPTY = new CanonicalFilter(Map.of(), Map.of());

    private final Map<String, IdCriterion> criteria;
    private final Map<String, Object> passthrough;

    CanonicalFilter(Map<String, IdCriterion> criteria, Map<String, Object> passthrough) {
        this.criteria = Collections.unmodifiableMap(new LinkedHashMap<>(criteria));
        this.passthrough = Collections.unmodifiableMap(new LinkedHashMap<>(passthrough));
    }

    public static CanonicalFilter empty() {
        return EMPTY;
    }

    public Optional<IdCriterion> get(String field) {
        return Optional.ofNullable(criteria.get(field));
    }

    public boolean has(String field) {
        return criteria.containsKey(field);
    }

    public CanonicalFilter with(String field, IdCriterion criterion) {
        Map<String, IdCriterion> next = new LinkedHashMap<>(criteria);
        if (criterion == null) {
            next.remove(field);
        } else {
            next.put(field, criterion);
        }
        return new CanonicalFilter(next, passthrough);
    }

    public CanonicalFilter withPassthrough(String field, Object value) {
        Map<String, Object> next = new LinkedHashMap<>(passthrough);
        if (value == null) {
            next.remove(field);
        } else {
            next.put(field, value);
        }
        return new CanonicalFilter(criteria, next);
    }

    public Map<String, IdCriterion> getCriteria() {
        return criteria;
    }

    public Map<String, Object> getPassthrough() {
        return passthrough;
    }

    public boolean isEmpty() {
        return criteria.isEmpty() && passthrough.isEmpty();
    }

    public Map<String, Object> toVariables() {
        Map<String, Object> out = new LinkedHashMap<>(passthrough);
        for (Map.Entry<String, IdCriterion> entry : criteria.entrySet()) {
            out.put(entry.getKey(), entry.getValue().toVariables(STRING_ID_FIELDS.contains(entry.getKey())));
        }
        return out;
    }
}
