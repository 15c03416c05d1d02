package com.clipfeed.sampler.filter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class IdCriterion {
    private final List<Long> ids;
    private final CriterionModifier modifier;
    private final List<Long> excludes;
    private final Integer depth;

    public IdCriterion(List<Long> ids, CriterionModifier modifier, List<Long> excludes, Integer depth) {
        this.modifier = modifier == null ? CriterionModifier.INCLUDES : modifier;
        if ((ids == null || ids.isEmpty()) && this.modifier.requiresIds()) {
            throw new IllegalArgumentException("criterion requires at least one id");
        }
        this.ids = ids == null ? List.of() : List.copyOf(ids);
        this.excludes = excludes == null ? List.of() : List.copyOf(excludes);
        this.depth = depth;
    }

    public static IdCriterion includes(List<Long> ids) {
        return new IdCriterion(ids, CriterionModifier.INCLUDES, List.of(), null);
    }

    // ad-hoc id lists: a single id must match, several ids match any
    public static IdCriterion forSelection(List<Long> ids) {
        CriterionModifier modifier = ids.size() == 1 ? CriterionModifier.INCLUDES_ALL : CriterionModifier.INCLUDES;
        return new IdCriterion(ids, modifier, List.of(), null);
    }

    public IdCriterion withExcludes(List<Long> additional) {
        if (additional == null || additional.isEmpty()) {
            return this;
        }
        List<Long> merged = new ArrayList<>(excludes);
        for (Long id : additional) {
            if (id != null && !merged.contains(id)) {
                merged.add(id);
            }
        }
        return new IdCriterion(ids, modifier, merged, depth);
    }

    public IdCriterion withDepth(Integer newDepth) {
        return new IdCriterion(ids, modifier, excludes, newDepth);
    }

    public Map<String, Object> toVariables(boolean idsAsStrings) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("value", idsAsStrings ? asStrings(ids) : ids);
        out.put("modifier", modifier.name());
        if (!excludes.isEmpty()) {
            out.put("excludes", idsAsStrings ? asStrings(excludes) : excludes);
        }
        if (depth != null) {
            out.put("depth", depth);
        }
        return out;
    }

    private static List<String> asStrings(List<Long> values) {
        List<String> out = new ArrayList<>(values.size());
        for (Long value : values) {
            out.add(String.valueOf(value));
        }
        return out;
    }

    public List<Long> getIds() {
        return ids;
    }

    public CriterionModifier getModifier() {
        return modifier;
    }

    public List<Long> getExcludes() {
        return excludes;
    }

    public Integer getDepth() {
        return depth;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IdCriterion)) {
            return false;
        }
        IdCriterion other = (IdCriterion) o;
        return ids.equals(other.ids)
            && modifier == other.modifier
            && excludes.equals(other.excludes)
            && Objects.equals(depth, other.depth);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ids, modifier, excludes, depth);
    }

    @Override
    public String toString() {
        return "IdCriterion{ids=" + ids + ", modifier=" + modifier + ", excludes=" + excludes + ", depth=" + depth + "}";
    }
}
