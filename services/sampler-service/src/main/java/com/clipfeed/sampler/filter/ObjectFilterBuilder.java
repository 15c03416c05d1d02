package com.clipfeed.sampler.filter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class ObjectFilterBuilder {

    /**
     * Marker feed filter. A saved filter's own object filter is the base and, when present, its
     * criteria replace the ad-hoc tag and performer selections. Studios always apply.
     */
    public CanonicalFilter markerFilter(FilterSpec spec, CanonicalFilter savedObjectFilter) {
        CanonicalFilter filter = savedObjectFilter == null ? CanonicalFilter.empty() : savedObjectFilter;
        if (savedObjectFilter == null) {
            filter = applyTags(filter, spec, 0);
            filter = applyPerformers(filter, spec);
        }
        return applyStudios(filter, spec);
    }

    public CanonicalFilter shuffleSceneFilter(FilterSpec spec) {
        CanonicalFilter filter = CanonicalFilter.empty();
        if (spec.isIncludeScenesWithoutMarkers()) {
            filter = filter.withPassthrough("has_markers", "false");
        }
        filter = applyTags(filter, spec, null);
        filter = applyPerformers(filter, spec);
        return applyStudios(filter, spec);
    }

    public CanonicalFilter shortFormSceneFilter(FilterSpec spec) {
        Map<String, Object> fileCount = new LinkedHashMap<>();
        fileCount.put("value", 0);
        fileCount.put("modifier", "GREATER_THAN");
        CanonicalFilter filter = CanonicalFilter.empty().withPassthrough("file_count", fileCount);
        filter = applyTags(filter, spec, null);
        filter = applyPerformers(filter, spec);
        return applyStudios(filter, spec);
    }

    private CanonicalFilter applyTags(CanonicalFilter filter, FilterSpec spec, Integer depth) {
        List<Long> tagIds = spec.getTagIds();
        List<Long> excluded = spec.getExcludedTagIds();
        if (!tagIds.isEmpty()) {
            return filter.with(CanonicalFilter.TAGS, IdCriterion.forSelection(tagIds).withExcludes(excluded).withDepth(depth));
        }
        if (!excluded.isEmpty()) {
            return filter.with(CanonicalFilter.TAGS, new IdCriterion(excluded, CriterionModifier.EXCLUDES, List.of(), depth));
        }
        return filter;
    }

    private CanonicalFilter applyPerformers(CanonicalFilter filter, FilterSpec spec) {
        if (spec.getPerformerIds().isEmpty()) {
            return filter;
        }
        return filter.with(CanonicalFilter.PERFORMERS, IdCriterion.forSelection(spec.getPerformerIds()));
    }

    private CanonicalFilter applyStudios(CanonicalFilter filter, FilterSpec spec) {
        if (spec.getStudioIds().isEmpty()) {
            return filter;
        }
        return filter.with(CanonicalFilter.STUDIOS, IdCriterion.includes(spec.getStudioIds()));
    }
}
