package com.clipfeed.sampler.filter;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ObjectFilterBuilderTest {

    private final ObjectFilterBuilder builder = new ObjectFilterBuilder();

    @Test
    void singleTagMustMatchAllAndMarkerTagsDoNotDescend() {
        FilterSpec spec = FilterSpec.builder().tagIds(List.of(5L)).performerIds(List.of(8L, 9L)).build();

        Map<String, Object> variables = builder.markerFilter(spec, null).toVariables();

        assertThat(variables.get("tags")).isEqualTo(Map.of("value", List.of("5"), "modifier", "INCLUDES_ALL", "depth", 0));
        assertThat(variables.get("performers")).isEqualTo(Map.of("value", List.of(8L, 9L), "modifier", "INCLUDES"));
    }

    @Test
    void savedFilterCriteriaWinOverAdHocSelections() {
        CanonicalFilter saved = CanonicalFilter.empty().with(CanonicalFilter.TAGS, IdCriterion.includes(List.of(40L)));
        FilterSpec spec = FilterSpec.builder()
            .savedFilterId("3")
            .tagIds(List.of(5L))
            .performerIds(List.of(8L))
            .studioIds(List.of(2L))
            .build();

        CanonicalFilter filter = builder.markerFilter(spec, saved);

        assertThat(filter.get(CanonicalFilter.TAGS).orElseThrow().getIds()).containsExactly(40L);
        assertThat(filter.has(CanonicalFilter.PERFORMERS)).isFalse();
        assertThat(filter.get(CanonicalFilter.STUDIOS).orElseThrow().getIds()).containsExactly(2L);
    }

    @Test
    void excludedTagsWithoutSelectionBecomeAnExcludesCriterion() {
        FilterSpec spec = FilterSpec.builder().excludedTagIds(List.of(11L)).build();

        IdCriterion tags = builder.shuffleSceneFilter(spec).get(CanonicalFilter.TAGS).orElseThrow();

        assertThat(tags.getModifier()).isEqualTo(CriterionModifier.EXCLUDES);
        assertThat(tags.getIds()).containsExactly(11L);
    }

    @Test
    void shortFormRequiresAFile() {
        Map<String, Object> variables = builder.shortFormSceneFilter(FilterSpec.builder().build()).toVariables();

        assertThat(variables.get("file_count")).isEqualTo(Map.of("value", 0, "modifier", "GREATER_THAN"));
    }
}
