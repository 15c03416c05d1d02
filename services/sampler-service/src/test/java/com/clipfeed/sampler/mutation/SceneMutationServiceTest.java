package com.clipfeed.sampler.mutation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.clipfeed.sampler.catalog.CatalogClient;
import com.clipfeed.sampler.catalog.CatalogQueries;
import com.clipfeed.sampler.catalog.CatalogUnavailableException;
import com.clipfeed.sampler.catalog.GraphQlResult;
import com.clipfeed.sampler.common.InvalidRequestException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SceneMutationServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private CatalogClient catalogClient;

    private SceneMutationService service;

    @BeforeEach
    void setUp() {
        service = new SceneMutationService(catalogClient);
    }

    @Test
    @SuppressWarnings("unchecked")
    void ratingIsStoredOnTheHundredScale() {
        when(catalogClient.mutate(eq(CatalogQueries.SCENE_UPDATE), anyMap(), any())).thenReturn(GraphQlResult.of(null));

        int stored = service.updateRating(17L, 7.5);

        ArgumentCaptor<Map<String, Object>> variables = ArgumentCaptor.forClass(Map.class);
        verify(catalogClient).mutate(eq(CatalogQueries.SCENE_UPDATE), variables.capture(), any());
        Map<String, Object> input = (Map<String, Object>) variables.getValue().get("input");
        assertThat(input).containsEntry("id", "17").containsEntry("rating100", 75);
        assertThat(stored).isEqualTo(75);
    }

    @Test
    void invalidArgumentsAreRejectedBeforeAnyCall() {
        assertThatThrownBy(() -> service.updateRating(1L, 11)).isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> service.updateRating(1L, Double.NaN)).isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> service.updateRating(0L, 5)).isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> service.addTag(3L, -2L)).isInstanceOf(InvalidRequestException.class);
        verifyNoInteractions(catalogClient);
    }

    @Test
    @SuppressWarnings("unchecked")
    void addTagAppendsToTheCurrentTags() throws Exception {
        when(catalogClient.query(eq(CatalogQueries.FIND_SCENE_TAG_IDS), anyMap(), any())).thenReturn(sceneWithTags("1", "2"));
        when(catalogClient.mutate(eq(CatalogQueries.SCENE_UPDATE), anyMap(), any())).thenReturn(GraphQlResult.of(null));

        List<Long> tags = service.addTag(9L, 5L);

        ArgumentCaptor<Map<String, Object>> variables = ArgumentCaptor.forClass(Map.class);
        verify(catalogClient).mutate(eq(CatalogQueries.SCENE_UPDATE), variables.capture(), any());
        Map<String, Object> input = (Map<String, Object>) variables.getValue().get("input");
        assertThat(input.get("tag_ids")).isEqualTo(List.of("1", "2", "5"));
        assertThat(tags).containsExactly(1L, 2L, 5L);
    }

    @Test
    void addingAnExistingTagWritesNothing() throws Exception {
        when(catalogClient.query(eq(CatalogQueries.FIND_SCENE_TAG_IDS), anyMap(), any())).thenReturn(sceneWithTags("1", "5"));

        List<Long> tags = service.addTag(9L, 5L);

        assertThat(tags).containsExactly(1L, 5L);
        verify(catalogClient, never()).mutate(any(), anyMap(), any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void removeTagDropsOnlyThatTag() throws Exception {
        when(catalogClient.query(eq(CatalogQueries.FIND_SCENE_TAG_IDS), anyMap(), any())).thenReturn(sceneWithTags("1", "5", "8"));
        when(catalogClient.mutate(eq(CatalogQueries.SCENE_UPDATE), anyMap(), any())).thenReturn(GraphQlResult.of(null));

        List<Long> tags = service.removeTag(9L, 5L);

        ArgumentCaptor<Map<String, Object>> variables = ArgumentCaptor.forClass(Map.class);
        verify(catalogClient).mutate(eq(CatalogQueries.SCENE_UPDATE), variables.capture(), any());
        Map<String, Object> input = (Map<String, Object>) variables.getValue().get("input");
        assertThat(input.get("tag_ids")).isEqualTo(List.of("1", "8"));
        assertThat(tags).containsExactly(1L, 8L);
    }

    @Test
    void catalogFailuresPropagate() {
        when(catalogClient.mutate(eq(CatalogQueries.SCENE_UPDATE), anyMap(), any()))
            .thenThrow(new CatalogUnavailableException("down", null));

        assertThatThrownBy(() -> service.updateRating(3L, 4)).isInstanceOf(CatalogUnavailableException.class);
    }

    private GraphQlResult sceneWithTags(String... ids) throws Exception {
        StringBuilder tags = new StringBuilder();
        for (String id : ids) {
            if (tags.length() > 0) {
                tags.append(',');
            }
            tags.append("{\"id\":\"").append(id).append("\"}");
        }
        return GraphQlResult.of(objectMapper.readTree("{\"findScene\":{\"id\":\"9\",\"tags\":[" + tags + "]}}"));
    }
}
