package com.clipfeed.sampler.api;

import com.clipfeed.sampler.api.dto.RatingRequest;
import com.clipfeed.sampler.api.dto.SceneUpdateResponse;
import com.clipfeed.sampler.common.InvalidRequestException;
import com.clipfeed.sampler.mutation.SceneMutationService;
import java.util.ArrayList;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SceneController {
    private final SceneMutationService sceneMutationService;

    public SceneController(SceneMutationService sceneMutationService) {
        this.sceneMutationService = sceneMutationService;
    }

    @PostMapping("/v1/scenes/{sceneId}/rating")
    public ResponseEntity<SceneUpdateResponse> rate(
        @PathVariable("sceneId") long sceneId,
        @RequestBody(required = false) RatingRequest request,
        @RequestHeader(value = RequestIds.TRACE_HEADER, required = false) String traceHeader,
        @RequestHeader(value = RequestIds.REQUEST_HEADER, required = false) String requestHeader
    ) {
        if (request == null || request.getRating() == null) {
            throw new InvalidRequestException("rating is required");
        }
        int rating100 = sceneMutationService.updateRating(sceneId, request.getRating());
        SceneUpdateResponse response = new SceneUpdateResponse();
        response.setSceneId(String.valueOf(sceneId));
        response.setRating100(rating100);
        return ResponseEntity.ok().headers(RequestIds.of(traceHeader, requestHeader).toHeaders()).body(response);
    }

    @PostMapping("/v1/scenes/{sceneId}/tags/{tagId}")
    public ResponseEntity<SceneUpdateResponse> addTag(
        @PathVariable("sceneId") long sceneId,
        @PathVariable("tagId") long tagId,
        @RequestHeader(value = RequestIds.TRACE_HEADER, required = false) String traceHeader,
        @RequestHeader(value = RequestIds.REQUEST_HEADER, required = false) String requestHeader
    ) {
        List<Long> tagIds = sceneMutationService.addTag(sceneId, tagId);
        return ResponseEntity.ok()
            .headers(RequestIds.of(traceHeader, requestHeader).toHeaders())
            .body(tagsResponse(sceneId, tagIds));
    }

    @DeleteMapping("/v1/scenes/{sceneId}/tags/{tagId}")
    public ResponseEntity<SceneUpdateResponse> removeTag(
        @PathVariable("sceneId") long sceneId,
        @PathVariable("tagId") long tagId,
        @RequestHeader(value = RequestIds.TRACE_HEADER, required = false) String traceHeader,
        @RequestHeader(value = RequestIds.REQUEST_HEADER, required = false) String requestHeader
    ) {
        List<Long> tagIds = sceneMutationService.removeTag(sceneId, tagId);
        return ResponseEntity.ok()
            .headers(RequestIds.of(traceHeader, requestHeader).toHeaders())
            .body(tagsResponse(sceneId, tagIds));
    }

    private SceneUpdateResponse tagsResponse(long sceneId, List<Long> tagIds) {
        List<String> values = new ArrayList<>(tagIds.size());
        for (Long id : tagIds) {
            values.add(String.valueOf(id));
        }
        SceneUpdateResponse response = new SceneUpdateResponse();
        response.setSceneId(String.valueOf(sceneId));
        response.setTagIds(values);
        return response;
    }
}
