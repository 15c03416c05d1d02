package com.clipfeed.sampler.api;

import com.clipfeed.sampler.api.dto.ErrorResponse;
import com.clipfeed.sampler.api.dto.FeedSampleRequest;
import com.clipfeed.sampler.api.dto.FeedSampleResponse;
import com.clipfeed.sampler.catalog.CatalogItem;
import com.clipfeed.sampler.common.CancellationToken;
import com.clipfeed.sampler.common.InvalidRequestException;
import com.clipfeed.sampler.common.ReadStatus;
import com.clipfeed.sampler.filter.FilterNormalizer;
import com.clipfeed.sampler.filter.FilterSpec;
import com.clipfeed.sampler.service.FeedSample;
import com.clipfeed.sampler.service.FeedSamplingService;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class FeedController {
    static final int MAX_LIMIT = 100;

    private final FeedSamplingService feedSamplingService;
    private final FilterNormalizer filterNormalizer;

    public FeedController(FeedSamplingService feedSamplingService, FilterNormalizer filterNormalizer) {
        this.feedSamplingService = feedSamplingService;
        this.filterNormalizer = filterNormalizer;
    }

    @PostMapping("/v1/feed/sample")
    public ResponseEntity<?> sample(
        @RequestBody(required = false) FeedSampleRequest request,
        @RequestHeader(value = RequestIds.TRACE_HEADER, required = false) String traceHeader,
        @RequestHeader(value = RequestIds.REQUEST_HEADER, required = false) String requestHeader
    ) {
        RequestIds ids = RequestIds.of(traceHeader, requestHeader);
        FilterSpec spec = toSpec(request == null ? new FeedSampleRequest() : request);

        FeedSample sample = feedSamplingService.fetchSample(spec, CancellationToken.create());
        if (sample.getStatus() == ReadStatus.FAILED) {
            ErrorResponse error = new ErrorResponse(
                "catalog_unavailable",
                "Catalog could not be read",
                ids.getTraceId(),
                ids.getRequestId()
            );
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).headers(ids.toHeaders()).body(error);
        }
        return ResponseEntity.ok().headers(ids.toHeaders()).body(toResponse(sample, ids));
    }

    FilterSpec toSpec(FeedSampleRequest request) {
        Integer limit = request.getLimit();
        if (limit != null && (limit < 1 || limit > MAX_LIMIT)) {
            throw new InvalidRequestException("limit must be between 1 and " + MAX_LIMIT);
        }
        if (request.getOffset() != null && request.getOffset() < 0) {
            throw new InvalidRequestException("offset must not be negative");
        }
        Double maxDuration = request.getMaxDurationSeconds();
        if (maxDuration != null && (maxDuration.isNaN() || maxDuration <= 0)) {
            throw new InvalidRequestException("max_duration_seconds must be positive");
        }
        return FilterSpec.builder()
            .query(request.getQuery())
            .tagIds(filterNormalizer.normalizeIds(request.getTagIds()))
            .excludedTagIds(filterNormalizer.normalizeIds(request.getExcludedTagIds()))
            .performerIds(filterNormalizer.normalizeIds(request.getPerformerIds()))
            .studioIds(filterNormalizer.normalizeIds(request.getStudioIds()))
            .savedFilterId(request.getSavedFilterId())
            .shuffleMode(Boolean.TRUE.equals(request.getShuffleMode()))
            .includeScenesWithoutMarkers(Boolean.TRUE.equals(request.getIncludeScenesWithoutMarkers()))
            .offset(request.getOffset())
            .limit(limit == null ? FilterSpec.DEFAULT_LIMIT : limit)
            .sortSeed(request.getSortSeed())
            .maxDurationSeconds(maxDuration)
            .build();
    }

    private FeedSampleResponse toResponse(FeedSample sample, RequestIds ids) {
        List<FeedSampleResponse.Item> items = new ArrayList<>();
        for (CatalogItem item : sample.getItems()) {
            FeedSampleResponse.Item dto = new FeedSampleResponse.Item();
            dto.setId(item.getId());
            dto.setSceneId(item.getSceneId());
            dto.setTitle(item.getTitle());
            dto.setStartSeconds(item.getStartSeconds());
            dto.setDurationSeconds(item.getDurationSeconds());
            dto.setSource(item.getSource());
            items.add(dto);
        }
        FeedSampleResponse response = new FeedSampleResponse();
        response.setItems(items);
        response.setTotalCount(sample.getTotalCount());
        response.setNext(toRequest(sample.getNextFilterSpec()));
        response.setStatus(sample.getStatus().name().toLowerCase(Locale.ROOT));
        response.setTraceId(ids.getTraceId());
        response.setRequestId(ids.getRequestId());
        return response;
    }

    private FeedSampleRequest toRequest(FilterSpec spec) {
        FeedSampleRequest next = new FeedSampleRequest();
        next.setQuery(spec.getQuery());
        next.setTagIds(asStrings(spec.getTagIds()));
        next.setExcludedTagIds(asStrings(spec.getExcludedTagIds()));
        next.setPerformerIds(asStrings(spec.getPerformerIds()));
        next.setStudioIds(asStrings(spec.getStudioIds()));
        next.setSavedFilterId(spec.getSavedFilterId());
        next.setShuffleMode(spec.isShuffleMode() ? Boolean.TRUE : null);
        next.setIncludeScenesWithoutMarkers(spec.isIncludeScenesWithoutMarkers() ? Boolean.TRUE : null);
        next.setOffset(spec.getOffset());
        next.setLimit(spec.getLimit());
        next.setSortSeed(spec.getSortSeed());
        next.setMaxDurationSeconds(spec.getMaxDurationSeconds());
        return next;
    }

    private static List<String> asStrings(List<Long> ids) {
        List<String> out = new ArrayList<>(ids.size());
        for (Long id : ids) {
            out.add(String.valueOf(id));
        }
        return out;
    }
}
