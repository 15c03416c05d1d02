package com.clipfeed.sampler.api;

import com.clipfeed.sampler.api.dto.ErrorResponse;
import com.clipfeed.sampler.api.dto.SavedFiltersResponse;
import com.clipfeed.sampler.common.CancellationToken;
import com.clipfeed.sampler.common.InvalidRequestException;
import com.clipfeed.sampler.common.ReadStatus;
import com.clipfeed.sampler.savedfilter.SavedFilterLookup;
import com.clipfeed.sampler.savedfilter.SavedFilterMode;
import com.clipfeed.sampler.savedfilter.SavedFilterService;
import com.clipfeed.sampler.savedfilter.SavedFilterSummary;
import java.util.ArrayList;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SavedFilterController {
    private final SavedFilterService savedFilterService;

    public SavedFilterController(SavedFilterService savedFilterService) {
        this.savedFilterService = savedFilterService;
    }

    @GetMapping("/v1/saved-filters")
    public ResponseEntity<?> list(
        @RequestParam(value = "mode", required = false) String mode,
        @RequestHeader(value = RequestIds.TRACE_HEADER, required = false) String traceHeader,
        @RequestHeader(value = RequestIds.REQUEST_HEADER, required = false) String requestHeader
    ) {
        RequestIds ids = RequestIds.of(traceHeader, requestHeader);
        SavedFilterMode resolved = SavedFilterMode.SCENE_MARKERS;
        if (mode != null && !mode.isBlank()) {
            resolved = SavedFilterMode.fromValue(mode);
            if (resolved == null) {
                throw new InvalidRequestException("unknown saved filter mode: " + mode);
            }
        }

        SavedFilterLookup lookup = savedFilterService.findSavedFilters(resolved, CancellationToken.create());
        if (lookup.getStatus() == ReadStatus.FAILED) {
            ErrorResponse error = new ErrorResponse(
                "catalog_unavailable",
                "Saved filters could not be loaded",
                ids.getTraceId(),
                ids.getRequestId()
            );
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).headers(ids.toHeaders()).body(error);
        }

        List<SavedFiltersResponse.SavedFilter> items = new ArrayList<>();
        for (SavedFilterSummary summary : lookup.getItems()) {
            SavedFiltersResponse.SavedFilter dto = new SavedFiltersResponse.SavedFilter();
            dto.setId(summary.getId());
            dto.setName(summary.getName());
            dto.setMode(summary.getMode());
            items.add(dto);
        }
        SavedFiltersResponse response = new SavedFiltersResponse();
        response.setMode(resolved.name());
        response.setItems(items);
        response.setTraceId(ids.getTraceId());
        response.setRequestId(ids.getRequestId());
        return ResponseEntity.ok().headers(ids.toHeaders()).body(response);
    }
}
