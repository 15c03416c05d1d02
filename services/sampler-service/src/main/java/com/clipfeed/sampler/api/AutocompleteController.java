package com.clipfeed.sampler.api;

import com.clipfeed.sampler.api.dto.AutocompleteResponse;
import com.clipfeed.sampler.api.dto.ErrorResponse;
import com.clipfeed.sampler.autocomplete.AutocompleteService;
import com.clipfeed.sampler.autocomplete.Suggestion;
import com.clipfeed.sampler.autocomplete.SuggestionKind;
import com.clipfeed.sampler.autocomplete.SuggestionLookup;
import com.clipfeed.sampler.common.CancellationToken;
import com.clipfeed.sampler.common.InvalidRequestException;
import com.clipfeed.sampler.common.ReadStatus;
import java.util.ArrayList;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AutocompleteController {
    static final int DEFAULT_SIZE = 10;
    static final int MAX_SIZE = 50;

    private final AutocompleteService autocompleteService;

    public AutocompleteController(AutocompleteService autocompleteService) {
        this.autocompleteService = autocompleteService;
    }

    @GetMapping("/v1/autocomplete/{kind}")
    public ResponseEntity<?> autocomplete(
        @PathVariable("kind") String kind,
        @RequestParam(value = "q", required = false) String query,
        @RequestParam(value = "size", required = false) Integer size,
        @RequestHeader(value = RequestIds.TRACE_HEADER, required = false) String traceHeader,
        @RequestHeader(value = RequestIds.REQUEST_HEADER, required = false) String requestHeader
    ) {
        RequestIds ids = RequestIds.of(traceHeader, requestHeader);
        SuggestionKind suggestionKind = SuggestionKind.fromValue(kind);
        if (suggestionKind == null) {
            throw new InvalidRequestException("unknown autocomplete kind: " + kind);
        }
        int resolvedSize = size == null ? DEFAULT_SIZE : size;
        if (resolvedSize < 1 || resolvedSize > MAX_SIZE) {
            throw new InvalidRequestException("size must be between 1 and " + MAX_SIZE);
        }

        SuggestionLookup lookup = autocompleteService.search(suggestionKind, query, resolvedSize, CancellationToken.create());
        if (lookup.getStatus() == ReadStatus.FAILED) {
            ErrorResponse error = new ErrorResponse(
                "catalog_unavailable",
                "Suggestions could not be loaded",
                ids.getTraceId(),
                ids.getRequestId()
            );
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).headers(ids.toHeaders()).body(error);
        }

        List<AutocompleteResponse.Suggestion> items = new ArrayList<>();
        for (Suggestion suggestion : lookup.getItems()) {
            AutocompleteResponse.Suggestion dto = new AutocompleteResponse.Suggestion();
            dto.setId(suggestion.getId());
            dto.setName(suggestion.getName());
            dto.setImagePath(suggestion.getImagePath());
            items.add(dto);
        }
        AutocompleteResponse response = new AutocompleteResponse();
        response.setKind(suggestionKind.getKey());
        response.setItems(items);
        response.setTraceId(ids.getTraceId());
        response.setRequestId(ids.getRequestId());
        return ResponseEntity.ok().headers(ids.toHeaders()).body(response);
    }
}
