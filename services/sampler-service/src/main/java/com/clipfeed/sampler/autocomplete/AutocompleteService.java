package com.clipfeed.sampler.autocomplete;

import com.clipfeed.sampler.autocomplete.cache.AutocompleteCache;
import com.clipfeed.sampler.catalog.CatalogAbortedException;
import com.clipfeed.sampler.catalog.CatalogClient;
import com.clipfeed.sampler.catalog.CatalogException;
import com.clipfeed.sampler.catalog.GraphQlResult;
import com.clipfeed.sampler.common.CancellationToken;
import com.clipfeed.sampler.sampling.SortSeedManager;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class AutocompleteService {
    private static final Logger logger = LoggerFactory.getLogger(AutocompleteService.class);
    static final int MIN_SUGGESTION_FETCH = 20;
    static final int TERM_FETCH_MULTIPLIER = 3;

    private final CatalogClient catalogClient;
    private final AutocompleteCache cache;
    private final SortSeedManager sortSeedManager;

    public AutocompleteService(CatalogClient catalogClient, AutocompleteCache cache, SortSeedManager sortSeedManager) {
        this.catalogClient = catalogClient;
        this.cache = cache;
        this.sortSeedManager = sortSeedManager;
    }

    // a term-less lookup is a random draw of popular entries and is never cached
    public SuggestionLookup search(SuggestionKind kind, String term, int limit, CancellationToken token) {
        if (CancellationToken.isAborted(token)) {
            return SuggestionLookup.aborted();
        }
        int safeLimit = Math.max(1, limit);
        try {
            List<Suggestion> items = cache.getOrFetch(kind.getKey(), term, safeLimit, () -> fetch(kind, term, safeLimit, token));
            if (CancellationToken.isAborted(token)) {
                return SuggestionLookup.aborted();
            }
            return SuggestionLookup.ok(items);
        } catch (CatalogAbortedException e) {
            return SuggestionLookup.aborted();
        } catch (CatalogException e) {
            logger.warn("{} failed: {}", "search" + kind.name(), e.getMessage());
            return SuggestionLookup.failed();
        }
    }

    private List<Suggestion> fetch(SuggestionKind kind, String term, int limit, CancellationToken token) {
        boolean hasTerm = term != null && !term.isBlank();
        Map<String, Object> findFilter = new LinkedHashMap<>();
        findFilter.put("per_page", hasTerm ? limit * TERM_FETCH_MULTIPLIER : Math.max(limit, MIN_SUGGESTION_FETCH));
        findFilter.put("page", 1);
        if (hasTerm) {
            findFilter.put("q", term.trim());
        } else {
            findFilter.put("sort", sortSeedManager.newSeed());
        }
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("filter", findFilter);
        variables.put(kind.getFilterVariable(), kind.filterFor(hasTerm));

        GraphQlResult result = catalogClient.query(kind.getDocument(), variables, token);
        List<Suggestion> suggestions = new ArrayList<>();
        for (JsonNode node : result.getData().path(kind.getRootField()).path(kind.getItemsField())) {
            Suggestion suggestion = Suggestion.fromNode(node);
            if (suggestion != null) {
                suggestions.add(suggestion);
            }
            if (suggestions.size() >= limit) {
                break;
            }
        }
        return suggestions;
    }
}
