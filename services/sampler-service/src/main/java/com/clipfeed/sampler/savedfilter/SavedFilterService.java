package com.clipfeed.sampler.savedfilter;

import com.clipfeed.sampler.catalog.CatalogAbortedException;
import com.clipfeed.sampler.catalog.CatalogClient;
import com.clipfeed.sampler.catalog.CatalogException;
import com.clipfeed.sampler.catalog.CatalogQueries;
import com.clipfeed.sampler.catalog.GraphQlResult;
import com.clipfeed.sampler.common.CancellationToken;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SavedFilterService {
    private static final Logger logger = LoggerFactory.getLogger(SavedFilterService.class);

    private final CatalogClient catalogClient;

    public SavedFilterService(CatalogClient catalogClient) {
        this.catalogClient = catalogClient;
    }

    public SavedFilterLookup findSavedFilters(SavedFilterMode mode, CancellationToken token) {
        if (CancellationToken.isAborted(token)) {
            return SavedFilterLookup.aborted();
        }
        SavedFilterMode resolved = mode == null ? SavedFilterMode.SCENE_MARKERS : mode;
        try {
            GraphQlResult result = catalogClient.query(CatalogQueries.FIND_SAVED_FILTERS, Map.of("mode", resolved.name()), token);
            if (CancellationToken.isAborted(token)) {
                return SavedFilterLookup.aborted();
            }
            List<SavedFilterSummary> items = new ArrayList<>();
            for (JsonNode node : result.getData().path("findSavedFilters")) {
                SavedFilterSummary summary = SavedFilterSummary.fromNode(node);
                if (summary != null) {
                    items.add(summary);
                }
            }
            return SavedFilterLookup.ok(items);
        } catch (CatalogAbortedException e) {
            return SavedFilterLookup.aborted();
        } catch (CatalogException e) {
            logger.warn("{} failed: {}", "findSavedFilters", e.getMessage());
            return SavedFilterLookup.failed();
        }
    }
}
