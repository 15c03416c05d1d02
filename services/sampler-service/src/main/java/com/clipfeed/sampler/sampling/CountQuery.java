package com.clipfeed.sampler.sampling;

import com.clipfeed.sampler.catalog.CatalogTarget;
import java.util.Map;

public final class CountQuery {
    private final CatalogTarget target;
    private final Map<String, Object> objectFilter;
    private final String searchTerm;

    public CountQuery(CatalogTarget target, Map<String, Object> objectFilter, String searchTerm) {
        this.target = target;
        this.objectFilter = objectFilter == null ? Map.of() : objectFilter;
        this.searchTerm = searchTerm;
    }

    public CatalogTarget getTarget() {
        return target;
    }

    public Map<String, Object> getObjectFilter() {
        return objectFilter;
    }

    public String getSearchTerm() {
        return searchTerm;
    }
}
