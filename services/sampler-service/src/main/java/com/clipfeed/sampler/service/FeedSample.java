package com.clipfeed.sampler.service;

import com.clipfeed.sampler.catalog.CatalogItem;
import com.clipfeed.sampler.common.ReadStatus;
import com.clipfeed.sampler.filter.FilterSpec;
import java.util.List;

public class FeedSample {
    private final List<CatalogItem> items;
    private final long totalCount;
    private final FilterSpec nextFilterSpec;
    private final ReadStatus status;

    public FeedSample(List<CatalogItem> items, long totalCount, FilterSpec nextFilterSpec, ReadStatus status) {
        this.items = items == null ? List.of() : items;
        this.totalCount = totalCount;
        this.nextFilterSpec = nextFilterSpec;
        this.status = status;
    }

    public static FeedSample aborted(FilterSpec spec) {
        return new FeedSample(List.of(), 0L, spec, ReadStatus.ABORTED);
    }

    public List<CatalogItem> getItems() {
        return items;
    }

    public long getTotalCount() {
        return totalCount;
    }

    public FilterSpec getNextFilterSpec() {
        return nextFilterSpec;
    }

    public ReadStatus getStatus() {
        return status;
    }
}
