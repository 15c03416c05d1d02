package com.clipfeed.sampler.sampling;

import com.clipfeed.sampler.catalog.CatalogItem;
import com.clipfeed.sampler.common.ReadStatus;
import java.util.List;

public class SampleResult {
    private final ReadStatus status;
    private final List<CatalogItem> items;
    private final long totalCount;
    private final String sortSeed;
    private final int page;
    private final int unfilteredOffsetConsumed;
    private final Integer nextOffset;
    private final String errorMessage;

    private SampleResult(
        ReadStatus status,
        List<CatalogItem> items,
        long totalCount,
        String sortSeed,
        int page,
        int unfilteredOffsetConsumed,
        Integer nextOffset,
        String errorMessage
    ) {
        this.status = status;
        this.items = items == null ? List.of() : List.copyOf(items);
        this.totalCount = totalCount;
        this.sortSeed = sortSeed;
        this.page = page;
        this.unfilteredOffsetConsumed = unfilteredOffsetConsumed;
        this.nextOffset = nextOffset;
        this.errorMessage = errorMessage;
    }

    public static SampleResult ok(List<CatalogItem> items, long totalCount, String sortSeed, int page) {
        int size = items == null ? 0 : items.size();
        return new SampleResult(ReadStatus.OK, items, totalCount, sortSeed, page, size, null, null);
    }

    public static SampleResult filtered(
        List<CatalogItem> items,
        long totalCount,
        String sortSeed,
        int page,
        int unfilteredOffsetConsumed
    ) {
        return new SampleResult(ReadStatus.OK, items, totalCount, sortSeed, page, unfilteredOffsetConsumed, null, null);
    }

    public static SampleResult walked(
        List<CatalogItem> items,
        long totalCount,
        String sortSeed,
        int page,
        int unfilteredOffsetConsumed,
        int nextOffset
    ) {
        return new SampleResult(ReadStatus.OK, items, totalCount, sortSeed, page, unfilteredOffsetConsumed, nextOffset, null);
    }

    public static SampleResult empty(String sortSeed) {
        return new SampleResult(ReadStatus.OK, List.of(), 0L, sortSeed, 1, 0, null, null);
    }

    public static SampleResult aborted(String sortSeed) {
        return new SampleResult(ReadStatus.ABORTED, List.of(), 0L, sortSeed, 1, 0, null, null);
    }

    public static SampleResult failed(String sortSeed, String message) {
        return new SampleResult(ReadStatus.FAILED, List.of(), 0L, sortSeed, 1, 0, null, message);
    }

    public boolean isOk() {
        return status == ReadStatus.OK;
    }

    public ReadStatus getStatus() {
        return status;
    }

    public List<CatalogItem> getItems() {
        return items;
    }

    public long getTotalCount() {
        return totalCount;
    }

    public String getSortSeed() {
        return sortSeed;
    }

    public int getPage() {
        return page;
    }

    public int getUnfilteredOffsetConsumed() {
        return unfilteredOffsetConsumed;
    }

    /**
     * Absolute offset a window walk should resume from, or {@code null} for reads that are not
     * offset-addressed. It accounts for the page actually served, so after a page-1 retry or a
     * drained page it differs from {@code offset + unfilteredOffsetConsumed}.
     */
    public Integer getNextOffset() {
        return nextOffset;
    }

    public String getErrorMessage() {
        return errorMessage;
    }
}
