package com.clipfeed.sampler.savedfilter;

import com.clipfeed.sampler.common.ReadStatus;
import java.util.List;

public class SavedFilterLookup {
    private final ReadStatus status;
    private final List<SavedFilterSummary> items;

    private SavedFilterLookup(ReadStatus status, List<SavedFilterSummary> items) {
        this.status = status;
        this.items = items == null ? List.of() : items;
    }

    public static SavedFilterLookup ok(List<SavedFilterSummary> items) {
        return new SavedFilterLookup(ReadStatus.OK, items);
    }

    public static SavedFilterLookup aborted() {
        return new SavedFilterLookup(ReadStatus.ABORTED, List.of());
    }

    public static SavedFilterLookup failed() {
        return new SavedFilterLookup(ReadStatus.FAILED, List.of());
    }

    public ReadStatus getStatus() {
        return status;
    }

    public List<SavedFilterSummary> getItems() {
        return items;
    }
}
