package com.clipfeed.sampler.autocomplete;

import com.clipfeed.sampler.common.ReadStatus;
import java.util.List;

public class SuggestionLookup {
    private final ReadStatus status;
    private final List<Suggestion> items;

    private SuggestionLookup(ReadStatus status, List<Suggestion> items) {
        this.status = status;
        this.items = items == null ? List.of() : items;
    }

    public static SuggestionLookup ok(List<Suggestion> items) {
        return new SuggestionLookup(ReadStatus.OK, items);
    }

    public static SuggestionLookup aborted() {
        return new SuggestionLookup(ReadStatus.ABORTED, List.of());
    }

    public static SuggestionLookup failed() {
        return new SuggestionLookup(ReadStatus.FAILED, List.of());
    }

    public ReadStatus getStatus() {
        return status;
    }

    public List<Suggestion> getItems() {
        return items;
    }
}
