package com.clipfeed.sampler.sampling;

import com.clipfeed.sampler.catalog.CatalogItem;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public interface ItemPredicate {

    boolean test(CatalogItem item);

    default Optional<NativeCriterion> nativeCriterion() {
        return Optional.empty();
    }

    static ItemPredicate maxDuration(double maxSeconds) {
        return new ItemPredicate() {
            @Override
            public boolean test(CatalogItem item) {
                Double duration = item.getDurationSeconds();
                return duration != null && duration < maxSeconds;
            }

            @Override
            public Optional<NativeCriterion> nativeCriterion() {
                Map<String, Object> value = new LinkedHashMap<>();
                value.put("value", (int) Math.ceil(maxSeconds));
                value.put("modifier", "LESS_THAN");
                return Optional.of(new NativeCriterion("duration", value));
            }
        };
    }

    record NativeCriterion(String field, Map<String, Object> value) {
    }
}
