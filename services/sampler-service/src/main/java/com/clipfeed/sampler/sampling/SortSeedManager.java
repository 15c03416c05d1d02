package com.clipfeed.sampler.sampling;

import com.clipfeed.sampler.filter.FilterSpec;
import java.util.Random;
import org.springframework.stereotype.Component;

@Component
public class SortSeedManager {
    static final String SEED_PREFIX = "random_";
    private static final int SEED_BOUND = 100_000_000;

    private final Random random;

    public SortSeedManager(Random samplerRandom) {
        this.random = samplerRandom;
    }

    public String resolveSeed(FilterSpec spec) {
        if (spec != null && spec.getSortSeed() != null && !spec.getSortSeed().isBlank()) {
            return spec.getSortSeed();
        }
        return newSeed();
    }

    public String newSeed() {
        return SEED_PREFIX + String.format("%08d", random.nextInt(SEED_BOUND));
    }

    public static boolean isSeed(String sort) {
        return sort != null && sort.startsWith(SEED_PREFIX);
    }
}
