package com.clipfeed.sampler.sampling;

import com.clipfeed.sampler.catalog.CatalogAbortedException;
import com.clipfeed.sampler.catalog.CatalogException;
import com.clipfeed.sampler.common.CancellationToken;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Picks a uniformly random page over the current count. Each page is equally likely, so items on
 * a short last page are slightly over-represented.
 */
@Component
public class RandomPageSampler {
    private static final Logger logger = LoggerFactory.getLogger(RandomPageSampler.class);

    private final QueryExecutor queryExecutor;
    private final Random random;

    public RandomPageSampler(QueryExecutor queryExecutor, Random samplerRandom) {
        this.queryExecutor = queryExecutor;
        this.random = samplerRandom;
    }

    public int pickPage(CountQuery countQuery, int pageSize, CancellationToken token) {
        if (CancellationToken.isAborted(token)) {
            return 1;
        }
        long totalCount;
        try {
            totalCount = queryExecutor.count(countQuery, token);
        } catch (CatalogAbortedException e) {
            return 1;
        } catch (CatalogException e) {
            logger.warn("{} failed: {}", "pickPage", e.getMessage());
            return 1;
        }
        return pageFor(totalCount, pageSize);
    }

    public int pageFor(long totalCount, int pageSize) {
        int totalPages = totalPages(totalCount, pageSize);
        if (totalPages <= 1) {
            return 1;
        }
        return random.nextInt(totalPages) + 1;
    }

    public static int totalPages(long totalCount, int pageSize) {
        if (totalCount <= 0) {
            return 0;
        }
        long size = Math.max(1, pageSize);
        long pages = (totalCount + size - 1) / size;
        return (int) Math.min(Integer.MAX_VALUE, pages);
    }
}
