package com.clipfeed.sampler.sampling;

import com.clipfeed.sampler.catalog.CatalogAbortedException;
import com.clipfeed.sampler.catalog.CatalogException;
import com.clipfeed.sampler.catalog.CatalogItem;
import com.clipfeed.sampler.catalog.CatalogTarget;
import com.clipfeed.sampler.common.CancellationToken;
import com.clipfeed.sampler.config.SamplerProperties;
import io.micrometer.core.instrument.Metrics;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fetches scenes that must be narrowed by an {@link ItemPredicate} the catalog query does not
 * express on its own.
 */
@Component
public class MultiPageDeduplicatingFetcher {
    private static final Logger logger = LoggerFactory.getLogger(MultiPageDeduplicatingFetcher.class);
    private static final CatalogTarget TARGET = CatalogTarget.SCENES;

    private final QueryExecutor queryExecutor;
    private final RandomPageSampler randomPageSampler;
    private final ExecutorService executor;
    private final Random random;
    private final SamplerProperties properties;

    public MultiPageDeduplicatingFetcher(
        QueryExecutor queryExecutor,
        RandomPageSampler randomPageSampler,
        ExecutorService samplerExecutor,
        Random samplerRandom,
        SamplerProperties properties
    ) {
        this.queryExecutor = queryExecutor;
        this.randomPageSampler = randomPageSampler;
        this.executor = samplerExecutor;
        this.random = samplerRandom;
        this.properties = properties;
    }

    public SampleResult sampleFiltered(
        ItemPredicate predicate,
        int limit,
        Integer offset,
        String seed,
        Map<String, Object> objectFilter,
        CancellationToken token
    ) {
        return sampleFiltered(predicate, limit, offset, seed, objectFilter, null, token);
    }

    /**
     * Reads one fixed window page and walks it from the in-page offset, keeping the first
     * {@code limit} items the predicate accepts. A {@code null} offset starts at a random window
     * chosen from the same filtered count the page is read with. {@code unfilteredOffsetConsumed}
     * counts every inspected item and {@link SampleResult#getNextOffset()} is where the next walk
     * starts; an offset at or past the count is an exhausted walk and reads nothing.
     */
    public SampleResult sampleFiltered(
        ItemPredicate predicate,
        int limit,
        Integer offset,
        String seed,
        Map<String, Object> objectFilter,
        String searchTerm,
        CancellationToken token
    ) {
        if (CancellationToken.isAborted(token)) {
            return SampleResult.aborted(seed);
        }
        int window = windowSize(limit);
        Map<String, Object> filter = withNativeCriterion(predicate, objectFilter);

        long totalCount;
        try {
            totalCount = queryExecutor.count(new CountQuery(TARGET, filter, searchTerm), token);
        } catch (CatalogAbortedException e) {
            return SampleResult.aborted(seed);
        } catch (CatalogException e) {
            logger.warn("{} failed: {}", "sampleFiltered", e.getMessage());
            return SampleResult.failed(seed, e.getMessage());
        }
        if (CancellationToken.isAborted(token)) {
            return SampleResult.aborted(seed);
        }

        int startOffset = offset == null
            ? (randomPageSampler.pageFor(totalCount, window) - 1) * window
            : Math.max(0, offset);
        if (startOffset >= totalCount) {
            int lastPage = Math.max(1, RandomPageSampler.totalPages(totalCount, window));
            return SampleResult.walked(List.of(), totalCount, seed, lastPage, 0, startOffset);
        }

        int page = startOffset / window + 1;
        SampleResult pageResult = queryExecutor.execute(new PageRequest(page, window, seed, searchTerm), TARGET, filter, token);
        if (!pageResult.isOk()) {
            return pageResult;
        }
        int servedPage = pageResult.getPage();
        // a page-1 retry restarts the walk at the top of page 1
        int start = servedPage == page ? startOffset % window : 0;
        List<CatalogItem> pageItems = pageResult.getItems();
        List<CatalogItem> selected = new ArrayList<>();
        int inspected = 0;
        for (int i = start; i < pageItems.size() && selected.size() < limit; i++) {
            inspected++;
            CatalogItem item = pageItems.get(i);
            if (predicate.test(item)) {
                selected.add(item);
            }
        }
        int pageStart = (servedPage - 1) * window;
        boolean drained = start + inspected >= pageItems.size();
        int nextOffset = drained ? pageStart + window : pageStart + start + inspected;
        return SampleResult.walked(selected, pageResult.getTotalCount(), seed, servedPage, inspected, nextOffset);
    }

    public SampleResult sampleAcrossPages(
        ItemPredicate predicate,
        int limit,
        int pageCount,
        String seed,
        Map<String, Object> objectFilter,
        CancellationToken token
    ) {
        return sampleAcrossPages(predicate, limit, pageCount, seed, objectFilter, null, token);
    }

    /**
     * Fetches several distinct random pages concurrently and merges them. A page that fails or
     * times out contributes nothing; the draw only fails when every page failed.
     */
    public SampleResult sampleAcrossPages(
        ItemPredicate predicate,
        int limit,
        int pageCount,
        String seed,
        Map<String, Object> objectFilter,
        String searchTerm,
        CancellationToken token
    ) {
        if (CancellationToken.isAborted(token)) {
            return SampleResult.aborted(seed);
        }
        int window = windowSize(limit);
        Map<String, Object> filter = withNativeCriterion(predicate, objectFilter);

        long totalCount;
        try {
            totalCount = queryExecutor.count(new CountQuery(TARGET, filter, searchTerm), token);
        } catch (CatalogAbortedException e) {
            return SampleResult.aborted(seed);
        } catch (CatalogException e) {
            logger.warn("{} failed: {}", "sampleAcrossPages", e.getMessage());
            return SampleResult.failed(seed, e.getMessage());
        }
        if (totalCount == 0) {
            return SampleResult.empty(seed);
        }

        List<Integer> pages = distinctPages(RandomPageSampler.totalPages(totalCount, window), pageCount);
        CancellationToken pageToken = CancellationToken.childOf(token);
        List<CompletableFuture<SampleResult>> futures = new ArrayList<>();
        for (Integer page : pages) {
            PageRequest request = new PageRequest(page, window, seed, searchTerm);
            futures.add(CompletableFuture.supplyAsync(
                () -> queryExecutor.execute(request, TARGET, filter, pageToken),
                executor
            ));
        }

        long timeoutMs = properties.getFanOut().getPageTimeoutMs();
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(Math.max(0L, timeoutMs));
        Map<String, CatalogItem> unique = new LinkedHashMap<>();
        int failedPages = 0;
        for (CompletableFuture<SampleResult> future : futures) {
            long remainingMs = timeoutMs > 0 ? Math.max(0L, TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime())) : -1L;
            SampleResult slice = awaitPage(future, remainingMs);
            if (!slice.isOk()) {
                failedPages++;
                Metrics.counter("sampler.fanout.page.total", "outcome", "failed").increment();
                continue;
            }
            Metrics.counter("sampler.fanout.page.total", "outcome", "ok").increment();
            for (CatalogItem item : slice.getItems()) {
                unique.putIfAbsent(item.getId(), item);
            }
        }
        // pages still in flight stop at their next checkpoint
        pageToken.abort();

        if (CancellationToken.isAborted(token)) {
            return SampleResult.aborted(seed);
        }
        if (failedPages == futures.size()) {
            return SampleResult.failed(seed, "all pages failed");
        }

        List<CatalogItem> passing = new ArrayList<>();
        for (CatalogItem item : unique.values()) {
            if (predicate.test(item)) {
                passing.add(item);
            }
        }
        Collections.shuffle(passing, random);
        List<CatalogItem> selected = passing.size() > limit ? new ArrayList<>(passing.subList(0, limit)) : passing;
        return SampleResult.filtered(selected, totalCount, seed, pages.get(0), 0);
    }

    private SampleResult awaitPage(CompletableFuture<SampleResult> future, long remainingMs) {
        try {
            if (remainingMs >= 0) {
                return future.get(remainingMs, TimeUnit.MILLISECONDS);
            }
            return future.get();
        } catch (TimeoutException e) {
            return SampleResult.failed(null, "timeout");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            logger.warn("{} failed: {}", "fetchPage", cause.getMessage());
            return SampleResult.failed(null, cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SampleResult.failed(null, "interrupted");
        }
    }

    private List<Integer> distinctPages(int totalPages, int pageCount) {
        int wanted = Math.max(1, Math.min(pageCount, totalPages));
        Set<Integer> pages = new LinkedHashSet<>();
        while (pages.size() < wanted) {
            pages.add(random.nextInt(totalPages) + 1);
        }
        return new ArrayList<>(pages);
    }

    private Map<String, Object> withNativeCriterion(ItemPredicate predicate, Map<String, Object> objectFilter) {
        Map<String, Object> filter = objectFilter == null ? new LinkedHashMap<>() : new LinkedHashMap<>(objectFilter);
        if (properties.getShortForm().getMode() != SamplerProperties.ShortFormMode.NATIVE) {
            return filter;
        }
        Optional<ItemPredicate.NativeCriterion> criterion = predicate.nativeCriterion();
        criterion.ifPresent(c -> filter.put(c.field(), c.value()));
        return filter;
    }

    private int windowSize(int limit) {
        return Math.max(Math.max(1, limit), properties.getShortForm().getWindow());
    }
}
