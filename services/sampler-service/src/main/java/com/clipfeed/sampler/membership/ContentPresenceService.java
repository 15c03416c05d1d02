package com.clipfeed.sampler.membership;

import com.clipfeed.sampler.catalog.CatalogAbortedException;
import com.clipfeed.sampler.catalog.CatalogException;
import com.clipfeed.sampler.catalog.CatalogTarget;
import com.clipfeed.sampler.common.CancellationToken;
import com.clipfeed.sampler.filter.CanonicalFilter;
import com.clipfeed.sampler.filter.IdCriterion;
import com.clipfeed.sampler.sampling.CountQuery;
import com.clipfeed.sampler.sampling.QueryExecutor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ContentPresenceService {
    private static final Logger logger = LoggerFactory.getLogger(ContentPresenceService.class);

    private final QueryExecutor queryExecutor;
    private final MembershipLruCache cache;
    private final ExecutorService executor;
    private final MembershipCacheProperties properties;

    public ContentPresenceService(
        QueryExecutor queryExecutor,
        MembershipLruCache membershipCache,
        ExecutorService samplerExecutor,
        MembershipCacheProperties properties
    ) {
        this.queryExecutor = queryExecutor;
        this.cache = membershipCache;
        this.executor = samplerExecutor;
        this.properties = properties;
    }

    enum Subject {
        TAG("tag", CanonicalFilter.TAGS),
        PERFORMER("performer", CanonicalFilter.PERFORMERS);

        private final String keyPrefix;
        private final String field;

        Subject(String keyPrefix, String field) {
            this.keyPrefix = keyPrefix;
            this.field = field;
        }

        String key(long id) {
            return keyPrefix + ":" + id;
        }
    }

    public boolean tagHasItems(long tagId, CancellationToken token) {
        return check(Subject.TAG, tagId, token).orElse(false);
    }

    public boolean performerHasItems(long performerId, CancellationToken token) {
        return check(Subject.PERFORMER, performerId, token).orElse(false);
    }

    public List<Long> retainTagsWithItems(List<Long> tagIds, CancellationToken token) {
        return retainWithItems(Subject.TAG, tagIds, token);
    }

    public List<Long> retainPerformersWithItems(List<Long> performerIds, CancellationToken token) {
        return retainWithItems(Subject.PERFORMER, performerIds, token);
    }

    /**
     * Keeps the ids that have items, in input order. Uncached ids are checked concurrently in
     * batches; an id whose check fails is treated as having no items for this call only.
     */
    private List<Long> retainWithItems(Subject subject, List<Long> ids, CancellationToken token) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        Map<Long, Boolean> known = new LinkedHashMap<>();
        List<Long> unknown = new ArrayList<>();
        for (Long id : ids) {
            if (id == null || known.containsKey(id) || unknown.contains(id)) {
                continue;
            }
            Optional<Boolean> cached = cache.get(subject.key(id));
            if (cached.isPresent()) {
                known.put(id, cached.get());
            } else {
                unknown.add(id);
            }
        }

        int batchSize = Math.max(1, properties.getBatchSize());
        for (int start = 0; start < unknown.size(); start += batchSize) {
            if (CancellationToken.isAborted(token)) {
                return List.of();
            }
            List<Long> batch = unknown.subList(start, Math.min(unknown.size(), start + batchSize));
            List<CompletableFuture<Optional<Boolean>>> futures = new ArrayList<>();
            for (Long id : batch) {
                futures.add(CompletableFuture.supplyAsync(() -> check(subject, id, token), executor));
            }
            for (int i = 0; i < batch.size(); i++) {
                Long id = batch.get(i);
                await(futures.get(i)).ifPresent(hasItems -> known.put(id, hasItems));
            }
        }
        if (CancellationToken.isAborted(token)) {
            return List.of();
        }

        List<Long> retained = new ArrayList<>();
        for (Long id : ids) {
            if (Boolean.TRUE.equals(known.get(id)) && !retained.contains(id)) {
                retained.add(id);
            }
        }
        return retained;
    }

    private Optional<Boolean> check(Subject subject, long id, CancellationToken token) {
        String key = subject.key(id);
        Optional<Boolean> cached = cache.get(key);
        if (cached.isPresent()) {
            return cached;
        }
        if (CancellationToken.isAborted(token)) {
            return Optional.empty();
        }
        Map<String, Object> filter = CanonicalFilter.empty()
            .with(subject.field, IdCriterion.includes(List.of(id)))
            .toVariables();
        try {
            boolean hasItems = queryExecutor.count(new CountQuery(CatalogTarget.SCENE_MARKERS, filter, null), token) > 0;
            cache.set(key, hasItems);
            return Optional.of(hasItems);
        } catch (CatalogAbortedException e) {
            return Optional.empty();
        } catch (CatalogException e) {
            logger.warn("{} failed: {}", subject.keyPrefix + "HasItems", e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<Boolean> await(CompletableFuture<Optional<Boolean>> future) {
        try {
            return future.get(properties.getCheckTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return Optional.empty();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            logger.warn("{} failed: {}", "presenceCheck", cause.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }
}
