package com.clipfeed.sampler.service;

import com.clipfeed.sampler.catalog.CatalogAbortedException;
import com.clipfeed.sampler.catalog.CatalogClient;
import com.clipfeed.sampler.catalog.CatalogException;
import com.clipfeed.sampler.catalog.CatalogQueries;
import com.clipfeed.sampler.catalog.CatalogTarget;
import com.clipfeed.sampler.catalog.GraphQlResult;
import com.clipfeed.sampler.common.CancellationToken;
import com.clipfeed.sampler.common.ReadStatus;
import com.clipfeed.sampler.config.SamplerProperties;
import com.clipfeed.sampler.filter.CanonicalFilter;
import com.clipfeed.sampler.filter.FilterNormalizer;
import com.clipfeed.sampler.filter.FilterSpec;
import com.clipfeed.sampler.filter.ObjectFilterBuilder;
import com.clipfeed.sampler.sampling.CountQuery;
import com.clipfeed.sampler.sampling.ItemPredicate;
import com.clipfeed.sampler.sampling.MultiPageDeduplicatingFetcher;
import com.clipfeed.sampler.sampling.PageRequest;
import com.clipfeed.sampler.sampling.QueryExecutor;
import com.clipfeed.sampler.sampling.RandomPageSampler;
import com.clipfeed.sampler.sampling.SampleResult;
import com.clipfeed.sampler.sampling.SortSeedManager;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class FeedSamplingService {
    private static final Logger logger = LoggerFactory.getLogger(FeedSamplingService.class);

    private final CatalogClient catalogClient;
    private final FilterNormalizer filterNormalizer;
    private final ObjectFilterBuilder objectFilterBuilder;
    private final SortSeedManager sortSeedManager;
    private final RandomPageSampler randomPageSampler;
    private final QueryExecutor queryExecutor;
    private final MultiPageDeduplicatingFetcher fetcher;
    private final SamplerProperties properties;

    public FeedSamplingService(
        CatalogClient catalogClient,
        FilterNormalizer filterNormalizer,
        ObjectFilterBuilder objectFilterBuilder,
        SortSeedManager sortSeedManager,
        RandomPageSampler randomPageSampler,
        QueryExecutor queryExecutor,
        MultiPageDeduplicatingFetcher fetcher,
        SamplerProperties properties
    ) {
        this.catalogClient = catalogClient;
        this.filterNormalizer = filterNormalizer;
        this.objectFilterBuilder = objectFilterBuilder;
        this.sortSeedManager = sortSeedManager;
        this.randomPageSampler = randomPageSampler;
        this.queryExecutor = queryExecutor;
        this.fetcher = fetcher;
        this.properties = properties;
    }

    public FeedSample fetchSample(FilterSpec spec, CancellationToken token) {
        if (CancellationToken.isAborted(token)) {
            return FeedSample.aborted(spec);
        }
        String seed = sortSeedManager.resolveSeed(spec);
        FilterSpec seeded = spec.withSortSeed(seed);
        if (spec.isShortForm()) {
            return sampleShortForm(seeded, seed, token);
        }
        if (spec.isShuffleMode()) {
            return sampleScenes(seeded, seed, token);
        }
        return sampleMarkers(seeded, seed, token);
    }

    private FeedSample sampleMarkers(FilterSpec spec, String seed, CancellationToken token) {
        SavedFilter saved = resolveSavedFilter(spec, token);
        if (CancellationToken.isAborted(token)) {
            return FeedSample.aborted(spec);
        }
        CanonicalFilter filter = objectFilterBuilder.markerFilter(spec, saved == null ? null : saved.objectFilter);
        String searchTerm = spec.hasQuery() ? spec.getQuery().trim() : (saved == null ? null : saved.searchTerm);
        return samplePaged(spec, seed, CatalogTarget.SCENE_MARKERS, filter.toVariables(), searchTerm, !spec.hasActiveFilters(), token);
    }

    private FeedSample sampleScenes(FilterSpec spec, String seed, CancellationToken token) {
        CanonicalFilter filter = objectFilterBuilder.shuffleSceneFilter(spec);
        String searchTerm = spec.hasQuery() ? spec.getQuery().trim() : null;
        return samplePaged(spec, seed, CatalogTarget.SCENES, filter.toVariables(), searchTerm, true, token);
    }

    private FeedSample samplePaged(
        FilterSpec spec,
        String seed,
        CatalogTarget target,
        Map<String, Object> objectFilter,
        String searchTerm,
        boolean randomWindowAllowed,
        CancellationToken token
    ) {
        int limit = spec.getLimit();
        int page;
        if (spec.hasOffset()) {
            page = Math.max(0, spec.getOffset()) / limit + 1;
        } else if (randomWindowAllowed) {
            page = randomPageSampler.pickPage(new CountQuery(target, objectFilter, searchTerm), limit, token);
        } else {
            page = 1;
        }
        SampleResult result = queryExecutor.execute(new PageRequest(page, limit, seed, searchTerm), target, objectFilter, token);
        // page-aligned so a short page is never served twice
        return toSample(result, spec, result.getPage() * limit);
    }

    private FeedSample sampleShortForm(FilterSpec spec, String seed, CancellationToken token) {
        ItemPredicate predicate = ItemPredicate.maxDuration(spec.getMaxDurationSeconds());
        Map<String, Object> objectFilter = objectFilterBuilder.shortFormSceneFilter(spec).toVariables();
        String searchTerm = spec.hasQuery() ? spec.getQuery().trim() : null;
        int limit = spec.getLimit();

        if (properties.getShortForm().getMode() == SamplerProperties.ShortFormMode.FAN_OUT) {
            SampleResult result = fetcher.sampleAcrossPages(
                predicate, limit, properties.getFanOut().getPageCount(), seed, objectFilter, searchTerm, token);
            return toSample(result, spec, spec.getOffset());
        }

        SampleResult result = fetcher.sampleFiltered(predicate, limit, spec.getOffset(), seed, objectFilter, searchTerm, token);
        return toSample(result, spec, result.getNextOffset());
    }

    private FeedSample toSample(SampleResult result, FilterSpec spec, Integer nextOffset) {
        if (result.getStatus() == ReadStatus.ABORTED) {
            return FeedSample.aborted(spec);
        }
        if (result.getStatus() == ReadStatus.FAILED) {
            return new FeedSample(result.getItems(), 0L, spec, ReadStatus.FAILED);
        }
        return new FeedSample(result.getItems(), result.getTotalCount(), spec.withOffset(nextOffset), ReadStatus.OK);
    }

    // an unreadable saved filter is ignored and the feed falls back to the ad-hoc selections
    private SavedFilter resolveSavedFilter(FilterSpec spec, CancellationToken token) {
        if (!spec.hasSavedFilter()) {
            return null;
        }
        try {
            GraphQlResult result = catalogClient.query(
                CatalogQueries.FIND_SAVED_FILTER,
                Map.of("id", spec.getSavedFilterId()),
                token
            );
            JsonNode saved = result.getData().path("findSavedFilter");
            if (saved.isMissingNode() || saved.isNull()) {
                logger.warn("{} failed: {}", "resolveSavedFilter", "saved filter not found: " + spec.getSavedFilterId());
                return null;
            }
            CanonicalFilter objectFilter = filterNormalizer.normalize(saved.path("object_filter"));
            String q = saved.path("find_filter").path("q").asText("");
            return new SavedFilter(objectFilter, q.isBlank() ? null : q.trim());
        } catch (CatalogAbortedException e) {
            return null;
        } catch (CatalogException e) {
            logger.warn("{} failed: {}", "resolveSavedFilter", e.getMessage());
            return null;
        }
    }

    private static final class SavedFilter {
        private final CanonicalFilter objectFilter;
        private final String searchTerm;

        private SavedFilter(CanonicalFilter objectFilter, String searchTerm) {
            this.objectFilter = objectFilter;
            this.searchTerm = searchTerm;
        }
    }
}
