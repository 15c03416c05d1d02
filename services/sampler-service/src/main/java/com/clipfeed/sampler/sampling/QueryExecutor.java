package com.clipfeed.sampler.sampling;

import com.clipfeed.sampler.catalog.CatalogAbortedException;
import com.clipfeed.sampler.catalog.CatalogClient;
import com.clipfeed.sampler.catalog.CatalogException;
import com.clipfeed.sampler.catalog.CatalogItem;
import com.clipfeed.sampler.catalog.CatalogTarget;
import com.clipfeed.sampler.catalog.GraphQlResult;
import com.clipfeed.sampler.common.CancellationToken;
import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.Metrics;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs one page query against the catalog and reconciles count/page disagreement.
 *
 * <p>The catalog may report a positive count and still return an empty page (rows deleted
 * between queries, or a random window past the real end). In that case the same filter and
 * seed are retried exactly once on page 1 and whatever comes back is returned.
 */
@Component
public class QueryExecutor {
    private static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);

    private final CatalogClient catalogClient;

    public QueryExecutor(CatalogClient catalogClient) {
        this.catalogClient = catalogClient;
    }

    public SampleResult execute(
        PageRequest request,
        CatalogTarget target,
        Map<String, Object> objectFilter,
        CancellationToken token
    ) {
        String seed = request.getSort();
        if (CancellationToken.isAborted(token)) {
            return SampleResult.aborted(seed);
        }
        try {
            SampleResult result = fetchPage(request, target, objectFilter, token);
            if (result.getTotalCount() > 0 && result.getItems().isEmpty() && request.getPage() != 1) {
                Metrics.counter("sampler.query.retry.total", "target", target.name()).increment();
                logger.debug("Page {} empty with count {}, retrying page 1", request.getPage(), result.getTotalCount());
                result = fetchPage(request.withPage(1), target, objectFilter, token);
            }
            if (CancellationToken.isAborted(token)) {
                return SampleResult.aborted(seed);
            }
            return result;
        } catch (CatalogAbortedException e) {
            return SampleResult.aborted(seed);
        } catch (CatalogException e) {
            logger.warn("{} failed: {}", target.getRootField(), e.getMessage());
            return SampleResult.failed(seed, e.getMessage());
        }
    }

    public long count(CountQuery query, CancellationToken token) {
        CatalogTarget target = query.getTarget();
        GraphQlResult result = catalogClient.query(
            target.getCountDocument(),
            variables(PageRequest.countOnly(query.getSearchTerm()), target, query.getObjectFilter()),
            token
        );
        return Math.max(0L, result.getData().path(target.getRootField()).path("count").asLong(0L));
    }

    private SampleResult fetchPage(
        PageRequest request,
        CatalogTarget target,
        Map<String, Object> objectFilter,
        CancellationToken token
    ) {
        GraphQlResult result = catalogClient.query(
            target.getFindDocument(),
            variables(request, target, objectFilter),
            token
        );
        JsonNode root = result.getData().path(target.getRootField());
        long totalCount = Math.max(0L, root.path("count").asLong(0L));
        List<CatalogItem> items = new ArrayList<>();
        for (JsonNode node : root.path(target.getItemsField())) {
            CatalogItem item = CatalogItem.fromNode(target, node);
            if (item != null) {
                items.add(item);
            }
        }
        return SampleResult.ok(items, totalCount, request.getSort(), request.getPage());
    }

    static Map<String, Object> variables(PageRequest request, CatalogTarget target, Map<String, Object> objectFilter) {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("filter", request.toFindFilter());
        variables.put(target.getFilterVariable(), objectFilter == null ? Map.of() : objectFilter);
        return variables;
    }
}
