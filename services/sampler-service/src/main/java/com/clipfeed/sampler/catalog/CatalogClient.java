package com.clipfeed.sampler.catalog;

import com.clipfeed.sampler.common.CancellationToken;
import java.util.Map;

/**
 * Remote catalog collaborator. Implementations throw {@link CatalogAbortedException} when the
 * token is aborted, {@link CatalogUnavailableException} on transport failures and
 * {@link CatalogResponseException} when the catalog answers with an error payload.
 */
public interface CatalogClient {
    GraphQlResult query(String document, Map<String, Object> variables, CancellationToken token);

    GraphQlResult mutate(String document, Map<String, Object> variables, CancellationToken token);
}
