package com.clipfeed.sampler.catalog;

import com.clipfeed.sampler.common.CancellationToken;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

@Component
public class GraphQlCatalogClient implements CatalogClient {
    private static final Logger logger = LoggerFactory.getLogger(GraphQlCatalogClient.class);
    private static final String API_KEY_HEADER = "ApiKey";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final CatalogProperties properties;

    public GraphQlCatalogClient(RestTemplate catalogRestTemplate, ObjectMapper objectMapper, CatalogProperties properties) {
        this.restTemplate = catalogRestTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public GraphQlResult query(String document, Map<String, Object> variables, CancellationToken token) {
        return execute("query", document, variables, token);
    }

    @Override
    public GraphQlResult mutate(String document, Map<String, Object> variables, CancellationToken token) {
        return execute("mutation", document, variables, token);
    }

    private GraphQlResult execute(String operation, String document, Map<String, Object> variables, CancellationToken token) {
        if (CancellationToken.isAborted(token)) {
            throw new CatalogAbortedException("Catalog " + operation + " aborted before dispatch");
        }
        String url = buildUrl(properties.getGraphqlPath());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", document);
        body.put("variables", variables == null ? Map.of() : variables);

        try {
            String payload = objectMapper.writeValueAsString(body);
            HttpEntity<String> entity = new HttpEntity<>(payload, buildHeaders());
            ResponseEntity<String> response = restTemplate.exchange(url, HttpMethod.POST, entity, String.class);
            if (CancellationToken.isAborted(token)) {
                throw new CatalogAbortedException("Catalog " + operation + " aborted after response");
            }
            String responseBody = response.getBody();
            JsonNode root = objectMapper.readTree(responseBody == null || responseBody.isBlank() ? "{}" : responseBody);
            GraphQlResult result = GraphQlResult.fromResponse(root);
            if (result.hasErrors() && !result.hasData()) {
                throw new CatalogResponseException("Catalog " + operation + " returned errors", result.getErrors());
            }
            if (result.hasErrors()) {
                logger.debug("Catalog {} returned partial data with errors: {}", operation, result.getErrors());
            }
            return result;
        } catch (ResourceAccessException e) {
            if (CancellationToken.isAborted(token)) {
                throw new CatalogAbortedException("Catalog " + operation + " aborted in flight");
            }
            throw new CatalogUnavailableException("Catalog unreachable: " + url, e);
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            if (status == 502 || status == 503 || status == 504) {
                throw new CatalogUnavailableException("Catalog unavailable: " + status, e);
            }
            throw new CatalogResponseException("Catalog error: " + status, e);
        } catch (JsonProcessingException e) {
            throw new CatalogResponseException("Failed to parse catalog response", e);
        }
    }

    private String buildUrl(String path) {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        if (path == null || path.isBlank()) {
            return base;
        }
        return path.startsWith("/") ? base + path : base + "/" + path;
    }

    private HttpHeaders buildHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        String apiKey = properties.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            headers.set(API_KEY_HEADER, apiKey);
        }
        return headers;
    }
}
