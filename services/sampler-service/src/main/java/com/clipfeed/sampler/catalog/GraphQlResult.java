package com.clipfeed.sampler.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.util.ArrayList;
import java.util.List;

public class GraphQlResult {
    private final JsonNode data;
    private final List<String> errors;

    public GraphQlResult(JsonNode data, List<String> errors) {
        this.data = data == null ? MissingNode.getInstance() : data;
        this.errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static GraphQlResult of(JsonNode data) {
        return new GraphQlResult(data, List.of());
    }

    public static GraphQlResult fromResponse(JsonNode root) {
        if (root == null) {
            return new GraphQlResult(null, List.of());
        }
        List<String> errors = new ArrayList<>();
        for (JsonNode error : root.path("errors")) {
            String message = error.path("message").asText(null);
            errors.add(message == null || message.isBlank() ? error.toString() : message);
        }
        return new GraphQlResult(root.path("data"), errors);
    }

    public JsonNode getData() {
        return data;
    }

    public List<String> getErrors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasData() {
        return !data.isMissingNode() && !data.isNull();
    }
}
