package com.clipfeed.sampler.catalog;

import java.util.List;

public class CatalogResponseException extends CatalogException {
    private final List<String> errors;

    public CatalogResponseException(String message, Throwable cause) {
        super(message, cause);
        this.errors = List.of();
    }

    public CatalogResponseException(String message, List<String> errors) {
        super(message);
        this.errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
