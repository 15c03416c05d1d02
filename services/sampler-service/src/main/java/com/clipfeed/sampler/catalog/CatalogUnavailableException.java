package com.clipfeed.sampler.catalog;

public class CatalogUnavailableException extends CatalogException {
    public CatalogUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
