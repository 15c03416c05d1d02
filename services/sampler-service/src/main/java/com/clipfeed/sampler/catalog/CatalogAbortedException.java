package com.clipfeed.sampler.catalog;

public class CatalogAbortedException extends CatalogException {
    public CatalogAbortedException(String message) {
        super(message);
    }
}
