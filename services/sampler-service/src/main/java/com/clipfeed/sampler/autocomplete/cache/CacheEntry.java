package com.clipfeed.sampler.autocomplete.cache;

public class CacheEntry<V> {
    private final V value;
    private final long createdAt;

    public CacheEntry(V value, long createdAt) {
        this.value = value;
        this.createdAt = createdAt;
    }

    public V getValue() {
        return value;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public boolean isExpired(long nowMs, long ttlMs) {
        return nowMs - createdAt >= ttlMs;
    }
}
