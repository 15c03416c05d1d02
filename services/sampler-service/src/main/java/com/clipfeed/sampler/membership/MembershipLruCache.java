package com.clipfeed.sampler.membership;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public class MembershipLruCache {
    private final Map<String, Boolean> entries = new LinkedHashMap<>();
    private final int capacity;

    public MembershipLruCache(int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    public synchronized Optional<Boolean> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        Boolean value = entries.remove(key);
        if (value == null) {
            return Optional.empty();
        }
        entries.put(key, value);
        return Optional.of(value);
    }

    public synchronized void set(String key, boolean value) {
        if (key == null) {
            return;
        }
        if (entries.remove(key) == null && entries.size() >= capacity) {
            Iterator<String> eldest = entries.keySet().iterator();
            eldest.next();
            eldest.remove();
        }
        entries.put(key, value);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }

    public int getCapacity() {
        return capacity;
    }
}
