package com.clipfeed.sampler.autocomplete.cache;

import io.micrometer.core.instrument.Metrics;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

/**
 * In-memory TTL cache for suggestion lists, keyed by kind, term and limit.
 *
 * <p>Entries expire lazily on read and eagerly on {@link #sweep()}, which {@link #start()}
 * schedules on the given {@link TaskScheduler} until {@link #stop()}. Nothing is persisted or
 * shared across instances.
 */
public class AutocompleteCache {
    private static final Logger logger = LoggerFactory.getLogger(AutocompleteCache.class);

    private final ConcurrentHashMap<String, CacheEntry<List<?>>> entries = new ConcurrentHashMap<>();
    private final AutocompleteCacheProperties properties;
    private final Clock clock;
    private final TaskScheduler taskScheduler;

    private ScheduledFuture<?> sweepTask;

    public AutocompleteCache(AutocompleteCacheProperties properties, Clock clock, TaskScheduler taskScheduler) {
        this.properties = properties;
        this.clock = clock;
        this.taskScheduler = taskScheduler;
    }

    /**
     * Returns the cached list for a non-blank term, or calls {@code fetch} and caches its result.
     * Blank terms always fetch. A fetch that throws is not cached and the exception propagates.
     */
    @SuppressWarnings("unchecked")
    public <T> List<T> getOrFetch(String kind, String term, int limit, Supplier<List<T>> fetch) {
        if (!properties.isEnabled() || term == null || term.isBlank()) {
            return fetch.get();
        }
        String key = keyFor(kind, term, limit);
        long now = clock.millis();
        CacheEntry<List<?>> entry = entries.get(key);
        if (entry != null) {
            if (!entry.isExpired(now, properties.getTtlMs())) {
                Metrics.counter("autocomplete.cache.requests.total", "outcome", "hit").increment();
                return (List<T>) entry.getValue();
            }
            entries.remove(key, entry);
        }
        Metrics.counter("autocomplete.cache.requests.total", "outcome", "miss").increment();
        List<T> value = fetch.get();
        if (value != null) {
            entries.put(key, new CacheEntry<>(List.copyOf(value), clock.millis()));
        }
        return value;
    }

    public static String keyFor(String kind, String term, int limit) {
        return escape(kind) + ":" + escape(term) + ":" + limit;
    }

    private static String escape(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("\\", "\\\\").replace(":", "\\:");
    }

    public int sweep() {
        long now = clock.millis();
        long ttlMs = properties.getTtlMs();
        int removed = 0;
        for (Map.Entry<String, CacheEntry<List<?>>> entry : entries.entrySet()) {
            if (entry.getValue().isExpired(now, ttlMs) && entries.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        int overflow = entries.size() - Math.max(0, properties.getMaxEntries());
        if (overflow > 0) {
            List<Map.Entry<String, CacheEntry<List<?>>>> byAge = new ArrayList<>(entries.entrySet());
            byAge.sort(Comparator.comparingLong(e -> e.getValue().getCreatedAt()));
            for (int i = 0; i < overflow && i < byAge.size(); i++) {
                if (entries.remove(byAge.get(i).getKey(), byAge.get(i).getValue())) {
                    removed++;
                }
            }
        }
        if (removed > 0) {
            Metrics.counter("autocomplete.cache.evictions.total").increment(removed);
            logger.debug("Autocomplete cache sweep removed {} entries", removed);
        }
        return removed;
    }

    public void invalidate(String kind) {
        String prefix = escape(kind) + ":";
        entries.keySet().removeIf(key -> key.startsWith(prefix));
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    public synchronized void start() {
        if (sweepTask != null) {
            return;
        }
        long interval = properties.getSweepIntervalMs();
        if (interval <= 0) {
            return;
        }
        sweepTask = taskScheduler.scheduleAtFixedRate(
            this::sweepSafely,
            clock.instant().plusMillis(interval),
            Duration.ofMillis(interval)
        );
    }

    public synchronized void stop() {
        if (sweepTask != null) {
            sweepTask.cancel(false);
            sweepTask = null;
        }
    }

    public synchronized boolean isRunning() {
        return sweepTask != null;
    }

    private void sweepSafely() {
        try {
            sweep();
        } catch (RuntimeException e) {
            logger.warn("Autocomplete cache sweep failed: {}", e.getMessage());
        }
    }
}
