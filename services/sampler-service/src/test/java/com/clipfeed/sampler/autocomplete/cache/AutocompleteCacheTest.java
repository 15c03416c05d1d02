package com.clipfeed.sampler.autocomplete.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.scheduling.TaskScheduler;

class AutocompleteCacheTest {

    private MutableClock clock;
    private AutocompleteCacheProperties properties;
    private TaskScheduler taskScheduler;
    private AutocompleteCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        properties = new AutocompleteCacheProperties();
        taskScheduler = mock(TaskScheduler.class);
        cache = new AutocompleteCache(properties, clock, taskScheduler);
    }

    @Test
    void hitWithinTtlSkipsTheFetch() {
        AtomicInteger fetches = new AtomicInteger();

        cache.getOrFetch("tags", "bea", 10, () -> List.of("beach-" + fetches.incrementAndGet()));
        clock.advance(299_999L);
        List<String> second = cache.getOrFetch("tags", "bea", 10, () -> List.of("beach-" + fetches.incrementAndGet()));

        assertThat(fetches.get()).isEqualTo(1);
        assertThat(second).containsExactly("beach-1");
    }

    @Test
    void entryExpiresAtTtl() {
        AtomicInteger fetches = new AtomicInteger();

        cache.getOrFetch("tags", "bea", 10, () -> List.of("v" + fetches.incrementAndGet()));
        clock.advance(300_000L);
        List<String> refreshed = cache.getOrFetch("tags", "bea", 10, () -> List.of("v" + fetches.incrementAndGet()));

        assertThat(refreshed).containsExactly("v2");
    }

    @Test
    void blankTermsAreNeverCached() {
        AtomicInteger fetches = new AtomicInteger();

        cache.getOrFetch("tags", "  ", 10, () -> List.of(fetches.incrementAndGet()));
        cache.getOrFetch("tags", "  ", 10, () -> List.of(fetches.incrementAndGet()));
        cache.getOrFetch("tags", null, 10, () -> List.of(fetches.incrementAndGet()));

        assertThat(fetches.get()).isEqualTo(3);
        assertThat(cache.size()).isZero();
    }

    @Test
    void limitIsPartOfTheKey() {
        cache.getOrFetch("performers", "ann", 5, () -> List.of("a"));
        List<String> wider = cache.getOrFetch("performers", "ann", 10, () -> List.of("a", "b"));

        assertThat(wider).containsExactly("a", "b");
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    void separatorsInTermsCannotCollide() {
        assertThat(AutocompleteCache.keyFor("tags", "a:1", 2)).isNotEqualTo(AutocompleteCache.keyFor("tags", "a", 12));
        assertThat(AutocompleteCache.keyFor("tags:a", "1", 2)).isNotEqualTo(AutocompleteCache.keyFor("tags", "a:1", 2));
        assertThat(AutocompleteCache.keyFor("tags", "a\\", 2)).isEqualTo("tags:a\\\\:2");
    }

    @Test
    void failedFetchIsNotCached() {
        assertThatThrownBy(() -> cache.getOrFetch("tags", "x", 10, () -> {
            throw new IllegalStateException("catalog down");
        })).isInstanceOf(IllegalStateException.class);

        List<String> retried = cache.getOrFetch("tags", "x", 10, () -> List.of("ok"));

        assertThat(retried).containsExactly("ok");
    }

    @Test
    void sweepDropsExpiredThenOldestAboveCap() {
        properties.setMaxEntries(2);
        cache.getOrFetch("tags", "old", 10, () -> List.of("1"));
        clock.advance(200_000L);
        cache.getOrFetch("tags", "b", 10, () -> List.of("2"));
        clock.advance(1_000L);
        cache.getOrFetch("tags", "c", 10, () -> List.of("3"));
        clock.advance(1_000L);
        cache.getOrFetch("tags", "d", 10, () -> List.of("4"));

        clock.advance(99_000L);
        int removed = cache.sweep();

        assertThat(removed).isEqualTo(2);
        assertThat(cache.size()).isEqualTo(2);
        AtomicInteger fetches = new AtomicInteger();
        cache.getOrFetch("tags", "c", 10, () -> List.of("x" + fetches.incrementAndGet()));
        cache.getOrFetch("tags", "d", 10, () -> List.of("x" + fetches.incrementAndGet()));
        assertThat(fetches.get()).isZero();
    }

    @Test
    void invalidateOnlyTouchesOneKind() {
        cache.getOrFetch("tags", "a", 10, () -> List.of("t"));
        cache.getOrFetch("performers", "a", 10, () -> List.of("p"));

        cache.invalidate("tags");

        assertThat(cache.size()).isEqualTo(1);
        cache.clear();
        assertThat(cache.size()).isZero();
    }

    @Test
    void startSchedulesTheSweepAndStopCancelsIt() {
        ScheduledFuture<?> task = mock(ScheduledFuture.class);
        doReturn(task).when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        cache.getOrFetch("tags", "old", 10, () -> List.of("x"));

        cache.start();
        cache.start();

        ArgumentCaptor<Runnable> sweep = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler).scheduleAtFixedRate(
            sweep.capture(),
            eq(clock.instant().plusMillis(300_000L)),
            eq(Duration.ofMillis(300_000L))
        );
        assertThat(cache.isRunning()).isTrue();

        clock.advance(300_000L);
        sweep.getValue().run();
        assertThat(cache.size()).isZero();

        cache.stop();
        verify(task).cancel(false);
        assertThat(cache.isRunning()).isFalse();
    }

    @Test
    void nonPositiveIntervalNeverSchedules() {
        properties.setSweepIntervalMs(0L);

        cache.start();

        assertThat(cache.isRunning()).isFalse();
        verify(taskScheduler, never()).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
    }

    private static final class MutableClock extends Clock {
        private long millis = 1_700_000_000_000L;

        void advance(long deltaMs) {
            millis += deltaMs;
        }

        @Override
        public long millis() {
            return millis;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }
    }
}
