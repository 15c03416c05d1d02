package com.clipfeed.sampler.sampling;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.clipfeed.sampler.catalog.CatalogItem;
import com.clipfeed.sampler.catalog.CatalogTarget;
import com.clipfeed.sampler.common.CancellationToken;
import com.clipfeed.sampler.common.ReadStatus;
import com.clipfeed.sampler.config.SamplerProperties;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MultiPageDeduplicatingFetcherTest {

    private static final String SEED = "random_00000099";
    private static final ItemPredicate SHORT = ItemPredicate.maxDuration(60);

    @Mock
    private QueryExecutor queryExecutor;

    private ExecutorService executor;
    private SamplerProperties properties;
    private MultiPageDeduplicatingFetcher fetcher;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(3);
        properties = new SamplerProperties();
        fetcher = new MultiPageDeduplicatingFetcher(
            queryExecutor,
            new RandomPageSampler(queryExecutor, SortSeedManagerTest.fixed(2)),
            executor,
            new Random(5),
            properties
        );
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void windowWalkReportsEveryInspectedItem() {
        when(queryExecutor.count(any(), any())).thenReturn(96L);
        when(queryExecutor.execute(any(PageRequest.class), eq(CatalogTarget.SCENES), anyMap(), any()))
            .thenAnswer(invocation -> alternatingPage(invocation.getArgument(0)));

        SampleResult result = fetcher.sampleFiltered(SHORT, 3, 30, SEED, Map.of(), CancellationToken.create());

        ArgumentCaptor<PageRequest> request = ArgumentCaptor.forClass(PageRequest.class);
        verify(queryExecutor).execute(request.capture(), eq(CatalogTarget.SCENES), anyMap(), any());
        assertThat(request.getValue().getPage()).isEqualTo(2);
        assertThat(request.getValue().getPerPage()).isEqualTo(24);
        assertThat(request.getValue().getSort()).isEqualTo(SEED);

        assertThat(result.getItems()).extracting("id").containsExactly("s30", "s32", "s34");
        assertThat(result.getUnfilteredOffsetConsumed()).isEqualTo(5);
        assertThat(result.getNextOffset()).isEqualTo(35);
    }

    @Test
    void consecutiveWindowsNeverRepeatItems() {
        when(queryExecutor.count(any(), any())).thenReturn(96L);
        when(queryExecutor.execute(any(PageRequest.class), eq(CatalogTarget.SCENES), anyMap(), any()))
            .thenAnswer(invocation -> alternatingPage(invocation.getArgument(0)));

        Set<String> served = new HashSet<>();
        int offset = 0;
        for (int call = 0; call < 10; call++) {
            SampleResult result = fetcher.sampleFiltered(SHORT, 4, offset, SEED, Map.of(), CancellationToken.create());
            for (CatalogItem item : result.getItems()) {
                assertThat(served.add(item.getId())).as("duplicate %s", item.getId()).isTrue();
            }
            assertThat(result.getUnfilteredOffsetConsumed()).isPositive();
            offset += result.getUnfilteredOffsetConsumed();
        }
        // four calls per page: three full ones, then one that drains the tail
        assertThat(served).hasSize(32);
    }

    @Test
    void offsetPastTheEndIsAnExhaustedWalk() {
        when(queryExecutor.count(any(), any())).thenReturn(30L);

        SampleResult result = fetcher.sampleFiltered(SHORT, 3, 500, SEED, Map.of(), CancellationToken.create());

        assertThat(result.getItems()).isEmpty();
        assertThat(result.getNextOffset()).isEqualTo(500);
        assertThat(result.getTotalCount()).isEqualTo(30L);
        verify(queryExecutor, never()).execute(any(), any(), anyMap(), any());
    }

    @Test
    void drainedShortPageAdvancesToTheNextPageBoundary() {
        when(queryExecutor.count(any(), any())).thenReturn(96L);
        when(queryExecutor.execute(any(PageRequest.class), eq(CatalogTarget.SCENES), anyMap(), any()))
            .thenAnswer(invocation -> {
                PageRequest request = invocation.getArgument(0);
                List<CatalogItem> items = new ArrayList<>();
                for (int i = 0; i < 10; i++) {
                    items.add(item("p" + request.getPage() + "-" + i, 30.0));
                }
                return SampleResult.ok(items, 96L, SEED, request.getPage());
            });

        SampleResult first = fetcher.sampleFiltered(SHORT, 20, 24, SEED, Map.of(), CancellationToken.create());
        SampleResult second = fetcher.sampleFiltered(SHORT, 20, first.getNextOffset(), SEED, Map.of(), CancellationToken.create());

        assertThat(first.getItems()).hasSize(10);
        assertThat(first.getNextOffset()).isEqualTo(48);
        assertThat(second.getPage()).isEqualTo(3);
        assertThat(second.getItems()).extracting("id").doesNotContainAnyElementsOf(
            first.getItems().stream().map(CatalogItem::getId).toList()
        );
    }

    @Test
    void pageOneRetryResumesFromTheServedPage() {
        when(queryExecutor.count(any(), any())).thenReturn(96L);
        when(queryExecutor.execute(any(PageRequest.class), eq(CatalogTarget.SCENES), anyMap(), any()))
            .thenAnswer(invocation -> alternatingPage(((PageRequest) invocation.getArgument(0)).withPage(1)));

        SampleResult result = fetcher.sampleFiltered(SHORT, 3, 60, SEED, Map.of(), CancellationToken.create());

        assertThat(result.getPage()).isEqualTo(1);
        assertThat(result.getItems()).extracting("id").containsExactly("s0", "s2", "s4");
        assertThat(result.getNextOffset()).isEqualTo(5);
    }

    @Test
    void missingOffsetStartsAtARandomWindowOfTheFilteredCount() {
        properties.getShortForm().setMode(SamplerProperties.ShortFormMode.NATIVE);
        when(queryExecutor.count(any(), any())).thenReturn(72L);
        when(queryExecutor.execute(any(PageRequest.class), eq(CatalogTarget.SCENES), anyMap(), any()))
            .thenAnswer(invocation -> alternatingPage(invocation.getArgument(0)));

        SampleResult result = fetcher.sampleFiltered(SHORT, 3, null, SEED, Map.of(), CancellationToken.create());

        ArgumentCaptor<PageRequest> request = ArgumentCaptor.forClass(PageRequest.class);
        ArgumentCaptor<Map<String, Object>> pageFilter = mapCaptor();
        verify(queryExecutor).execute(request.capture(), eq(CatalogTarget.SCENES), pageFilter.capture(), any());
        ArgumentCaptor<CountQuery> count = ArgumentCaptor.forClass(CountQuery.class);
        verify(queryExecutor).count(count.capture(), any());
        // three pages of 24, fixed draw picks the last
        assertThat(request.getValue().getPage()).isEqualTo(3);
        assertThat(count.getValue().getObjectFilter()).isEqualTo(pageFilter.getValue()).containsKey("duration");
        assertThat(result.getNextOffset()).isEqualTo(53);
    }

    @Test
    void emptyCountSkipsThePageFetch() {
        when(queryExecutor.count(any(), any())).thenReturn(0L);

        SampleResult result = fetcher.sampleFiltered(SHORT, 3, 0, SEED, Map.of(), CancellationToken.create());

        assertThat(result.getStatus()).isEqualTo(ReadStatus.OK);
        assertThat(result.getTotalCount()).isZero();
        assertThat(result.getUnfilteredOffsetConsumed()).isZero();
        verify(queryExecutor, never()).execute(any(), any(), anyMap(), any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void nativeModePushesTheDurationBoundIntoTheQuery() {
        properties.getShortForm().setMode(SamplerProperties.ShortFormMode.NATIVE);
        when(queryExecutor.count(any(), any())).thenReturn(0L);

        fetcher.sampleFiltered(SHORT, 3, 0, SEED, Map.of("file_count", Map.of()), CancellationToken.create());

        ArgumentCaptor<CountQuery> count = ArgumentCaptor.forClass(CountQuery.class);
        verify(queryExecutor).count(count.capture(), any());
        Map<String, Object> duration = (Map<String, Object>) count.getValue().getObjectFilter().get("duration");
        assertThat(duration).containsEntry("value", 60).containsEntry("modifier", "LESS_THAN");
        assertThat(count.getValue().getObjectFilter()).containsKey("file_count");
    }

    @Test
    void fanOutDeduplicatesAcrossPages() {
        when(queryExecutor.count(any(), any())).thenReturn(72L);
        when(queryExecutor.execute(any(PageRequest.class), eq(CatalogTarget.SCENES), anyMap(), any()))
            .thenAnswer(invocation -> {
                PageRequest request = invocation.getArgument(0);
                int page = request.getPage();
                return SampleResult.ok(
                    List.of(item("scene-42", 20.0), item("scene-" + page + "a", 25.0), item("scene-" + page + "b", 500.0)),
                    72L,
                    SEED,
                    page
                );
            });

        SampleResult result = fetcher.sampleAcrossPages(SHORT, 10, 3, SEED, Map.of(), CancellationToken.create());

        List<String> ids = new ArrayList<>();
        for (CatalogItem item : result.getItems()) {
            ids.add(item.getId());
        }
        assertThat(ids).containsOnlyOnce("scene-42");
        assertThat(ids).containsExactlyInAnyOrder("scene-42", "scene-1a", "scene-2a", "scene-3a");
        assertThat(result.getStatus()).isEqualTo(ReadStatus.OK);
    }

    @Test
    void fanOutToleratesAFailedPage() {
        when(queryExecutor.count(any(), any())).thenReturn(72L);
        when(queryExecutor.execute(any(PageRequest.class), eq(CatalogTarget.SCENES), anyMap(), any()))
            .thenAnswer(invocation -> {
                PageRequest request = invocation.getArgument(0);
                if (request.getPage() == 2) {
                    return SampleResult.failed(SEED, "boom");
                }
                return SampleResult.ok(List.of(item("scene-" + request.getPage(), 10.0)), 72L, SEED, request.getPage());
            });

        SampleResult result = fetcher.sampleAcrossPages(SHORT, 10, 3, SEED, Map.of(), CancellationToken.create());

        assertThat(result.getStatus()).isEqualTo(ReadStatus.OK);
        assertThat(result.getItems()).extracting("id").containsExactlyInAnyOrder("scene-1", "scene-3");
    }

    @Test
    void fanOutFailsOnlyWhenEveryPageFails() {
        when(queryExecutor.count(any(), any())).thenReturn(72L);
        when(queryExecutor.execute(any(PageRequest.class), eq(CatalogTarget.SCENES), anyMap(), any()))
            .thenReturn(SampleResult.failed(SEED, "boom"));

        SampleResult result = fetcher.sampleAcrossPages(SHORT, 10, 3, SEED, Map.of(), CancellationToken.create());

        assertThat(result.getStatus()).isEqualTo(ReadStatus.FAILED);
    }

    @Test
    void fanOutSharesOneDeadlineAndReleasesStalledPages() throws Exception {
        properties.getFanOut().setPageTimeoutMs(300L);
        CountDownLatch released = new CountDownLatch(3);
        when(queryExecutor.count(any(), any())).thenReturn(72L);
        when(queryExecutor.execute(any(PageRequest.class), eq(CatalogTarget.SCENES), anyMap(), any()))
            .thenAnswer(invocation -> {
                CancellationToken pageToken = invocation.getArgument(3);
                long until = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
                while (!pageToken.isAborted() && System.nanoTime() < until) {
                    Thread.sleep(10);
                }
                if (pageToken.isAborted()) {
                    released.countDown();
                }
                return SampleResult.aborted(SEED);
            });
        CancellationToken token = CancellationToken.create();

        long startedAt = System.nanoTime();
        SampleResult result = fetcher.sampleAcrossPages(SHORT, 10, 3, SEED, Map.of(), token);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);

        assertThat(result.getStatus()).isEqualTo(ReadStatus.FAILED);
        assertThat(elapsedMs).isLessThan(700L);
        assertThat(released.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(token.isAborted()).isFalse();
    }

    @Test
    void fanOutTruncatesToLimit() {
        when(queryExecutor.count(any(), any())).thenReturn(72L);
        when(queryExecutor.execute(any(PageRequest.class), eq(CatalogTarget.SCENES), anyMap(), any()))
            .thenAnswer(invocation -> alternatingPage(invocation.getArgument(0)));

        SampleResult result = fetcher.sampleAcrossPages(SHORT, 5, 3, SEED, Map.of(), CancellationToken.create());

        assertThat(result.getItems()).hasSize(5);
    }

    @SuppressWarnings("unchecked")
    private static ArgumentCaptor<Map<String, Object>> mapCaptor() {
        return ArgumentCaptor.forClass(Map.class);
    }

    private static SampleResult alternatingPage(PageRequest request) {
        int base = (request.getPage() - 1) * request.getPerPage();
        List<CatalogItem> items = new ArrayList<>();
        for (int i = 0; i < request.getPerPage(); i++) {
            items.add(item("s" + (base + i), i % 2 == 0 ? 30.0 : 300.0));
        }
        return SampleResult.ok(items, 96L, request.getSort(), request.getPage());
    }

    private static CatalogItem item(String id, double duration) {
        return new CatalogItem(id, id, "title " + id, 0.0, duration, null);
    }
}
