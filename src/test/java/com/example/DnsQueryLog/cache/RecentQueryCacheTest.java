package com.example.DnsQueryLog.cache;

import com.example.DnsQueryLog.entity.QueryLogEntry;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.example.DnsQueryLog.QueryLogFixtures.entry;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecentQueryCacheTest {

    private static final Instant T0 = Instant.parse("2024-03-10T12:00:00Z");

    @Test
    void keepsNewestEntriesInArrivalOrder() {
        RecentQueryCache cache = new RecentQueryCache(3);
        List<QueryLogEntry> all = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            QueryLogEntry e = entry("host" + i + ".example", "10.0.0.1", T0.plusSeconds(i));
            all.add(e);
            cache.append(e);
            assertThat(cache.size()).isLessThanOrEqualTo(3);
        }

        assertThat(cache.snapshot()).containsExactlyElementsOf(all.subList(2, 5));
    }

    @Test
    void snapshotIsACopy() {
        RecentQueryCache cache = new RecentQueryCache(2);
        cache.append(entry("a.example", "10.0.0.1", T0));
        List<QueryLogEntry> snapshot = cache.snapshot();

        cache.append(entry("b.example", "10.0.0.1", T0.plusSeconds(1)));
        cache.clear();

        assertThat(snapshot).hasSize(1);
        assertThat(cache.snapshot()).isEmpty();
    }

    @Test
    void loadAllSortsByTimeAndKeepsNewest() {
        RecentQueryCache cache = new RecentQueryCache(2);
        QueryLogEntry first = entry("a.example", "10.0.0.1", T0);
        QueryLogEntry second = entry("b.example", "10.0.0.1", T0.plusSeconds(1));
        QueryLogEntry third = entry("c.example", "10.0.0.1", T0.plusSeconds(2));

        // active file entries arrive before the older backup entries
        cache.loadAll(List.of(third, first, second));

        assertThat(cache.snapshot()).containsExactly(second, third);
    }

    @Test
    void concurrentAppendsNeverExceedCapacity() throws InterruptedException {
        RecentQueryCache cache = new RecentQueryCache(100);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch done = new CountDownLatch(4);
        QueryLogEntry e = entry("a.example", "10.0.0.1", T0);
        for (int t = 0; t < 4; t++) {
            pool.execute(() -> {
                for (int i = 0; i < 1000; i++) {
                    cache.append(e);
                    assertThat(cache.snapshot().size()).isLessThanOrEqualTo(100);
                }
                done.countDown();
            });
        }
        assertThat(done.await(30, TimeUnit.SECONDS)).isTrue();
        pool.shutdown();

        assertThat(cache.size()).isEqualTo(100);
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new RecentQueryCache(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
