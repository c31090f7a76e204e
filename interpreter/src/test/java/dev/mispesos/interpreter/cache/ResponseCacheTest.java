package dev.mispesos.interpreter.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.mispesos.records.Category;
import dev.mispesos.records.RecordOrigin;
import dev.mispesos.records.StructuredRecord;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class ResponseCacheTest {

    private final AtomicLong nanos = new AtomicLong();

    @Test
    void returnsStoredRecordUntilTtlElapses() {
        ResponseCache cache = new ResponseCache(Duration.ofHours(1), 1000, 0.8, 0.6, nanos::get);
        StructuredRecord record = record(0.9);

        assertThat(cache.put("fp", record)).isTrue();
        nanos.addAndGet(Duration.ofMinutes(59).toNanos());
        assertThat(cache.get("fp")).contains(record);

        nanos.addAndGet(Duration.ofMinutes(2).toNanos());
        assertThat(cache.get("fp")).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    void rejectsRecordsThatAreNotConfidentOrSuccessful() {
        ResponseCache cache = new ResponseCache(Duration.ofHours(1), 1000, 0.8, 0.6, nanos::get);

        assertThat(cache.put("at-threshold", record(0.6))).isFalse();
        assertThat(cache.put("no-amount", StructuredRecord.builder().confidence(0.95).build())).isFalse();
        assertThat(cache.put("confident", record(0.61))).isTrue();

        assertThat(cache.get("at-threshold")).isEmpty();
        assertThat(cache.get("no-amount")).isEmpty();
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void shrinksToNewestEntriesWhenCapacityIsExceeded() {
        ResponseCache cache = new ResponseCache(Duration.ofHours(1), 10, 0.8, 0.6, nanos::get);

        for (int i = 0; i <= 10; i++) {
            cache.put("fp-" + i, record(0.9));
            nanos.incrementAndGet();
        }

        assertThat(cache.size()).isEqualTo(8);
        assertThat(cache.get("fp-0")).isEmpty();
        assertThat(cache.get("fp-1")).isEmpty();
        assertThat(cache.get("fp-2")).isEmpty();
        assertThat(cache.get("fp-3")).isPresent();
        assertThat(cache.get("fp-10")).isPresent();
    }

    @Test
    void concurrentOverflowKeepsNewestEntries() throws Exception {
        ResponseCache cache = new ResponseCache(Duration.ofHours(1), 100, 0.8, 0.6, nanos::get);
        for (int i = 0; i < 100; i++) {
            cache.put("seed-" + i, record(0.9));
        }

        int writers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        try {
            for (int round = 0; round < 50; round++) {
                CountDownLatch start = new CountDownLatch(1);
                List<Future<?>> futures = new ArrayList<>();
                for (int writer = 0; writer < writers; writer++) {
                    String fingerprint = "round-" + round + "-writer-" + writer;
                    futures.add(pool.submit(() -> {
                        start.await();
                        return cache.put(fingerprint, record(0.9));
                    }));
                }
                start.countDown();
                for (Future<?> future : futures) {
                    future.get(5, TimeUnit.SECONDS);
                }

                assertThat(cache.size()).isBetween(80L, 100L + writers);
                for (int writer = 0; writer < writers; writer++) {
                    assertThat(cache.get("round-" + round + "-writer-" + writer)).isPresent();
                }
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void clearRemovesEverything() {
        ResponseCache cache = new ResponseCache(Duration.ofHours(1), 1000, 0.8, 0.6, nanos::get);
        cache.put("a", record(0.9));
        cache.put("b", record(0.9));

        cache.clear();

        assertThat(cache.size()).isZero();
        assertThat(cache.get(null)).isEmpty();
    }

    @Test
    void validatesConfiguration() {
        assertThatThrownBy(() -> new ResponseCache(Duration.ZERO, 10, 0.8, 0.6, nanos::get))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ResponseCache(Duration.ofMinutes(1), 0, 0.8, 0.6, nanos::get))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ResponseCache(Duration.ofMinutes(1), 10, 1.5, 0.6, nanos::get))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static StructuredRecord record(double confidence) {
        return StructuredRecord.builder()
            .amount(new BigDecimal("50000"))
            .description("almuerzo")
            .category(Category.FOOD)
            .confidence(confidence)
            .origin(RecordOrigin.INFERENCE)
            .build();
    }
}
