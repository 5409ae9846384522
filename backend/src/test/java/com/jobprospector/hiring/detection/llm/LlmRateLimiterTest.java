package com.jobprospector.hiring.detection.llm;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class LlmRateLimiterTest {

    @Test
    void concurrentCallersGetDistinctEvenlySpacedSlots() throws Exception {
        AtomicLong clock = new AtomicLong(1_000L);
        ConcurrentLinkedQueue<Long> waits = new ConcurrentLinkedQueue<>();
        LlmRateLimiter limiter = new LlmRateLimiter(60, clock::get, waits::add);
        long interval = TimeUnit.SECONDS.toNanos(1);

        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                limiter.acquire();
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(5, TimeUnit.SECONDS);
        }
        pool.shutdownNow();

        List<Long> sorted = new ArrayList<>(waits);
        sorted.sort(Long::compare);
        List<Long> expected = new ArrayList<>();
        for (int i = 1; i < callers; i++) {
            expected.add(i * interval);
        }
        assertThat(sorted).isEqualTo(expected);
    }

    @Test
    void idleLimiterGrantsImmediately() throws Exception {
        AtomicLong clock = new AtomicLong(0L);
        ConcurrentLinkedQueue<Long> waits = new ConcurrentLinkedQueue<>();
        LlmRateLimiter limiter = new LlmRateLimiter(60, clock::get, waits::add);

        limiter.acquire();
        clock.addAndGet(TimeUnit.SECONDS.toNanos(5));
        limiter.acquire();

        assertThat(waits).isEmpty();
    }

    @Test
    void realClockSpacesBackToBackCalls() throws Exception {
        LlmRateLimiter limiter = new LlmRateLimiter(1200, System::nanoTime, TimeUnit.NANOSECONDS::sleep);
        long startedAt = System.nanoTime();

        limiter.acquire();
        limiter.acquire();
        limiter.acquire();

        assertThat(System.nanoTime() - startedAt).isGreaterThanOrEqualTo(TimeUnit.MILLISECONDS.toNanos(100));
        assertThat(limiter.interval().toMillis()).isEqualTo(50);
    }
}
