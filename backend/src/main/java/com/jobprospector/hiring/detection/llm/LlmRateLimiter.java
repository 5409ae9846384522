package com.jobprospector.hiring.detection.llm;

import com.jobprospector.hiring.config.HiringProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Process-wide spacing of model calls. Each caller reserves the next free slot under the lock
 * and then sleeps outside it, so grants are at least {@code 60 / rpm} seconds apart no matter how
 * many threads arrive together.
 */
@Component
public class LlmRateLimiter {

    @FunctionalInterface
    interface Sleeper {
        void sleepNanos(long nanos) throws InterruptedException;
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final long intervalNanos;
    private final LongSupplier clock;
    private final Sleeper sleeper;
    private long nextGrantNanos;
    private boolean granted;

    @Autowired
    public LlmRateLimiter(HiringProperties properties) {
        this(properties.getLlm().getRateLimitRpm(), System::nanoTime, TimeUnit.NANOSECONDS::sleep);
    }

    LlmRateLimiter(int requestsPerMinute, LongSupplier clock, Sleeper sleeper) {
        int rpm = Math.max(1, requestsPerMinute);
        this.intervalNanos = TimeUnit.MINUTES.toNanos(1) / rpm;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public void acquire() throws InterruptedException {
        long waitNanos;
        lock.lock();
        try {
            long now = clock.getAsLong();
            long grantAt = !granted || nextGrantNanos <= now ? now : nextGrantNanos;
            granted = true;
            nextGrantNanos = grantAt + intervalNanos;
            waitNanos = grantAt - now;
        } finally {
            lock.unlock();
        }
        if (waitNanos > 0) {
            sleeper.sleepNanos(waitNanos);
        }
    }

    public Duration interval() {
        return Duration.ofNanos(intervalNanos);
    }
}
