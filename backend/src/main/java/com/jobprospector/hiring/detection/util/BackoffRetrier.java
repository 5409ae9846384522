package com.jobprospector.hiring.detection.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

public class BackoffRetrier {
    private static final Logger log = LoggerFactory.getLogger(BackoffRetrier.class);

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final int maxAttempts;
    private final double multiplier;
    private final long baseDelayMs;
    private final Sleeper sleeper;

    public BackoffRetrier(int maxAttempts, double multiplier, long baseDelayMs) {
        this(maxAttempts, multiplier, baseDelayMs, Thread::sleep);
    }

    public BackoffRetrier(int maxAttempts, double multiplier, long baseDelayMs, Sleeper sleeper) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.multiplier = Math.max(1.0, multiplier);
        this.baseDelayMs = Math.max(0, baseDelayMs);
        this.sleeper = sleeper;
    }

    public <T> T call(String label, Supplier<T> action) {
        RuntimeException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.get();
            } catch (RuntimeException e) {
                last = e;
                if (attempt == maxAttempts) {
                    break;
                }
                long delay = delayBeforeAttempt(attempt + 1);
                log.warn("Attempt {}/{} for {} failed ({}); retrying in {} ms",
                    attempt, maxAttempts, label, e.getMessage(), delay);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
        throw last;
    }

    public long delayBeforeAttempt(int attempt) {
        if (attempt <= 1) {
            return 0;
        }
        return (long) (baseDelayMs * Math.pow(multiplier, attempt - 2));
    }

    public int maxAttempts() {
        return maxAttempts;
    }
}
