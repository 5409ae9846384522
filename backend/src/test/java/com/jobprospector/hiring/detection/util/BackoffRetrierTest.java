package com.jobprospector.hiring.detection.util;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffRetrierTest {

    @Test
    void retriesWithExponentialPauses() {
        List<Long> pauses = new ArrayList<>();
        BackoffRetrier retrier = new BackoffRetrier(3, 2.0, 1000, pauses::add);
        AtomicInteger calls = new AtomicInteger();

        String value = retrier.call("acme", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("flaky");
            }
            return "ok";
        });

        assertThat(value).isEqualTo("ok");
        assertThat(calls).hasValue(3);
        assertThat(pauses).containsExactly(1000L, 2000L);
    }

    @Test
    void rethrowsLastFailureWhenAttemptsRunOut() {
        List<Long> pauses = new ArrayList<>();
        BackoffRetrier retrier = new BackoffRetrier(3, 2.0, 1000, pauses::add);
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retrier.call("acme", () -> {
            throw new IllegalStateException("attempt " + calls.incrementAndGet());
        }))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("attempt 3");
        assertThat(pauses).hasSize(2);
    }

    @Test
    void firstSuccessDoesNotSleep() {
        List<Long> pauses = new ArrayList<>();
        BackoffRetrier retrier = new BackoffRetrier(3, 2.0, 1000, pauses::add);

        assertThat(retrier.call("acme", () -> 42)).isEqualTo(42);
        assertThat(pauses).isEmpty();
    }

    @Test
    void delayScheduleStartsAtBase() {
        BackoffRetrier retrier = new BackoffRetrier(4, 2.0, 1000);

        assertThat(retrier.delayBeforeAttempt(1)).isZero();
        assertThat(retrier.delayBeforeAttempt(2)).isEqualTo(1000);
        assertThat(retrier.delayBeforeAttempt(3)).isEqualTo(2000);
        assertThat(retrier.delayBeforeAttempt(4)).isEqualTo(4000);
    }
}
