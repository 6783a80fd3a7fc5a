package com.streamfirst.feedrelay.application;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class BoundedRetryTest {

    private final RecordingSleeper sleeper = new RecordingSleeper();
    private final BoundedRetry retry = BoundedRetry.defaults(sleeper);

    @Test
    void stops_at_first_success() throws InterruptedException {
        AtomicInteger attempts = new AtomicInteger();

        boolean result = retry.call(() -> attempts.incrementAndGet() == 2, Boolean::booleanValue);

        assertThat(result).isTrue();
        assertThat(attempts).hasValue(2);
        assertThat(sleeper.pauses()).containsExactly(Duration.ofSeconds(1));
    }

    @Test
    void returns_last_result_after_all_attempts() throws InterruptedException {
        AtomicInteger attempts = new AtomicInteger();

        int result = retry.call(attempts::incrementAndGet, value -> value > 10);

        assertThat(result).isEqualTo(3);
        assertThat(sleeper.pauses()).hasSize(2);
    }

    @Test
    void at_least_one_attempt_is_made() throws InterruptedException {
        BoundedRetry single = new BoundedRetry(0, Duration.ofSeconds(1), sleeper);
        AtomicInteger attempts = new AtomicInteger();

        single.call(attempts::incrementAndGet, value -> false);

        assertThat(attempts).hasValue(1);
        assertThat(sleeper.pauses()).isEmpty();
    }
}
