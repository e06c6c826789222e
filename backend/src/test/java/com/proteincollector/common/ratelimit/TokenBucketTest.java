package com.proteincollector.common.ratelimit;

import com.proteincollector.common.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenBucketTest {

    private final MutableClock clock = MutableClock.startingAt("2024-01-01T00:00:00Z");

    @Test
    @DisplayName("bucket starts full with capacity twice the rate")
    void startsFull() {
        TokenBucket bucket = new TokenBucket(5.0, clock);

        assertThat(bucket.getCapacity()).isEqualTo(10);
        assertThat(bucket.getCurrentTokens()).isEqualTo(10.0);
    }

    @Test
    @DisplayName("capacity is at least one token for slow rates")
    void capacityAtLeastOne() {
        assertThat(new TokenBucket(0.3, clock).getCapacity()).isEqualTo(1);
    }

    @Test
    @DisplayName("acquire is free while tokens remain, then returns time until the missing token refills")
    void acquireReturnsWaitWhenEmpty() {
        TokenBucket bucket = new TokenBucket(2.0, clock);

        for (int i = 0; i < 4; i++) {
            assertThat(bucket.acquire(1)).isZero();
        }
        assertThat(bucket.acquire(1)).isEqualTo(Duration.ofMillis(500));
        assertThat(bucket.getTokens()).isZero();
    }

    @Test
    @DisplayName("multi-token acquire waits for the shortfall only")
    void multiTokenShortfall() {
        TokenBucket bucket = new TokenBucket(2.0, clock);
        bucket.acquire(3);

        assertThat(bucket.acquire(3)).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("tokens refill with elapsed time up to capacity")
    void refillCappedAtCapacity() {
        TokenBucket bucket = new TokenBucket(2.0, clock);
        bucket.acquire(4);

        clock.advance(Duration.ofSeconds(1));
        assertThat(bucket.getCurrentTokens()).isEqualTo(2.0);

        clock.advance(Duration.ofSeconds(10));
        assertThat(bucket.getCurrentTokens()).isEqualTo(4.0);
        assertThat(bucket.acquire(4)).isZero();
    }

    @Test
    @DisplayName("constructor and acquire reject non-positive values")
    void rejectsNonPositive() {
        assertThatThrownBy(() -> new TokenBucket(0, clock))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("positive");
        assertThatThrownBy(() -> new TokenBucket(1.0, clock).acquire(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("concurrent acquires keep the balance within [0, capacity]")
    void concurrentAcquireNeverNegative() throws InterruptedException {
        TokenBucket bucket = new TokenBucket(50.0, Clock.systemUTC());
        int threads = 8;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        List<Double> observed = new CopyOnWriteArrayList<>();
        for (int t = 0; t < threads; t++) {
            new Thread(() -> {
                try {
                    start.await();
                    for (int i = 0; i < 200; i++) {
                        bucket.acquire(1 + i % 3);
                        observed.add(bucket.getTokens());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            }).start();
        }
        start.countDown();

        assertThat(done.await(30, TimeUnit.SECONDS)).isTrue();
        assertThat(observed).hasSize(threads * 200)
                .allSatisfy(tokens -> assertThat(tokens).isBetween(0.0, (double) bucket.getCapacity()));
    }
}
