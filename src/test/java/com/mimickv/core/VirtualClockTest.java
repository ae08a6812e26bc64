package com.mimickv.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class VirtualClockTest {

    private VirtualClock clock;

    @BeforeEach
    void setUp() {
        clock = new VirtualClock();
    }

    @Test
    void unpinned_followsWallClock() {
        long before = System.currentTimeMillis();
        long now = clock.currentTimeMillis();
        long after = System.currentTimeMillis();

        assertThat(clock.isPinned()).isFalse();
        assertThat(now).isBetween(before, after);
    }

    @Test
    void setTime_pinsBusinessTime() throws InterruptedException {
        clock.setTime(Instant.ofEpochMilli(1_000_000));
        Thread.sleep(5);

        assertThat(clock.isPinned()).isTrue();
        assertThat(clock.currentTimeMillis()).isEqualTo(1_000_000);
    }

    @Test
    void advance_movesPinnedTime() {
        clock.setTime(Instant.ofEpochMilli(5_000));

        clock.advance(Duration.ofSeconds(3));

        assertThat(clock.currentTimeMillis()).isEqualTo(8_000);
    }

    @Test
    void advance_unpinned_pinsAtWallTimePlusDuration() {
        long before = System.currentTimeMillis();

        clock.advance(Duration.ofHours(1));

        assertThat(clock.isPinned()).isTrue();
        assertThat(clock.currentTimeMillis()).isGreaterThanOrEqualTo(before + 3_600_000);
    }

    @Test
    void advance_negative_throws() {
        assertThatThrownBy(() -> clock.advance(Duration.ofMillis(-1)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void setTime_null_throws() {
        assertThatThrownBy(() -> clock.setTime(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void reset_returnsToWallClock() {
        clock.setTime(Instant.ofEpochMilli(1));

        clock.reset();

        assertThat(clock.isPinned()).isFalse();
        assertThat(clock.currentTimeMillis()).isGreaterThan(1);
    }

    @Test
    void nanoTime_ignoresPinnedTime() {
        clock.setTime(Instant.ofEpochMilli(0));
        long first = clock.nanoTime();
        clock.advance(Duration.ofDays(1));
        long second = clock.nanoTime();

        assertThat(second - first).isLessThan(Duration.ofHours(1).toNanos());
    }

    @Test
    void setTimeAndReset_waitForAnAdvanceInProgress() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            CompletableFuture<Void> pin;
            synchronized (clock) {
                // same monitor advance() holds for its read-modify-write
                pin = CompletableFuture.runAsync(() -> clock.setTime(Instant.ofEpochMilli(42)), executor);
                Thread.sleep(100);
                assertThat(pin).isNotDone();
                assertThat(clock.isPinned()).isFalse();
            }
            pin.get(5, TimeUnit.SECONDS);
            assertThat(clock.currentTimeMillis()).isEqualTo(42);

            CompletableFuture<Void> unpin;
            synchronized (clock) {
                unpin = CompletableFuture.runAsync(clock::reset, executor);
                Thread.sleep(100);
                assertThat(unpin).isNotDone();
                assertThat(clock.isPinned()).isTrue();
            }
            unpin.get(5, TimeUnit.SECONDS);
            assertThat(clock.isPinned()).isFalse();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void advance_concurrentCallers_loseNoTime() throws Exception {
        clock.setTime(Instant.ofEpochMilli(0));
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            CompletableFuture<?>[] tasks = new CompletableFuture<?>[4];
            for (int t = 0; t < tasks.length; t++) {
                tasks[t] = CompletableFuture.runAsync(() -> {
                    for (int i = 0; i < 1000; i++) {
                        clock.advance(Duration.ofMillis(1));
                    }
                }, executor);
            }
            CompletableFuture.allOf(tasks).get(10, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        assertThat(clock.currentTimeMillis()).isEqualTo(4000);
    }
}
