package com.mimickv.core;

import com.mimickv.command.ClientContext;
import com.mimickv.stream.Stream;
import com.mimickv.stream.StreamEntry;
import com.mimickv.stream.StreamEntryId;
import com.mimickv.util.MetricsCollector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class BlockingCoordinatorTest {

    private VirtualClock clock;
    private MetricsCollector metrics;
    private BlockingCoordinator coordinator;
    private Database db;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        clock = new VirtualClock();
        metrics = new MetricsCollector();
        coordinator = new BlockingCoordinator(clock, metrics);
        db = new Database(0);
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private BlockingRead<List<StreamEntry>> entriesAfterZero() {
        return () -> db.getStream("s")
            .map(stream -> stream.after(StreamEntryId.MIN, 0))
            .filter(entries -> !entries.isEmpty());
    }

    private void append(String id) {
        db.execute(() -> db.getOrCreateStream("s").add(id, List.of("f", "v"), 0));
    }

    private void awaitBlocked() throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (metrics.getBlockedClients() == 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        assertThat(metrics.getBlockedClients()).isEqualTo(1);
    }

    @Test
    void await_readSucceedsImmediately_doesNotBlock() {
        append("1-0");

        Optional<List<StreamEntry>> result = coordinator.await(db, Duration.ZERO, Cancellation.NONE,
            entriesAfterZero(), List::of);

        assertThat(result).isPresent();
        assertThat(result.get()).hasSize(1);
        assertThat(metrics.getBlockedClients()).isZero();
    }

    @Test
    void await_timeout_returnsTimeoutValue() {
        long start = System.nanoTime();

        Optional<List<StreamEntry>> result = coordinator.await(db, Duration.ofMillis(100), Cancellation.NONE,
            entriesAfterZero(), List::of);

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        assertThat(result).contains(List.of());
        assertThat(elapsedMs).isGreaterThanOrEqualTo(90);
        assertThat(metrics.getBlockedClients()).isZero();
    }

    @Test
    void await_timeoutIgnoresPinnedBusinessTime() {
        clock.setTime(Instant.ofEpochMilli(0));
        Future<Optional<List<StreamEntry>>> future = executor.submit(() ->
            coordinator.await(db, Duration.ofMillis(150), Cancellation.NONE, entriesAfterZero(), List::of));

        clock.advance(Duration.ofDays(1));

        assertThat(future).succeedsWithin(Duration.ofSeconds(5)).isEqualTo(Optional.of(List.of()));
    }

    @Test
    void await_wokenByAppend() throws Exception {
        Future<Optional<List<StreamEntry>>> future = executor.submit(() ->
            coordinator.await(db, Duration.ZERO, Cancellation.NONE, entriesAfterZero(), List::of));
        awaitBlocked();

        append("7-0");

        Optional<List<StreamEntry>> result = future.get(5, TimeUnit.SECONDS);
        assertThat(result).isPresent();
        assertThat(result.get()).extracting(e -> e.getId().toString()).containsExactly("7-0");
        assertThat(metrics.getBlockedClients()).isZero();
    }

    @Test
    void await_unrelatedChange_keepsWaiting() throws Exception {
        Future<Optional<List<StreamEntry>>> future = executor.submit(() ->
            coordinator.await(db, Duration.ZERO, Cancellation.NONE, entriesAfterZero(), List::of));
        awaitBlocked();

        db.execute(() -> {
            db.setString("other", "x");
            return null;
        });
        Thread.sleep(50);

        assertThat(future).isNotDone();
        append("1-0");
        assertThat(future.get(5, TimeUnit.SECONDS)).isPresent();
    }

    @Test
    void await_cancelled_returnsEmpty() throws Exception {
        ClientContext client = new ClientContext("test");
        Future<Optional<List<StreamEntry>>> future = executor.submit(() ->
            coordinator.await(db, Duration.ZERO, client, entriesAfterZero(), List::of));
        awaitBlocked();

        client.close();

        assertThat(future.get(5, TimeUnit.SECONDS)).isEmpty();
        assertThat(metrics.getBlockedClients()).isZero();
    }

    @Test
    void await_alreadyCancelled_returnsEmptyWithoutBlocking() {
        ClientContext client = new ClientContext("test");
        client.close();

        Optional<List<StreamEntry>> result = coordinator.await(db, Duration.ZERO, client,
            entriesAfterZero(), List::of);

        assertThat(result).isEmpty();
    }

    @Test
    void await_cancelledWhileRegistering_returnsEmpty() throws Exception {
        // closes between the first read and listener registration
        Cancellation closesDuringRegistration = new Cancellation() {
            private volatile boolean cancelled;

            @Override
            public boolean isCancelled() {
                return cancelled;
            }

            @Override
            public Registration onCancel(Runnable listener) {
                cancelled = true;
                listener.run();
                return () -> { };
            }
        };

        Future<Optional<List<StreamEntry>>> future = executor.submit(() ->
            coordinator.await(db, Duration.ZERO, closesDuringRegistration, entriesAfterZero(), List::of));

        assertThat(future.get(5, TimeUnit.SECONDS)).isEmpty();
        assertThat(metrics.getBlockedClients()).isZero();
    }

    @Test
    void await_negativeTimeout_throws() {
        assertThatThrownBy(() -> coordinator.await(db, Duration.ofMillis(-1), Cancellation.NONE,
            entriesAfterZero(), List::of))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void await_manyReaders_allWoken() throws Exception {
        Future<Optional<List<StreamEntry>>> first = executor.submit(() ->
            coordinator.await(db, Duration.ZERO, Cancellation.NONE, entriesAfterZero(), List::of));
        Future<Optional<List<StreamEntry>>> second = executor.submit(() ->
            coordinator.await(db, Duration.ZERO, Cancellation.NONE, entriesAfterZero(), List::of));
        long deadline = System.currentTimeMillis() + 5000;
        while (metrics.getBlockedClients() < 2 && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }

        append("1-0");

        assertThat(first.get(5, TimeUnit.SECONDS)).isPresent();
        assertThat(second.get(5, TimeUnit.SECONDS)).isPresent();
        Stream stream = db.execute(() -> db.getStream("s").orElseThrow());
        assertThat(stream.size()).isEqualTo(1);
    }
}
