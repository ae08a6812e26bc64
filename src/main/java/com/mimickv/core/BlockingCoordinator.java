package com.mimickv.core;

import com.mimickv.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Runs a read until it succeeds, its deadline passes, or the client goes away.
 * <p>
 * The read is attempted with the database lock held. Between attempts the
 * caller sleeps on the database's change condition with the lock released and
 * is woken by any mutation, by its deadline, or by cancellation. Deadlines use
 * the clock's monotonic timer, never the (possibly pinned) business time.
 */
public class BlockingCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(BlockingCoordinator.class);

    private final Clock clock;
    private final MetricsCollector metrics;

    public BlockingCoordinator(Clock clock, MetricsCollector metrics) {
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Block on a read.
     *
     * @param db           database whose changes wake the reader
     * @param timeout      how long to wait; {@link Duration#ZERO} waits forever
     * @param cancellation fires when the client connection closes
     * @param read         the read attempt
     * @param onTimeout    produces the result when the deadline passes
     * @return the read's or the timeout's result, or empty if cancelled
     */
    public <T> Optional<T> await(Database db, Duration timeout, Cancellation cancellation,
                                 BlockingRead<T> read, Supplier<T> onTimeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout must be non-negative");
        }
        db.lock();
        try {
            Optional<T> result = read.tryRead();
            if (result.isPresent() || cancellation.isCancelled()) {
                return result;
            }
            boolean forever = timeout.isZero();
            long deadline = forever ? 0 : clock.nanoTime() + timeout.toNanos();
            metrics.blockedClientAdded();
            logger.debug("Blocking read on db {} (timeout {}ms)", db.getIndex(), timeout.toMillis());
            try (Cancellation.Registration ignored = cancellation.onCancel(db::signalAll)) {
                while (true) {
                    // a close that raced the registration has already signalled
                    if (cancellation.isCancelled()) {
                        logger.debug("Blocking read on db {} cancelled", db.getIndex());
                        return Optional.empty();
                    }
                    if (forever) {
                        db.awaitChange();
                    } else {
                        long remaining = deadline - clock.nanoTime();
                        if (remaining > 0) {
                            db.awaitChange(remaining);
                        }
                    }
                    if (cancellation.isCancelled()) {
                        logger.debug("Blocking read on db {} cancelled", db.getIndex());
                        return Optional.empty();
                    }
                    if (!forever && clock.nanoTime() - deadline >= 0) {
                        return Optional.of(onTimeout.get());
                    }
                    result = read.tryRead();
                    if (result.isPresent()) {
                        return result;
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.debug("Blocking read on db {} interrupted", db.getIndex());
                return Optional.empty();
            } finally {
                metrics.blockedClientRemoved();
            }
        } finally {
            db.unlock();
        }
    }
}
