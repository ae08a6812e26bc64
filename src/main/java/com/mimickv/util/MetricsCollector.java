package com.mimickv.util;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * Metrics collector for MimicKV.
 * Tracks command throughput and latency, errors, connections and blocked readers.
 */
public class MetricsCollector {

    private final MeterRegistry registry;

    // Per-command meters, registered on first use
    private final Map<String, Counter> commandCounters = new ConcurrentHashMap<>();
    private final Map<String, Timer> commandTimers = new ConcurrentHashMap<>();

    private final Counter errors;
    private final Counter entriesAppended;
    private final Counter acks;

    // Gauges
    private final LongAdder activeConnections;
    private final LongAdder blockedClients;

    /**
     * Create a metrics collector with a simple registry.
     */
    public MetricsCollector() {
        this(new SimpleMeterRegistry());
    }

    /**
     * Create a metrics collector with a custom registry.
     *
     * @param registry the Micrometer registry to use
     */
    public MetricsCollector(MeterRegistry registry) {
        this.registry = registry;

        this.errors = Counter.builder("mimickv.errors")
            .description("Commands answered with an error")
            .register(registry);

        this.entriesAppended = Counter.builder("mimickv.stream.entries.appended")
            .description("Entries appended to streams")
            .register(registry);

        this.acks = Counter.builder("mimickv.stream.acks")
            .description("Pending entries acknowledged")
            .register(registry);

        this.activeConnections = new LongAdder();
        this.blockedClients = new LongAdder();

        Gauge.builder("mimickv.connections", activeConnections, LongAdder::sum)
            .description("Active connections")
            .register(registry);

        Gauge.builder("mimickv.blocked.clients", blockedClients, LongAdder::sum)
            .description("Clients waiting in a blocking read")
            .register(registry);
    }

    // Command recording

    public void recordCommand(String command, long durationNanos) {
        String name = command.toLowerCase(Locale.ROOT);
        commandCounters.computeIfAbsent(name, n -> Counter.builder("mimickv.commands")
            .tag("command", n)
            .description("Commands executed")
            .register(registry)).increment();
        commandTimers.computeIfAbsent(name, n -> Timer.builder("mimickv.latency")
            .tag("command", n)
            .description("Command latency")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry)).record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordError() {
        errors.increment();
    }

    public void recordAppend() {
        entriesAppended.increment();
    }

    public void recordAcks(int count) {
        if (count > 0) {
            acks.increment(count);
        }
    }

    // Connection tracking

    public void connectionOpened() {
        activeConnections.increment();
    }

    public void connectionClosed() {
        activeConnections.decrement();
    }

    // Blocked reader tracking

    public void blockedClientAdded() {
        blockedClients.increment();
    }

    public void blockedClientRemoved() {
        blockedClients.decrement();
    }

    // Getters for metrics values

    public long getCommandCount(String command) {
        Counter counter = commandCounters.get(command.toLowerCase(Locale.ROOT));
        return counter != null ? (long) counter.count() : 0;
    }

    public long getTotalCommands() {
        long total = 0;
        for (Counter counter : commandCounters.values()) {
            total += (long) counter.count();
        }
        return total;
    }

    public long getTotalErrors() {
        return (long) errors.count();
    }

    public long getEntriesAppended() {
        return (long) entriesAppended.count();
    }

    public long getTotalAcks() {
        return (long) acks.count();
    }

    public long getActiveConnections() {
        return activeConnections.sum();
    }

    public long getBlockedClients() {
        return blockedClients.sum();
    }

    public double getMeanLatencyMs(String command) {
        Timer timer = commandTimers.get(command.toLowerCase(Locale.ROOT));
        return timer != null ? timer.mean(TimeUnit.MILLISECONDS) : 0.0;
    }

    /**
     * Get the underlying registry.
     *
     * @return the MeterRegistry
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * Print a summary of current metrics.
     *
     * @return formatted metrics string
     */
    public String summary() {
        return String.format(
            "MimicKV Metrics Summary%n" +
            "=======================%n" +
            "Commands: %d total, XADD=%d, XREADGROUP=%d, XACK=%d%n" +
            "Streams: appended=%d, acked=%d%n" +
            "Errors: %d%n" +
            "Connections: %d active, %d blocked%n" +
            "Latency (mean): XADD=%.3fms, XREADGROUP=%.3fms",
            getTotalCommands(), getCommandCount("xadd"), getCommandCount("xreadgroup"), getCommandCount("xack"),
            getEntriesAppended(), getTotalAcks(),
            getTotalErrors(),
            getActiveConnections(), getBlockedClients(),
            getMeanLatencyMs("xadd"), getMeanLatencyMs("xreadgroup")
        );
    }
}
