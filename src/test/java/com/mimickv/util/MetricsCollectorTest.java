package com.mimickv.util;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class MetricsCollectorTest {

    private MetricsCollector metrics;

    @BeforeEach
    void setUp() {
        metrics = new MetricsCollector();
    }

    @Test
    void recordCommand_countsPerCommand() {
        metrics.recordCommand("XADD", 1000L);
        metrics.recordCommand("xadd", 1000L);
        metrics.recordCommand("XLEN", 1000L);

        assertThat(metrics.getCommandCount("XADD")).isEqualTo(2);
        assertThat(metrics.getCommandCount("xlen")).isEqualTo(1);
        assertThat(metrics.getCommandCount("XACK")).isZero();
        assertThat(metrics.getTotalCommands()).isEqualTo(3);
    }

    @Test
    void recordCommand_tracksLatency() {
        metrics.recordCommand("XADD", TimeUnit.MILLISECONDS.toNanos(1));
        metrics.recordCommand("XADD", TimeUnit.MILLISECONDS.toNanos(3));

        double mean = metrics.getMeanLatencyMs("XADD");
        assertThat(mean).isGreaterThan(1.5);
        assertThat(mean).isLessThan(2.5);
        assertThat(metrics.getMeanLatencyMs("XREAD")).isZero();
    }

    @Test
    void recordError_incrementsCounter() {
        metrics.recordError();
        metrics.recordError();

        assertThat(metrics.getTotalErrors()).isEqualTo(2);
    }

    @Test
    void streamCounters_trackAppendsAndAcks() {
        metrics.recordAppend();
        metrics.recordAppend();
        metrics.recordAcks(3);
        metrics.recordAcks(0);

        assertThat(metrics.getEntriesAppended()).isEqualTo(2);
        assertThat(metrics.getTotalAcks()).isEqualTo(3);
    }

    @Test
    void connectionTracking_incrementsAndDecrements() {
        metrics.connectionOpened();
        metrics.connectionOpened();
        assertThat(metrics.getActiveConnections()).isEqualTo(2);

        metrics.connectionClosed();
        assertThat(metrics.getActiveConnections()).isEqualTo(1);
    }

    @Test
    void blockedClients_gaugeFollowsCounts() {
        metrics.blockedClientAdded();
        metrics.blockedClientAdded();
        metrics.blockedClientRemoved();

        assertThat(metrics.getBlockedClients()).isEqualTo(1);
        assertThat(metrics.getRegistry().find("mimickv.blocked.clients").gauge().value()).isEqualTo(1.0);
    }

    @Test
    void customRegistry_isUsed() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MetricsCollector custom = new MetricsCollector(registry);

        custom.recordCommand("XACK", 10L);

        assertThat(registry.find("mimickv.commands").tag("command", "xack").counter()).isNotNull();
        assertThat(registry.find("mimickv.latency").tag("command", "xack").timer()).isNotNull();
        assertThat(registry.find("mimickv.stream.entries.appended").counter()).isNotNull();
    }

    @Test
    void summary_includesStreamMetrics() {
        metrics.recordCommand("XADD", 1000L);
        metrics.recordAppend();
        metrics.recordError();
        metrics.connectionOpened();

        String summary = metrics.summary();

        assertThat(summary).contains("XADD=1");
        assertThat(summary).contains("appended=1");
        assertThat(summary).contains("Errors: 1");
        assertThat(summary).contains("Connections: 1");
    }
}
