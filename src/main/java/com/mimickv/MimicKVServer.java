package com.mimickv;

import com.mimickv.command.CommandRouter;
import com.mimickv.core.Database;
import com.mimickv.core.DatabaseRegistry;
import com.mimickv.core.VirtualClock;
import com.mimickv.network.TcpServer;
import com.mimickv.stream.Stream;
import com.mimickv.stream.StreamEntry;
import com.mimickv.stream.StreamEntryId;
import com.mimickv.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * MimicKV Server entry point.
 * Runs an in-memory, RESP-speaking test double with stream and consumer group
 * support. Can be started from the command line or embedded in tests, where
 * the direct helpers below prepare data and move the clock without a client.
 */
public class MimicKVServer {

    private static final Logger logger = LoggerFactory.getLogger(MimicKVServer.class);

    private static final int DEFAULT_PORT = 6379;
    private static final String VERSION = "1.0.0";

    private final DatabaseRegistry databases;
    private final VirtualClock clock;
    private final MetricsCollector metrics;
    private final CommandRouter router;
    private final TcpServer tcpServer;
    private final CountDownLatch shutdownLatch;

    /**
     * Create a server with the configured number of databases.
     *
     * @param port the port to listen on, 0 for any free port
     */
    public MimicKVServer(int port) {
        this(port, getConfiguredDatabases(), new MetricsCollector());
    }

    /**
     * Create a server with custom database count and metrics.
     *
     * @param port      the port to listen on, 0 for any free port
     * @param databases number of databases
     * @param metrics   the metrics collector to use
     */
    public MimicKVServer(int port, int databases, MetricsCollector metrics) {
        this.databases = new DatabaseRegistry(databases);
        this.clock = new VirtualClock();
        this.metrics = metrics;
        this.router = new CommandRouter(this.databases, clock, metrics);
        this.tcpServer = new TcpServer(port, router, metrics);
        this.shutdownLatch = new CountDownLatch(1);
    }

    /**
     * Get database count from environment/system property, or use default.
     * Checks: MIMICKV_DATABASES env var, mimickv.databases property
     */
    static int getConfiguredDatabases() {
        return readPositiveInt("MIMICKV_DATABASES", "mimickv.databases", DatabaseRegistry.DEFAULT_DATABASES);
    }

    /**
     * Get port from environment/system property, or use default.
     * Checks: MIMICKV_PORT env var, mimickv.port property
     */
    static int getConfiguredPort() {
        return readPositiveInt("MIMICKV_PORT", "mimickv.port", DEFAULT_PORT);
    }

    private static int readPositiveInt(String envKey, String propKey, int fallback) {
        String value = System.getenv(envKey);
        String source = envKey;
        if (value == null || value.isEmpty()) {
            value = System.getProperty(propKey);
            source = propKey;
        }
        if (value == null || value.isEmpty()) {
            return fallback;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed > 0) {
                logger.info("Using {}={}", source, parsed);
                return parsed;
            }
            logger.warn("Non-positive {} value: {}, using default {}", source, value, fallback);
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value: {}, using default {}", source, value, fallback);
        }
        return fallback;
    }

    /**
     * Start the server.
     */
    public void start() throws IOException {
        logger.info("Starting MimicKV Server v{} with {} databases", VERSION, databases.size());
        tcpServer.start();
        logger.info("MimicKV Server listening on port {}", tcpServer.getPort());
    }

    /**
     * Start the server and block until stopped.
     */
    public void startAndBlock() throws IOException, InterruptedException {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received");
            stop();
        }, "mimickv-shutdown"));
        start();
        shutdownLatch.await();
    }

    /**
     * Stop the server. Blocked clients are disconnected without a reply.
     */
    public void stop() {
        logger.info("Stopping MimicKV Server");
        tcpServer.stop();
        shutdownLatch.countDown();
        logger.info("MimicKV Server stopped");
    }

    // ==================== Embedded helpers ====================

    /**
     * Pin the server's notion of "now". Affects generated IDs and idle times,
     * not blocking deadlines.
     */
    public void setTime(Instant instant) {
        clock.setTime(instant);
    }

    /**
     * Move the pinned time forward.
     */
    public void fastForward(Duration duration) {
        clock.advance(duration);
    }

    /**
     * Append to a stream in database 0, waking blocked readers like XADD does.
     *
     * @return the new entry ID
     */
    public String xadd(String key, String id, String... fieldsValues) {
        return xadd(0, key, id, fieldsValues);
    }

    public String xadd(int db, String key, String id, String... fieldsValues) {
        Database database = databases.get(db);
        List<String> values = Arrays.asList(fieldsValues);
        return database.execute(() -> {
            Stream stream = database.getStream(key).orElse(null);
            boolean created = stream == null;
            if (created) {
                stream = new Stream();
            }
            StreamEntryId entryId = stream.add(id, values, clock.currentTimeMillis());
            if (created) {
                database.addStream(key, stream);
            } else {
                database.touch(key);
            }
            metrics.recordAppend();
            return entryId.toString();
        });
    }

    /**
     * All entries of a stream in database 0, oldest first. Empty if the key does not exist.
     */
    public List<StreamEntry> streamEntries(String key) {
        Database database = databases.get(0);
        return database.execute(() -> database.getStream(key)
                .map(stream -> stream.range(StreamEntryId.MIN, StreamEntryId.MAX, 0, false))
                .orElse(List.of()));
    }

    /**
     * Store a plain value in database 0.
     */
    public void set(String key, String value) {
        Database database = databases.get(0);
        database.execute(() -> {
            database.setString(key, value);
            return null;
        });
    }

    public void flushAll() {
        databases.flushAll();
    }

    /**
     * Check if the server is running.
     */
    public boolean isRunning() {
        return tcpServer.isRunning();
    }

    /**
     * Get the server port. After start this is the bound port.
     */
    public int getPort() {
        return tcpServer.getPort();
    }

    /**
     * host:port for clients.
     */
    public String getAddress() {
        return "localhost:" + getPort();
    }

    public DatabaseRegistry getDatabases() {
        return databases;
    }

    public VirtualClock getClock() {
        return clock;
    }

    public CommandRouter getRouter() {
        return router;
    }

    /**
     * Get the metrics collector.
     */
    public MetricsCollector getMetrics() {
        return metrics;
    }

    /**
     * Get the number of active connections.
     */
    public int getConnectionCount() {
        return tcpServer.getConnectionCount();
    }

    /**
     * Main entry point.
     */
    public static void main(String[] args) {
        int port = getConfiguredPort();
        int databases = getConfiguredDatabases();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--port":
                case "-p":
                    if (i + 1 >= args.length) {
                        exitWithError("--port requires a value");
                    }
                    port = parseOption(args[++i], "port");
                    if (port <= 0 || port > 65535) {
                        exitWithError("Port must be between 1 and 65535");
                    }
                    break;
                case "--databases":
                    if (i + 1 >= args.length) {
                        exitWithError("--databases requires a value");
                    }
                    databases = parseOption(args[++i], "database count");
                    if (databases <= 0) {
                        exitWithError("Database count must be positive");
                    }
                    break;
                case "--help":
                case "-h":
                    printHelp();
                    return;
                case "--version":
                case "-v":
                    System.out.println("MimicKV Server v" + VERSION);
                    return;
                default:
                    exitWithError("Unknown option: " + args[i]);
            }
        }

        printBanner();

        MimicKVServer server = new MimicKVServer(port, databases, new MetricsCollector());
        try {
            server.startAndBlock();
        } catch (IOException e) {
            logger.error("Failed to start server: {}", e.getMessage());
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static int parseOption(String value, String what) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            exitWithError("Invalid " + what + ": " + value);
            return -1;
        }
    }

    private static void printBanner() {
        System.out.println();
        System.out.println("  __  __ _           _      _  ____     __");
        System.out.println(" |  \\/  (_)_ __ ___ (_) ___| |/ /\\ \\   / /");
        System.out.println(" | |\\/| | | '_ ` _ \\| |/ __| ' /  \\ \\ / / ");
        System.out.println(" | |  | | | | | | | | | (__| . \\   \\ V /  ");
        System.out.println(" |_|  |_|_|_| |_| |_|_|\\___|_|\\_\\   \\_/   ");
        System.out.println();
        System.out.println("  In-memory Redis test double v" + VERSION);
        System.out.println();
    }

    private static void exitWithError(String message) {
        System.err.println("Error: " + message);
        System.err.println("Use --help for usage information");
        System.exit(1);
    }

    private static void printHelp() {
        System.out.println("MimicKV Server - In-memory Redis test double");
        System.out.println();
        System.out.println("Usage: mimickv [options]");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  -p, --port <port>            Port to listen on (default: 6379)");
        System.out.println("      --databases <n>          Number of databases (default: 16)");
        System.out.println("  -h, --help                   Show this help message");
        System.out.println("  -v, --version                Show version");
        System.out.println();
        System.out.println("Environment:");
        System.out.println("  MIMICKV_PORT, MIMICKV_DATABASES, MIMICKV_WORKER_THREADS, MIMICKV_MAX_BULK_LENGTH");
        System.out.println();
    }
}
