package com.mimickv.network;

import com.mimickv.command.CommandRouter;
import com.mimickv.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.channels.*;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * NIO-based TCP server for MimicKV.
 * Uses a single-threaded selector event loop for accepting connections and I/O,
 * with a worker pool for command execution. Blocking reads park a worker, so
 * the pool grows beyond its core size instead of queueing behind them.
 */
public class TcpServer {

    private static final Logger logger = LoggerFactory.getLogger(TcpServer.class);
    private static final int DEFAULT_WORKER_THREADS = Math.max(4, Runtime.getRuntime().availableProcessors());

    /**
     * Get core worker thread count from environment/system property, or use default.
     * Checks: MIMICKV_WORKER_THREADS env var, mimickv.worker.threads property
     */
    private static int getConfiguredWorkerThreads() {
        String envValue = System.getenv("MIMICKV_WORKER_THREADS");
        if (envValue != null && !envValue.isEmpty()) {
            try {
                int threads = Integer.parseInt(envValue.trim());
                if (threads > 0) {
                    logger.info("Using MIMICKV_WORKER_THREADS={}", threads);
                    return threads;
                }
            } catch (NumberFormatException e) {
                logger.warn("Invalid MIMICKV_WORKER_THREADS value: {}, using default", envValue);
            }
        }

        String propValue = System.getProperty("mimickv.worker.threads");
        if (propValue != null && !propValue.isEmpty()) {
            try {
                int threads = Integer.parseInt(propValue.trim());
                if (threads > 0) {
                    logger.info("Using mimickv.worker.threads={}", threads);
                    return threads;
                }
            } catch (NumberFormatException e) {
                logger.warn("Invalid mimickv.worker.threads value: {}, using default", propValue);
            }
        }

        return DEFAULT_WORKER_THREADS;
    }

    private final int requestedPort;
    private final CommandRouter router;
    private final MetricsCollector metrics;
    private final AtomicBoolean running;
    private final Map<SocketChannel, ConnectionHandler> connections;
    private final ExecutorService workerPool;

    private volatile int boundPort;
    private Selector selector;
    private ServerSocketChannel serverChannel;
    private Thread serverThread;

    /**
     * Create a new TCP server.
     *
     * @param port    the port to listen on, 0 for any free port
     * @param router  the command table
     * @param metrics the metrics collector
     */
    public TcpServer(int port, CommandRouter router, MetricsCollector metrics) {
        this.requestedPort = port;
        this.boundPort = port;
        this.router = router;
        this.metrics = metrics;
        this.running = new AtomicBoolean(false);
        this.connections = new ConcurrentHashMap<>();
        int workerThreads = getConfiguredWorkerThreads();
        AtomicInteger threadIds = new AtomicInteger();
        ThreadPoolExecutor pool = new ThreadPoolExecutor(
                workerThreads,
                Integer.MAX_VALUE,
                60L,
                TimeUnit.SECONDS,
                new SynchronousQueue<>(),
                r -> {
                    Thread t = new Thread(r, "mimickv-worker-" + threadIds.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
        this.workerPool = pool;
        logger.info("Initialized worker pool with {} core threads", workerThreads);
    }

    /**
     * Start the server.
     *
     * @throws IOException if the server cannot be started
     */
    public void start() throws IOException {
        if (running.getAndSet(true)) {
            throw new IllegalStateException("Server already running");
        }
        bind();

        serverThread = new Thread(this::eventLoop, "mimickv-server-" + boundPort);
        serverThread.start();

        logger.info("MimicKV server started on port {}", boundPort);
    }

    /**
     * Start the server and block until it's stopped.
     *
     * @throws IOException if the server cannot be started
     */
    public void startAndBlock() throws IOException {
        if (running.getAndSet(true)) {
            throw new IllegalStateException("Server already running");
        }
        bind();

        logger.info("MimicKV server started on port {}", boundPort);
        eventLoop();
    }

    private void bind() throws IOException {
        try {
            selector = Selector.open();
            serverChannel = ServerSocketChannel.open();
            serverChannel.configureBlocking(false);
            serverChannel.socket().setReuseAddress(true);
            serverChannel.bind(new InetSocketAddress(requestedPort));
            serverChannel.register(selector, SelectionKey.OP_ACCEPT);
            boundPort = ((InetSocketAddress) serverChannel.getLocalAddress()).getPort();
        } catch (IOException e) {
            running.set(false);
            cleanup();
            throw e;
        }
    }

    private void eventLoop() {
        while (running.get()) {
            try {
                int ready = selector.select(1000); // 1 second timeout for clean shutdown

                if (ready == 0) {
                    continue;
                }

                Iterator<SelectionKey> keys = selector.selectedKeys().iterator();
                while (keys.hasNext()) {
                    SelectionKey key = keys.next();
                    keys.remove();

                    if (!key.isValid()) {
                        continue;
                    }

                    try {
                        if (key.isAcceptable()) {
                            accept();
                        }
                        if (key.isValid() && key.isReadable()) {
                            read(key);
                        }
                        if (key.isValid() && key.isWritable()) {
                            write(key);
                        }
                    } catch (CancelledKeyException e) {
                        logger.trace("Key cancelled during dispatch: {}", key.channel());
                    } catch (IOException | RuntimeException e) {
                        logger.error("Error handling connection {}: {}", key.channel(), e.getMessage(), e);
                        ConnectionHandler handler = (ConnectionHandler) key.attachment();
                        if (handler != null) {
                            closeConnection(key, handler);
                        } else {
                            key.cancel();
                        }
                    }
                }
            } catch (IOException e) {
                if (running.get()) {
                    logger.error("Selector error: {}", e.getMessage());
                }
            }
        }

        cleanup();
    }

    private void accept() throws IOException {
        SocketChannel clientChannel = serverChannel.accept();
        if (clientChannel == null) {
            return;
        }

        clientChannel.configureBlocking(false);
        clientChannel.socket().setTcpNoDelay(true);
        clientChannel.socket().setKeepAlive(true);

        ConnectionHandler handler = new ConnectionHandler(clientChannel, router, metrics, this, workerPool, selector);
        connections.put(clientChannel, handler);

        clientChannel.register(selector, SelectionKey.OP_READ, handler);

        logger.debug("Accepted connection from {}", handler.getRemoteAddress());
    }

    private void read(SelectionKey key) {
        ConnectionHandler handler = (ConnectionHandler) key.attachment();
        if (handler == null) {
            key.cancel();
            return;
        }

        if (!handler.handleRead(key)) {
            closeConnection(key, handler);
        }
    }

    private void write(SelectionKey key) {
        ConnectionHandler handler = (ConnectionHandler) key.attachment();
        if (handler == null) {
            key.cancel();
            return;
        }

        if (!handler.handleWrite(key)) {
            closeConnection(key, handler);
        }
    }

    private void closeConnection(SelectionKey key, ConnectionHandler handler) {
        key.cancel();
        SocketChannel channel = (SocketChannel) key.channel();
        connections.remove(channel);
        handler.close();
    }

    /**
     * Stop the server.
     */
    public void stop() {
        if (!running.getAndSet(false)) {
            return;
        }

        logger.info("Stopping MimicKV server on port {}", boundPort);

        if (selector != null) {
            selector.wakeup();
        }

        if (serverThread != null && serverThread != Thread.currentThread()) {
            try {
                serverThread.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void cleanup() {
        // Close connections first so blocked reads release their workers
        for (ConnectionHandler handler : new ArrayList<>(connections.values())) {
            handler.close();
        }
        connections.clear();

        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(5, TimeUnit.SECONDS)) {
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }

        if (serverChannel != null) {
            try {
                serverChannel.close();
            } catch (IOException e) {
                logger.debug("Error closing server channel: {}", e.getMessage());
            }
        }

        if (selector != null) {
            try {
                selector.close();
            } catch (IOException e) {
                logger.debug("Error closing selector: {}", e.getMessage());
            }
        }

        logger.info("MimicKV server stopped on port {}", boundPort);
    }

    /**
     * Check if the server is running.
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * Get the number of active connections.
     */
    public int getConnectionCount() {
        return connections.size();
    }

    /**
     * Get the port this server is listening on. Once started this is the
     * actual port, even when 0 was requested.
     */
    public int getPort() {
        return boundPort;
    }

    /**
     * Remove a connection from tracking.
     * Package-private, called by ConnectionHandler when connection is closed.
     */
    void removeConnection(SocketChannel channel) {
        connections.remove(channel);
    }
}
