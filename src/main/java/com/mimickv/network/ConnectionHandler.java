package com.mimickv.network;

import com.mimickv.command.ClientContext;
import com.mimickv.command.CommandRouter;
import com.mimickv.network.protocol.ProtocolException;
import com.mimickv.network.protocol.Reply;
import com.mimickv.network.protocol.RespCommand;
import com.mimickv.network.protocol.RespProtocol;
import com.mimickv.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.SocketChannel;
import java.util.LinkedList;
import java.util.Queue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Handles individual client connections.
 * Manages read/write buffers and hands complete requests to the worker pool,
 * one at a time per connection so replies keep request order.
 */
public class ConnectionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionHandler.class);
    private static final int BUFFER_SIZE = 64 * 1024;
    private static final int MAX_QUEUED_RESPONSES = 1000;
    private static final int MAX_QUEUED_COMMANDS = 1000;
    // Largest frame we accept: one maximal bulk string plus headers
    private static final long MAX_READ_BUFFER_SIZE = (long) RespProtocol.MAX_BULK_LENGTH + BUFFER_SIZE;
    // Timeout for completing a request frame (30 seconds)
    private static final long INCOMPLETE_FRAME_TIMEOUT_MS = 30_000;

    private final SocketChannel channel;
    private final CommandRouter router;
    private final MetricsCollector metrics;
    private final TcpServer server;
    private final ExecutorService workerPool;
    private final Selector selector;
    private final ClientContext client;
    private ByteBuffer readBuffer; // Mutable to allow growth
    private final ByteBuffer writeBuffer;
    private final String clientAddress;
    private final Queue<ByteBuffer> pendingResponses;
    private final Queue<RespCommand> pendingCommands;
    private ByteBuffer currentResponse; // Track partial write progress
    private boolean closed = false;
    private boolean closeAfterWrite = false; // Set by QUIT
    private SelectionKey selectionKey; // Track selection key for async wakeup
    private boolean commandInProgress = false;
    private boolean writeInProgress = false;

    private long incompleteFrameStartTime = 0;
    private boolean hasIncompleteFrame = false;

    private final Object interestOpsLock = new Object();

    public ConnectionHandler(SocketChannel channel, CommandRouter router, MetricsCollector metrics,
                             TcpServer server, ExecutorService workerPool, Selector selector) {
        this.channel = channel;
        this.router = router;
        this.metrics = metrics;
        this.server = server;
        this.workerPool = workerPool;
        this.selector = selector;
        this.readBuffer = ByteBuffer.allocateDirect(BUFFER_SIZE);
        this.writeBuffer = ByteBuffer.allocateDirect(BUFFER_SIZE);
        this.clientAddress = getClientAddress();
        this.client = new ClientContext(clientAddress);
        this.pendingResponses = new LinkedList<>();
        this.pendingCommands = new LinkedList<>();
        metrics.connectionOpened();
        logger.debug("New connection from {}", clientAddress);
    }

    private String getClientAddress() {
        try {
            return String.valueOf(channel.getRemoteAddress());
        } catch (IOException e) {
            return "unknown";
        }
    }

    /**
     * Handle a read event from the selector.
     *
     * @param key the selection key
     * @return true if the connection should continue, false to close
     */
    public boolean handleRead(SelectionKey key) {
        if (this.selectionKey == null) {
            this.selectionKey = key;
        }

        try {
            int bytesRead = channel.read(readBuffer);
            if (bytesRead == -1) {
                logger.debug("Client {} disconnected", clientAddress);
                return false;
            }

            if (bytesRead > 0) {
                readBuffer.flip();
                boolean hasCompleteFrame = readBuffer.remaining() > 0 && RespProtocol.hasCompleteRequest(readBuffer);
                readBuffer.compact();

                if (!hasCompleteFrame && readBuffer.position() > 0) {
                    if (!hasIncompleteFrame) {
                        hasIncompleteFrame = true;
                        incompleteFrameStartTime = System.currentTimeMillis();
                        logger.trace("Started tracking incomplete frame from {}", clientAddress);
                    } else {
                        long elapsed = System.currentTimeMillis() - incompleteFrameStartTime;
                        if (elapsed > INCOMPLETE_FRAME_TIMEOUT_MS) {
                            logger.warn("Connection from {} exceeded incomplete frame timeout ({}ms), closing",
                                    clientAddress, elapsed);
                            return false;
                        }
                    }
                }

                processReadBuffer(key);

                if (hasCompleteFrame) {
                    hasIncompleteFrame = false;
                    incompleteFrameStartTime = 0;
                }

                // Buffer completely full without a complete request: grow it
                if (readBuffer.position() == readBuffer.capacity()) {
                    readBuffer.flip();
                    boolean hasComplete = RespProtocol.hasCompleteRequest(readBuffer);
                    readBuffer.compact();

                    if (!hasComplete) {
                        growReadBuffer();
                    }
                }
            }
            return true;
        } catch (ProtocolException e) {
            logger.warn("Protocol violation from {} (closing connection): {}", clientAddress, e.getMessage());
            readBuffer.clear();
            queueResponse(Reply.error("ERR Protocol error: " + e.getMessage()), key);
            closeAfterWrite = true;
            return true;
        } catch (IOException e) {
            logger.warn("Read error from {}: {}", clientAddress, e.getMessage());
            return false;
        }
    }

    private void processReadBuffer(SelectionKey key) {
        readBuffer.flip();
        try {
            RespCommand command;
            while ((command = RespProtocol.decodeCommand(readBuffer)) != null) {
                // Queue command for sequential processing to preserve ordering
                synchronized (pendingCommands) {
                    if (pendingCommands.size() >= MAX_QUEUED_COMMANDS) {
                        logger.error("Command queue overflow for {}, closing connection", clientAddress);
                        key.cancel();
                        close();
                        return;
                    }
                    pendingCommands.offer(command);
                }
                processNextCommand();
            }
        } finally {
            readBuffer.compact();
        }
    }

    /**
     * Process the next command in the queue if one is not already being processed.
     * Commands of one connection run one at a time, so a blocked read holds back
     * the commands queued behind it.
     */
    private void processNextCommand() {
        synchronized (pendingCommands) {
            if (commandInProgress || pendingCommands.isEmpty() || closed) {
                return;
            }

            RespCommand command = pendingCommands.poll();
            commandInProgress = true;
            try {
                workerPool.submit(() -> {
                    try {
                        processCommandAsync(command);
                    } finally {
                        synchronized (pendingCommands) {
                            commandInProgress = false;
                        }
                        processNextCommand();
                    }
                });
            } catch (RejectedExecutionException e) {
                commandInProgress = false;
                logger.warn("Worker pool rejected command from {}: {}", clientAddress, e.getMessage());
            }
        }
    }

    /**
     * Process command on worker thread.
     */
    private void processCommandAsync(RespCommand command) {
        Reply reply = router.execute(client, command);
        if (reply == null) {
            // Client went away while blocked
            return;
        }
        if ("QUIT".equals(command.getName())) {
            synchronized (this) {
                closeAfterWrite = true;
            }
        }
        queueResponseAsync(reply);
    }

    /**
     * Queue response from selector thread.
     */
    private void queueResponse(Reply reply, SelectionKey key) {
        ByteBuffer encoded = RespProtocol.encode(reply);

        synchronized (this) {
            if (closed) {
                return;
            }

            if (pendingResponses.size() >= MAX_QUEUED_RESPONSES) {
                logger.error("Response queue overflow for {}, closing connection", clientAddress);
                key.cancel();
                close();
                return;
            }

            pendingResponses.offer(encoded);

            if (!writeInProgress) {
                drainToWriteBuffer();
                if (writeBuffer.position() > 0) {
                    writeInProgress = true;
                    synchronized (interestOpsLock) {
                        if (key.isValid()) {
                            key.interestOps(key.interestOps() | SelectionKey.OP_WRITE);
                        }
                    }
                }
            }
        }
    }

    /**
     * Queue response from worker thread and wake up selector.
     * Thread-safe - can be called from any worker thread.
     */
    private void queueResponseAsync(Reply reply) {
        ByteBuffer encoded = RespProtocol.encode(reply);

        synchronized (this) {
            if (closed) {
                return;
            }

            if (pendingResponses.size() >= MAX_QUEUED_RESPONSES) {
                logger.error("Response queue overflow for {}, closing connection", clientAddress);
                close();
                return;
            }

            pendingResponses.offer(encoded);

            if (!writeInProgress && selectionKey != null && selectionKey.isValid()) {
                writeInProgress = true;
                synchronized (interestOpsLock) {
                    if (selectionKey.isValid()) {
                        selectionKey.interestOps(selectionKey.interestOps() | SelectionKey.OP_WRITE);
                    }
                }
                selector.wakeup();
            }
        }
    }

    private void drainToWriteBuffer() {
        while (writeBuffer.hasRemaining()) {
            if (currentResponse == null || !currentResponse.hasRemaining()) {
                currentResponse = pendingResponses.poll();
                if (currentResponse == null) {
                    break;
                }
            }

            int toWrite = Math.min(writeBuffer.remaining(), currentResponse.remaining());
            if (toWrite > 0) {
                int oldLimit = currentResponse.limit();
                currentResponse.limit(currentResponse.position() + toWrite);
                writeBuffer.put(currentResponse);
                currentResponse.limit(oldLimit);
            }
        }
    }

    /**
     * Handle a write event from the selector.
     * Thread-safe - synchronized with queueResponseAsync.
     *
     * @param key the selection key
     * @return true if the connection should continue, false to close
     */
    public boolean handleWrite(SelectionKey key) {
        synchronized (this) {
            try {
                drainToWriteBuffer();
                writeBuffer.flip();
                channel.write(writeBuffer);
                writeBuffer.compact();

                drainToWriteBuffer();

                boolean allWritten = writeBuffer.position() == 0
                        && pendingResponses.isEmpty()
                        && (currentResponse == null || !currentResponse.hasRemaining());

                if (allWritten) {
                    writeInProgress = false;
                    currentResponse = null;
                    if (closeAfterWrite) {
                        logger.debug("Closing {} after final reply", clientAddress);
                        return false;
                    }
                    synchronized (interestOpsLock) {
                        if (key.isValid()) {
                            key.interestOps(key.interestOps() & ~SelectionKey.OP_WRITE);
                        }
                    }
                }
                return true;
            } catch (IOException e) {
                logger.warn("Write error to {}: {}", clientAddress, e.getMessage());
                return false;
            }
        }
    }

    /**
     * Grow the read buffer to accommodate larger requests.
     * PRECONDITION: Buffer must be in WRITE MODE (after compact or initial state).
     * POSTCONDITION: Buffer is in WRITE MODE with all unread bytes preserved at the start.
     */
    private void growReadBuffer() {
        int currentCapacity = readBuffer.capacity();
        if (currentCapacity >= MAX_READ_BUFFER_SIZE) {
            throw new ProtocolException("request too large (" + currentCapacity + " bytes buffered)");
        }

        int preservedBytes = readBuffer.position();
        long newCapacity = Math.min(Math.min((long) currentCapacity * 2, MAX_READ_BUFFER_SIZE), Integer.MAX_VALUE - 8);
        logger.debug("Growing read buffer from {} to {} bytes for {} (preserving {} bytes)",
                currentCapacity, newCapacity, clientAddress, preservedBytes);

        ByteBuffer newBuffer = ByteBuffer.allocateDirect((int) newCapacity);
        readBuffer.flip();
        newBuffer.put(readBuffer);
        readBuffer = newBuffer;
    }

    /**
     * Close this connection and release resources. Wakes a read blocked on
     * behalf of this connection without sending it a reply.
     * Idempotent and thread-safe - safe to call multiple times from any thread.
     */
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }

        client.close();

        try {
            channel.close();
        } catch (IOException e) {
            logger.debug("Error closing connection: {}", e.getMessage());
        }

        if (server != null) {
            server.removeConnection(channel);
        }

        metrics.connectionClosed();
        logger.debug("Connection closed: {}", clientAddress);
    }

    public String getRemoteAddress() {
        return clientAddress;
    }

    ClientContext getClientContext() {
        return client;
    }
}
