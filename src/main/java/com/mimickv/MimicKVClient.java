package com.mimickv;

import com.mimickv.client.ClientConfig;
import com.mimickv.network.protocol.Reply;
import com.mimickv.network.protocol.RespProtocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Minimal blocking RESP client for MimicKV (or any server speaking RESP2).
 * One socket, one request in flight at a time.
 */
public class MimicKVClient implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(MimicKVClient.class);

    private final String host;
    private final int port;
    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;
    private volatile boolean closed = false;

    /**
     * Connect with the default configuration.
     *
     * @param hostPort address in host:port format
     */
    public MimicKVClient(String hostPort) throws IOException {
        this(ClientConfig.builder().build(), hostPort);
    }

    /**
     * Connect with a custom configuration.
     *
     * @param config   client configuration
     * @param hostPort address in host:port format
     */
    public MimicKVClient(ClientConfig config, String hostPort) throws IOException {
        int colon = hostPort == null ? -1 : hostPort.lastIndexOf(':');
        if (colon <= 0 || colon == hostPort.length() - 1) {
            throw new IllegalArgumentException("Address must be host:port, got: " + hostPort);
        }
        this.host = hostPort.substring(0, colon);
        try {
            this.port = Integer.parseInt(hostPort.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in address: " + hostPort, e);
        }

        this.socket = new Socket();
        try {
            socket.setTcpNoDelay(true);
            socket.connect(new InetSocketAddress(host, port), config.getConnectTimeoutMs());
            socket.setSoTimeout(config.getReadTimeoutMs());
            this.in = new BufferedInputStream(socket.getInputStream());
            this.out = socket.getOutputStream();
        } catch (IOException e) {
            socket.close();
            throw e;
        }
        logger.debug("Connected to {}:{}", host, port);

        if (config.getDatabase() != 0) {
            Reply reply = execute("SELECT", Integer.toString(config.getDatabase()));
            if (reply.isError()) {
                close();
                throw new IOException("SELECT failed: " + reply.getText());
            }
        }
    }

    /**
     * Send a command and wait for its reply. Error replies are returned, not thrown.
     *
     * @param parts command name followed by arguments
     * @return the server's reply
     * @throws IOException if the connection fails
     */
    public synchronized Reply execute(String... parts) throws IOException {
        return execute(Arrays.asList(parts));
    }

    public synchronized Reply execute(List<String> parts) throws IOException {
        ensureOpen();
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("Command cannot be empty");
        }
        out.write(RespProtocol.encodeCommand(parts));
        out.flush();
        return RespProtocol.readReply(in);
    }

    /**
     * Check if server is reachable.
     *
     * @return true if the server answered PONG
     */
    public boolean ping() {
        try {
            Reply reply = execute("PING");
            return "PONG".equals(reply.getText());
        } catch (IOException e) {
            logger.debug("Ping failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Append an entry with a generated ID.
     *
     * @param key          stream key
     * @param fieldsValues field, value, field, value...
     * @return the new entry ID
     * @throws IOException if the connection fails or the server answers with an error
     */
    public String xadd(String key, String... fieldsValues) throws IOException {
        List<String> parts = new ArrayList<>();
        parts.add("XADD");
        parts.add(key);
        parts.add("*");
        parts.addAll(Arrays.asList(fieldsValues));
        return expectBulk(execute(parts));
    }

    public long xlen(String key) throws IOException {
        return expectInteger(execute("XLEN", key));
    }

    public long xack(String key, String group, String... ids) throws IOException {
        List<String> parts = new ArrayList<>(Arrays.asList("XACK", key, group));
        parts.addAll(Arrays.asList(ids));
        return expectInteger(execute(parts));
    }

    private static String expectBulk(Reply reply) throws IOException {
        if (reply.isError()) {
            throw new IOException("Server error: " + reply.getText());
        }
        return reply.getText();
    }

    private static long expectInteger(Reply reply) throws IOException {
        if (reply.getType() != Reply.Type.INTEGER) {
            throw new IOException("Expected integer reply, got: " + reply);
        }
        return reply.getInteger();
    }

    private void ensureOpen() throws IOException {
        if (closed) {
            throw new IOException("Client is closed");
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            socket.close();
        } catch (IOException e) {
            logger.debug("Error closing socket: {}", e.getMessage());
        }
    }

    public boolean isClosed() {
        return closed;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }
}
