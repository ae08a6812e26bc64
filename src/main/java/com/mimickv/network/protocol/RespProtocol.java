package com.mimickv.network.protocol;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * RESP2 encoder/decoder.
 *
 * Requests are arrays of bulk strings ({@code *<n>\r\n$<len>\r\n<data>\r\n...})
 * or inline commands (a single space separated line). Replies use the five
 * RESP2 types: {@code +} simple, {@code -} error, {@code :} integer,
 * {@code $} bulk and {@code *} array, with {@code $-1} and {@code *-1} as nulls.
 */
public final class RespProtocol {

    private static final Logger logger = LoggerFactory.getLogger(RespProtocol.class);

    private static final byte[] CRLF = {'\r', '\n'};

    // Maximum sizes
    public static final int MAX_ARRAY_LENGTH = 1024 * 1024;
    public static final int MAX_INLINE_LENGTH = 64 * 1024;
    public static final int DEFAULT_MAX_BULK_LENGTH = 512 * 1024 * 1024;
    public static final int MAX_BULK_LENGTH = readMaxBulkLength();

    private RespProtocol() {
        // Utility class
    }

    /**
     * Get the bulk string limit from environment/system property, or use default.
     * Checks: MIMICKV_MAX_BULK_LENGTH env var, mimickv.max.bulk.length property
     */
    private static int readMaxBulkLength() {
        String value = System.getenv("MIMICKV_MAX_BULK_LENGTH");
        if (value == null || value.isEmpty()) {
            value = System.getProperty("mimickv.max.bulk.length");
        }
        if (value == null || value.isEmpty()) {
            return DEFAULT_MAX_BULK_LENGTH;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed > 0) {
                return parsed;
            }
            logger.warn("Non-positive max bulk length {}, using default", value);
        } catch (NumberFormatException e) {
            logger.warn("Invalid max bulk length: {}, using default", value);
        }
        return DEFAULT_MAX_BULK_LENGTH;
    }

    // ==================== Decoding (server side) ====================

    /**
     * Check if the buffer holds at least one complete request.
     * Does not modify the buffer position.
     *
     * @param buffer the buffer in read mode
     * @return true if a complete request is available
     * @throws ProtocolException if the pending bytes can never form a valid request
     */
    public static boolean hasCompleteRequest(ByteBuffer buffer) {
        return parseFrame(buffer.duplicate()) != null;
    }

    /**
     * Decode the next request from the buffer and advance past it.
     * Empty requests (blank inline lines, zero-length arrays) are skipped.
     *
     * @param buffer the buffer in read mode
     * @return the decoded command, or null if no complete request is available
     * @throws ProtocolException if the data is malformed
     */
    public static RespCommand decodeCommand(ByteBuffer buffer) {
        while (true) {
            List<String> parts = parseFrame(buffer);
            if (parts == null) {
                return null;
            }
            if (!parts.isEmpty()) {
                return RespCommand.of(parts);
            }
        }
    }

    /**
     * Parse one frame starting at the buffer position. On success the position
     * moves past the frame; when the frame is incomplete it is left unchanged.
     */
    private static List<String> parseFrame(ByteBuffer buffer) {
        int pos = buffer.position();
        int limit = buffer.limit();
        if (pos >= limit) {
            return null;
        }
        if (buffer.get(pos) != '*') {
            return parseInline(buffer, pos, limit);
        }

        int lineEnd = findCrlf(buffer, pos, limit);
        if (lineEnd < 0) {
            return null;
        }
        long count = parseNumber(buffer, pos + 1, lineEnd, "invalid multibulk length");
        if (count > MAX_ARRAY_LENGTH) {
            throw new ProtocolException("invalid multibulk length");
        }
        pos = lineEnd + 2;

        List<String> parts = new ArrayList<>((int) Math.max(0, count));
        for (long i = 0; i < count; i++) {
            if (pos >= limit) {
                return null;
            }
            byte marker = buffer.get(pos);
            if (marker != '$') {
                throw new ProtocolException("expected '$', got '" + (char) marker + "'");
            }
            lineEnd = findCrlf(buffer, pos, limit);
            if (lineEnd < 0) {
                return null;
            }
            long length = parseNumber(buffer, pos + 1, lineEnd, "invalid bulk length");
            if (length < 0 || length > MAX_BULK_LENGTH) {
                throw new ProtocolException("invalid bulk length");
            }
            int dataStart = lineEnd + 2;
            if ((long) dataStart + length + 2 > limit) {
                return null;
            }
            int dataEnd = dataStart + (int) length;
            if (buffer.get(dataEnd) != '\r' || buffer.get(dataEnd + 1) != '\n') {
                throw new ProtocolException("bulk string not terminated by CRLF");
            }
            byte[] data = new byte[(int) length];
            buffer.get(dataStart, data);
            parts.add(new String(data, StandardCharsets.UTF_8));
            pos = dataEnd + 2;
        }
        buffer.position(pos);
        return parts;
    }

    private static List<String> parseInline(ByteBuffer buffer, int pos, int limit) {
        int end = -1;
        for (int i = pos; i < limit; i++) {
            if (buffer.get(i) == '\n') {
                end = i;
                break;
            }
        }
        if (end < 0) {
            if (limit - pos > MAX_INLINE_LENGTH) {
                throw new ProtocolException("too big inline request");
            }
            return null;
        }
        int lineEnd = end > pos && buffer.get(end - 1) == '\r' ? end - 1 : end;
        byte[] line = new byte[lineEnd - pos];
        buffer.get(pos, line);
        buffer.position(end + 1);

        List<String> parts = new ArrayList<>();
        for (String token : new String(line, StandardCharsets.UTF_8).trim().split("\\s+")) {
            if (!token.isEmpty()) {
                parts.add(token);
            }
        }
        return parts;
    }

    private static int findCrlf(ByteBuffer buffer, int from, int limit) {
        for (int i = from; i + 1 < limit; i++) {
            if (buffer.get(i) == '\r' && buffer.get(i + 1) == '\n') {
                return i;
            }
        }
        if (limit - from > MAX_INLINE_LENGTH) {
            throw new ProtocolException("header line too long");
        }
        return -1;
    }

    private static long parseNumber(ByteBuffer buffer, int from, int to, String error) {
        if (from >= to) {
            throw new ProtocolException(error);
        }
        boolean negative = buffer.get(from) == '-';
        int i = negative ? from + 1 : from;
        if (i >= to) {
            throw new ProtocolException(error);
        }
        long value = 0;
        for (; i < to; i++) {
            byte b = buffer.get(i);
            if (b < '0' || b > '9' || value > Integer.MAX_VALUE) {
                throw new ProtocolException(error);
            }
            value = value * 10 + (b - '0');
        }
        return negative ? -value : value;
    }

    // ==================== Encoding (server side) ====================

    /**
     * Encode a reply.
     *
     * @param reply the reply to encode
     * @return ByteBuffer positioned at start, ready to read
     */
    public static ByteBuffer encode(Reply reply) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        write(reply, out);
        return ByteBuffer.wrap(out.toByteArray());
    }

    private static void write(Reply reply, ByteArrayOutputStream out) {
        switch (reply.getType()) {
            case SIMPLE:
                writeLine(out, '+', reply.getText());
                break;
            case ERROR:
                writeLine(out, '-', reply.getText());
                break;
            case INTEGER:
                writeLine(out, ':', Long.toString(reply.getInteger()));
                break;
            case BULK:
                if (reply.getText() == null) {
                    writeLine(out, '$', "-1");
                } else {
                    byte[] data = reply.getText().getBytes(StandardCharsets.UTF_8);
                    writeLine(out, '$', Integer.toString(data.length));
                    out.writeBytes(data);
                    out.writeBytes(CRLF);
                }
                break;
            case ARRAY:
                if (reply.getElements() == null) {
                    writeLine(out, '*', "-1");
                } else {
                    writeLine(out, '*', Integer.toString(reply.getElements().size()));
                    for (Reply element : reply.getElements()) {
                        write(element, out);
                    }
                }
                break;
            default:
                throw new ProtocolException("Unknown reply type: " + reply.getType());
        }
    }

    private static void writeLine(ByteArrayOutputStream out, char marker, String text) {
        // Simple strings and errors cannot carry line breaks
        String line = marker == '+' || marker == '-' ? text.replace('\r', ' ').replace('\n', ' ') : text;
        out.write(marker);
        out.writeBytes(line.getBytes(StandardCharsets.UTF_8));
        out.writeBytes(CRLF);
    }

    // ==================== Client side ====================

    /**
     * Encode a request as an array of bulk strings.
     *
     * @param parts command name followed by arguments
     * @return the encoded bytes
     */
    public static byte[] encodeCommand(List<String> parts) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeLine(out, '*', Integer.toString(parts.size()));
        for (String part : parts) {
            byte[] data = part.getBytes(StandardCharsets.UTF_8);
            writeLine(out, '$', Integer.toString(data.length));
            out.writeBytes(data);
            out.writeBytes(CRLF);
        }
        return out.toByteArray();
    }

    /**
     * Read one reply from a stream, blocking until it is complete.
     *
     * @param in the stream to read from
     * @return the decoded reply
     * @throws IOException       if the stream fails or ends early
     * @throws ProtocolException if the data is not a valid reply
     */
    public static Reply readReply(InputStream in) throws IOException {
        int marker = in.read();
        if (marker < 0) {
            throw new EOFException("Connection closed by server");
        }
        String line = readLine(in);
        switch (marker) {
            case '+':
                return Reply.simple(line);
            case '-':
                return Reply.error(line);
            case ':':
                return Reply.integer(parseLong(line));
            case '$': {
                long length = parseLong(line);
                if (length < 0) {
                    return Reply.nullBulk();
                }
                if (length > MAX_BULK_LENGTH) {
                    throw new ProtocolException("Bulk reply too large: " + length);
                }
                byte[] data = in.readNBytes((int) length);
                if (data.length != length || in.read() != '\r' || in.read() != '\n') {
                    throw new EOFException("Truncated bulk reply");
                }
                return Reply.bulk(new String(data, StandardCharsets.UTF_8));
            }
            case '*': {
                long count = parseLong(line);
                if (count < 0) {
                    return Reply.nullArray();
                }
                List<Reply> elements = new ArrayList<>();
                for (long i = 0; i < count; i++) {
                    elements.add(readReply(in));
                }
                return Reply.array(elements);
            }
            default:
                throw new ProtocolException("Unknown reply marker: " + (char) marker);
        }
    }

    private static String readLine(InputStream in) throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream();
        while (true) {
            int b = in.read();
            if (b < 0) {
                throw new EOFException("Connection closed mid-reply");
            }
            if (b == '\r') {
                if (in.read() != '\n') {
                    throw new ProtocolException("Expected LF after CR");
                }
                return line.toString(StandardCharsets.UTF_8);
            }
            line.write(b);
        }
    }

    private static long parseLong(String text) {
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new ProtocolException("Invalid number in reply: " + text, e);
        }
    }
}
