package com.mimickv.network.protocol;

/**
 * Exception thrown when a RESP frame cannot be encoded or decoded.
 */
public class ProtocolException extends RuntimeException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
