package com.mimickv.core;

/**
 * Raised when a command cannot be executed.
 * The message is the exact error text sent back to the client,
 * including its prefix (ERR, WRONGTYPE, NOGROUP, BUSYGROUP).
 */
public class CommandException extends RuntimeException {

    public CommandException(String message) {
        super(message);
    }
}
