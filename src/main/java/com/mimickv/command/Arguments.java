package com.mimickv.command;

import com.mimickv.core.CommandException;
import com.mimickv.core.ErrorMessages;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Argument parsing shared by the executors.
 */
final class Arguments {

    private Arguments() {
        // Utility class
    }

    static int parseInt(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw ErrorMessages.invalidInt();
        }
    }

    static long parseLong(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw ErrorMessages.invalidInt();
        }
    }

    /**
     * Parse a BLOCK argument in milliseconds. Zero means wait forever.
     */
    static Duration parseBlockTimeout(String value) {
        long millis = parseLong(value);
        if (millis < 0) {
            throw new CommandException(ErrorMessages.TIMEOUT_NEGATIVE);
        }
        return Duration.ofMillis(millis);
    }

    static String upper(String value) {
        return value.toUpperCase(Locale.ROOT);
    }

    static void requireAtLeast(List<String> args, int count, String command) {
        if (args.size() < count) {
            throw ErrorMessages.wrongNumberOfArguments(command);
        }
    }

    static void requireExactly(List<String> args, int count, String command) {
        if (args.size() != count) {
            throw ErrorMessages.wrongNumberOfArguments(command);
        }
    }
}
