package com.mimickv.core;

import java.util.List;
import java.util.Locale;

/**
 * Error replies shared by the command executors.
 * The texts match the reference server byte for byte, clients compare them literally.
 */
public final class ErrorMessages {

    public static final String WRONG_TYPE = "WRONGTYPE Operation against a key holding the wrong kind of value";
    public static final String INVALID_INT = "ERR value is not an integer or out of range";
    public static final String SYNTAX_ERROR = "ERR syntax error";
    public static final String INVALID_DB_INDEX = "ERR DB index is out of range";
    public static final String KEY_NOT_FOUND = "ERR no such key";
    public static final String INVALID_STREAM_ID = "ERR Invalid stream ID specified as stream command argument";
    public static final String STREAM_ID_TOO_SMALL =
            "ERR The ID specified in XADD is equal or smaller than the target stream top item";
    public static final String STREAM_ID_ZERO = "ERR The ID specified in XADD must be greater than 0-0";
    public static final String MAXLEN_NEGATIVE = "ERR The MAXLEN argument must be >= 0.";
    public static final String XADD_FIELD_ARITY = "ERR wrong number of arguments for XADD";
    public static final String XREAD_UNBALANCED =
            "ERR Unbalanced XREAD list of streams: for each stream key an ID or '$' must be specified.";
    public static final String XGROUP_KEY_NOT_FOUND = "ERR The XGROUP subcommand requires the key to exist. "
            + "Note that for CREATE you may want to use the MKSTREAM option to create an empty stream automatically.";
    public static final String BUSY_GROUP = "BUSYGROUP Consumer Group name already exists";
    public static final String TIMEOUT_NEGATIVE = "ERR timeout is negative";
    public static final String XINFO_SYNTAX = "ERR syntax error, try 'XINFO HELP'";

    private ErrorMessages() {
        // Utility class
    }

    public static CommandException wrongType() {
        return new CommandException(WRONG_TYPE);
    }

    public static CommandException invalidInt() {
        return new CommandException(INVALID_INT);
    }

    public static CommandException syntaxError() {
        return new CommandException(SYNTAX_ERROR);
    }

    public static CommandException invalidStreamId() {
        return new CommandException(INVALID_STREAM_ID);
    }

    public static CommandException wrongNumberOfArguments(String command) {
        return new CommandException("ERR wrong number of arguments for '"
                + command.toLowerCase(Locale.ROOT) + "' command");
    }

    public static CommandException unknownCommand(String command, List<String> args) {
        StringBuilder sb = new StringBuilder();
        for (String arg : args) {
            sb.append('\'').append(arg).append("' ");
        }
        return new CommandException("ERR unknown command `" + command + "`, with args beginning with: " + sb);
    }

    /**
     * Group lookup failure for XREADGROUP.
     */
    public static CommandException noGroupForRead(String key, String group) {
        return new CommandException(String.format(
                "NOGROUP No such key '%s' or consumer group '%s' in XREADGROUP with GROUP option", key, group));
    }

    /**
     * Group lookup failure for the other group-scoped commands.
     */
    public static CommandException noGroup(String key, String group) {
        return new CommandException(String.format("NOGROUP No such key '%s' or consumer group '%s'", key, group));
    }

    public static CommandException unsupported(String command, List<String> args) {
        return new CommandException("ERR '" + command + " " + String.join(" ", args) + "' not supported");
    }

    public static CommandException incorrectArgument(String arg) {
        return new CommandException("ERR incorrect argument " + arg);
    }
}
