package com.mimickv.command;

import com.mimickv.core.BlockingCoordinator;
import com.mimickv.core.Clock;
import com.mimickv.core.CommandException;
import com.mimickv.core.DatabaseRegistry;
import com.mimickv.core.ErrorMessages;
import com.mimickv.network.protocol.Reply;
import com.mimickv.network.protocol.RespCommand;
import com.mimickv.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Static command table. Names are matched case-insensitively; the table is
 * built once in the constructor and never changes.
 */
public class CommandRouter {

    private static final Logger logger = LoggerFactory.getLogger(CommandRouter.class);

    private final Map<String, CommandHandler> handlers;
    private final MetricsCollector metrics;

    public CommandRouter(DatabaseRegistry databases, Clock clock, MetricsCollector metrics) {
        this.metrics = metrics;
        BlockingCoordinator blocking = new BlockingCoordinator(clock, metrics);
        KeyCommandExecutor keys = new KeyCommandExecutor(databases);
        StreamCommandExecutor streams = new StreamCommandExecutor(databases, clock, blocking, metrics);
        ConsumerGroupCommandExecutor groups = new ConsumerGroupCommandExecutor(databases, clock, blocking, metrics);

        Map<String, CommandHandler> table = new HashMap<>();
        table.put("PING", keys::ping);
        table.put("ECHO", keys::echo);
        table.put("SELECT", keys::select);
        table.put("DEL", keys::del);
        table.put("EXISTS", keys::exists);
        table.put("TYPE", keys::type);
        table.put("FLUSHDB", keys::flushdb);
        table.put("FLUSHALL", keys::flushall);
        table.put("QUIT", keys::quit);

        table.put("XADD", streams::xadd);
        table.put("XLEN", streams::xlen);
        table.put("XRANGE", streams::xrange);
        table.put("XREVRANGE", streams::xrevrange);
        table.put("XDEL", streams::xdel);
        table.put("XREAD", streams::xread);
        table.put("XINFO", streams::xinfo);

        table.put("XGROUP", groups::xgroup);
        table.put("XREADGROUP", groups::xreadgroup);
        table.put("XACK", groups::xack);
        table.put("XPENDING", groups::xpending);
        this.handlers = Collections.unmodifiableMap(table);
    }

    /**
     * Execute a command and turn any failure into an error reply.
     *
     * @param client  the calling connection
     * @param command the request
     * @return the reply, or null when nothing must be sent because the client
     *         disconnected while blocked
     */
    public Reply execute(ClientContext client, RespCommand command) {
        long startTime = System.nanoTime();
        CommandHandler handler = handlers.get(command.getName());
        if (handler == null) {
            metrics.recordError();
            return Reply.error(ErrorMessages.unknownCommand(command.getName(), command.getArgs()).getMessage());
        }
        try {
            Reply reply = handler.handle(client, command.getArgs());
            logger.trace("{} {} -> {}", client.getName(), command.getName(), reply);
            return reply;
        } catch (CommandException e) {
            metrics.recordError();
            return Reply.error(e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Error processing command {}: {}", command.getName(), e.toString(), e);
            metrics.recordError();
            return Reply.error("ERR internal error: " + e.getMessage());
        } finally {
            metrics.recordCommand(command.getName(), System.nanoTime() - startTime);
        }
    }

    public Set<String> getCommandNames() {
        return handlers.keySet();
    }
}
