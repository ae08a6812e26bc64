package com.mimickv.command;

import com.mimickv.core.BlockingCoordinator;
import com.mimickv.core.BlockingRead;
import com.mimickv.core.Clock;
import com.mimickv.core.CommandException;
import com.mimickv.core.Database;
import com.mimickv.core.DatabaseRegistry;
import com.mimickv.core.ErrorMessages;
import com.mimickv.network.protocol.Reply;
import com.mimickv.stream.ConsumerGroup;
import com.mimickv.stream.Consumer;
import com.mimickv.stream.Stream;
import com.mimickv.stream.StreamEntry;
import com.mimickv.stream.StreamEntryId;
import com.mimickv.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Stream commands that do not involve consumer groups for delivery:
 * XADD, XLEN, XRANGE, XREVRANGE, XDEL, XREAD and XINFO.
 */
public class StreamCommandExecutor {

    private static final Logger logger = LoggerFactory.getLogger(StreamCommandExecutor.class);

    private final DatabaseRegistry databases;
    private final Clock clock;
    private final BlockingCoordinator blocking;
    private final MetricsCollector metrics;

    public StreamCommandExecutor(DatabaseRegistry databases, Clock clock,
                                 BlockingCoordinator blocking, MetricsCollector metrics) {
        this.databases = databases;
        this.clock = clock;
        this.blocking = blocking;
        this.metrics = metrics;
    }

    private Database database(ClientContext client) {
        return databases.get(client.getDatabaseIndex());
    }

    /**
     * XADD key [NOMKSTREAM] [MAXLEN [~|=] n] id field value [field value ...]
     */
    public Reply xadd(ClientContext client, List<String> args) {
        Arguments.requireAtLeast(args, 4, "XADD");
        String key = args.get(0);
        boolean noMkStream = false;
        int maxLen = -1;

        int i = 1;
        while (i < args.size()) {
            String option = Arguments.upper(args.get(i));
            if ("NOMKSTREAM".equals(option)) {
                noMkStream = true;
                i++;
            } else if ("MAXLEN".equals(option)) {
                i++;
                if (i < args.size() && ("~".equals(args.get(i)) || "=".equals(args.get(i)))) {
                    i++;
                }
                if (i >= args.size()) {
                    throw ErrorMessages.wrongNumberOfArguments("XADD");
                }
                maxLen = Arguments.parseInt(args.get(i));
                if (maxLen < 0) {
                    throw new CommandException(ErrorMessages.MAXLEN_NEGATIVE);
                }
                i++;
            } else {
                break;
            }
        }
        if (i >= args.size()) {
            throw ErrorMessages.wrongNumberOfArguments("XADD");
        }
        String idToken = args.get(i);
        List<String> values = args.subList(i + 1, args.size());
        if (values.isEmpty() || values.size() % 2 != 0) {
            throw new CommandException(ErrorMessages.XADD_FIELD_ARITY);
        }

        final boolean skipCreate = noMkStream;
        final int trimTo = maxLen;
        Database db = database(client);
        return db.execute(() -> {
            Optional<Stream> existing = db.getStream(key);
            if (existing.isEmpty() && skipCreate) {
                return Reply.nullBulk();
            }
            // A fresh stream is only stored once the append succeeded
            Stream stream = existing.orElseGet(Stream::new);
            StreamEntryId id = stream.add(idToken, values, clock.currentTimeMillis());
            if (trimTo >= 0) {
                stream.trim(trimTo);
            }
            if (existing.isEmpty()) {
                db.addStream(key, stream);
            } else {
                db.touch(key);
            }
            metrics.recordAppend();
            logger.trace("XADD {} -> {}", key, id);
            return Reply.bulk(id.toString());
        });
    }

    /**
     * XLEN key
     */
    public Reply xlen(ClientContext client, List<String> args) {
        Arguments.requireExactly(args, 1, "XLEN");
        Database db = database(client);
        return db.execute(() -> Reply.integer(db.getStream(args.get(0)).map(Stream::size).orElse(0)));
    }

    /**
     * XRANGE key start end [COUNT n]
     */
    public Reply xrange(ClientContext client, List<String> args) {
        return range(client, args, false, "XRANGE");
    }

    /**
     * XREVRANGE key end start [COUNT n]
     */
    public Reply xrevrange(ClientContext client, List<String> args) {
        return range(client, args, true, "XREVRANGE");
    }

    private Reply range(ClientContext client, List<String> args, boolean reversed, String command) {
        Arguments.requireAtLeast(args, 3, command);
        if (args.size() == 4 || args.size() > 5) {
            throw ErrorMessages.syntaxError();
        }
        String key = args.get(0);
        StreamEntryId first = StreamEntryId.formatRangeBound(args.get(1), true, reversed);
        StreamEntryId second = StreamEntryId.formatRangeBound(args.get(2), false, reversed);
        int count = 0;
        if (args.size() == 5) {
            if (!"COUNT".equals(Arguments.upper(args.get(3)))) {
                throw ErrorMessages.syntaxError();
            }
            count = Arguments.parseInt(args.get(4));
        }
        StreamEntryId low = reversed ? second : first;
        StreamEntryId high = reversed ? first : second;

        final int limit = count;
        Database db = database(client);
        return db.execute(() -> db.getStream(key)
                .map(stream -> StreamReplies.entries(stream.range(low, high, limit, reversed)))
                .orElseGet(() -> Reply.array(List.of())));
    }

    /**
     * XDEL key id [id ...]
     */
    public Reply xdel(ClientContext client, List<String> args) {
        Arguments.requireAtLeast(args, 2, "XDEL");
        String key = args.get(0);
        List<StreamEntryId> ids = new ArrayList<>();
        for (String token : args.subList(1, args.size())) {
            ids.add(StreamEntryId.parse(token));
        }
        Database db = database(client);
        return db.execute(() -> {
            Optional<Stream> stream = db.getStream(key);
            if (stream.isEmpty()) {
                return Reply.integer(0);
            }
            int removed = stream.get().delete(ids);
            db.touch(key);
            return Reply.integer(removed);
        });
    }

    /**
     * XREAD [COUNT n] [BLOCK ms] STREAMS key [key ...] id [id ...]
     */
    public Reply xread(ClientContext client, List<String> args) {
        Arguments.requireAtLeast(args, 3, "XREAD");
        int count = 0;
        Duration block = null;
        boolean streamsSeen = false;

        int i = 0;
        parsing:
        while (i < args.size()) {
            String option = Arguments.upper(args.get(i));
            switch (option) {
                case "COUNT":
                    if (i + 1 >= args.size()) {
                        throw ErrorMessages.wrongNumberOfArguments("XREAD");
                    }
                    count = Arguments.parseInt(args.get(i + 1));
                    i += 2;
                    break;
                case "BLOCK":
                    if (i + 1 >= args.size()) {
                        throw ErrorMessages.wrongNumberOfArguments("XREAD");
                    }
                    block = Arguments.parseBlockTimeout(args.get(i + 1));
                    i += 2;
                    break;
                case "STREAMS":
                    streamsSeen = true;
                    i++;
                    break parsing;
                default:
                    throw ErrorMessages.incorrectArgument(args.get(i));
            }
        }
        List<String> rest = args.subList(i, args.size());
        if (!streamsSeen || rest.isEmpty()) {
            throw ErrorMessages.wrongNumberOfArguments("XREAD");
        }
        if (rest.size() % 2 != 0) {
            throw new CommandException(ErrorMessages.XREAD_UNBALANCED);
        }
        List<String> keys = rest.subList(0, rest.size() / 2);
        List<String> idTokens = rest.subList(rest.size() / 2, rest.size());
        for (String token : idTokens) {
            if (!"$".equals(token)) {
                StreamEntryId.parse(token);
            }
        }

        Database db = database(client);
        // "$" is fixed once, before any waiting
        Map<String, StreamEntryId> after = db.execute(() -> {
            Map<String, StreamEntryId> resolved = new LinkedHashMap<>();
            for (int k = 0; k < keys.size(); k++) {
                String token = idTokens.get(k);
                StreamEntryId id = "$".equals(token)
                        ? db.getStream(keys.get(k)).map(Stream::getLastId).orElse(StreamEntryId.MIN)
                        : StreamEntryId.parse(token);
                resolved.put(keys.get(k), id);
            }
            return resolved;
        });

        final int limit = count;
        BlockingRead<Reply> read = () -> {
            Map<String, List<StreamEntry>> results = new LinkedHashMap<>();
            for (Map.Entry<String, StreamEntryId> request : after.entrySet()) {
                Optional<Stream> stream = db.getStream(request.getKey());
                if (stream.isEmpty()) {
                    continue;
                }
                List<StreamEntry> entries = stream.get().after(request.getValue(), limit);
                if (!entries.isEmpty()) {
                    results.put(request.getKey(), entries);
                }
            }
            return results.isEmpty() ? Optional.empty() : Optional.of(StreamReplies.streams(results));
        };

        if (block == null) {
            return db.execute(() -> read.tryRead().orElse(Reply.nullArray()));
        }
        return blocking.await(db, block, client, read, Reply::nullArray).orElse(null);
    }

    /**
     * XINFO STREAM key | XINFO GROUPS key | XINFO CONSUMERS key group
     */
    public Reply xinfo(ClientContext client, List<String> args) {
        Arguments.requireAtLeast(args, 1, "XINFO");
        String subcommand = Arguments.upper(args.get(0));
        switch (subcommand) {
            case "STREAM":
                Arguments.requireExactly(args, 2, "XINFO");
                return xinfoStream(client, args.get(1));
            case "GROUPS":
                Arguments.requireExactly(args, 2, "XINFO");
                return xinfoGroups(client, args.get(1));
            case "CONSUMERS":
                Arguments.requireExactly(args, 3, "XINFO");
                return xinfoConsumers(client, args.get(1), args.get(2));
            default:
                throw new CommandException(ErrorMessages.XINFO_SYNTAX);
        }
    }

    private Reply xinfoStream(ClientContext client, String key) {
        Database db = database(client);
        return db.execute(() -> {
            Stream stream = existingStream(db, key);
            return Reply.array(
                    Reply.bulk("length"), Reply.integer(stream.size()),
                    Reply.bulk("last-generated-id"), Reply.bulk(stream.getLastId().toString()),
                    Reply.bulk("groups"), Reply.integer(stream.getGroups().size()),
                    Reply.bulk("first-entry"), stream.firstEntry().map(StreamReplies::entry).orElse(Reply.nullBulk()),
                    Reply.bulk("last-entry"), stream.lastEntry().map(StreamReplies::entry).orElse(Reply.nullBulk()));
        });
    }

    private Reply xinfoGroups(ClientContext client, String key) {
        Database db = database(client);
        return db.execute(() -> {
            List<Reply> groups = new ArrayList<>();
            for (ConsumerGroup group : existingStream(db, key).getGroups()) {
                groups.add(Reply.array(
                        Reply.bulk("name"), Reply.bulk(group.getName()),
                        Reply.bulk("consumers"), Reply.integer(group.getConsumers().size()),
                        Reply.bulk("pending"), Reply.integer(group.pendingCount()),
                        Reply.bulk("last-delivered-id"), Reply.bulk(group.getLastDeliveredId().toString())));
            }
            return Reply.array(groups);
        });
    }

    private Reply xinfoConsumers(ClientContext client, String key, String groupName) {
        Database db = database(client);
        return db.execute(() -> {
            ConsumerGroup group = existingStream(db, key).getGroup(groupName)
                    .orElseThrow(() -> ErrorMessages.noGroup(key, groupName));
            long now = clock.currentTimeMillis();
            List<Reply> consumers = new ArrayList<>();
            for (Consumer consumer : group.getConsumers()) {
                consumers.add(Reply.array(
                        Reply.bulk("name"), Reply.bulk(consumer.getName()),
                        Reply.bulk("pending"), Reply.integer(group.pendingCount(consumer.getName())),
                        Reply.bulk("idle"), Reply.integer(Math.max(0, now - consumer.getLastSeenMillis()))));
            }
            return Reply.array(consumers);
        });
    }

    private static Stream existingStream(Database db, String key) {
        return db.getStream(key).orElseThrow(() -> new CommandException(ErrorMessages.KEY_NOT_FOUND));
    }
}
