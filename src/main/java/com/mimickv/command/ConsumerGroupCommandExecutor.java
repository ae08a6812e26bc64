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
import com.mimickv.stream.PendingEntry;
import com.mimickv.stream.PendingSummary;
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
 * Consumer group commands: XGROUP, XREADGROUP, XACK and XPENDING.
 */
public class ConsumerGroupCommandExecutor {

    private static final Logger logger = LoggerFactory.getLogger(ConsumerGroupCommandExecutor.class);

    private final DatabaseRegistry databases;
    private final Clock clock;
    private final BlockingCoordinator blocking;
    private final MetricsCollector metrics;

    public ConsumerGroupCommandExecutor(DatabaseRegistry databases, Clock clock,
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
     * XGROUP CREATE key group id|$ [MKSTREAM]. No other subcommand is supported.
     */
    public Reply xgroup(ClientContext client, List<String> args) {
        if ((args.size() != 4 && args.size() != 5) || !"CREATE".equals(Arguments.upper(args.get(0)))) {
            throw ErrorMessages.unsupported("XGROUP", args);
        }
        String key = args.get(1);
        String group = args.get(2);
        String idToken = args.get(3);
        boolean mkStream = args.size() == 5 && "MKSTREAM".equals(Arguments.upper(args.get(4)));
        if (!"$".equals(idToken)) {
            StreamEntryId.parse(idToken);
        }

        Database db = database(client);
        return db.execute(() -> {
            Optional<Stream> existing = db.getStream(key);
            if (existing.isEmpty() && !mkStream) {
                throw new CommandException(ErrorMessages.XGROUP_KEY_NOT_FOUND);
            }
            Stream stream = existing.orElseGet(() -> db.getOrCreateStream(key));
            stream.createGroup(group, idToken);
            logger.debug("Created consumer group {} on {} at {}", group, key, idToken);
            return Reply.ok();
        });
    }

    /**
     * XREADGROUP GROUP group consumer [COUNT n] [BLOCK ms] [NOACK] STREAMS key [key ...] id [id ...]
     */
    public Reply xreadgroup(ClientContext client, List<String> args) {
        Arguments.requireAtLeast(args, 6, "XREADGROUP");
        if (!"GROUP".equals(Arguments.upper(args.get(0)))) {
            throw ErrorMessages.syntaxError();
        }
        String group = args.get(1);
        String consumer = args.get(2);
        int count = 0;
        Duration block = null;
        boolean noAck = false;
        List<String> keys = List.of();
        List<String> idTokens = List.of();

        int i = 3;
        parsing:
        while (i < args.size()) {
            switch (Arguments.upper(args.get(i))) {
                case "COUNT":
                    if (i + 1 >= args.size()) {
                        throw ErrorMessages.wrongNumberOfArguments("XREADGROUP");
                    }
                    count = Arguments.parseInt(args.get(i + 1));
                    i += 2;
                    break;
                case "BLOCK":
                    if (i + 1 >= args.size()) {
                        throw ErrorMessages.wrongNumberOfArguments("XREADGROUP");
                    }
                    block = Arguments.parseBlockTimeout(args.get(i + 1));
                    i += 2;
                    break;
                case "NOACK":
                    noAck = true;
                    i++;
                    break;
                case "STREAMS":
                    List<String> rest = args.subList(i + 1, args.size());
                    if (rest.size() % 2 != 0) {
                        throw new CommandException(ErrorMessages.XREAD_UNBALANCED);
                    }
                    keys = rest.subList(0, rest.size() / 2);
                    idTokens = rest.subList(rest.size() / 2, rest.size());
                    break parsing;
                default:
                    throw ErrorMessages.incorrectArgument(args.get(i));
            }
        }
        if (keys.isEmpty()) {
            throw ErrorMessages.wrongNumberOfArguments("XREADGROUP");
        }
        boolean onlyNew = idTokens.stream().allMatch(ConsumerGroup.NEW_ENTRIES::equals);

        Database db = database(client);
        final List<String> streamKeys = keys;
        final List<String> ids = idTokens;
        final int limit = count;
        final boolean fireAndForget = noAck;
        BlockingRead<Reply> read = () -> {
            // Group first, then ID, key by key; nothing is delivered unless every key resolves
            List<ConsumerGroup> consumerGroups = new ArrayList<>();
            for (int k = 0; k < streamKeys.size(); k++) {
                String key = streamKeys.get(k);
                String token = ids.get(k);
                consumerGroups.add(db.getStream(key)
                        .flatMap(stream -> stream.getGroup(group))
                        .orElseThrow(() -> ErrorMessages.noGroupForRead(key, group)));
                if (!ConsumerGroup.NEW_ENTRIES.equals(token)) {
                    StreamEntryId.parse(token);
                }
            }
            long now = clock.currentTimeMillis();
            Map<String, List<StreamEntry>> results = new LinkedHashMap<>();
            for (int k = 0; k < streamKeys.size(); k++) {
                String key = streamKeys.get(k);
                String token = ids.get(k);
                List<StreamEntry> entries = consumerGroups.get(k).readGroup(now, consumer, token, limit, fireAndForget);
                if (ConsumerGroup.NEW_ENTRIES.equals(token) && entries.isEmpty()) {
                    continue;
                }
                results.put(key, entries);
            }
            return results.isEmpty() ? Optional.empty() : Optional.of(StreamReplies.streams(results));
        };

        // Replaying pending history never waits
        if (block == null || !onlyNew) {
            return db.execute(() -> read.tryRead().orElse(Reply.nullArray()));
        }
        return blocking.await(db, block, client, read, Reply::nullArray).orElse(null);
    }

    /**
     * XACK key group id [id ...]
     */
    public Reply xack(ClientContext client, List<String> args) {
        Arguments.requireAtLeast(args, 3, "XACK");
        String key = args.get(0);
        String group = args.get(1);
        List<String> idTokens = args.subList(2, args.size());

        Database db = database(client);
        return db.execute(() -> {
            Optional<ConsumerGroup> consumerGroup = db.getStream(key).flatMap(stream -> stream.getGroup(group));
            if (consumerGroup.isEmpty()) {
                return Reply.integer(0);
            }
            List<StreamEntryId> ids = new ArrayList<>();
            for (String token : idTokens) {
                ids.add(StreamEntryId.parse(token));
            }
            int acked = consumerGroup.get().ack(ids);
            metrics.recordAcks(acked);
            return Reply.integer(acked);
        });
    }

    /**
     * XPENDING key group [[IDLE min-idle-ms] start end count [consumer]]
     */
    public Reply xpending(ClientContext client, List<String> args) {
        Arguments.requireAtLeast(args, 2, "XPENDING");
        String key = args.get(0);
        String group = args.get(1);
        List<String> rest = args.subList(2, args.size());

        long minIdle = 0;
        if (!rest.isEmpty() && "IDLE".equals(Arguments.upper(rest.get(0)))) {
            if (rest.size() < 2) {
                throw ErrorMessages.syntaxError();
            }
            minIdle = Arguments.parseLong(rest.get(1));
            rest = rest.subList(2, rest.size());
            if (rest.size() < 3) {
                throw ErrorMessages.syntaxError();
            }
        }

        boolean summary = true;
        StreamEntryId start = null;
        StreamEntryId end = null;
        int count = 0;
        String consumer = null;
        if (rest.size() >= 3) {
            summary = false;
            start = StreamEntryId.formatRangeBound(rest.get(0), true, false);
            end = StreamEntryId.formatRangeBound(rest.get(1), false, false);
            count = Arguments.parseInt(rest.get(2));
            rest = rest.subList(3, rest.size());
            if (rest.size() == 1) {
                consumer = rest.get(0);
                rest = List.of();
            }
        }
        if (!rest.isEmpty()) {
            throw ErrorMessages.syntaxError();
        }

        Database db = database(client);
        final boolean summaryOnly = summary;
        final StreamEntryId low = start;
        final StreamEntryId high = end;
        final int limit = count;
        final String consumerFilter = consumer;
        final long idle = minIdle;
        return db.execute(() -> {
            ConsumerGroup consumerGroup = db.getStream(key)
                    .flatMap(stream -> stream.getGroup(group))
                    .orElseThrow(() -> ErrorMessages.noGroup(key, group));
            if (summaryOnly) {
                return summaryReply(consumerGroup.pendingSummary());
            }
            if (consumerGroup.pendingCount() == 0 || limit < 0) {
                return Reply.nullArray();
            }
            long now = clock.currentTimeMillis();
            List<Reply> rows = new ArrayList<>();
            for (PendingEntry row : consumerGroup.pendingDetail(now, low, high, limit, consumerFilter, idle)) {
                rows.add(Reply.array(
                        Reply.bulk(row.getId().toString()),
                        Reply.bulk(row.getConsumer()),
                        Reply.integer(row.idleMillis(now)),
                        Reply.integer(row.getDeliveryCount())));
            }
            return Reply.array(rows);
        });
    }

    private static Reply summaryReply(PendingSummary summary) {
        if (summary.isEmpty()) {
            return Reply.array(Reply.integer(0), Reply.nullBulk(), Reply.nullBulk(), Reply.nullArray());
        }
        List<Reply> consumers = new ArrayList<>();
        for (Map.Entry<String, Long> entry : summary.getConsumerCounts().entrySet()) {
            consumers.add(Reply.array(Reply.bulk(entry.getKey()), Reply.bulk(Long.toString(entry.getValue()))));
        }
        return Reply.array(
                Reply.integer(summary.getTotal()),
                Reply.bulk(summary.getMinId().toString()),
                Reply.bulk(summary.getMaxId().toString()),
                Reply.array(consumers));
    }
}
