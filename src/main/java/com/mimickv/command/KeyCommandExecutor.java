package com.mimickv.command;

import com.mimickv.core.Database;
import com.mimickv.core.DatabaseRegistry;
import com.mimickv.core.ErrorMessages;
import com.mimickv.core.KeyType;
import com.mimickv.network.protocol.Reply;

import java.util.List;

/**
 * Connection and key registry commands: PING, ECHO, SELECT, DEL, EXISTS,
 * TYPE, FLUSHDB, FLUSHALL and QUIT.
 */
public class KeyCommandExecutor {

    private final DatabaseRegistry databases;

    public KeyCommandExecutor(DatabaseRegistry databases) {
        this.databases = databases;
    }

    private Database database(ClientContext client) {
        return databases.get(client.getDatabaseIndex());
    }

    public Reply ping(ClientContext client, List<String> args) {
        if (args.size() > 1) {
            throw ErrorMessages.wrongNumberOfArguments("PING");
        }
        return args.isEmpty() ? Reply.simple("PONG") : Reply.bulk(args.get(0));
    }

    public Reply echo(ClientContext client, List<String> args) {
        Arguments.requireExactly(args, 1, "ECHO");
        return Reply.bulk(args.get(0));
    }

    public Reply select(ClientContext client, List<String> args) {
        Arguments.requireExactly(args, 1, "SELECT");
        int index = Arguments.parseInt(args.get(0));
        databases.get(index);
        client.selectDatabase(index);
        return Reply.ok();
    }

    public Reply del(ClientContext client, List<String> args) {
        Arguments.requireAtLeast(args, 1, "DEL");
        Database db = database(client);
        return db.execute(() -> {
            long deleted = 0;
            for (String key : args) {
                if (db.delete(key)) {
                    deleted++;
                }
            }
            return Reply.integer(deleted);
        });
    }

    public Reply exists(ClientContext client, List<String> args) {
        Arguments.requireAtLeast(args, 1, "EXISTS");
        Database db = database(client);
        return db.execute(() -> {
            long found = 0;
            for (String key : args) {
                if (db.exists(key)) {
                    found++;
                }
            }
            return Reply.integer(found);
        });
    }

    public Reply type(ClientContext client, List<String> args) {
        Arguments.requireExactly(args, 1, "TYPE");
        Database db = database(client);
        return db.execute(() -> Reply.simple(db.type(args.get(0)).map(KeyType::getWireName).orElse("none")));
    }

    public Reply flushdb(ClientContext client, List<String> args) {
        Arguments.requireExactly(args, 0, "FLUSHDB");
        Database db = database(client);
        return db.execute(() -> {
            db.flush();
            return Reply.ok();
        });
    }

    public Reply flushall(ClientContext client, List<String> args) {
        Arguments.requireExactly(args, 0, "FLUSHALL");
        databases.flushAll();
        return Reply.ok();
    }

    /**
     * The connection closes itself once this reply is written.
     */
    public Reply quit(ClientContext client, List<String> args) {
        return Reply.ok();
    }
}
