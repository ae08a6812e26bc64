package com.mimickv.command;

import com.mimickv.core.Database;
import com.mimickv.core.DatabaseRegistry;
import com.mimickv.core.ErrorMessages;
import com.mimickv.core.VirtualClock;
import com.mimickv.network.protocol.Reply;
import com.mimickv.network.protocol.RespCommand;
import com.mimickv.util.MetricsCollector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class KeyCommandExecutorTest {

    private DatabaseRegistry databases;
    private CommandRouter router;
    private ClientContext client;

    @BeforeEach
    void setUp() {
        databases = new DatabaseRegistry(4);
        router = new CommandRouter(databases, new VirtualClock(), new MetricsCollector());
        client = new ClientContext("test");
    }

    private Reply exec(String... parts) {
        return router.execute(client, RespCommand.of(parts));
    }

    @Test
    void ping_withAndWithoutMessage() {
        assertThat(exec("PING")).isEqualTo(Reply.simple("PONG"));
        assertThat(exec("PING", "hello")).isEqualTo(Reply.bulk("hello"));
        assertThat(exec("PING", "a", "b").isError()).isTrue();
    }

    @Test
    void echo_returnsArgument() {
        assertThat(exec("ECHO", "hi")).isEqualTo(Reply.bulk("hi"));
        assertThat(exec("ECHO")).isEqualTo(Reply.error("ERR wrong number of arguments for 'echo' command"));
    }

    @Test
    void select_switchesDatabase() {
        exec("XADD", "s", "1-0", "f", "v");

        assertThat(exec("SELECT", "2")).isEqualTo(Reply.ok());
        assertThat(client.getDatabaseIndex()).isEqualTo(2);
        assertThat(exec("XLEN", "s")).isEqualTo(Reply.integer(0));

        exec("SELECT", "0");
        assertThat(exec("XLEN", "s")).isEqualTo(Reply.integer(1));
    }

    @Test
    void select_invalidIndex_keepsCurrentDatabase() {
        exec("SELECT", "1");

        assertThat(exec("SELECT", "4")).isEqualTo(Reply.error(ErrorMessages.INVALID_DB_INDEX));
        assertThat(exec("SELECT", "x")).isEqualTo(Reply.error(ErrorMessages.INVALID_INT));
        assertThat(client.getDatabaseIndex()).isEqualTo(1);
    }

    @Test
    void delAndExists_countKeys() {
        exec("XADD", "a", "1-0", "f", "v");
        exec("XADD", "b", "1-0", "f", "v");

        assertThat(exec("EXISTS", "a", "b", "c", "a")).isEqualTo(Reply.integer(3));
        assertThat(exec("DEL", "a", "c")).isEqualTo(Reply.integer(1));
        assertThat(exec("EXISTS", "a")).isEqualTo(Reply.integer(0));
    }

    @Test
    void del_streamDropsGroups() {
        exec("XADD", "s", "1-0", "f", "v");
        exec("XGROUP", "CREATE", "s", "g", "0");

        exec("DEL", "s");
        exec("XADD", "s", "2-0", "f", "v");

        assertThat(exec("XINFO", "GROUPS", "s")).isEqualTo(Reply.array(List.of()));
    }

    @Test
    void type_reportsKeyKind() {
        Database db = databases.get(0);
        db.execute(() -> {
            db.setString("str", "v");
            return null;
        });
        exec("XADD", "s", "1-0", "f", "v");

        assertThat(exec("TYPE", "s")).isEqualTo(Reply.simple("stream"));
        assertThat(exec("TYPE", "str")).isEqualTo(Reply.simple("string"));
        assertThat(exec("TYPE", "nope")).isEqualTo(Reply.simple("none"));
    }

    @Test
    void flushdb_clearsOnlySelectedDatabase() {
        exec("XADD", "s", "1-0", "f", "v");
        exec("SELECT", "1");
        exec("XADD", "s", "1-0", "f", "v");

        assertThat(exec("FLUSHDB")).isEqualTo(Reply.ok());
        assertThat(exec("EXISTS", "s")).isEqualTo(Reply.integer(0));
        exec("SELECT", "0");
        assertThat(exec("EXISTS", "s")).isEqualTo(Reply.integer(1));
    }

    @Test
    void flushall_clearsEveryDatabase() {
        exec("XADD", "s", "1-0", "f", "v");
        exec("SELECT", "3");
        exec("XADD", "s", "1-0", "f", "v");

        assertThat(exec("FLUSHALL")).isEqualTo(Reply.ok());
        assertThat(exec("EXISTS", "s")).isEqualTo(Reply.integer(0));
        exec("SELECT", "0");
        assertThat(exec("EXISTS", "s")).isEqualTo(Reply.integer(0));
    }

    @Test
    void quit_returnsOk() {
        assertThat(exec("QUIT")).isEqualTo(Reply.ok());
    }
}
