package com.mimickv.command;

import com.mimickv.core.DatabaseRegistry;
import com.mimickv.core.VirtualClock;
import com.mimickv.network.protocol.Reply;
import com.mimickv.network.protocol.RespCommand;
import com.mimickv.util.MetricsCollector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CommandRouterTest {

    private MetricsCollector metrics;
    private CommandRouter router;
    private ClientContext client;

    @BeforeEach
    void setUp() {
        metrics = new MetricsCollector();
        router = new CommandRouter(new DatabaseRegistry(), new VirtualClock(), metrics);
        client = new ClientContext("test");
    }

    @Test
    void execute_matchesNamesCaseInsensitively() {
        Reply upper = router.execute(client, RespCommand.of("PING"));
        Reply lower = router.execute(client, RespCommand.of("ping"));
        Reply mixed = router.execute(client, RespCommand.of("xLen", "s"));

        assertThat(upper).isEqualTo(Reply.simple("PONG"));
        assertThat(lower).isEqualTo(Reply.simple("PONG"));
        assertThat(mixed).isEqualTo(Reply.integer(0));
    }

    @Test
    void execute_unknownCommand_returnsError() {
        Reply reply = router.execute(client, RespCommand.of("nosuch", "a", "b"));

        assertThat(reply).isEqualTo(Reply.error("ERR unknown command `NOSUCH`, with args beginning with: 'a' 'b' "));
        assertThat(metrics.getTotalErrors()).isEqualTo(1);
    }

    @Test
    void execute_recordsCommandMetrics() {
        router.execute(client, RespCommand.of("XADD", "s", "*", "f", "v"));
        router.execute(client, RespCommand.of("XADD", "s", "*", "f", "v"));
        router.execute(client, RespCommand.of("XLEN", "s"));

        assertThat(metrics.getCommandCount("XADD")).isEqualTo(2);
        assertThat(metrics.getCommandCount("XLEN")).isEqualTo(1);
        assertThat(metrics.getEntriesAppended()).isEqualTo(2);
        assertThat(metrics.getTotalErrors()).isZero();
    }

    @Test
    void execute_commandError_countsAsError() {
        Reply reply = router.execute(client, RespCommand.of("XADD", "s", "0-0", "f", "v"));

        assertThat(reply.isError()).isTrue();
        assertThat(metrics.getTotalErrors()).isEqualTo(1);
        assertThat(metrics.getCommandCount("XADD")).isEqualTo(1);
    }

    @Test
    void execute_unexpectedFailure_becomesInternalError() {
        Reply reply = router.execute(client, RespCommand.of("XADD", null, "*", "f", "v"));

        assertThat(reply).isEqualTo(Reply.error("ERR internal error: Key cannot be null"));
        assertThat(metrics.getTotalErrors()).isEqualTo(1);
    }

    @Test
    void commandNames_coverStreamSurface() {
        assertThat(router.getCommandNames()).contains(
            "XADD", "XLEN", "XRANGE", "XREVRANGE", "XDEL", "XREAD",
            "XGROUP", "XREADGROUP", "XACK", "XPENDING", "XINFO",
            "PING", "SELECT", "DEL", "TYPE", "FLUSHALL");
        assertThatThrownBy(() -> router.getCommandNames().add("SET"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void respCommand_upperCasesName() {
        RespCommand command = RespCommand.of(List.of("xadd", "s", "*"));

        assertThat(command.getName()).isEqualTo("XADD");
        assertThat(command.getArgs()).containsExactly("s", "*");
    }
}
