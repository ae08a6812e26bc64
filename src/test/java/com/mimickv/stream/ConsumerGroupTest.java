package com.mimickv.stream;

import com.mimickv.core.CommandException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ConsumerGroupTest {

    private Stream stream;
    private ConsumerGroup group;

    @BeforeEach
    void setUp() {
        stream = new Stream();
        stream.add("1-0", List.of("n", "1"), 0);
        stream.add("2-0", List.of("n", "2"), 0);
        stream.add("3-0", List.of("n", "3"), 0);
        group = stream.createGroup("g", "0");
    }

    private static List<String> ids(List<StreamEntry> entries) {
        return entries.stream().map(e -> e.getId().toString()).toList();
    }

    @Test
    void readNew_deliversAndAdvancesCursor() {
        List<StreamEntry> first = group.readGroup(100, "alice", ">", 2, false);
        List<StreamEntry> second = group.readGroup(100, "bob", ">", 0, false);
        List<StreamEntry> third = group.readGroup(100, "bob", ">", 0, false);

        assertThat(ids(first)).containsExactly("1-0", "2-0");
        assertThat(ids(second)).containsExactly("3-0");
        assertThat(third).isEmpty();
        assertThat(group.getLastDeliveredId().toString()).isEqualTo("3-0");
    }

    @Test
    void readNew_eachEntryDeliveredToOneConsumer() {
        group.readGroup(0, "alice", ">", 1, false);
        group.readGroup(0, "bob", ">", 1, false);

        assertThat(group.pendingCount("alice")).isEqualTo(1);
        assertThat(group.pendingCount("bob")).isEqualTo(1);
        assertThat(group.pendingCount()).isEqualTo(2);
    }

    @Test
    void readNew_recordsPendingRowWithDeliveryData() {
        group.readGroup(500, "alice", ">", 1, false);

        List<PendingEntry> rows = group.pendingDetail(800, StreamEntryId.MIN, StreamEntryId.MAX, 10, null, 0);

        assertThat(rows).hasSize(1);
        PendingEntry row = rows.get(0);
        assertThat(row.getId().toString()).isEqualTo("1-0");
        assertThat(row.getConsumer()).isEqualTo("alice");
        assertThat(row.getDeliveryCount()).isEqualTo(1);
        assertThat(row.idleMillis(800)).isEqualTo(300);
    }

    @Test
    void readNew_noAck_advancesWithoutPending() {
        List<StreamEntry> read = group.readGroup(0, "alice", ">", 0, true);

        assertThat(read).hasSize(3);
        assertThat(group.pendingCount()).isZero();
        assertThat(group.getLastDeliveredId().toString()).isEqualTo("3-0");
    }

    @Test
    void readGroup_registersConsumerEvenWhenNothingDelivered() {
        group.readGroup(0, "alice", ">", 0, false);
        group.readGroup(42, "carol", ">", 0, false);

        assertThat(group.getConsumers()).extracting(Consumer::getName).containsExactly("alice", "carol");
        assertThat(group.getConsumers()).filteredOn(c -> c.getName().equals("carol"))
            .extracting(Consumer::getLastSeenMillis).containsExactly(42L);
    }

    @Test
    void replay_returnsOnlyOwnPendingAfterId() {
        group.readGroup(0, "alice", ">", 2, false);
        group.readGroup(0, "bob", ">", 1, false);

        assertThat(ids(group.readGroup(0, "alice", "0", 0, false))).containsExactly("1-0", "2-0");
        assertThat(ids(group.readGroup(0, "alice", "1-0", 0, false))).containsExactly("2-0");
        assertThat(ids(group.readGroup(0, "bob", "0-0", 0, false))).containsExactly("3-0");
        assertThat(ids(group.readGroup(0, "alice", "0", 1, false))).containsExactly("1-0");
    }

    @Test
    void replay_doesNotChangeCursorOrDeliveryCount() {
        group.readGroup(10, "alice", ">", 1, false);

        group.readGroup(20, "alice", "0", 0, false);

        assertThat(group.getLastDeliveredId().toString()).isEqualTo("1-0");
        PendingEntry row = group.pendingDetail(20, StreamEntryId.MIN, StreamEntryId.MAX, 10, null, 0).get(0);
        assertThat(row.getDeliveryCount()).isEqualTo(1);
        assertThat(row.getLastDeliveryMillis()).isEqualTo(10);
    }

    @Test
    void replay_skipsEntriesDeletedFromStream() {
        group.readGroup(0, "alice", ">", 0, false);
        stream.delete(List.of(StreamEntryId.parse("2-0")));

        assertThat(ids(group.readGroup(0, "alice", "0", 0, false))).containsExactly("1-0", "3-0");
        assertThat(group.pendingCount("alice")).isEqualTo(3);
    }

    @Test
    void replay_malformedId_throws() {
        assertThatThrownBy(() -> group.readGroup(0, "alice", "bogus", 0, false))
            .isInstanceOf(CommandException.class);
    }

    @Test
    void ack_removesRowsAndIgnoresUnknown() {
        group.readGroup(0, "alice", ">", 0, false);

        int removed = group.ack(List.of(StreamEntryId.parse("1-0"), StreamEntryId.parse("9-9")));

        assertThat(removed).isEqualTo(1);
        assertThat(group.ack(List.of(StreamEntryId.parse("1-0")))).isZero();
        assertThat(group.pendingCount("alice")).isEqualTo(2);
    }

    @Test
    void ack_worksForAnyConsumersRow() {
        group.readGroup(0, "alice", ">", 1, false);

        assertThat(group.ack(List.of(StreamEntryId.parse("1-0")))).isEqualTo(1);
        assertThat(group.pendingCount()).isZero();
    }

    @Test
    void pendingRows_surviveStreamTrim() {
        group.readGroup(0, "alice", ">", 0, false);
        stream.trim(0);

        assertThat(group.pendingCount()).isEqualTo(3);
        assertThat(group.readGroup(0, "alice", "0", 0, false)).isEmpty();
    }

    @Test
    void pendingSummary_countsPerConsumer() {
        group.readGroup(0, "bob", ">", 1, false);
        group.readGroup(0, "alice", ">", 2, false);

        PendingSummary summary = group.pendingSummary();

        assertThat(summary.getTotal()).isEqualTo(3);
        assertThat(summary.getMinId().toString()).isEqualTo("1-0");
        assertThat(summary.getMaxId().toString()).isEqualTo("3-0");
        assertThat(summary.getConsumerCounts()).containsExactly(entry("alice", 2L), entry("bob", 1L));
    }

    @Test
    void pendingSummary_emptyGroup() {
        PendingSummary summary = group.pendingSummary();

        assertThat(summary.isEmpty()).isTrue();
        assertThat(summary.getMinId()).isNull();
        assertThat(summary.getConsumerCounts()).isEmpty();
    }

    @Test
    void pendingDetail_filtersByRangeConsumerAndIdle() {
        group.readGroup(0, "alice", ">", 1, false);
        group.readGroup(50, "bob", ">", 1, false);
        group.readGroup(90, "alice", ">", 1, false);

        assertThat(group.pendingDetail(100, StreamEntryId.parse("2-0"), StreamEntryId.MAX, 10, null, 0))
            .extracting(p -> p.getId().toString()).containsExactly("2-0", "3-0");
        assertThat(group.pendingDetail(100, StreamEntryId.MIN, StreamEntryId.MAX, 10, "alice", 0))
            .extracting(p -> p.getId().toString()).containsExactly("1-0", "3-0");
        assertThat(group.pendingDetail(100, StreamEntryId.MIN, StreamEntryId.MAX, 10, null, 50))
            .extracting(p -> p.getId().toString()).containsExactly("1-0", "2-0");
        assertThat(group.pendingDetail(100, StreamEntryId.MIN, StreamEntryId.MAX, 1, null, 0)).hasSize(1);
        assertThat(group.pendingDetail(100, StreamEntryId.MIN, StreamEntryId.MAX, 0, null, 0)).isEmpty();
    }

    @Test
    void createGroup_atLastId_seesOnlyLaterEntries() {
        ConsumerGroup late = stream.createGroup("late", "$");
        stream.add("4-0", List.of("n", "4"), 0);

        assertThat(ids(late.readGroup(0, "c", ">", 0, false))).containsExactly("4-0");
    }
}
