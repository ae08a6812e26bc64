package com.mimickv.command;

import com.mimickv.network.protocol.Reply;
import com.mimickv.stream.StreamEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reply shapes for stream data.
 */
final class StreamReplies {

    private StreamReplies() {
        // Utility class
    }

    /**
     * {@code [id, [field, value, ...]]}
     */
    static Reply entry(StreamEntry entry) {
        return Reply.array(Reply.bulk(entry.getId().toString()), Reply.bulkArray(entry.getValues()));
    }

    static Reply entries(List<StreamEntry> entries) {
        List<Reply> replies = new ArrayList<>(entries.size());
        for (StreamEntry entry : entries) {
            replies.add(entry(entry));
        }
        return Reply.array(replies);
    }

    /**
     * {@code [[key, entries], ...]} in the given map order, or a null array when empty.
     */
    static Reply streams(Map<String, List<StreamEntry>> results) {
        if (results.isEmpty()) {
            return Reply.nullArray();
        }
        List<Reply> replies = new ArrayList<>(results.size());
        for (Map.Entry<String, List<StreamEntry>> result : results.entrySet()) {
            replies.add(Reply.array(Reply.bulk(result.getKey()), entries(result.getValue())));
        }
        return Reply.array(replies);
    }
}
