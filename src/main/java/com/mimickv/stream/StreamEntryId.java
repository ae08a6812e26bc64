package com.mimickv.stream;

import com.mimickv.core.ErrorMessages;

/**
 * Immutable stream entry ID: a pair of unsigned 64-bit numbers, written as
 * {@code <millis>-<seq>}. IDs are ordered by millis, then by sequence.
 */
public final class StreamEntryId implements Comparable<StreamEntryId> {

    /** Largest unsigned 64-bit value. */
    public static final long MAX_PART = -1L;

    public static final StreamEntryId MIN = new StreamEntryId(0, 0);
    public static final StreamEntryId MAX = new StreamEntryId(MAX_PART, MAX_PART);

    private final long millis;
    private final long seq;

    public StreamEntryId(long millis, long seq) {
        this.millis = millis;
        this.seq = seq;
    }

    /**
     * Parse {@code <millis>-<seq>} or {@code <millis>}. A missing sequence is 0.
     *
     * @param token the textual ID
     * @return the parsed ID
     * @throws com.mimickv.core.CommandException if either part is not an unsigned integer
     */
    public static StreamEntryId parse(String token) {
        return parse(token, 0);
    }

    /**
     * Parse an ID, filling a missing sequence with {@code defaultSeq}.
     */
    public static StreamEntryId parse(String token, long defaultSeq) {
        if (token == null || token.isEmpty()) {
            throw ErrorMessages.invalidStreamId();
        }
        int dash = token.indexOf('-');
        if (dash < 0) {
            return new StreamEntryId(parsePart(token), defaultSeq);
        }
        return new StreamEntryId(parsePart(token.substring(0, dash)), parsePart(token.substring(dash + 1)));
    }

    /**
     * Normalize a user supplied range endpoint into a concrete ID.
     * {@code -} and {@code +} map to the absolute minimum and maximum. A bare
     * millis value gets sequence 0 when it acts as the low end of the scan and
     * the maximum sequence when it acts as the high end; a reverse scan swaps
     * which argument is the high end.
     *
     * @param token    the endpoint as typed by the client
     * @param start    whether this is the first bound argument of the command
     * @param reversed whether the scan runs from high to low IDs
     * @return the concrete bound
     */
    public static StreamEntryId formatRangeBound(String token, boolean start, boolean reversed) {
        if ("-".equals(token)) {
            return MIN;
        }
        if ("+".equals(token)) {
            return MAX;
        }
        if (token != null && token.indexOf('-') < 0) {
            boolean highEnd = start == reversed;
            return new StreamEntryId(parsePart(token), highEnd ? MAX_PART : 0);
        }
        return parse(token);
    }

    private static long parsePart(String part) {
        if (part.isEmpty() || part.charAt(0) == '+' || part.charAt(0) == '-') {
            throw ErrorMessages.invalidStreamId();
        }
        try {
            return Long.parseUnsignedLong(part);
        } catch (NumberFormatException e) {
            throw ErrorMessages.invalidStreamId();
        }
    }

    public long getMillis() {
        return millis;
    }

    public long getSeq() {
        return seq;
    }

    public boolean isZero() {
        return millis == 0 && seq == 0;
    }

    /**
     * The smallest ID greater than this one, or this ID if it is already the maximum.
     */
    public StreamEntryId next() {
        if (seq != MAX_PART) {
            return new StreamEntryId(millis, seq + 1);
        }
        if (millis != MAX_PART) {
            return new StreamEntryId(millis + 1, 0);
        }
        return this;
    }

    @Override
    public int compareTo(StreamEntryId other) {
        int cmp = Long.compareUnsigned(millis, other.millis);
        if (cmp != 0) {
            return cmp;
        }
        return Long.compareUnsigned(seq, other.seq);
    }

    public boolean isAfter(StreamEntryId other) {
        return compareTo(other) > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StreamEntryId that = (StreamEntryId) o;
        return millis == that.millis && seq == that.seq;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(millis) + Long.hashCode(seq);
    }

    @Override
    public String toString() {
        return Long.toUnsignedString(millis) + "-" + Long.toUnsignedString(seq);
    }
}
