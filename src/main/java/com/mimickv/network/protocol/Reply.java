package com.mimickv.network.protocol;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable reply sent back to a client.
 * Null bulk strings and null arrays are distinct values on the wire and are
 * kept distinct here.
 */
public final class Reply {

    public enum Type {
        SIMPLE,
        ERROR,
        INTEGER,
        BULK,
        ARRAY
    }

    private static final Reply OK = new Reply(Type.SIMPLE, "OK", 0, null);
    private static final Reply NULL_BULK = new Reply(Type.BULK, null, 0, null);
    private static final Reply NULL_ARRAY = new Reply(Type.ARRAY, null, 0, null);

    private final Type type;
    private final String text;
    private final long integer;
    private final List<Reply> elements;

    private Reply(Type type, String text, long integer, List<Reply> elements) {
        this.type = type;
        this.text = text;
        this.integer = integer;
        this.elements = elements;
    }

    public static Reply ok() {
        return OK;
    }

    public static Reply simple(String text) {
        return new Reply(Type.SIMPLE, Objects.requireNonNull(text), 0, null);
    }

    public static Reply error(String message) {
        return new Reply(Type.ERROR, Objects.requireNonNull(message), 0, null);
    }

    public static Reply integer(long value) {
        return new Reply(Type.INTEGER, null, value, null);
    }

    public static Reply bulk(String value) {
        return value == null ? NULL_BULK : new Reply(Type.BULK, value, 0, null);
    }

    public static Reply nullBulk() {
        return NULL_BULK;
    }

    public static Reply nullArray() {
        return NULL_ARRAY;
    }

    public static Reply array(List<Reply> elements) {
        return new Reply(Type.ARRAY, null, 0, Collections.unmodifiableList(new ArrayList<>(elements)));
    }

    public static Reply array(Reply... elements) {
        return array(Arrays.asList(elements));
    }

    /**
     * An array of bulk strings.
     */
    public static Reply bulkArray(List<String> values) {
        List<Reply> elements = new ArrayList<>(values.size());
        for (String value : values) {
            elements.add(bulk(value));
        }
        return new Reply(Type.ARRAY, null, 0, Collections.unmodifiableList(elements));
    }

    public Type getType() {
        return type;
    }

    /**
     * Text of a simple string, error or bulk string; null for a null bulk string.
     */
    public String getText() {
        return text;
    }

    public long getInteger() {
        return integer;
    }

    /**
     * Elements of an array; null for a null array.
     */
    public List<Reply> getElements() {
        return elements;
    }

    public boolean isError() {
        return type == Type.ERROR;
    }

    public boolean isNull() {
        return (type == Type.BULK && text == null) || (type == Type.ARRAY && elements == null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Reply reply = (Reply) o;
        return integer == reply.integer
                && type == reply.type
                && Objects.equals(text, reply.text)
                && Objects.equals(elements, reply.elements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, integer, elements);
    }

    @Override
    public String toString() {
        switch (type) {
            case SIMPLE:
                return "+" + text;
            case ERROR:
                return "-" + text;
            case INTEGER:
                return ":" + integer;
            case BULK:
                return text == null ? "(nil)" : '"' + text + '"';
            default:
                return elements == null ? "(nil array)" : elements.toString();
        }
    }
}
