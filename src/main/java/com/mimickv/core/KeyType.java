package com.mimickv.core;

/**
 * Type tag of a key, as reported by TYPE.
 */
public enum KeyType {
    STRING("string"),
    STREAM("stream");

    private final String wireName;

    KeyType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
