package com.deepansh.collab.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MessageType {
    TEXT, REACTION, SYSTEM;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static MessageType fromWire(String value) {
        return MessageType.valueOf(value.trim().toUpperCase());
    }
}
