package com.deepansh.collab.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Decorative; the engine never interprets it. */
public enum Orientation {
    NORMAL, INVERTED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
