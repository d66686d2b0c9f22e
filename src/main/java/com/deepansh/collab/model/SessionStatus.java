package com.deepansh.collab.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SessionStatus {
    WAITING("waiting"),
    ACTIVE("active"),
    COMPLETE("complete");

    private final String wireName;

    SessionStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
