package com.deepansh.collab.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Role {
    HOST, MEMBER;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
