package com.deepansh.collab.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum SessionType {

    READING("reading", SessionPolicy.builder()
            .minParticipants(2).maxParticipants(8)
            .closedToJoinsWhenActive(true).turnAdvances(true).hostFirst(false)
            .defaultLayout("three-card").build()),
    MEDITATION("meditation", SessionPolicy.builder()
            .minParticipants(2).maxParticipants(12)
            .closedToJoinsWhenActive(false).turnAdvances(false).hostFirst(false)
            .defaultLayout(null).build()),
    EXPLORATION("exploration", SessionPolicy.builder()
            .minParticipants(2).maxParticipants(12)
            .closedToJoinsWhenActive(false).turnAdvances(false).hostFirst(false)
            .defaultLayout("planetary").build()),
    CIRCLE("circle", SessionPolicy.builder()
            .minParticipants(2).maxParticipants(12)
            .closedToJoinsWhenActive(true).turnAdvances(true).hostFirst(true)
            .defaultLayout("zodiac-wheel").build()),
    PLAYLIST_CURATION("playlist-curation", SessionPolicy.builder()
            .minParticipants(2).maxParticipants(12)
            .closedToJoinsWhenActive(false).turnAdvances(false).hostFirst(false)
            .defaultLayout("playlist").build()),
    GENERIC_CHAT("generic-chat", SessionPolicy.builder()
            .minParticipants(2).maxParticipants(12)
            .closedToJoinsWhenActive(false).turnAdvances(false).hostFirst(false)
            .defaultLayout(null).build());

    private final String wireName;
    private final SessionPolicy defaultPolicy;

    SessionType(String wireName, SessionPolicy defaultPolicy) {
        this.wireName = wireName;
        this.defaultPolicy = defaultPolicy;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public SessionPolicy defaultPolicy() {
        return defaultPolicy;
    }

    @JsonCreator
    public static SessionType fromWire(String value) {
        return Arrays.stream(values())
                .filter(t -> t.wireName.equalsIgnoreCase(value) || t.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown session type: " + value));
    }
}
