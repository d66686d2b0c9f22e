package com.deepansh.collab.model;

import lombok.Builder;

@Builder(toBuilder = true)
public record VoiceState(boolean connected, boolean muted, boolean deafened, boolean speaking) {

    public static VoiceState joined() {
        return new VoiceState(true, false, false, false);
    }

    public static VoiceState disconnected() {
        return new VoiceState(false, false, false, false);
    }
}
