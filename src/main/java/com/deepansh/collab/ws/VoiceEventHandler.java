package com.deepansh.collab.ws;

import com.deepansh.collab.model.SessionRequest;
import com.deepansh.collab.model.VoiceFlagRequest;
import com.deepansh.collab.presence.ClientConnection;
import com.deepansh.collab.voice.VoiceCoordinator;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Set;

@Component
@RequiredArgsConstructor
public class VoiceEventHandler implements ClientEventHandler {

    private final VoiceCoordinator voiceCoordinator;
    private final PayloadBinder binder;

    @Override
    public Set<String> events() {
        return Set.of("join_voice", "leave_voice", "set_muted", "set_deafened", "set_speaking");
    }

    @Override
    public Object handle(String event, ClientConnection connection, JsonNode payload) {
        String userId = connection.userId();
        return switch (event) {
            case "join_voice" -> voiceCoordinator.joinVoice(
                    binder.bind(payload, SessionRequest.class).getSessionId(), userId);
            case "leave_voice" -> voiceCoordinator.leaveVoice(
                    binder.bind(payload, SessionRequest.class).getSessionId(), userId);
            case "set_muted" -> {
                VoiceFlagRequest flag = binder.bind(payload, VoiceFlagRequest.class);
                yield voiceCoordinator.setMuted(flag.getSessionId(), userId, flag.getValue());
            }
            case "set_deafened" -> {
                VoiceFlagRequest flag = binder.bind(payload, VoiceFlagRequest.class);
                yield voiceCoordinator.setDeafened(flag.getSessionId(), userId, flag.getValue());
            }
            case "set_speaking" -> {
                VoiceFlagRequest flag = binder.bind(payload, VoiceFlagRequest.class);
                yield voiceCoordinator.setSpeaking(flag.getSessionId(), userId, flag.getValue());
            }
            default -> throw new IllegalArgumentException("Unsupported event: " + event);
        };
    }
}
