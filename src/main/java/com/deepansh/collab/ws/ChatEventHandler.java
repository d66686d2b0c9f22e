package com.deepansh.collab.ws;

import com.deepansh.collab.chat.ChatService;
import com.deepansh.collab.chat.TypingTracker;
import com.deepansh.collab.model.AddReactionRequest;
import com.deepansh.collab.model.Message;
import com.deepansh.collab.model.SendMessageRequest;
import com.deepansh.collab.model.SessionRequest;
import com.deepansh.collab.presence.ClientConnection;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

@Component
@RequiredArgsConstructor
public class ChatEventHandler implements ClientEventHandler {

    private final ChatService chatService;
    private final TypingTracker typingTracker;
    private final PayloadBinder binder;

    @Override
    public Set<String> events() {
        return Set.of("send_message", "add_reaction", "typing_start", "typing_stop");
    }

    @Override
    public Object handle(String event, ClientConnection connection, JsonNode payload) {
        String userId = connection.userId();
        return switch (event) {
            case "send_message" -> {
                Message message = chatService.postMessage(userId, binder.bind(payload, SendMessageRequest.class));
                yield Map.of("messageId", message.getId(), "timestamp", message.getTimestamp());
            }
            case "add_reaction" -> {
                AddReactionRequest request = binder.bind(payload, AddReactionRequest.class);
                boolean added = chatService.addReaction(request.getSessionId(), request.getMessageId(),
                        userId, request.getSymbol(), request.getLabel());
                yield Map.of("messageId", request.getMessageId(), "added", added);
            }
            case "typing_start" -> {
                typingTracker.startTyping(binder.bind(payload, SessionRequest.class).getSessionId(), userId);
                yield null;
            }
            case "typing_stop" -> {
                typingTracker.stopTyping(binder.bind(payload, SessionRequest.class).getSessionId(), userId);
                yield null;
            }
            default -> throw new IllegalArgumentException("Unsupported event: " + event);
        };
    }
}
