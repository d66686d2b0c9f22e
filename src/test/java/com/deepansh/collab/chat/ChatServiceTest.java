package com.deepansh.collab.chat;

import com.deepansh.collab.broadcast.ServerEvent;
import com.deepansh.collab.config.CollabProperties;
import com.deepansh.collab.exception.CollabException;
import com.deepansh.collab.exception.ErrorKind;
import com.deepansh.collab.model.Message;
import com.deepansh.collab.model.MessageType;
import com.deepansh.collab.model.SendMessageRequest;
import com.deepansh.collab.model.SessionSnapshot;
import com.deepansh.collab.model.SessionType;
import com.deepansh.collab.support.CollabTestHarness;
import com.deepansh.collab.support.RecordingChannel;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChatServiceTest {

    private CollabTestHarness h;
    private ChatService chat;
    private String sessionId;

    @BeforeEach
    void setUp() {
        CollabProperties properties = new CollabProperties();
        properties.getChat().getRateLimit().setLimitForPeriod(5);
        properties.getChat().getRateLimit().setRefreshPeriod(Duration.ofMinutes(1));
        h = new CollabTestHarness(properties);
        chat = h.chatService;
        SessionSnapshot created = h.create("alice", SessionType.GENERIC_CHAT, 6);
        sessionId = created.id();
        h.join("bob", sessionId);
        h.channel("bob").clear();
    }

    @Test
    void postMessage_appendsAndFansOutTrimmedContent() {
        Message message = chat.postMessage("alice", request("  hello stars  ", null));

        assertThat(message.getContent()).isEqualTo("hello stars");
        assertThat(message.getType()).isEqualTo(MessageType.TEXT);
        assertThat(message.getDisplayName()).isEqualTo("Name-alice");
        assertThat(h.channel("bob").named(ServerEvent.MESSAGE)).singleElement()
                .satisfies(e -> assertThat(((Message) e.payload()).getId()).isEqualTo(message.getId()));
        assertThat(chat.messages(sessionId)).last().extracting(Message::getContent).isEqualTo("hello stars");
    }

    @Test
    void postMessage_blankContent_isEmptyMessage() {
        assertKind(() -> chat.postMessage("alice", request("   ", null)), ErrorKind.EMPTY_MESSAGE);
        assertKind(() -> chat.postMessage("alice", request(null, null)), ErrorKind.EMPTY_MESSAGE);
        assertThat(h.channel("bob").named(ServerEvent.MESSAGE)).isEmpty();
    }

    @Test
    void postMessage_tooLong_isBadRequest() {
        String longContent = "x".repeat(h.properties.getChat().getMaxContentLength() + 1);

        assertKind(() -> chat.postMessage("alice", request(longContent, null)), ErrorKind.BAD_REQUEST);
    }

    @Test
    void postMessage_replyToEarlierMessage_isKept() {
        Message parent = chat.postMessage("alice", request("What does the Tower mean?", null));

        Message reply = chat.postMessage("bob", request("Sudden change", parent.getId()));

        assertThat(reply.getReplyTo()).isEqualTo(parent.getId());
        assertThat(reply.getTimestamp()).isAfter(parent.getTimestamp());
    }

    @Test
    void postMessage_replyToUnknownOrOtherSessionMessage_isInvalidReply() {
        SessionSnapshot other = h.create("dora", SessionType.GENERIC_CHAT, 4);
        Message foreign = chat.postMessage("dora", requestIn(other.id(), "elsewhere", null));

        assertKind(() -> chat.postMessage("alice", request("hi", "missing-id")), ErrorKind.INVALID_REPLY);
        assertKind(() -> chat.postMessage("alice", request("hi", foreign.getId())), ErrorKind.INVALID_REPLY);
    }

    @Test
    void postMessage_sameInstant_timestampsStayStrictlyIncreasing() {
        Message first = chat.postMessage("alice", request("one", null));
        Message second = chat.postMessage("alice", request("two", null));

        assertThat(second.getTimestamp()).isAfter(first.getTimestamp());
    }

    @Test
    void postMessage_systemType_isReservedForServer() {
        SendMessageRequest forged = request("I am the host now", null);
        forged.setType(MessageType.SYSTEM);

        assertKind(() -> chat.postMessage("bob", forged), ErrorKind.UNAUTHORIZED);
    }

    @Test
    void postMessage_nonParticipant_isUnauthorized() {
        assertKind(() -> chat.postMessage("mallory", request("hi", null)), ErrorKind.UNAUTHORIZED);
    }

    @Test
    void postMessage_floodBeyondLimit_isRateLimited() {
        for (int i = 0; i < 5; i++) {
            chat.postMessage("bob", request("msg " + i, null));
        }

        assertKind(() -> chat.postMessage("bob", request("one too many", null)), ErrorKind.RATE_LIMITED);
        assertThat(chat.postMessage("alice", request("still fine", null))).isNotNull();
    }

    @Test
    void addReaction_sameUserAndSymbolTwice_isIdempotent() {
        Message message = chat.postMessage("alice", request("Three of Cups!", null));
        h.channel("bob").clear();

        assertThat(chat.addReaction(sessionId, message.getId(), "bob", "✨", "sparkle")).isTrue();
        assertThat(chat.addReaction(sessionId, message.getId(), "bob", "✨", "sparkle")).isFalse();
        assertThat(chat.addReaction(sessionId, message.getId(), "alice", "✨", null)).isTrue();

        assertThat(chat.messages(sessionId)).last().satisfies(m -> assertThat(m.getReactions()).hasSize(2));
        assertThat(message.getReactions()).isEmpty();
        assertThat(h.channel("bob").named(ServerEvent.REACTION_ADDED)).hasSize(2);
    }

    @Test
    void messageEvent_deliveredLate_stillShowsStateAtPostTime() {
        Deque<Runnable> heldDrains = new ArrayDeque<>();
        CollabTestHarness deferred = new CollabTestHarness(new CollabProperties(), heldDrains::add);
        String id = deferred.create("alice", SessionType.GENERIC_CHAT, 4).id();
        deferred.join("bob", id);
        while (!heldDrains.isEmpty()) heldDrains.poll().run();
        deferred.channel("bob").clear();

        Message posted = deferred.chatService.postMessage("alice", requestIn(id, "hello", null));
        SessionSnapshot before = deferred.lifecycleManager.snapshot(id);
        deferred.chatService.addReaction(id, posted.getId(), "alice", "*", null);
        while (!heldDrains.isEmpty()) heldDrains.poll().run();

        RecordingChannel bob = deferred.channel("bob");
        assertThat(bob.eventNames()).containsExactly(ServerEvent.MESSAGE, ServerEvent.REACTION_ADDED);
        JsonNode frame = new ObjectMapper().findAndRegisterModules()
                .valueToTree(bob.named(ServerEvent.MESSAGE).get(0));
        assertThat(frame.path("payload").path("content").asText()).isEqualTo("hello");
        assertThat(frame.path("payload").path("reactions").isArray()).isTrue();
        assertThat(frame.path("payload").path("reactions").size()).isZero();
        assertThat(before.messages()).last().satisfies(m -> assertThat(m.getReactions()).isEmpty());
        assertThat(deferred.chatService.messages(id)).last()
                .satisfies(m -> assertThat(m.getReactions()).hasSize(1));
    }

    @Test
    void addReaction_unknownMessage_isNotFound() {
        assertKind(() -> chat.addReaction(sessionId, "nope", "bob", "🌙", null), ErrorKind.NOT_FOUND);
    }

    @Test
    void postMessage_clearsTypingIndicator() {
        h.typingTracker.startTyping(sessionId, "bob");
        assertThat(h.typingTracker.isTyping(sessionId, "bob")).isTrue();

        chat.postMessage("bob", request("done typing", null));

        assertThat(h.typingTracker.isTyping(sessionId, "bob")).isFalse();
        assertThat(h.channel("alice").eventNames())
                .containsSubsequence(ServerEvent.TYPING_START, ServerEvent.TYPING_STOP, ServerEvent.MESSAGE);
    }

    private SendMessageRequest request(String content, String replyTo) {
        return requestIn(sessionId, content, replyTo);
    }

    private static SendMessageRequest requestIn(String sessionId, String content, String replyTo) {
        SendMessageRequest request = new SendMessageRequest();
        request.setSessionId(sessionId);
        request.setContent(content);
        request.setReplyTo(replyTo);
        return request;
    }

    private static void assertKind(Runnable call, ErrorKind kind) {
        assertThatThrownBy(call::run)
                .isInstanceOf(CollabException.class)
                .extracting("kind")
                .isEqualTo(kind);
    }
}
