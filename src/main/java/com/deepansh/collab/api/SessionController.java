package com.deepansh.collab.api;

import com.deepansh.collab.chat.ChatService;
import com.deepansh.collab.exception.CollabException;
import com.deepansh.collab.exception.ErrorKind;
import com.deepansh.collab.model.CreateSessionRequest;
import com.deepansh.collab.model.Message;
import com.deepansh.collab.model.SessionSnapshot;
import com.deepansh.collab.model.UserIdentity;
import com.deepansh.collab.presence.PresenceStore;
import com.deepansh.collab.resilience.IdempotencyService;
import com.deepansh.collab.room.RoomDirectory;
import com.deepansh.collab.session.SessionLifecycleManager;
import com.deepansh.collab.session.SessionRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Read-mostly HTTP surface next to the WebSocket protocol.
 *
 * POST /api/v1/sessions
 *   Optional header: Idempotency-Key: <uuid>
 * GET  /api/v1/sessions, /{id}, /{id}/messages, /code/{roomCode}, /health
 *
 * The caller is identified by X-User-Id, as asserted by the upstream gateway.
 */
@RestController
@RequestMapping("/api/v1/sessions")
@RequiredArgsConstructor
@Slf4j
public class SessionController {

    private final SessionLifecycleManager lifecycleManager;
    private final SessionRegistry sessionRegistry;
    private final PresenceStore presenceStore;
    private final RoomDirectory roomDirectory;
    private final ChatService chatService;
    private final IdempotencyService idempotencyService;
    private final ObjectMapper objectMapper;

    @GetMapping
    public ResponseEntity<List<SessionSnapshot.Summary>> list(
            @RequestHeader(value = "X-User-Id", required = false) String userId) {
        return ResponseEntity.ok(lifecycleManager.listSessions(userId));
    }

    @PostMapping
    public ResponseEntity<SessionSnapshot> create(
            @Valid @RequestBody CreateSessionRequest request,
            @RequestHeader("X-User-Id") String userId,
            @RequestHeader(value = "X-Display-Name", required = false) String displayName,
            @RequestHeader(value = "X-Zodiac-Sign", required = false) String zodiacSign,
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey) {

        log.info("Create session request [userId={}, type={}, idempotencyKey={}]",
                userId, request.getType(), idempotencyKey);

        UserIdentity identity = identity(userId, displayName, zodiacSign);
        boolean idempotent = idempotencyKey != null && !idempotencyKey.isBlank();
        if (idempotent) {
            var cached = idempotencyService.findCreated(identity.userId(), idempotencyKey);
            if (cached.isPresent()) {
                try {
                    return ResponseEntity.ok(objectMapper.readValue(cached.get(), SessionSnapshot.class));
                } catch (Exception e) {
                    log.warn("Failed to deserialize cached session, creating fresh", e);
                    idempotencyService.abandon(identity.userId(), idempotencyKey);
                }
            }
            if (!idempotencyService.begin(identity.userId(), idempotencyKey)) {
                throw new CollabException(ErrorKind.INVALID_TRANSITION,
                        "A request with this Idempotency-Key is still being processed");
            }
        }

        SessionSnapshot created;
        try {
            created = lifecycleManager.createSession(identity, request, null);
        } catch (RuntimeException e) {
            if (idempotent) idempotencyService.abandon(identity.userId(), idempotencyKey);
            throw e;
        }

        if (idempotent) {
            try {
                idempotencyService.complete(identity.userId(), idempotencyKey, objectMapper.writeValueAsString(created));
            } catch (Exception e) {
                log.warn("Failed to cache idempotency response", e);
            }
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<SessionSnapshot> get(
            @PathVariable String sessionId,
            @RequestHeader(value = "X-User-Id", required = false) String userId) {
        return ResponseEntity.ok(lifecycleManager.snapshotFor(sessionId, userId));
    }

    @GetMapping("/{sessionId}/messages")
    public ResponseEntity<List<Message>> messages(
            @PathVariable String sessionId,
            @RequestHeader(value = "X-User-Id", required = false) String userId) {
        lifecycleManager.snapshotFor(sessionId, userId);
        return ResponseEntity.ok(chatService.messages(sessionId));
    }

    /** Looks up a room code without joining; returns the listing row. */
    @GetMapping("/code/{roomCode}")
    public ResponseEntity<SessionSnapshot.Summary> byCode(@PathVariable String roomCode) {
        String sessionId = roomDirectory.resolve(roomCode)
                .orElseThrow(() -> new CollabException(ErrorKind.NOT_FOUND, "Room code not found: " + roomCode));
        return ResponseEntity.ok(lifecycleManager.snapshot(sessionId).summary());
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "activeSessions", sessionRegistry.size(),
                "connections", presenceStore.connectionCount(),
                "activeRoomCodes", roomDirectory.activeCodes()));
    }

    private static UserIdentity identity(String userId, String displayName, String zodiacSign) {
        if (userId == null || userId.isBlank()) {
            throw CollabException.badRequest("X-User-Id must not be blank");
        }
        return new UserIdentity(userId.trim(), displayName, zodiacSign);
    }
}
