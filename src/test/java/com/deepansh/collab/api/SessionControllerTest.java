package com.deepansh.collab.api;

import com.deepansh.collab.exception.GlobalExceptionHandler;
import com.deepansh.collab.model.SessionSnapshot;
import com.deepansh.collab.model.SessionType;
import com.deepansh.collab.resilience.IdempotencyService;
import com.deepansh.collab.support.CollabTestHarness;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class SessionControllerTest {

    private static final String CREATE_BODY = """
            {"type":"reading","title":"Celtic Cross","maxParticipants":4}
            """;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private CollabTestHarness h;
    private IdempotencyService idempotencyService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        h = new CollabTestHarness();
        idempotencyService = mock(IdempotencyService.class);
        SessionController controller = new SessionController(h.lifecycleManager, h.sessionRegistry,
                h.presenceStore, h.roomDirectory, h.chatService, idempotencyService, objectMapper);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void create_validBody_returns201WithRoomCode() throws Exception {
        mockMvc.perform(post("/api/v1/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-User-Id", "alice")
                        .header("X-Display-Name", "Alice")
                        .content(CREATE_BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.type").value("reading"))
                .andExpect(jsonPath("$.status").value("waiting"))
                .andExpect(jsonPath("$.hostId").value("alice"))
                .andExpect(jsonPath("$.roomCode").isString())
                .andExpect(jsonPath("$.participants", hasSize(1)));
    }

    @Test
    void create_missingUserHeader_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CREATE_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BadRequest"));
    }

    @Test
    void create_blankTitle_failsValidation() throws Exception {
        mockMvc.perform(post("/api/v1/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-User-Id", "alice")
                        .content("{\"type\":\"reading\",\"title\":\"\",\"maxParticipants\":4}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BadRequest"));
    }

    @Test
    void create_capacityOutsideBounds_isInvalidConfig() throws Exception {
        mockMvc.perform(post("/api/v1/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-User-Id", "alice")
                        .content("{\"type\":\"reading\",\"title\":\"Too many\",\"maxParticipants\":40}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("InvalidConfig"));
    }

    @Test
    void create_cachedIdempotencyKey_returnsFirstSessionWithoutCreating() throws Exception {
        SessionSnapshot first = h.lifecycleManager.snapshot(h.create("alice", SessionType.READING, 4).id());
        when(idempotencyService.findCreated("alice", "key-1"))
                .thenReturn(Optional.of(objectMapper.writeValueAsString(first)));

        mockMvc.perform(post("/api/v1/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-User-Id", "alice")
                        .header("Idempotency-Key", "key-1")
                        .content(CREATE_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(first.id()));

        verify(idempotencyService, never()).begin(anyString(), anyString());
        assertThat(h.sessionRegistry.size()).isEqualTo(1);
    }

    @Test
    void create_newIdempotencyKey_claimsThenStoresResponse() throws Exception {
        when(idempotencyService.findCreated("alice", "key-2")).thenReturn(Optional.empty());
        when(idempotencyService.begin("alice", "key-2")).thenReturn(true);

        mockMvc.perform(post("/api/v1/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-User-Id", "alice")
                        .header("Idempotency-Key", "key-2")
                        .content(CREATE_BODY))
                .andExpect(status().isCreated());

        verify(idempotencyService).complete(eq("alice"), eq("key-2"), anyString());
    }

    @Test
    void create_failureWithIdempotencyKey_releasesKey() throws Exception {
        when(idempotencyService.findCreated("alice", "key-3")).thenReturn(Optional.empty());
        when(idempotencyService.begin("alice", "key-3")).thenReturn(true);

        mockMvc.perform(post("/api/v1/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-User-Id", "alice")
                        .header("Idempotency-Key", "key-3")
                        .content("{\"type\":\"reading\",\"title\":\"Secret\",\"maxParticipants\":4,\"isPrivate\":true}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("InvalidConfig"));

        verify(idempotencyService).abandon("alice", "key-3");
        verify(idempotencyService, never()).complete(anyString(), anyString(), anyString());
    }

    @Test
    void create_keyStillInFlight_isConflict() throws Exception {
        when(idempotencyService.findCreated("alice", "key-4")).thenReturn(Optional.empty());
        when(idempotencyService.begin("alice", "key-4")).thenReturn(false);

        mockMvc.perform(post("/api/v1/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-User-Id", "alice")
                        .header("Idempotency-Key", "key-4")
                        .content(CREATE_BODY))
                .andExpect(status().isConflict());

        assertThat(h.sessionRegistry.size()).isZero();
    }

    @Test
    void get_privateSessionForStranger_isForbidden() throws Exception {
        var request = CollabTestHarness.request(SessionType.READING, 4);
        request.setIsPrivate(true);
        request.setPassword("aurora7");
        String sessionId = h.create("alice", request).id();

        mockMvc.perform(get("/api/v1/sessions/" + sessionId).header("X-User-Id", "mallory"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("Unauthorized"));
        mockMvc.perform(get("/api/v1/sessions/" + sessionId).header("X-User-Id", "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.isPrivate").value(true));
    }

    @Test
    void get_unknownSession_is404() throws Exception {
        mockMvc.perform(get("/api/v1/sessions/does-not-exist"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NotFound"));
    }

    @Test
    void list_hidesPrivateSessionsFromNonMembers() throws Exception {
        h.create("alice", SessionType.MEDITATION, 6);
        var hidden = CollabTestHarness.request(SessionType.READING, 4);
        hidden.setIsPrivate(true);
        hidden.setPassword("secret");
        h.create("bob", hidden);

        mockMvc.perform(get("/api/v1/sessions").header("X-User-Id", "carol"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].type").value("meditation"));
        mockMvc.perform(get("/api/v1/sessions").header("X-User-Id", "bob"))
                .andExpect(jsonPath("$", hasSize(2)));
    }

    @Test
    void byCode_resolvesRoomCodeToSummary() throws Exception {
        SessionSnapshot created = h.create("alice", SessionType.CIRCLE, 6);

        mockMvc.perform(get("/api/v1/sessions/code/" + created.roomCode()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(created.id()))
                .andExpect(jsonPath("$.participantCount").value(1));
        mockMvc.perform(get("/api/v1/sessions/code/ZZZZZZ"))
                .andExpect(status().isNotFound());
    }

    @Test
    void messages_returnsChatLogForMembers() throws Exception {
        String sessionId = h.create("alice", SessionType.GENERIC_CHAT, 6).id();
        h.join("bob", sessionId);

        mockMvc.perform(get("/api/v1/sessions/" + sessionId + "/messages").header("X-User-Id", "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].type").value("system"))
                .andExpect(jsonPath("$[0].content").value("Name-bob joined the session"));
    }

    @Test
    void health_reportsCounts() throws Exception {
        h.create("alice", SessionType.MEDITATION, 6);

        mockMvc.perform(get("/api/v1/sessions/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.activeSessions").value(1))
                .andExpect(jsonPath("$.connections").value(1))
                .andExpect(jsonPath("$.activeRoomCodes").value(1));
    }
}
