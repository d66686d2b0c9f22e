package com.deepansh.collab.turn;

import com.deepansh.collab.broadcast.ServerEvent;
import com.deepansh.collab.exception.CollabException;
import com.deepansh.collab.exception.ErrorKind;
import com.deepansh.collab.model.SessionSnapshot;
import com.deepansh.collab.model.SessionType;
import com.deepansh.collab.support.CollabTestHarness;
import com.deepansh.collab.turn.TurnCoordinator.RevealResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TurnCoordinatorTest {

    private CollabTestHarness h;
    private TurnCoordinator turns;
    private String sessionId;

    @BeforeEach
    void setUp() {
        h = new CollabTestHarness();
        turns = h.turnCoordinator;
        SessionSnapshot created = h.create("alice", SessionType.READING, 4);
        sessionId = created.id();
        h.join("bob", created.roomCode());
    }

    @Test
    void threeCardReading_turnPassesAndSecondRevealOfSameSlotIsRejected() {
        h.lifecycleManager.startSession(sessionId, "alice");
        assertThat(h.lifecycleManager.snapshot(sessionId).turn().turnOrder()).containsExactly("alice", "bob");

        RevealResult first = turns.performAction(sessionId, "alice", "slot1");
        assertThat(first.turnAdvanced()).isTrue();
        assertThat(first.currentUserId()).isEqualTo("bob");

        assertKind(() -> turns.performAction(sessionId, "bob", "slot1"), ErrorKind.ALREADY_REVEALED);

        RevealResult second = turns.performAction(sessionId, "bob", "slot2");
        assertThat(second.revealedBy()).isEqualTo("bob");
        assertThat(second.currentUserId()).isEqualTo("alice");
        assertThat(second.currentTurnIndex()).isZero();
    }

    @Test
    void performAction_notTheTurnHolder_rejected() {
        h.lifecycleManager.startSession(sessionId, "alice");

        assertKind(() -> turns.performAction(sessionId, "bob", "slot1"), ErrorKind.NOT_YOUR_TURN);
        assertThat(h.lifecycleManager.snapshot(sessionId).turn().resources())
                .noneMatch(SessionSnapshot.ResourceView::revealed);
    }

    @Test
    void performAction_hostMayActOutOfTurn() {
        h.lifecycleManager.startSession(sessionId, "alice");
        turns.performAction(sessionId, "alice", "slot1"); // bob's turn now

        RevealResult override = turns.performAction(sessionId, "alice", "slot2");

        assertThat(override.revealedBy()).isEqualTo("alice");
        assertThat(override.currentUserId()).isEqualTo("alice");
    }

    @Test
    void performAction_beforeStart_isInvalidTransition() {
        assertKind(() -> turns.performAction(sessionId, "alice", "slot1"), ErrorKind.INVALID_TRANSITION);
    }

    @Test
    void performAction_nonParticipant_isUnauthorized() {
        h.lifecycleManager.startSession(sessionId, "alice");

        assertKind(() -> turns.performAction(sessionId, "mallory", "slot1"), ErrorKind.UNAUTHORIZED);
    }

    @Test
    void performAction_unknownResourceOrSession_isNotFound() {
        h.lifecycleManager.startSession(sessionId, "alice");

        assertKind(() -> turns.performAction(sessionId, "alice", "slot9"), ErrorKind.NOT_FOUND);
        assertKind(() -> turns.performAction("nope", "alice", "slot1"), ErrorKind.NOT_FOUND);
    }

    @Test
    void performAction_completedSession_isSessionClosed() {
        h.lifecycleManager.startSession(sessionId, "alice");
        h.lifecycleManager.endSession(sessionId, "alice");

        assertKind(() -> turns.performAction(sessionId, "alice", "slot1"), ErrorKind.SESSION_CLOSED);
    }

    @Test
    void performAction_broadcastsRevealThenTurnChangeInOrder() {
        h.lifecycleManager.startSession(sessionId, "alice");
        h.channel("bob").clear();

        turns.performAction(sessionId, "alice", "slot1");

        assertThat(h.channel("bob").eventNames())
                .containsSubsequence(ServerEvent.RESOURCE_REVEALED, ServerEvent.TURN_CHANGED);
        Map<String, Object> revealed = h.channel("bob").lastPayload(ServerEvent.RESOURCE_REVEALED);
        assertThat(revealed).containsEntry("resourceId", "slot1").containsEntry("revealedBy", "alice");
        assertThat(revealed.get("orientation")).isNotNull();
        assertThat(h.channel("bob").lastPayload(ServerEvent.TURN_CHANGED)).containsEntry("userId", "bob");
    }

    @Test
    void snapshot_hidesOrientationUntilRevealed() {
        h.lifecycleManager.startSession(sessionId, "alice");
        turns.performAction(sessionId, "alice", "slot1");

        List<SessionSnapshot.ResourceView> resources = h.lifecycleManager.snapshot(sessionId).turn().resources();

        assertThat(resources).extracting(SessionSnapshot.ResourceView::id).containsExactly("slot1", "slot2", "slot3");
        assertThat(resources.get(0).orientation()).isNotNull();
        assertThat(resources.get(1).orientation()).isNull();
        assertThat(resources.get(2).orientation()).isNull();
    }

    @Test
    void turnHolderLeaves_turnPassesToNextRemaining() {
        h.join("carol", sessionId);
        h.lifecycleManager.startSession(sessionId, "alice");
        turns.performAction(sessionId, "alice", "slot1"); // bob's turn
        h.channel("alice").clear();

        h.lifecycleManager.leaveSession(sessionId, "bob");

        SessionSnapshot.TurnView view = h.lifecycleManager.snapshot(sessionId).turn();
        assertThat(view.turnOrder()).containsExactly("alice", "carol");
        assertThat(view.currentUserId()).isEqualTo("carol");
        assertThat(h.channel("alice").lastPayload(ServerEvent.TURN_CHANGED)).containsEntry("userId", "carol");
        assertThat(turns.performAction(sessionId, "carol", "slot2").revealedBy()).isEqualTo("carol");
    }

    @Test
    void freeForAllType_anyParticipantActsAndTurnNeverAdvances() {
        SessionSnapshot exploration = h.create("dora", SessionType.EXPLORATION, 6);
        h.join("eve", exploration.id());
        h.lifecycleManager.startSession(exploration.id(), "dora");

        RevealResult byGuest = turns.performAction(exploration.id(), "eve", "moon");

        assertThat(byGuest.turnAdvanced()).isFalse();
        assertThat(byGuest.currentUserId()).isEqualTo("dora");
        assertThat(h.lifecycleManager.snapshot(exploration.id()).turn().resources()).hasSize(7);
    }

    @Test
    void lateJoinerOfOpenActiveSession_isAppendedToTurnOrder() {
        SessionSnapshot playlist = h.create("dora", SessionType.PLAYLIST_CURATION, 6);
        h.join("eve", playlist.id());
        h.lifecycleManager.startSession(playlist.id(), "dora");

        h.join("frank", playlist.roomCode());

        assertThat(h.lifecycleManager.snapshot(playlist.id()).turn().turnOrder())
                .containsExactly("dora", "eve", "frank");
    }

    @Test
    void concurrentReveals_exactlyOneSucceeds() throws Exception {
        h.lifecycleManager.startSession(sessionId, "alice");
        int attempts = 8;
        ExecutorService pool = Executors.newFixedThreadPool(attempts);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<ErrorKind>> outcomes = new ArrayList<>();
        try {
            for (int i = 0; i < attempts; i++) {
                outcomes.add(pool.submit(() -> {
                    go.await();
                    try {
                        turns.performAction(sessionId, "alice", "slot3");
                        return null;
                    } catch (CollabException e) {
                        return e.getKind();
                    }
                }));
            }
            go.countDown();

            List<ErrorKind> kinds = new ArrayList<>();
            for (Future<ErrorKind> f : outcomes) {
                kinds.add(f.get(5, TimeUnit.SECONDS));
            }
            assertThat(kinds).filteredOn(k -> k == null).hasSize(1);
            assertThat(kinds).filteredOn(k -> k != null).containsOnly(ErrorKind.ALREADY_REVEALED);
        } finally {
            pool.shutdownNow();
        }
        assertThat(h.channel("bob").named(ServerEvent.RESOURCE_REVEALED)).hasSize(1);
    }

    private static void assertKind(Runnable call, ErrorKind kind) {
        assertThatThrownBy(call::run)
                .isInstanceOf(CollabException.class)
                .extracting("kind")
                .isEqualTo(kind);
    }
}
