package com.deepansh.collab.turn;

import com.deepansh.collab.broadcast.BroadcastFanout;
import com.deepansh.collab.broadcast.ServerEvent;
import com.deepansh.collab.exception.CollabException;
import com.deepansh.collab.exception.ErrorKind;
import com.deepansh.collab.model.Layout;
import com.deepansh.collab.model.Orientation;
import com.deepansh.collab.model.Participant;
import com.deepansh.collab.model.Session;
import com.deepansh.collab.model.SessionStatus;
import com.deepansh.collab.model.TurnResource;
import com.deepansh.collab.model.TurnState;
import com.deepansh.collab.session.SessionGuards;
import com.deepansh.collab.session.SessionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Decides whose turn it is and mediates every state change on turn resources.
 *
 * Shares write ownership of a session with the lifecycle manager; both act
 * only under the session monitor. Validation order for a reveal:
 * session → status → membership → resource → already revealed → turn.
 * Checking "already revealed" before the turn means every attempt after the
 * first successful reveal gets {@code AlreadyRevealed}, whoever makes it.
 * Types whose turns do not advance are free-for-all: any participant may act.
 */
@Service
@Slf4j
public class TurnCoordinator {

    private final SessionRegistry sessionRegistry;
    private final BroadcastFanout fanout;
    private final Clock clock;

    public TurnCoordinator(SessionRegistry sessionRegistry, BroadcastFanout fanout, Clock clock) {
        this.sessionRegistry = sessionRegistry;
        this.fanout = fanout;
        this.clock = clock;
    }

    /**
     * Snapshot the turn order and deal one resource per layout slot.
     * Caller holds the session monitor.
     */
    public TurnState initialize(Session session) {
        List<String> order = new ArrayList<>();
        for (Participant p : session.getParticipants()) {
            order.add(p.getUserId());
        }
        if (session.getPolicy().hostFirst()) {
            order.remove(session.getHostId());
            order.add(0, session.getHostId());
        }

        List<TurnResource> resources = new ArrayList<>();
        Layout layout = session.getLayout();
        if (layout != null) {
            for (Layout.Slot slot : layout.slots()) {
                Orientation orientation = ThreadLocalRandom.current().nextBoolean()
                        ? Orientation.NORMAL : Orientation.INVERTED;
                resources.add(new TurnResource(slot.id(), slot.label(), orientation));
            }
        }

        TurnState state = new TurnState(order, resources);
        session.setTurnState(state);

        log.info("Turns initialized [sessionId={}, order={}, resources={}]",
                session.getId(), order, resources.size());
        return state;
    }

    /**
     * Reveal a resource on behalf of a participant.
     */
    public RevealResult performAction(String sessionId, String userId, String resourceId) {
        Session session = sessionRegistry.require(sessionId);

        synchronized (session) {
            SessionGuards.requireOpen(session);
            if (session.getStatus() != SessionStatus.ACTIVE) {
                throw CollabException.invalidTransition("Session has not started");
            }
            SessionGuards.requireParticipant(session, userId);

            TurnState turns = session.getTurnState();
            TurnResource resource = turns.resource(resourceId)
                    .orElseThrow(() -> CollabException.notFound("Resource", resourceId));

            if (resource.isRevealed()) {
                throw new CollabException(ErrorKind.ALREADY_REVEALED,
                        "Resource " + resourceId + " was already revealed by " + resource.getRevealedBy());
            }

            boolean isHost = session.getHostId().equals(userId);
            String current = turns.currentUserId().orElse(null);
            if (session.getPolicy().turnAdvances() && !isHost && !userId.equals(current)) {
                throw new CollabException(ErrorKind.NOT_YOUR_TURN,
                        "It is " + current + "'s turn");
            }

            Instant now = clock.instant();
            resource.reveal(userId, now);
            session.touch(now);

            fanout.publish(sessionId, ServerEvent.of(ServerEvent.RESOURCE_REVEALED, revealedPayload(session, resource)));

            boolean advanced = false;
            if (session.getPolicy().turnAdvances()) {
                turns.advance();
                advanced = true;
                publishTurn(session);
            }

            log.info("Resource revealed [sessionId={}, resourceId={}, by={}, advanced={}]",
                    sessionId, resourceId, userId, advanced);

            return new RevealResult(resource.getId(), userId, resource.getOrientation(),
                    turns.getCurrentTurnIndex(), turns.currentUserId().orElse(null), advanced);
        }
    }

    /** A late joiner of an open, running session takes the last place in line. */
    public void onParticipantJoined(Session session, String userId) {
        TurnState turns = session.getTurnState();
        if (turns != null && session.getStatus() == SessionStatus.ACTIVE) {
            turns.append(userId);
        }
    }

    /**
     * Drop a leaver from the order; when it was their turn the next remaining
     * participant gets it right away. Caller holds the session monitor.
     */
    public void onParticipantLeft(Session session, String userId) {
        TurnState turns = session.getTurnState();
        if (turns == null) return;

        boolean heldTurn = turns.remove(userId);
        if (heldTurn && !turns.getTurnOrder().isEmpty() && !session.isTerminal()) {
            log.info("Turn holder left, passing turn [sessionId={}, left={}, next={}]",
                    session.getId(), userId, turns.currentUserId().orElse(null));
            publishTurn(session);
        }
    }

    public void publishTurn(Session session) {
        TurnState turns = session.getTurnState();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sessionId", session.getId());
        payload.put("currentTurnIndex", turns.getCurrentTurnIndex());
        payload.put("userId", turns.currentUserId().orElse(null));
        payload.put("turnOrder", List.copyOf(turns.getTurnOrder()));
        fanout.publish(session.getId(), ServerEvent.of(ServerEvent.TURN_CHANGED, payload));
    }

    private Map<String, Object> revealedPayload(Session session, TurnResource resource) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sessionId", session.getId());
        payload.put("resourceId", resource.getId());
        payload.put("position", resource.getPosition());
        payload.put("label", resource.getLabel());
        payload.put("revealedBy", resource.getRevealedBy());
        payload.put("revealedAt", resource.getRevealedAt());
        payload.put("orientation", resource.getOrientation());
        return payload;
    }

    public record RevealResult(
            String resourceId,
            String revealedBy,
            Orientation orientation,
            int currentTurnIndex,
            String currentUserId,
            boolean turnAdvanced
    ) {
    }
}
