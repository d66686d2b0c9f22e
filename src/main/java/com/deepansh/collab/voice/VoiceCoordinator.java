package com.deepansh.collab.voice;

import com.deepansh.collab.broadcast.BroadcastFanout;
import com.deepansh.collab.broadcast.ServerEvent;
import com.deepansh.collab.exception.CollabException;
import com.deepansh.collab.model.Participant;
import com.deepansh.collab.model.Session;
import com.deepansh.collab.model.VoiceState;
import com.deepansh.collab.session.SessionGuards;
import com.deepansh.collab.session.SessionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Voice signaling state per participant. Audio is out of band; this only
 * tracks and broadcasts connected / muted / deafened / speaking flags.
 *
 * Rules:
 * - mute, deafen and speaking require a connected voice state
 * - muting clears speaking
 * - speaking while muted is ignored
 * - unchanged state is not rebroadcast
 */
@Service
@Slf4j
public class VoiceCoordinator {

    private final SessionRegistry sessionRegistry;
    private final BroadcastFanout fanout;
    private final VoiceGrantService grantService;
    private final Clock clock;

    public VoiceCoordinator(SessionRegistry sessionRegistry,
                            BroadcastFanout fanout,
                            VoiceGrantService grantService,
                            Clock clock) {
        this.sessionRegistry = sessionRegistry;
        this.fanout = fanout;
        this.grantService = grantService;
        this.clock = clock;
    }

    public VoiceState joinVoice(String sessionId, String userId) {
        Session session = sessionRegistry.require(sessionId);
        synchronized (session) {
            SessionGuards.requireOpen(session);
            Participant p = SessionGuards.requireParticipant(session, userId);
            if (current(p).connected()) {
                return p.getVoiceState();
            }
            VoiceState state = apply(session, p, s -> VoiceState.joined());
            grantService.issueCredentials(sessionId, userId);
            return state;
        }
    }

    public VoiceState leaveVoice(String sessionId, String userId) {
        Session session = sessionRegistry.require(sessionId);
        synchronized (session) {
            SessionGuards.requireOpen(session);
            Participant p = SessionGuards.requireParticipant(session, userId);
            return apply(session, p, s -> VoiceState.disconnected());
        }
    }

    public VoiceState setMuted(String sessionId, String userId, boolean muted) {
        return updateConnected(sessionId, userId,
                s -> s.toBuilder().muted(muted).speaking(!muted && s.speaking()).build());
    }

    public VoiceState setDeafened(String sessionId, String userId, boolean deafened) {
        return updateConnected(sessionId, userId, s -> s.toBuilder().deafened(deafened).build());
    }

    public VoiceState setSpeaking(String sessionId, String userId, boolean speaking) {
        return updateConnected(sessionId, userId,
                s -> speaking && s.muted() ? s : s.toBuilder().speaking(speaking).build());
    }

    private VoiceState updateConnected(String sessionId, String userId, UnaryOperator<VoiceState> change) {
        Session session = sessionRegistry.require(sessionId);
        synchronized (session) {
            SessionGuards.requireOpen(session);
            Participant p = SessionGuards.requireParticipant(session, userId);
            if (!current(p).connected()) {
                throw CollabException.invalidTransition("Join voice before changing voice settings");
            }
            return apply(session, p, change);
        }
    }

    /** Caller holds the session monitor. */
    private VoiceState apply(Session session, Participant p, UnaryOperator<VoiceState> change) {
        VoiceState before = current(p);
        VoiceState after = change.apply(before);
        if (after.equals(before)) {
            return before;
        }
        p.setVoiceState(after);
        session.touch(clock.instant());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sessionId", session.getId());
        payload.put("userId", p.getUserId());
        payload.put("voiceState", after);
        fanout.publish(session.getId(), ServerEvent.of(ServerEvent.VOICE_STATE, payload));

        log.debug("Voice state changed [sessionId={}, userId={}, state={}]", session.getId(), p.getUserId(), after);
        return after;
    }

    private static VoiceState current(Participant p) {
        return p.getVoiceState() != null ? p.getVoiceState() : VoiceState.disconnected();
    }
}
