package com.deepansh.collab.session;

import com.deepansh.collab.config.CollabProperties;
import com.deepansh.collab.config.CollabProperties.TypeOverride;
import com.deepansh.collab.model.SessionPolicy;
import com.deepansh.collab.model.SessionType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Resolves the effective policy per session type: built-in defaults with
 * any {@code collab.types.<type>.*} overrides applied on top.
 */
@Component
@Slf4j
public class SessionPolicies {

    private final Map<SessionType, SessionPolicy> policies = new EnumMap<>(SessionType.class);

    public SessionPolicies(CollabProperties properties) {
        for (SessionType type : SessionType.values()) {
            TypeOverride override = properties.getTypes().get(type.wireName());
            SessionPolicy policy = override == null ? type.defaultPolicy() : merge(type.defaultPolicy(), override);
            if (policy.minParticipants() < 1 || policy.minParticipants() > policy.maxParticipants()) {
                throw new IllegalStateException("Invalid participant bounds for type " + type.wireName());
            }
            policies.put(type, policy);
        }
        log.info("Session policies resolved: {}", policies);
    }

    public SessionPolicy policyFor(SessionType type) {
        return policies.get(type);
    }

    private SessionPolicy merge(SessionPolicy base, TypeOverride o) {
        SessionPolicy.SessionPolicyBuilder b = base.toBuilder();
        if (o.getMinParticipants() != null) b.minParticipants(o.getMinParticipants());
        if (o.getMaxParticipants() != null) b.maxParticipants(o.getMaxParticipants());
        if (o.getClosedToJoinsWhenActive() != null) b.closedToJoinsWhenActive(o.getClosedToJoinsWhenActive());
        if (o.getTurnAdvances() != null) b.turnAdvances(o.getTurnAdvances());
        if (o.getHostFirst() != null) b.hostFirst(o.getHostFirst());
        if (o.getDefaultLayout() != null) {
            b.defaultLayout(o.getDefaultLayout().isBlank() ? null : o.getDefaultLayout());
        }
        return b.build();
    }
}
