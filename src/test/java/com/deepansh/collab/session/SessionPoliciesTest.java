package com.deepansh.collab.session;

import com.deepansh.collab.config.CollabProperties;
import com.deepansh.collab.model.SessionPolicy;
import com.deepansh.collab.model.SessionType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionPoliciesTest {

    @Test
    void policyFor_noOverrides_usesBuiltInDefaults() {
        SessionPolicies policies = new SessionPolicies(new CollabProperties());

        SessionPolicy reading = policies.policyFor(SessionType.READING);
        SessionPolicy meditation = policies.policyFor(SessionType.MEDITATION);

        assertThat(reading.maxParticipants()).isEqualTo(8);
        assertThat(reading.closedToJoinsWhenActive()).isTrue();
        assertThat(reading.defaultLayout()).isEqualTo("three-card");
        assertThat(meditation.turnAdvances()).isFalse();
        assertThat(meditation.acceptsCapacity(12)).isTrue();
        assertThat(meditation.acceptsCapacity(13)).isFalse();
        assertThat(meditation.acceptsCapacity(1)).isFalse();
    }

    @Test
    void policyFor_override_replacesOnlyGivenFields() {
        CollabProperties properties = new CollabProperties();
        CollabProperties.TypeOverride override = new CollabProperties.TypeOverride();
        override.setMaxParticipants(4);
        override.setTurnAdvances(true);
        override.setDefaultLayout("");
        properties.getTypes().put("exploration", override);

        SessionPolicy exploration = new SessionPolicies(properties).policyFor(SessionType.EXPLORATION);

        assertThat(exploration.maxParticipants()).isEqualTo(4);
        assertThat(exploration.minParticipants()).isEqualTo(2);
        assertThat(exploration.turnAdvances()).isTrue();
        assertThat(exploration.closedToJoinsWhenActive()).isFalse();
        assertThat(exploration.defaultLayout()).isNull();
    }

    @Test
    void constructor_minAboveMax_failsAtStartup() {
        CollabProperties properties = new CollabProperties();
        CollabProperties.TypeOverride override = new CollabProperties.TypeOverride();
        override.setMinParticipants(10);
        override.setMaxParticipants(3);
        properties.getTypes().put("circle", override);

        assertThatThrownBy(() -> new SessionPolicies(properties))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("circle");
    }
}
