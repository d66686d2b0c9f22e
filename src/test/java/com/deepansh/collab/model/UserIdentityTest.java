package com.deepansh.collab.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UserIdentityTest {

    @Test
    void constructor_blankDisplayName_derivesFromUserId() {
        assertThat(new UserIdentity("user-1234", " ", null).displayName()).isEqualTo("Seeker_1234");
        assertThat(new UserIdentity("ab", null, null).displayName()).isEqualTo("Seeker_ab");
    }

    @Test
    void constructor_blankUserId_isRejected() {
        assertThatThrownBy(() -> new UserIdentity(" ", "Luna", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void cursorPosition_clampsToViewportPercentages() {
        assertThat(CursorPosition.clamped(-5, 140, "card-1")).isEqualTo(new CursorPosition(0, 100, "card-1"));
        assertThat(CursorPosition.clamped(Double.NaN, 42.5, null)).isEqualTo(new CursorPosition(0, 42.5, null));
    }

    @Test
    void sessionType_acceptsWireAndEnumNames() {
        assertThat(SessionType.fromWire("playlist-curation")).isEqualTo(SessionType.PLAYLIST_CURATION);
        assertThat(SessionType.fromWire("GENERIC_CHAT")).isEqualTo(SessionType.GENERIC_CHAT);
        assertThatThrownBy(() -> SessionType.fromWire("seance")).isInstanceOf(IllegalArgumentException.class);
    }
}
