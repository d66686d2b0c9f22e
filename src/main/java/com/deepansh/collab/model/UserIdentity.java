package com.deepansh.collab.model;

/**
 * Identity supplied by the external auth provider when a client connects.
 * {@code zodiacSign} is decorative and may be null.
 */
public record UserIdentity(String userId, String displayName, String zodiacSign) {

    public UserIdentity {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        if (displayName == null || displayName.isBlank()) {
            displayName = "Seeker_" + userId.substring(Math.max(0, userId.length() - 4));
        }
    }
}
