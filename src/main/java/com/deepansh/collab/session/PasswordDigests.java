package com.deepansh.collab.session;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 digests for private-session passwords. Sessions are short-lived
 * and in-memory, so the plain password is simply never kept.
 */
final class PasswordDigests {

    private PasswordDigests() {
    }

    static String digest(String password) {
        if (password == null) return null;
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(password.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static boolean matches(String candidate, String expectedDigest) {
        if (expectedDigest == null) return true;
        if (candidate == null) return false;
        return MessageDigest.isEqual(
                digest(candidate).getBytes(StandardCharsets.US_ASCII),
                expectedDigest.getBytes(StandardCharsets.US_ASCII));
    }
}
