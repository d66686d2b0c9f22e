package com.deepansh.collab.room;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Issues short human-typable room codes and maps them to session ids.
 *
 * Codes are scoped to currently active sessions: a code is reserved with
 * putIfAbsent, so two sessions can never hold it at once, and becomes
 * eligible again once released.
 */
@Component
@Slf4j
public class RoomDirectory {

    /** No 0/O, 1/I/L: readable aloud and over a blurry screenshot. */
    static final String ALPHABET = "ABCDEFGHJKMNPQRSTUVWXYZ23456789";
    static final int CODE_LENGTH = 6;
    private static final int MAX_ATTEMPTS = 1_000;

    private final Map<String, String> codeToSession = new ConcurrentHashMap<>();
    private final Random random;

    public RoomDirectory() {
        this(new SecureRandom());
    }

    RoomDirectory(Random random) {
        this.random = random;
    }

    /**
     * Reserve a fresh code for the given session.
     *
     * @throws IllegalStateException when no free code was found
     */
    public String allocate(String sessionId) {
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            String code = randomCode();
            if (codeToSession.putIfAbsent(code, sessionId) == null) {
                log.debug("Room code allocated [code={}, sessionId={}, attempt={}]", code, sessionId, attempt);
                return code;
            }
        }
        throw new IllegalStateException("Could not allocate a room code after " + MAX_ATTEMPTS + " attempts");
    }

    public Optional<String> resolve(String code) {
        if (code == null || code.isBlank()) return Optional.empty();
        return Optional.ofNullable(codeToSession.get(normalize(code)));
    }

    public void release(String code) {
        if (code == null) return;
        if (codeToSession.remove(normalize(code)) != null) {
            log.debug("Room code released [code={}]", code);
        }
    }

    public boolean isActive(String code) {
        return code != null && codeToSession.containsKey(normalize(code));
    }

    public int activeCodes() {
        return codeToSession.size();
    }

    public static boolean looksLikeCode(String candidate) {
        if (candidate == null) return false;
        String c = normalize(candidate);
        if (c.length() != CODE_LENGTH) return false;
        for (char ch : c.toCharArray()) {
            if (ALPHABET.indexOf(ch) < 0) return false;
        }
        return true;
    }

    private String randomCode() {
        StringBuilder sb = new StringBuilder(CODE_LENGTH);
        for (int i = 0; i < CODE_LENGTH; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }

    private static String normalize(String code) {
        return code.trim().toUpperCase(Locale.ROOT);
    }
}
