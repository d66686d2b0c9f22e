package com.deepansh.collab.exception;

/**
 * Thrown by every engine operation that rejects a request. Raised before
 * any state is mutated, so catching it never leaves a half-applied change.
 */
public class CollabException extends RuntimeException {

    private final ErrorKind kind;

    public CollabException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static CollabException notFound(String what, String id) {
        return new CollabException(ErrorKind.NOT_FOUND, what + " not found: " + id);
    }

    public static CollabException unauthorized(String message) {
        return new CollabException(ErrorKind.UNAUTHORIZED, message);
    }

    public static CollabException invalidTransition(String message) {
        return new CollabException(ErrorKind.INVALID_TRANSITION, message);
    }

    public static CollabException invalidConfig(String message) {
        return new CollabException(ErrorKind.INVALID_CONFIG, message);
    }

    public static CollabException sessionClosed(String sessionId) {
        return new CollabException(ErrorKind.SESSION_CLOSED, "Session is closed: " + sessionId);
    }

    public static CollabException badRequest(String message) {
        return new CollabException(ErrorKind.BAD_REQUEST, message);
    }
}
