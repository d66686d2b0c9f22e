package com.deepansh.collab.exception;

import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.http.HttpStatus;

/**
 * Rejection kinds reported to clients. The wire code is what appears in
 * the {@code error} event and in REST error bodies.
 */
public enum ErrorKind {

    NOT_FOUND("NotFound", HttpStatus.NOT_FOUND),
    UNAUTHORIZED("Unauthorized", HttpStatus.FORBIDDEN),
    INVALID_TRANSITION("InvalidTransition", HttpStatus.CONFLICT),
    FULL("Full", HttpStatus.CONFLICT),
    NOT_YOUR_TURN("NotYourTurn", HttpStatus.CONFLICT),
    ALREADY_REVEALED("AlreadyRevealed", HttpStatus.CONFLICT),
    INVALID_REPLY("InvalidReply", HttpStatus.BAD_REQUEST),
    EMPTY_MESSAGE("EmptyMessage", HttpStatus.BAD_REQUEST),
    PRIVATE_AUTH_FAILED("PrivateAuthFailed", HttpStatus.FORBIDDEN),
    RATE_LIMITED("RateLimited", HttpStatus.TOO_MANY_REQUESTS),
    INVALID_CONFIG("InvalidConfig", HttpStatus.BAD_REQUEST),
    SESSION_CLOSED("SessionClosed", HttpStatus.GONE),
    CLOSED_TO_JOINS("ClosedToJoins", HttpStatus.CONFLICT),
    BAD_REQUEST("BadRequest", HttpStatus.BAD_REQUEST);

    private final String code;
    private final HttpStatus httpStatus;

    ErrorKind(String code, HttpStatus httpStatus) {
        this.code = code;
        this.httpStatus = httpStatus;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public HttpStatus httpStatus() {
        return httpStatus;
    }
}
