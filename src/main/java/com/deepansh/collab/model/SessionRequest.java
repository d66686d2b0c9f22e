package com.deepansh.collab.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/** Payload of events that only name a session. */
@Data
public class SessionRequest {

    @NotBlank(message = "sessionId must not be blank")
    private String sessionId;
}
