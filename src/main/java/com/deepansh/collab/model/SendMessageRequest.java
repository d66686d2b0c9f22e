package com.deepansh.collab.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class SendMessageRequest {

    @NotBlank(message = "sessionId must not be blank")
    private String sessionId;

    /** Blank content is rejected by the chat service with EmptyMessage. */
    private String content;

    private String replyTo;
    private String attachedEntityId;

    /** "text" (default) or "reaction". */
    private MessageType type;
}
