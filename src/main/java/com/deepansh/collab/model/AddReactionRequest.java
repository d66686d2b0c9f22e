package com.deepansh.collab.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class AddReactionRequest {

    @NotBlank(message = "sessionId must not be blank")
    private String sessionId;

    @NotBlank(message = "messageId must not be blank")
    private String messageId;

    @NotBlank(message = "symbol must not be blank")
    @Size(max = 32)
    private String symbol;

    @Size(max = 64)
    private String label;
}
