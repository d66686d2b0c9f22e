package com.deepansh.collab.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/** Payload of set_muted / set_deafened / set_speaking. */
@Data
public class VoiceFlagRequest {

    @NotBlank(message = "sessionId must not be blank")
    private String sessionId;

    @NotNull(message = "value is required")
    private Boolean value;
}
