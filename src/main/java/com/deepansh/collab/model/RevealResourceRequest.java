package com.deepansh.collab.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class RevealResourceRequest {

    @NotBlank(message = "sessionId must not be blank")
    private String sessionId;

    @NotBlank(message = "resourceId must not be blank")
    private String resourceId;
}
