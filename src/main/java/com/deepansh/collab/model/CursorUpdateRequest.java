package com.deepansh.collab.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class CursorUpdateRequest {

    @NotBlank(message = "sessionId must not be blank")
    private String sessionId;

    @NotNull(message = "x is required")
    private Double x;

    @NotNull(message = "y is required")
    private Double y;

    private String element;
}
