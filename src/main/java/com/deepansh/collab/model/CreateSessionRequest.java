package com.deepansh.collab.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateSessionRequest {

    @NotNull(message = "type is required")
    private SessionType type;

    @NotBlank(message = "title must not be blank")
    @Size(max = 120)
    private String title;

    @Size(max = 1000)
    private String description;

    /** Checked against the type's bounds; a missing value is rejected there. */
    private Integer maxParticipants;

    private Boolean isPrivate;

    /** Required when isPrivate. */
    private String password;

    /** Optional layout name; defaults to the type's layout. */
    private String layout;

    public boolean privateSession() {
        return Boolean.TRUE.equals(isPrivate);
    }
}
