package com.nosota.mvault.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request for proposing a membership change (adding or removing a participant).
 *
 * @param participant Identity to add or remove
 */
public record ProposeParticipantRequest(
        @NotBlank(message = "Participant is required")
        @Size(max = 128, message = "Participant identity must not exceed 128 characters")
        String participant
) {
}
