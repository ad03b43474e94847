package com.nosota.mvault.api.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Request for proposing a new approval threshold.
 *
 * @param threshold New threshold, must lie within [1, number of participants]
 */
public record ProposeThresholdRequest(
        @NotNull(message = "Threshold is required")
        @Positive(message = "Threshold must be positive")
        Integer threshold
) {
}
