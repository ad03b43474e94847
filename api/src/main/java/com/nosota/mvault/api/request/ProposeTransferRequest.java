package com.nosota.mvault.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Request for proposing a transfer out of the custodied balance.
 *
 * @param destination Identity that receives the funds once the proposal is executed
 * @param amount      Amount to transfer (in minor units)
 */
public record ProposeTransferRequest(
        @NotBlank(message = "Destination is required")
        String destination,

        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        Long amount
) {
}
