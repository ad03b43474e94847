package com.nosota.mvault.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Request for depositing funds into the vault.
 *
 * <p>Deposits carry no authorization: anyone may add value to the custodied balance.
 *
 * @param from   Identity of the sender
 * @param amount Amount to deposit (in minor units)
 */
public record DepositRequest(
        @NotBlank(message = "Sender is required")
        String from,

        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        Long amount
) {
}
