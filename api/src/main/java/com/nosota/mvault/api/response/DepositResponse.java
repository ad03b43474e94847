package com.nosota.mvault.api.response;

import java.time.LocalDateTime;

/**
 * Response for deposit operation.
 *
 * @param from      Sender of the deposit
 * @param amount    Deposited amount (in minor units)
 * @param balance   Custodied balance after the deposit
 * @param timestamp Operation timestamp
 */
public record DepositResponse(
        String from,
        Long amount,
        Long balance,
        LocalDateTime timestamp
) {
}
