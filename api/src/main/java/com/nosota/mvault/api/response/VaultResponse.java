package com.nosota.mvault.api.response;

import java.util.List;

/**
 * Current governance parameters and balance of the vault.
 */
public record VaultResponse(
        List<String> participants,
        Integer threshold,
        Long balance,
        Long proposalCount
) {
}
