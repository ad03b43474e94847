package com.nosota.mvault.api.response;

import java.util.List;

/**
 * Result of recomputing the vault invariants from storage.
 *
 * <p>{@code consistent} is true when the participant set is non-empty, the threshold lies in
 * [1, participantCount] and every pending proposal's stored approval count matches its approval records.
 */
public record ConsistencyResponse(
        boolean consistent,
        Long participantCount,
        Integer threshold,
        Long pendingProposals,
        List<Long> mismatchedProposalIds
) {
}
