package com.nosota.mvault.event;

import com.nosota.mvault.api.model.ProposalType;

/**
 * @param executor participant who called execute
 * @param effect   human-readable description of the applied change
 */
public record ProposalExecutedEvent(
        Long proposalId,
        ProposalType type,
        String executor,
        String effect) implements VaultEvent {
}
