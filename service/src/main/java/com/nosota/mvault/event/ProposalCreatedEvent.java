package com.nosota.mvault.event;

import com.nosota.mvault.api.model.ProposalType;

/**
 * Published when a proposal is stored. The proposer's automatic approval follows as a separate
 * {@link ApprovalGrantedEvent}.
 */
public record ProposalCreatedEvent(
        Long proposalId,
        String proposer,
        ProposalType type,
        String target,
        Long value) implements VaultEvent {
}
