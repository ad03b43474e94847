package com.nosota.mvault.error;

public class ProposalNotFoundException extends RuntimeException {
    private final Long proposalId;

    public ProposalNotFoundException(Long proposalId) {
        super("Proposal not found: " + proposalId);
        this.proposalId = proposalId;
    }

    public Long getProposalId() {
        return proposalId;
    }
}
