package com.nosota.mvault.api.model;

/**
 * Lifecycle status of a proposal.
 */
public enum ProposalStatus {
    /**
     * PENDING: collecting approvals. Initial state, the proposer's own approval is already counted.
     */
    PENDING,

    /**
     * EXECUTED: the action was applied. Final state - the proposal never changes again.
     */
    EXECUTED
}
