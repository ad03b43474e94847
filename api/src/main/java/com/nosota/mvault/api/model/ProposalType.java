package com.nosota.mvault.api.model;

/**
 * Kind of action a proposal performs once executed.
 *
 * <p>The set is closed: the execution engine switches over it exhaustively, so adding a
 * constant forces every dispatch site to handle it.
 */
public enum ProposalType {
    /**
     * TRANSFER: moves {@code value} units of the custodied balance to the {@code target} identity.
     */
    TRANSFER,

    /**
     * ADD_PARTICIPANT: admits {@code target} into the participant set.
     */
    ADD_PARTICIPANT,

    /**
     * REMOVE_PARTICIPANT: removes {@code target} from the participant set and voids its pending approvals.
     */
    REMOVE_PARTICIPANT,

    /**
     * CHANGE_THRESHOLD: replaces the approval threshold with {@code value}. Carries no target.
     */
    CHANGE_THRESHOLD
}
