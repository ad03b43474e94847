package com.nosota.mvault.service;

import com.nosota.mvault.api.model.ProposalStatus;
import com.nosota.mvault.error.ProposalStateException;
import com.nosota.mvault.model.Proposal;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for validating ProposalStatus transitions.
 *
 * <p>State diagram:
 * <pre>
 *   PENDING --execute (approvalCount >= threshold)--> EXECUTED
 * </pre>
 *
 * <p>EXECUTED is terminal. Unlike a no-op transition, EXECUTED -> EXECUTED is rejected: executing twice
 * must fail.
 */
@Component
public class ProposalStatusStateMachine {

    /**
     * Map of allowed transitions: fromStatus → Set of valid toStatus values.
     */
    private static final Map<ProposalStatus, Set<ProposalStatus>> ALLOWED_TRANSITIONS = Map.of(
            ProposalStatus.PENDING, EnumSet.of(ProposalStatus.EXECUTED)
    );

    public boolean isTransitionAllowed(ProposalStatus fromStatus, ProposalStatus toStatus) {
        if (fromStatus == null || toStatus == null) {
            return false;
        }
        Set<ProposalStatus> allowedTargets = ALLOWED_TRANSITIONS.get(fromStatus);
        return allowedTargets != null && allowedTargets.contains(toStatus);
    }

    /**
     * Validates a status transition of the given proposal.
     *
     * @param proposal Proposal about to change
     * @param toStatus Target status
     * @throws ProposalStateException if the transition is not allowed
     */
    public void validateTransition(Proposal proposal, ProposalStatus toStatus) {
        if (!isTransitionAllowed(proposal.getStatus(), toStatus)) {
            throw new ProposalStateException(
                    String.format("Invalid proposal status transition for proposal %d: %s → %s",
                            proposal.getId(), proposal.getStatus(), toStatus));
        }
    }

    /**
     * Ensures votes may still be cast on the proposal.
     *
     * @throws ProposalStateException if the proposal is not PENDING
     */
    public void requirePending(Proposal proposal) {
        if (proposal.getStatus() != ProposalStatus.PENDING) {
            throw new ProposalStateException(
                    String.format("Proposal %d is not pending (status: %s)", proposal.getId(), proposal.getStatus()));
        }
    }
}
