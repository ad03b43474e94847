package com.nosota.mvault.service;

import com.nosota.mvault.api.model.ProposalStatus;
import com.nosota.mvault.error.InsufficientApprovalsException;
import com.nosota.mvault.error.InsufficientFundsException;
import com.nosota.mvault.error.NotParticipantException;
import com.nosota.mvault.error.ProposalNotFoundException;
import com.nosota.mvault.error.ProposalStateException;
import com.nosota.mvault.event.ProposalExecutedEvent;
import com.nosota.mvault.event.VaultEventPublisher;
import com.nosota.mvault.model.Proposal;
import com.nosota.mvault.model.VaultState;
import com.nosota.mvault.repository.ProposalRepository;
import com.nosota.mvault.transfer.ValueTransferGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * Execution engine: applies proposals that reached the approval threshold.
 *
 * <p>This is the only component that mutates the membership registry or finalizes proposals. Execution steps:
 * <ol>
 *   <li>Lock the vault state</li>
 *   <li>Check: proposal exists, is PENDING, caller is a participant, approvalCount >= threshold</li>
 *   <li>Mark the proposal EXECUTED</li>
 *   <li>Dispatch by type, re-validating membership rules against the current state</li>
 * </ol>
 *
 * <p>The whole call is one transaction and all errors are unchecked, so a failure in any step rolls back every
 * effect, the EXECUTED flag included. For transfers the external gateway is called last, after the proposal
 * and the debited balance are flushed: a re-entrant call from the gateway finds the proposal EXECUTED and is
 * rejected by the ordinary state check.
 *
 * <p>The rejections raised before the first write (not found, wrong state, not a participant, too few approvals)
 * do not mark a surrounding transaction rollback-only, so a rejected re-entrant call leaves the outer execution
 * intact.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExecutionService {

    private final ProposalRepository proposalRepository;
    private final VaultStateService vaultStateService;
    private final MembershipService membershipService;
    private final ApprovalService approvalService;
    private final ProposalStatusStateMachine stateMachine;
    private final ValueTransferGateway valueTransferGateway;
    private final VaultEventPublisher eventPublisher;

    /**
     * Executes a pending proposal.
     *
     * @param caller     Executing participant (need not have approved)
     * @param proposalId Proposal id
     * @return The executed proposal
     * @throws ProposalNotFoundException      if the proposal does not exist
     * @throws com.nosota.mvault.error.ProposalStateException  if the proposal is not PENDING
     * @throws com.nosota.mvault.error.NotParticipantException if the caller is not a participant
     * @throws InsufficientApprovalsException if the approval count is below the threshold
     * @throws InsufficientFundsException     if a transfer exceeds the custodied balance
     * @throws com.nosota.mvault.error.VaultValidationException if a governance change is no longer valid
     * @throws com.nosota.mvault.error.ValueTransferException  if the value transfer itself fails
     */
    @Transactional(noRollbackFor = {
            ProposalNotFoundException.class,
            ProposalStateException.class,
            NotParticipantException.class,
            InsufficientApprovalsException.class
    })
    public Proposal execute(String caller, Long proposalId) {
        log.info("Executing proposal: proposalId={}, caller={}", proposalId, caller);

        VaultState vaultState = vaultStateService.lockVault();
        Proposal proposal = proposalRepository.findById(proposalId)
                .orElseThrow(() -> new ProposalNotFoundException(proposalId));
        stateMachine.validateTransition(proposal, ProposalStatus.EXECUTED);
        membershipService.requireParticipant(caller);

        if (proposal.getApprovalCount() < vaultState.getThreshold()) {
            throw new InsufficientApprovalsException(proposalId, proposal.getApprovalCount(), vaultState.getThreshold());
        }

        proposal.setStatus(ProposalStatus.EXECUTED);
        proposal.setExecutedAt(LocalDateTime.now());
        proposal = proposalRepository.save(proposal);

        String effect = switch (proposal.getType()) {
            case TRANSFER -> executeTransfer(vaultState, proposal);
            case ADD_PARTICIPANT -> executeAddParticipant(proposal);
            case REMOVE_PARTICIPANT -> executeRemoveParticipant(proposal);
            case CHANGE_THRESHOLD -> executeChangeThreshold(proposal);
        };

        eventPublisher.publish(new ProposalExecutedEvent(proposalId, proposal.getType(), caller, effect));
        log.info("Proposal executed: proposalId={}, type={}, effect={}", proposalId, proposal.getType(), effect);
        return proposal;
    }

    private String executeTransfer(VaultState vaultState, Proposal proposal) {
        long amount = proposal.getValue();
        if (vaultState.getBalance() < amount) {
            throw new InsufficientFundsException(
                    String.format("Insufficient custodied balance for proposal %d: balance=%d, amount=%d",
                            proposal.getId(), vaultState.getBalance(), amount));
        }

        vaultState.setBalance(vaultState.getBalance() - amount);
        vaultStateService.saveAndFlush(vaultState);

        // External interaction last: all bookkeeping above is already visible.
        valueTransferGateway.transfer(proposal.getId(), proposal.getTarget(), amount);

        return String.format("transferred %d to %s, balance %d", amount, proposal.getTarget(), vaultState.getBalance());
    }

    private String executeAddParticipant(Proposal proposal) {
        membershipService.addParticipant(proposal.getTarget());
        return "added participant " + proposal.getTarget();
    }

    private String executeRemoveParticipant(Proposal proposal) {
        membershipService.removeParticipant(proposal.getTarget());
        int voided = approvalService.sweepApprovals(proposal.getTarget());
        return String.format("removed participant %s, voided %d pending approval(s)", proposal.getTarget(), voided);
    }

    private String executeChangeThreshold(Proposal proposal) {
        int newThreshold = Math.toIntExact(proposal.getValue());
        membershipService.changeThreshold(newThreshold);
        return "threshold set to " + newThreshold;
    }
}
