package com.nosota.mvault.service;

import com.nosota.mvault.api.model.ProposalStatus;
import com.nosota.mvault.error.NotParticipantException;
import com.nosota.mvault.error.ProposalNotFoundException;
import com.nosota.mvault.error.ProposalStateException;
import com.nosota.mvault.error.VaultValidationException;
import com.nosota.mvault.event.ApprovalGrantedEvent;
import com.nosota.mvault.event.ApprovalRevokedEvent;
import com.nosota.mvault.event.VaultEventPublisher;
import com.nosota.mvault.model.Approval;
import com.nosota.mvault.model.ApprovalId;
import com.nosota.mvault.model.Proposal;
import com.nosota.mvault.repository.ApprovalRepository;
import com.nosota.mvault.repository.ProposalRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Approval ledger: the relation {@code (proposal, participant) -> approved} and the derived
 * {@code Proposal.approvalCount}.
 *
 * <p>Every change to a record adjusts the proposal's count in the same transaction, so for each PENDING
 * proposal the count equals the number of records with {@code approved = true}. Approvals may arrive in
 * any order; only the count at execution time matters.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ApprovalService {

    private final ApprovalRepository approvalRepository;
    private final ProposalRepository proposalRepository;
    private final MembershipService membershipService;
    private final VaultStateService vaultStateService;
    private final ProposalStatusStateMachine stateMachine;
    private final VaultEventPublisher eventPublisher;

    /**
     * Records the caller's approval of a pending proposal.
     *
     * @param caller     Approving participant
     * @param proposalId Proposal id
     * @return The proposal with its updated approval count
     * @throws ProposalNotFoundException if the proposal does not exist
     * @throws com.nosota.mvault.error.ProposalStateException if the proposal is not PENDING
     * @throws com.nosota.mvault.error.NotParticipantException if the caller is not a participant
     * @throws VaultValidationException if the caller already approved
     */
    @Transactional(noRollbackFor = {
            ProposalNotFoundException.class,
            ProposalStateException.class,
            NotParticipantException.class
    })
    public Proposal approve(String caller, Long proposalId) {
        vaultStateService.lockVault();
        Proposal proposal = proposalRepository.findById(proposalId)
                .orElseThrow(() -> new ProposalNotFoundException(proposalId));
        stateMachine.requirePending(proposal);
        membershipService.requireParticipant(caller);

        if (hasApproved(proposalId, caller)) {
            throw new VaultValidationException(
                    String.format("Participant %s already approved proposal %d", caller, proposalId));
        }

        recordApproval(proposal, caller);
        return proposal;
    }

    /**
     * Withdraws the caller's approval of a pending proposal.
     *
     * @param caller     Revoking participant
     * @param proposalId Proposal id
     * @return The proposal with its updated approval count
     * @throws ProposalNotFoundException if the proposal does not exist
     * @throws com.nosota.mvault.error.ProposalStateException if the proposal is not PENDING
     * @throws com.nosota.mvault.error.NotParticipantException if the caller is not a participant
     * @throws VaultValidationException if the caller had not approved
     */
    @Transactional(noRollbackFor = {
            ProposalNotFoundException.class,
            ProposalStateException.class,
            NotParticipantException.class
    })
    public Proposal revoke(String caller, Long proposalId) {
        vaultStateService.lockVault();
        Proposal proposal = proposalRepository.findById(proposalId)
                .orElseThrow(() -> new ProposalNotFoundException(proposalId));
        stateMachine.requirePending(proposal);
        membershipService.requireParticipant(caller);

        Approval approval = approvalRepository.findById(new ApprovalId(proposalId, caller))
                .filter(Approval::isApproved)
                .orElseThrow(() -> new VaultValidationException(
                        String.format("Participant %s has not approved proposal %d", caller, proposalId)));

        clearApproval(proposal, approval, false);
        return proposal;
    }

    /**
     * Marks the participant's approval as counted and increments the proposal's count.
     * Shared by {@link #approve(String, Long)} and proposal creation; runs in the caller's transaction
     * after all checks passed.
     */
    @Transactional
    public void recordApproval(Proposal proposal, String participant) {
        Approval approval = approvalRepository.findById(new ApprovalId(proposal.getId(), participant))
                .orElseGet(() -> new Approval(proposal.getId(), participant, false, null));
        approval.setApproved(true);
        approval.setUpdatedAt(LocalDateTime.now());
        approvalRepository.save(approval);

        proposal.setApprovalCount(proposal.getApprovalCount() + 1);
        proposalRepository.save(proposal);

        eventPublisher.publish(new ApprovalGrantedEvent(proposal.getId(), participant, proposal.getApprovalCount()));
        log.info("Approval granted: proposalId={}, participant={}, approvalCount={}",
                proposal.getId(), participant, proposal.getApprovalCount());
    }

    /**
     * Voids every counted approval of a removed participant on every PENDING proposal, whatever the
     * proposal's type. Each affected proposal loses exactly one from its count; others are untouched.
     *
     * @param removed Identity that just left the participant set
     * @return Number of approvals voided
     */
    @Transactional
    public int sweepApprovals(String removed) {
        List<Approval> approvals = approvalRepository.findCountedApprovals(removed, ProposalStatus.PENDING);

        int voided = 0;
        for (Approval approval : approvals) {
            Proposal proposal = proposalRepository.findById(approval.getProposalId())
                    .orElseThrow(() -> new ProposalNotFoundException(approval.getProposalId()));
            // The proposal being executed is already EXECUTED in this transaction and keeps its record.
            if (proposal.getStatus() != ProposalStatus.PENDING) {
                continue;
            }
            clearApproval(proposal, approval, true);
            voided++;
        }

        log.info("Approval sweep completed: participant={}, voidedApprovals={}", removed, voided);
        return voided;
    }

    public boolean hasApproved(Long proposalId, String participant) {
        return approvalRepository.findById(new ApprovalId(proposalId, participant))
                .map(Approval::isApproved)
                .orElse(false);
    }

    /**
     * Participants whose approval of the proposal currently counts.
     *
     * @throws ProposalNotFoundException if the proposal does not exist
     */
    @Transactional(readOnly = true)
    public List<String> getApprovers(Long proposalId) {
        if (!proposalRepository.existsById(proposalId)) {
            throw new ProposalNotFoundException(proposalId);
        }
        return approvalRepository.findByProposalIdAndApprovedTrueOrderByParticipantAsc(proposalId).stream()
                .map(Approval::getParticipant)
                .toList();
    }

    private void clearApproval(Proposal proposal, Approval approval, boolean swept) {
        approval.setApproved(false);
        approval.setUpdatedAt(LocalDateTime.now());
        approvalRepository.save(approval);

        proposal.setApprovalCount(proposal.getApprovalCount() - 1);
        proposalRepository.save(proposal);

        eventPublisher.publish(new ApprovalRevokedEvent(
                proposal.getId(), approval.getParticipant(), proposal.getApprovalCount(), swept));
        log.info("Approval revoked: proposalId={}, participant={}, approvalCount={}, swept={}",
                proposal.getId(), approval.getParticipant(), proposal.getApprovalCount(), swept);
    }
}
