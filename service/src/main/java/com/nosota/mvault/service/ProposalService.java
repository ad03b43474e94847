package com.nosota.mvault.service;

import com.nosota.mvault.api.model.ProposalStatus;
import com.nosota.mvault.api.model.ProposalType;
import com.nosota.mvault.error.ProposalNotFoundException;
import com.nosota.mvault.error.VaultValidationException;
import com.nosota.mvault.event.ProposalCreatedEvent;
import com.nosota.mvault.event.VaultEventPublisher;
import com.nosota.mvault.model.Proposal;
import com.nosota.mvault.model.VaultState;
import com.nosota.mvault.repository.ProposalRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * Proposal store: the append-only, sequentially numbered list of proposed actions.
 *
 * <p>Four entry points, one per action type, each callable by a current participant only:
 * <ol>
 *   <li>Lock the vault state</li>
 *   <li>Check the caller is a participant</li>
 *   <li>Validate the type-specific payload against the current membership</li>
 *   <li>Store a PENDING proposal with the next id and record the proposer's approval</li>
 * </ol>
 *
 * <p>Membership checks made here are optimistic: membership may change before execution, so the execution
 * engine checks them again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProposalService {

    private final ProposalRepository proposalRepository;
    private final VaultStateService vaultStateService;
    private final MembershipService membershipService;
    private final ApprovalService approvalService;
    private final VaultEventPublisher eventPublisher;

    /**
     * Proposes a transfer of {@code amount} from the custodied balance to {@code destination}.
     * The balance is checked at execution time, not here.
     */
    @Transactional
    public Proposal proposeTransfer(String caller, String destination, Long amount) {
        VaultState vaultState = vaultStateService.lockVault();
        membershipService.requireParticipant(caller);
        membershipService.validateIdentity(destination);

        if (amount == null || amount <= 0) {
            throw new VaultValidationException("Transfer amount must be positive");
        }

        return createProposal(vaultState, ProposalType.TRANSFER, destination, amount, caller);
    }

    @Transactional
    public Proposal proposeAddParticipant(String caller, String identity) {
        VaultState vaultState = vaultStateService.lockVault();
        membershipService.requireParticipant(caller);
        membershipService.validateIdentity(identity);

        if (membershipService.isParticipant(identity)) {
            throw new VaultValidationException("Already a participant: " + identity);
        }

        return createProposal(vaultState, ProposalType.ADD_PARTICIPANT, identity, 0L, caller);
    }

    @Transactional
    public Proposal proposeRemoveParticipant(String caller, String identity) {
        VaultState vaultState = vaultStateService.lockVault();
        membershipService.requireParticipant(caller);
        membershipService.validateIdentity(identity);

        if (!membershipService.isParticipant(identity)) {
            throw new VaultValidationException("Not a participant: " + identity);
        }
        membershipService.validateRemoval(membershipService.getParticipantCount(), vaultState.getThreshold());

        return createProposal(vaultState, ProposalType.REMOVE_PARTICIPANT, identity, 0L, caller);
    }

    @Transactional
    public Proposal proposeChangeThreshold(String caller, Integer newThreshold) {
        VaultState vaultState = vaultStateService.lockVault();
        membershipService.requireParticipant(caller);

        if (newThreshold == null) {
            throw new VaultValidationException("Threshold is required");
        }
        membershipService.validateThreshold(newThreshold, membershipService.getParticipantCount());

        return createProposal(vaultState, ProposalType.CHANGE_THRESHOLD, null, newThreshold.longValue(), caller);
    }

    @Transactional(readOnly = true)
    public Proposal getProposal(Long proposalId) {
        return proposalRepository.findById(proposalId)
                .orElseThrow(() -> new ProposalNotFoundException(proposalId));
    }

    /**
     * Lists proposals ordered by id.
     *
     * @param status Optional status filter, null for all proposals
     */
    @Transactional(readOnly = true)
    public Page<Proposal> listProposals(ProposalStatus status, int page, int size) {
        Pageable pageable = PageRequest.of(page, size, Sort.by("id"));
        if (status == null) {
            return proposalRepository.findAll(pageable);
        }
        return proposalRepository.findByStatus(status, pageable);
    }

    /**
     * Creation routine shared by all proposal types: takes the next sequential id, stores the proposal as
     * PENDING and counts the proposer's approval.
     */
    private Proposal createProposal(VaultState vaultState, ProposalType type, String target, Long value,
                                    String proposer) {
        Long proposalId = vaultState.getProposalCount();
        vaultState.setProposalCount(proposalId + 1);
        vaultStateService.save(vaultState);

        Proposal proposal = new Proposal();
        proposal.setId(proposalId);
        proposal.setType(type);
        proposal.setTarget(target);
        proposal.setValue(value);
        proposal.setApprovalCount(0);
        proposal.setStatus(ProposalStatus.PENDING);
        proposal.setProposer(proposer);
        proposal.setCreatedAt(LocalDateTime.now());
        proposal = proposalRepository.save(proposal);

        eventPublisher.publish(new ProposalCreatedEvent(proposalId, proposer, type, target, value));
        log.info("Proposal created: proposalId={}, type={}, target={}, value={}, proposer={}",
                proposalId, type, target, value, proposer);

        approvalService.recordApproval(proposal, proposer);
        return proposal;
    }
}
