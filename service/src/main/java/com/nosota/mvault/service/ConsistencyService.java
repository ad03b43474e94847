package com.nosota.mvault.service;

import com.nosota.mvault.api.model.ProposalStatus;
import com.nosota.mvault.api.response.ConsistencyResponse;
import com.nosota.mvault.model.Proposal;
import com.nosota.mvault.model.VaultState;
import com.nosota.mvault.repository.ApprovalRepository;
import com.nosota.mvault.repository.ParticipantRepository;
import com.nosota.mvault.repository.ProposalRepository;
import com.nosota.mvault.repository.VaultStateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Recomputes the vault invariants from storage:
 * <ul>
 *   <li>at least one participant</li>
 *   <li>{@code 1 <= threshold <= participants}</li>
 *   <li>every PENDING proposal's approvalCount equals its number of counted approval records</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConsistencyService {

    private final VaultStateRepository vaultStateRepository;
    private final ParticipantRepository participantRepository;
    private final ProposalRepository proposalRepository;
    private final ApprovalRepository approvalRepository;

    @Transactional(readOnly = true)
    public ConsistencyResponse check() {
        long participantCount = participantRepository.count();
        Integer threshold = vaultStateRepository.findById(VaultState.SINGLETON_ID)
                .map(VaultState::getThreshold)
                .orElse(null);

        List<Proposal> pending = proposalRepository.findByStatusOrderByIdAsc(ProposalStatus.PENDING);
        List<Long> mismatched = pending.stream()
                .filter(p -> approvalRepository.countByProposalIdAndApprovedTrue(p.getId()) != p.getApprovalCount())
                .map(Proposal::getId)
                .toList();

        boolean membershipValid = participantCount >= 1
                && threshold != null
                && threshold >= 1
                && threshold <= participantCount;
        boolean consistent = membershipValid && mismatched.isEmpty();

        if (!consistent) {
            log.error("Vault inconsistency detected: participantCount={}, threshold={}, mismatchedProposals={}",
                    participantCount, threshold, mismatched);
        } else {
            log.debug("Vault consistent: participantCount={}, threshold={}, pendingProposals={}",
                    participantCount, threshold, pending.size());
        }

        return new ConsistencyResponse(consistent, participantCount, threshold, (long) pending.size(), mismatched);
    }
}
