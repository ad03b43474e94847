package com.nosota.mvault.repository;

import com.nosota.mvault.api.model.ProposalStatus;
import com.nosota.mvault.model.Approval;
import com.nosota.mvault.model.ApprovalId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for the approval relation {@code (proposalId, participant) -> approved}.
 */
@Repository
public interface ApprovalRepository extends JpaRepository<Approval, ApprovalId> {

    /**
     * Participants whose approval of the proposal currently counts, ordered by identity.
     *
     * @param proposalId The proposal id
     * @return Counted approval records
     */
    List<Approval> findByProposalIdAndApprovedTrueOrderByParticipantAsc(Long proposalId);

    /**
     * Counts approvals of a proposal that currently count.
     * Used to cross-check the denormalized {@code Proposal.approvalCount}.
     *
     * @param proposalId The proposal id
     * @return Number of records with {@code approved = true}
     */
    long countByProposalIdAndApprovedTrue(Long proposalId);

    /**
     * Finds every counted approval of a participant on proposals in the given status.
     * Used by the removal sweep with {@code status = PENDING}: the approvals of a removed participant
     * are voided on every pending proposal regardless of its type.
     *
     * @param participant The participant identity
     * @param status      Proposal status to restrict to
     * @return Approval records with {@code approved = true}, ordered by proposal id
     */
    @Query("""
            SELECT a
            FROM Approval a
            WHERE a.participant = :participant
              AND a.approved = true
              AND a.proposalId IN (SELECT p.id FROM Proposal p WHERE p.status = :status)
            ORDER BY a.proposalId
            """)
    List<Approval> findCountedApprovals(@Param("participant") String participant,
                                        @Param("status") ProposalStatus status);
}
