package com.nosota.mvault.api.response;

import com.nosota.mvault.api.model.ProposalStatus;
import com.nosota.mvault.api.model.ProposalType;

import java.time.LocalDateTime;

/**
 * Proposal details.
 *
 * @param id            Sequential proposal id (first proposal is 0)
 * @param type          Action type
 * @param target        Destination (TRANSFER) or participant (ADD/REMOVE), null for CHANGE_THRESHOLD
 * @param value         Amount (TRANSFER), new threshold (CHANGE_THRESHOLD) or 0
 * @param approvalCount Number of approvals currently counted
 * @param status        PENDING or EXECUTED
 * @param proposer      Participant who created the proposal
 * @param createdAt     Creation timestamp
 * @param executedAt    Execution timestamp, null while pending
 */
public record ProposalResponse(
        Long id,
        ProposalType type,
        String target,
        Long value,
        Integer approvalCount,
        ProposalStatus status,
        String proposer,
        LocalDateTime createdAt,
        LocalDateTime executedAt
) {
}
