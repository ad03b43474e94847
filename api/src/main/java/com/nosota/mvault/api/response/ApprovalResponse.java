package com.nosota.mvault.api.response;

/**
 * Result of an approve or revoke call.
 *
 * @param proposalId    Proposal the vote applies to
 * @param participant   Participant who voted
 * @param approved      Whether the participant's approval now counts
 * @param approvalCount Resulting approval count of the proposal
 */
public record ApprovalResponse(
        Long proposalId,
        String participant,
        boolean approved,
        Integer approvalCount
) {
}
