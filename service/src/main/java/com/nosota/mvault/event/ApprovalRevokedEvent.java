package com.nosota.mvault.event;

/**
 * Published when an approval stops counting.
 *
 * @param swept true when the approval was voided because its participant was removed,
 *              false for an explicit revoke
 */
public record ApprovalRevokedEvent(
        Long proposalId,
        String participant,
        int approvalCount,
        boolean swept) implements VaultEvent {
}
