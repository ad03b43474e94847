package com.nosota.mvault.error;

/**
 * A proposal was executed before its approval count reached the threshold.
 */
public class InsufficientApprovalsException extends RuntimeException {
    public InsufficientApprovalsException(Long proposalId, int approvalCount, int threshold) {
        super(String.format("Proposal %d has %d approval(s), threshold is %d", proposalId, approvalCount, threshold));
    }
}
