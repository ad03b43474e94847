package com.nosota.mvault.error;

/**
 * An operation was attempted on a proposal that is not in the required lifecycle state,
 * e.g. approving or executing an EXECUTED proposal.
 */
public class ProposalStateException extends IllegalStateException {
    public ProposalStateException(String message) {
        super(message);
    }
}
