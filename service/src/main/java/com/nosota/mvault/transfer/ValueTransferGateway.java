package com.nosota.mvault.transfer;

import com.nosota.mvault.error.ValueTransferException;

/**
 * Mechanism that hands value over to a destination outside the vault.
 *
 * <p>The execution engine calls it as the very last step of a TRANSFER execution, after the proposal is marked
 * EXECUTED and the balance is debited. An implementation that calls back into the vault therefore sees the
 * proposal in its final state.
 */
public interface ValueTransferGateway {

    /**
     * Transfers value to a destination.
     *
     * @param proposalId  Executed TRANSFER proposal
     * @param destination Receiving identity
     * @param amount      Amount (in minor units), positive
     * @throws ValueTransferException if the transfer could not be performed
     */
    void transfer(Long proposalId, String destination, long amount);
}
