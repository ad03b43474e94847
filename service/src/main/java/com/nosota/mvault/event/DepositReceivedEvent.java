package com.nosota.mvault.event;

/**
 * @param balance custodied balance after the deposit
 */
public record DepositReceivedEvent(String from, long amount, long balance) implements VaultEvent {
}
