package com.nosota.mvault.service;

import com.nosota.mvault.error.VaultValidationException;
import com.nosota.mvault.event.DepositReceivedEvent;
import com.nosota.mvault.event.VaultEventPublisher;
import com.nosota.mvault.model.VaultState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Service for handling deposit operations.
 *
 * <p>Deposits are value entering the vault from outside. They are accepted from anyone at any time,
 * independent of proposals in flight, and only ever increase the custodied balance.
 *
 * <p>No authorization is required, but the input is still validated: the sender must be named, the amount must
 * be positive and the vault must already be initialized. A deposit that would overflow the balance is rejected.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DepositService {

    private final VaultStateService vaultStateService;
    private final VaultEventPublisher eventPublisher;

    /**
     * Adds funds to the custodied balance.
     *
     * @param from   Sender identity
     * @param amount Amount to deposit (in minor units)
     * @return Custodied balance after the deposit
     * @throws VaultValidationException if the sender is empty, the amount is not positive or the balance would overflow
     */
    @Transactional
    public long acceptDeposit(String from, Long amount) {
        log.info("Processing deposit: from={}, amount={}", from, amount);

        if (from == null || from.isBlank()) {
            throw new VaultValidationException("Sender must not be empty");
        }
        if (amount == null || amount <= 0) {
            throw new VaultValidationException("Deposit amount must be positive");
        }

        VaultState vaultState = vaultStateService.lockVault();
        long balance;
        try {
            balance = Math.addExact(vaultState.getBalance(), amount);
        } catch (ArithmeticException e) {
            throw new VaultValidationException("Deposit would overflow the custodied balance", e);
        }
        vaultState.setBalance(balance);
        vaultStateService.save(vaultState);

        eventPublisher.publish(new DepositReceivedEvent(from, amount, balance));
        log.info("Deposit completed: from={}, amount={}, balance={}", from, amount, balance);
        return balance;
    }
}
