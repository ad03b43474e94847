package com.nosota.mvault.service;

import com.nosota.mvault.error.VaultNotInitializedException;
import com.nosota.mvault.model.VaultState;
import com.nosota.mvault.repository.VaultStateRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Access to the singleton {@link VaultState} row.
 */
@Service
@RequiredArgsConstructor
public class VaultStateService {

    private final VaultStateRepository vaultStateRepository;

    /**
     * Locks the vault state for the rest of the current transaction.
     * Must be the first step of every operation that mutates the vault.
     *
     * @return The locked vault state
     * @throws VaultNotInitializedException if the vault has not been initialized yet
     */
    public VaultState lockVault() {
        VaultState vaultState = vaultStateRepository.getOneForUpdate(VaultState.SINGLETON_ID);
        if (vaultState == null) {
            throw new VaultNotInitializedException();
        }
        return vaultState;
    }

    public VaultState getVault() {
        return vaultStateRepository.findById(VaultState.SINGLETON_ID)
                .orElseThrow(VaultNotInitializedException::new);
    }

    public boolean isInitialized() {
        return vaultStateRepository.existsById(VaultState.SINGLETON_ID);
    }

    public VaultState save(VaultState vaultState) {
        return vaultStateRepository.save(vaultState);
    }

    /**
     * Saves and flushes the whole persistence context, so every pending change reaches the database
     * before the caller interacts with anything outside of it.
     */
    public VaultState saveAndFlush(VaultState vaultState) {
        return vaultStateRepository.saveAndFlush(vaultState);
    }
}
