package com.nosota.mvault.error;

public class VaultNotInitializedException extends IllegalStateException {
    public VaultNotInitializedException() {
        super("Vault is not initialized");
    }
}
