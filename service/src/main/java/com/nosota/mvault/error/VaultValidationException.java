package com.nosota.mvault.error;

/**
 * Malformed parameters: null or duplicate identity, threshold outside [1, participants],
 * a removal that would breach the membership invariants, a non-positive amount.
 */
public class VaultValidationException extends IllegalArgumentException {
    public VaultValidationException(String message) {
        super(message);
    }

    public VaultValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
