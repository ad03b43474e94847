package com.nosota.mvault.error;

/**
 * The caller is not a current participant of the vault.
 */
public class NotParticipantException extends RuntimeException {
    private final String caller;

    public NotParticipantException(String caller) {
        super("Caller is not a participant: " + caller);
        this.caller = caller;
    }

    public String getCaller() {
        return caller;
    }
}
