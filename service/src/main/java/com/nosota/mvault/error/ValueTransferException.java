package com.nosota.mvault.error;

/**
 * The value-transfer mechanism reported a failure. The whole execution is rolled back.
 */
public class ValueTransferException extends RuntimeException {
    public ValueTransferException(String message) {
        super(message);
    }

    public ValueTransferException(String message, Throwable cause) {
        super(message, cause);
    }
}
