package com.nosota.mvault.api;

/**
 * HTTP headers understood by the mVault service.
 */
public final class VaultHeaders {

    /**
     * Identity of the already-authenticated caller. Supplied by the gateway in front of the service.
     */
    public static final String CALLER_ID = "X-Caller-Id";

    /**
     * Optional correlation id propagated into logs and error responses.
     */
    public static final String CORRELATION_ID = "X-Correlation-Id";

    private VaultHeaders() {
    }
}
