package com.nosota.msale.api;

/**
 * HTTP headers shared by the msale endpoints and clients.
 */
public final class ApiHeaders {

    /**
     * Identity of the calling account. Administrator operations compare it with the stored administrator.
     */
    public static final String ACCOUNT_ID = "X-Account-Id";

    /**
     * Correlation id propagated into the service logs.
     */
    public static final String CORRELATION_ID = "X-Correlation-Id";

    private ApiHeaders() {
    }
}
