package com.marginledger.api;

/** Request headers set by the gateway in front of the service. */
public final class ApiHeaders {

    /** Authenticated account identifier of the caller. */
    public static final String CALLER_ID = "X-Caller-Id";

    private ApiHeaders() {}
}
