package com.spiderhub.common.error;

/**
 * Classification of a failed site call. Drives retry decisions and the
 * error tag carried by degraded envelopes.
 */
public enum ErrorKind {
    CONFIG(false),
    BACKEND_INIT(false),
    TRANSIENT_NETWORK(true),
    PERMANENT_UPSTREAM(false),
    MALFORMED_RESPONSE(false),
    TIMEOUT(false),
    CANCELLED(false),
    INTERNAL(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
