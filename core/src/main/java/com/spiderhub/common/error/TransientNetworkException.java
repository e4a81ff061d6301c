package com.spiderhub.common.error;

/**
 * Timeout, connection reset or a retryable HTTP status. Eligible for backoff retry.
 */
public class TransientNetworkException extends SpiderException {

    public TransientNetworkException(String message) {
        super(ErrorKind.TRANSIENT_NETWORK, message);
    }

    public TransientNetworkException(String message, Throwable cause) {
        super(ErrorKind.TRANSIENT_NETWORK, message, cause);
    }
}
