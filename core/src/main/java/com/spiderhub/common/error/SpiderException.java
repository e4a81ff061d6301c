package com.spiderhub.common.error;

/**
 * Base of all checked failures raised while executing a site operation.
 */
public class SpiderException extends Exception {
    private final ErrorKind kind;

    public SpiderException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SpiderException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
