package com.spiderhub.common.error;

/**
 * The upstream answered with a definitive failure (4xx, explicit error payload). Never retried.
 */
public class PermanentUpstreamException extends SpiderException {

    public PermanentUpstreamException(String message) {
        super(ErrorKind.PERMANENT_UPSTREAM, message);
    }

    public PermanentUpstreamException(String message, Throwable cause) {
        super(ErrorKind.PERMANENT_UPSTREAM, message, cause);
    }
}
