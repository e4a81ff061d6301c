package com.spiderhub.common.error;

/**
 * Backend output could not be interpreted as a content envelope.
 */
public class MalformedResponseException extends SpiderException {

    public MalformedResponseException(String message) {
        super(ErrorKind.MALFORMED_RESPONSE, message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(ErrorKind.MALFORMED_RESPONSE, message, cause);
    }
}
