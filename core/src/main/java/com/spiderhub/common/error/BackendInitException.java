package com.spiderhub.common.error;

/**
 * The preferred backend for a site could not be brought up (script or module failed to load).
 */
public class BackendInitException extends SpiderException {

    public BackendInitException(String message) {
        super(ErrorKind.BACKEND_INIT, message);
    }

    public BackendInitException(String message, Throwable cause) {
        super(ErrorKind.BACKEND_INIT, message, cause);
    }
}
