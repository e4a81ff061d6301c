package com.spiderhub.common.error;

/**
 * Invalid site or engine configuration. Fatal to the affected site only.
 */
public class ConfigException extends SpiderException {

    public ConfigException(String message) {
        super(ErrorKind.CONFIG, message);
    }

    public ConfigException(String message, Throwable cause) {
        super(ErrorKind.CONFIG, message, cause);
    }
}
