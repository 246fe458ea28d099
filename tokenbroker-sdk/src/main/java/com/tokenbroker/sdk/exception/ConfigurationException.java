package com.tokenbroker.sdk.exception;

/**
 * Thrown when an {@code AuthState} or broker is configured with no usable credential source.
 */
public class ConfigurationException extends TokenBrokerException {

    public ConfigurationException(String message) {
        super(message, 0, "CONFIGURATION");
    }
}
