package com.tokenbroker.sdk.exception;

/**
 * Thrown when the token introspection endpoint could not be reached or answered unexpectedly.
 */
public class IntrospectionException extends TokenBrokerException {

    public IntrospectionException(String message, Throwable cause) {
        super(message, cause);
    }

    public IntrospectionException(String message, int statusCode) {
        super(message, statusCode, "INTROSPECTION_FAILED");
    }
}
