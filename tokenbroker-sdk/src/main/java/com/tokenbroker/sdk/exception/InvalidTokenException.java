package com.tokenbroker.sdk.exception;

/**
 * Thrown when the introspection endpoint rejects a token as expired or revoked.
 */
public class InvalidTokenException extends TokenBrokerException {

    public InvalidTokenException(String message, int statusCode, String errorCode) {
        super(message, statusCode, errorCode);
    }
}
