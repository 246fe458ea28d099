package com.tokenbroker.sdk.exception;

/**
 * Base exception for Token Broker SDK errors
 */
public class TokenBrokerException extends RuntimeException {

    private final int statusCode;
    private final String errorCode;

    public TokenBrokerException(String message) {
        super(message);
        this.statusCode = 0;
        this.errorCode = null;
    }

    public TokenBrokerException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.errorCode = null;
    }

    public TokenBrokerException(String message, int statusCode, String errorCode) {
        super(message);
        this.statusCode = statusCode;
        this.errorCode = errorCode;
    }

    public TokenBrokerException(String message, int statusCode, String errorCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.errorCode = errorCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
