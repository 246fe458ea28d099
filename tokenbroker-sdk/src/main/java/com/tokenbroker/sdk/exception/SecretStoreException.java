package com.tokenbroker.sdk.exception;

/**
 * Base exception for secret store failures (missing or corrupt secret files, I/O errors).
 */
public class SecretStoreException extends TokenBrokerException {

    public SecretStoreException(String message) {
        super(message);
    }

    public SecretStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
