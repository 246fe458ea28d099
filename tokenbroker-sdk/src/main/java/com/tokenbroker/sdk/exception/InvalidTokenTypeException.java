package com.tokenbroker.sdk.exception;

/**
 * Thrown when a candidate credential does not expose the token capability set.
 */
public class InvalidTokenTypeException extends TokenBrokerException {

    private final String actualType;

    public InvalidTokenTypeException(String actualType) {
        super("Expected a TokenFacade or TokenRequestConfig but got: " + actualType,
                0, "INVALID_TOKEN_TYPE");
        this.actualType = actualType;
    }

    public String getActualType() {
        return actualType;
    }
}
