package com.tokenbroker.sdk.exception;

/**
 * Thrown when a structurally valid token was issued by an authorization server other than Google's.
 */
public class WrongEndpointException extends TokenBrokerException {

    private final String actualHost;
    private final String expectedHost;

    public WrongEndpointException(String actualHost, String expectedHost) {
        super("Token endpoint host '" + actualHost + "' does not match expected host '" + expectedHost + "'",
                0, "WRONG_ENDPOINT");
        this.actualHost = actualHost;
        this.expectedHost = expectedHost;
    }

    public String getActualHost() {
        return actualHost;
    }

    public String getExpectedHost() {
        return expectedHost;
    }
}
