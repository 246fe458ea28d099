package com.tokenbroker.sdk.credential;

/**
 * Record of a strategy that did not produce a token.
 *
 * @param strategyName name of the strategy
 * @param reason why it was not applicable, or what went wrong
 * @param error the failure, or null if the strategy was merely not applicable
 */
public record CredentialAttempt(String strategyName, String reason, Throwable error) {

    public boolean isFailure() {
        return error != null;
    }
}
