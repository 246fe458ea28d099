package com.tokenbroker.sdk.exception;

import com.tokenbroker.sdk.credential.CredentialAttempt;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when no credential strategy produced a token.
 *
 * <p>Carries one {@link CredentialAttempt} per evaluated strategy, in evaluation order.</p>
 */
public class NoCredentialException extends TokenBrokerException {

    private final List<CredentialAttempt> attempts;

    public NoCredentialException(List<CredentialAttempt> attempts) {
        super(buildMessage(attempts), 0, "NO_CREDENTIAL");
        this.attempts = List.copyOf(attempts);
    }

    public NoCredentialException(List<CredentialAttempt> attempts, Throwable cause) {
        super(buildMessage(attempts), 0, "NO_CREDENTIAL", cause);
        this.attempts = List.copyOf(attempts);
    }

    public List<CredentialAttempt> getAttempts() {
        return attempts;
    }

    private static String buildMessage(List<CredentialAttempt> attempts) {
        if (attempts.isEmpty()) {
            return "Unable to obtain a credential: no strategies were configured";
        }
        return attempts.stream()
                .map(attempt -> "  " + attempt.strategyName() + ": " + attempt.reason())
                .collect(Collectors.joining("\n", "Unable to obtain a credential. Tried:\n", ""));
    }
}
