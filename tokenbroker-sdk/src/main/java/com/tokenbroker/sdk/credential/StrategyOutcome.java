package com.tokenbroker.sdk.credential;

import com.tokenbroker.sdk.token.TokenFacade;

import java.util.Objects;

/**
 * Result of a single {@link CredentialStrategy} attempt.
 */
public interface StrategyOutcome {

    static StrategyOutcome success(TokenFacade token) {
        return new Success(token);
    }

    static StrategyOutcome notApplicable(String reason) {
        return new NotApplicable(reason);
    }

    static StrategyOutcome failure(Throwable error) {
        return new Failure(error);
    }

    record Success(TokenFacade token) implements StrategyOutcome {
        public Success {
            Objects.requireNonNull(token, "token");
        }
    }

    record NotApplicable(String reason) implements StrategyOutcome {
        public NotApplicable {
            Objects.requireNonNull(reason, "reason");
        }
    }

    record Failure(Throwable error) implements StrategyOutcome {
        public Failure {
            Objects.requireNonNull(error, "error");
        }

        public String reason() {
            String message = error.getMessage();
            return message != null ? message : error.getClass().getSimpleName();
        }
    }
}
