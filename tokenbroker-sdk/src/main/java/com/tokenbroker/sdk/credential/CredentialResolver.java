package com.tokenbroker.sdk.credential;

import com.tokenbroker.sdk.auth.AuthState;
import com.tokenbroker.sdk.exception.NoCredentialException;
import com.tokenbroker.sdk.token.TokenFacade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs an ordered list of {@link CredentialStrategy} instances until one produces a token.
 *
 * <p>The first {@link StrategyOutcome.Success} wins and later strategies are never evaluated.
 * {@link StrategyOutcome.NotApplicable} outcomes are skipped. What happens on a
 * {@link StrategyOutcome.Failure} depends on the {@link FailurePolicy}: by default the failure
 * is recorded and resolution continues. A strategy that throws is treated as a failure.</p>
 *
 * <h2>Usage:</h2>
 * <pre>{@code
 * CredentialResolver resolver = CredentialResolver.builder()
 *     .strategy(new ExplicitTokenStrategy(token))
 *     .strategy(ServiceAccountStrategy.fromPath(keyPath))
 *     .strategy(new AmbientCredentialStrategy())
 *     .failurePolicy(FailurePolicy.CONTINUE)
 *     .build();
 *
 * TokenFacade token = resolver.resolve(request);
 * }</pre>
 *
 * <p>Not thread-safe with respect to the {@link AuthState} passed to {@link #populate}.</p>
 */
public class CredentialResolver {

    private static final Logger log = LoggerFactory.getLogger(CredentialResolver.class);

    private final List<CredentialStrategy> strategies;
    private final FailurePolicy failurePolicy;

    private CredentialResolver(Builder builder) {
        this.strategies = List.copyOf(builder.strategies);
        this.failurePolicy = builder.failurePolicy;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<CredentialStrategy> getStrategies() {
        return strategies;
    }

    public FailurePolicy getFailurePolicy() {
        return failurePolicy;
    }

    /**
     * Resolve a token with the configured strategies.
     *
     * @throws NoCredentialException if no strategy succeeds
     */
    public TokenFacade resolve(CredentialRequest request) {
        return resolve(request, strategies);
    }

    /**
     * Resolve a token with a caller-supplied ordered list of strategies.
     *
     * @throws NoCredentialException if no strategy succeeds, or on the first failure under
     *         {@link FailurePolicy#ABORT}
     */
    public TokenFacade resolve(CredentialRequest request, List<? extends CredentialStrategy> candidates) {
        List<CredentialAttempt> attempts = new ArrayList<>(candidates.size());

        for (CredentialStrategy strategy : candidates) {
            StrategyOutcome outcome = evaluate(strategy, request);

            if (outcome instanceof StrategyOutcome.Success success) {
                log.info("Credential for '{}' obtained via strategy '{}'",
                        request.getPackageName(), strategy.name());
                return success.token();
            }

            if (outcome instanceof StrategyOutcome.NotApplicable notApplicable) {
                log.debug("Strategy '{}' not applicable: {}", strategy.name(), notApplicable.reason());
                attempts.add(new CredentialAttempt(strategy.name(), notApplicable.reason(), null));
                continue;
            }

            StrategyOutcome.Failure failure = (StrategyOutcome.Failure) outcome;
            log.warn("Strategy '{}' failed: {}", strategy.name(), failure.reason());
            attempts.add(new CredentialAttempt(strategy.name(), failure.reason(), failure.error()));
            if (failurePolicy == FailurePolicy.ABORT) {
                throw new NoCredentialException(attempts, failure.error());
            }
        }

        throw new NoCredentialException(attempts);
    }

    /**
     * Resolve a token and install it into the given auth state.
     *
     * @return the installed token
     */
    public TokenFacade populate(AuthState authState, CredentialRequest request) {
        TokenFacade token = resolve(request);
        authState.setCred(token);
        return token;
    }

    private StrategyOutcome evaluate(CredentialStrategy strategy, CredentialRequest request) {
        try {
            StrategyOutcome outcome = strategy.attempt(request);
            if (outcome == null) {
                return StrategyOutcome.failure(
                        new IllegalStateException("Strategy '" + strategy.name() + "' returned no outcome"));
            }
            if (!(outcome instanceof StrategyOutcome.Success
                    || outcome instanceof StrategyOutcome.NotApplicable
                    || outcome instanceof StrategyOutcome.Failure)) {
                return StrategyOutcome.failure(new IllegalStateException(
                        "Strategy '" + strategy.name() + "' returned unsupported outcome "
                                + outcome.getClass().getName()));
            }
            return outcome;
        } catch (RuntimeException e) {
            return StrategyOutcome.failure(e);
        }
    }

    public static class Builder {
        private final List<CredentialStrategy> strategies = new ArrayList<>();
        private FailurePolicy failurePolicy = FailurePolicy.CONTINUE;

        /**
         * Append a strategy; strategies are evaluated in the order they were added
         */
        public Builder strategy(CredentialStrategy strategy) {
            this.strategies.add(strategy);
            return this;
        }

        public Builder strategies(List<? extends CredentialStrategy> strategies) {
            this.strategies.addAll(strategies);
            return this;
        }

        /**
         * Behaviour when an applicable strategy fails (default: CONTINUE)
         */
        public Builder failurePolicy(FailurePolicy failurePolicy) {
            this.failurePolicy = failurePolicy;
            return this;
        }

        public CredentialResolver build() {
            if (failurePolicy == null) {
                throw new IllegalStateException("failurePolicy is required");
            }
            return new CredentialResolver(this);
        }
    }
}
