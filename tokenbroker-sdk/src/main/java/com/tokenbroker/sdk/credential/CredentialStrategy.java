package com.tokenbroker.sdk.credential;

/**
 * One way of obtaining a credential.
 *
 * <p>Implementations must distinguish "my preconditions are not met" ({@link StrategyOutcome.NotApplicable})
 * from "I was meant to work but could not" ({@link StrategyOutcome.Failure}), so that a misconfigured
 * strategy reports a specific diagnostic instead of being skipped silently.</p>
 *
 * <p>The SDK ships these strategies, listed in their conventional order:</p>
 * <ul>
 *   <li>{@link ExplicitTokenStrategy} - a token object supplied by the caller</li>
 *   <li>{@link ServiceAccountStrategy} - a service account JSON key</li>
 *   <li>{@link EnvironmentTokenStrategy} - an access token in an environment variable</li>
 *   <li>{@link CachedUserTokenStrategy} - a cached user OAuth grant</li>
 *   <li>{@link AmbientCredentialStrategy} - application default credentials of the host</li>
 * </ul>
 */
public interface CredentialStrategy {

    /**
     * @return short name used in logs and in {@link com.tokenbroker.sdk.exception.NoCredentialException}
     */
    String name();

    /**
     * Try to produce a token for the request. Blocks on network calls, if any.
     */
    StrategyOutcome attempt(CredentialRequest request);
}
