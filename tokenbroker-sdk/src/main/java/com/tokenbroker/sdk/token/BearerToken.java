package com.tokenbroker.sdk.token;

import com.tokenbroker.sdk.exception.TokenBrokerException;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * A bare access token with no refresh capability.
 *
 * <p>Used for tokens supplied through the environment, and by callers that obtained
 * an access token elsewhere.</p>
 *
 * <pre>{@code
 * TokenFacade token = BearerToken.of(System.getenv("GOOGLE_OAUTH_ACCESS_TOKEN"));
 * }</pre>
 */
public class BearerToken extends AbstractTokenFacade {

    private final String accessToken;
    private final Instant expiresAt;

    public BearerToken(String accessToken, Instant expiresAt, Set<String> scopes, String endpointHost) {
        super(endpointHost, scopes);
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("accessToken cannot be null or blank");
        }
        this.accessToken = accessToken;
        this.expiresAt = expiresAt;
    }

    /**
     * Create a Google bearer token with unknown expiry and scopes.
     */
    public static BearerToken of(String accessToken) {
        return new BearerToken(accessToken, null, Set.of(), OAuthEndpoints.GOOGLE_AUTHORIZATION_HOST);
    }

    @Override
    public String accessToken() {
        return accessToken;
    }

    @Override
    public Optional<String> refreshToken() {
        return Optional.empty();
    }

    @Override
    public Optional<Instant> expiry() {
        return Optional.ofNullable(expiresAt);
    }

    @Override
    public boolean canRefresh() {
        return false;
    }

    @Override
    public void refresh() {
        throw new TokenBrokerException("Bearer token cannot be refreshed; obtain a new access token instead");
    }
}
