package com.tokenbroker.sdk.token;

import com.google.auth.oauth2.AccessToken;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.auth.oauth2.UserCredentials;
import com.tokenbroker.sdk.exception.TokenBrokerException;

import java.io.IOException;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Token facade over a google-auth {@link GoogleCredentials} instance.
 *
 * <p>Covers service account, user and application default credentials. Refreshing is
 * delegated to the google-auth library.</p>
 */
public class GoogleCredentialsToken extends AbstractTokenFacade {

    private final GoogleCredentials credentials;

    public GoogleCredentialsToken(GoogleCredentials credentials, Set<String> scopes) {
        this(credentials, scopes, OAuthEndpoints.GOOGLE_AUTHORIZATION_HOST);
    }

    public GoogleCredentialsToken(GoogleCredentials credentials, Set<String> scopes, String endpointHost) {
        super(endpointHost, scopes);
        this.credentials = Objects.requireNonNull(credentials, "credentials");
    }

    /**
     * @return the wrapped credentials, for handing to Google client libraries directly
     */
    public GoogleCredentials getCredentials() {
        return credentials;
    }

    /**
     * @throws IllegalStateException if the credentials have never been refreshed
     */
    @Override
    public String accessToken() {
        AccessToken token = credentials.getAccessToken();
        if (token == null) {
            throw new IllegalStateException("Credentials hold no access token; call refresh() first");
        }
        return token.getTokenValue();
    }

    @Override
    public Optional<String> refreshToken() {
        if (credentials instanceof UserCredentials userCredentials) {
            return Optional.ofNullable(userCredentials.getRefreshToken());
        }
        return Optional.empty();
    }

    @Override
    public Optional<Instant> expiry() {
        AccessToken token = credentials.getAccessToken();
        if (token == null || token.getExpirationTime() == null) {
            return Optional.empty();
        }
        return Optional.of(token.getExpirationTime().toInstant());
    }

    @Override
    public boolean isExpired() {
        return credentials.getAccessToken() == null || super.isExpired();
    }

    @Override
    public boolean canRefresh() {
        return true;
    }

    @Override
    public void refresh() {
        try {
            credentials.refresh();
        } catch (IOException e) {
            throw new TokenBrokerException("Failed to refresh Google credentials: " + e.getMessage(), e);
        }
    }
}
