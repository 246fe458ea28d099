package com.tokenbroker.sdk.auth;

import com.tokenbroker.sdk.client.transport.TransportRequest;
import com.tokenbroker.sdk.exception.ConfigurationException;
import com.tokenbroker.sdk.token.TokenFacade;

import java.util.Objects;
import java.util.Optional;

/**
 * Auth configuration of one consuming package: its OAuth client, optional API key,
 * whether requests should carry a token, and the current token.
 *
 * <p>When {@code active} is true a credential is expected to be resolved into {@code cred};
 * when false, the API key is the only credential sent with requests.</p>
 *
 * <p>Not thread-safe. One owner mutates {@code cred} and {@code active}; concurrent
 * resolution on the same instance must be synchronized by the caller.</p>
 */
public final class AuthState {

    static final String API_KEY_PARAMETER = "key";

    private final String packageName;
    private OAuthClient client;
    private String apiKey;
    private boolean active;
    private TokenFacade cred;

    private AuthState(Builder builder) {
        this.packageName = builder.packageName;
        this.client = builder.client;
        this.apiKey = builder.apiKey;
        this.active = builder.active;
        this.cred = builder.cred;
    }

    public static Builder builder(String packageName) {
        return new Builder(packageName);
    }

    public String getPackageName() {
        return packageName;
    }

    public Optional<OAuthClient> getClient() {
        return Optional.ofNullable(client);
    }

    public Optional<String> getApiKey() {
        return Optional.ofNullable(apiKey);
    }

    public boolean isActive() {
        return active;
    }

    public Optional<TokenFacade> getCred() {
        return Optional.ofNullable(cred);
    }

    public boolean hasCred() {
        return cred != null;
    }

    /**
     * Replace the current token and mark the state active.
     */
    public void setCred(TokenFacade token) {
        this.cred = Objects.requireNonNull(token, "token");
        this.active = true;
    }

    /**
     * Drop the current token. {@code active} is left unchanged, so the next
     * authorized request needs a fresh resolution.
     */
    public void clearCred() {
        this.cred = null;
    }

    /**
     * @throws ConfigurationException if deactivating would leave no API key to send
     */
    public void setActive(boolean active) {
        if (!active && apiKey == null) {
            throw new ConfigurationException(
                    "Cannot deactivate auth for '" + packageName + "' without an API key");
        }
        this.active = active;
    }

    public void setClient(OAuthClient client) {
        this.client = client;
    }

    /**
     * A blank key is treated as no key.
     *
     * @throws ConfigurationException if the state is inactive and the key is null or blank
     */
    public void setApiKey(String apiKey) {
        String normalized = apiKey != null && !apiKey.isBlank() ? apiKey : null;
        if (normalized == null && !active) {
            throw new ConfigurationException(
                    "Cannot remove the API key of inactive auth state '" + packageName + "'");
        }
        this.apiKey = normalized;
    }

    /**
     * Attach this state's credential to an outgoing request.
     *
     * <p>Active state adds an {@code Authorization: Bearer} header; inactive state adds the
     * API key as the {@code key} query parameter.</p>
     *
     * @throws ConfigurationException if the state is active but no token has been resolved
     */
    public TransportRequest authorize(TransportRequest request) {
        if (active) {
            if (cred == null) {
                throw new ConfigurationException(
                        "Auth for '" + packageName + "' is active but no credential has been resolved");
            }
            return request.withHeader("Authorization", "Bearer " + cred.accessToken());
        }
        return request.withQueryParameter(API_KEY_PARAMETER, apiKey);
    }

    @Override
    public String toString() {
        return "AuthState{package=" + packageName
                + ", client=" + (client != null ? client.getId() : null)
                + ", apiKey=" + (apiKey != null ? "<set>" : null)
                + ", active=" + active
                + ", cred=" + (cred != null ? cred.getClass().getSimpleName() : null) + "}";
    }

    public static class Builder {
        private final String packageName;
        private OAuthClient client;
        private String apiKey;
        private boolean active = true;
        private TokenFacade cred;

        private Builder(String packageName) {
            this.packageName = packageName;
        }

        public Builder client(OAuthClient client) {
            this.client = client;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        /**
         * Whether requests should be authorized with a token (default: true)
         */
        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder cred(TokenFacade cred) {
            this.cred = cred;
            return this;
        }

        /**
         * @throws ConfigurationException if the package name is blank, or if the state
         *         would be inactive without an API key
         */
        public AuthState build() {
            if (packageName == null || packageName.isBlank()) {
                throw new ConfigurationException("packageName is required");
            }
            if (apiKey != null && apiKey.isBlank()) {
                apiKey = null;
            }
            if (apiKey == null && !active) {
                throw new ConfigurationException(
                        "Auth state for '" + packageName + "' is inactive and has no API key");
            }
            return new AuthState(this);
        }
    }
}
