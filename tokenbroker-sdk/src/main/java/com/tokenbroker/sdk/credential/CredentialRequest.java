package com.tokenbroker.sdk.credential;

import com.tokenbroker.sdk.auth.OAuthClient;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Context handed to every strategy during one resolution.
 *
 * <p>Hints are loosely typed, strategy-specific inputs (for example a key file path under
 * {@code "path"} or an explicit token under {@code "token"}).</p>
 */
public final class CredentialRequest {

    private final String packageName;
    private final Set<String> scopes;
    private final String email;
    private final OAuthClient client;
    private final Map<String, Object> hints;

    private CredentialRequest(Builder builder) {
        this.packageName = builder.packageName;
        this.scopes = Collections.unmodifiableSet(new LinkedHashSet<>(builder.scopes));
        this.email = builder.email;
        this.client = builder.client;
        this.hints = Collections.unmodifiableMap(new LinkedHashMap<>(builder.hints));
    }

    public static Builder builder(String packageName) {
        return new Builder(packageName);
    }

    public String getPackageName() {
        return packageName;
    }

    public Set<String> getScopes() {
        return scopes;
    }

    public Optional<String> getEmail() {
        return Optional.ofNullable(email);
    }

    public Optional<OAuthClient> getClient() {
        return Optional.ofNullable(client);
    }

    public Map<String, Object> getHints() {
        return hints;
    }

    public Optional<Object> hint(String key) {
        return Optional.ofNullable(hints.get(key));
    }

    @Override
    public String toString() {
        return "CredentialRequest{package=" + packageName + ", scopes=" + scopes + ", email=" + email
                + ", hints=" + hints.keySet() + "}";
    }

    public static class Builder {
        private final String packageName;
        private final Set<String> scopes = new LinkedHashSet<>();
        private String email;
        private OAuthClient client;
        private final Map<String, Object> hints = new LinkedHashMap<>();

        private Builder(String packageName) {
            this.packageName = packageName;
        }

        public Builder scope(String scope) {
            this.scopes.add(scope);
            return this;
        }

        public Builder scopes(Collection<String> scopes) {
            this.scopes.addAll(scopes);
            return this;
        }

        /**
         * Preferred account, used to pick among cached user grants
         */
        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder client(OAuthClient client) {
            this.client = client;
            return this;
        }

        public Builder hint(String key, Object value) {
            this.hints.put(key, value);
            return this;
        }

        public Builder hints(Map<String, ?> hints) {
            this.hints.putAll(hints);
            return this;
        }

        public CredentialRequest build() {
            if (packageName == null || packageName.isBlank()) {
                throw new IllegalStateException("packageName is required");
            }
            return new CredentialRequest(this);
        }
    }
}
