package com.tokenbroker.sdk.client;

import com.tokenbroker.sdk.auth.AuthState;
import com.tokenbroker.sdk.auth.OAuthClient;
import com.tokenbroker.sdk.client.transport.TransportRequest;
import com.tokenbroker.sdk.credential.AmbientCredentialStrategy;
import com.tokenbroker.sdk.credential.CredentialRequest;
import com.tokenbroker.sdk.credential.CredentialResolver;
import com.tokenbroker.sdk.credential.CredentialStrategy;
import com.tokenbroker.sdk.credential.EnvironmentTokenStrategy;
import com.tokenbroker.sdk.credential.ExplicitTokenStrategy;
import com.tokenbroker.sdk.credential.FailurePolicy;
import com.tokenbroker.sdk.credential.ServiceAccountStrategy;
import com.tokenbroker.sdk.exception.ConfigurationException;
import com.tokenbroker.sdk.exception.NoCredentialException;
import com.tokenbroker.sdk.exception.TokenBrokerException;
import com.tokenbroker.sdk.introspect.TokenIntrospector;
import com.tokenbroker.sdk.token.IntrospectionResult;
import com.tokenbroker.sdk.token.OAuthEndpoints;
import com.tokenbroker.sdk.token.TokenFacade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Token Broker - Main entry point for the SDK
 *
 * <p>Owns the {@link AuthState} of one consuming package and fills it on demand by running
 * the credential strategies. A resolved token is reused until it expires or no longer covers
 * the requested scopes.</p>
 *
 * <h2>Usage:</h2>
 * <pre>{@code
 * TokenBroker broker = TokenBroker.builder()
 *     .packageName("mypkg")
 *     .client(new OAuthClient("client-id", "client-secret"))
 *     .strategy(ServiceAccountStrategy.fromPath(Path.of("key.json")))
 *     .strategy(new AmbientCredentialStrategy())
 *     .build();
 *
 * TokenFacade token = broker.token("https://www.googleapis.com/auth/drive");
 * String email = broker.email().orElse("unknown");
 * }</pre>
 *
 * <h2>Usage with API Key only:</h2>
 * <pre>{@code
 * TokenBroker broker = TokenBroker.builder()
 *     .packageName("mypkg")
 *     .apiKey("your-api-key")
 *     .active(false)
 *     .build();
 *
 * TransportRequest authorized = broker.authorize(request);  // adds ?key=...
 * }</pre>
 *
 * <p>Not thread-safe: resolution mutates the owned auth state.</p>
 */
public class TokenBroker {

    private static final Logger log = LoggerFactory.getLogger(TokenBroker.class);

    public static final Set<String> DEFAULT_SCOPES = Set.of(OAuthEndpoints.USERINFO_EMAIL_SCOPE);

    private final AuthState authState;
    private final CredentialResolver resolver;
    private final TokenIntrospector introspector;
    private final Set<String> defaultScopes;
    private final String email;
    private final Map<String, Object> hints;

    protected TokenBroker(Builder builder) {
        this.authState = AuthState.builder(builder.packageName)
                .client(builder.client)
                .apiKey(builder.apiKey)
                .active(builder.active)
                .build();
        this.resolver = builder.resolver != null
                ? builder.resolver
                : CredentialResolver.builder()
                    .strategies(builder.strategies.isEmpty() ? defaultStrategies() : builder.strategies)
                    .failurePolicy(builder.failurePolicy)
                    .build();
        this.introspector = builder.introspector != null
                ? builder.introspector
                : TokenIntrospector.builder().build();
        this.defaultScopes = Set.copyOf(builder.defaultScopes);
        this.email = builder.email;
        this.hints = Map.copyOf(builder.hints);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Strategies used when none are configured, in the conventional order.
     */
    public static List<CredentialStrategy> defaultStrategies() {
        return List.of(
                new ExplicitTokenStrategy(),
                new ServiceAccountStrategy(),
                new EnvironmentTokenStrategy(),
                new AmbientCredentialStrategy());
    }

    public AuthState authState() {
        return authState;
    }

    public CredentialResolver getResolver() {
        return resolver;
    }

    /**
     * Get a token covering the default scopes.
     *
     * @see #token(Collection)
     */
    public TokenFacade token() {
        return token(defaultScopes);
    }

    public TokenFacade token(String... scopes) {
        return token(Arrays.asList(scopes));
    }

    /**
     * Get a token covering the given scopes, resolving a new one if the current token is
     * missing, expired beyond refresh, or too narrow.
     *
     * @throws ConfigurationException if auth is inactive for this package
     * @throws NoCredentialException if no strategy produces a token
     */
    public TokenFacade token(Collection<String> scopes) {
        if (!authState.isActive()) {
            throw new ConfigurationException(
                    "Auth is inactive for '" + authState.getPackageName() + "'; requests use the API key");
        }
        Set<String> wanted = new LinkedHashSet<>(scopes.isEmpty() ? defaultScopes : scopes);

        Optional<TokenFacade> current = authState.getCred()
                .filter(cred -> cred.scopes().isEmpty() || cred.scopes().containsAll(wanted));
        if (current.isPresent() && usable(current.get())) {
            return current.get();
        }

        CredentialRequest request = CredentialRequest.builder(authState.getPackageName())
                .scopes(wanted)
                .email(email)
                .client(authState.getClient().orElse(null))
                .hints(hints)
                .build();
        return resolver.populate(authState, request);
    }

    /**
     * Attach credentials to a request: a bearer token when auth is active, the API key otherwise.
     */
    public TransportRequest authorize(TransportRequest request) {
        if (authState.isActive()) {
            token();
        }
        return authState.authorize(request);
    }

    /**
     * @return email of the account behind the current token
     */
    public Optional<String> email() {
        return introspector.email(token());
    }

    public IntrospectionResult tokenInfo() {
        return introspector.tokenInfo(token());
    }

    /**
     * Forget the current token; the next call resolves again.
     */
    public void invalidate() {
        authState.clearCred();
    }

    private boolean usable(TokenFacade cred) {
        if (!cred.isExpired()) {
            return true;
        }
        if (!cred.canRefresh()) {
            log.debug("Cached token expired and cannot be refreshed");
            return false;
        }
        try {
            cred.refresh();
            return !cred.isExpired();
        } catch (TokenBrokerException e) {
            log.warn("Refreshing cached token failed, resolving a new one: {}", e.getMessage());
            return false;
        }
    }

    public static class Builder {
        private String packageName;
        private OAuthClient client;
        private String apiKey;
        private boolean active = true;
        private String email;
        private final List<CredentialStrategy> strategies = new ArrayList<>();
        private FailurePolicy failurePolicy = FailurePolicy.CONTINUE;
        private CredentialResolver resolver;
        private TokenIntrospector introspector;
        private Set<String> defaultScopes = DEFAULT_SCOPES;
        private final Map<String, Object> hints = new LinkedHashMap<>();

        /**
         * Name of the consuming package (required)
         */
        public Builder packageName(String packageName) {
            this.packageName = packageName;
            return this;
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
         * Whether requests carry a token (default: true); inactive brokers send only the API key
         */
        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        /**
         * Preferred account when several cached user grants exist
         */
        public Builder email(String email) {
            this.email = email;
            return this;
        }

        /**
         * Append a strategy; ignored when a resolver is provided
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
         * Behaviour when an applicable strategy fails (default: CONTINUE); ignored when a resolver is provided
         */
        public Builder failurePolicy(FailurePolicy failurePolicy) {
            this.failurePolicy = failurePolicy;
            return this;
        }

        /**
         * Provide a pre-built resolver (overrides strategies and failurePolicy)
         */
        public Builder resolver(CredentialResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        public Builder introspector(TokenIntrospector introspector) {
            this.introspector = introspector;
            return this;
        }

        /**
         * Scopes requested by {@link TokenBroker#token()} (default: userinfo.email)
         */
        public Builder defaultScopes(Collection<String> defaultScopes) {
            this.defaultScopes = new LinkedHashSet<>(defaultScopes);
            return this;
        }

        /**
         * Hint passed to every strategy, e.g. {@code "path"} for a service account key
         */
        public Builder hint(String key, Object value) {
            this.hints.put(key, value);
            return this;
        }

        /**
         * @throws IllegalStateException if packageName is not set
         * @throws ConfigurationException if auth is inactive without an API key
         */
        public TokenBroker build() {
            if (packageName == null || packageName.isBlank()) {
                throw new IllegalStateException("packageName is required");
            }
            if (failurePolicy == null) {
                throw new IllegalStateException("failurePolicy is required");
            }
            return new TokenBroker(this);
        }
    }
}
