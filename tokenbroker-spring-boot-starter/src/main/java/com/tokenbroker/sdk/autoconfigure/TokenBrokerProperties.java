package com.tokenbroker.sdk.autoconfigure;

import jakarta.validation.constraints.AssertTrue;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@ConfigurationProperties(prefix = "tokenbroker")
@Validated
public class TokenBrokerProperties {

    static final Set<String> KNOWN_STRATEGIES =
            Set.of("explicit", "service-account", "environment", "user-cache", "ambient");
    static final List<String> DEFAULT_STRATEGIES =
            List.of("explicit", "service-account", "environment", "user-cache", "ambient");

    private final boolean enabled;
    private final String packageName;
    private final String apiKey;
    private final boolean active;
    private final List<String> scopes;
    private final String email;
    private final String failurePolicy;
    private final List<String> strategies;

    @NestedConfigurationProperty
    private final ServiceAccount serviceAccount;

    @NestedConfigurationProperty
    private final EnvironmentToken environment;

    @NestedConfigurationProperty
    private final UserCache userCache;

    @NestedConfigurationProperty
    private final OAuth oauth;

    @NestedConfigurationProperty
    private final Introspection introspection;

    @NestedConfigurationProperty
    private final Secret secret;

    public TokenBrokerProperties(
            Boolean enabled,
            String packageName,
            String apiKey,
            Boolean active,
            List<String> scopes,
            String email,
            String failurePolicy,
            List<String> strategies,
            ServiceAccount serviceAccount,
            EnvironmentToken environment,
            UserCache userCache,
            OAuth oauth,
            Introspection introspection,
            Secret secret) {
        this.enabled = enabled != null && enabled;
        this.packageName = packageName;
        this.apiKey = hasText(apiKey) ? apiKey : null;
        this.active = active == null || active;
        this.scopes = scopes != null ? List.copyOf(scopes) : List.of();
        this.email = email;
        this.failurePolicy = normalize(failurePolicy, "continue");
        this.strategies = strategies != null && !strategies.isEmpty()
                ? strategies.stream().filter(TokenBrokerProperties::hasText).map(s -> normalize(s, s)).toList()
                : DEFAULT_STRATEGIES;
        this.serviceAccount = serviceAccount != null ? serviceAccount : new ServiceAccount(null);
        this.environment = environment != null ? environment : new EnvironmentToken(null);
        this.userCache = userCache != null ? userCache : new UserCache(null);
        this.oauth = oauth != null ? oauth : new OAuth(null, null);
        this.introspection = introspection != null ? introspection : new Introspection(null, null, null);
        this.secret = secret != null ? secret : new Secret(null);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getPackageName() {
        return packageName;
    }

    public String getApiKey() {
        return apiKey;
    }

    public boolean isActive() {
        return active;
    }

    public List<String> getScopes() {
        return scopes;
    }

    public String getEmail() {
        return email;
    }

    public String getFailurePolicy() {
        return failurePolicy;
    }

    public List<String> getStrategies() {
        return strategies;
    }

    public ServiceAccount getServiceAccount() {
        return serviceAccount;
    }

    public EnvironmentToken getEnvironment() {
        return environment;
    }

    public UserCache getUserCache() {
        return userCache;
    }

    public OAuth getOauth() {
        return oauth;
    }

    public Introspection getIntrospection() {
        return introspection;
    }

    public Secret getSecret() {
        return secret;
    }

    @AssertTrue(message = "tokenbroker.package-name is required when tokenbroker.enabled=true")
    public boolean isPackageNameValid() {
        return !enabled || hasText(packageName);
    }

    @AssertTrue(message = "tokenbroker.api-key is required when tokenbroker.active=false")
    public boolean isApiKeyValid() {
        return !enabled || active || apiKey != null;
    }

    @AssertTrue(message = "tokenbroker.failure-policy must be one of: continue, abort")
    public boolean isFailurePolicyValid() {
        return failurePolicy.equals("continue") || failurePolicy.equals("abort");
    }

    @AssertTrue(message = "tokenbroker.strategies may only contain: explicit, service-account, environment, user-cache, ambient")
    public boolean isStrategiesValid() {
        return KNOWN_STRATEGIES.containsAll(strategies);
    }

    @AssertTrue(message = "tokenbroker.oauth requires both client-id and client-secret when either is set")
    public boolean isOAuthValid() {
        return hasText(oauth.clientId) == hasText(oauth.clientSecret);
    }

    public static class ServiceAccount {
        private final Path path;

        public ServiceAccount(Path path) {
            this.path = path;
        }

        public Path getPath() {
            return path;
        }
    }

    public static class EnvironmentToken {
        private final String variable;

        public EnvironmentToken(String variable) {
            this.variable = hasText(variable) ? variable.trim() : "GOOGLE_OAUTH_ACCESS_TOKEN";
        }

        public String getVariable() {
            return variable;
        }
    }

    public static class UserCache {
        private final Path directory;

        public UserCache(Path directory) {
            this.directory = directory;
        }

        public Path getDirectory() {
            return directory;
        }
    }

    public static class OAuth {
        private final String clientId;
        private final String clientSecret;

        public OAuth(String clientId, String clientSecret) {
            this.clientId = clientId;
            this.clientSecret = clientSecret;
        }

        public String getClientId() {
            return clientId;
        }

        public String getClientSecret() {
            return clientSecret;
        }

        public boolean isConfigured() {
            return hasText(clientId) && hasText(clientSecret);
        }
    }

    public static class Introspection {
        private static final String DEFAULT_URL = "https://oauth2.googleapis.com/tokeninfo";
        private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
        private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

        private final String url;
        private final Duration connectTimeout;
        private final Duration requestTimeout;

        public Introspection(String url, Duration connectTimeout, Duration requestTimeout) {
            this.url = hasText(url) ? url : DEFAULT_URL;
            this.connectTimeout = connectTimeout != null ? connectTimeout : DEFAULT_CONNECT_TIMEOUT;
            this.requestTimeout = requestTimeout != null ? requestTimeout : DEFAULT_REQUEST_TIMEOUT;
        }

        public String getUrl() {
            return url;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }
    }

    public static class Secret {
        private final Path root;

        public Secret(Path root) {
            this.root = root;
        }

        public Path getRoot() {
            return root;
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String normalize(String value, String fallback) {
        if (!hasText(value)) {
            return fallback;
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
