package com.tokenbroker.sdk.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tokenbroker.sdk.auth.OAuthClient;
import com.tokenbroker.sdk.client.TokenBroker;
import com.tokenbroker.sdk.credential.AmbientCredentialStrategy;
import com.tokenbroker.sdk.credential.CachedUserTokenStrategy;
import com.tokenbroker.sdk.credential.CredentialResolver;
import com.tokenbroker.sdk.credential.CredentialStrategy;
import com.tokenbroker.sdk.credential.CredentialsRefresher;
import com.tokenbroker.sdk.credential.EnvironmentTokenStrategy;
import com.tokenbroker.sdk.credential.ExplicitTokenStrategy;
import com.tokenbroker.sdk.credential.FailurePolicy;
import com.tokenbroker.sdk.credential.ServiceAccountStrategy;
import com.tokenbroker.sdk.introspect.TokenIntrospector;
import com.tokenbroker.sdk.secret.SecretStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@AutoConfiguration
@EnableConfigurationProperties(TokenBrokerProperties.class)
@ConditionalOnClass(TokenBroker.class)
@ConditionalOnProperty(prefix = "tokenbroker", name = "enabled", havingValue = "true")
public class TokenBrokerAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TokenBrokerAutoConfiguration.class);
    private static final Set<String> DEV_PROFILES = new HashSet<>(Arrays.asList("dev", "local", "test"));

    private static final Duration DEV_CONNECT_TIMEOUT = Duration.ofSeconds(3);
    private static final Duration DEV_REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private final Environment environment;

    public TokenBrokerAutoConfiguration(Environment environment) {
        this.environment = environment;
    }

    @Bean
    @ConditionalOnMissingBean
    public SecretStore secretStore(TokenBrokerProperties properties) {
        SecretStore.Builder builder = SecretStore.builder();
        if (properties.getSecret().getRoot() != null) {
            builder.baseDirectory(properties.getSecret().getRoot());
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public TokenIntrospector tokenIntrospector(
            TokenBrokerProperties properties,
            ObjectProvider<ObjectMapper> objectMapperProvider,
            ObjectProvider<HttpClient> httpClientProvider) {
        TokenBrokerProperties.Introspection introspection = properties.getIntrospection();
        Duration connectTimeout = resolveDuration(
                introspection.getConnectTimeout(),
                "tokenbroker.introspection.connect-timeout",
                DEV_CONNECT_TIMEOUT);
        Duration requestTimeout = resolveDuration(
                introspection.getRequestTimeout(),
                "tokenbroker.introspection.request-timeout",
                DEV_REQUEST_TIMEOUT);

        TokenIntrospector.Builder builder = TokenIntrospector.builder()
                .endpoint(introspection.getUrl())
                .connectTimeout(connectTimeout)
                .requestTimeout(requestTimeout);

        ObjectMapper objectMapper = objectMapperProvider.getIfUnique();
        if (objectMapper != null) {
            builder.objectMapper(objectMapper);
        }

        HttpClient httpClient = httpClientProvider.getIfUnique();
        if (httpClient != null) {
            builder.httpClient(httpClient);
        }

        return builder.build();
    }

    /**
     * Strategy beans defined by the application run first, in their {@code @Order}, followed by
     * the built-in strategies named in {@code tokenbroker.strategies}.
     */
    @Bean
    @ConditionalOnMissingBean
    public CredentialResolver credentialResolver(
            TokenBrokerProperties properties,
            ObjectProvider<CredentialStrategy> strategyProvider,
            ObjectProvider<ObjectMapper> objectMapperProvider) {
        List<CredentialStrategy> strategies = new ArrayList<>();
        strategyProvider.orderedStream().forEach(strategies::add);

        ObjectMapper objectMapper = objectMapperProvider.getIfUnique();
        for (String name : properties.getStrategies()) {
            strategies.add(createStrategy(name, properties, objectMapper));
        }
        log.debug("Credential strategies: {}", strategies.stream().map(CredentialStrategy::name).toList());

        return CredentialResolver.builder()
                .strategies(strategies)
                .failurePolicy(FailurePolicy.valueOf(properties.getFailurePolicy().toUpperCase(Locale.ROOT)))
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public TokenBroker tokenBroker(
            TokenBrokerProperties properties,
            CredentialResolver credentialResolver,
            TokenIntrospector tokenIntrospector) {
        TokenBroker.Builder builder = TokenBroker.builder()
                .packageName(properties.getPackageName())
                .apiKey(properties.getApiKey())
                .active(properties.isActive())
                .email(properties.getEmail())
                .resolver(credentialResolver)
                .introspector(tokenIntrospector);

        TokenBrokerProperties.OAuth oauth = properties.getOauth();
        if (oauth.isConfigured()) {
            builder.client(new OAuthClient(oauth.getClientId(), oauth.getClientSecret()));
        }

        if (!properties.getScopes().isEmpty()) {
            builder.defaultScopes(properties.getScopes());
        }

        return builder.build();
    }

    private CredentialStrategy createStrategy(String name, TokenBrokerProperties properties, ObjectMapper objectMapper) {
        switch (name) {
            case "explicit":
                return new ExplicitTokenStrategy();
            case "service-account":
                return properties.getServiceAccount().getPath() != null
                        ? ServiceAccountStrategy.fromPath(properties.getServiceAccount().getPath())
                        : new ServiceAccountStrategy();
            case "environment":
                return new EnvironmentTokenStrategy(
                        properties.getEnvironment().getVariable(),
                        com.tokenbroker.sdk.util.Environment.system());
            case "user-cache":
                return new CachedUserTokenStrategy(
                        properties.getUserCache().getDirectory(),
                        objectMapper != null ? objectMapper : new ObjectMapper(),
                        CredentialsRefresher.GOOGLE);
            case "ambient":
                return new AmbientCredentialStrategy();
            default:
                throw new IllegalStateException("Unknown credential strategy '" + name + "' in tokenbroker.strategies");
        }
    }

    private Duration resolveDuration(Duration currentValue, String propertyKey, Duration devDefault) {
        if (environment.containsProperty(propertyKey)) {
            return currentValue;
        }
        return isDevProfile() ? devDefault : currentValue;
    }

    private boolean isDevProfile() {
        String[] activeProfiles = environment.getActiveProfiles();
        if (activeProfiles.length == 0) {
            activeProfiles = environment.getDefaultProfiles();
        }
        for (String profile : activeProfiles) {
            if (DEV_PROFILES.contains(profile.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
