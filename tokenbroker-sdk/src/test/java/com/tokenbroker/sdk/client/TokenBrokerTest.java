package com.tokenbroker.sdk.client;

import com.tokenbroker.sdk.auth.OAuthClient;
import com.tokenbroker.sdk.client.transport.TransportRequest;
import com.tokenbroker.sdk.client.transport.TransportResponse;
import com.tokenbroker.sdk.credential.CredentialRequest;
import com.tokenbroker.sdk.credential.CredentialStrategy;
import com.tokenbroker.sdk.credential.FailurePolicy;
import com.tokenbroker.sdk.credential.StrategyOutcome;
import com.tokenbroker.sdk.exception.ConfigurationException;
import com.tokenbroker.sdk.exception.NoCredentialException;
import com.tokenbroker.sdk.introspect.TokenIntrospector;
import com.tokenbroker.sdk.token.BearerToken;
import com.tokenbroker.sdk.token.OAuthEndpoints;
import com.tokenbroker.sdk.token.TokenFacade;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TokenBrokerTest {

    private static final String DRIVE = "https://www.googleapis.com/auth/drive";

    private static TransportRequest request() {
        return new TransportRequest(URI.create("https://www.googleapis.com/drive/v3/files"),
                "GET", null, Map.of(), Duration.ofSeconds(5));
    }

    @Test
    void resolvesOnceAndReusesToken() {
        IssuingStrategy strategy = new IssuingStrategy(Duration.ofHours(1));
        TokenBroker broker = TokenBroker.builder().packageName("mypkg").strategy(strategy).build();

        TokenFacade first = broker.token();
        TokenFacade second = broker.token();

        assertSame(first, second);
        assertEquals(1, strategy.requests.size());
        assertEquals(TokenBroker.DEFAULT_SCOPES, strategy.requests.get(0).getScopes());
        assertSame(first, broker.authState().getCred().orElseThrow());
    }

    @Test
    void widerScopeTriggersNewResolution() {
        IssuingStrategy strategy = new IssuingStrategy(Duration.ofHours(1));
        TokenBroker broker = TokenBroker.builder().packageName("mypkg").strategy(strategy).build();

        TokenFacade narrow = broker.token();
        TokenFacade wide = broker.token(DRIVE);

        assertNotSame(narrow, wide);
        assertEquals(Set.of(DRIVE), strategy.requests.get(1).getScopes());
        assertSame(wide, broker.token(DRIVE));
        assertEquals(2, strategy.requests.size());
    }

    @Test
    void expiredTokenIsResolvedAgain() {
        IssuingStrategy strategy = new IssuingStrategy(Duration.ofSeconds(-5));
        TokenBroker broker = TokenBroker.builder().packageName("mypkg").strategy(strategy).build();

        TokenFacade first = broker.token();
        TokenFacade second = broker.token();

        assertNotSame(first, second);
        assertEquals(2, strategy.requests.size());
    }

    @Test
    void invalidateForgetsToken() {
        IssuingStrategy strategy = new IssuingStrategy(Duration.ofHours(1));
        TokenBroker broker = TokenBroker.builder().packageName("mypkg").strategy(strategy).build();

        TokenFacade first = broker.token();
        broker.invalidate();

        assertFalse(broker.authState().hasCred());
        assertNotSame(first, broker.token());
    }

    @Test
    void requestCarriesConfiguredContext() {
        IssuingStrategy strategy = new IssuingStrategy(Duration.ofHours(1));
        OAuthClient client = new OAuthClient("client-id", "client-secret");
        TokenBroker broker = TokenBroker.builder()
                .packageName("mypkg")
                .client(client)
                .email("user@example.com")
                .hint("path", "/keys/sa.json")
                .strategy(strategy)
                .build();

        broker.token();

        CredentialRequest seen = strategy.requests.get(0);
        assertEquals("mypkg", seen.getPackageName());
        assertSame(client, seen.getClient().orElseThrow());
        assertEquals("user@example.com", seen.getEmail().orElseThrow());
        assertEquals("/keys/sa.json", seen.hint("path").orElseThrow());
    }

    @Test
    void noStrategySucceedingThrows() {
        TokenBroker broker = TokenBroker.builder()
                .packageName("mypkg")
                .strategy(new RefusingStrategy())
                .build();

        NoCredentialException ex = assertThrows(NoCredentialException.class, broker::token);
        assertEquals("refusing", ex.getAttempts().get(0).strategyName());
        assertFalse(broker.authState().hasCred());
    }

    @Test
    void abortPolicyIsPassedToResolver() {
        TokenBroker broker = TokenBroker.builder()
                .packageName("mypkg")
                .failurePolicy(FailurePolicy.ABORT)
                .strategy(new RefusingStrategy())
                .build();

        assertEquals(FailurePolicy.ABORT, broker.getResolver().getFailurePolicy());
    }

    @Test
    void inactiveBrokerUsesApiKey() {
        IssuingStrategy strategy = new IssuingStrategy(Duration.ofHours(1));
        TokenBroker broker = TokenBroker.builder()
                .packageName("mypkg")
                .apiKey("key-123")
                .active(false)
                .strategy(strategy)
                .build();

        TransportRequest authorized = broker.authorize(request());

        assertEquals("key=key-123", authorized.getUri().getRawQuery());
        assertFalse(authorized.getHeaders().containsKey("Authorization"));
        assertThrows(ConfigurationException.class, broker::token);
        assertTrue(strategy.requests.isEmpty());
    }

    @Test
    void activeBrokerAuthorizesWithResolvedToken() {
        IssuingStrategy strategy = new IssuingStrategy(Duration.ofHours(1));
        TokenBroker broker = TokenBroker.builder().packageName("mypkg").strategy(strategy).build();

        TransportRequest authorized = broker.authorize(request());

        assertEquals("Bearer token-1", authorized.getHeaders().get("Authorization"));
    }

    @Test
    void inactiveWithoutApiKeyFailsAtBuild() {
        assertThrows(ConfigurationException.class,
                () -> TokenBroker.builder().packageName("mypkg").active(false).build());
    }

    @Test
    void packageNameIsRequired() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> TokenBroker.builder().build());
        assertTrue(ex.getMessage().contains("packageName"));
    }

    @Test
    void emailComesFromIntrospection() {
        IssuingStrategy strategy = new IssuingStrategy(Duration.ofHours(1));
        List<TransportRequest> calls = new ArrayList<>();
        TokenIntrospector introspector = TokenIntrospector.builder()
                .transport(request -> {
                    calls.add(request);
                    return new TransportResponse(200, "{\"email\":\"sa@project.iam.gserviceaccount.com\"}");
                })
                .build();
        TokenBroker broker = TokenBroker.builder()
                .packageName("mypkg")
                .strategy(strategy)
                .introspector(introspector)
                .build();

        assertEquals("sa@project.iam.gserviceaccount.com", broker.email().orElseThrow());
        assertEquals("sa@project.iam.gserviceaccount.com", broker.tokenInfo().getEmail().orElseThrow());
        assertEquals(1, calls.size());
    }

    @Test
    void defaultStrategiesFollowConventionalOrder() {
        List<String> names = TokenBroker.defaultStrategies().stream().map(CredentialStrategy::name).toList();

        assertEquals(List.of("explicit", "service-account", "environment", "ambient"), names);
    }

    private static final class IssuingStrategy implements CredentialStrategy {
        private final Duration lifetime;
        private final List<CredentialRequest> requests = new ArrayList<>();

        IssuingStrategy(Duration lifetime) {
            this.lifetime = lifetime;
        }

        @Override
        public String name() {
            return "issuing";
        }

        @Override
        public StrategyOutcome attempt(CredentialRequest request) {
            requests.add(request);
            return StrategyOutcome.success(new BearerToken("token-" + requests.size(),
                    Instant.now().plus(lifetime), request.getScopes(), OAuthEndpoints.GOOGLE_AUTHORIZATION_HOST));
        }
    }

    private static final class RefusingStrategy implements CredentialStrategy {
        @Override
        public String name() {
            return "refusing";
        }

        @Override
        public StrategyOutcome attempt(CredentialRequest request) {
            return StrategyOutcome.notApplicable("never applicable");
        }
    }
}
