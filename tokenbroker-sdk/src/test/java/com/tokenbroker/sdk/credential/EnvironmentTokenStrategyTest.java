package com.tokenbroker.sdk.credential;

import com.tokenbroker.sdk.token.BearerToken;
import com.tokenbroker.sdk.token.OAuthEndpoints;
import com.tokenbroker.sdk.util.Environment;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnvironmentTokenStrategyTest {

    private static final CredentialRequest REQUEST = CredentialRequest.builder("mypkg")
            .scope("https://www.googleapis.com/auth/drive")
            .build();

    @Test
    void notApplicableWhenVariableUnset() {
        EnvironmentTokenStrategy strategy = new EnvironmentTokenStrategy(
                EnvironmentTokenStrategy.DEFAULT_VARIABLE, Environment.of(Map.of()));

        StrategyOutcome.NotApplicable outcome =
                assertInstanceOf(StrategyOutcome.NotApplicable.class, strategy.attempt(REQUEST));
        assertEquals("GOOGLE_OAUTH_ACCESS_TOKEN is not set", outcome.reason());
    }

    @Test
    void notApplicableWhenVariableBlank() {
        EnvironmentTokenStrategy strategy = new EnvironmentTokenStrategy(
                "MY_TOKEN", Environment.of(Map.of("MY_TOKEN", "  ")));

        assertInstanceOf(StrategyOutcome.NotApplicable.class, strategy.attempt(REQUEST));
    }

    @Test
    void producesBearerTokenOnGoogleHost() {
        EnvironmentTokenStrategy strategy = new EnvironmentTokenStrategy(
                "MY_TOKEN", Environment.of(Map.of("MY_TOKEN", "ya29.token\n")));

        StrategyOutcome.Success success =
                assertInstanceOf(StrategyOutcome.Success.class, strategy.attempt(REQUEST));
        BearerToken token = assertInstanceOf(BearerToken.class, success.token());
        assertEquals("ya29.token", token.accessToken());
        assertEquals(OAuthEndpoints.GOOGLE_AUTHORIZATION_HOST, token.endpointHost());
        assertTrue(token.scopes().contains("https://www.googleapis.com/auth/drive"));
        assertFalse(token.canRefresh());
    }

    @Test
    void rejectsBlankVariableName() {
        assertThrows(IllegalArgumentException.class,
                () -> new EnvironmentTokenStrategy(" ", Environment.of(Map.of())));
    }
}
