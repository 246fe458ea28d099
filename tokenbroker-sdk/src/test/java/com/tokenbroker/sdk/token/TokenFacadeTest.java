package com.tokenbroker.sdk.token;

import com.tokenbroker.sdk.exception.TokenBrokerException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TokenFacadeTest {

    private static final IntrospectionResult RESULT =
            new IntrospectionResult("jane@example.com", Set.of("openid"), 3599L, null);

    @Test
    void introspectionSlotIsWriteOnce() {
        BearerToken token = BearerToken.of("tok");
        assertTrue(token.cachedIntrospection().isEmpty());

        token.cacheIntrospection(RESULT);
        assertSame(RESULT, token.cachedIntrospection().orElseThrow());

        assertThrows(IllegalStateException.class, () -> token.cacheIntrospection(RESULT));
        assertSame(RESULT, token.cachedIntrospection().orElseThrow());
    }

    @Test
    void expiryWithinBufferCountsAsExpired() {
        BearerToken soon = new BearerToken("tok", Instant.now().plusSeconds(10), Set.of(),
                OAuthEndpoints.GOOGLE_AUTHORIZATION_HOST);
        BearerToken later = new BearerToken("tok", Instant.now().plusSeconds(3600), Set.of(),
                OAuthEndpoints.GOOGLE_AUTHORIZATION_HOST);

        assertTrue(soon.isExpired());
        assertFalse(later.isExpired());
        assertFalse(BearerToken.of("tok").isExpired());
    }

    @Test
    void bearerTokenCannotRefresh() {
        BearerToken token = BearerToken.of("tok");

        assertFalse(token.canRefresh());
        assertThrows(TokenBrokerException.class, token::refresh);
        assertTrue(token.refreshToken().isEmpty());
    }

    @Test
    void bearerTokenRejectsBlankValue() {
        assertThrows(IllegalArgumentException.class, () -> BearerToken.of(" "));
        assertThrows(IllegalArgumentException.class, () -> BearerToken.of(null));
    }

    @Test
    void toStringOmitsAccessToken() {
        assertFalse(BearerToken.of("secret-token").toString().contains("secret-token"));
    }
}
