package com.tokenbroker.sdk.token;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * Capability set of any bearer credential the broker can hand out.
 *
 * <p>Implementations wrap a concrete token representation (a Google credentials object,
 * a raw access token from the environment, a caller-built token). Conformance is checked
 * once, when a credential enters the broker; after that only this interface is used.</p>
 *
 * <p>Apart from the introspection slot, a token is immutable from the broker's point of view.
 * The slot is write-once: {@link #cacheIntrospection(IntrospectionResult)} may succeed at most
 * once per instance.</p>
 */
public interface TokenFacade {

    /**
     * @return the bearer token value (without "Bearer " prefix)
     */
    String accessToken();

    Optional<String> refreshToken();

    Optional<Instant> expiry();

    Set<String> scopes();

    /**
     * @return host of the authorization server this token was issued through
     */
    String endpointHost();

    boolean isExpired();

    /**
     * @return true if {@link #refresh()} can obtain a new access token
     */
    boolean canRefresh();

    /**
     * Obtain a fresh access token from the issuing authorization server.
     *
     * @throws com.tokenbroker.sdk.exception.TokenBrokerException if the refresh fails or is unsupported
     */
    void refresh();

    Optional<IntrospectionResult> cachedIntrospection();

    /**
     * Store the introspection result for this token.
     *
     * @throws IllegalStateException if a result was already cached
     */
    void cacheIntrospection(IntrospectionResult result);
}
