package com.tokenbroker.sdk.token;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Shared state for token facades: endpoint host, granted scopes and the write-once
 * introspection slot.
 */
public abstract class AbstractTokenFacade implements TokenFacade {

    /** Tokens expiring within this window are reported as expired. */
    protected static final Duration EXPIRY_BUFFER = Duration.ofSeconds(60);

    private final String endpointHost;
    private final Set<String> scopes;
    private IntrospectionResult introspection;

    protected AbstractTokenFacade(String endpointHost, Set<String> scopes) {
        this.endpointHost = Objects.requireNonNull(endpointHost, "endpointHost");
        this.scopes = scopes != null ? Set.copyOf(scopes) : Set.of();
    }

    @Override
    public String endpointHost() {
        return endpointHost;
    }

    @Override
    public Set<String> scopes() {
        return scopes;
    }

    @Override
    public boolean isExpired() {
        return expiry()
                .map(expiresAt -> Instant.now().plus(EXPIRY_BUFFER).isAfter(expiresAt))
                .orElse(false);
    }

    @Override
    public Optional<IntrospectionResult> cachedIntrospection() {
        return Optional.ofNullable(introspection);
    }

    @Override
    public void cacheIntrospection(IntrospectionResult result) {
        Objects.requireNonNull(result, "result");
        if (introspection != null) {
            throw new IllegalStateException("Introspection result already cached for this token");
        }
        introspection = result;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{endpointHost=" + endpointHost + ", scopes=" + scopes
                + ", expiry=" + expiry().orElse(null) + "}";
    }
}
