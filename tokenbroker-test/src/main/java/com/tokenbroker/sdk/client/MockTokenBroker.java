package com.tokenbroker.sdk.client;

import com.tokenbroker.sdk.test.StubCredentialStrategy;
import com.tokenbroker.sdk.token.IntrospectionResult;
import com.tokenbroker.sdk.token.TokenFacade;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory TokenBroker for tests. Issues stub tokens without touching the network and
 * answers {@link #email()} and {@link #tokenInfo()} locally.
 */
public class MockTokenBroker extends TokenBroker {

    public static final String DEFAULT_PACKAGE = "mock";
    public static final String DEFAULT_EMAIL = "mock-user@example.com";

    private final String email;
    private final CopyOnWriteArrayList<Set<String>> requestedScopes = new CopyOnWriteArrayList<>();

    public MockTokenBroker() {
        this(DEFAULT_PACKAGE, DEFAULT_EMAIL);
    }

    public MockTokenBroker(String packageName, String email) {
        super(TokenBroker.builder()
                .packageName(packageName)
                .strategy(StubCredentialStrategy.issuing("mock")));
        this.email = email;
    }

    @Override
    public TokenFacade token(Collection<String> scopes) {
        requestedScopes.add(Set.copyOf(scopes));
        return super.token(scopes);
    }

    @Override
    public Optional<String> email() {
        token();
        return Optional.ofNullable(email);
    }

    @Override
    public IntrospectionResult tokenInfo() {
        TokenFacade token = token();
        return new IntrospectionResult(email, token.scopes(), 3600L, null);
    }

    public List<Set<String>> getRequestedScopes() {
        return Collections.unmodifiableList(requestedScopes);
    }

    public void reset() {
        requestedScopes.clear();
        invalidate();
    }

    public void assertTokenRequestCount(int expected) {
        int actual = requestedScopes.size();
        if (actual != expected) {
            throw new AssertionError("Expected " + expected + " token requests but found " + actual);
        }
    }

    public void assertScopeRequested(String scope) {
        for (Set<String> scopes : requestedScopes) {
            if (scopes.contains(scope)) {
                return;
            }
        }
        throw new AssertionError("Expected a token request for scope '" + scope + "'");
    }
}
