package com.tokenbroker.sdk.test;

import com.tokenbroker.sdk.credential.CredentialRequest;
import com.tokenbroker.sdk.credential.CredentialStrategy;
import com.tokenbroker.sdk.credential.StrategyOutcome;
import com.tokenbroker.sdk.token.BearerToken;
import com.tokenbroker.sdk.token.OAuthEndpoints;
import com.tokenbroker.sdk.token.TokenFacade;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Credential strategy with a scripted outcome that records every request it sees.
 *
 * <pre>{@code
 * StubCredentialStrategy first = StubCredentialStrategy.notApplicable("first", "nothing here");
 * StubCredentialStrategy second = StubCredentialStrategy.issuing("second");
 * StubCredentialStrategy third = StubCredentialStrategy.issuing("third");
 *
 * resolver.resolve(request, List.of(first, second, third));
 * third.assertNotCalled();
 * }</pre>
 */
public class StubCredentialStrategy implements CredentialStrategy {

    private final String name;
    private final Function<CredentialRequest, StrategyOutcome> outcome;
    private final CopyOnWriteArrayList<CredentialRequest> requests = new CopyOnWriteArrayList<>();

    public StubCredentialStrategy(String name, Function<CredentialRequest, StrategyOutcome> outcome) {
        this.name = name;
        this.outcome = outcome;
    }

    /**
     * Always returns the given token.
     */
    public static StubCredentialStrategy succeeding(String name, TokenFacade token) {
        return new StubCredentialStrategy(name, request -> StrategyOutcome.success(token));
    }

    /**
     * Returns a fresh one-hour Google bearer token carrying the requested scopes on every call.
     */
    public static StubCredentialStrategy issuing(String name) {
        return new StubCredentialStrategy(name, request -> StrategyOutcome.success(new BearerToken(
                name + "-token",
                Instant.now().plus(Duration.ofHours(1)),
                request.getScopes(),
                OAuthEndpoints.GOOGLE_AUTHORIZATION_HOST)));
    }

    public static StubCredentialStrategy notApplicable(String name, String reason) {
        return new StubCredentialStrategy(name, request -> StrategyOutcome.notApplicable(reason));
    }

    public static StubCredentialStrategy failing(String name, Throwable error) {
        return new StubCredentialStrategy(name, request -> StrategyOutcome.failure(error));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public StrategyOutcome attempt(CredentialRequest request) {
        requests.add(request);
        return outcome.apply(request);
    }

    public int getCallCount() {
        return requests.size();
    }

    public List<CredentialRequest> getRequests() {
        return Collections.unmodifiableList(requests);
    }

    public void reset() {
        requests.clear();
    }

    public void assertCalled(int expected) {
        int actual = requests.size();
        if (actual != expected) {
            throw new AssertionError("Expected strategy '" + name + "' to be called " + expected
                    + " times but was called " + actual + " times");
        }
    }

    public void assertNotCalled() {
        assertCalled(0);
    }
}
