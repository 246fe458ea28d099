package com.tokenbroker.sdk.credential;

import com.tokenbroker.sdk.exception.InvalidTokenTypeException;
import com.tokenbroker.sdk.exception.TokenBrokerException;
import com.tokenbroker.sdk.exception.WrongEndpointException;
import com.tokenbroker.sdk.token.OAuthEndpoints;
import com.tokenbroker.sdk.token.TokenFacade;
import com.tokenbroker.sdk.token.TokenRequestConfig;

import java.util.Objects;

/**
 * Bring-your-own token: accepts a token object the caller obtained elsewhere.
 *
 * <p>The candidate is taken from the constructor, or else from the {@value #TOKEN_HINT}
 * request hint. It must be a {@link TokenFacade} issued through Google's authorization
 * server, or a {@link TokenRequestConfig} wrapping one. Valid tokens are returned as-is.</p>
 */
public class ExplicitTokenStrategy implements CredentialStrategy {

    public static final String TOKEN_HINT = "token";

    private final Object candidate;
    private final String expectedHost;

    public ExplicitTokenStrategy() {
        this(null);
    }

    public ExplicitTokenStrategy(Object candidate) {
        this(candidate, OAuthEndpoints.GOOGLE_AUTHORIZATION_HOST);
    }

    public ExplicitTokenStrategy(Object candidate, String expectedHost) {
        this.candidate = candidate;
        this.expectedHost = Objects.requireNonNull(expectedHost, "expectedHost");
    }

    @Override
    public String name() {
        return "explicit";
    }

    @Override
    public StrategyOutcome attempt(CredentialRequest request) {
        Object supplied = candidate != null ? candidate : request.hint(TOKEN_HINT).orElse(null);
        if (supplied == null) {
            return StrategyOutcome.notApplicable("no token supplied");
        }
        try {
            return StrategyOutcome.success(acceptExternalToken(supplied, expectedHost));
        } catch (TokenBrokerException e) {
            return StrategyOutcome.failure(e);
        }
    }

    /**
     * Validate a caller-supplied token against Google's authorization host.
     *
     * @see #acceptExternalToken(Object, String)
     */
    public static TokenFacade acceptExternalToken(Object candidate) {
        return acceptExternalToken(candidate, OAuthEndpoints.GOOGLE_AUTHORIZATION_HOST);
    }

    /**
     * Validate a caller-supplied token.
     *
     * @param candidate a {@link TokenFacade}, or a {@link TokenRequestConfig} embedding one
     * @param expectedHost the authorization host the token must have been issued through
     * @return the candidate token itself, not a copy
     * @throws InvalidTokenTypeException if the candidate is not a token
     * @throws WrongEndpointException if the token belongs to another authorization server
     */
    public static TokenFacade acceptExternalToken(Object candidate, String expectedHost) {
        Object unwrapped = candidate;
        while (unwrapped instanceof TokenRequestConfig config) {
            unwrapped = config.getToken();
        }

        if (!(unwrapped instanceof TokenFacade token)) {
            throw new InvalidTokenTypeException(describe(unwrapped));
        }

        String host = token.endpointHost();
        if (!expectedHost.equalsIgnoreCase(host)) {
            throw new WrongEndpointException(host, expectedHost);
        }
        return token;
    }

    private static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        return value.getClass().getName();
    }
}
