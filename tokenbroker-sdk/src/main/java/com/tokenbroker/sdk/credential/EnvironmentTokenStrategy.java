package com.tokenbroker.sdk.credential;

import com.tokenbroker.sdk.token.BearerToken;
import com.tokenbroker.sdk.token.OAuthEndpoints;
import com.tokenbroker.sdk.util.Environment;

import java.util.Objects;

/**
 * Token from an environment variable holding a raw access token.
 *
 * <p>Typical for CI systems or workload setups that mint a short-lived token outside the
 * process. The token cannot be refreshed.</p>
 */
public class EnvironmentTokenStrategy implements CredentialStrategy {

    public static final String DEFAULT_VARIABLE = "GOOGLE_OAUTH_ACCESS_TOKEN";

    private final String variable;
    private final Environment environment;

    public EnvironmentTokenStrategy() {
        this(DEFAULT_VARIABLE, Environment.system());
    }

    public EnvironmentTokenStrategy(String variable, Environment environment) {
        if (variable == null || variable.isBlank()) {
            throw new IllegalArgumentException("variable cannot be null or blank");
        }
        this.variable = variable;
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    public String getVariable() {
        return variable;
    }

    @Override
    public String name() {
        return "environment";
    }

    @Override
    public StrategyOutcome attempt(CredentialRequest request) {
        return environment.getNonBlank(variable)
                .map(value -> StrategyOutcome.success(new BearerToken(
                        value.trim(), null, request.getScopes(), OAuthEndpoints.GOOGLE_AUTHORIZATION_HOST)))
                .orElseGet(() -> StrategyOutcome.notApplicable(variable + " is not set"));
    }
}
