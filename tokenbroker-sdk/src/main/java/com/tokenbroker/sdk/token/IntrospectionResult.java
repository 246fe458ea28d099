package com.tokenbroker.sdk.token;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Identity and scopes reported by the token introspection endpoint. Immutable.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class IntrospectionResult {

    private final String email;
    private final Set<String> scope;
    private final Long expiresIn;
    private final String audience;

    public IntrospectionResult(String email, Set<String> scope, Long expiresIn, String audience) {
        this.email = email;
        this.scope = scope != null ? Set.copyOf(scope) : Set.of();
        this.expiresIn = expiresIn;
        this.audience = audience;
    }

    /**
     * Jackson entry point; {@code scope} arrives either space-delimited or as a JSON array.
     */
    @JsonCreator
    static IntrospectionResult fromJson(
            @JsonProperty("email") String email,
            @JsonProperty("scope") JsonNode scope,
            @JsonProperty("expires_in") Long expiresIn,
            @JsonProperty("aud") String audience) {
        return new IntrospectionResult(email, parseScope(scope), expiresIn, audience);
    }

    private static Set<String> parseScope(JsonNode scope) {
        Set<String> scopes = new LinkedHashSet<>();
        if (scope == null || scope.isNull()) {
            return scopes;
        }
        if (scope.isArray()) {
            scope.forEach(node -> scopes.add(node.asText()));
        } else {
            Arrays.stream(scope.asText().trim().split("\\s+"))
                    .filter(s -> !s.isEmpty())
                    .forEach(scopes::add);
        }
        return scopes;
    }

    public Optional<String> getEmail() {
        return Optional.ofNullable(email);
    }

    public Set<String> getScope() {
        return scope;
    }

    public Optional<Long> getExpiresIn() {
        return Optional.ofNullable(expiresIn);
    }

    public Optional<String> getAudience() {
        return Optional.ofNullable(audience);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IntrospectionResult that)) return false;
        return Objects.equals(email, that.email)
                && scope.equals(that.scope)
                && Objects.equals(expiresIn, that.expiresIn)
                && Objects.equals(audience, that.audience);
    }

    @Override
    public int hashCode() {
        return Objects.hash(email, scope, expiresIn, audience);
    }

    @Override
    public String toString() {
        return "IntrospectionResult{email=" + email + ", scope=" + scope + ", expiresIn=" + expiresIn + "}";
    }
}
