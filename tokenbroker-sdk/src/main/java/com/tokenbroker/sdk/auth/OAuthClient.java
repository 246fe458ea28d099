package com.tokenbroker.sdk.auth;

import java.util.Objects;

/**
 * OAuth client identity of a consuming package. Immutable.
 */
public final class OAuthClient {

    private final String id;
    private final String secret;
    private final String name;

    public OAuthClient(String id, String secret, String name) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("client id cannot be null or blank");
        }
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("client secret cannot be null or blank");
        }
        this.id = id;
        this.secret = secret;
        this.name = name;
    }

    public OAuthClient(String id, String secret) {
        this(id, secret, null);
    }

    public String getId() {
        return id;
    }

    public String getSecret() {
        return secret;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OAuthClient that)) return false;
        return id.equals(that.id) && secret.equals(that.secret) && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, secret, name);
    }

    @Override
    public String toString() {
        return "OAuthClient{id=" + id + ", name=" + name + "}";
    }
}
