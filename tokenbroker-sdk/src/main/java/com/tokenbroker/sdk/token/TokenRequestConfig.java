package com.tokenbroker.sdk.token;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request configuration carrying an embedded token alongside other per-request settings.
 *
 * <p>Client libraries often pass credentials around inside such a wrapper; the explicit
 * token strategy unwraps it before validating the token.</p>
 *
 * <pre>{@code
 * TokenRequestConfig config = TokenRequestConfig.builder()
 *     .token(token)
 *     .header("X-Goog-User-Project", "my-project")
 *     .build();
 * }</pre>
 */
public final class TokenRequestConfig {

    private final Object token;
    private final Map<String, String> headers;

    private TokenRequestConfig(Builder builder) {
        this.token = builder.token;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
    }

    public static TokenRequestConfig of(Object token) {
        return builder().token(token).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the embedded token, of whatever shape the caller supplied (may be null)
     */
    public Object getToken() {
        return token;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public static class Builder {
        private Object token;
        private final Map<String, String> headers = new LinkedHashMap<>();

        public Builder token(Object token) {
            this.token = token;
            return this;
        }

        public Builder header(String name, String value) {
            this.headers.put(name, value);
            return this;
        }

        public TokenRequestConfig build() {
            return new TokenRequestConfig(this);
        }
    }
}
