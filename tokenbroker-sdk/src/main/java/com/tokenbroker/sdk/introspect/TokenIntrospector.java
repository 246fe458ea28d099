package com.tokenbroker.sdk.introspect;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tokenbroker.sdk.client.transport.HttpTransport;
import com.tokenbroker.sdk.client.transport.JdkHttpTransport;
import com.tokenbroker.sdk.client.transport.TransportRequest;
import com.tokenbroker.sdk.client.transport.TransportResponse;
import com.tokenbroker.sdk.exception.IntrospectionException;
import com.tokenbroker.sdk.exception.InvalidTokenException;
import com.tokenbroker.sdk.token.IntrospectionResult;
import com.tokenbroker.sdk.token.OAuthEndpoints;
import com.tokenbroker.sdk.token.TokenFacade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Looks up the identity and scopes behind a token at Google's tokeninfo endpoint.
 *
 * <p>Results are memoized on the token itself: the first call for a token makes one request
 * and stores the result, every later {@link #email} or {@link #tokenInfo} call for the same
 * token is answered from that cache. Rejected tokens are not cached, so a retry after
 * refreshing can succeed.</p>
 *
 * <h2>Usage:</h2>
 * <pre>{@code
 * TokenIntrospector introspector = TokenIntrospector.builder().build();
 * String email = introspector.email(token).orElseThrow();
 * Set<String> scopes = introspector.tokenInfo(token).getScope();
 * }</pre>
 */
public class TokenIntrospector {

    private static final Logger log = LoggerFactory.getLogger(TokenIntrospector.class);

    private final URI endpoint;
    private final HttpTransport transport;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    private TokenIntrospector(Builder builder) {
        this.endpoint = URI.create(builder.endpoint);
        if (builder.transport != null) {
            this.transport = builder.transport;
        } else {
            HttpClient httpClient = builder.httpClient != null
                    ? builder.httpClient
                    : HttpClient.newBuilder()
                        .connectTimeout(builder.connectTimeout)
                        .build();
            this.transport = new JdkHttpTransport(httpClient);
        }
        this.objectMapper = builder.objectMapper != null
                ? builder.objectMapper
                : new ObjectMapper()
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.requestTimeout = builder.requestTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the email of the account the token was issued to, if the token carries the email scope
     * @throws InvalidTokenException if the endpoint rejects the token
     * @throws IntrospectionException on network or protocol failure
     */
    public Optional<String> email(TokenFacade token) {
        return tokenInfo(token).getEmail();
    }

    /**
     * @return identity, scopes and remaining lifetime of the token
     * @throws InvalidTokenException if the endpoint rejects the token
     * @throws IntrospectionException on network or protocol failure
     */
    public IntrospectionResult tokenInfo(TokenFacade token) {
        Optional<IntrospectionResult> cached = token.cachedIntrospection();
        if (cached.isPresent()) {
            log.debug("Using cached introspection result");
            return cached.get();
        }

        IntrospectionResult result = fetch(token);
        token.cacheIntrospection(result);
        return result;
    }

    private IntrospectionResult fetch(TokenFacade token) {
        String accessToken = token.accessToken();
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", "application/x-www-form-urlencoded");
        headers.put("Accept", "application/json");
        headers.put("Authorization", "Bearer " + accessToken);
        String body = "access_token=" + URLEncoder.encode(accessToken, StandardCharsets.UTF_8);
        TransportRequest request = new TransportRequest(endpoint, "POST", body, headers, requestTimeout);

        TransportResponse response;
        try {
            response = transport.send(request);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IntrospectionException("Interrupted while introspecting token", e);
        } catch (IOException | RuntimeException e) {
            throw new IntrospectionException("Failed to reach introspection endpoint " + endpoint + ": " + e.getMessage(), e);
        }

        int status = response.getStatusCode();
        if (status == 400 || status == 401 || status == 403) {
            throw new InvalidTokenException("Token rejected by introspection endpoint: " + status,
                    status, extractErrorCode(response.getBody()));
        }
        if (status < 200 || status >= 300) {
            throw new IntrospectionException("Introspection endpoint returned " + status, status);
        }

        try {
            IntrospectionResult result = objectMapper.readValue(response.getBody(), IntrospectionResult.class);
            log.debug("Introspected token: {}", result);
            return result;
        } catch (IOException e) {
            throw new IntrospectionException("Malformed introspection response: " + e.getMessage(), e);
        }
    }

    private String extractErrorCode(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            return null;
        }
        try {
            var node = objectMapper.readTree(responseBody);
            if (node.has("error")) {
                return node.get("error").asText();
            }
        } catch (IOException e) {
            log.debug("Error response is not JSON: {}", e.getMessage());
        }
        return null;
    }

    public static class Builder {
        private String endpoint = OAuthEndpoints.GOOGLE_TOKENINFO_URL;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(30);
        private ObjectMapper objectMapper;
        private HttpClient httpClient;
        private HttpTransport transport;

        /**
         * Introspection endpoint URL (default: Google tokeninfo)
         */
        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        /**
         * Connection timeout (default: 10 seconds)
         */
        public Builder connectTimeout(Duration timeout) {
            this.connectTimeout = timeout;
            return this;
        }

        /**
         * Per-request timeout (default: 30 seconds)
         */
        public Builder requestTimeout(Duration timeout) {
            this.requestTimeout = timeout;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        /**
         * Provide a pre-configured HttpClient (connectTimeout will be ignored if set)
         */
        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        /**
         * Provide a custom transport (overrides any HttpClient settings)
         */
        public Builder transport(HttpTransport transport) {
            this.transport = transport;
            return this;
        }

        public TokenIntrospector build() {
            if (endpoint == null || endpoint.isBlank()) {
                throw new IllegalStateException("endpoint is required");
            }
            return new TokenIntrospector(this);
        }
    }
}
