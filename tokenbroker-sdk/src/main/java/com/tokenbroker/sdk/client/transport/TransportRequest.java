package com.tokenbroker.sdk.client.transport;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class TransportRequest {
    private final URI uri;
    private final String method;
    private final String body;
    private final Map<String, String> headers;
    private final Duration timeout;

    public TransportRequest(URI uri, String method, String body, Map<String, String> headers, Duration timeout) {
        this.uri = uri;
        this.method = method;
        this.body = body;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.timeout = timeout;
    }

    public URI getUri() {
        return uri;
    }

    public String getMethod() {
        return method;
    }

    public String getBody() {
        return body;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public TransportRequest withHeader(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(name, value);
        return new TransportRequest(uri, method, body, copy, timeout);
    }

    /**
     * Append a form-encoded query parameter, keeping any existing query and fragment.
     */
    public TransportRequest withQueryParameter(String name, String value) {
        String param = encode(name) + "=" + encode(value);
        String existing = uri.getRawQuery();
        String query = existing == null || existing.isEmpty() ? param : existing + "&" + param;

        // Raw components, so existing percent-escapes are not encoded twice
        StringBuilder rebuilt = new StringBuilder();
        if (uri.getScheme() != null) {
            rebuilt.append(uri.getScheme()).append(':');
        }
        if (uri.getRawAuthority() != null) {
            rebuilt.append("//").append(uri.getRawAuthority());
        }
        if (uri.getRawPath() != null) {
            rebuilt.append(uri.getRawPath());
        }
        rebuilt.append('?').append(query);
        if (uri.getRawFragment() != null) {
            rebuilt.append('#').append(uri.getRawFragment());
        }
        return new TransportRequest(URI.create(rebuilt.toString()), method, body, headers, timeout);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
