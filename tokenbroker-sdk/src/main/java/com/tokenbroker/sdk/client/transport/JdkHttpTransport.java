package com.tokenbroker.sdk.client.transport;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Locale;
import java.util.Objects;

/**
 * {@link HttpTransport} over {@link HttpClient}. The request method is passed through as given,
 * with an empty body when the request carries none.
 */
public final class JdkHttpTransport implements HttpTransport {
    private final HttpClient httpClient;

    public JdkHttpTransport(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    @Override
    public TransportResponse send(TransportRequest request) throws IOException, InterruptedException {
        HttpResponse<String> response = httpClient.send(toHttpRequest(request), HttpResponse.BodyHandlers.ofString());
        return new TransportResponse(response.statusCode(), response.body());
    }

    static HttpRequest toHttpRequest(TransportRequest request) {
        String method = request.getMethod() != null ? request.getMethod().toUpperCase(Locale.ROOT) : "GET";
        HttpRequest.BodyPublisher publisher = request.getBody() != null
                ? HttpRequest.BodyPublishers.ofString(request.getBody())
                : HttpRequest.BodyPublishers.noBody();

        HttpRequest.Builder builder = HttpRequest.newBuilder(request.getUri()).method(method, publisher);
        if (request.getTimeout() != null) {
            builder.timeout(request.getTimeout());
        }
        request.getHeaders().forEach(builder::header);
        return builder.build();
    }
}
