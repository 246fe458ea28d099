package com.tokenbroker.sdk.client.transport;

import java.io.IOException;

/**
 * Sends a single HTTP exchange. Implementations return any status code as a response and
 * throw only when no response was received.
 */
public interface HttpTransport {
    TransportResponse send(TransportRequest request) throws IOException, InterruptedException;
}
