package com.tokenbroker.sdk.credential;

import com.google.auth.oauth2.GoogleCredentials;

import java.io.IOException;

/**
 * Performs the network refresh of freshly built Google credentials.
 */
@FunctionalInterface
public interface CredentialsRefresher {

    CredentialsRefresher GOOGLE = GoogleCredentials::refresh;

    void refresh(GoogleCredentials credentials) throws IOException;
}
