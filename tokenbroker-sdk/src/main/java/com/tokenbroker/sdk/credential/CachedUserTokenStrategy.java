package com.tokenbroker.sdk.credential;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.auth.oauth2.UserCredentials;
import com.tokenbroker.sdk.auth.OAuthClient;
import com.tokenbroker.sdk.token.GoogleCredentialsToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Token from a user OAuth grant cached on disk by an earlier interactive login.
 *
 * <p>Each {@code *.json} file in the cache directory holds one grant:</p>
 * <pre>{@code
 * {"email": "jane@example.com", "client_id": "...", "refresh_token": "...",
 *  "scopes": ["https://www.googleapis.com/auth/userinfo.email"]}
 * }</pre>
 *
 * <p>A grant matches when its email equals the requested one (any email if none was requested
 * or the request email is {@code "*"}), it was issued to the request's OAuth client, and its
 * scopes cover the requested scopes. The refresh-token exchange is done by google-auth's
 * {@link UserCredentials}.</p>
 */
public class CachedUserTokenStrategy implements CredentialStrategy {

    private static final Logger log = LoggerFactory.getLogger(CachedUserTokenStrategy.class);

    static final String ANY_EMAIL = "*";

    private final Path cacheDirectory;
    private final ObjectMapper objectMapper;
    private final CredentialsRefresher refresher;

    public CachedUserTokenStrategy(Path cacheDirectory) {
        this(cacheDirectory, new ObjectMapper(), CredentialsRefresher.GOOGLE);
    }

    public CachedUserTokenStrategy(Path cacheDirectory, ObjectMapper objectMapper, CredentialsRefresher refresher) {
        this.cacheDirectory = cacheDirectory;
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.refresher = Objects.requireNonNull(refresher, "refresher");
    }

    @Override
    public String name() {
        return "user-cache";
    }

    @Override
    public StrategyOutcome attempt(CredentialRequest request) {
        if (cacheDirectory == null || !Files.isDirectory(cacheDirectory)) {
            return StrategyOutcome.notApplicable("no token cache directory");
        }
        OAuthClient client = request.getClient().orElse(null);
        if (client == null) {
            return StrategyOutcome.notApplicable("no OAuth client configured");
        }

        List<CachedGrant> matches;
        try {
            matches = findGrants(request, client);
        } catch (IOException e) {
            return StrategyOutcome.failure(e);
        }

        if (matches.isEmpty()) {
            return StrategyOutcome.notApplicable("no cached grant matches "
                    + request.getEmail().orElse(ANY_EMAIL) + " in " + cacheDirectory);
        }
        if (matches.size() > 1) {
            return StrategyOutcome.notApplicable(matches.size()
                    + " cached grants match; specify an email to choose one");
        }

        CachedGrant grant = matches.get(0);
        UserCredentials credentials = UserCredentials.newBuilder()
                .setClientId(client.getId())
                .setClientSecret(client.getSecret())
                .setRefreshToken(grant.refreshToken)
                .build();
        try {
            refresher.refresh(credentials);
        } catch (IOException e) {
            return StrategyOutcome.failure(e);
        }
        log.debug("Refreshed cached user grant for {}", grant.email);
        Set<String> scopes = grant.scopes != null ? Set.copyOf(grant.scopes) : request.getScopes();
        return StrategyOutcome.success(new GoogleCredentialsToken(credentials, scopes));
    }

    private List<CachedGrant> findGrants(CredentialRequest request, OAuthClient client) throws IOException {
        String email = request.getEmail().filter(e -> !ANY_EMAIL.equals(e)).orElse(null);
        List<CachedGrant> matches = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(cacheDirectory, "*.json")) {
            for (Path file : files) {
                CachedGrant grant;
                try {
                    grant = objectMapper.readValue(file.toFile(), CachedGrant.class);
                } catch (IOException e) {
                    throw new IOException("Unreadable cached grant " + file.getFileName() + ": " + e.getMessage(), e);
                }
                if (grant.matches(email, client, request.getScopes())) {
                    matches.add(grant);
                }
            }
        }
        return matches;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static class CachedGrant {
        @JsonProperty("email")
        String email;

        @JsonProperty("client_id")
        String clientId;

        @JsonProperty("refresh_token")
        String refreshToken;

        @JsonProperty("scopes")
        List<String> scopes;

        boolean matches(String wantedEmail, OAuthClient client, Set<String> wantedScopes) {
            if (refreshToken == null || refreshToken.isBlank()) {
                return false;
            }
            if (wantedEmail != null && !wantedEmail.equalsIgnoreCase(email)) {
                return false;
            }
            if (clientId != null && !clientId.equals(client.getId())) {
                return false;
            }
            return scopes == null || scopes.containsAll(wantedScopes);
        }
    }
}
