package com.tokenbroker.sdk.credential;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.auth.oauth2.ServiceAccountCredentials;
import com.tokenbroker.sdk.token.GoogleCredentialsToken;
import com.tokenbroker.sdk.token.OAuthEndpoints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Set;

/**
 * Token from a service account JSON key.
 *
 * <p>The key comes from a path or JSON string given at construction, or else from the
 * {@value #PATH_HINT} request hint. Without any key source the strategy is not applicable;
 * an unreadable or malformed key, or a failed token exchange, is a failure.</p>
 */
public class ServiceAccountStrategy implements CredentialStrategy {

    private static final Logger log = LoggerFactory.getLogger(ServiceAccountStrategy.class);

    public static final String PATH_HINT = "path";

    private final Path keyPath;
    private final String keyJson;
    private final KeyParser keyParser;
    private final CredentialsRefresher refresher;

    /**
     * Parses service account key bytes into credentials.
     */
    @FunctionalInterface
    public interface KeyParser {
        KeyParser GOOGLE = ServiceAccountCredentials::fromStream;

        GoogleCredentials parse(InputStream keyStream) throws IOException;
    }

    public ServiceAccountStrategy() {
        this(null, null, KeyParser.GOOGLE, CredentialsRefresher.GOOGLE);
    }

    public ServiceAccountStrategy(Path keyPath, String keyJson, KeyParser keyParser, CredentialsRefresher refresher) {
        this.keyPath = keyPath;
        this.keyJson = keyJson;
        this.keyParser = Objects.requireNonNull(keyParser, "keyParser");
        this.refresher = Objects.requireNonNull(refresher, "refresher");
    }

    public static ServiceAccountStrategy fromPath(Path keyPath) {
        return new ServiceAccountStrategy(keyPath, null, KeyParser.GOOGLE, CredentialsRefresher.GOOGLE);
    }

    public static ServiceAccountStrategy fromJson(String keyJson) {
        return new ServiceAccountStrategy(null, keyJson, KeyParser.GOOGLE, CredentialsRefresher.GOOGLE);
    }

    @Override
    public String name() {
        return "service-account";
    }

    @Override
    public StrategyOutcome attempt(CredentialRequest request) {
        byte[] key;
        try {
            key = loadKey(request);
        } catch (IOException e) {
            return StrategyOutcome.failure(e);
        }
        if (key == null) {
            return StrategyOutcome.notApplicable("no service account key configured");
        }

        Set<String> scopes = request.getScopes().isEmpty()
                ? Set.of(OAuthEndpoints.CLOUD_PLATFORM_SCOPE)
                : request.getScopes();
        try (InputStream in = new ByteArrayInputStream(key)) {
            GoogleCredentials credentials = keyParser.parse(in).createScoped(scopes);
            refresher.refresh(credentials);
            log.debug("Service account token obtained for scopes {}", scopes);
            return StrategyOutcome.success(new GoogleCredentialsToken(credentials, scopes));
        } catch (IOException e) {
            return StrategyOutcome.failure(e);
        }
    }

    private byte[] loadKey(CredentialRequest request) throws IOException {
        if (keyJson != null) {
            return keyJson.getBytes(StandardCharsets.UTF_8);
        }
        Path path = keyPath;
        if (path == null) {
            Object hint = request.hint(PATH_HINT).orElse(null);
            if (hint instanceof Path hintPath) {
                path = hintPath;
            } else if (hint instanceof String hintString && !hintString.isBlank()) {
                path = Path.of(hintString);
            }
        }
        return path != null ? Files.readAllBytes(path) : null;
    }
}
