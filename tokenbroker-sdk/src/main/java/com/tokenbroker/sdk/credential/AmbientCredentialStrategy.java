package com.tokenbroker.sdk.credential;

import com.google.auth.oauth2.GoogleCredentials;
import com.tokenbroker.sdk.token.GoogleCredentialsToken;
import com.tokenbroker.sdk.token.OAuthEndpoints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.Set;

/**
 * Application default credentials of the host: the {@code GOOGLE_APPLICATION_CREDENTIALS} file,
 * gcloud user credentials, or the metadata server on Google Cloud.
 *
 * <p>Discovery is delegated to google-auth. If it finds nothing the strategy is not applicable;
 * if it finds credentials that cannot be refreshed the strategy fails.</p>
 */
public class AmbientCredentialStrategy implements CredentialStrategy {

    private static final Logger log = LoggerFactory.getLogger(AmbientCredentialStrategy.class);

    private final CredentialsLoader loader;
    private final CredentialsRefresher refresher;

    /**
     * Locates ambient credentials.
     */
    @FunctionalInterface
    public interface CredentialsLoader {
        CredentialsLoader APPLICATION_DEFAULT = GoogleCredentials::getApplicationDefault;

        GoogleCredentials load() throws IOException;
    }

    public AmbientCredentialStrategy() {
        this(CredentialsLoader.APPLICATION_DEFAULT, CredentialsRefresher.GOOGLE);
    }

    public AmbientCredentialStrategy(CredentialsLoader loader, CredentialsRefresher refresher) {
        this.loader = Objects.requireNonNull(loader, "loader");
        this.refresher = Objects.requireNonNull(refresher, "refresher");
    }

    @Override
    public String name() {
        return "ambient";
    }

    @Override
    public StrategyOutcome attempt(CredentialRequest request) {
        GoogleCredentials credentials;
        try {
            credentials = loader.load();
        } catch (IOException e) {
            return StrategyOutcome.notApplicable("no application default credentials: " + e.getMessage());
        }

        Set<String> scopes = request.getScopes().isEmpty()
                ? Set.of(OAuthEndpoints.CLOUD_PLATFORM_SCOPE)
                : request.getScopes();
        if (credentials.createScopedRequired()) {
            credentials = credentials.createScoped(scopes);
        }

        try {
            refresher.refresh(credentials);
        } catch (IOException e) {
            return StrategyOutcome.failure(e);
        }
        log.debug("Application default credentials of type {} refreshed", credentials.getClass().getSimpleName());
        return StrategyOutcome.success(new GoogleCredentialsToken(credentials, scopes));
    }
}
