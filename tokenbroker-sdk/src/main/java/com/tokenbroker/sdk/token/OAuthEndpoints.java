package com.tokenbroker.sdk.token;

/**
 * Well-known Google OAuth 2.0 hosts and URLs.
 */
public final class OAuthEndpoints {

    /** Host of Google's authorization endpoint; every Google-issued token reports this host. */
    public static final String GOOGLE_AUTHORIZATION_HOST = "accounts.google.com";

    public static final String GOOGLE_TOKEN_URL = "https://oauth2.googleapis.com/token";

    public static final String GOOGLE_TOKENINFO_URL = "https://oauth2.googleapis.com/tokeninfo";

    public static final String USERINFO_EMAIL_SCOPE = "https://www.googleapis.com/auth/userinfo.email";

    public static final String CLOUD_PLATFORM_SCOPE = "https://www.googleapis.com/auth/cloud-platform";

    private OAuthEndpoints() {
    }
}
