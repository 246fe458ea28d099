package com.tokenbroker.sdk.secret;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;

/**
 * A package's secret password, read from the environment at time of use and never persisted.
 */
public final class Password {

    private final String envVarName;
    private final byte[] raw;

    Password(String envVarName, byte[] raw) {
        this.envVarName = envVarName;
        this.raw = raw.clone();
    }

    /**
     * @return the environment variable name for a package, e.g. {@code MYPKG_PASSWORD} for {@code mypkg}
     */
    public static String envVarName(String packageName) {
        String normalized = packageName.trim()
                .toUpperCase(Locale.ROOT)
                .replaceAll("[^A-Z0-9]", "_");
        return normalized + "_PASSWORD";
    }

    public String getEnvVarName() {
        return envVarName;
    }

    /**
     * @return a 256-bit key: SHA-256 of the password bytes
     */
    byte[] deriveKey() {
        try {
            return MessageDigest.getInstance("SHA-256").digest(raw);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is required by every Java platform", e);
        }
    }

    static Password fromValue(String envVarName, String value) {
        return new Password(envVarName, value.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return "Password{envVarName=" + envVarName + "}";
    }
}
