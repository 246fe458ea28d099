package com.tokenbroker.sdk.exception;

/**
 * Thrown when a secret is read but decryption is not possible in this environment.
 *
 * <p>Callers are expected to catch this and skip work that needs the secret,
 * rather than treating it as a failure.</p>
 */
public class DecryptionUnavailableException extends SecretStoreException {

    private final String packageName;

    public DecryptionUnavailableException(String packageName, String envVarName) {
        super("Secrets for package '" + packageName + "' cannot be decrypted: "
                + envVarName + " is not set or encryption is unavailable");
        this.packageName = packageName;
    }

    public String getPackageName() {
        return packageName;
    }
}
