package com.tokenbroker.sdk.exception;

/**
 * Thrown when a secret is written but the password environment variable is not set.
 */
public class PasswordUnavailableException extends SecretStoreException {

    private final String envVarName;

    public PasswordUnavailableException(String envVarName) {
        super("Cannot encrypt secret: environment variable " + envVarName + " is not set");
        this.envVarName = envVarName;
    }

    public String getEnvVarName() {
        return envVarName;
    }
}
