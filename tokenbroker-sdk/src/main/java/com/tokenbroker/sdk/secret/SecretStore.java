package com.tokenbroker.sdk.secret;

import com.tokenbroker.sdk.exception.DecryptionUnavailableException;
import com.tokenbroker.sdk.exception.PasswordUnavailableException;
import com.tokenbroker.sdk.exception.SecretStoreException;
import com.tokenbroker.sdk.util.Environment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;

/**
 * Encrypted secrets that can be committed alongside code and decrypted only where the
 * package's password is available.
 *
 * <p>The password of package {@code mypkg} is read from the environment variable
 * {@code MYPKG_PASSWORD}. Secrets are stored at {@code <package root>/secret/<name>}, where the
 * package root is {@code <base directory>/<package>} unless another {@link PackageRootResolver}
 * is configured.</p>
 *
 * <h2>Usage:</h2>
 * <pre>{@code
 * SecretStore store = SecretStore.builder()
 *     .baseDirectory(Path.of("src/test/resources"))
 *     .build();
 *
 * // authoring time, with MYPKG_PASSWORD set
 * store.write("mypkg", "service-account.json", Path.of("/secure/key.json"));
 *
 * // test time
 * if (store.canDecrypt("mypkg")) {
 *     byte[] key = store.read("mypkg", "service-account.json");
 * }
 * }</pre>
 *
 * <p>A missing password is fatal when writing ({@link PasswordUnavailableException}) but
 * expected when reading: {@link #read} throws {@link DecryptionUnavailableException}, which
 * callers turn into a skip.</p>
 */
public class SecretStore {

    private static final Logger log = LoggerFactory.getLogger(SecretStore.class);

    static final String SECRET_DIRECTORY = "secret";
    private static final int GENERATED_PASSWORD_BYTES = 32;

    private final Environment environment;
    private final SecretCipher cipher;
    private final PackageRootResolver rootResolver;
    private final SecureRandom random;

    private SecretStore(Builder builder) {
        this.environment = builder.environment;
        this.cipher = builder.cipher;
        this.rootResolver = builder.rootResolver;
        this.random = builder.random;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return name of the environment variable holding the package's password
     */
    public static String passwordName(String packageName) {
        return Password.envVarName(packageName);
    }

    /**
     * @return a new random password suitable for a {@code <PACKAGE>_PASSWORD} variable
     */
    public static String generatePassword() {
        byte[] bytes = new byte[GENERATED_PASSWORD_BYTES];
        new SecureRandom().nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * Whether secrets of the package can be decrypted here. Only consults the environment
     * and the cipher; never throws.
     */
    public boolean canDecrypt(String packageName) {
        try {
            return password(packageName).isPresent() && cipher.isAvailable();
        } catch (RuntimeException e) {
            log.debug("Decryption check for '{}' failed: {}", packageName, e.toString());
            return false;
        }
    }

    /**
     * @return location of a secret, whether or not it exists
     */
    public Path secretPath(String packageName, String name) {
        validateName("package name", packageName);
        validateName("secret name", name);
        return rootResolver.rootOf(packageName).resolve(SECRET_DIRECTORY).resolve(name);
    }

    /**
     * Encrypt and store a secret, replacing any previous one of the same name.
     *
     * @return path of the written file
     * @throws PasswordUnavailableException if the package's password is not set
     */
    public Path write(String packageName, String name, byte[] data) {
        Objects.requireNonNull(data, "data");
        Password password = requirePassword(packageName);
        Path target = secretPath(packageName, name);

        byte[] nonce = new byte[cipher.nonceLength()];
        random.nextBytes(nonce);
        EncryptedSecret secret;
        try {
            secret = new EncryptedSecret(cipher.encrypt(password.deriveKey(), nonce, data), nonce);
        } catch (GeneralSecurityException e) {
            throw new SecretStoreException("Failed to encrypt secret '" + name + "'", e);
        }

        try {
            Files.createDirectories(target.getParent());
            Files.write(target, secret.toBytes());
        } catch (IOException e) {
            throw new SecretStoreException("Failed to write secret to " + target, e);
        }
        log.info("Wrote secret '{}' for package '{}' to {}", name, packageName, target);
        return target;
    }

    /**
     * Encrypt and store the contents of a file. The password is checked before the input is read.
     *
     * @see #write(String, String, byte[])
     */
    public Path write(String packageName, String name, Path input) {
        requirePassword(packageName);
        byte[] data;
        try {
            data = Files.readAllBytes(input);
        } catch (IOException e) {
            throw new SecretStoreException("Failed to read secret input " + input, e);
        }
        return write(packageName, name, data);
    }

    /**
     * Decrypt a stored secret.
     *
     * @return the exact bytes that were written
     * @throws DecryptionUnavailableException if {@link #canDecrypt} is false; no file is touched
     * @throws SecretStoreException if the secret is missing, corrupt, or the password is wrong
     */
    public byte[] read(String packageName, String name) {
        if (!canDecrypt(packageName)) {
            throw new DecryptionUnavailableException(packageName, passwordName(packageName));
        }
        Password password = password(packageName)
                .orElseThrow(() -> new DecryptionUnavailableException(packageName, passwordName(packageName)));
        Path source = secretPath(packageName, name);

        byte[] bytes;
        try {
            bytes = Files.readAllBytes(source);
        } catch (NoSuchFileException e) {
            throw new SecretStoreException("No secret '" + name + "' for package '" + packageName + "' at " + source, e);
        } catch (IOException e) {
            throw new SecretStoreException("Failed to read secret from " + source, e);
        }

        EncryptedSecret secret = EncryptedSecret.fromBytes(bytes);
        try {
            return cipher.decrypt(password.deriveKey(), secret.getNonce(), secret.getCiphertext());
        } catch (GeneralSecurityException e) {
            throw new SecretStoreException(
                    "Failed to decrypt secret '" + name + "': wrong password or corrupted file", e);
        }
    }

    // Any non-empty value counts, including whitespace.
    private Optional<Password> password(String packageName) {
        String envVarName = passwordName(packageName);
        return environment.get(envVarName)
                .filter(value -> !value.isEmpty())
                .map(value -> Password.fromValue(envVarName, value));
    }

    private Password requirePassword(String packageName) {
        return password(packageName)
                .orElseThrow(() -> new PasswordUnavailableException(passwordName(packageName)));
    }

    private static void validateName(String kind, String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException(kind + " cannot be null or blank");
        }
        if (name.contains("/") || name.contains("\\") || name.equals("..") || name.equals(".")) {
            throw new IllegalArgumentException(kind + " must be a plain file name: " + name);
        }
    }

    public static class Builder {
        private Environment environment = Environment.system();
        private SecretCipher cipher = new AesGcmSecretCipher();
        private PackageRootResolver rootResolver =
                PackageRootResolver.perPackage(Path.of(System.getProperty("user.dir")));
        private SecureRandom random = new SecureRandom();

        /**
         * Source of password variables (default: process environment)
         */
        public Builder environment(Environment environment) {
            this.environment = environment;
            return this;
        }

        /**
         * Encryption primitive (default: AES-256/GCM)
         */
        public Builder cipher(SecretCipher cipher) {
            this.cipher = cipher;
            return this;
        }

        /**
         * Directory holding one subdirectory per package (default: working directory)
         */
        public Builder baseDirectory(Path baseDirectory) {
            this.rootResolver = PackageRootResolver.perPackage(baseDirectory);
            return this;
        }

        public Builder rootResolver(PackageRootResolver rootResolver) {
            this.rootResolver = rootResolver;
            return this;
        }

        public Builder random(SecureRandom random) {
            this.random = random;
            return this;
        }

        public SecretStore build() {
            if (environment == null) {
                throw new IllegalStateException("environment is required");
            }
            if (cipher == null) {
                throw new IllegalStateException("cipher is required");
            }
            if (rootResolver == null) {
                throw new IllegalStateException("rootResolver is required");
            }
            if (random == null) {
                throw new IllegalStateException("random is required");
            }
            return new SecretStore(this);
        }
    }
}
