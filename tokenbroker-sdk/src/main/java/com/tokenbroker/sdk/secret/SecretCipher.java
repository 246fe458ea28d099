package com.tokenbroker.sdk.secret;

import java.security.GeneralSecurityException;

/**
 * Authenticated symmetric encryption used by {@link SecretStore}.
 *
 * <p>The store only relies on this contract: ciphertext produced by {@link #encrypt} with a
 * key and nonce is turned back into the exact plaintext by {@link #decrypt} with the same key
 * and nonce, and any tampering or wrong key makes {@link #decrypt} fail.</p>
 */
public interface SecretCipher {

    /**
     * @return true if the primitive can be used in this runtime; must not throw
     */
    boolean isAvailable();

    int nonceLength();

    byte[] encrypt(byte[] key, byte[] nonce, byte[] plaintext) throws GeneralSecurityException;

    byte[] decrypt(byte[] key, byte[] nonce, byte[] ciphertext) throws GeneralSecurityException;
}
