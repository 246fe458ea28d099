package com.tokenbroker.sdk.secret;

import com.tokenbroker.sdk.exception.SecretStoreException;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * Ciphertext and nonce of one stored secret. Immutable.
 *
 * <p>Serialized layout: {@code [format version: 1 byte][nonce length: 1 byte][nonce][ciphertext]}.</p>
 */
public final class EncryptedSecret {

    static final byte FORMAT_VERSION = 1;
    private static final int HEADER_LENGTH = 2;

    private final byte[] ciphertext;
    private final byte[] nonce;

    public EncryptedSecret(byte[] ciphertext, byte[] nonce) {
        if (nonce.length == 0 || nonce.length > 255) {
            throw new IllegalArgumentException("nonce length must be between 1 and 255 bytes");
        }
        this.ciphertext = ciphertext.clone();
        this.nonce = nonce.clone();
    }

    public byte[] getCiphertext() {
        return ciphertext.clone();
    }

    public byte[] getNonce() {
        return nonce.clone();
    }

    public byte[] toBytes() {
        return ByteBuffer.allocate(HEADER_LENGTH + nonce.length + ciphertext.length)
                .put(FORMAT_VERSION)
                .put((byte) nonce.length)
                .put(nonce)
                .put(ciphertext)
                .array();
    }

    /**
     * @throws SecretStoreException if the bytes are not a serialized secret
     */
    public static EncryptedSecret fromBytes(byte[] bytes) {
        if (bytes.length < HEADER_LENGTH) {
            throw new SecretStoreException("Secret file is truncated");
        }
        if (bytes[0] != FORMAT_VERSION) {
            throw new SecretStoreException("Unsupported secret format version: " + bytes[0]);
        }
        int nonceLength = Byte.toUnsignedInt(bytes[1]);
        if (nonceLength == 0 || bytes.length < HEADER_LENGTH + nonceLength) {
            throw new SecretStoreException("Secret file is truncated");
        }
        byte[] nonce = Arrays.copyOfRange(bytes, HEADER_LENGTH, HEADER_LENGTH + nonceLength);
        byte[] ciphertext = Arrays.copyOfRange(bytes, HEADER_LENGTH + nonceLength, bytes.length);
        return new EncryptedSecret(ciphertext, nonce);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EncryptedSecret that)) return false;
        return Arrays.equals(ciphertext, that.ciphertext) && Arrays.equals(nonce, that.nonce);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(ciphertext) + Arrays.hashCode(nonce);
    }
}
