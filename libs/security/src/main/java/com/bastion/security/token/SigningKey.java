package com.bastion.security.token;

import com.bastion.security.ConfigurationException;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;

/**
 * One HMAC-SHA256 signing secret and the key ID advertised in the {@code kid} header of
 * the tokens it signs.
 * <p>
 * {@link #toString()} never prints the secret.
 */
public final class SigningKey {

    /** HS256 keys shorter than the hash output are refused by the JWT library. */
    public static final int MIN_SECRET_BYTES = 32;

    static final String JCA_ALGORITHM = "HmacSHA256";

    private final String keyId;
    private final SecretKey secretKey;

    private SigningKey(String keyId, SecretKey secretKey) {
        this.keyId = keyId;
        this.secretKey = secretKey;
    }

    /**
     * Creates a signing key from a UTF-8 secret.
     *
     * @throws ConfigurationException if the key ID is blank, or the secret is null, empty,
     *                                or shorter than {@value #MIN_SECRET_BYTES} bytes
     */
    public static SigningKey of(String keyId, String secret) {
        if (keyId == null || keyId.isBlank()) {
            throw new ConfigurationException("Signing key ID must not be blank");
        }
        if (secret == null || secret.isEmpty()) {
            throw new ConfigurationException("Signing secret is not configured");
        }
        byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < MIN_SECRET_BYTES) {
            throw new ConfigurationException(
                    "Signing secret must be at least %d bytes, got %d".formatted(MIN_SECRET_BYTES, bytes.length));
        }
        return new SigningKey(keyId, new SecretKeySpec(bytes, JCA_ALGORITHM));
    }

    public String keyId() {
        return keyId;
    }

    SecretKey secretKey() {
        return secretKey;
    }

    @Override
    public String toString() {
        return "SigningKey[keyId=" + keyId + "]";
    }
}
