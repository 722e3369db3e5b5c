package io.obscur.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.obscur.error.CryptoException;
import io.obscur.error.ValidationException;
import io.obscur.util.Jsons;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Passphrase-protected export of a hex private key, for backups and device moves.
 */
public final class PrivateKeyVault {
    public static final String ALGORITHM = "PBKDF2-SHA256/AES-256-GCM";
    public static final int DEFAULT_ITERATIONS = 200_000;
    private static final int SALT_BYTES = 16;
    private static final int VERSION = 1;

    private final int iterations;
    private final SecureRandom secureRandom;

    public PrivateKeyVault() {
        this(DEFAULT_ITERATIONS);
    }

    public PrivateKeyVault(int iterations) {
        if (iterations < 1) {
            throw new ValidationException("iterations must be >= 1");
        }
        this.iterations = iterations;
        this.secureRandom = new SecureRandom();
    }

    public String seal(String privateKeyHex, char[] passphrase) {
        requirePassphrase(passphrase);
        byte[] salt = new byte[SALT_BYTES];
        byte[] iv = new byte[AesGcm.GCM_IV_BYTES];
        secureRandom.nextBytes(salt);
        secureRandom.nextBytes(iv);
        byte[] key = deriveKey(passphrase, salt, iterations);
        try {
            byte[] cipherText = AesGcm.seal(privateKeyHex.getBytes(StandardCharsets.UTF_8), key, iv);
            ObjectNode row = Jsons.compact().createObjectNode();
            row.put("v", VERSION);
            row.put("alg", ALGORITHM);
            row.put("iterations", iterations);
            row.put("saltB64", Base64.getEncoder().encodeToString(salt));
            row.put("ivB64", Base64.getEncoder().encodeToString(iv));
            row.put("ciphertextB64", Base64.getEncoder().encodeToString(cipherText));
            return Jsons.toCompactJson(row);
        } finally {
            SecurityUtils.clearSensitiveBuffer(key);
        }
    }

    public String open(String sealed, char[] passphrase) {
        requirePassphrase(passphrase);
        JsonNode node = Jsons.fromJson(sealed, JsonNode.class);
        if (node.path("v").asInt(0) != VERSION || !ALGORITHM.equals(node.path("alg").asText(""))) {
            throw new CryptoException("Unsupported private key envelope");
        }
        byte[] salt;
        byte[] iv;
        byte[] cipherText;
        try {
            salt = Base64.getDecoder().decode(node.path("saltB64").asText(""));
            iv = Base64.getDecoder().decode(node.path("ivB64").asText(""));
            cipherText = Base64.getDecoder().decode(node.path("ciphertextB64").asText(""));
        } catch (IllegalArgumentException e) {
            throw new CryptoException("Malformed private key envelope", e);
        }
        byte[] key = deriveKey(passphrase, salt, node.path("iterations").asInt(iterations));
        try {
            return new String(AesGcm.open(cipherText, key, iv), StandardCharsets.UTF_8);
        } finally {
            SecurityUtils.clearSensitiveBuffer(key);
        }
    }

    private static byte[] deriveKey(char[] passphrase, byte[] salt, int rounds) {
        PBEKeySpec spec = new PBEKeySpec(passphrase, salt, rounds, AesGcm.KEY_BYTES * 8);
        try {
            return SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256").generateSecret(spec).getEncoded();
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Failed to derive passphrase key", e);
        } finally {
            spec.clearPassword();
        }
    }

    private static void requirePassphrase(char[] passphrase) {
        if (passphrase == null || passphrase.length == 0) {
            throw new ValidationException("passphrase must not be empty");
        }
    }
}
