package io.obscur.security;

import io.obscur.error.CryptoException;
import io.obscur.error.ValidationException;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * AES-256-GCM with the wire layout {@code base64(IV[12] || ciphertext || tag)},
 * used for at-rest records and invite payloads.
 */
public final class AesGcm {
    public static final int KEY_BYTES = 32;
    public static final int GCM_IV_BYTES = 12;
    private static final int GCM_TAG_BITS = 128;
    private static final SecureRandom RANDOM = new SecureRandom();

    private AesGcm() {
    }

    public static String encryptString(String plaintext, byte[] key) {
        return encrypt(plaintext.getBytes(StandardCharsets.UTF_8), key);
    }

    public static String decryptString(String payload, byte[] key) {
        return new String(decrypt(payload, key), StandardCharsets.UTF_8);
    }

    public static String encrypt(byte[] plaintext, byte[] key) {
        requireKey(key);
        byte[] iv = new byte[GCM_IV_BYTES];
        RANDOM.nextBytes(iv);
        byte[] cipherText = seal(plaintext, key, iv);
        byte[] out = new byte[iv.length + cipherText.length];
        System.arraycopy(iv, 0, out, 0, iv.length);
        System.arraycopy(cipherText, 0, out, iv.length, cipherText.length);
        return Base64.getEncoder().encodeToString(out);
    }

    public static byte[] decrypt(String payload, byte[] key) {
        requireKey(key);
        if (payload == null || payload.isBlank()) {
            throw new CryptoException("Encrypted payload is empty");
        }
        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(payload.trim());
        } catch (IllegalArgumentException e) {
            throw new CryptoException("Encrypted payload is not valid base64", e);
        }
        if (raw.length < GCM_IV_BYTES + GCM_TAG_BITS / 8) {
            throw new CryptoException("Encrypted payload is too short");
        }
        byte[] iv = new byte[GCM_IV_BYTES];
        byte[] cipherText = new byte[raw.length - GCM_IV_BYTES];
        System.arraycopy(raw, 0, iv, 0, GCM_IV_BYTES);
        System.arraycopy(raw, GCM_IV_BYTES, cipherText, 0, cipherText.length);
        return open(cipherText, key, iv);
    }

    static byte[] seal(byte[] plaintext, byte[] key, byte[] iv) {
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(GCM_TAG_BITS, iv));
            return cipher.doFinal(plaintext);
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Failed to encrypt payload", e);
        }
    }

    static byte[] open(byte[] cipherText, byte[] key, byte[] iv) {
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(GCM_TAG_BITS, iv));
            return cipher.doFinal(cipherText);
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Failed to decrypt payload", e);
        }
    }

    private static void requireKey(byte[] key) {
        if (key == null || key.length != KEY_BYTES) {
            throw new ValidationException("AES-256-GCM key must be " + KEY_BYTES + " bytes");
        }
    }
}
