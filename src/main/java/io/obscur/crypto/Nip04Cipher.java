package io.obscur.crypto;

import io.obscur.error.CryptoException;
import io.obscur.error.ValidationException;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * NIP-04 direct-message payloads: AES-256-CBC keyed by the ECDH x coordinate,
 * wire form {@code base64(ciphertext)?iv=base64(iv)}.
 */
final class Nip04Cipher {
    private static final String IV_SEPARATOR = "?iv=";
    private static final int IV_BYTES = 16;

    private final SecureRandom secureRandom;

    Nip04Cipher(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    String encrypt(String plaintext, byte[] sharedX) {
        if (plaintext == null) {
            throw new ValidationException("plaintext must not be null");
        }
        byte[] iv = new byte[IV_BYTES];
        secureRandom.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance("AES/CBC/PKCS5Padding");
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(sharedX, "AES"), new IvParameterSpec(iv));
            byte[] encrypted = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(encrypted) + IV_SEPARATOR + Base64.getEncoder().encodeToString(iv);
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Failed to encrypt direct message", e);
        }
    }

    String decrypt(String payload, byte[] sharedX) {
        if (payload == null || !payload.contains(IV_SEPARATOR)) {
            throw new CryptoException("Invalid NIP-04 payload format");
        }
        int split = payload.indexOf(IV_SEPARATOR);
        byte[] encrypted;
        byte[] iv;
        try {
            encrypted = Base64.getDecoder().decode(payload.substring(0, split));
            iv = Base64.getDecoder().decode(payload.substring(split + IV_SEPARATOR.length()));
        } catch (IllegalArgumentException e) {
            throw new CryptoException("Invalid NIP-04 payload encoding", e);
        }
        if (iv.length != IV_BYTES) {
            throw new CryptoException("Invalid NIP-04 IV length");
        }
        byte[] plain;
        try {
            Cipher cipher = Cipher.getInstance("AES/CBC/PKCS5Padding");
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(sharedX, "AES"), new IvParameterSpec(iv));
            plain = cipher.doFinal(encrypted);
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Failed to decrypt direct message", e);
        }
        return strictUtf8(plain);
    }

    // CBC has no authentication; a wrong key must not surface as mojibake.
    static String strictUtf8(byte[] bytes) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            throw new CryptoException("Decrypted payload is not valid UTF-8", e);
        }
    }
}
