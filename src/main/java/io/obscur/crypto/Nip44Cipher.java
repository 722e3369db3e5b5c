package io.obscur.crypto;

import io.obscur.error.CryptoException;
import io.obscur.error.ValidationException;
import io.obscur.security.SecurityUtils;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.engines.ChaCha7539Engine;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.HKDFParameters;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.crypto.params.ParametersWithIV;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * NIP-44 version 2 payloads used by seals and gift wraps.
 */
final class Nip44Cipher {
    static final int VERSION = 2;
    private static final byte[] SALT = "nip44-v2".getBytes(StandardCharsets.US_ASCII);
    private static final int NONCE_BYTES = 32;
    private static final int MAC_BYTES = 32;
    private static final int MIN_PLAINTEXT = 1;
    private static final int MAX_PLAINTEXT = 65_535;
    private static final int MIN_PAYLOAD_BYTES = 99;
    private static final int MAX_PAYLOAD_BYTES = 65_603;

    private final SecureRandom secureRandom;

    Nip44Cipher(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    static byte[] conversationKey(byte[] sharedX) {
        return hmac(SALT, sharedX);
    }

    String encrypt(String plaintext, byte[] conversationKey) {
        byte[] nonce = new byte[NONCE_BYTES];
        secureRandom.nextBytes(nonce);
        return encrypt(plaintext, conversationKey, nonce);
    }

    static String encrypt(String plaintext, byte[] conversationKey, byte[] nonce) {
        if (plaintext == null) {
            throw new ValidationException("plaintext must not be null");
        }
        MessageKeys keys = messageKeys(conversationKey, nonce);
        try {
            byte[] cipherText = chacha(keys.chachaKey(), keys.chachaNonce(), pad(plaintext));
            byte[] mac = hmac(keys.hmacKey(), concat(nonce, cipherText));
            byte[] out = new byte[1 + NONCE_BYTES + cipherText.length + MAC_BYTES];
            out[0] = (byte) VERSION;
            System.arraycopy(nonce, 0, out, 1, NONCE_BYTES);
            System.arraycopy(cipherText, 0, out, 1 + NONCE_BYTES, cipherText.length);
            System.arraycopy(mac, 0, out, 1 + NONCE_BYTES + cipherText.length, MAC_BYTES);
            return Base64.getEncoder().encodeToString(out);
        } finally {
            keys.clear();
        }
    }

    static String decrypt(String payload, byte[] conversationKey) {
        if (payload == null || payload.isEmpty() || payload.charAt(0) == '#') {
            throw new CryptoException("Unsupported NIP-44 payload");
        }
        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(payload);
        } catch (IllegalArgumentException e) {
            throw new CryptoException("Invalid NIP-44 payload encoding", e);
        }
        if (raw.length < MIN_PAYLOAD_BYTES || raw.length > MAX_PAYLOAD_BYTES) {
            throw new CryptoException("Invalid NIP-44 payload length");
        }
        if (raw[0] != VERSION) {
            throw new CryptoException("Unknown NIP-44 version " + raw[0]);
        }
        byte[] nonce = Arrays.copyOfRange(raw, 1, 1 + NONCE_BYTES);
        byte[] cipherText = Arrays.copyOfRange(raw, 1 + NONCE_BYTES, raw.length - MAC_BYTES);
        byte[] mac = Arrays.copyOfRange(raw, raw.length - MAC_BYTES, raw.length);
        MessageKeys keys = messageKeys(conversationKey, nonce);
        try {
            byte[] expected = hmac(keys.hmacKey(), concat(nonce, cipherText));
            if (!SecurityUtils.constantTimeCompare(expected, mac)) {
                throw new CryptoException("Invalid NIP-44 MAC");
            }
            return unpad(chacha(keys.chachaKey(), keys.chachaNonce(), cipherText));
        } finally {
            keys.clear();
        }
    }

    static int calcPaddedLength(int unpaddedLength) {
        if (unpaddedLength <= 32) {
            return 32;
        }
        int nextPower = 1 << (32 - Integer.numberOfLeadingZeros(unpaddedLength - 1));
        int chunk = nextPower <= 256 ? 32 : nextPower / 8;
        return chunk * ((unpaddedLength - 1) / chunk + 1);
    }

    private static byte[] pad(String plaintext) {
        byte[] unpadded = plaintext.getBytes(StandardCharsets.UTF_8);
        if (unpadded.length < MIN_PLAINTEXT || unpadded.length > MAX_PLAINTEXT) {
            throw new ValidationException("NIP-44 plaintext must be 1..65535 bytes");
        }
        byte[] padded = new byte[2 + calcPaddedLength(unpadded.length)];
        padded[0] = (byte) (unpadded.length >>> 8);
        padded[1] = (byte) unpadded.length;
        System.arraycopy(unpadded, 0, padded, 2, unpadded.length);
        return padded;
    }

    private static String unpad(byte[] padded) {
        int length = ((padded[0] & 0xff) << 8) | (padded[1] & 0xff);
        if (length < MIN_PLAINTEXT || padded.length != 2 + calcPaddedLength(length)) {
            throw new CryptoException("Invalid NIP-44 padding");
        }
        return Nip04Cipher.strictUtf8(Arrays.copyOfRange(padded, 2, 2 + length));
    }

    private static MessageKeys messageKeys(byte[] conversationKey, byte[] nonce) {
        if (conversationKey == null || conversationKey.length != 32) {
            throw new ValidationException("NIP-44 conversation key must be 32 bytes");
        }
        if (nonce == null || nonce.length != NONCE_BYTES) {
            throw new ValidationException("NIP-44 nonce must be 32 bytes");
        }
        HKDFBytesGenerator hkdf = new HKDFBytesGenerator(new SHA256Digest());
        hkdf.init(HKDFParameters.skipExtractParameters(conversationKey, nonce));
        byte[] okm = new byte[76];
        hkdf.generateBytes(okm, 0, okm.length);
        MessageKeys keys = new MessageKeys(
                Arrays.copyOfRange(okm, 0, 32),
                Arrays.copyOfRange(okm, 32, 44),
                Arrays.copyOfRange(okm, 44, 76)
        );
        SecurityUtils.clearSensitiveBuffer(okm);
        return keys;
    }

    private static byte[] chacha(byte[] key, byte[] nonce, byte[] input) {
        ChaCha7539Engine engine = new ChaCha7539Engine();
        engine.init(true, new ParametersWithIV(new KeyParameter(key), nonce));
        byte[] out = new byte[input.length];
        engine.processBytes(input, 0, input.length, out, 0);
        return out;
    }

    private static byte[] hmac(byte[] key, byte[] message) {
        HMac mac = new HMac(new SHA256Digest());
        mac.init(new KeyParameter(key));
        mac.update(message, 0, message.length);
        byte[] out = new byte[mac.getMacSize()];
        mac.doFinal(out, 0);
        return out;
    }

    private static byte[] concat(byte[] a, byte[] b) {
        byte[] out = new byte[a.length + b.length];
        System.arraycopy(a, 0, out, 0, a.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }

    private record MessageKeys(byte[] chachaKey, byte[] chachaNonce, byte[] hmacKey) {
        void clear() {
            SecurityUtils.clearSensitiveBuffer(chachaKey);
            SecurityUtils.clearSensitiveBuffer(chachaNonce);
            SecurityUtils.clearSensitiveBuffer(hmacKey);
        }
    }
}
