package io.obscur.crypto;

import io.obscur.error.CryptoException;
import io.obscur.error.ValidationException;
import io.obscur.util.Hashing;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.math.ec.ECCurve;
import org.bouncycastle.math.ec.ECPoint;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * secp256k1 with x-only public keys and BIP-340 Schnorr signatures.
 */
final class Secp256k1 {
    private static final X9ECParameters PARAMS = CustomNamedCurves.getByName("secp256k1");
    private static final ECCurve CURVE = PARAMS.getCurve();
    private static final ECPoint G = PARAMS.getG();
    private static final BigInteger N = PARAMS.getN();
    private static final BigInteger P = CURVE.getField().getCharacteristic();
    private static final byte[] TAG_AUX = tagHash("BIP0340/aux");
    private static final byte[] TAG_NONCE = tagHash("BIP0340/nonce");
    private static final byte[] TAG_CHALLENGE = tagHash("BIP0340/challenge");

    private Secp256k1() {
    }

    static BigInteger randomScalar(SecureRandom random) {
        BigInteger d;
        do {
            byte[] raw = new byte[32];
            random.nextBytes(raw);
            d = new BigInteger(1, raw);
            Arrays.fill(raw, (byte) 0);
        } while (d.signum() <= 0 || d.compareTo(N) >= 0);
        return d;
    }

    static BigInteger parsePrivateKey(String hex) {
        if (hex == null || !hex.matches("^[0-9a-fA-F]{64}$")) {
            throw new ValidationException("Private key must be 64 hex characters");
        }
        BigInteger d = new BigInteger(1, Hashing.fromHex(hex));
        if (d.signum() <= 0 || d.compareTo(N) >= 0) {
            throw new ValidationException("Private key is outside the secp256k1 scalar range");
        }
        return d;
    }

    static byte[] parsePublicKey(String hex) {
        if (hex == null || !hex.trim().matches("^[0-9a-fA-F]{64}$")) {
            throw new ValidationException("Public key must be 64 hex characters");
        }
        return Hashing.fromHex(hex.trim());
    }

    static byte[] xOnlyPublicKey(BigInteger d) {
        return G.multiply(d).normalize().getAffineXCoord().getEncoded();
    }

    static String privateKeyHex(BigInteger d) {
        return Hashing.toHex(toBytes32(d));
    }

    // Even-y point for an x-only key.
    static ECPoint liftX(byte[] x) {
        if (x == null || x.length != 32 || new BigInteger(1, x).compareTo(P) >= 0) {
            throw new ValidationException("Public key is not a valid x coordinate");
        }
        byte[] compressed = new byte[33];
        compressed[0] = 0x02;
        System.arraycopy(x, 0, compressed, 1, 32);
        try {
            return CURVE.decodePoint(compressed).normalize();
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Public key is not on secp256k1", e);
        }
    }

    static byte[] sharedX(BigInteger d, byte[] publicKey) {
        ECPoint shared = liftX(publicKey).multiply(d).normalize();
        if (shared.isInfinity()) {
            throw new CryptoException("ECDH produced the point at infinity");
        }
        return shared.getAffineXCoord().getEncoded();
    }

    static byte[] sign(byte[] message, BigInteger secret, byte[] auxRand) {
        if (message == null || message.length != 32) {
            throw new ValidationException("Schnorr message must be 32 bytes");
        }
        ECPoint pub = G.multiply(secret).normalize();
        BigInteger d = hasEvenY(pub) ? secret : N.subtract(secret);
        byte[] px = pub.getAffineXCoord().getEncoded();
        byte[] t = xor(toBytes32(d), taggedHash(TAG_AUX, auxRand));
        BigInteger k0 = new BigInteger(1, taggedHash(TAG_NONCE, t, px, message)).mod(N);
        if (k0.signum() == 0) {
            throw new CryptoException("Schnorr nonce derivation produced zero");
        }
        ECPoint r = G.multiply(k0).normalize();
        BigInteger k = hasEvenY(r) ? k0 : N.subtract(k0);
        byte[] rx = r.getAffineXCoord().getEncoded();
        BigInteger e = new BigInteger(1, taggedHash(TAG_CHALLENGE, rx, px, message)).mod(N);
        byte[] signature = new byte[64];
        System.arraycopy(rx, 0, signature, 0, 32);
        System.arraycopy(toBytes32(k.add(e.multiply(d)).mod(N)), 0, signature, 32, 32);
        if (!verify(message, px, signature)) {
            throw new CryptoException("Produced Schnorr signature does not verify");
        }
        return signature;
    }

    static boolean verify(byte[] message, byte[] publicKey, byte[] signature) {
        if (message == null || message.length != 32 || signature == null || signature.length != 64) {
            return false;
        }
        ECPoint pub;
        try {
            pub = liftX(publicKey);
        } catch (ValidationException e) {
            return false;
        }
        byte[] rx = Arrays.copyOfRange(signature, 0, 32);
        BigInteger r = new BigInteger(1, rx);
        BigInteger s = new BigInteger(1, Arrays.copyOfRange(signature, 32, 64));
        if (r.compareTo(P) >= 0 || s.compareTo(N) >= 0) {
            return false;
        }
        BigInteger e = new BigInteger(1, taggedHash(TAG_CHALLENGE, rx, publicKey, message)).mod(N);
        ECPoint candidate = G.multiply(s).add(pub.multiply(N.subtract(e))).normalize();
        if (candidate.isInfinity() || !hasEvenY(candidate)) {
            return false;
        }
        return candidate.getAffineXCoord().toBigInteger().equals(r);
    }

    static byte[] toBytes32(BigInteger value) {
        byte[] raw = value.toByteArray();
        if (raw.length == 32) {
            return raw;
        }
        byte[] out = new byte[32];
        if (raw.length > 32) {
            System.arraycopy(raw, raw.length - 32, out, 0, 32);
        } else {
            System.arraycopy(raw, 0, out, 32 - raw.length, raw.length);
        }
        return out;
    }

    private static boolean hasEvenY(ECPoint point) {
        return !point.getAffineYCoord().toBigInteger().testBit(0);
    }

    private static byte[] tagHash(String tag) {
        return Hashing.sha256(tag.getBytes(StandardCharsets.UTF_8));
    }

    private static byte[] taggedHash(byte[] tagDigest, byte[]... parts) {
        int total = tagDigest.length * 2;
        for (byte[] part : parts) {
            total += part.length;
        }
        byte[] buffer = new byte[total];
        System.arraycopy(tagDigest, 0, buffer, 0, tagDigest.length);
        System.arraycopy(tagDigest, 0, buffer, tagDigest.length, tagDigest.length);
        int offset = tagDigest.length * 2;
        for (byte[] part : parts) {
            System.arraycopy(part, 0, buffer, offset, part.length);
            offset += part.length;
        }
        return Hashing.sha256(buffer);
    }

    private static byte[] xor(byte[] a, byte[] b) {
        byte[] out = new byte[a.length];
        for (int i = 0; i < a.length; i++) {
            out[i] = (byte) (a[i] ^ b[i]);
        }
        return out;
    }
}
