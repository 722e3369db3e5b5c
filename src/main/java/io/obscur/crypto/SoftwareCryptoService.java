package io.obscur.crypto;

import io.obscur.error.ValidationException;
import io.obscur.model.InvitePayload;
import io.obscur.model.Keypair;
import io.obscur.model.NostrEvent;
import io.obscur.model.UnsignedEvent;
import io.obscur.security.AesGcm;
import io.obscur.security.SecurityUtils;
import io.obscur.util.Hashing;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

public final class SoftwareCryptoService implements CryptoService {
    private static final int SHARED_SECRET_CACHE_SIZE = 256;
    private static final int INVITE_ID_BYTES = 16;

    private final SecureRandom secureRandom;
    private final Nip04Cipher nip04;
    private final GiftWraps giftWraps;
    private final Map<String, byte[]> sharedSecrets;

    public SoftwareCryptoService() {
        this(new SecureRandom(), Clock.systemUTC());
    }

    public SoftwareCryptoService(SecureRandom secureRandom, Clock clock) {
        this.secureRandom = secureRandom;
        this.nip04 = new Nip04Cipher(secureRandom);
        this.giftWraps = new GiftWraps(new Nip44Cipher(secureRandom), secureRandom, clock);
        this.sharedSecrets = new LinkedHashMap<>(64, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, byte[]> eldest) {
                return size() > SHARED_SECRET_CACHE_SIZE;
            }
        };
    }

    @Override
    public Keypair generateKeyPair() {
        BigInteger d = Secp256k1.randomScalar(secureRandom);
        return new Keypair(Hashing.toHex(Secp256k1.xOnlyPublicKey(d)), Secp256k1.privateKeyHex(d));
    }

    @Override
    public String derivePublicKey(String privateKey) {
        return Hashing.toHex(Secp256k1.xOnlyPublicKey(Secp256k1.parsePrivateKey(privateKey)));
    }

    @Override
    public String encryptDM(String plaintext, String recipientPubkey, String senderPrivateKey) {
        byte[] shared = sharedSecret(senderPrivateKey, recipientPubkey);
        try {
            return nip04.encrypt(plaintext, shared);
        } finally {
            SecurityUtils.clearSensitiveBuffer(shared);
        }
    }

    @Override
    public String decryptDM(String ciphertext, String senderPubkey, String recipientPrivateKey) {
        byte[] shared = sharedSecret(recipientPrivateKey, senderPubkey);
        try {
            return nip04.decrypt(ciphertext, shared);
        } finally {
            SecurityUtils.clearSensitiveBuffer(shared);
        }
    }

    @Override
    public NostrEvent signEvent(UnsignedEvent event, String privateKey) {
        if (event == null) {
            throw new ValidationException("event must not be null");
        }
        BigInteger d = Secp256k1.parsePrivateKey(privateKey);
        String pubkey = Hashing.toHex(Secp256k1.xOnlyPublicKey(d));
        if (event.pubkey() != null && !event.pubkey().equalsIgnoreCase(pubkey)) {
            throw new ValidationException("Event pubkey does not match the signing key");
        }
        UnsignedEvent bound = event.withPubkey(pubkey);
        byte[] id = NostrEvents.computeIdBytes(bound);
        return NostrEvents.assemble(bound, id, Secp256k1.sign(id, d, generateSecureRandom(32)));
    }

    @Override
    public boolean verifyEventSignature(NostrEvent event) {
        return NostrEvents.verify(event);
    }

    @Override
    public NostrEvent encryptGiftWrap(UnsignedEvent rumor, String senderPrivateKey, String recipientPubkey) {
        return giftWraps.wrap(signEvent(rumor, senderPrivateKey), recipientPubkey);
    }

    @Override
    public NostrEvent decryptGiftWrap(NostrEvent wrap, String recipientPrivateKey) {
        BigInteger d = Secp256k1.parsePrivateKey(recipientPrivateKey);
        return giftWraps.unwrap(wrap, (counterparty, payload) -> {
            byte[] shared = Secp256k1.sharedX(d, Secp256k1.parsePublicKey(counterparty));
            byte[] conversationKey = Nip44Cipher.conversationKey(shared);
            try {
                return Nip44Cipher.decrypt(payload, conversationKey);
            } finally {
                SecurityUtils.clearSensitiveBuffer(shared);
                SecurityUtils.clearSensitiveBuffer(conversationKey);
            }
        });
    }

    @Override
    public byte[] deriveSharedSecret(String privateKey, String publicKey) {
        return sharedSecret(privateKey, publicKey);
    }

    @Override
    public String generateInviteId() {
        return Hashing.toHex(generateSecureRandom(INVITE_ID_BYTES));
    }

    @Override
    public String signInviteData(InvitePayload payload, String privateKey) {
        if (payload == null) {
            throw new ValidationException("invite payload must not be null");
        }
        BigInteger d = Secp256k1.parsePrivateKey(privateKey);
        return Hashing.toHex(Secp256k1.sign(Invites.digest(payload), d, generateSecureRandom(32)));
    }

    @Override
    public boolean verifyInviteSignature(InvitePayload payload, String signature, String publicKey) {
        if (payload == null || signature == null || !signature.matches("^[0-9a-fA-F]{128}$") || !isValidPubkey(publicKey)) {
            return false;
        }
        try {
            return Secp256k1.verify(Invites.digest(payload), Hashing.fromHex(publicKey.trim()), Hashing.fromHex(signature));
        } catch (RuntimeException e) {
            return false;
        }
    }

    @Override
    public String encryptInviteData(String plaintext, byte[] key) {
        if (plaintext == null) {
            throw new ValidationException("plaintext must not be null");
        }
        return AesGcm.encryptString(plaintext, key);
    }

    @Override
    public String decryptInviteData(String payload, byte[] key) {
        return AesGcm.decryptString(payload, key);
    }

    @Override
    public byte[] generateSecureRandom(int length) {
        if (length <= 0) {
            throw new ValidationException("Random length must be a positive integer, got " + length);
        }
        byte[] out = new byte[length];
        secureRandom.nextBytes(out);
        return out;
    }

    @Override
    public byte[] deriveStorageKey(String identitySecret) {
        if (identitySecret == null || identitySecret.isBlank()) {
            throw new ValidationException("identity secret must not be blank");
        }
        return Hashing.sha256(identitySecret.getBytes(StandardCharsets.UTF_8));
    }

    // Cached under a digest so raw private keys never become map keys.
    private byte[] sharedSecret(String privateKey, String publicKey) {
        BigInteger d = Secp256k1.parsePrivateKey(privateKey);
        byte[] pub = Secp256k1.parsePublicKey(publicKey);
        String cacheKey = Hashing.sha256Hex(privateKey.toLowerCase() + ":" + Hashing.toHex(pub));
        synchronized (sharedSecrets) {
            byte[] cached = sharedSecrets.get(cacheKey);
            if (cached != null) {
                return cached.clone();
            }
        }
        byte[] shared = Secp256k1.sharedX(d, pub);
        synchronized (sharedSecrets) {
            sharedSecrets.put(cacheKey, shared.clone());
        }
        return shared;
    }
}
