package io.obscur.crypto;

import io.obscur.error.CryptoException;
import io.obscur.error.ValidationException;
import io.obscur.model.EventKinds;
import io.obscur.model.NostrEvent;
import io.obscur.model.UnsignedEvent;
import io.obscur.security.SecurityUtils;
import io.obscur.util.Hashing;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.List;

/**
 * Rumor, seal and wrap layering. The seal is encrypted to the recipient under
 * a first ephemeral key and the wrap under a second one, so neither outer
 * layer names the real sender; only the signed rumor inside does.
 */
final class GiftWraps {
    static final long MAX_TIMESTAMP_SKEW_SECONDS = 2L * 24L * 60L * 60L;

    private final Nip44Cipher nip44;
    private final SecureRandom secureRandom;
    private final Clock clock;

    GiftWraps(Nip44Cipher nip44, SecureRandom secureRandom, Clock clock) {
        this.nip44 = nip44;
        this.secureRandom = secureRandom;
        this.clock = clock;
    }

    NostrEvent wrap(NostrEvent signedRumor, String recipientPubkey) {
        byte[] recipient = Secp256k1.parsePublicKey(recipientPubkey);
        String recipientHex = Hashing.toHex(recipient);
        BigInteger sealKey = Secp256k1.randomScalar(secureRandom);
        BigInteger wrapKey;
        do {
            wrapKey = Secp256k1.randomScalar(secureRandom);
        } while (wrapKey.equals(sealKey));

        String sealContent = encryptTo(NostrEvents.toJson(signedRumor), sealKey, recipient);
        NostrEvent seal = sign(new UnsignedEvent(null, randomizedNow(), EventKinds.SEAL, List.of(), sealContent), sealKey);

        String wrapContent = encryptTo(NostrEvents.toJson(seal), wrapKey, recipient);
        return sign(new UnsignedEvent(
                null,
                randomizedNow(),
                EventKinds.GIFT_WRAP,
                List.of(List.of("p", recipientHex)),
                wrapContent
        ), wrapKey);
    }

    NostrEvent unwrap(NostrEvent wrap, PayloadOpener opener) {
        if (wrap == null || wrap.kind() != EventKinds.GIFT_WRAP) {
            throw new CryptoException("Expected a gift wrap event of kind " + EventKinds.GIFT_WRAP);
        }
        if (!NostrEvents.verify(wrap)) {
            throw new CryptoException("Gift wrap signature is invalid");
        }
        NostrEvent seal = parseLayer(opener.open(wrap.pubkey(), wrap.content()), "seal");
        if (seal.kind() != EventKinds.SEAL) {
            throw new CryptoException("Expected a seal event of kind " + EventKinds.SEAL + " but got " + seal.kind());
        }
        if (!NostrEvents.verify(seal)) {
            throw new CryptoException("Seal signature is invalid");
        }
        NostrEvent rumor = parseLayer(opener.open(seal.pubkey(), seal.content()), "rumor");
        if (!NostrEvents.verify(rumor)) {
            throw new CryptoException("Rumor signature is invalid");
        }
        return rumor;
    }

    private String encryptTo(String plaintext, BigInteger ephemeral, byte[] recipient) {
        byte[] shared = Secp256k1.sharedX(ephemeral, recipient);
        byte[] conversationKey = Nip44Cipher.conversationKey(shared);
        try {
            return nip44.encrypt(plaintext, conversationKey);
        } finally {
            SecurityUtils.clearSensitiveBuffer(shared);
            SecurityUtils.clearSensitiveBuffer(conversationKey);
        }
    }

    private NostrEvent sign(UnsignedEvent event, BigInteger key) {
        UnsignedEvent withPubkey = event.withPubkey(Hashing.toHex(Secp256k1.xOnlyPublicKey(key)));
        byte[] id = NostrEvents.computeIdBytes(withPubkey);
        byte[] aux = new byte[32];
        secureRandom.nextBytes(aux);
        return NostrEvents.assemble(withPubkey, id, Secp256k1.sign(id, key, aux));
    }

    private long randomizedNow() {
        long now = clock.millis() / 1000L;
        return now - (long) (secureRandom.nextDouble() * MAX_TIMESTAMP_SKEW_SECONDS);
    }

    private static NostrEvent parseLayer(String json, String layer) {
        try {
            return NostrEvents.fromJson(json);
        } catch (ValidationException e) {
            throw new CryptoException("Malformed " + layer + " payload", e);
        }
    }

    @FunctionalInterface
    interface PayloadOpener {
        String open(String counterpartyPubkey, String payload);
    }
}
