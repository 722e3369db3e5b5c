package io.obscur.crypto;

import io.obscur.error.CryptoException;
import io.obscur.error.ValidationException;
import io.obscur.model.EventKinds;
import io.obscur.model.InvitePayload;
import io.obscur.model.Keypair;
import io.obscur.model.NostrEvent;
import io.obscur.model.UnsignedEvent;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

final class SoftwareCryptoServiceTest {
    private static final String LONG_TEXT = "The relay dropped the first attempt, so this one goes out again with backoff.";

    private final SoftwareCryptoService crypto = new SoftwareCryptoService();

    @Test
    void generatedKeysRoundTripThroughDerivation() {
        Keypair keypair = crypto.generateKeyPair();

        Assertions.assertTrue(crypto.isValidPubkey(keypair.publicKey()));
        Assertions.assertTrue(keypair.privateKey().matches("^[0-9a-f]{64}$"));
        Assertions.assertEquals(keypair.publicKey(), crypto.derivePublicKey(keypair.privateKey()));
        Assertions.assertFalse(keypair.toString().contains(keypair.privateKey()));
    }

    @Test
    void directMessageDecryptsOnlyForTheCounterparty() {
        Keypair alice = crypto.generateKeyPair();
        Keypair bob = crypto.generateKeyPair();
        Keypair carol = crypto.generateKeyPair();

        String ciphertext = crypto.encryptDM(LONG_TEXT, bob.publicKey(), alice.privateKey());

        Assertions.assertTrue(ciphertext.contains("?iv="));
        Assertions.assertEquals(LONG_TEXT, crypto.decryptDM(ciphertext, alice.publicKey(), bob.privateKey()));
        Assertions.assertEquals(LONG_TEXT, crypto.decryptDM(ciphertext, bob.publicKey(), alice.privateKey()));
        Assertions.assertThrows(CryptoException.class,
                () -> crypto.decryptDM(ciphertext, alice.publicKey(), carol.privateKey()));
        Assertions.assertThrows(CryptoException.class,
                () -> crypto.decryptDM("garbage", alice.publicKey(), bob.privateKey()));
    }

    @Test
    void signedEventsVerifyAndTamperingIsDetected() {
        Keypair alice = crypto.generateKeyPair();
        UnsignedEvent unsigned = UnsignedEvent.of(EventKinds.ENCRYPTED_DM, "hello", List.of(List.of("p", alice.publicKey())), 1_700_000_000L);

        NostrEvent signed = crypto.signEvent(unsigned, alice.privateKey());

        Assertions.assertEquals(alice.publicKey(), signed.pubkey());
        Assertions.assertEquals(NostrEvents.computeId(signed.unsigned()), signed.id());
        Assertions.assertTrue(crypto.verifyEventSignature(signed));

        NostrEvent edited = new NostrEvent(signed.id(), signed.pubkey(), signed.createdAt(), signed.kind(),
                signed.tags(), "hello!", signed.sig());
        Assertions.assertFalse(crypto.verifyEventSignature(edited));

        char flipped = signed.sig().charAt(0) == '0' ? '1' : '0';
        NostrEvent badSig = new NostrEvent(signed.id(), signed.pubkey(), signed.createdAt(), signed.kind(),
                signed.tags(), signed.content(), flipped + signed.sig().substring(1));
        Assertions.assertFalse(crypto.verifyEventSignature(badSig));
        Assertions.assertFalse(crypto.verifyEventSignature(new NostrEvent(null, null, 0L, 1, null, null, null)));
        Assertions.assertFalse(crypto.verifyEventSignature(null));
    }

    @Test
    void signingRejectsForeignPubkey() {
        Keypair alice = crypto.generateKeyPair();
        Keypair bob = crypto.generateKeyPair();
        UnsignedEvent claimed = UnsignedEvent.of(EventKinds.CHAT_MESSAGE, "x", List.of(), 1L).withPubkey(bob.publicKey());

        Assertions.assertThrows(ValidationException.class, () -> crypto.signEvent(claimed, alice.privateKey()));
    }

    @Test
    void giftWrapHidesSenderAndOpensForRecipient() {
        Keypair alice = crypto.generateKeyPair();
        Keypair bob = crypto.generateKeyPair();
        Keypair carol = crypto.generateKeyPair();
        long nowSeconds = System.currentTimeMillis() / 1000L;
        UnsignedEvent rumor = UnsignedEvent.of(EventKinds.CHAT_MESSAGE, LONG_TEXT,
                List.of(List.of("p", bob.publicKey())), nowSeconds);

        NostrEvent wrap = crypto.encryptGiftWrap(rumor, alice.privateKey(), bob.publicKey());

        Assertions.assertEquals(EventKinds.GIFT_WRAP, wrap.kind());
        Assertions.assertEquals(bob.publicKey(), wrap.firstTagValue("p"));
        Assertions.assertNotEquals(alice.publicKey(), wrap.pubkey());
        Assertions.assertFalse(wrap.content().contains(LONG_TEXT));
        Assertions.assertTrue(wrap.createdAt() <= nowSeconds + 1);
        Assertions.assertTrue(wrap.createdAt() >= nowSeconds - GiftWraps.MAX_TIMESTAMP_SKEW_SECONDS - 1);
        Assertions.assertTrue(crypto.verifyEventSignature(wrap));

        NostrEvent opened = crypto.decryptGiftWrap(wrap, bob.privateKey());
        Assertions.assertEquals(LONG_TEXT, opened.content());
        Assertions.assertEquals(alice.publicKey(), opened.pubkey());
        Assertions.assertEquals(EventKinds.CHAT_MESSAGE, opened.kind());

        Assertions.assertThrows(CryptoException.class, () -> crypto.decryptGiftWrap(wrap, carol.privateKey()));
    }

    @Test
    void giftWrapWithForgedOuterSignatureIsRejected() {
        Keypair alice = crypto.generateKeyPair();
        Keypair bob = crypto.generateKeyPair();
        NostrEvent wrap = crypto.encryptGiftWrap(
                UnsignedEvent.of(EventKinds.CHAT_MESSAGE, "hi", List.of(), 1L), alice.privateKey(), bob.publicKey());
        NostrEvent forged = new NostrEvent(wrap.id(), alice.publicKey(), wrap.createdAt(), wrap.kind(),
                wrap.tags(), wrap.content(), wrap.sig());

        Assertions.assertThrows(CryptoException.class, () -> crypto.decryptGiftWrap(forged, bob.privateKey()));
    }

    @Test
    void sharedSecretIsSymmetric() {
        Keypair alice = crypto.generateKeyPair();
        Keypair bob = crypto.generateKeyPair();

        byte[] ab = crypto.deriveSharedSecret(alice.privateKey(), bob.publicKey());
        byte[] ba = crypto.deriveSharedSecret(bob.privateKey(), alice.publicKey());

        Assertions.assertEquals(32, ab.length);
        Assertions.assertArrayEquals(ab, ba);
        // Callers may wipe what they receive without poisoning the cache.
        Arrays.fill(ab, (byte) 0);
        Assertions.assertArrayEquals(ba, crypto.deriveSharedSecret(alice.privateKey(), bob.publicKey()));
    }

    @Test
    void inviteSignaturesBindEveryField() {
        Keypair alice = crypto.generateKeyPair();
        InvitePayload payload = new InvitePayload(alice.publicKey(), "Alice", null, "join me", 1_700_000_000_000L,
                1_800_000_000_000L, crypto.generateInviteId());

        String signature = crypto.signInviteData(payload, alice.privateKey());

        Assertions.assertTrue(crypto.verifyInviteSignature(payload, signature, alice.publicKey()));
        InvitePayload renamed = new InvitePayload(alice.publicKey(), "Mallory", null, "join me", payload.timestamp(),
                payload.expirationTime(), payload.inviteId());
        Assertions.assertFalse(crypto.verifyInviteSignature(renamed, signature, alice.publicKey()));
        Assertions.assertFalse(crypto.verifyInviteSignature(payload, signature, crypto.generateKeyPair().publicKey()));
        Assertions.assertFalse(crypto.verifyInviteSignature(payload, "zz", alice.publicKey()));
        Assertions.assertEquals(32, payload.inviteId().length());
    }

    @Test
    void inviteDataUsesAesGcmWith32ByteKeys() {
        byte[] key = crypto.generateSecureRandom(32);

        String sealed = crypto.encryptInviteData("{\"relay\":\"wss://relay.example\"}", key);

        Assertions.assertEquals("{\"relay\":\"wss://relay.example\"}", crypto.decryptInviteData(sealed, key));
        Assertions.assertThrows(CryptoException.class, () -> crypto.decryptInviteData(sealed, crypto.generateSecureRandom(32)));
        Assertions.assertThrows(ValidationException.class, () -> crypto.encryptInviteData("x", new byte[16]));
    }

    @Test
    void keyHelpersNormalizeAndValidate() {
        String upper = "AB".repeat(32);

        Assertions.assertTrue(crypto.isValidPubkey(" " + upper + " "));
        Assertions.assertFalse(crypto.isValidPubkey("ab"));
        Assertions.assertFalse(crypto.isValidPubkey(null));
        Assertions.assertEquals("ab".repeat(32), crypto.normalizeKey(upper));
        Assertions.assertEquals("", crypto.normalizeKey("npub1xyz"));
        Assertions.assertThrows(ValidationException.class, () -> crypto.generateSecureRandom(0));
        Assertions.assertEquals(16, crypto.generateSecureRandom(16).length);
    }

    @Test
    void storageKeyIsStablePerSecret() {
        Assertions.assertArrayEquals(crypto.deriveStorageKey("identity-secret"), crypto.deriveStorageKey("identity-secret"));
        Assertions.assertFalse(Arrays.equals(crypto.deriveStorageKey("a"), crypto.deriveStorageKey("b")));
        Assertions.assertThrows(ValidationException.class, () -> crypto.deriveStorageKey(" "));
    }
}
