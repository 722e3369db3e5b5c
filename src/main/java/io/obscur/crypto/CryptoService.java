package io.obscur.crypto;

import io.obscur.model.InvitePayload;
import io.obscur.model.Keypair;
import io.obscur.model.NostrEvent;
import io.obscur.model.UnsignedEvent;

import java.util.Locale;

/**
 * Cryptographic operations of the messaging core. One implementation is chosen
 * at startup (see {@link CryptoServices}) and handed to every consumer.
 *
 * <p>Producing operations throw {@link io.obscur.error.CryptoException} or
 * {@link io.obscur.error.ValidationException}; {@code verify*} methods never
 * throw. A private key argument is either 64 hex chars or a
 * {@code native:<handle>} token, and call sites never branch on which.
 */
public interface CryptoService extends AutoCloseable {

    Keypair generateKeyPair();

    String derivePublicKey(String privateKey);

    String encryptDM(String plaintext, String recipientPubkey, String senderPrivateKey);

    String decryptDM(String ciphertext, String senderPubkey, String recipientPrivateKey);

    NostrEvent signEvent(UnsignedEvent event, String privateKey);

    boolean verifyEventSignature(NostrEvent event);

    NostrEvent encryptGiftWrap(UnsignedEvent rumor, String senderPrivateKey, String recipientPubkey);

    NostrEvent decryptGiftWrap(NostrEvent wrap, String recipientPrivateKey);

    byte[] deriveSharedSecret(String privateKey, String publicKey);

    String generateInviteId();

    String signInviteData(InvitePayload payload, String privateKey);

    boolean verifyInviteSignature(InvitePayload payload, String signature, String publicKey);

    String encryptInviteData(String plaintext, byte[] key);

    String decryptInviteData(String payload, byte[] key);

    byte[] generateSecureRandom(int length);

    /** SHA-256 of the identity secret, used as the at-rest record key. */
    byte[] deriveStorageKey(String identitySecret);

    default boolean isValidPubkey(String value) {
        return value != null && value.trim().matches("^[0-9a-fA-F]{64}$");
    }

    default String normalizeKey(String value) {
        if (value == null) {
            return "";
        }
        String hex = value.trim().toLowerCase(Locale.ROOT).replaceAll("[^0-9a-f]", "");
        return hex.length() == 64 ? hex : "";
    }

    @Override
    default void close() {
    }
}
