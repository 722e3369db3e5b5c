package io.obscur.crypto;

/**
 * RPC surface of an OS keystore that keeps private keys inside secure
 * hardware. Handles are opaque, non-secret tokens; implementations may block.
 */
public interface NativeKeystoreBridge {

    /** Creates a key inside the keystore and returns its handle. */
    String generateKey();

    String publicKey(String handle);

    byte[] signSchnorr(String handle, byte[] digest);

    String encryptNip04(String handle, String recipientPubkey, String plaintext);

    String decryptNip04(String handle, String senderPubkey, String ciphertext);

    String decryptNip44(String handle, String senderPubkey, String payload);
}
