package io.obscur.model;

/**
 * A secp256k1 identity. {@code privateKey} is either 64 hex chars (software
 * keys) or an opaque {@code native:<handle>} token owned by the OS keystore.
 */
public record Keypair(String publicKey, String privateKey) {
    public static final String NATIVE_PREFIX = "native:";

    public static boolean isNativeHandle(String privateKey) {
        return privateKey != null && privateKey.startsWith(NATIVE_PREFIX);
    }

    public static String nativeHandle(String handle) {
        return NATIVE_PREFIX + handle;
    }

    public boolean usesNativeHandle() {
        return isNativeHandle(privateKey);
    }

    @Override
    public String toString() {
        return "Keypair[publicKey=" + publicKey + ", privateKey=[REDACTED]]";
    }
}
