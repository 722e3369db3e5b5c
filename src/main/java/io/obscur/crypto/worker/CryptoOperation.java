package io.obscur.crypto.worker;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.obscur.error.ValidationException;

public enum CryptoOperation {
    GENERATE_KEY_PAIR("generateKeyPair"),
    DERIVE_PUBLIC_KEY("derivePublicKey"),
    ENCRYPT_DM("encryptDM"),
    DECRYPT_DM("decryptDM"),
    SIGN_EVENT("signEvent"),
    VERIFY_EVENT_SIGNATURE("verifyEventSignature"),
    ENCRYPT_GIFT_WRAP("encryptGiftWrap"),
    DECRYPT_GIFT_WRAP("decryptGiftWrap"),
    DERIVE_SHARED_SECRET("deriveSharedSecret"),
    GENERATE_INVITE_ID("generateInviteId"),
    SIGN_INVITE_DATA("signInviteData"),
    VERIFY_INVITE_SIGNATURE("verifyInviteSignature"),
    ENCRYPT_INVITE_DATA("encryptInviteData"),
    DECRYPT_INVITE_DATA("decryptInviteData"),
    GENERATE_SECURE_RANDOM("generateSecureRandom"),
    DERIVE_STORAGE_KEY("deriveStorageKey");

    private final String wireName;

    CryptoOperation(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static CryptoOperation fromWire(String raw) {
        for (CryptoOperation op : values()) {
            if (op.wireName.equals(raw)) {
                return op;
            }
        }
        throw new ValidationException("Unknown crypto operation: " + raw);
    }
}
