package io.obscur.crypto.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.obscur.crypto.CryptoService;
import io.obscur.error.ObscurException;
import io.obscur.error.ValidationException;
import io.obscur.model.InvitePayload;
import io.obscur.model.NostrEvent;
import io.obscur.model.UnsignedEvent;
import io.obscur.util.Jsons;

/**
 * Serving side of the worker boundary: decodes a request envelope, runs it on
 * the wrapped service and encodes the outcome. Failures travel back as
 * {@code errorType}/{@code errorMessage}, never as stack traces.
 */
public final class CryptoWorker {
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final CryptoService delegate;

    public CryptoWorker(CryptoService delegate) {
        this.delegate = delegate;
    }

    public String handle(String requestJson) {
        CryptoRequest request;
        try {
            request = Jsons.fromJson(requestJson, CryptoRequest.class);
        } catch (ValidationException e) {
            return Jsons.toCompactJson(CryptoResponse.failure(null, ValidationException.class.getSimpleName(), e.getMessage()));
        }
        if (request.operation() == null) {
            return Jsons.toCompactJson(CryptoResponse.failure(
                    request.correlationId(), ValidationException.class.getSimpleName(), "operation is required"));
        }
        CryptoResponse response;
        try {
            response = CryptoResponse.success(request.correlationId(), dispatch(request.operation(), request.args()));
        } catch (ObscurException e) {
            response = CryptoResponse.failure(request.correlationId(), e.getClass().getSimpleName(), e.getMessage());
        } catch (RuntimeException e) {
            response = CryptoResponse.failure(request.correlationId(), "CryptoException",
                    request.operation().wireName() + " failed: " + e.getClass().getSimpleName());
        }
        return Jsons.toCompactJson(response);
    }

    private JsonNode dispatch(CryptoOperation operation, JsonNode args) {
        return switch (operation) {
            case GENERATE_KEY_PAIR -> Jsons.compact().valueToTree(delegate.generateKeyPair());
            case DERIVE_PUBLIC_KEY -> NODES.textNode(delegate.derivePublicKey(WireArgs.text(args, "privateKey")));
            case ENCRYPT_DM -> NODES.textNode(delegate.encryptDM(
                    WireArgs.text(args, "plaintext"),
                    WireArgs.text(args, "recipientPubkey"),
                    WireArgs.text(args, "senderPrivateKey")));
            case DECRYPT_DM -> NODES.textNode(delegate.decryptDM(
                    WireArgs.text(args, "ciphertext"),
                    WireArgs.text(args, "senderPubkey"),
                    WireArgs.text(args, "recipientPrivateKey")));
            case SIGN_EVENT -> Jsons.compact().valueToTree(delegate.signEvent(
                    WireArgs.value(args, "event", UnsignedEvent.class),
                    WireArgs.text(args, "privateKey")));
            case VERIFY_EVENT_SIGNATURE -> NODES.booleanNode(delegate.verifyEventSignature(
                    WireArgs.value(args, "event", NostrEvent.class)));
            case ENCRYPT_GIFT_WRAP -> Jsons.compact().valueToTree(delegate.encryptGiftWrap(
                    WireArgs.value(args, "rumor", UnsignedEvent.class),
                    WireArgs.text(args, "senderPrivateKey"),
                    WireArgs.text(args, "recipientPubkey")));
            case DECRYPT_GIFT_WRAP -> Jsons.compact().valueToTree(delegate.decryptGiftWrap(
                    WireArgs.value(args, "wrap", NostrEvent.class),
                    WireArgs.text(args, "recipientPrivateKey")));
            case DERIVE_SHARED_SECRET -> NODES.textNode(WireArgs.base64(delegate.deriveSharedSecret(
                    WireArgs.text(args, "privateKey"),
                    WireArgs.text(args, "publicKey"))));
            case GENERATE_INVITE_ID -> NODES.textNode(delegate.generateInviteId());
            case SIGN_INVITE_DATA -> NODES.textNode(delegate.signInviteData(
                    WireArgs.value(args, "payload", InvitePayload.class),
                    WireArgs.text(args, "privateKey")));
            case VERIFY_INVITE_SIGNATURE -> NODES.booleanNode(delegate.verifyInviteSignature(
                    WireArgs.value(args, "payload", InvitePayload.class),
                    WireArgs.text(args, "signature"),
                    WireArgs.text(args, "publicKey")));
            case ENCRYPT_INVITE_DATA -> NODES.textNode(delegate.encryptInviteData(
                    WireArgs.text(args, "plaintext"),
                    WireArgs.bytes(args, "key")));
            case DECRYPT_INVITE_DATA -> NODES.textNode(delegate.decryptInviteData(
                    WireArgs.text(args, "payload"),
                    WireArgs.bytes(args, "key")));
            case GENERATE_SECURE_RANDOM -> NODES.textNode(WireArgs.base64(delegate.generateSecureRandom(
                    args == null ? 0 : args.path("length").asInt(0))));
            case DERIVE_STORAGE_KEY -> NODES.textNode(WireArgs.base64(delegate.deriveStorageKey(
                    WireArgs.text(args, "identitySecret"))));
        };
    }
}
