package io.obscur.crypto.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.obscur.crypto.CryptoService;
import io.obscur.error.BridgeTimeoutException;
import io.obscur.error.CryptoException;
import io.obscur.error.ObscurException;
import io.obscur.error.ValidationException;
import io.obscur.model.InvitePayload;
import io.obscur.model.Keypair;
import io.obscur.model.NostrEvent;
import io.obscur.model.UnsignedEvent;
import io.obscur.observability.AuditLogger;
import io.obscur.util.Jsons;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Typed client for a crypto worker. Each call sends one request envelope and
 * waits on the future registered under its correlation id.
 */
public final class WorkerCryptoService implements CryptoService {
    private final CryptoChannel channel;
    private final long timeoutMs;
    private final AuditLogger auditLogger;
    private final Map<String, CompletableFuture<CryptoResponse>> pending;

    public WorkerCryptoService(CryptoChannel channel, long timeoutMs, AuditLogger auditLogger) {
        if (timeoutMs <= 0L) {
            throw new ValidationException("worker timeout must be > 0");
        }
        this.channel = channel;
        this.timeoutMs = timeoutMs;
        this.auditLogger = auditLogger == null ? AuditLogger.disabled() : auditLogger;
        this.pending = new ConcurrentHashMap<>();
        channel.onResponse(this::onResponse);
    }

    public int pendingRequests() {
        return pending.size();
    }

    @Override
    public Keypair generateKeyPair() {
        return as(call(CryptoOperation.GENERATE_KEY_PAIR, WireArgs.object()), Keypair.class);
    }

    @Override
    public String derivePublicKey(String privateKey) {
        return call(CryptoOperation.DERIVE_PUBLIC_KEY, WireArgs.object().put("privateKey", privateKey)).asText();
    }

    @Override
    public String encryptDM(String plaintext, String recipientPubkey, String senderPrivateKey) {
        ObjectNode args = WireArgs.object()
                .put("plaintext", plaintext)
                .put("recipientPubkey", recipientPubkey)
                .put("senderPrivateKey", senderPrivateKey);
        return call(CryptoOperation.ENCRYPT_DM, args).asText();
    }

    @Override
    public String decryptDM(String ciphertext, String senderPubkey, String recipientPrivateKey) {
        ObjectNode args = WireArgs.object()
                .put("ciphertext", ciphertext)
                .put("senderPubkey", senderPubkey)
                .put("recipientPrivateKey", recipientPrivateKey);
        return call(CryptoOperation.DECRYPT_DM, args).asText();
    }

    @Override
    public NostrEvent signEvent(UnsignedEvent event, String privateKey) {
        ObjectNode args = WireArgs.object().put("privateKey", privateKey);
        args.set("event", Jsons.compact().valueToTree(event));
        return as(call(CryptoOperation.SIGN_EVENT, args), NostrEvent.class);
    }

    @Override
    public boolean verifyEventSignature(NostrEvent event) {
        ObjectNode args = WireArgs.object();
        args.set("event", Jsons.compact().valueToTree(event));
        try {
            return call(CryptoOperation.VERIFY_EVENT_SIGNATURE, args).asBoolean(false);
        } catch (ObscurException e) {
            return false;
        }
    }

    @Override
    public NostrEvent encryptGiftWrap(UnsignedEvent rumor, String senderPrivateKey, String recipientPubkey) {
        ObjectNode args = WireArgs.object()
                .put("senderPrivateKey", senderPrivateKey)
                .put("recipientPubkey", recipientPubkey);
        args.set("rumor", Jsons.compact().valueToTree(rumor));
        return as(call(CryptoOperation.ENCRYPT_GIFT_WRAP, args), NostrEvent.class);
    }

    @Override
    public NostrEvent decryptGiftWrap(NostrEvent wrap, String recipientPrivateKey) {
        ObjectNode args = WireArgs.object().put("recipientPrivateKey", recipientPrivateKey);
        args.set("wrap", Jsons.compact().valueToTree(wrap));
        return as(call(CryptoOperation.DECRYPT_GIFT_WRAP, args), NostrEvent.class);
    }

    @Override
    public byte[] deriveSharedSecret(String privateKey, String publicKey) {
        ObjectNode args = WireArgs.object().put("privateKey", privateKey).put("publicKey", publicKey);
        return WireArgs.bytes(wrapResult(call(CryptoOperation.DERIVE_SHARED_SECRET, args)), "value");
    }

    @Override
    public String generateInviteId() {
        return call(CryptoOperation.GENERATE_INVITE_ID, WireArgs.object()).asText();
    }

    @Override
    public String signInviteData(InvitePayload payload, String privateKey) {
        ObjectNode args = WireArgs.object().put("privateKey", privateKey);
        args.set("payload", Jsons.compact().valueToTree(payload));
        return call(CryptoOperation.SIGN_INVITE_DATA, args).asText();
    }

    @Override
    public boolean verifyInviteSignature(InvitePayload payload, String signature, String publicKey) {
        ObjectNode args = WireArgs.object().put("signature", signature).put("publicKey", publicKey);
        args.set("payload", Jsons.compact().valueToTree(payload));
        try {
            return call(CryptoOperation.VERIFY_INVITE_SIGNATURE, args).asBoolean(false);
        } catch (ObscurException e) {
            return false;
        }
    }

    @Override
    public String encryptInviteData(String plaintext, byte[] key) {
        ObjectNode args = WireArgs.object().put("plaintext", plaintext).put("key", WireArgs.base64(key));
        return call(CryptoOperation.ENCRYPT_INVITE_DATA, args).asText();
    }

    @Override
    public String decryptInviteData(String payload, byte[] key) {
        ObjectNode args = WireArgs.object().put("payload", payload).put("key", WireArgs.base64(key));
        return call(CryptoOperation.DECRYPT_INVITE_DATA, args).asText();
    }

    @Override
    public byte[] generateSecureRandom(int length) {
        if (length <= 0) {
            throw new ValidationException("Random length must be a positive integer, got " + length);
        }
        JsonNode result = call(CryptoOperation.GENERATE_SECURE_RANDOM, WireArgs.object().put("length", length));
        return WireArgs.bytes(wrapResult(result), "value");
    }

    @Override
    public byte[] deriveStorageKey(String identitySecret) {
        JsonNode result = call(CryptoOperation.DERIVE_STORAGE_KEY, WireArgs.object().put("identitySecret", identitySecret));
        return WireArgs.bytes(wrapResult(result), "value");
    }

    @Override
    public void close() {
        channel.close();
        pending.values().forEach(f -> f.completeExceptionally(new CryptoException("Crypto worker closed")));
        pending.clear();
    }

    private JsonNode call(CryptoOperation operation, ObjectNode args) {
        String correlationId = UUID.randomUUID().toString();
        CompletableFuture<CryptoResponse> future = new CompletableFuture<>();
        pending.put(correlationId, future);
        try {
            channel.send(Jsons.toCompactJson(new CryptoRequest(correlationId, operation, args)));
            CryptoResponse response = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (!response.ok()) {
                throw remoteFailure(response);
            }
            return response.result() == null ? Jsons.compact().nullNode() : response.result();
        } catch (TimeoutException e) {
            auditLogger.log(AuditLogger.AuditEvent.system(
                    "crypto.worker.timeout",
                    "crypto/" + operation.wireName(),
                    "timeout",
                    Map.of("timeout_ms", timeoutMs, "correlationId", correlationId)
            ));
            throw new BridgeTimeoutException(operation.wireName(), timeoutMs);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ObscurException obscur) {
                throw obscur;
            }
            throw new CryptoException("Crypto worker call " + operation.wireName() + " failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CryptoException("Interrupted while waiting for crypto worker", e);
        } finally {
            pending.remove(correlationId);
        }
    }

    private void onResponse(String responseJson) {
        CryptoResponse response;
        try {
            response = Jsons.fromJson(responseJson, CryptoResponse.class);
        } catch (ValidationException e) {
            auditLogger.log(AuditLogger.AuditEvent.system(
                    "crypto.worker.bad_response", "crypto/worker", "dropped", Map.of("error", e)));
            return;
        }
        CompletableFuture<CryptoResponse> future = response.correlationId() == null
                ? null
                : pending.remove(response.correlationId());
        if (future == null) {
            auditLogger.log(AuditLogger.AuditEvent.system(
                    "crypto.worker.late_response", "crypto/worker", "dropped",
                    Map.of("correlationId", String.valueOf(response.correlationId()))));
            return;
        }
        future.complete(response);
    }

    private static ObscurException remoteFailure(CryptoResponse response) {
        String message = response.errorMessage() == null ? "crypto worker error" : response.errorMessage();
        if (ValidationException.class.getSimpleName().equals(response.errorType())) {
            return new ValidationException(message);
        }
        return new CryptoException(message);
    }

    private static JsonNode wrapResult(JsonNode result) {
        return WireArgs.object().set("value", result);
    }

    private static <T> T as(JsonNode node, Class<T> type) {
        try {
            return Jsons.compact().treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new CryptoException("Crypto worker returned a malformed " + type.getSimpleName(), e);
        }
    }
}
