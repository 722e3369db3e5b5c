package io.obscur.crypto;

import io.obscur.error.BridgeTimeoutException;
import io.obscur.error.CryptoException;
import io.obscur.error.ObscurException;
import io.obscur.error.ValidationException;
import io.obscur.model.InvitePayload;
import io.obscur.model.Keypair;
import io.obscur.model.NostrEvent;
import io.obscur.model.UnsignedEvent;
import io.obscur.observability.AuditLogger;
import io.obscur.util.Hashing;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Routes {@code native:<handle>} keys to the OS keystore and everything else
 * to the wrapped {@link CryptoService}. Every bridge call has a deadline; a
 * call that misses it fails closed with {@link BridgeTimeoutException}.
 * Gift wrap layering is done here so the keystore only ever sees NIP-44
 * payloads, never the rumor.
 */
public final class NativeCryptoService implements CryptoService {
    private final CryptoService software;
    private final GiftWraps giftWraps;
    private final NativeKeystoreBridge bridge;
    private final long timeoutMs;
    private final AuditLogger auditLogger;
    private final ExecutorService bridgeExecutor;

    public NativeCryptoService(CryptoService software, NativeKeystoreBridge bridge, long timeoutMs, AuditLogger auditLogger) {
        this(software, bridge, timeoutMs, auditLogger, new SecureRandom(), Clock.systemUTC());
    }

    public NativeCryptoService(
            CryptoService software,
            NativeKeystoreBridge bridge,
            long timeoutMs,
            AuditLogger auditLogger,
            SecureRandom secureRandom,
            Clock clock
    ) {
        if (software == null) {
            throw new ValidationException("software crypto service must not be null");
        }
        if (bridge == null) {
            throw new ValidationException("native keystore bridge must not be null");
        }
        if (timeoutMs <= 0L) {
            throw new ValidationException("bridge timeout must be > 0");
        }
        this.software = software;
        this.giftWraps = new GiftWraps(new Nip44Cipher(secureRandom), secureRandom, clock);
        this.bridge = bridge;
        this.timeoutMs = timeoutMs;
        this.auditLogger = auditLogger == null ? AuditLogger.disabled() : auditLogger;
        AtomicInteger seq = new AtomicInteger();
        this.bridgeExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "obscur-native-bridge-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public Keypair generateKeyPair() {
        try {
            String handle = call("generateKey", bridge::generateKey);
            String pubkey = call("publicKey", () -> bridge.publicKey(handle));
            if (!isValidPubkey(pubkey)) {
                throw new CryptoException("Native keystore returned an invalid public key");
            }
            return new Keypair(normalizeKey(pubkey), Keypair.nativeHandle(handle));
        } catch (ObscurException e) {
            auditLogger.log(AuditLogger.AuditEvent.system(
                    "crypto.native.fallback",
                    "crypto/generateKeyPair",
                    "software",
                    Map.of("error", e)
            ));
            return software.generateKeyPair();
        }
    }

    @Override
    public String derivePublicKey(String privateKey) {
        if (!Keypair.isNativeHandle(privateKey)) {
            return software.derivePublicKey(privateKey);
        }
        String handle = handleOf(privateKey);
        return normalizeKey(call("publicKey", () -> bridge.publicKey(handle)));
    }

    @Override
    public String encryptDM(String plaintext, String recipientPubkey, String senderPrivateKey) {
        if (!Keypair.isNativeHandle(senderPrivateKey)) {
            return software.encryptDM(plaintext, recipientPubkey, senderPrivateKey);
        }
        String handle = handleOf(senderPrivateKey);
        return call("encryptNip04", () -> bridge.encryptNip04(handle, recipientPubkey, plaintext));
    }

    @Override
    public String decryptDM(String ciphertext, String senderPubkey, String recipientPrivateKey) {
        if (!Keypair.isNativeHandle(recipientPrivateKey)) {
            return software.decryptDM(ciphertext, senderPubkey, recipientPrivateKey);
        }
        String handle = handleOf(recipientPrivateKey);
        return call("decryptNip04", () -> bridge.decryptNip04(handle, senderPubkey, ciphertext));
    }

    @Override
    public NostrEvent signEvent(UnsignedEvent event, String privateKey) {
        if (!Keypair.isNativeHandle(privateKey)) {
            return software.signEvent(event, privateKey);
        }
        if (event == null) {
            throw new ValidationException("event must not be null");
        }
        String pubkey = derivePublicKey(privateKey);
        if (event.pubkey() != null && !event.pubkey().equalsIgnoreCase(pubkey)) {
            throw new ValidationException("Event pubkey does not match the signing key");
        }
        UnsignedEvent bound = event.withPubkey(pubkey);
        byte[] id = NostrEvents.computeIdBytes(bound);
        String handle = handleOf(privateKey);
        byte[] signature = call("signSchnorr", () -> bridge.signSchnorr(handle, id));
        NostrEvent signed = NostrEvents.assemble(bound, id, signature);
        if (!NostrEvents.verify(signed)) {
            throw new CryptoException("Native keystore produced an invalid signature");
        }
        return signed;
    }

    @Override
    public boolean verifyEventSignature(NostrEvent event) {
        return software.verifyEventSignature(event);
    }

    @Override
    public NostrEvent encryptGiftWrap(UnsignedEvent rumor, String senderPrivateKey, String recipientPubkey) {
        return giftWraps.wrap(signEvent(rumor, senderPrivateKey), recipientPubkey);
    }

    @Override
    public NostrEvent decryptGiftWrap(NostrEvent wrap, String recipientPrivateKey) {
        if (!Keypair.isNativeHandle(recipientPrivateKey)) {
            return software.decryptGiftWrap(wrap, recipientPrivateKey);
        }
        String handle = handleOf(recipientPrivateKey);
        return giftWraps.unwrap(wrap, (counterparty, payload) ->
                call("decryptNip44", () -> bridge.decryptNip44(handle, counterparty, payload)));
    }

    @Override
    public byte[] deriveSharedSecret(String privateKey, String publicKey) {
        if (Keypair.isNativeHandle(privateKey)) {
            throw new CryptoException("Shared secrets of keystore-held keys cannot be exported");
        }
        return software.deriveSharedSecret(privateKey, publicKey);
    }

    @Override
    public String generateInviteId() {
        return software.generateInviteId();
    }

    @Override
    public String signInviteData(InvitePayload payload, String privateKey) {
        if (!Keypair.isNativeHandle(privateKey)) {
            return software.signInviteData(payload, privateKey);
        }
        if (payload == null) {
            throw new ValidationException("invite payload must not be null");
        }
        byte[] digest = Invites.digest(payload);
        String handle = handleOf(privateKey);
        return Hashing.toHex(call("signSchnorr", () -> bridge.signSchnorr(handle, digest)));
    }

    @Override
    public boolean verifyInviteSignature(InvitePayload payload, String signature, String publicKey) {
        return software.verifyInviteSignature(payload, signature, publicKey);
    }

    @Override
    public String encryptInviteData(String plaintext, byte[] key) {
        return software.encryptInviteData(plaintext, key);
    }

    @Override
    public String decryptInviteData(String payload, byte[] key) {
        return software.decryptInviteData(payload, key);
    }

    @Override
    public byte[] generateSecureRandom(int length) {
        return software.generateSecureRandom(length);
    }

    @Override
    public byte[] deriveStorageKey(String identitySecret) {
        return software.deriveStorageKey(identitySecret);
    }

    @Override
    public void close() {
        bridgeExecutor.shutdownNow();
        software.close();
    }

    private <T> T call(String operation, Callable<T> body) {
        Future<T> future = bridgeExecutor.submit(body);
        try {
            T result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (result == null) {
                throw new CryptoException("Native bridge returned no result for " + operation);
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            auditLogger.log(AuditLogger.AuditEvent.system(
                    "crypto.native.timeout",
                    "crypto/" + operation,
                    "timeout",
                    Map.of("timeout_ms", timeoutMs)
            ));
            throw new BridgeTimeoutException(operation, timeoutMs);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ObscurException obscur) {
                throw obscur;
            }
            throw new CryptoException("Native bridge call " + operation + " failed", cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CryptoException("Interrupted while waiting for native bridge call " + operation, e);
        }
    }

    private static String handleOf(String privateKey) {
        String handle = privateKey.substring(Keypair.NATIVE_PREFIX.length());
        if (handle.isBlank()) {
            throw new ValidationException("Native key handle must not be blank");
        }
        return handle;
    }
}
