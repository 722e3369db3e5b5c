package io.obscur.crypto;

import io.obscur.config.ObscurSettings;
import io.obscur.crypto.worker.CryptoWorker;
import io.obscur.crypto.worker.InProcessCryptoChannel;
import io.obscur.crypto.worker.WorkerCryptoService;
import io.obscur.error.ValidationException;
import io.obscur.observability.AuditLogger;

/**
 * Picks the crypto backend once at startup. The returned instance is passed to
 * consumers explicitly; nothing looks it up globally.
 */
public final class CryptoServices {
    private CryptoServices() {
    }

    public static CryptoService create(ObscurSettings settings, NativeKeystoreBridge bridge, AuditLogger auditLogger) {
        return create(CryptoBackend.fromString(settings.cryptoBackend()), settings.bridgeTimeoutMs(), bridge, auditLogger);
    }

    public static CryptoService create(CryptoBackend backend, long bridgeTimeoutMs, NativeKeystoreBridge bridge, AuditLogger auditLogger) {
        return switch (backend) {
            case SOFTWARE -> new SoftwareCryptoService();
            case WORKER -> new WorkerCryptoService(
                    new InProcessCryptoChannel(new CryptoWorker(new SoftwareCryptoService())),
                    bridgeTimeoutMs,
                    auditLogger
            );
            case NATIVE -> {
                if (bridge == null) {
                    throw new ValidationException("Native crypto backend requires a keystore bridge");
                }
                yield new NativeCryptoService(new SoftwareCryptoService(), bridge, bridgeTimeoutMs, auditLogger);
            }
        };
    }
}
