package io.obscur.runtime;

import io.obscur.config.ObscurConfig;
import io.obscur.config.ObscurSettings;
import io.obscur.crypto.CryptoService;
import io.obscur.crypto.CryptoServices;
import io.obscur.crypto.NativeKeystoreBridge;
import io.obscur.observability.AuditLogger;
import io.obscur.retry.RelayPublisher;
import io.obscur.retry.RetryCoordinator;
import io.obscur.retry.RetryDispatcher;
import io.obscur.retry.RetryPolicy;
import io.obscur.storage.Database;
import io.obscur.storage.MessageStore;
import io.obscur.storage.SqliteDocumentStore;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * One identity's messaging core: settings, audit trail, durable store, crypto
 * backend and retry machinery, built once and closed together.
 */
public final class ObscurRuntime implements AutoCloseable {
    private final ObscurConfig config;
    private final ObscurSettings settings;
    private final AuditLogger auditLogger;
    private final Database database;
    private final CryptoService crypto;
    private final AtomicBoolean encryptAtRest;
    private final MessageStore messageStore;
    private final RetryCoordinator retryCoordinator;
    private final RetryDispatcher retryDispatcher;

    public ObscurRuntime(
            ObscurConfig config,
            String identitySecret,
            RelayPublisher publisher,
            Supplier<List<String>> relays,
            NativeKeystoreBridge bridge,
            RetryDispatcher.Listener listener
    ) {
        this(config, identitySecret, publisher, relays, bridge, listener, Clock.systemUTC());
    }

    public ObscurRuntime(
            ObscurConfig config,
            String identitySecret,
            RelayPublisher publisher,
            Supplier<List<String>> relays,
            NativeKeystoreBridge bridge,
            RetryDispatcher.Listener listener,
            Clock clock
    ) {
        this.config = config;
        this.settings = ObscurSettings.load(config.settingsFile());
        this.auditLogger = new AuditLogger(config.auditFile(), config.identity(), settings.auditSigningSecret(), clock);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("settingsFile", config.settingsFile().toString());
        details.put("cryptoBackend", settings.cryptoBackend());
        details.put("encryptStorageAtRest", settings.encryptStorageAtRest());
        details.put("maxRetries", settings.maxRetries());
        auditLogger.log(AuditLogger.AuditEvent.system("runtime.settings.load", config.identity(), "ok", details));

        this.database = new Database(config);
        this.database.init();
        this.crypto = CryptoServices.create(settings, bridge, auditLogger);
        this.encryptAtRest = new AtomicBoolean(settings.encryptStorageAtRest());
        this.messageStore = new MessageStore(
                new SqliteDocumentStore(database, clock),
                crypto,
                identitySecret,
                encryptAtRest::get,
                settings,
                clock,
                auditLogger
        );
        this.retryCoordinator = new RetryCoordinator(RetryPolicy.from(settings), clock, auditLogger);
        this.retryDispatcher = new RetryDispatcher(messageStore, retryCoordinator, publisher, relays, listener, clock, auditLogger);
    }

    /** Re-arms retry timers for entries queued before the last shutdown. */
    public int resume() {
        return retryDispatcher.resumePending();
    }

    public void setEncryptStorageAtRest(boolean enabled) {
        if (encryptAtRest.getAndSet(enabled) != enabled) {
            auditLogger.log(AuditLogger.AuditEvent.system("store.at_rest.toggle", config.identity(), "ok",
                    Map.of("encryptStorageAtRest", enabled)));
        }
    }

    public ObscurConfig config() {
        return config;
    }

    public ObscurSettings settings() {
        return settings;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    public Database database() {
        return database;
    }

    public CryptoService crypto() {
        return crypto;
    }

    public MessageStore messageStore() {
        return messageStore;
    }

    public RetryCoordinator retryCoordinator() {
        return retryCoordinator;
    }

    public RetryDispatcher retryDispatcher() {
        return retryDispatcher;
    }

    @Override
    public void close() {
        retryCoordinator.close();
        crypto.close();
    }
}
