package io.obscur.crypto.worker;

import io.obscur.error.CryptoException;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Runs a {@link CryptoWorker} on one dedicated thread, so requests are served
 * in order and never on the caller's thread.
 */
public final class InProcessCryptoChannel implements CryptoChannel {
    private final CryptoWorker worker;
    private final ExecutorService workerThread;
    private volatile Consumer<String> listener;

    public InProcessCryptoChannel(CryptoWorker worker) {
        this.worker = worker;
        this.workerThread = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "obscur-crypto-worker");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void send(String requestJson) {
        Consumer<String> target = listener;
        if (target == null) {
            throw new IllegalStateException("No response listener registered on crypto channel");
        }
        try {
            workerThread.execute(() -> target.accept(worker.handle(requestJson)));
        } catch (RejectedExecutionException e) {
            throw new CryptoException("Crypto worker channel is closed", e);
        }
    }

    @Override
    public void onResponse(Consumer<String> listener) {
        this.listener = listener;
    }

    @Override
    public void close() {
        workerThread.shutdownNow();
    }
}
