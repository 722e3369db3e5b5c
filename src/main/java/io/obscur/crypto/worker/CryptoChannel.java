package io.obscur.crypto.worker;

import java.util.function.Consumer;

/**
 * Transport between {@link WorkerCryptoService} and a {@link CryptoWorker}.
 * Only serialized envelopes cross it.
 */
public interface CryptoChannel extends AutoCloseable {

    void send(String requestJson);

    void onResponse(Consumer<String> listener);

    @Override
    void close();
}
