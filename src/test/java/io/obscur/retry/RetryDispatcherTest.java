package io.obscur.retry;

import io.obscur.config.ObscurSettings;
import io.obscur.crypto.SoftwareCryptoService;
import io.obscur.error.RetryExhaustedException;
import io.obscur.model.EventKinds;
import io.obscur.model.Message;
import io.obscur.model.MessageStatus;
import io.obscur.model.NostrEvent;
import io.obscur.model.OutgoingMessage;
import io.obscur.model.RelayResult;
import io.obscur.observability.AuditLogger;
import io.obscur.storage.InMemoryDocumentStore;
import io.obscur.storage.MessageStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

final class RetryDispatcherTest {
    private static final long NOW = 1_700_000_000_000L;
    private static final String RELAY_A = "wss://relay.a";
    private static final String RELAY_B = "wss://relay.b";
    private static final String CONVERSATION = "a".repeat(64) + ":" + "b".repeat(64);
    private static final RetryPolicy POLICY = new RetryPolicy(3, 60_000L, 600_000L, 2.0d, 0L, 5, 86_400_000L);

    @Test
    void failedSendIsRequeuedWithBackoff() {
        Fixture fx = new Fixture((event, relays) -> List.of());
        try (fx) {
            fx.store.persistMessage(message("m-1", MessageStatus.SENDING));

            RetryDecision decision = fx.dispatcher.handleSendFailure(outgoing("m-1", 0, signed()), new IllegalStateException("timeout"));

            Assertions.assertTrue(decision.shouldRetry());
            Assertions.assertEquals(NOW + 60_000L, decision.nextRetryAt());
            OutgoingMessage queued = fx.store.getQueuedMessage("m-1").orElseThrow();
            Assertions.assertEquals(1, queued.retryCount());
            Assertions.assertEquals(NOW + 60_000L, queued.nextRetryAt());
            Assertions.assertEquals(MessageStatus.QUEUED, fx.store.getMessage("m-1").orElseThrow().status());
            Assertions.assertEquals(1, fx.coordinator.pendingRetries());
        }
    }

    @Test
    void exhaustedSendIsFinalizedAsFailed() {
        Fixture fx = new Fixture((event, relays) -> List.of());
        try (fx) {
            fx.store.persistMessage(message("m-1", MessageStatus.QUEUED));
            OutgoingMessage last = outgoing("m-1", 3, signed());
            fx.store.queueOutgoingMessage(last);

            RetryDecision decision = fx.dispatcher.handleSendFailure(last, new IllegalStateException("timeout"));

            Assertions.assertFalse(decision.shouldRetry());
            Assertions.assertEquals(RetryDecision.MAX_RETRIES_EXCEEDED, decision.error());
            Assertions.assertTrue(fx.store.getQueuedMessage("m-1").isEmpty());
            Assertions.assertEquals(MessageStatus.FAILED, fx.store.getMessage("m-1").orElseThrow().status());
            Assertions.assertEquals(1, fx.listener.exhausted.size());
            RetryExhaustedException failure = fx.listener.exhausted.get(0);
            Assertions.assertEquals("m-1", failure.messageId());
            Assertions.assertEquals(3, failure.retryCount());
            Assertions.assertEquals(0, fx.coordinator.pendingRetries());
        }
    }

    @Test
    void attemptSkipsOpenRelaysAndAcceptsOnFirstSuccess() {
        List<List<String>> calls = new ArrayList<>();
        Fixture fx = new Fixture((event, relays) -> {
            calls.add(relays);
            return List.of(RelayResult.ok(RELAY_A, 12L));
        });
        try (fx) {
            fx.store.persistMessage(message("m-1", MessageStatus.QUEUED));
            fx.store.queueOutgoingMessage(outgoing("m-1", 1, signed()));
            for (int i = 0; i < 5; i++) {
                fx.coordinator.recordRelayFailure(RELAY_B, "down");
            }

            Assertions.assertTrue(fx.dispatcher.attempt("m-1"));

            Assertions.assertEquals(List.of(List.of(RELAY_A)), calls);
            Assertions.assertTrue(fx.store.getQueuedMessage("m-1").isEmpty());
            Assertions.assertEquals(MessageStatus.ACCEPTED, fx.store.getMessage("m-1").orElseThrow().status());
            Assertions.assertEquals(List.of("m-1"), fx.listener.accepted);
            Assertions.assertEquals(1L, fx.coordinator.circuitBreakerStatus(RELAY_A).orElseThrow().successCount());
        }
    }

    @Test
    void rejectedAttemptFeedsBreakersAndRequeues() {
        Fixture fx = new Fixture((event, relays) -> List.of(
                RelayResult.failed(RELAY_A, "blocked"),
                RelayResult.failed(RELAY_B, null)));
        try (fx) {
            fx.store.persistMessage(message("m-1", MessageStatus.QUEUED));
            fx.store.queueOutgoingMessage(outgoing("m-1", 0, signed()));

            Assertions.assertFalse(fx.dispatcher.attempt("m-1"));

            Assertions.assertEquals(1, fx.store.getQueuedMessage("m-1").orElseThrow().retryCount());
            Assertions.assertEquals(1, fx.coordinator.circuitBreakerStatus(RELAY_A).orElseThrow().failureCount());
            Assertions.assertEquals(1, fx.coordinator.circuitBreakerStatus(RELAY_B).orElseThrow().failureCount());
            Assertions.assertEquals(MessageStatus.QUEUED, fx.store.getMessage("m-1").orElseThrow().status());
            Assertions.assertTrue(fx.listener.accepted.isEmpty());
        }
    }

    @Test
    void throwingPublisherCountsAsFailureOnEveryTarget() {
        Fixture fx = new Fixture((event, relays) -> {
            throw new IllegalStateException("socket closed");
        });
        try (fx) {
            fx.store.queueOutgoingMessage(outgoing("m-1", 0, signed()));

            Assertions.assertFalse(fx.dispatcher.attempt("m-1"));

            Assertions.assertEquals(1, fx.coordinator.circuitBreakerStatus(RELAY_A).orElseThrow().failureCount());
            Assertions.assertEquals(1, fx.coordinator.circuitBreakerStatus(RELAY_B).orElseThrow().failureCount());
            Assertions.assertEquals(1, fx.store.getQueuedMessage("m-1").orElseThrow().retryCount());
        }
    }

    @Test
    void entryWithoutSignedEventCannotBeRetried() {
        Fixture fx = new Fixture((event, relays) -> List.of(RelayResult.ok(RELAY_A, 1L)));
        try (fx) {
            fx.store.persistMessage(message("m-1", MessageStatus.QUEUED));
            fx.store.queueOutgoingMessage(outgoing("m-1", 0, null));

            Assertions.assertFalse(fx.dispatcher.attempt("m-1"));
            Assertions.assertFalse(fx.dispatcher.attempt("unknown"));

            Assertions.assertEquals(MessageStatus.FAILED, fx.store.getMessage("m-1").orElseThrow().status());
            Assertions.assertEquals(1, fx.listener.exhausted.size());
        }
    }

    @Test
    void resumeArmsLiveEntriesAndFinalizesSpentOnes() {
        Fixture fx = new Fixture((event, relays) -> List.of());
        try (fx) {
            fx.store.queueOutgoingMessage(outgoing("live-1", 1, signed()));
            fx.store.queueOutgoingMessage(outgoing("live-2", 2, signed()));
            fx.store.queueOutgoingMessage(outgoing("spent", 4, signed()));

            Assertions.assertEquals(2, fx.dispatcher.resumePending());

            Assertions.assertEquals(2, fx.coordinator.pendingRetries());
            Assertions.assertTrue(fx.store.getQueuedMessage("spent").isEmpty());
            Assertions.assertEquals("spent", fx.listener.exhausted.get(0).messageId());
        }
    }

    @Test
    void finalRetryQueuedBeforeRestartStillRuns() {
        Fixture fx = new Fixture((event, relays) -> List.of());
        try (fx) {
            fx.store.persistMessage(message("m-1", MessageStatus.SENDING));
            fx.dispatcher.handleSendFailure(outgoing("m-1", 2, signed()), new IllegalStateException("timeout"));
            Assertions.assertEquals(3, fx.store.getQueuedMessage("m-1").orElseThrow().retryCount());
            Assertions.assertEquals(1, fx.store.getQueuedMessages(NOW + 600_000L).size());
            fx.coordinator.close();

            RecordingListener listener = new RecordingListener();
            try (RetryCoordinator restarted = new RetryCoordinator(POLICY, fx.clock, AuditLogger.disabled())) {
                RetryDispatcher dispatcher = new RetryDispatcher(fx.store, restarted,
                        (event, relays) -> List.of(RelayResult.ok(RELAY_A, 3L)), () -> List.of(RELAY_A), listener,
                        fx.clock, AuditLogger.disabled());

                Assertions.assertEquals(1, dispatcher.resumePending());
                Assertions.assertTrue(listener.exhausted.isEmpty());
                Assertions.assertTrue(dispatcher.attempt("m-1"));
                Assertions.assertEquals(MessageStatus.ACCEPTED, fx.store.getMessage("m-1").orElseThrow().status());
            }
        }
    }

    @Test
    void terminalMessagesKeepTheirStatus() {
        Fixture fx = new Fixture((event, relays) -> List.of());
        try (fx) {
            fx.store.persistMessage(message("m-1", MessageStatus.DELIVERED));

            fx.dispatcher.handleSendFailure(outgoing("m-1", 0, signed()), null);

            Assertions.assertEquals(MessageStatus.DELIVERED, fx.store.getMessage("m-1").orElseThrow().status());
            Assertions.assertTrue(fx.store.getQueuedMessage("m-1").isPresent());
        }
    }

    private static Message message(String id, MessageStatus status) {
        return Message.builder()
                .id(id)
                .conversationId(CONVERSATION)
                .content("hello")
                .timestamp(NOW)
                .outgoing(true)
                .status(status)
                .senderPubkey("a".repeat(64))
                .recipientPubkey("b".repeat(64))
                .build();
    }

    private static OutgoingMessage outgoing(String id, int retryCount, NostrEvent signed) {
        return new OutgoingMessage(id, CONVERSATION, "hello", "b".repeat(64), NOW, retryCount, NOW, signed);
    }

    private static NostrEvent signed() {
        return new NostrEvent("e".repeat(64), "a".repeat(64), NOW / 1000L, EventKinds.ENCRYPTED_DM,
                List.of(List.of("p", "b".repeat(64))), "opaque", "f".repeat(128));
    }

    private static final class RecordingListener implements RetryDispatcher.Listener {
        private final List<String> accepted = new CopyOnWriteArrayList<>();
        private final List<RetryExhaustedException> exhausted = new CopyOnWriteArrayList<>();

        @Override
        public void onAccepted(String messageId, List<RelayResult> results) {
            accepted.add(messageId);
        }

        @Override
        public void onExhausted(RetryExhaustedException failure) {
            exhausted.add(failure);
        }
    }

    private static final class Fixture implements AutoCloseable {
        private final MutableClock clock = new MutableClock(NOW);
        private final MessageStore store;
        private final RetryCoordinator coordinator;
        private final RecordingListener listener = new RecordingListener();
        private final RetryDispatcher dispatcher;

        private Fixture(RelayPublisher publisher) {
            this.store = new MessageStore(new InMemoryDocumentStore(), new SoftwareCryptoService(), "identity-secret",
                    () -> true, ObscurSettings.defaults(), clock, AuditLogger.disabled());
            this.coordinator = new RetryCoordinator(POLICY, clock, AuditLogger.disabled());
            this.dispatcher = new RetryDispatcher(store, coordinator, publisher, () -> List.of(RELAY_A, RELAY_B),
                    listener, clock, AuditLogger.disabled());
        }

        @Override
        public void close() {
            coordinator.close();
        }
    }
}
