package io.obscur.retry;

import io.obscur.error.ObscurException;
import io.obscur.error.RetryExhaustedException;
import io.obscur.error.ValidationException;
import io.obscur.model.Message;
import io.obscur.model.MessageStatus;
import io.obscur.model.OutgoingMessage;
import io.obscur.model.RelayResult;
import io.obscur.observability.AuditLogger;
import io.obscur.storage.MessageStore;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Drives the retry half of the send flow: a failed publish is re-queued with
 * backoff or finalized as {@code failed}; a due entry is republished to the
 * relays whose breakers are closed.
 */
public final class RetryDispatcher {
    private final MessageStore store;
    private final RetryCoordinator coordinator;
    private final RelayPublisher publisher;
    private final Supplier<List<String>> relays;
    private final Listener listener;
    private final Clock clock;
    private final AuditLogger audit;

    public RetryDispatcher(
            MessageStore store,
            RetryCoordinator coordinator,
            RelayPublisher publisher,
            Supplier<List<String>> relays,
            Listener listener,
            Clock clock,
            AuditLogger audit
    ) {
        this.store = store;
        this.coordinator = coordinator;
        this.publisher = publisher;
        this.relays = relays;
        this.listener = listener == null ? Listener.NOOP : listener;
        this.clock = clock;
        this.audit = audit;
    }

    public RetryDecision handleSendFailure(OutgoingMessage outgoing, Throwable error) {
        if (outgoing == null) {
            throw new ValidationException("outgoing message must not be null");
        }
        RetryDecision decision = coordinator.shouldRetry(outgoing, error);
        if (!decision.shouldRetry()) {
            exhaust(outgoing, decision.error());
            return decision;
        }
        long at = decision.nextRetryAt();
        OutgoingMessage requeued = outgoing.withRetry(outgoing.retryCount() + 1, at);
        store.queueOutgoingMessage(requeued);
        moveTo(outgoing.id(), MessageStatus.QUEUED);
        coordinator.scheduleRetry(outgoing.id(), at, () -> attempt(outgoing.id()));
        return decision;
    }

    /**
     * Republishes a queued entry. Returns {@code true} when at least one relay
     * accepted it; the entry then leaves the queue and the message becomes
     * {@code accepted}.
     */
    public boolean attempt(String messageId) {
        Optional<OutgoingMessage> found = store.getQueuedMessage(messageId);
        if (found.isEmpty()) {
            return false;
        }
        OutgoingMessage entry = found.get();
        if (entry.signedEvent() == null) {
            exhaust(entry, "Queued entry has no signed event");
            return false;
        }
        List<String> targets = coordinator.getAvailableRelays(relays.get());
        if (targets.isEmpty()) {
            handleSendFailure(entry, new ObscurException("No relay available"));
            return false;
        }
        List<RelayResult> results;
        try {
            results = publisher.publish(entry.signedEvent(), targets);
        } catch (RuntimeException e) {
            for (String url : targets) {
                coordinator.recordRelayFailure(url, e.getMessage());
            }
            handleSendFailure(entry, e);
            return false;
        }
        List<String> errors = new ArrayList<>();
        boolean accepted = false;
        for (RelayResult result : results == null ? List.<RelayResult>of() : results) {
            if (result.success()) {
                coordinator.recordRelaySuccess(result.relayUrl());
                accepted = true;
            } else {
                coordinator.recordRelayFailure(result.relayUrl(), result.error());
                errors.add(result.relayUrl() + ": " + (result.error() == null ? "rejected" : result.error()));
            }
        }
        if (!accepted) {
            handleSendFailure(entry, new ObscurException(errors.isEmpty() ? "No relay accepted the event" : String.join("; ", errors)));
            return false;
        }
        coordinator.cancelRetry(messageId);
        store.removeFromQueue(messageId);
        moveTo(messageId, MessageStatus.ACCEPTED);
        listener.onAccepted(messageId, results);
        return true;
    }

    /**
     * Re-arms timers for every queued entry, e.g. after a restart. An entry at
     * {@code maxRetries} still gets its final attempt. Returns the number armed.
     */
    public int resumePending() {
        int armed = 0;
        long now = clock.millis();
        for (OutgoingMessage entry : store.getAllQueuedMessages()) {
            if (entry.retryCount() > coordinator.policy().maxRetries()) {
                exhaust(entry, RetryDecision.MAX_RETRIES_EXCEEDED);
                continue;
            }
            String id = entry.id();
            coordinator.scheduleRetry(id, Math.max(now, entry.nextRetryAt()), () -> attempt(id));
            armed++;
        }
        return armed;
    }

    private void exhaust(OutgoingMessage outgoing, String reason) {
        coordinator.cancelRetry(outgoing.id());
        store.removeFromQueue(outgoing.id());
        moveTo(outgoing.id(), MessageStatus.FAILED);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("retryCount", outgoing.retryCount());
        details.put("reason", reason);
        audit.log(AuditLogger.AuditEvent.system("retry.exhausted", outgoing.id(), "failed", details));
        listener.onExhausted(new RetryExhaustedException(outgoing.id(), outgoing.retryCount(), reason));
    }

    // Queue entries may outlive their message record, and a message already
    // past the target status keeps its own.
    private void moveTo(String messageId, MessageStatus status) {
        Optional<Message> message = store.getMessage(messageId);
        if (message.isEmpty()) {
            return;
        }
        MessageStatus current = message.get().status();
        if (current != null && !current.canTransitionTo(status)) {
            audit.log(AuditLogger.AuditEvent.system("message.status.kept", messageId, "skipped",
                    Map.of("current", current.wireName(), "requested", status.wireName())));
            return;
        }
        store.updateMessageStatus(messageId, status);
    }

    public interface Listener {
        Listener NOOP = new Listener() {
        };

        default void onAccepted(String messageId, List<RelayResult> results) {
        }

        default void onExhausted(RetryExhaustedException failure) {
        }
    }
}
