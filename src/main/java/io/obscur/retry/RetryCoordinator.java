package io.obscur.retry;

import io.obscur.error.ValidationException;
import io.obscur.model.OutgoingMessage;
import io.obscur.observability.AuditLogger;
import io.obscur.security.SecurityUtils;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Backoff scheduling for outgoing messages and per-relay circuit breakers.
 *
 * <p>Each message id owns at most one armed timer. Breaker counters for one
 * relay are updated atomically; relays never share state. An open breaker only
 * closes again through {@link #recordRelaySuccess} or
 * {@link #resetCircuitBreaker}.
 */
public final class RetryCoordinator implements AutoCloseable {
    private static final AtomicInteger THREAD_SEQ = new AtomicInteger();

    private final RetryPolicy policy;
    private final Clock clock;
    private final AuditLogger audit;
    private final ScheduledExecutorService scheduler;
    private final ConcurrentHashMap<String, ScheduledFuture<?>> timers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CircuitBreakerSnapshot> breakers = new ConcurrentHashMap<>();

    public RetryCoordinator() {
        this(RetryPolicy.defaults(), Clock.systemUTC(), AuditLogger.disabled());
    }

    public RetryCoordinator(RetryPolicy policy, Clock clock, AuditLogger audit) {
        this.policy = policy;
        this.clock = clock;
        this.audit = audit;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "obscur-retry-" + THREAD_SEQ.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public RetryPolicy policy() {
        return policy;
    }

    public RetryDecision shouldRetry(OutgoingMessage message, Throwable error) {
        if (message == null) {
            throw new ValidationException("message must not be null");
        }
        if (message.retryCount() >= policy.maxRetries()) {
            return RetryDecision.giveUp(RetryDecision.MAX_RETRIES_EXCEEDED);
        }
        return RetryDecision.retryAt(computeNextRetry(message.retryCount()));
    }

    public long computeNextRetry(int retryCount) {
        return computeNextRetry(retryCount, clock.millis());
    }

    /** {@code base + min(baseDelay * multiplier^retryCount, maxDelay) + uniform[0, jitter]}. */
    public long computeNextRetry(int retryCount, long baseMs) {
        if (retryCount < 0) {
            throw new ValidationException("retryCount must be >= 0");
        }
        double raw = policy.baseDelayMs() * Math.pow(policy.backoffMultiplier(), retryCount);
        long delay = raw >= policy.maxDelayMs() ? policy.maxDelayMs() : (long) raw;
        long jitter = policy.jitterMs() == 0 ? 0L : ThreadLocalRandom.current().nextLong(policy.jitterMs() + 1);
        return baseMs + delay + jitter;
    }

    /**
     * Arms the timer for {@code messageId}, replacing any timer already armed
     * for it. A canceled timer never runs its callback.
     */
    public void scheduleRetry(String messageId, long atMs, Runnable callback) {
        if (messageId == null || messageId.isBlank()) {
            throw new ValidationException("messageId must not be blank");
        }
        if (callback == null) {
            throw new ValidationException("callback must not be null");
        }
        long delay = Math.max(0L, atMs - clock.millis());
        timers.compute(messageId, (id, previous) -> {
            if (previous != null) {
                previous.cancel(false);
            }
            ScheduledFuture<?>[] self = new ScheduledFuture<?>[1];
            self[0] = scheduler.schedule(() -> fire(id, callback, self), delay, TimeUnit.MILLISECONDS);
            return self[0];
        });
        audit.log(AuditLogger.AuditEvent.system("retry.scheduled", messageId, "ok",
                Map.of("nextRetryAt", atMs, "delayMs", delay)));
    }

    public boolean cancelRetry(String messageId) {
        ScheduledFuture<?> timer = messageId == null ? null : timers.remove(messageId);
        return timer != null && timer.cancel(false);
    }

    public int pendingRetries() {
        return timers.size();
    }

    /** Cancels every armed timer and drops breakers idle past the retention window. */
    public void cleanup() {
        for (String id : new ArrayList<>(timers.keySet())) {
            cancelRetry(id);
        }
        long cutoff = clock.millis() - policy.breakerRetentionMs();
        breakers.entrySet().removeIf(entry -> entry.getValue().lastActivityAt() < cutoff);
    }

    public void recordRelayFailure(String relayUrl, String error) {
        requireRelay(relayUrl);
        long now = clock.millis();
        boolean[] opened = new boolean[1];
        CircuitBreakerSnapshot updated = breakers.compute(relayUrl, (url, current) -> {
            CircuitBreakerSnapshot base = current == null ? CircuitBreakerSnapshot.fresh(url, now) : current;
            int failures = base.failureCount() + 1;
            BreakerState state = base.state();
            long changedAt = base.lastChangeAt();
            if (state == BreakerState.CLOSED && failures >= policy.failureThreshold()) {
                state = BreakerState.OPEN;
                changedAt = now;
                opened[0] = true;
            }
            return new CircuitBreakerSnapshot(url, failures, 0L, state, changedAt, now);
        });
        if (opened[0]) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("failureCount", updated.failureCount());
            if (error != null) {
                details.put("error", error);
            }
            audit.log(AuditLogger.AuditEvent.system("relay.breaker.open", relayUrl, "open", details));
        }
    }

    public void recordRelaySuccess(String relayUrl) {
        requireRelay(relayUrl);
        long now = clock.millis();
        boolean[] closed = new boolean[1];
        CircuitBreakerSnapshot updated = breakers.compute(relayUrl, (url, current) -> {
            CircuitBreakerSnapshot base = current == null ? CircuitBreakerSnapshot.fresh(url, now) : current;
            int failures = Math.max(0, base.failureCount() - 1);
            BreakerState state = base.state();
            long changedAt = base.lastChangeAt();
            if (state == BreakerState.OPEN && failures < policy.failureThreshold()) {
                state = BreakerState.CLOSED;
                changedAt = now;
                closed[0] = true;
            }
            return new CircuitBreakerSnapshot(url, failures, base.successCount() + 1, state, changedAt, now);
        });
        if (closed[0]) {
            audit.log(AuditLogger.AuditEvent.system("relay.breaker.close", relayUrl, "closed",
                    Map.of("failureCount", updated.failureCount(), "successCount", updated.successCount())));
        }
    }

    public boolean isRelayAvailable(String relayUrl) {
        if (relayUrl == null) {
            return false;
        }
        CircuitBreakerSnapshot breaker = breakers.get(relayUrl);
        return breaker == null || !breaker.isOpen();
    }

    public List<String> getAvailableRelays(List<String> relayUrls) {
        List<String> out = new ArrayList<>();
        if (relayUrls == null) {
            return out;
        }
        for (String url : relayUrls) {
            if (isRelayAvailable(url)) {
                out.add(url);
            }
        }
        return out;
    }

    public Optional<CircuitBreakerSnapshot> circuitBreakerStatus(String relayUrl) {
        return relayUrl == null ? Optional.empty() : Optional.ofNullable(breakers.get(relayUrl));
    }

    public Map<String, CircuitBreakerSnapshot> circuitBreakerStatus() {
        return Map.copyOf(breakers);
    }

    public void resetCircuitBreaker(String relayUrl) {
        requireRelay(relayUrl);
        if (breakers.remove(relayUrl) != null) {
            audit.log(AuditLogger.AuditEvent.system("relay.breaker.reset", relayUrl, "closed", Map.of()));
        }
    }

    @Override
    public void close() {
        cleanup();
        scheduler.shutdownNow();
    }

    private void fire(String messageId, Runnable callback, ScheduledFuture<?>[] self) {
        // Read the handle under the map lock; it is assigned inside compute().
        timers.computeIfPresent(messageId, (id, armed) -> armed == self[0] ? null : armed);
        try {
            callback.run();
        } catch (RuntimeException e) {
            audit.log(AuditLogger.AuditEvent.system("retry.callback", messageId, "error",
                    Map.of("error", SecurityUtils.sanitizeForLogging(e))));
        }
    }

    private static void requireRelay(String relayUrl) {
        if (relayUrl == null || relayUrl.isBlank()) {
            throw new ValidationException("relayUrl must not be blank");
        }
    }
}
