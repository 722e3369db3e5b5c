package io.obscur.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.obscur.config.ObscurSettings;
import io.obscur.crypto.CryptoService;
import io.obscur.error.CryptoException;
import io.obscur.error.StorageException;
import io.obscur.error.ValidationException;
import io.obscur.model.Message;
import io.obscur.model.MessageStatus;
import io.obscur.model.OutgoingMessage;
import io.obscur.model.PaginationOptions;
import io.obscur.model.StorageStats;
import io.obscur.observability.AuditLogger;
import io.obscur.security.AesGcm;
import io.obscur.util.Jsons;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Per-identity message log and outgoing retry queue over a {@link DocumentStore}.
 *
 * <p>With at-rest encryption on, the sensitive fields of a record are bundled
 * into a single AES-GCM blob ({@code encryptedData}) and {@code content} holds
 * {@link #ENCRYPTED_SENTINEL}. The {@code isEncrypted} flag written with each
 * record decides how it is read back, so flipping the setting only affects
 * later writes.
 */
public final class MessageStore {
    public static final String ENCRYPTED_SENTINEL = "[ENCRYPTED]";
    private static final List<String> MESSAGE_SECRET_FIELDS = List.of("content", "encryptedContent", "attachments", "replyTo");
    private static final List<String> QUEUE_SECRET_FIELDS = List.of("content", "signedEvent");
    private static final Comparator<ObjectNode> BY_TIMESTAMP = Comparator
            .comparingLong((ObjectNode doc) -> doc.path("timestamp").asLong())
            .thenComparing(doc -> doc.path("id").asText());

    private final DocumentStore documents;
    private final byte[] storageKey;
    private final BooleanSupplier encryptAtRest;
    private final int maxRetries;
    private final int maxMessagesPerConversation;
    private final Clock clock;
    private final AuditLogger audit;
    private final ConcurrentHashMap<String, LockRef> locks = new ConcurrentHashMap<>();

    public MessageStore(DocumentStore documents, CryptoService crypto, String identitySecret, ObscurSettings settings) {
        this(documents, crypto, identitySecret, settings::encryptStorageAtRest, settings, Clock.systemUTC(), AuditLogger.disabled());
    }

    public MessageStore(
            DocumentStore documents,
            CryptoService crypto,
            String identitySecret,
            BooleanSupplier encryptAtRest,
            ObscurSettings settings,
            Clock clock,
            AuditLogger audit
    ) {
        if (documents == null) {
            throw new ValidationException("document store must not be null");
        }
        this.documents = documents;
        this.storageKey = identitySecret == null || identitySecret.isBlank() ? null : crypto.deriveStorageKey(identitySecret);
        this.encryptAtRest = encryptAtRest;
        this.maxRetries = settings.maxRetries();
        this.maxMessagesPerConversation = settings.maxMessagesPerConversation();
        this.clock = clock;
        this.audit = audit;
        if (encryptAtRest.getAsBoolean() && storageKey == null) {
            throw new ValidationException("At-rest encryption requires an identity secret");
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("encryptAtRest", encryptAtRest.getAsBoolean());
        details.put("keyed", storageKey != null);
        details.put("maxMessagesPerConversation", maxMessagesPerConversation);
        audit.log(AuditLogger.AuditEvent.system("store.at_rest.mode", "messages", "ok", details));
    }

    public void persistMessage(Message message) {
        if (message == null) {
            throw new ValidationException("message must not be null");
        }
        requireId(message.id());
        if (message.conversationId() == null || message.conversationId().isBlank()) {
            throw new ValidationException("message conversationId must not be blank");
        }
        ObjectNode doc = encodeMessage(message);
        withIdLock("messages/" + message.id(), () -> {
            documents.put(StoreName.MESSAGES, message.id(), doc);
            return null;
        });
        enforceConversationCap(message.conversationId(), message.id());
    }

    public Optional<Message> getMessage(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        return documents.get(StoreName.MESSAGES, id).map(this::decodeMessage);
    }

    /**
     * Messages of a conversation in ascending timestamp order. The window is
     * the newest {@code limit} entries strictly between {@code after} and
     * {@code before}, skipping the {@code offset} newest of those.
     */
    public List<Message> getMessages(String conversationId, PaginationOptions options) {
        if (conversationId == null || conversationId.isBlank()) {
            throw new ValidationException("conversationId must not be blank");
        }
        PaginationOptions opts = options == null ? PaginationOptions.all() : options;
        List<ObjectNode> docs = new ArrayList<>();
        for (ObjectNode doc : documents.getAllByIndex(IndexName.CONVERSATION_ID, IndexQuery.only(conversationId))) {
            long ts = doc.path("timestamp").asLong();
            if (opts.before() != null && ts >= opts.before()) {
                continue;
            }
            if (opts.after() != null && ts <= opts.after()) {
                continue;
            }
            docs.add(doc);
        }
        docs.sort(BY_TIMESTAMP.reversed());
        int from = Math.min(opts.offset() == null ? 0 : opts.offset(), docs.size());
        int to = opts.limit() == null ? docs.size() : Math.min(docs.size(), from + opts.limit());
        List<Message> out = new ArrayList<>(to - from);
        for (ObjectNode doc : docs.subList(from, to)) {
            out.add(decodeMessage(doc));
        }
        Collections.reverse(out);
        return out;
    }

    public List<Message> getMessages(String conversationId) {
        return getMessages(conversationId, PaginationOptions.all());
    }

    /**
     * Moves a stored message to {@code status}. Re-applying the current status
     * is a no-op; unknown ids and backward transitions are rejected.
     */
    public void updateMessageStatus(String id, MessageStatus status) {
        requireId(id);
        if (status == null) {
            throw new ValidationException("status must not be null");
        }
        withIdLock("messages/" + id, () -> {
            ObjectNode doc = documents.get(StoreName.MESSAGES, id)
                    .orElseThrow(() -> new ValidationException("Unknown message id: " + id));
            MessageStatus current = MessageStatus.fromWire(doc.path("status").asText(MessageStatus.SENDING.wireName()));
            if (current == status) {
                return null;
            }
            if (!current.canTransitionTo(status)) {
                throw new ValidationException("Illegal status transition " + current.wireName() + " -> " + status.wireName() + " for " + id);
            }
            doc.put("status", status.wireName());
            documents.put(StoreName.MESSAGES, id, doc);
            return null;
        });
    }

    public void queueOutgoingMessage(OutgoingMessage message) {
        if (message == null) {
            throw new ValidationException("outgoing message must not be null");
        }
        requireId(message.id());
        ObjectNode doc = encodeQueued(message);
        withIdLock("queue/" + message.id(), () -> {
            documents.put(StoreName.QUEUE, message.id(), doc);
            return null;
        });
    }

    public Optional<OutgoingMessage> getQueuedMessage(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        return documents.get(StoreName.QUEUE, id).map(this::decodeQueued);
    }

    /**
     * Entries due now. An entry's {@code retryCount} numbers the retry it is
     * waiting for, so an entry at {@code maxRetries} still has its last attempt pending.
     */
    public List<OutgoingMessage> getQueuedMessages() {
        return getQueuedMessages(clock.millis());
    }

    public List<OutgoingMessage> getQueuedMessages(long nowMs) {
        List<OutgoingMessage> out = new ArrayList<>();
        for (ObjectNode doc : documents.getAllByIndex(IndexName.NEXT_RETRY_AT, IndexQuery.atMost(nowMs))) {
            OutgoingMessage queued = decodeQueued(doc);
            if (queued.retryCount() <= maxRetries) {
                out.add(queued);
            }
        }
        return out;
    }

    public List<OutgoingMessage> getAllQueuedMessages() {
        List<OutgoingMessage> out = new ArrayList<>();
        for (ObjectNode doc : documents.getAllByIndex(IndexName.NEXT_RETRY_AT, IndexQuery.all())) {
            out.add(decodeQueued(doc));
        }
        return out;
    }

    public boolean removeFromQueue(String id) {
        requireId(id);
        return withIdLock("queue/" + id, () -> documents.delete(StoreName.QUEUE, id));
    }

    public OptionalLong getLastMessageTimestamp(String conversationId) {
        if (conversationId == null || conversationId.isBlank()) {
            throw new ValidationException("conversationId must not be blank");
        }
        OptionalLong last = OptionalLong.empty();
        for (ObjectNode doc : documents.getAllByIndex(IndexName.CONVERSATION_ID, IndexQuery.only(conversationId))) {
            long ts = doc.path("timestamp").asLong();
            if (last.isEmpty() || ts > last.getAsLong()) {
                last = OptionalLong.of(ts);
            }
        }
        return last;
    }

    /** Stamps {@code syncedAt} on every known id; returns how many were found. */
    public int markMessagesSynced(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return 0;
        }
        long now = clock.millis();
        int marked = 0;
        for (String id : ids) {
            if (id == null || id.isBlank()) {
                continue;
            }
            boolean found = withIdLock("messages/" + id, () -> {
                Optional<ObjectNode> doc = documents.get(StoreName.MESSAGES, id);
                if (doc.isEmpty()) {
                    return false;
                }
                doc.get().put("syncedAt", now);
                documents.put(StoreName.MESSAGES, id, doc.get());
                return true;
            });
            if (found) {
                marked++;
            }
        }
        return marked;
    }

    /** Deletes messages with a timestamp before {@code olderThanMs}. */
    public int cleanupOldMessages(long olderThanMs) {
        int removed = 0;
        for (ObjectNode doc : documents.getAllByIndex(IndexName.TIMESTAMP, IndexQuery.below(olderThanMs))) {
            String id = doc.path("id").asText();
            if (withIdLock("messages/" + id, () -> documents.delete(StoreName.MESSAGES, id))) {
                removed++;
            }
        }
        if (removed > 0) {
            audit.log(AuditLogger.AuditEvent.system("store.cleanup", "messages", "ok",
                    Map.of("olderThanMs", olderThanMs, "removed", removed)));
        }
        return removed;
    }

    public StorageStats getStorageUsage() {
        long total = 0;
        long bytes = 0;
        Long oldest = null;
        Long newest = null;
        for (ObjectNode doc : documents.getAll(StoreName.MESSAGES)) {
            total++;
            bytes += Jsons.toCompactJson(doc).getBytes(StandardCharsets.UTF_8).length;
            long ts = doc.path("timestamp").asLong();
            oldest = oldest == null ? ts : Math.min(oldest, ts);
            newest = newest == null ? ts : Math.max(newest, ts);
        }
        return new StorageStats(total, bytes, oldest, newest);
    }

    // The record just written is never the one pruned, even when it is older than the rest.
    private void enforceConversationCap(String conversationId, String keptId) {
        if (maxMessagesPerConversation <= 0) {
            return;
        }
        withIdLock("conversation/" + conversationId, () -> {
            IndexQuery query = IndexQuery.only(conversationId);
            long count = documents.countByIndex(IndexName.CONVERSATION_ID, query);
            if (count <= maxMessagesPerConversation) {
                return null;
            }
            List<ObjectNode> docs = documents.getAllByIndex(IndexName.CONVERSATION_ID, query);
            docs.sort(BY_TIMESTAMP);
            int excess = docs.size() - maxMessagesPerConversation;
            int removed = 0;
            for (ObjectNode doc : docs) {
                if (removed >= excess) {
                    break;
                }
                String id = doc.path("id").asText();
                if (id.equals(keptId)) {
                    continue;
                }
                withIdLock("messages/" + id, () -> documents.delete(StoreName.MESSAGES, id));
                removed++;
            }
            audit.log(AuditLogger.AuditEvent.system("store.conversation.pruned", conversationId, "ok",
                    Map.of("removed", removed, "cap", maxMessagesPerConversation)));
            return null;
        });
    }

    private ObjectNode encodeMessage(Message message) {
        ObjectNode doc = Jsons.mapper().valueToTree(message);
        return sealFields(doc, MESSAGE_SECRET_FIELDS);
    }

    private ObjectNode encodeQueued(OutgoingMessage message) {
        ObjectNode doc = Jsons.mapper().valueToTree(message);
        return sealFields(doc, QUEUE_SECRET_FIELDS);
    }

    private ObjectNode sealFields(ObjectNode doc, List<String> fields) {
        doc.remove("encryptedData");
        if (!encryptAtRest.getAsBoolean()) {
            doc.put("isEncrypted", false);
            return doc;
        }
        if (storageKey == null) {
            throw new ValidationException("At-rest encryption requires an identity secret");
        }
        ObjectNode bundle = Jsons.mapper().createObjectNode();
        for (String field : fields) {
            JsonNode value = doc.remove(field);
            if (value != null) {
                bundle.set(field, value);
            }
        }
        doc.put("encryptedData", AesGcm.encryptString(Jsons.toCompactJson(bundle), storageKey));
        doc.put("content", ENCRYPTED_SENTINEL);
        doc.put("isEncrypted", true);
        return doc;
    }

    private Message decodeMessage(ObjectNode stored) {
        ObjectNode doc = openFields(stored, MESSAGE_SECRET_FIELDS);
        JsonNode legacy = doc.remove("attachment");
        if (legacy != null && !legacy.isNull() && !doc.hasNonNull("attachments")) {
            ArrayNode attachments = doc.putArray("attachments");
            attachments.add(legacy);
        }
        return treeToValue(doc, Message.class);
    }

    private OutgoingMessage decodeQueued(ObjectNode stored) {
        return treeToValue(openFields(stored, QUEUE_SECRET_FIELDS), OutgoingMessage.class);
    }

    private ObjectNode openFields(ObjectNode stored, List<String> fields) {
        ObjectNode doc = stored.deepCopy();
        boolean encrypted = doc.path("isEncrypted").asBoolean(false);
        doc.remove("isEncrypted");
        JsonNode blob = doc.remove("encryptedData");
        if (!encrypted) {
            return doc;
        }
        if (blob == null || !blob.isTextual()) {
            throw new StorageException("Encrypted record " + doc.path("id").asText() + " has no encryptedData");
        }
        if (storageKey == null) {
            throw new CryptoException("Record " + doc.path("id").asText() + " is encrypted but no storage key is configured");
        }
        JsonNode bundle = Jsons.fromJson(AesGcm.decryptString(blob.asText(), storageKey), JsonNode.class);
        for (String field : fields) {
            doc.remove(field);
            JsonNode value = bundle.get(field);
            if (value != null) {
                doc.set(field, value);
            }
        }
        return doc;
    }

    private static <T> T treeToValue(ObjectNode doc, Class<T> type) {
        try {
            return Jsons.mapper().treeToValue(doc, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new StorageException("Stored " + type.getSimpleName() + " could not be decoded", e);
        }
    }

    private <T> T withIdLock(String key, Supplier<T> action) {
        LockRef ref = locks.compute(key, (k, existing) -> {
            LockRef r = existing == null ? new LockRef() : existing;
            r.refs++;
            return r;
        });
        ref.lock.lock();
        try {
            return action.get();
        } finally {
            ref.lock.unlock();
            locks.computeIfPresent(key, (k, r) -> --r.refs == 0 ? null : r);
        }
    }

    private static void requireId(String id) {
        if (id == null || id.isBlank()) {
            throw new ValidationException("id must not be blank");
        }
    }

    private static final class LockRef {
        private final ReentrantLock lock = new ReentrantLock();
        private int refs;
    }
}
