package benor.messaging;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * MessageType is an extensible constant backed by a global registry, so every
 * id maps to a single canonical instance and equality by reference holds.
 */
public final class MessageType implements MessageTypeInterface {

    // ===== Static registry (id → instance) ==================================
    private static final Map<String, MessageType> REGISTRY = new ConcurrentHashMap<>();

    private static MessageType register(MessageType type) {
        MessageType existing = REGISTRY.putIfAbsent(type.id, type);
        return existing == null ? type : existing;
    }

    /** Look up an existing MessageType by id (or null if not registered). */
    public static MessageType valueOf(String id) {
        return REGISTRY.get(id);
    }

    /**
     * Obtains an existing MessageType by id or registers a new one.
     */
    public static MessageType valueOf(String id, MessageTypeInterface.Category category) {
        return REGISTRY.computeIfAbsent(id, k -> new MessageType(k, category));
    }

    // --- Ben-Or protocol messages (fire-and-forget) -------------------------
    public static final MessageType BENOR_R = register(new MessageType("BENOR_R", MessageTypeInterface.Category.INTERNAL_REQUEST));
    public static final MessageType BENOR_P = register(new MessageType("BENOR_P", MessageTypeInterface.Category.INTERNAL_REQUEST));

    // --- System messages ----------------------------------------------------
    public static final MessageType STATUS_REQUEST  = register(new MessageType("STATUS_REQUEST",  MessageTypeInterface.Category.SYSTEM_REQUEST));
    public static final MessageType STATUS_RESPONSE = register(new MessageType("STATUS_RESPONSE", MessageTypeInterface.Category.SYSTEM_RESPONSE));

    private final String id;
    private final MessageTypeInterface.Category category;

    private MessageType(String id, MessageTypeInterface.Category category) {
        this.id = Objects.requireNonNull(id, "id");
        this.category = Objects.requireNonNull(category, "category");
    }

    @Override public String getId() { return id; }
    @Override public MessageTypeInterface.Category getCategory() { return category; }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MessageType)) return false;
        MessageType other = (MessageType) o;
        return id.equals(other.id);
    }

    @Override public int hashCode() { return id.hashCode(); }

    @Override public String toString() { return id; }

    /**
     * Returns all registered message types; the order is unspecified.
     */
    public static MessageType[] values() {
        return REGISTRY.values().toArray(new MessageType[0]);
    }
}
