package benor.network.id;

import java.util.Objects;

/**
 * Immutable identifier of a consensus node.
 * Each node is identified by a unique integer index, which is also the sender id
 * carried by its protocol messages, and has a human-readable name.
 */
public record NodeId(int index, String name) {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if index is negative
     * @throws NullPointerException if name is null
     */
    public NodeId {
        if (index < 0) {
            throw new IllegalArgumentException("Node index must be non-negative, got: " + index);
        }
        Objects.requireNonNull(name, "Node name cannot be null");
    }

    /**
     * Convenience constructor that generates a default name based on the index.
     */
    public NodeId(int index) {
        this(index, "node-" + index);
    }

    public static NodeId of(int index) {
        return new NodeId(index);
    }

    @Override
    public String toString() {
        return name;
    }
}
