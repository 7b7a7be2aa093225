package benor.consensus;

/**
 * Health reported by a node's status query. Faulty nodes always report {@link #FAULTY}.
 */
public enum NodeStatus {
    HEALTHY,
    FAULTY
}
