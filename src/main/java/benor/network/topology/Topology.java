package benor.network.topology;

import benor.messaging.NetworkAddress;
import benor.network.id.NodeId;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable cluster topology containing the addressing of all nodes.
 * Node {@code i} sits at position {@code i}, so lookups are by index.
 */
public class Topology {

    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_BASE_PORT = 3000;

    private final List<NodeConfig> nodes;

    /**
     * Creates a new Topology from a list of node configurations.
     *
     * @param nodes the node configurations, ordered by index (must not be null or empty)
     * @throws NullPointerException if nodes is null
     * @throws IllegalArgumentException if nodes is empty, out of order or contains duplicate addresses
     */
    public Topology(List<NodeConfig> nodes) {
        Objects.requireNonNull(nodes, "Nodes list cannot be null");

        if (nodes.isEmpty()) {
            throw new IllegalArgumentException("Nodes list cannot be empty");
        }
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i).index() != i) {
                throw new IllegalArgumentException("Node at position " + i + " has index " + nodes.get(i).index());
            }
        }
        if (nodes.stream().map(NodeConfig::address).distinct().count() != nodes.size()) {
            throw new IllegalArgumentException("Nodes list contains duplicate addresses");
        }

        this.nodes = List.copyOf(nodes);
    }

    /**
     * Builds a topology of {@code size} nodes on consecutive ports of one host.
     */
    public static Topology localCluster(int size, String host, int basePort) {
        if (size < 1) {
            throw new IllegalArgumentException("Cluster size must be at least 1, got: " + size);
        }
        List<NodeConfig> configs = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            configs.add(NodeConfig.of(i, host, basePort));
        }
        return new Topology(configs);
    }

    public static Topology localCluster(int size) {
        return localCluster(size, DEFAULT_HOST, DEFAULT_BASE_PORT);
    }

    /**
     * @throws IndexOutOfBoundsException if index is invalid
     */
    public NodeConfig get(int index) {
        if (index < 0 || index >= nodes.size()) {
            throw new IndexOutOfBoundsException("Invalid node index: " + index + ", size: " + nodes.size());
        }
        return nodes.get(index);
    }

    public NodeConfig get(NodeId nodeId) {
        NodeConfig config = get(nodeId.index());
        if (!config.nodeId().equals(nodeId)) {
            throw new IllegalArgumentException("Node not found: " + nodeId);
        }
        return config;
    }

    public int size() {
        return nodes.size();
    }

    public List<NodeConfig> getAllNodes() {
        return nodes;
    }

    public List<NetworkAddress> getAllAddresses() {
        return nodes.stream().map(NodeConfig::address).toList();
    }

    /**
     * Returns the addresses of every node except the given one.
     */
    public List<NetworkAddress> peersOf(NodeId nodeId) {
        NetworkAddress self = get(nodeId).address();
        return nodes.stream()
                .map(NodeConfig::address)
                .filter(address -> !address.equals(self))
                .toList();
    }
}
