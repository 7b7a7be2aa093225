package benor.network.topology;

import benor.messaging.NetworkAddress;
import benor.network.id.NodeId;

import java.util.Objects;

/**
 * Addressing for a single node in the cluster topology.
 */
public record NodeConfig(NodeId nodeId, NetworkAddress address) {

    public NodeConfig {
        Objects.requireNonNull(nodeId, "NodeId cannot be null");
        Objects.requireNonNull(address, "Address cannot be null");
    }

    /**
     * Creates a NodeConfig whose port is {@code basePort + index}.
     *
     * @param index the node index (must be non-negative)
     * @param host the hostname or IP address
     * @param basePort port of node 0
     */
    public static NodeConfig of(int index, String host, int basePort) {
        return new NodeConfig(NodeId.of(index), new NetworkAddress(host, basePort + index));
    }

    public int index() {
        return nodeId.index();
    }
}
