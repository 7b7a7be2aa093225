package benor.replica;

import benor.messaging.Message;
import benor.messaging.MessageBus;
import benor.messaging.MessageCodec;
import benor.messaging.MessageHandler;
import benor.messaging.MessageType;
import benor.messaging.NetworkAddress;
import benor.network.id.NodeId;

import java.util.List;

/**
 * Base class for nodes taking part in a deterministic, tick-driven simulation.
 * <p>
 * Responsibilities
 * <ul>
 *   <li>Hold the immutable identity ({@code nodeId}, {@code networkAddress}) and the list of peers.</li>
 *   <li>Require non-null {@link MessageBus} and {@link MessageCodec} dependencies and register
 *       this node as the handler for its address.</li>
 *   <li>Expose {@link #tick()} as the single entry point for periodic work.</li>
 *   <li>Provide helpers for payload serialization and fan-out to peers.</li>
 * </ul>
 * <p>
 * Extension Points for Subclasses
 * <ol>
 *   <li>{@link #onMessageReceived(Message)} – <strong>Required:</strong> handle inbound messages.</li>
 *   <li>{@link #onTick()} – <strong>Optional:</strong> replica-specific periodic work.</li>
 * </ol>
 * <p>
 * Never tick the {@link MessageBus} or the network from here; the
 * {@link benor.simulation.SimulationDriver} owns tick orchestration.
 * <p>
 * The class is <em>not</em> thread-safe and expects single-threaded event-loop execution.
 */
public abstract class Replica implements MessageHandler {

    protected final NodeId nodeId;
    protected final NetworkAddress networkAddress;
    protected final List<NetworkAddress> peers;

    protected final MessageBus messageBus;
    protected final MessageCodec messageCodec;

    /**
     * @param nodeId         identity of this node
     * @param networkAddress network address of this node
     * @param peers          addresses of the other nodes
     * @param messageBus     message bus for communication
     * @param messageCodec   codec for payload serialization
     */
    protected Replica(NodeId nodeId, NetworkAddress networkAddress, List<NetworkAddress> peers,
                      MessageBus messageBus, MessageCodec messageCodec) {
        checkArguments(nodeId, networkAddress, peers, messageBus, messageCodec);

        this.nodeId = nodeId;
        this.networkAddress = networkAddress;
        this.peers = List.copyOf(peers);
        this.messageBus = messageBus;
        this.messageCodec = messageCodec;
        messageBus.registerHandler(networkAddress, this);
    }

    private static void checkArguments(NodeId nodeId, NetworkAddress networkAddress, List<NetworkAddress> peers,
                                       MessageBus messageBus, MessageCodec messageCodec) {
        if (nodeId == null) {
            throw new IllegalArgumentException("NodeId cannot be null");
        }
        if (networkAddress == null) {
            throw new IllegalArgumentException("Network address cannot be null");
        }
        if (peers == null) {
            throw new IllegalArgumentException("Peers list cannot be null");
        }
        if (peers.contains(networkAddress)) {
            throw new IllegalArgumentException("Peers list cannot contain the node's own address " + networkAddress);
        }
        if (messageBus == null || messageCodec == null) {
            throw new IllegalArgumentException("MessageBus and MessageCodec must be provided and non-null");
        }
    }

    public NodeId getNodeId() {
        return nodeId;
    }

    public String getName() {
        return nodeId.name();
    }

    public NetworkAddress getNetworkAddress() {
        return networkAddress;
    }

    public List<NetworkAddress> getPeers() {
        return peers;
    }

    @Override
    public abstract void onMessageReceived(Message message);

    /**
     * Common tick() processing for all replica types.
     */
    public void tick() {
        onTick();
    }

    /**
     * Hook method for subclasses to perform additional tick processing.
     */
    protected void onTick() {
    }

    protected byte[] serializePayload(Object payload) {
        return messageCodec.encode(payload);
    }

    protected <T> T deserializePayload(byte[] data, Class<T> type) {
        return messageCodec.decode(data, type);
    }

    /**
     * Sends the payload to every peer. Peers that cannot be reached are skipped silently.
     */
    protected int broadcastToPeers(MessageType messageType, Object payload) {
        return messageBus.broadcast(networkAddress, peers, messageType, serializePayload(payload));
    }

    protected void reply(Message request, MessageType responseType, Object payload) {
        if (request.source() == null) {
            return;
        }
        messageBus.sendMessage(Message.networkMessage(networkAddress, request.source(), responseType,
                serializePayload(payload), request.correlationId()));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "name='" + nodeId + '\'' +
                ", networkAddress=" + networkAddress +
                ", peers=" + peers +
                '}';
    }
}
