package benor.consensus;

/**
 * Outbound side of the protocol: sends a message to every peer.
 * Delivery is fire-and-forget; implementations must not report unreachable peers.
 */
@FunctionalInterface
public interface ProtocolBroadcaster {

    void broadcast(ProtocolMessage message);
}
