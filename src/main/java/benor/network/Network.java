package benor.network;

import benor.messaging.Message;
import benor.messaging.NetworkAddress;

/**
 * Network interface for sending messages in the distributed simulation.
 *
 * This interface follows the deterministic simulation principles:
 * - send() queues messages for delivery (may be delayed/dropped in simulation)
 * - tick() delivers due messages to the registered callbacks
 *
 * Delivery is best effort. A message that cannot reach its destination is
 * dropped without any error reaching the sender.
 */
public interface Network {

    /**
     * Sends a message through the network.
     *
     * @param message the message to send (must not be null)
     * @throws IllegalArgumentException if message is null
     */
    void send(Message message);

    /**
     * Processes pending network operations in the simulation tick.
     */
    void tick();

    /**
     * Registers a callback that receives every delivered message.
     *
     * @param callback the callback (must not be null)
     */
    void registerMessageHandler(MessageCallback callback);

    // Fault injection

    /**
     * Creates a bidirectional partition between two network addresses.
     * Messages in both directions are dropped until the partition is healed.
     */
    void partition(NetworkAddress source, NetworkAddress destination);

    /**
     * Heals any partition between two network addresses, restoring connectivity.
     */
    void healPartition(NetworkAddress source, NetworkAddress destination);

    /**
     * Makes an endpoint unreachable: nothing is delivered to or sent from it.
     */
    void disconnect(NetworkAddress address);

    /**
     * Restores an endpoint previously removed with {@link #disconnect(NetworkAddress)}.
     */
    void reconnect(NetworkAddress address);
}
