package benor.network;

import benor.messaging.Message;
import benor.messaging.NetworkAddress;
import benor.util.DebugConfig;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Queue;
import java.util.Random;
import java.util.Set;

/**
 * Simulated network implementation that provides deterministic message delivery
 * with configurable delays and packet loss for testing distributed systems.
 *
 * This implementation follows the Service Layer reactive tick() pattern:
 * - send() queues messages for future delivery
 * - tick() processes queued messages and pushes due ones to the callbacks
 *
 * Messages to or from a disconnected endpoint, or across a partition, are
 * dropped silently; the sender never learns about it.
 */
public class SimulatedNetwork implements Network {

    private final Random random;
    private final int delayTicks;
    private final double packetLossRate;

    private final Queue<QueuedMessage> pendingMessages = new LinkedList<>();
    private final List<MessageCallback> callbacks = new ArrayList<>();
    private final Set<Link> partitions = new HashSet<>();
    private final Set<NetworkAddress> disconnected = new HashSet<>();
    private long currentTick = 0;

    private long sentCount = 0;
    private long deliveredCount = 0;
    private long droppedCount = 0;

    /**
     * Creates a SimulatedNetwork with no delays and no packet loss.
     *
     * @param random seeded random generator for deterministic behavior
     */
    public SimulatedNetwork(Random random) {
        this(random, 0, 0.0);
    }

    /**
     * Creates a SimulatedNetwork with configurable behavior.
     *
     * @param random seeded random generator for deterministic behavior
     * @param delayTicks number of ticks to delay message delivery (0 = next tick)
     * @param packetLossRate probability [0.0-1.0] that a message will be lost
     */
    public SimulatedNetwork(Random random, int delayTicks, double packetLossRate) {
        if (random == null) {
            throw new IllegalArgumentException("Random cannot be null");
        }
        if (delayTicks < 0) {
            throw new IllegalArgumentException("Delay ticks cannot be negative");
        }
        if (packetLossRate < 0.0 || packetLossRate > 1.0) {
            throw new IllegalArgumentException("Packet loss rate must be between 0.0 and 1.0");
        }

        this.random = random;
        this.delayTicks = delayTicks;
        this.packetLossRate = packetLossRate;
    }

    @Override
    public void send(Message message) {
        if (message == null) {
            throw new IllegalArgumentException("Message cannot be null");
        }
        sentCount++;

        if (!isReachable(message.source(), message.destination())) {
            drop(message, "unreachable");
            return;
        }
        if (packetLossRate > 0.0 && random.nextDouble() < packetLossRate) {
            drop(message, "lost");
            return;
        }

        long deliveryTick = currentTick + delayTicks;
        pendingMessages.offer(new QueuedMessage(message, deliveryTick));
    }

    @Override
    public void registerMessageHandler(MessageCallback callback) {
        if (callback == null) {
            throw new IllegalArgumentException("Callback cannot be null");
        }
        callbacks.add(callback);
    }

    /**
     * Advances the network clock by one tick and delivers every message whose
     * delivery tick has arrived, in FIFO order.
     *
     * A message sent at tick T with delay D is pushed to the callbacks during
     * the tick() call that moves the clock to T+D (or T+1 when D is 0).
     * Reachability is checked again at delivery, so a link cut while a message
     * is in flight still loses it.
     */
    @Override
    public void tick() {
        currentTick++;

        while (!pendingMessages.isEmpty() &&
               pendingMessages.peek().deliveryTick <= currentTick) {

            Message message = pendingMessages.poll().message;
            if (!isReachable(message.source(), message.destination())) {
                drop(message, "unreachable at delivery");
                continue;
            }
            deliveredCount++;
            for (MessageCallback callback : List.copyOf(callbacks)) {
                callback.onMessage(message);
            }
        }
    }

    @Override
    public void partition(NetworkAddress source, NetworkAddress destination) {
        validateAddresses(source, destination);
        partitions.add(new Link(source, destination));
        partitions.add(new Link(destination, source));
    }

    @Override
    public void healPartition(NetworkAddress source, NetworkAddress destination) {
        validateAddresses(source, destination);
        partitions.remove(new Link(source, destination));
        partitions.remove(new Link(destination, source));
    }

    @Override
    public void disconnect(NetworkAddress address) {
        if (address == null) {
            throw new IllegalArgumentException("Address cannot be null");
        }
        disconnected.add(address);
    }

    @Override
    public void reconnect(NetworkAddress address) {
        if (address == null) {
            throw new IllegalArgumentException("Address cannot be null");
        }
        disconnected.remove(address);
    }

    public long getCurrentTick() {
        return currentTick;
    }

    public long getSentCount() {
        return sentCount;
    }

    public long getDeliveredCount() {
        return deliveredCount;
    }

    public long getDroppedCount() {
        return droppedCount;
    }

    public int getPendingCount() {
        return pendingMessages.size();
    }

    private boolean isReachable(NetworkAddress source, NetworkAddress destination) {
        if (disconnected.contains(destination) || (source != null && disconnected.contains(source))) {
            return false;
        }
        return source == null || !partitions.contains(new Link(source, destination));
    }

    private void drop(Message message, String reason) {
        droppedCount++;
        if (DebugConfig.ENABLED) {
            System.out.println("SimulatedNetwork: Dropped " + message.messageType() + " " +
                    message.source() + " -> " + message.destination() + " (" + reason + ")");
        }
    }

    private static void validateAddresses(NetworkAddress source, NetworkAddress destination) {
        if (source == null || destination == null) {
            throw new IllegalArgumentException("Addresses cannot be null");
        }
    }

    private record QueuedMessage(Message message, long deliveryTick) {}

    private record Link(NetworkAddress from, NetworkAddress to) {}
}
