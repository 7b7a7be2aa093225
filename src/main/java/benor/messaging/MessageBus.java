package benor.messaging;

import benor.network.MessageCallback;
import benor.network.Network;
import benor.util.DebugConfig;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * MessageBus that handles both correlation ID and address-based routing.
 *
 * Routing Priority:
 * 1. Correlation ID-based routing (for responses to status queries)
 * 2. Address-based routing (for protocol messages and requests)
 *
 * A response whose correlation handler is missing falls back to address routing.
 */
public class MessageBus implements MessageCallback {

    protected final Network network;
    protected final MessageCodec messageCodec;

    private final Map<String, MessageHandler> correlationIdHandlers;
    private final Map<NetworkAddress, MessageHandler> addressHandlers;

    private static final AtomicLong correlationIdCounter = new AtomicLong(0);

    /**
     * Creates a MessageBus and registers it with the network for push delivery.
     *
     * @param network the underlying network for message transmission
     * @param messageCodec the codec for message encoding/decoding
     * @throws IllegalArgumentException if either parameter is null
     */
    public MessageBus(Network network, MessageCodec messageCodec) {
        if (network == null) {
            throw new IllegalArgumentException("Network cannot be null");
        }
        if (messageCodec == null) {
            throw new IllegalArgumentException("MessageCodec cannot be null");
        }

        this.network = network;
        this.messageCodec = messageCodec;
        this.correlationIdHandlers = new HashMap<>();
        this.addressHandlers = new HashMap<>();
        network.registerMessageHandler(this);
    }

    /**
     * Sends a message through the underlying network.
     *
     * @param message the message to send
     * @throws IllegalArgumentException if message is null
     */
    public void sendMessage(Message message) {
        if (message == null) {
            throw new IllegalArgumentException("Message cannot be null");
        }
        network.send(message);
    }

    // === CORRELATION ID ROUTING ===

    /**
     * Registers a one-shot handler for the response carrying the given correlation ID.
     */
    public void registerHandler(String correlationId, MessageHandler handler) {
        if (correlationId == null) {
            throw new IllegalArgumentException("Correlation ID cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("Handler cannot be null");
        }
        correlationIdHandlers.put(correlationId, handler);
    }

    public void unregisterHandler(String correlationId) {
        if (correlationId == null) {
            throw new IllegalArgumentException("Correlation ID cannot be null");
        }
        correlationIdHandlers.remove(correlationId);
    }

    public boolean hasHandler(String correlationId) {
        return correlationIdHandlers.containsKey(correlationId);
    }

    // === ADDRESS ROUTING ===

    /**
     * Registers a message handler for the given network address.
     * When messages are received for this address, they will be routed to the handler.
     */
    public void registerHandler(NetworkAddress address, MessageHandler handler) {
        if (address == null) {
            throw new IllegalArgumentException("Address cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("Handler cannot be null");
        }
        addressHandlers.put(address, handler);
    }

    public void unregisterHandler(NetworkAddress address) {
        if (address == null) {
            throw new IllegalArgumentException("Address cannot be null");
        }
        addressHandlers.remove(address);
    }

    public boolean hasHandler(NetworkAddress address) {
        return addressHandlers.containsKey(address);
    }

    // === ROUTING ===

    /**
     * Callback invoked by the network when a message has been delivered.
     */
    @Override
    public void onMessage(Message message) {
        String correlationId = message.correlationId();
        NetworkAddress destination = message.destination();

        if (DebugConfig.ENABLED) {
            System.out.println("MessageBus: Routing message " + message.messageType() + " from " + message.source() +
                    " to " + destination + " (correlationId=" + correlationId + ")");
        }

        if (message.messageType().isResponse()) {
            MessageHandler correlationHandler = correlationIdHandlers.remove(correlationId);
            if (correlationHandler != null) {
                correlationHandler.onMessageReceived(message);
                return;
            }
        }

        MessageHandler addressHandler = addressHandlers.get(destination);
        if (addressHandler != null) {
            addressHandler.onMessageReceived(message);
            return;
        }

        if (DebugConfig.ENABLED) {
            System.out.println("MessageBus: No handler found for message " + message.messageType() +
                    " (correlationId=" + correlationId + ", destination=" + destination + ")");
        }
    }

    /**
     * Service layer tick. Delivery is pushed by the network through {@link #onMessage},
     * so there is no queued work here; the network is ticked by the SimulationDriver.
     */
    public void tick() {
    }

    /**
     * Sends the payload from the source to every recipient except the source itself.
     * A failure to hand the message to the network for one recipient does not stop
     * delivery to the others.
     *
     * @return the number of recipients the message was handed off for
     */
    public int broadcast(NetworkAddress source, List<NetworkAddress> recipients,
                         MessageType messageType, byte[] payload) {
        int sent = 0;
        for (NetworkAddress recipient : recipients) {
            if (recipient.equals(source)) {
                continue;
            }
            try {
                sendMessage(new Message(source, recipient, messageType, payload, generateCorrelationId()));
                sent++;
            } catch (RuntimeException e) {
                System.err.println("MessageBus: Failed to send " + messageType + " from " + source +
                        " to " + recipient + ": " + e.getMessage());
            }
        }
        return sent;
    }

    /**
     * Generates a unique correlation ID for message tracking.
     */
    public String generateCorrelationId() {
        return "msg-" + correlationIdCounter.incrementAndGet();
    }
}
