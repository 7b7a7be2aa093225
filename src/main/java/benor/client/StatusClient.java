package benor.client;

import benor.messaging.Message;
import benor.messaging.MessageBus;
import benor.messaging.MessageCodec;
import benor.messaging.MessageCodecException;
import benor.messaging.MessageType;
import benor.messaging.NetworkAddress;
import benor.replica.StatusReport;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Observer that queries node status over the message bus.
 * <p>
 * Each request registers a one-shot correlation handler; the callback runs when the
 * response is delivered. Faulty nodes never answer, so their requests stay pending
 * until cancelled.
 */
public class StatusClient {

    private static final byte[] EMPTY_PAYLOAD = new byte[0];

    private final MessageBus messageBus;
    private final MessageCodec messageCodec;
    private final NetworkAddress clientAddress;
    private final Map<String, NetworkAddress> pendingRequests = new HashMap<>();

    public StatusClient(MessageBus messageBus, MessageCodec messageCodec, NetworkAddress clientAddress) {
        if (messageBus == null || messageCodec == null || clientAddress == null) {
            throw new IllegalArgumentException("MessageBus, MessageCodec and client address must be provided and non-null");
        }
        this.messageBus = messageBus;
        this.messageCodec = messageCodec;
        this.clientAddress = clientAddress;
    }

    /**
     * Sends a STATUS_REQUEST to the node.
     *
     * @return the correlation id of the request
     */
    public String requestStatus(NetworkAddress node, Consumer<StatusReport> onReport) {
        if (node == null || onReport == null) {
            throw new IllegalArgumentException("Node address and callback cannot be null");
        }
        String correlationId = messageBus.generateCorrelationId();
        pendingRequests.put(correlationId, node);
        messageBus.registerHandler(correlationId, response -> {
            pendingRequests.remove(correlationId);
            try {
                onReport.accept(messageCodec.decode(response.payload(), StatusReport.class));
            } catch (MessageCodecException e) {
                System.err.println("StatusClient: Undecodable status response from " + response.source() + ": " + e.getMessage());
            }
        });
        messageBus.sendMessage(Message.networkMessage(clientAddress, node, MessageType.STATUS_REQUEST,
                EMPTY_PAYLOAD, correlationId));
        return correlationId;
    }

    /**
     * Gives up on a request: its callback will not run even if the response arrives later.
     */
    public void cancel(String correlationId) {
        if (pendingRequests.remove(correlationId) != null) {
            messageBus.unregisterHandler(correlationId);
        }
    }

    /**
     * Gives up on every request that has not been answered yet.
     */
    public void cancelAll() {
        List.copyOf(pendingRequests.keySet()).forEach(this::cancel);
    }

    public int pendingCount() {
        return pendingRequests.size();
    }

    public boolean isPending(String correlationId) {
        return pendingRequests.containsKey(correlationId);
    }
}
