package benor.messaging;

import java.util.Arrays;
import java.util.Objects;

/**
 * Envelope moved by the network: routing addresses, a type, an opaque payload
 * and a correlation id used to match responses to requests.
 */
public record Message(
        NetworkAddress source,
        NetworkAddress destination,
        MessageType messageType,
        byte[] payload,
        String correlationId
) {

    public static Message networkMessage(NetworkAddress source, NetworkAddress destination,
                                         MessageType messageType, byte[] payload, String correlationId) {
        return new Message(source, destination, messageType, payload, correlationId);
    }

    public Message {
        Objects.requireNonNull(messageType, "Message type cannot be null");
        // Status queries may come from an observer that has no bound address
        if (source == null && !messageType.isSystemMessage()) {
            throw new NullPointerException("Source address cannot be null (except for system messages)");
        }
        Objects.requireNonNull(destination, "Destination address cannot be null");
        Objects.requireNonNull(payload, "Payload cannot be null");
        Objects.requireNonNull(correlationId, "Correlation ID cannot be null");
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Message message = (Message) obj;
        return Objects.equals(source, message.source) &&
               Objects.equals(destination, message.destination) &&
               messageType == message.messageType &&
               Arrays.equals(payload, message.payload) &&
               Objects.equals(correlationId, message.correlationId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, destination, messageType, Arrays.hashCode(payload), correlationId);
    }

    @Override
    public String toString() {
        return "Message{" + messageType + " " + source + " -> " + destination +
               ", correlationId='" + correlationId + "', payload=" + payload.length + " bytes}";
    }
}
