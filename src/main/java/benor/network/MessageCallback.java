package benor.network;

import benor.messaging.Message;

/**
 * Callback interface for push-based message delivery from Network implementations.
 *
 * The network hands every message that has reached its destination to the
 * registered callbacks during its tick(); nothing polls for messages.
 */
public interface MessageCallback {

    /**
     * Called by the Network implementation when a message is ready for delivery.
     *
     * @param message the message that has been received and is ready for processing
     */
    void onMessage(Message message);
}
