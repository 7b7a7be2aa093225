package benor.messaging;

/**
 * Minimal contract for message types carried by the {@link MessageBus}.
 * <p>
 * Lets callers outside this package define their own message types while the
 * bus only relies on the id and the category.
 */
public interface MessageTypeInterface {

    /**
     * Returns the unique identifier for this message type.
     *
     * @return unique string identifier
     */
    String getId();

    /**
     * Returns the category of this message type.
     *
     * @return the message category
     */
    Category getCategory();

    default boolean isResponse() {
        return getCategory().isResponse();
    }

    default boolean isRequest() {
        return !isResponse();
    }

    /**
     * Returns true for node-to-node protocol traffic.
     */
    default boolean isInternalMessage() {
        Category cat = getCategory();
        return cat == Category.INTERNAL_REQUEST || cat == Category.INTERNAL_RESPONSE;
    }

    /**
     * Returns true for status and control traffic.
     */
    default boolean isSystemMessage() {
        Category cat = getCategory();
        return cat == Category.SYSTEM_REQUEST || cat == Category.SYSTEM_RESPONSE;
    }

    /**
     * Categories for message types.
     */
    enum Category {
        /** Node-to-node requests, including fire-and-forget protocol messages */
        INTERNAL_REQUEST,

        /** Responses to internal requests */
        INTERNAL_RESPONSE,

        /** Status queries and other control requests */
        SYSTEM_REQUEST,

        /** Responses to system requests */
        SYSTEM_RESPONSE;

        public boolean isResponse() {
            return this == INTERNAL_RESPONSE || this == SYSTEM_RESPONSE;
        }

        public boolean isRequest() {
            return !isResponse();
        }
    }
}
