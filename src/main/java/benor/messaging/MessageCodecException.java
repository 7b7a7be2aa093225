package benor.messaging;

/**
 * Thrown when a payload or envelope cannot be converted to or from bytes.
 */
public class MessageCodecException extends RuntimeException {

    public MessageCodecException(String message) {
        super(message);
    }

    public MessageCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
