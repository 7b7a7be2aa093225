package benor.consensus;

import java.util.Objects;

/**
 * One protocol message of a Ben-Or round. A well-behaved sender emits at most
 * one message per {@code (round, phase)}.
 */
public record ProtocolMessage(Phase phase, int senderId, int round, Value value) {

    public ProtocolMessage {
        Objects.requireNonNull(phase, "Phase cannot be null");
        Objects.requireNonNull(value, "Value cannot be null");
        if (senderId < 0) {
            throw new IllegalArgumentException("Sender id must be non-negative, got: " + senderId);
        }
        if (round < 0) {
            throw new IllegalArgumentException("Round must be non-negative, got: " + round);
        }
    }

    public static ProtocolMessage r(int senderId, int round, Value value) {
        return new ProtocolMessage(Phase.R, senderId, round, value);
    }

    public static ProtocolMessage p(int senderId, int round, Value value) {
        return new ProtocolMessage(Phase.P, senderId, round, value);
    }
}
