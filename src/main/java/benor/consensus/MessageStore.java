package benor.consensus;

import benor.util.DebugConfig;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Per-round buffers of received protocol messages, one bucket per phase.
 * <p>
 * A bucket keeps one message per sender; a later message from the same sender
 * for the same round and phase replaces the earlier one. After
 * {@link #prune(int)} the store also refuses messages for rounds it has
 * already discarded, so a late straggler cannot bring an old bucket back.
 * <p>
 * Not thread-safe; owned by a single node.
 */
public class MessageStore {

    private final Map<Integer, Map<Phase, Map<Integer, ProtocolMessage>>> rounds = new HashMap<>();
    private int lowestRetainedRound = 0;

    /**
     * Inserts the message into the bucket for its round and phase.
     *
     * @return false if the round has already been pruned and the message was ignored
     */
    public boolean record(ProtocolMessage message) {
        if (message == null) {
            throw new IllegalArgumentException("Message cannot be null");
        }
        if (message.round() < lowestRetainedRound) {
            if (DebugConfig.ENABLED) {
                System.out.println("MessageStore: Ignoring " + message + " below retained round " + lowestRetainedRound);
            }
            return false;
        }
        rounds.computeIfAbsent(message.round(), k -> new EnumMap<>(Phase.class))
              .computeIfAbsent(message.phase(), k -> new LinkedHashMap<>())
              .put(message.senderId(), message);
        return true;
    }

    /**
     * Returns a copy of the bucket for the round and phase (empty if absent).
     */
    public Set<ProtocolMessage> read(int round, Phase phase) {
        Map<Phase, Map<Integer, ProtocolMessage>> buckets = rounds.get(round);
        if (buckets == null || !buckets.containsKey(phase)) {
            return Set.of();
        }
        return Set.copyOf(buckets.get(phase).values());
    }

    /**
     * Discards every bucket for rounds strictly older than {@code beforeRound - 1},
     * keeping the current and the immediately preceding round.
     */
    public void prune(int beforeRound) {
        int floor = beforeRound - 1;
        if (floor <= lowestRetainedRound) {
            return;
        }
        rounds.keySet().removeIf(round -> round < floor);
        lowestRetainedRound = floor;
    }

    /**
     * Returns the round numbers that currently have a bucket, in ascending order.
     */
    public Set<Integer> rounds() {
        return new TreeSet<>(rounds.keySet());
    }

    public int size() {
        return rounds.values().stream()
                .flatMap(buckets -> buckets.values().stream())
                .mapToInt(Map::size)
                .sum();
    }
}
