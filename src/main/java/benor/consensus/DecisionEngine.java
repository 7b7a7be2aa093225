package benor.consensus;

import java.util.Collection;

/**
 * Counting rules of the protocol.
 * <p>
 * Both evaluations only look at how many messages carry 0 and how many carry 1;
 * the coin is the only source of non-determinism. With N nodes and F faulty:
 * <ul>
 *   <li>R phase: a strict majority ({@code > N/2}) of one value is proposed, otherwise the coin.</li>
 *   <li>P phase: {@code N - F} equal values decide, {@code F + 1} are adopted, otherwise the coin.</li>
 * </ul>
 * When {@code F > N/2} termination is disabled: {@link #terminationAllowed()} is the
 * only place that condition is evaluated, and no resolution or snapshot ever reports
 * a decision in that mode.
 */
public class DecisionEngine {

    private final int nodeCount;
    private final int faultyCount;
    private final RandomBitSource coin;

    public DecisionEngine(int nodeCount, int faultyCount, RandomBitSource coin) {
        if (nodeCount < 1) {
            throw new IllegalArgumentException("Node count must be at least 1");
        }
        if (faultyCount < 0 || faultyCount > nodeCount) {
            throw new IllegalArgumentException("Faulty count must be between 0 and " + nodeCount);
        }
        if (coin == null) {
            throw new IllegalArgumentException("RandomBitSource cannot be null");
        }
        this.nodeCount = nodeCount;
        this.faultyCount = faultyCount;
        this.coin = coin;
    }

    public DecisionEngine(ConsensusConfig config, RandomBitSource coin) {
        this(config.nodeCount(), config.faultyCount(), coin);
    }

    /**
     * True while the fault bound {@code F <= N/2} holds.
     */
    public boolean terminationAllowed() {
        return 2 * faultyCount <= nodeCount;
    }

    /**
     * Applies the non-termination override to a stored decided flag.
     */
    public boolean effectiveDecided(boolean decided) {
        return decided && terminationAllowed();
    }

    /**
     * Chooses the value to send in the P phase from the round's R messages.
     */
    public Value proposeFromR(Collection<ProtocolMessage> rMessages) {
        Tally tally = Tally.of(rMessages);
        if (2 * tally.zeros > nodeCount) {
            return Value.ZERO;
        }
        if (2 * tally.ones > nodeCount) {
            return Value.ONE;
        }
        return coin.nextValue();
    }

    /**
     * Computes the node's next estimate from the round's P messages.
     *
     * @param pMessages P messages of the round, including the node's own
     * @param current the node's estimate before this round
     */
    public Resolution resolveFromP(Collection<ProtocolMessage> pMessages, Value current) {
        if (nodeCount == 1) {
            return resolveAlone(pMessages, current);
        }

        Tally tally = Tally.of(pMessages);
        if (terminationAllowed()) {
            int threshold = nodeCount - faultyCount;
            if (tally.zeros >= threshold) {
                return Resolution.decided(Value.ZERO);
            }
            if (tally.ones >= threshold) {
                return Resolution.decided(Value.ONE);
            }
        }
        if (tally.zeros >= faultyCount + 1) {
            return Resolution.adopt(Value.ZERO);
        }
        if (tally.ones >= faultyCount + 1) {
            return Resolution.adopt(Value.ONE);
        }
        return Resolution.adopt(coin.nextValue());
    }

    // A lone node is its own quorum. It keeps its estimate, or takes its own
    // P value when it started without one.
    private Resolution resolveAlone(Collection<ProtocolMessage> pMessages, Value current) {
        Value value = current;
        if (!value.isBinary()) {
            value = pMessages.stream()
                    .map(ProtocolMessage::value)
                    .filter(Value::isBinary)
                    .findFirst()
                    .orElse(Value.UNKNOWN);
        }
        return new Resolution(value, value.isBinary() && terminationAllowed());
    }

    public int nodeCount() {
        return nodeCount;
    }

    public int faultyCount() {
        return faultyCount;
    }

    private record Tally(int zeros, int ones) {
        static Tally of(Collection<ProtocolMessage> messages) {
            int zeros = 0;
            int ones = 0;
            for (ProtocolMessage message : messages) {
                if (message.value() == Value.ZERO) {
                    zeros++;
                } else if (message.value() == Value.ONE) {
                    ones++;
                }
            }
            return new Tally(zeros, ones);
        }
    }
}
