package benor.consensus;

/**
 * Cluster-wide protocol parameters shared by every node.
 * Immutable configuration object with builder support.
 */
public final class ConsensusConfig {

    // === Cluster shape ===
    private final int nodeCount;
    private final int faultyCount;

    // === Round timing, in ticks ===
    private final int roundWindowTicks;
    private final int roundGapTicks;
    private final int degradedRoundGapTicks;

    private ConsensusConfig(Builder builder) {
        this.nodeCount = builder.nodeCount;
        this.faultyCount = builder.faultyCount;
        this.roundWindowTicks = builder.roundWindowTicks;
        this.roundGapTicks = builder.roundGapTicks;
        this.degradedRoundGapTicks = builder.degradedRoundGapTicks;

        validate();
    }

    private void validate() {
        if (nodeCount < 1) {
            throw new IllegalArgumentException("nodeCount must be at least 1");
        }
        if (faultyCount < 0 || faultyCount > nodeCount) {
            throw new IllegalArgumentException("faultyCount must be between 0 and nodeCount (" + nodeCount + ")");
        }
        if (roundWindowTicks <= 0) {
            throw new IllegalArgumentException("roundWindowTicks must be positive");
        }
        if (roundGapTicks <= 0) {
            throw new IllegalArgumentException("roundGapTicks must be positive");
        }
        if (degradedRoundGapTicks <= 0) {
            throw new IllegalArgumentException("degradedRoundGapTicks must be positive");
        }
    }

    /** N, the number of nodes taking part in the protocol. */
    public int nodeCount() {
        return nodeCount;
    }

    /** F, the configured number of faulty nodes. */
    public int faultyCount() {
        return faultyCount;
    }

    /** Length of each of the two collection windows of a round. */
    public int roundWindowTicks() {
        return roundWindowTicks;
    }

    /** Pause between the end of one round and the start of the next. */
    public int roundGapTicks() {
        return roundGapTicks;
    }

    /** Pause between rounds when the cluster can never terminate. */
    public int degradedRoundGapTicks() {
        return degradedRoundGapTicks;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ConsensusConfig of(int nodeCount, int faultyCount) {
        return builder().nodeCount(nodeCount).faultyCount(faultyCount).build();
    }

    @Override
    public String toString() {
        return String.format("ConsensusConfig{N=%d, F=%d, roundWindowTicks=%d, roundGapTicks=%d, degradedRoundGapTicks=%d}",
                nodeCount, faultyCount, roundWindowTicks, roundGapTicks, degradedRoundGapTicks);
    }

    public static final class Builder {
        private int nodeCount = 1;
        private int faultyCount = 0;
        private int roundWindowTicks = 5;
        private int roundGapTicks = 5;
        private int degradedRoundGapTicks = 1;

        public Builder nodeCount(int nodeCount) {
            this.nodeCount = nodeCount;
            return this;
        }

        public Builder faultyCount(int faultyCount) {
            this.faultyCount = faultyCount;
            return this;
        }

        public Builder roundWindowTicks(int roundWindowTicks) {
            this.roundWindowTicks = roundWindowTicks;
            return this;
        }

        public Builder roundGapTicks(int roundGapTicks) {
            this.roundGapTicks = roundGapTicks;
            return this;
        }

        public Builder degradedRoundGapTicks(int degradedRoundGapTicks) {
            this.degradedRoundGapTicks = degradedRoundGapTicks;
            return this;
        }

        public ConsensusConfig build() {
            return new ConsensusConfig(this);
        }
    }
}
