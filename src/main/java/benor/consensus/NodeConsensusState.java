package benor.consensus;

/**
 * The consensus state owned by exactly one node.
 * <p>
 * Only the {@link RoundStateMachine} changes the estimate, the decided flag and
 * the round; the {@link RoundDriver} sets the stopped flag. A faulty node's state
 * has no estimate and never changes. Outside readers go through
 * {@link RoundDriver#inspect()}.
 */
public final class NodeConsensusState {

    private final boolean faulty;
    private Value currentValue;
    private boolean decided;
    private int round;
    private boolean stopped;

    private NodeConsensusState(boolean faulty, Value currentValue) {
        this.faulty = faulty;
        this.currentValue = currentValue;
        this.decided = false;
        this.round = 0;
        this.stopped = false;
    }

    public static NodeConsensusState initial(Value initialValue) {
        if (initialValue == null) {
            throw new IllegalArgumentException("Initial value cannot be null");
        }
        return new NodeConsensusState(false, initialValue);
    }

    public static NodeConsensusState faulty() {
        return new NodeConsensusState(true, null);
    }

    public boolean isFaulty() {
        return faulty;
    }

    /** Null for a faulty node. */
    public Value getCurrentValue() {
        return currentValue;
    }

    public boolean isDecided() {
        return decided;
    }

    public int getRound() {
        return round;
    }

    public boolean isStopped() {
        return stopped;
    }

    void apply(Resolution resolution) {
        checkMutable();
        if (decided) {
            throw new IllegalStateException("Decided on " + currentValue + ", cannot apply " + resolution);
        }
        currentValue = resolution.value();
        decided = resolution.decided();
    }

    void advanceRound() {
        checkMutable();
        round++;
    }

    void markStopped() {
        stopped = true;
    }

    private void checkMutable() {
        if (faulty) {
            throw new IllegalStateException("Faulty node state cannot change");
        }
    }

    @Override
    public String toString() {
        return "NodeConsensusState{" +
                "faulty=" + faulty +
                ", currentValue=" + currentValue +
                ", decided=" + decided +
                ", round=" + round +
                ", stopped=" + stopped +
                '}';
    }
}
