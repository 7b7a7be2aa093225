package benor.consensus;

import benor.util.DebugConfig;

/**
 * Runs the stages of one Ben-Or round for a single node:
 * <pre>
 * IDLE → BROADCAST_R → AWAIT_R → BROADCAST_P → AWAIT_P → RESOLVE → (DECIDED | NEXT_ROUND)
 * </pre>
 * The machine does not wait by itself. {@link #beginRound()} leaves it in AWAIT_R,
 * {@link #closeRWindow()} in AWAIT_P, and {@link #closePWindow()} in DECIDED or
 * NEXT_ROUND; the {@link RoundDriver} decides when each window closes.
 * <p>
 * Sending never fails a round: any exception from the broadcaster is logged and
 * the round carries on with the messages already recorded locally.
 */
public class RoundStateMachine {

    private final int selfId;
    private final NodeConsensusState state;
    private final MessageStore store;
    private final DecisionEngine engine;
    private final ProtocolBroadcaster broadcaster;
    private RoundStage stage = RoundStage.IDLE;

    public RoundStateMachine(int selfId, NodeConsensusState state, MessageStore store,
                             DecisionEngine engine, ProtocolBroadcaster broadcaster) {
        if (state == null || store == null || engine == null || broadcaster == null) {
            throw new IllegalArgumentException("State, store, engine and broadcaster must be provided and non-null");
        }
        this.selfId = selfId;
        this.state = state;
        this.store = store;
        this.engine = engine;
        this.broadcaster = broadcaster;
    }

    /**
     * BROADCAST_R: sends the current estimate for the current round and records it locally.
     */
    public void beginRound() {
        if (state.isFaulty()) {
            throw new IllegalStateException("Node " + selfId + " is faulty and does not run rounds");
        }
        requireStage(RoundStage.IDLE, RoundStage.NEXT_ROUND);
        stage = RoundStage.BROADCAST_R;
        emit(ProtocolMessage.r(selfId, state.getRound(), state.getCurrentValue()));
        stage = RoundStage.AWAIT_R;
    }

    /**
     * BROADCAST_P: evaluates the R messages collected for the round and sends the proposal.
     *
     * @return the proposed value
     */
    public Value closeRWindow() {
        requireStage(RoundStage.AWAIT_R);
        stage = RoundStage.BROADCAST_P;
        int round = state.getRound();
        Value proposal = engine.proposeFromR(store.read(round, Phase.R));
        emit(ProtocolMessage.p(selfId, round, proposal));
        stage = RoundStage.AWAIT_P;
        return proposal;
    }

    /**
     * RESOLVE: evaluates the P messages, updates the estimate, and either decides or
     * advances the round and prunes the store.
     *
     * @return DECIDED or NEXT_ROUND
     */
    public RoundStage closePWindow() {
        requireStage(RoundStage.AWAIT_P);
        stage = RoundStage.RESOLVE;
        int round = state.getRound();
        Resolution resolution = engine.resolveFromP(store.read(round, Phase.P), state.getCurrentValue());
        state.apply(resolution);

        if (state.isDecided()) {
            stage = RoundStage.DECIDED;
            return stage;
        }

        state.advanceRound();
        store.prune(state.getRound());
        stage = RoundStage.NEXT_ROUND;
        return stage;
    }

    public RoundStage stage() {
        return stage;
    }

    public boolean isTerminal() {
        return stage == RoundStage.DECIDED;
    }

    private void emit(ProtocolMessage message) {
        store.record(message);
        try {
            broadcaster.broadcast(message);
        } catch (RuntimeException e) {
            System.err.println("RoundStateMachine: node " + selfId + " failed to broadcast " + message + ": " + e.getMessage());
        }
        if (DebugConfig.ENABLED) {
            System.out.println("RoundStateMachine: node " + selfId + " sent " + message);
        }
    }

    private void requireStage(RoundStage... allowed) {
        for (RoundStage candidate : allowed) {
            if (stage == candidate) {
                return;
            }
        }
        throw new IllegalStateException("Node " + selfId + " cannot leave stage " + stage);
    }
}
