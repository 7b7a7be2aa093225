package benor.consensus;

import benor.simulation.CancellationToken;
import benor.simulation.TickScheduler;
import benor.util.DebugConfig;

import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Schedules successive rounds of a {@link RoundStateMachine} on a node's
 * {@link TickScheduler} and is the node's start/stop/inspect surface.
 * <p>
 * Timing of one run:
 * <ol>
 *   <li>{@link #start()} waits, one tick at a time, until the readiness gate reports all peers up.</li>
 *   <li>Each round broadcasts R, waits {@code roundWindowTicks}, broadcasts P, waits
 *       {@code roundWindowTicks} again, then resolves.</li>
 *   <li>An undecided node starts the next round after {@code roundGapTicks}, or after
 *       {@code degradedRoundGapTicks} when termination is disabled.</li>
 * </ol>
 * Every scheduled step carries the token returned by {@link #start()}. {@link #stop()}
 * cancels it, and each step also checks the stopped flag before touching state.
 */
public class RoundDriver {

    private final int selfId;
    private final RoundStateMachine machine;
    private final NodeConsensusState state;
    private final DecisionEngine engine;
    private final TickScheduler scheduler;
    private final ConsensusConfig config;
    private final BooleanSupplier readiness;

    private CancellationToken token;
    private boolean running;

    public RoundDriver(int selfId, RoundStateMachine machine, NodeConsensusState state, DecisionEngine engine,
                       TickScheduler scheduler, ConsensusConfig config, BooleanSupplier readiness) {
        if (machine == null || state == null || engine == null || scheduler == null || config == null || readiness == null) {
            throw new IllegalArgumentException("RoundDriver dependencies must be provided and non-null");
        }
        this.selfId = selfId;
        this.machine = machine;
        this.state = state;
        this.engine = engine;
        this.scheduler = scheduler;
        this.config = config;
        this.readiness = readiness;
    }

    /**
     * Starts round execution. Calling it again while running returns the same token.
     *
     * A node that has already decided accepts the call and does nothing.
     *
     * @return the token of the run, or empty if the node is stopped or faulty
     */
    public Optional<CancellationToken> start() {
        if (state.isStopped() || state.isFaulty()) {
            return Optional.empty();
        }
        if (running || machine.isTerminal()) {
            return Optional.of(token);
        }
        running = true;
        token = new CancellationToken();
        System.out.println("Node " + selfId + " starting consensus with value " + state.getCurrentValue() +
                (engine.terminationAllowed() ? "" : " (F > N/2, termination disabled)"));
        awaitReadiness();
        return Optional.of(token);
    }

    /**
     * Halts the node: cancels every pending step and marks the state stopped.
     * Calling it again has no further effect.
     */
    public void stop() {
        if (state.isStopped()) {
            return;
        }
        if (token != null) {
            token.cancel();
        }
        scheduler.cancelAll();
        running = false;
        state.markStopped();
        System.out.println("Node " + selfId + " stopped at round " + state.getRound());
    }

    /**
     * Read-only view of the node's state, with the non-termination override applied.
     */
    public ConsensusSnapshot inspect() {
        if (state.isFaulty()) {
            return ConsensusSnapshot.ofFaulty(state.isStopped());
        }
        return new ConsensusSnapshot(state.getCurrentValue(),
                engine.effectiveDecided(state.isDecided()),
                state.getRound(),
                state.isStopped());
    }

    public boolean isRunning() {
        return running;
    }

    public RoundStage stage() {
        return machine.stage();
    }

    private void awaitReadiness() {
        if (halted()) {
            return;
        }
        if (readiness.getAsBoolean()) {
            runRound();
        } else {
            scheduler.schedule(1, token, this::awaitReadiness);
        }
    }

    private void runRound() {
        if (halted()) {
            return;
        }
        if (DebugConfig.ENABLED) {
            System.out.println("Node " + selfId + " round " + state.getRound() + ": starting");
        }
        machine.beginRound();
        scheduler.schedule(config.roundWindowTicks(), token, this::afterRWindow);
    }

    private void afterRWindow() {
        if (halted()) {
            return;
        }
        machine.closeRWindow();
        scheduler.schedule(config.roundWindowTicks(), token, this::afterPWindow);
    }

    private void afterPWindow() {
        if (halted()) {
            return;
        }
        int round = state.getRound();
        RoundStage outcome = machine.closePWindow();
        if (outcome == RoundStage.DECIDED) {
            running = false;
            System.out.println("Node " + selfId + " decided " + state.getCurrentValue() + " in round " + round);
            return;
        }
        System.out.println("Node " + selfId + " round " + round + ": completed with estimate " + state.getCurrentValue());
        int gap = engine.terminationAllowed() ? config.roundGapTicks() : config.degradedRoundGapTicks();
        scheduler.schedule(gap, token, this::runRound);
    }

    private boolean halted() {
        return state.isStopped() || token.isCancelled();
    }
}
