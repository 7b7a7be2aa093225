package benor.consensus;

import benor.simulation.CancellationToken;
import benor.simulation.TickScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class RoundDriverTest {

    private final List<ProtocolMessage> sent = new ArrayList<>();
    private TickScheduler scheduler;
    private MessageStore store;
    private boolean ready;

    @BeforeEach
    void setUp() {
        scheduler = new TickScheduler();
        store = new MessageStore();
        ready = true;
    }

    private RoundDriver driver(NodeConsensusState state, ConsensusConfig config) {
        DecisionEngine engine = new DecisionEngine(config, () -> true);
        RoundStateMachine machine = new RoundStateMachine(0, state, store, engine, sent::add);
        BooleanSupplier readiness = () -> ready;
        return new RoundDriver(0, machine, state, engine, scheduler, config, readiness);
    }

    private static ConsensusConfig config(int nodeCount, int faultyCount) {
        return ConsensusConfig.builder()
                .nodeCount(nodeCount)
                .faultyCount(faultyCount)
                .roundWindowTicks(2)
                .roundGapTicks(3)
                .degradedRoundGapTicks(1)
                .build();
    }

    private void tick(int times) {
        for (int i = 0; i < times; i++) {
            scheduler.tick();
        }
    }

    @Test
    void shouldRunRoundAcrossTwoWindowsAndDecide() {
        // Given
        NodeConsensusState state = NodeConsensusState.initial(Value.ONE);
        RoundDriver driver = driver(state, config(1, 0));

        // When
        driver.start();

        // Then - R is sent at once, P after one window, the decision after the second
        assertEquals(RoundStage.AWAIT_R, driver.stage());
        tick(2);
        assertEquals(RoundStage.AWAIT_P, driver.stage());
        tick(2);
        assertEquals(RoundStage.DECIDED, driver.stage());

        ConsensusSnapshot snapshot = driver.inspect();
        assertTrue(snapshot.hasDecided());
        assertEquals(Value.ONE, snapshot.currentValue());
        assertEquals(0, snapshot.round());
        assertFalse(driver.isRunning());
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void shouldNotCountMessagesArrivingAfterWindowCloses() {
        // Given - N=3, F=0; peers' R messages for round 0 only show up after the R window
        ScriptedBitSource coin = new ScriptedBitSource(false);
        ConsensusConfig config = config(3, 0);
        NodeConsensusState state = NodeConsensusState.initial(Value.ONE);
        DecisionEngine engine = new DecisionEngine(config, coin);
        RoundStateMachine machine = new RoundStateMachine(0, state, store, engine, sent::add);
        RoundDriver driver = new RoundDriver(0, machine, state, engine, scheduler, config, () -> true);
        driver.start();

        // When - the R window closes with only the node's own R
        tick(2);
        store.record(ProtocolMessage.r(1, 0, Value.ONE));
        store.record(ProtocolMessage.r(2, 0, Value.ONE));
        tick(2);

        // Then - the proposal came from the coin, not from the unanimous late R messages
        assertEquals(ProtocolMessage.p(0, 0, Value.ZERO), sent.get(1));
        assertEquals(1, coin.flips());
        assertEquals(Value.ZERO, state.getCurrentValue());
        assertFalse(state.isDecided());
        assertEquals(1, state.getRound());

        // And the late messages are still buffered for round 0
        assertEquals(3, store.read(0, Phase.R).size());
    }

    @Test
    void shouldWaitForReadinessBeforeFirstRound() {
        // Given
        ready = false;
        RoundDriver driver = driver(NodeConsensusState.initial(Value.ONE), config(1, 0));

        // When
        driver.start();
        tick(10);

        // Then
        assertEquals(RoundStage.IDLE, driver.stage());
        assertTrue(sent.isEmpty());
        assertTrue(driver.isRunning());

        // When the gate opens
        ready = true;
        tick(1);

        // Then
        assertEquals(RoundStage.AWAIT_R, driver.stage());
        assertEquals(1, sent.size());
    }

    @Test
    void shouldReturnSameTokenWhenStartedTwice() {
        RoundDriver driver = driver(NodeConsensusState.initial(Value.ONE), config(1, 0));

        Optional<CancellationToken> first = driver.start();
        Optional<CancellationToken> second = driver.start();

        assertTrue(first.isPresent());
        assertSame(first.get(), second.get());
        assertEquals(1, sent.size());
    }

    @Test
    void shouldAcceptStartAfterDecisionWithoutRunningAgain() {
        RoundDriver driver = driver(NodeConsensusState.initial(Value.ZERO), config(1, 0));
        driver.start();
        tick(4);
        int sentBefore = sent.size();

        assertTrue(driver.start().isPresent());
        tick(10);

        assertEquals(sentBefore, sent.size());
    }

    @Test
    void shouldKeepRoundingWithoutDecidingWhenBoundViolated() {
        // Given - N=1, F=1
        NodeConsensusState state = NodeConsensusState.initial(Value.ONE);
        RoundDriver driver = driver(state, config(1, 1));

        // When
        driver.start();
        tick(15);
        int earlier = driver.inspect().round();
        tick(15);

        // Then
        ConsensusSnapshot snapshot = driver.inspect();
        assertFalse(snapshot.hasDecided());
        assertTrue(snapshot.round() > earlier);
        assertTrue(earlier > 0);
        assertTrue(driver.isRunning());
    }

    @Test
    void shouldUseShortGapWhenBoundViolated() {
        // Given - window 2, gap 3, degraded gap 1: a degraded round lasts 5 ticks
        RoundDriver driver = driver(NodeConsensusState.initial(Value.ONE), config(1, 1));

        // When
        driver.start();
        tick(5);

        // Then
        assertEquals(1, driver.inspect().round());
        assertEquals(RoundStage.AWAIT_R, driver.stage());
    }

    @Test
    void shouldStopIdempotently() {
        // Given
        NodeConsensusState state = NodeConsensusState.initial(Value.ONE);
        RoundDriver driver = driver(state, config(3, 2));
        Optional<CancellationToken> token = driver.start();
        tick(3);

        // When
        driver.stop();
        driver.stop();

        // Then
        assertTrue(token.orElseThrow().isCancelled());
        assertTrue(driver.inspect().stopped());
        assertFalse(driver.isRunning());
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void shouldNotRunAnyStepAfterStop() {
        // Given
        NodeConsensusState state = NodeConsensusState.initial(Value.ONE);
        RoundDriver driver = driver(state, config(3, 2));
        driver.start();
        tick(1);
        int sentBefore = sent.size();
        RoundStage stageBefore = driver.stage();

        // When
        driver.stop();
        tick(50);

        // Then
        assertEquals(sentBefore, sent.size());
        assertEquals(stageBefore, driver.stage());
        assertEquals(0, driver.inspect().round());
    }

    @Test
    void shouldRejectStartAfterStop() {
        RoundDriver driver = driver(NodeConsensusState.initial(Value.ONE), config(1, 0));
        driver.stop();

        assertTrue(driver.start().isEmpty());
        assertTrue(sent.isEmpty());
    }

    @Test
    void shouldRejectStartForFaultyNode() {
        // Given
        RoundDriver driver = driver(NodeConsensusState.faulty(), config(3, 1));

        // When
        Optional<CancellationToken> token = driver.start();
        tick(20);

        // Then
        assertTrue(token.isEmpty());
        assertTrue(sent.isEmpty());
        ConsensusSnapshot snapshot = driver.inspect();
        assertNull(snapshot.currentValue());
        assertNull(snapshot.decided());
        assertNull(snapshot.round());
        assertFalse(snapshot.stopped());
    }
}
