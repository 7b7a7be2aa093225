package benor.consensus;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RoundStateMachineTest {

    private final List<ProtocolMessage> sent = new ArrayList<>();
    private final MessageStore store = new MessageStore();

    private RoundStateMachine machine(NodeConsensusState state, int nodeCount, int faultyCount, RandomBitSource coin) {
        return new RoundStateMachine(0, state, store, new DecisionEngine(nodeCount, faultyCount, coin), sent::add);
    }

    @Test
    void shouldDecideInRoundZeroForSingleNode() {
        // Given
        NodeConsensusState state = NodeConsensusState.initial(Value.ZERO);
        RoundStateMachine machine = machine(state, 1, 0, new ScriptedBitSource());

        // When
        machine.beginRound();
        Value proposal = machine.closeRWindow();
        RoundStage outcome = machine.closePWindow();

        // Then
        assertEquals(Value.ZERO, proposal);
        assertEquals(RoundStage.DECIDED, outcome);
        assertTrue(machine.isTerminal());
        assertTrue(state.isDecided());
        assertEquals(Value.ZERO, state.getCurrentValue());
        assertEquals(0, state.getRound());
        assertEquals(List.of(ProtocolMessage.r(0, 0, Value.ZERO), ProtocolMessage.p(0, 0, Value.ZERO)), sent);
    }

    @Test
    void shouldRecordOwnMessagesLocally() {
        // Given
        RoundStateMachine machine = machine(NodeConsensusState.initial(Value.ONE), 3, 0, () -> true);

        // When
        machine.beginRound();

        // Then
        assertEquals(RoundStage.AWAIT_R, machine.stage());
        assertTrue(store.read(0, Phase.R).contains(ProtocolMessage.r(0, 0, Value.ONE)));
    }

    @Test
    void shouldUsePeerMessagesCollectedDuringWindows() {
        // Given - N=3, F=1; peers report 0
        NodeConsensusState state = NodeConsensusState.initial(Value.ONE);
        RoundStateMachine machine = machine(state, 3, 1, new ScriptedBitSource());
        machine.beginRound();
        store.record(ProtocolMessage.r(1, 0, Value.ZERO));
        store.record(ProtocolMessage.r(2, 0, Value.ZERO));

        // When
        Value proposal = machine.closeRWindow();
        store.record(ProtocolMessage.p(1, 0, Value.ZERO));
        RoundStage outcome = machine.closePWindow();

        // Then - two of three P messages reach N-F=2
        assertEquals(Value.ZERO, proposal);
        assertEquals(RoundStage.DECIDED, outcome);
        assertEquals(Value.ZERO, state.getCurrentValue());
    }

    @Test
    void shouldAdvanceRoundWhenUndecided() {
        // Given - N=3, F=2 can never decide
        NodeConsensusState state = NodeConsensusState.initial(Value.ONE);
        RoundStateMachine machine = machine(state, 3, 2, () -> true);

        // When
        machine.beginRound();
        machine.closeRWindow();
        RoundStage outcome = machine.closePWindow();

        // Then
        assertEquals(RoundStage.NEXT_ROUND, outcome);
        assertFalse(state.isDecided());
        assertEquals(1, state.getRound());

        // And the next round starts from NEXT_ROUND
        machine.beginRound();
        assertEquals(ProtocolMessage.r(0, 1, Value.ONE), sent.get(sent.size() - 1));
    }

    @Test
    void shouldPruneStoreAsRoundsAdvance() {
        // Given
        NodeConsensusState state = NodeConsensusState.initial(Value.ONE);
        RoundStateMachine machine = machine(state, 3, 2, () -> false);

        // When
        for (int i = 0; i < 6; i++) {
            machine.beginRound();
            machine.closeRWindow();
            machine.closePWindow();
        }

        // Then - only the current and the preceding round are kept
        assertEquals(6, state.getRound());
        assertEquals(Set.of(5), store.rounds());
        assertFalse(store.record(ProtocolMessage.r(1, 3, Value.ONE)));
    }

    @Test
    void shouldCarryOnWhenBroadcastFails() {
        // Given
        NodeConsensusState state = NodeConsensusState.initial(Value.ONE);
        RoundStateMachine machine = new RoundStateMachine(0, state, store,
                new DecisionEngine(1, 0, () -> true),
                message -> { throw new IllegalStateException("peer unreachable"); });

        // When
        machine.beginRound();
        machine.closeRWindow();
        RoundStage outcome = machine.closePWindow();

        // Then
        assertEquals(RoundStage.DECIDED, outcome);
        assertEquals(1, store.read(0, Phase.P).size());
    }

    @Test
    void shouldRefuseToRunForFaultyNode() {
        RoundStateMachine machine = machine(NodeConsensusState.faulty(), 3, 1, () -> true);

        assertThrows(IllegalStateException.class, machine::beginRound);
        assertTrue(sent.isEmpty());
        assertEquals(0, store.size());
    }

    @Test
    void shouldRejectOutOfOrderStages() {
        RoundStateMachine machine = machine(NodeConsensusState.initial(Value.ONE), 1, 0, () -> true);

        assertThrows(IllegalStateException.class, machine::closeRWindow);
        assertThrows(IllegalStateException.class, machine::closePWindow);

        machine.beginRound();
        assertThrows(IllegalStateException.class, machine::beginRound);
        assertThrows(IllegalStateException.class, machine::closePWindow);
    }

    @Test
    void shouldNotRunAfterDecision() {
        RoundStateMachine machine = machine(NodeConsensusState.initial(Value.ONE), 1, 0, () -> true);
        machine.beginRound();
        machine.closeRWindow();
        machine.closePWindow();

        assertThrows(IllegalStateException.class, machine::beginRound);
    }
}
