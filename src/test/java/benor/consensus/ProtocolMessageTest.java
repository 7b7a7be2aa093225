package benor.consensus;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProtocolMessageTest {

    @Test
    void shouldBeIdentifiedBySenderRoundPhaseAndValue() {
        assertEquals(ProtocolMessage.r(2, 5, Value.ONE), new ProtocolMessage(Phase.R, 2, 5, Value.ONE));
        assertNotEquals(ProtocolMessage.r(2, 5, Value.ONE), ProtocolMessage.p(2, 5, Value.ONE));
    }

    @Test
    void shouldRejectInvalidFields() {
        assertThrows(IllegalArgumentException.class, () -> ProtocolMessage.r(-1, 0, Value.ONE));
        assertThrows(IllegalArgumentException.class, () -> ProtocolMessage.r(0, -1, Value.ONE));
        assertThrows(NullPointerException.class, () -> ProtocolMessage.r(0, 0, null));
        assertThrows(NullPointerException.class, () -> new ProtocolMessage(null, 0, 0, Value.ONE));
    }

    @Test
    void resolutionCannotDecideUnknown() {
        assertThrows(IllegalArgumentException.class, () -> Resolution.decided(Value.UNKNOWN));
        assertFalse(Resolution.adopt(Value.UNKNOWN).decided());
    }
}
