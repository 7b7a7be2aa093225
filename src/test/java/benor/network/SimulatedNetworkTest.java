package benor.network;

import benor.messaging.Message;
import benor.messaging.MessageType;
import benor.messaging.NetworkAddress;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SimulatedNetwork delivery, delay and fault injection.
 */
class SimulatedNetworkTest {

    private final NetworkAddress a = new NetworkAddress("192.168.1.1", 3000);
    private final NetworkAddress b = new NetworkAddress("192.168.1.2", 3000);
    private final NetworkAddress c = new NetworkAddress("192.168.1.3", 3000);

    private SimulatedNetwork network;
    private List<Message> delivered;

    @BeforeEach
    void setUp() {
        network = new SimulatedNetwork(new Random(12345L), 1, 0.0);
        delivered = new ArrayList<>();
        network.registerMessageHandler(delivered::add);
    }

    private Message message(NetworkAddress from, NetworkAddress to, String id) {
        return Message.networkMessage(from, to, MessageType.BENOR_R, id.getBytes(), id);
    }

    @Test
    void shouldDeliverAfterConfiguredDelay() {
        // Given
        SimulatedNetwork slow = new SimulatedNetwork(new Random(1L), 3, 0.0);
        List<Message> received = new ArrayList<>();
        slow.registerMessageHandler(received::add);

        // When
        slow.send(message(a, b, "m1"));
        slow.tick();
        slow.tick();

        // Then
        assertTrue(received.isEmpty());
        assertEquals(1, slow.getPendingCount());
        slow.tick();
        assertEquals(1, received.size());
        assertEquals(3, slow.getCurrentTick());
    }

    @Test
    void shouldDeliverInSendOrder() {
        network.send(message(a, b, "m1"));
        network.send(message(c, b, "m2"));
        network.send(message(a, c, "m3"));

        network.tick();

        assertEquals(List.of("m1", "m2", "m3"), delivered.stream().map(Message::correlationId).toList());
        assertEquals(3, network.getSentCount());
        assertEquals(3, network.getDeliveredCount());
        assertEquals(0, network.getDroppedCount());
    }

    @Test
    void shouldDropMessagesToAndFromDisconnectedEndpoint() {
        // Given
        network.disconnect(b);

        // When
        network.send(message(a, b, "to-b"));
        network.send(message(b, c, "from-b"));
        network.send(message(a, c, "a-c"));
        network.tick();

        // Then
        assertEquals(1, delivered.size());
        assertEquals("a-c", delivered.get(0).correlationId());
        assertEquals(2, network.getDroppedCount());

        // And reconnecting restores delivery
        network.reconnect(b);
        network.send(message(a, b, "again"));
        network.tick();
        assertEquals(2, delivered.size());
    }

    @Test
    void shouldDropInFlightMessageWhenLinkIsCut() {
        network.send(message(a, b, "m1"));

        network.partition(a, b);
        network.tick();

        assertTrue(delivered.isEmpty());
        assertEquals(1, network.getDroppedCount());
    }

    @Test
    void shouldPartitionInBothDirectionsUntilHealed() {
        // Given
        network.partition(a, b);

        // When
        network.send(message(a, b, "ab"));
        network.send(message(b, a, "ba"));
        network.send(message(a, c, "ac"));
        network.tick();

        // Then
        assertEquals(List.of("ac"), delivered.stream().map(Message::correlationId).toList());

        network.healPartition(b, a);
        network.send(message(b, a, "healed"));
        network.tick();
        assertEquals(2, delivered.size());
    }

    @Test
    void shouldLoseEveryMessageAtFullLossRate() {
        SimulatedNetwork lossy = new SimulatedNetwork(new Random(7L), 1, 1.0);
        List<Message> received = new ArrayList<>();
        lossy.registerMessageHandler(received::add);

        for (int i = 0; i < 10; i++) {
            lossy.send(message(a, b, "m" + i));
        }
        lossy.tick();

        assertTrue(received.isEmpty());
        assertEquals(10, lossy.getDroppedCount());
    }

    @Test
    void shouldAcceptStatusRequestWithoutSource() {
        network.send(Message.networkMessage(null, b, MessageType.STATUS_REQUEST, new byte[0], "status"));
        network.tick();

        assertEquals(1, delivered.size());
    }

    @Test
    void shouldRejectInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new SimulatedNetwork(null));
        assertThrows(IllegalArgumentException.class, () -> new SimulatedNetwork(new Random(), -1, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new SimulatedNetwork(new Random(), 1, 1.5));
        assertThrows(IllegalArgumentException.class, () -> network.send(null));
        assertThrows(IllegalArgumentException.class, () -> network.partition(a, null));
    }
}
