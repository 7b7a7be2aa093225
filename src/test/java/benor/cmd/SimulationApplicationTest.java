package benor.cmd;

import benor.consensus.ConsensusConfig;
import benor.consensus.NodeStatus;
import benor.consensus.Value;
import benor.replica.StatusReport;
import benor.simulation.BenOrCluster;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SimulationApplicationTest {

    @Test
    void shouldUseDefaultsWithoutArguments() {
        SimulationApplication application = SimulationApplication.fromArgs(new String[0]);

        assertEquals(4, application.getConfig().nodeCount());
        assertEquals(1, application.getConfig().faultyCount());
        assertEquals(List.of(Value.ONE, Value.ONE, Value.ONE, Value.ONE), application.getInitialValues());
        assertEquals(42L, application.getSeed());
        assertEquals(2000, application.getMaxTicks());
        assertEquals(1, application.getDelayTicks());
        assertEquals(0.0, application.getLossRate());
    }

    @Test
    void shouldParseArguments() {
        // When
        SimulationApplication application = SimulationApplication.fromArgs(new String[]{
                "--nodes=3", "--faulty=0", "--values=0,1,?", "--seed=7", "--ticks=500", "--delay=2", "--loss=0.25"});

        // Then
        assertEquals(3, application.getConfig().nodeCount());
        assertEquals(0, application.getConfig().faultyCount());
        assertEquals(List.of(Value.ZERO, Value.ONE, Value.UNKNOWN), application.getInitialValues());
        assertEquals(7L, application.getSeed());
        assertEquals(500, application.getMaxTicks());
        assertEquals(2, application.getDelayTicks());
        assertEquals(0.25, application.getLossRate());
    }

    @Test
    void shouldRejectBadArguments() {
        assertThrows(IllegalArgumentException.class, () -> SimulationApplication.fromArgs(new String[]{"--verbose"}));
        assertThrows(IllegalArgumentException.class, () -> SimulationApplication.fromArgs(new String[]{"--nodes=x"}));
        assertThrows(IllegalArgumentException.class, () -> SimulationApplication.fromArgs(new String[]{"--faulty=5"}));
        assertThrows(IllegalArgumentException.class, () -> SimulationApplication.fromArgs(new String[]{"--values=2"}));
        assertThrows(IllegalArgumentException.class, () -> SimulationApplication.fromArgs(new String[]{"--ticks=0"}));
    }

    @Test
    void shouldLeaveNoStatusRequestPendingAfterCollectingReports() {
        // Given
        BenOrCluster cluster = BenOrCluster.builder(ConsensusConfig.of(4, 1))
                .initialValue(Value.ONE)
                .build();
        cluster.startAll();
        cluster.runUntilDecided(500);
        long sentBefore = cluster.network().getSentCount();

        // When
        List<StatusReport> reports = SimulationApplication.collectReports(cluster);

        // Then - only the three healthy nodes were asked
        assertEquals(sentBefore + 6, cluster.network().getSentCount());
        assertEquals(0, cluster.statusClient().pendingCount());
        assertEquals(4, reports.size());
        assertEquals(NodeStatus.FAULTY, reports.get(3).status());
        assertNull(reports.get(3).snapshot().round());
    }

    @Test
    void shouldReportEveryNodeAfterRun() {
        // Given
        SimulationApplication application = SimulationApplication.fromArgs(new String[]{"--nodes=4", "--faulty=1"});

        // When
        List<StatusReport> reports = application.run();

        // Then
        assertEquals(4, reports.size());
        for (int i = 0; i < 3; i++) {
            StatusReport report = reports.get(i);
            assertEquals(i, report.nodeId());
            assertEquals(NodeStatus.HEALTHY, report.status());
            assertTrue(report.snapshot().hasDecided());
            assertEquals(Value.ONE, report.snapshot().currentValue());
            assertTrue(report.snapshot().stopped());
        }
        StatusReport faulty = reports.get(3);
        assertEquals(NodeStatus.FAULTY, faulty.status());
        assertNull(faulty.snapshot().currentValue());
    }
}
