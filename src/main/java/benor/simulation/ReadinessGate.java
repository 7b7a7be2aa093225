package benor.simulation;

import java.util.BitSet;

/**
 * Tracks which nodes of a cluster are up. Nodes only begin their first round
 * once {@link #allReady()} holds.
 */
public class ReadinessGate {

    private final int nodeCount;
    private final BitSet ready;

    public ReadinessGate(int nodeCount) {
        if (nodeCount < 1) {
            throw new IllegalArgumentException("Node count must be at least 1");
        }
        this.nodeCount = nodeCount;
        this.ready = new BitSet(nodeCount);
    }

    public void markReady(int index) {
        if (index < 0 || index >= nodeCount) {
            throw new IndexOutOfBoundsException("Invalid node index: " + index + ", size: " + nodeCount);
        }
        ready.set(index);
    }

    public boolean isReady(int index) {
        return ready.get(index);
    }

    public boolean allReady() {
        return ready.cardinality() == nodeCount;
    }
}
