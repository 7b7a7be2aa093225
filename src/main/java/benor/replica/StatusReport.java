package benor.replica;

import benor.consensus.ConsensusSnapshot;
import benor.consensus.NodeStatus;

/**
 * Payload of a STATUS_RESPONSE: the node's health and its consensus snapshot.
 */
public record StatusReport(int nodeId, NodeStatus status, ConsensusSnapshot snapshot) {
}
