package benor.replica;

import benor.consensus.ConsensusConfig;
import benor.consensus.ConsensusSnapshot;
import benor.consensus.DecisionEngine;
import benor.consensus.MessageStore;
import benor.consensus.NodeConsensusState;
import benor.consensus.NodeStatus;
import benor.consensus.Phase;
import benor.consensus.ProtocolMessage;
import benor.consensus.RandomBitSource;
import benor.consensus.RoundDriver;
import benor.consensus.RoundStage;
import benor.consensus.RoundStateMachine;
import benor.consensus.Value;
import benor.messaging.Message;
import benor.messaging.MessageBus;
import benor.messaging.MessageCodec;
import benor.messaging.MessageCodecException;
import benor.messaging.MessageType;
import benor.messaging.NetworkAddress;
import benor.network.id.NodeId;
import benor.simulation.TickScheduler;
import benor.util.DebugConfig;

import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * A node running Ben-Or randomized binary consensus.
 * <p>
 * Inbound R and P messages from the bus go into the node's {@link MessageStore};
 * the {@link RoundDriver} advances rounds on the node's own {@link TickScheduler},
 * which this replica ticks from {@link #onTick()}. A faulty node keeps its address
 * on the bus but never sends, rejects every command and stays silent on status queries.
 * <p>
 * Control surface: {@link #status()}, {@link #submitMessage(ProtocolMessage)},
 * {@link #start()}, {@link #stop()} and {@link #snapshot()}.
 */
public final class BenOrReplica extends Replica {

    private final ConsensusConfig config;
    private final NodeConsensusState state;
    private final MessageStore store;
    private final DecisionEngine engine;
    private final TickScheduler scheduler;
    private final RoundDriver driver;

    public BenOrReplica(NodeId nodeId, NetworkAddress networkAddress, List<NetworkAddress> peers,
                        MessageBus messageBus, MessageCodec messageCodec, ConsensusConfig config,
                        Value initialValue, boolean faulty, BooleanSupplier readiness, RandomBitSource coin) {
        super(nodeId, networkAddress, peers, messageBus, messageCodec);
        if (config == null || readiness == null || coin == null) {
            throw new IllegalArgumentException("Config, readiness and coin must be provided and non-null");
        }
        if (peers.size() != config.nodeCount() - 1) {
            throw new IllegalArgumentException("Expected " + (config.nodeCount() - 1) + " peers for N=" +
                    config.nodeCount() + ", got " + peers.size());
        }

        this.config = config;
        this.state = faulty ? NodeConsensusState.faulty() : NodeConsensusState.initial(initialValue);
        this.store = new MessageStore();
        this.engine = new DecisionEngine(config, coin);
        this.scheduler = new TickScheduler();
        this.driver = new RoundDriver(nodeId.index(),
                new RoundStateMachine(nodeId.index(), state, store, engine, this::broadcast),
                state, engine, scheduler, config, readiness);
    }

    @Override
    public void onMessageReceived(Message message) {
        MessageType mt = message.messageType();
        try {
            if (mt == MessageType.BENOR_R || mt == MessageType.BENOR_P) {
                handleProtocolMessage(message);
            } else if (mt == MessageType.STATUS_REQUEST) {
                handleStatusRequest(message);
            } else if (DebugConfig.ENABLED) {
                System.out.println("BenOrReplica: Unhandled message type: " + mt);
            }
        } catch (MessageCodecException e) {
            System.err.println("BenOrReplica " + nodeId + ": Discarding undecodable " + mt + " from " +
                    message.source() + ": " + e.getMessage());
        }
    }

    private void handleProtocolMessage(Message message) {
        ProtocolMessage protocolMessage = deserializePayload(message.payload(), ProtocolMessage.class);
        Phase expected = message.messageType() == MessageType.BENOR_R ? Phase.R : Phase.P;
        if (protocolMessage.phase() != expected) {
            System.err.println("BenOrReplica " + nodeId + ": Discarding " + protocolMessage +
                    " carried as " + message.messageType());
            return;
        }
        submitMessage(protocolMessage);
    }

    private void handleStatusRequest(Message message) {
        if (state.isFaulty()) {
            return;
        }
        reply(message, MessageType.STATUS_RESPONSE, new StatusReport(nodeId.index(), status(), snapshot()));
    }

    @Override
    protected void onTick() {
        scheduler.tick();
    }

    // === Control surface ===

    /**
     * @return FAULTY for a faulty node, HEALTHY otherwise
     */
    public NodeStatus status() {
        return state.isFaulty() ? NodeStatus.FAULTY : NodeStatus.HEALTHY;
    }

    /**
     * Buffers a peer's protocol message for its round.
     * <p>
     * Once the node has decided, and for rounds more than one ahead of its own,
     * the message is accepted but not kept; nothing would ever read or prune it.
     *
     * @return false if the node is stopped or faulty; the message is then dropped
     */
    public boolean submitMessage(ProtocolMessage message) {
        if (message == null) {
            throw new IllegalArgumentException("Message cannot be null");
        }
        if (state.isStopped() || state.isFaulty()) {
            return false;
        }
        if (driver.stage() == RoundStage.DECIDED || message.round() > state.getRound() + 1) {
            if (DebugConfig.ENABLED) {
                System.out.println("BenOrReplica " + nodeId + ": Not buffering " + message + " at round " +
                        state.getRound() + " (" + driver.stage() + ")");
            }
            return true;
        }
        store.record(message);
        return true;
    }

    /**
     * Starts the round driver; rounds begin once the readiness gate opens.
     *
     * @return false if the node is stopped or faulty
     */
    public boolean start() {
        return driver.start().isPresent();
    }

    /**
     * Halts the node for good. Idempotent.
     */
    public void stop() {
        driver.stop();
    }

    public ConsensusSnapshot snapshot() {
        return driver.inspect();
    }

    // === Outbound ===

    private void broadcast(ProtocolMessage message) {
        if (state.isStopped() || state.isFaulty()) {
            return;
        }
        MessageType type = message.phase() == Phase.R ? MessageType.BENOR_R : MessageType.BENOR_P;
        broadcastToPeers(type, message);
    }

    public boolean isFaulty() {
        return state.isFaulty();
    }

    public boolean isRunning() {
        return driver.isRunning();
    }

    public ConsensusConfig getConfig() {
        return config;
    }

    MessageStore messageStore() {
        return store;
    }
}
