package benor.simulation;

import benor.client.StatusClient;
import benor.consensus.ConsensusConfig;
import benor.consensus.ConsensusSnapshot;
import benor.consensus.SeededRandomBitSource;
import benor.consensus.Value;
import benor.messaging.JsonMessageCodec;
import benor.messaging.MessageBus;
import benor.messaging.MessageCodec;
import benor.messaging.NetworkAddress;
import benor.network.SimulatedNetwork;
import benor.network.topology.NodeConfig;
import benor.network.topology.Topology;
import benor.replica.BenOrReplica;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * An in-process cluster of {@link BenOrReplica} nodes sharing one {@link SimulatedNetwork}.
 * <p>
 * Every node gets its own coin, seeded from the cluster seed, so a run is fully
 * determined by its configuration. Faulty nodes are disconnected from the network
 * and never start.
 */
public class BenOrCluster {

    private final ConsensusConfig config;
    private final Topology topology;
    private final SimulatedNetwork network;
    private final MessageBus messageBus;
    private final ReadinessGate readiness;
    private final List<BenOrReplica> nodes;
    private final StatusClient statusClient;
    private final SimulationDriver driver;

    private BenOrCluster(Builder builder) {
        this.config = builder.config;
        this.topology = Topology.localCluster(config.nodeCount(), builder.host, builder.basePort);
        this.network = new SimulatedNetwork(new Random(builder.seed), builder.networkDelayTicks, builder.packetLossRate);
        MessageCodec codec = new JsonMessageCodec();
        this.messageBus = new MessageBus(network, codec);
        this.readiness = new ReadinessGate(config.nodeCount());

        Set<Integer> faulty = builder.faultyIndexes != null ? builder.faultyIndexes : lastIndexes(config);
        List<BenOrReplica> created = new ArrayList<>();
        for (NodeConfig nodeConfig : topology.getAllNodes()) {
            int index = nodeConfig.index();
            boolean isFaulty = faulty.contains(index);
            BenOrReplica node = new BenOrReplica(nodeConfig.nodeId(), nodeConfig.address(),
                    topology.peersOf(nodeConfig.nodeId()), messageBus, codec, config,
                    builder.initialValues.get(index), isFaulty, readiness::allReady,
                    new SeededRandomBitSource(builder.seed * 31 + index));
            if (isFaulty) {
                network.disconnect(nodeConfig.address());
            }
            created.add(node);
            if (builder.markReady) {
                readiness.markReady(index);
            }
        }
        this.nodes = List.copyOf(created);
        this.statusClient = new StatusClient(messageBus, codec,
                new NetworkAddress(builder.host, builder.basePort + config.nodeCount()));
        this.driver = new SimulationDriver(List.of(network), nodes, List.of(messageBus));
    }

    private static Set<Integer> lastIndexes(ConsensusConfig config) {
        Set<Integer> indexes = new HashSet<>();
        IntStream.range(config.nodeCount() - config.faultyCount(), config.nodeCount()).forEach(indexes::add);
        return indexes;
    }

    /**
     * Starts every node; faulty nodes decline.
     */
    public void startAll() {
        nodes.forEach(BenOrReplica::start);
    }

    public void stopAll() {
        nodes.forEach(BenOrReplica::stop);
    }

    public void run(int ticks) {
        driver.runSimulation(ticks);
    }

    /**
     * Ticks until every healthy node has decided or {@code maxTicks} have run.
     *
     * @return true if every healthy node decided
     */
    public boolean runUntilDecided(int maxTicks) {
        return driver.runUntil(this::allHealthyDecided, maxTicks);
    }

    public boolean allHealthyDecided() {
        return healthyNodes().stream().allMatch(node -> node.snapshot().hasDecided());
    }

    public List<BenOrReplica> nodes() {
        return nodes;
    }

    public BenOrReplica node(int index) {
        return nodes.get(index);
    }

    public List<BenOrReplica> healthyNodes() {
        return nodes.stream().filter(node -> !node.isFaulty()).toList();
    }

    public List<ConsensusSnapshot> snapshots() {
        return nodes.stream().map(BenOrReplica::snapshot).toList();
    }

    public ConsensusConfig config() {
        return config;
    }

    public Topology topology() {
        return topology;
    }

    public SimulatedNetwork network() {
        return network;
    }

    public MessageBus messageBus() {
        return messageBus;
    }

    /**
     * Observer bound to the first port after the nodes' ports.
     */
    public StatusClient statusClient() {
        return statusClient;
    }

    public ReadinessGate readiness() {
        return readiness;
    }

    public SimulationDriver driver() {
        return driver;
    }

    public static Builder builder(ConsensusConfig config) {
        return new Builder(config);
    }

    public static final class Builder {
        private final ConsensusConfig config;
        private List<Value> initialValues;
        private Set<Integer> faultyIndexes;
        private long seed = 42L;
        private int networkDelayTicks = 1;
        private double packetLossRate = 0.0;
        private String host = Topology.DEFAULT_HOST;
        private int basePort = Topology.DEFAULT_BASE_PORT;
        private boolean markReady = true;

        private Builder(ConsensusConfig config) {
            if (config == null) {
                throw new IllegalArgumentException("Config cannot be null");
            }
            this.config = config;
        }

        public Builder initialValues(List<Value> initialValues) {
            this.initialValues = List.copyOf(initialValues);
            return this;
        }

        /**
         * Gives every node the same initial value.
         */
        public Builder initialValue(Value value) {
            this.initialValues = Collections.nCopies(config.nodeCount(), value);
            return this;
        }

        /**
         * Chooses which nodes are faulty. Defaults to the last F indexes.
         */
        public Builder faultyIndexes(Set<Integer> faultyIndexes) {
            this.faultyIndexes = Set.copyOf(faultyIndexes);
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder networkDelayTicks(int networkDelayTicks) {
            this.networkDelayTicks = networkDelayTicks;
            return this;
        }

        public Builder packetLossRate(double packetLossRate) {
            this.packetLossRate = packetLossRate;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder basePort(int basePort) {
            this.basePort = basePort;
            return this;
        }

        /**
         * When false, the readiness gate starts closed and the caller marks nodes ready.
         */
        public Builder markReady(boolean markReady) {
            this.markReady = markReady;
            return this;
        }

        public BenOrCluster build() {
            if (initialValues == null) {
                throw new IllegalArgumentException("Initial values must be provided");
            }
            if (initialValues.size() != config.nodeCount()) {
                throw new IllegalArgumentException("Expected " + config.nodeCount() + " initial values, got " +
                        initialValues.size());
            }
            if (faultyIndexes != null) {
                if (faultyIndexes.size() != config.faultyCount()) {
                    throw new IllegalArgumentException("Expected " + config.faultyCount() + " faulty nodes, got " +
                            faultyIndexes.size());
                }
                for (int index : faultyIndexes) {
                    if (index < 0 || index >= config.nodeCount()) {
                        throw new IllegalArgumentException("Invalid faulty node index: " + index);
                    }
                }
            }
            return new BenOrCluster(this);
        }
    }
}
