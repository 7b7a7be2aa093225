package benor.cmd;

import benor.client.StatusClient;
import benor.consensus.ConsensusConfig;
import benor.consensus.Value;
import benor.messaging.JsonMessageCodec;
import benor.replica.BenOrReplica;
import benor.replica.StatusReport;
import benor.simulation.BenOrCluster;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Command-line entry point that runs one simulated Ben-Or cluster and prints
 * every node's final state as JSON.
 * <p>
 * Arguments: {@code --nodes=N --faulty=F --values=1,0,1 --seed=S --ticks=T --delay=D --loss=L}.
 * Without {@code --values} every node starts with 1.
 */
public class SimulationApplication {

    private static final int STATUS_QUERY_TICKS = 20;

    private final ConsensusConfig config;
    private final List<Value> initialValues;
    private final long seed;
    private final int maxTicks;
    private final int delayTicks;
    private final double lossRate;

    public SimulationApplication(ConsensusConfig config, List<Value> initialValues, long seed,
                                 int maxTicks, int delayTicks, double lossRate) {
        if (maxTicks <= 0) {
            throw new IllegalArgumentException("ticks must be positive");
        }
        this.config = config;
        this.initialValues = List.copyOf(initialValues);
        this.seed = seed;
        this.maxTicks = maxTicks;
        this.delayTicks = delayTicks;
        this.lossRate = lossRate;
    }

    public static void main(String[] args) {
        System.out.println("Starting Ben-Or consensus simulation...");
        System.out.println("Arguments: " + String.join(" ", args));

        try {
            SimulationApplication application = SimulationApplication.fromArgs(args);
            application.run();
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid arguments: " + e.getMessage());
            System.exit(1);
        }
    }

    public static SimulationApplication fromArgs(String[] args) {
        int nodes = 4;
        int faulty = 1;
        String values = null;
        long seed = 42L;
        int ticks = 2000;
        int delay = 1;
        double loss = 0.0;
        for (String arg : args) {
            if (arg.startsWith("--nodes=")) nodes = Integer.parseInt(arg.substring(8));
            else if (arg.startsWith("--faulty=")) faulty = Integer.parseInt(arg.substring(9));
            else if (arg.startsWith("--values=")) values = arg.substring(9);
            else if (arg.startsWith("--seed=")) seed = Long.parseLong(arg.substring(7));
            else if (arg.startsWith("--ticks=")) ticks = Integer.parseInt(arg.substring(8));
            else if (arg.startsWith("--delay=")) delay = Integer.parseInt(arg.substring(8));
            else if (arg.startsWith("--loss=")) loss = Double.parseDouble(arg.substring(7));
            else throw new IllegalArgumentException("Unknown argument: " + arg);
        }
        ConsensusConfig config = ConsensusConfig.of(nodes, faulty);
        List<Value> initialValues = values == null || values.isBlank()
                ? Collections.nCopies(nodes, Value.ONE)
                : Arrays.stream(values.split(",")).map(Value::fromWire).toList();
        return new SimulationApplication(config, initialValues, seed, ticks, delay, loss);
    }

    /**
     * Runs until every healthy node decides or the tick budget is spent, then stops the cluster.
     *
     * @return the status report of every node
     */
    public List<StatusReport> run() {
        System.out.println("Configuration: " + config + ", values=" + initialValues + ", seed=" + seed);
        BenOrCluster cluster = BenOrCluster.builder(config)
                .initialValues(initialValues)
                .seed(seed)
                .networkDelayTicks(delayTicks)
                .packetLossRate(lossRate)
                .build();

        cluster.startAll();
        boolean decided = cluster.runUntilDecided(maxTicks);
        long ticks = cluster.driver().getTicks();
        cluster.stopAll();

        System.out.println(decided
                ? "All healthy nodes decided after " + ticks + " ticks"
                : "No agreement after " + ticks + " ticks");
        System.out.println("Network: sent=" + cluster.network().getSentCount() +
                ", delivered=" + cluster.network().getDeliveredCount() +
                ", dropped=" + cluster.network().getDroppedCount());

        List<StatusReport> reports = collectReports(cluster);
        JsonMessageCodec codec = new JsonMessageCodec();
        reports.forEach(report -> System.out.println(codec.toJson(report)));
        return reports;
    }

    // Asks every healthy node over the bus; faulty nodes never answer, so they are reported directly.
    static List<StatusReport> collectReports(BenOrCluster cluster) {
        Map<Integer, StatusReport> answered = new TreeMap<>();
        StatusClient statusClient = cluster.statusClient();
        for (BenOrReplica node : cluster.healthyNodes()) {
            statusClient.requestStatus(node.getNetworkAddress(), report -> answered.put(report.nodeId(), report));
        }
        cluster.driver().runUntil(() -> answered.size() == cluster.healthyNodes().size(), STATUS_QUERY_TICKS);
        statusClient.cancelAll();

        List<StatusReport> reports = new ArrayList<>();
        for (BenOrReplica node : cluster.nodes()) {
            int index = node.getNodeId().index();
            reports.add(answered.getOrDefault(index, new StatusReport(index, node.status(), node.snapshot())));
        }
        return reports;
    }

    public ConsensusConfig getConfig() { return config; }
    public List<Value> getInitialValues() { return initialValues; }
    public long getSeed() { return seed; }
    public int getMaxTicks() { return maxTicks; }
    public int getDelayTicks() { return delayTicks; }
    public double getLossRate() { return lossRate; }
}
