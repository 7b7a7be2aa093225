package benor.simulation;

import benor.messaging.MessageBus;
import benor.network.Network;
import benor.replica.Replica;

import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * SimulationDriver orchestrates ticking all simulation components in deterministic order.
 * It advances the simulation clock and ensures all components progress together.
 */
public class SimulationDriver {
    private final List<Network> networks;
    private final List<? extends Replica> replicas;
    private final List<MessageBus> messageBuses;
    private long ticks = 0;

    public SimulationDriver(List<Network> networks, List<? extends Replica> replicas, List<MessageBus> messageBuses) {
        if (networks == null || replicas == null || messageBuses == null) {
            throw new IllegalArgumentException("Component lists cannot be null");
        }
        this.networks = List.copyOf(networks);
        this.replicas = List.copyOf(replicas);
        this.messageBuses = List.copyOf(messageBuses);
    }

    /**
     * Advances the simulation by one tick, calling tick() on all components in deterministic order.
     *
     * 1. Replicas (application layer - run due round steps, send messages)
     * 2. Networks (service layer - deliver messages that are due)
     * 3. MessageBuses (service layer - route delivered messages to handlers)
     */
    public void tick() {
        ticks++;
        replicas.forEach(Replica::tick);
        networks.forEach(Network::tick);
        messageBuses.forEach(MessageBus::tick);
    }

    /**
     * Runs the simulation for the specified number of ticks.
     */
    public void runSimulation(int maxTicks) {
        for (int i = 0; i < maxTicks; i++) {
            tick();
        }
    }

    /**
     * Ticks until the condition holds or {@code maxTicks} ticks have run.
     *
     * @return true if the condition was met
     */
    public boolean runUntil(BooleanSupplier condition, int maxTicks) {
        for (int i = 0; i < maxTicks; i++) {
            if (condition.getAsBoolean()) {
                return true;
            }
            tick();
        }
        return condition.getAsBoolean();
    }

    public long getTicks() {
        return ticks;
    }
}
