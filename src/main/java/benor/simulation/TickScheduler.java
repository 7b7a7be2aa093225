package benor.simulation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Per-node cooperative scheduler driven by simulation ticks.
 * <p>
 * A task scheduled with delay {@code d} runs during the {@code d}-th following
 * {@link #tick()}. Tasks due on the same tick run in the order they were
 * scheduled. Everything runs on the thread that calls tick(), so a node's tasks
 * never overlap.
 */
public class TickScheduler {

    private final PriorityQueue<ScheduledTask> queue = new PriorityQueue<>(
            Comparator.comparingLong(ScheduledTask::getDueTick).thenComparingLong(ScheduledTask::sequence));
    private long currentTick = 0;
    private long sequence = 0;

    /**
     * Queues an action.
     *
     * @param delayTicks ticks to wait, at least 1
     * @param token token that can cancel the action before it runs
     * @param action the work to run
     * @return handle to the queued task
     */
    public ScheduledTask schedule(int delayTicks, CancellationToken token, Runnable action) {
        if (delayTicks < 1) {
            throw new IllegalArgumentException("Delay must be at least one tick, got: " + delayTicks);
        }
        if (token == null || action == null) {
            throw new IllegalArgumentException("Token and action cannot be null");
        }
        ScheduledTask task = new ScheduledTask(currentTick + delayTicks, sequence++, token, action);
        queue.offer(task);
        return task;
    }

    /**
     * Advances the clock and runs the tasks that are due and not cancelled.
     * Tasks scheduled while running are never due on the same tick.
     */
    public void tick() {
        currentTick++;
        List<ScheduledTask> due = new ArrayList<>();
        while (!queue.isEmpty() && queue.peek().getDueTick() <= currentTick) {
            due.add(queue.poll());
        }
        for (ScheduledTask task : due) {
            if (!task.isCancelled()) {
                task.run();
            }
        }
    }

    /**
     * Drops every queued task.
     */
    public void cancelAll() {
        queue.forEach(ScheduledTask::cancel);
        queue.clear();
    }

    public int pendingCount() {
        return (int) queue.stream().filter(task -> !task.isCancelled()).count();
    }

    public long getCurrentTick() {
        return currentTick;
    }
}
