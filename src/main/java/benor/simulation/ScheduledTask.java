package benor.simulation;

/**
 * Handle to a task queued on a {@link TickScheduler}.
 */
public final class ScheduledTask {

    private final long dueTick;
    private final long sequence;
    private final CancellationToken token;
    private final Runnable action;
    private boolean cancelled;
    private boolean done;

    ScheduledTask(long dueTick, long sequence, CancellationToken token, Runnable action) {
        this.dueTick = dueTick;
        this.sequence = sequence;
        this.token = token;
        this.action = action;
    }

    public void cancel() {
        cancelled = true;
    }

    /**
     * True if this task or its token was cancelled.
     */
    public boolean isCancelled() {
        return cancelled || token.isCancelled();
    }

    public boolean isDone() {
        return done;
    }

    public long getDueTick() {
        return dueTick;
    }

    long sequence() {
        return sequence;
    }

    void run() {
        done = true;
        action.run();
    }
}
