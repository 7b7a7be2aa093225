package benor.simulation;

/**
 * Shared cancellation flag for a chain of scheduled tasks. Once cancelled, no task
 * scheduled under this token runs, including tasks already queued.
 */
public final class CancellationToken {

    private boolean cancelled;

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public String toString() {
        return "CancellationToken{cancelled=" + cancelled + '}';
    }
}
