package fun.fengwk.msh.core.service.browser.runtime;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/**
 * Cooperative cancellation flag shared between a task's submitter and the worker running it.
 * Playwright objects are bound to their worker thread, so a task stops itself at its next
 * checkpoint instead of being torn down from outside.
 *
 * <p>The worker also reports through it when the task leaves the queue, so a submitter can
 * start its deadline then instead of at submission.
 *
 * @author fengwk
 */
public class BrowserTaskSignal {

    private final CompletableFuture<Void> started = new CompletableFuture<>();
    private volatile String cancelReason;

    public void cancel(String reason) {
        this.cancelReason = reason == null ? "cancelled" : reason;
    }

    public boolean isCancelled() {
        return cancelReason != null;
    }

    public void throwIfCancelled() {
        String reason = cancelReason;
        if (reason != null) {
            throw new CancellationException(reason);
        }
    }

    public void markStarted() {
        started.complete(null);
    }

    public boolean isStarted() {
        return started.isDone();
    }

    /**
     * Run {@code action} once a worker has picked the task up, immediately if it already has.
     */
    public void whenStarted(Runnable action) {
        started.thenRun(action);
    }

}
