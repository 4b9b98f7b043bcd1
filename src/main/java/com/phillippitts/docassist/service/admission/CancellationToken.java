package com.phillippitts.docassist.service.admission;

import com.phillippitts.docassist.exception.OperationCancelledException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Cooperative cancellation signal scoped to one execution attempt.
 *
 * <p>The token only moves from active to cancelled, once. Running work is expected to poll
 * {@link #isCancelled()} or call {@link #throwIfCancelled()} at its own checkpoints, or to
 * register an {@link #onCancel(Runnable) listener} that aborts a blocking call. Nothing is
 * interrupted preemptively.
 *
 * <p><b>Thread Safety:</b> This class is thread-safe. Listeners run on the thread that
 * calls {@link #cancel()}, outside the token's monitor.
 */
public final class CancellationToken {

    private static final Logger LOG = LogManager.getLogger(CancellationToken.class);

    private volatile boolean cancelled;
    private final List<Runnable> listeners = new ArrayList<>();

    /**
     * Moves the token to the cancelled state and runs registered listeners.
     *
     * @return {@code true} if this call cancelled the token, {@code false} if it already was
     */
    public boolean cancel() {
        List<Runnable> toRun;
        synchronized (this) {
            if (cancelled) {
                return false;
            }
            cancelled = true;
            toRun = List.copyOf(listeners);
            listeners.clear();
        }
        for (Runnable listener : toRun) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                LOG.warn("Cancellation listener failed: {}", e.toString());
            }
        }
        return true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Checkpoint for running work.
     *
     * @throws OperationCancelledException if the token has been cancelled
     */
    public void throwIfCancelled() {
        if (cancelled) {
            throw new OperationCancelledException("Operation cancelled");
        }
    }

    /**
     * Registers a listener to run on cancellation. Runs immediately on the calling thread if
     * the token is already cancelled.
     */
    public void onCancel(Runnable listener) {
        boolean runNow;
        synchronized (this) {
            runNow = cancelled;
            if (!runNow) {
                listeners.add(listener);
            }
        }
        if (runNow) {
            listener.run();
        }
    }
}
