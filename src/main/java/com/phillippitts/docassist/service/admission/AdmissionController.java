package com.phillippitts.docassist.service.admission;

import com.phillippitts.docassist.config.properties.AdmissionProperties;
import com.phillippitts.docassist.domain.OperationCategory;
import com.phillippitts.docassist.exception.OperationCancelledException;
import com.phillippitts.docassist.service.admission.event.OperationCancelledEvent;
import com.phillippitts.docassist.service.admission.event.OperationQueuedEvent;
import com.phillippitts.docassist.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounds concurrency per {@link OperationCategory} and keeps at most one execution per
 * (category, resource key) in flight.
 *
 * <p><b>Admission Algorithm:</b>
 * <ol>
 *   <li>If the key is already active in the category, the caller waits for that result to
 *       settle (outcome ignored) and then resubmits. Callers never share a result object.</li>
 *   <li>Else if the category is below its ceiling, the work starts on the admission executor.</li>
 *   <li>Else the work is queued and settles when a later drain starts it.</li>
 * </ol>
 *
 * <p>When an execution finishes, its record is removed and the queue is drained front to
 * back: an item whose key collides with an active record goes to the tail, anything else
 * starts, until the ceiling is reached or every queued item has been looked at once. This
 * is best-effort FIFO, not a fairness guarantee.
 *
 * <p><b>Cancellation</b> is cooperative. Cancelling an active operation signals its token,
 * fails the caller's result with {@link OperationCancelledException} and frees the slot at
 * once; the work itself is expected to notice and unwind. A queued operation is removed and
 * failed without ever running.
 *
 * <p>Outcomes of submitted work are passed through untouched.
 *
 * <p><b>Thread Safety:</b> All bookkeeping happens under a single monitor. Work dispatch,
 * token signalling and result completion happen outside it, after the bookkeeping that
 * justifies them is already visible, so a continuation that resubmits synchronously never
 * observes a stale record.
 */
@Service
public class AdmissionController {

    private static final Logger LOG = LogManager.getLogger(AdmissionController.class);
    private static final int KEY_PREVIEW = 50;

    private final Map<OperationCategory, CategoryState> states = new EnumMap<>(OperationCategory.class);
    private final Executor executor;
    private final ApplicationEventPublisher publisher;
    private final AtomicLong sequence = new AtomicLong();
    private final Object lock = new Object();

    /**
     * Constructs an admission controller.
     *
     * @param props per-category ceilings
     * @param executor executor that runs admitted work
     * @param publisher event publisher for queue and cancel notifications (nullable)
     */
    public AdmissionController(AdmissionProperties props,
                               @Qualifier("admissionExecutor") Executor executor,
                               ApplicationEventPublisher publisher) {
        Objects.requireNonNull(props, "props");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.publisher = publisher;
        for (OperationCategory category : OperationCategory.values()) {
            states.put(category, new CategoryState(props.ceilingFor(category)));
        }
    }

    /**
     * Submits work for a resource key.
     *
     * @param category operation category
     * @param key resource key, usually the content source
     * @param work work to run; receives a fresh cancellation token per execution
     * @param <T> result type
     * @return future settling with the work's own outcome, or with
     *         {@link OperationCancelledException} if the operation is cancelled. Completing
     *         or cancelling it has no effect on the operation; use {@link #cancel} for that.
     */
    public <T> CompletableFuture<T> submit(OperationCategory category, String key, CancellableWork<T> work) {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(work, "work");

        CategoryState state = states.get(category);
        // Only this class completes it; callers get a copy.
        CompletableFuture<T> result = new CompletableFuture<>();
        ActiveOperation existing;
        ActiveOperation started = null;
        int queueLength = -1;

        synchronized (lock) {
            existing = state.active.get(key);
            if (existing == null) {
                if (state.active.size() < state.ceiling) {
                    started = new ActiveOperation(result, new CancellationToken());
                    state.active.put(key, started);
                } else {
                    state.queue.addLast(new QueuedOperation<>(nextId(category, key), key, category, work, result,
                            new CancellationToken(), Instant.now()));
                    queueLength = state.queue.size();
                }
            }
        }

        if (existing != null) {
            LOG.debug("{} for {} already running, waiting", category.id(), preview(key));
            return existing.result()
                    .handle((ignoredValue, ignoredFailure) -> null)
                    .thenCompose(ignored -> submit(category, key, work));
        }
        if (started == null) {
            LOG.info("{} ceiling ({}) reached, queued {} (queue={})",
                    category.id(), state.ceiling, preview(key), queueLength);
            publish(new OperationQueuedEvent(category, key, queueLength, Instant.now()));
            return result.copy();
        }
        dispatch(category, key, started, work, result);
        return result.copy();
    }

    /**
     * Cancels the operation for a key: the active one if there is one, otherwise the first
     * queued one.
     *
     * @return {@code true} if something was cancelled
     */
    public boolean cancel(OperationCategory category, String key) {
        CategoryState state = states.get(Objects.requireNonNull(category, "category"));
        ActiveOperation active;
        QueuedOperation<?> queued = null;
        List<Runnable> starts = List.of();

        synchronized (lock) {
            active = state.active.remove(key);
            if (active != null) {
                starts = drainLocked(category, state);
            } else {
                Iterator<QueuedOperation<?>> it = state.queue.iterator();
                while (it.hasNext()) {
                    QueuedOperation<?> candidate = it.next();
                    if (candidate.resourceKey().equals(key)) {
                        it.remove();
                        queued = candidate;
                        break;
                    }
                }
            }
        }

        if (active != null) {
            active.token().cancel();
            active.result().completeExceptionally(
                    new OperationCancelledException(category, key, "Operation cancelled"));
            LOG.info("Cancelled active {} for {}", category.id(), preview(key));
            publish(new OperationCancelledEvent(category, key, true, Instant.now()));
            starts.forEach(Runnable::run);
            return true;
        }
        if (queued != null) {
            rejectQueued(queued, "Operation cancelled before start");
            LOG.info("Cancelled queued {} for {}", category.id(), preview(key));
            return true;
        }
        return false;
    }

    /**
     * Cancels every active and queued operation in a category.
     *
     * @return number of operations cancelled
     */
    public int cancelAll(OperationCategory category) {
        CategoryState state = states.get(Objects.requireNonNull(category, "category"));
        Map<String, ActiveOperation> active;
        List<QueuedOperation<?>> queued;

        synchronized (lock) {
            active = new LinkedHashMap<>(state.active);
            state.active.clear();
            queued = new ArrayList<>(state.queue);
            state.queue.clear();
        }

        active.forEach((key, op) -> {
            op.token().cancel();
            op.result().completeExceptionally(
                    new OperationCancelledException(category, key, "All operations cancelled"));
            publish(new OperationCancelledEvent(category, key, true, Instant.now()));
        });
        queued.forEach(op -> rejectQueued(op, "All operations cancelled"));

        int total = active.size() + queued.size();
        if (total > 0) {
            LOG.info("Cancelled all {} operations (active={}, queued={})", category.id(), active.size(), queued.size());
        }
        return total;
    }

    /**
     * Cancels the key in every category, e.g. when its source is closed.
     *
     * @return {@code true} if anything was cancelled
     */
    public boolean cancelForKey(String key) {
        boolean any = false;
        for (OperationCategory category : OperationCategory.values()) {
            any |= cancel(category, key);
        }
        return any;
    }

    public int getActiveCount(OperationCategory category) {
        synchronized (lock) {
            return states.get(category).active.size();
        }
    }

    public int getQueueLength(OperationCategory category) {
        synchronized (lock) {
            return states.get(category).queue.size();
        }
    }

    public boolean isRunning(OperationCategory category, String key) {
        synchronized (lock) {
            return states.get(category).active.containsKey(key);
        }
    }

    public int getCeiling(OperationCategory category) {
        return states.get(category).ceiling;
    }

    /**
     * Returns an {active, queued} snapshot for every category, taken atomically.
     */
    public Map<OperationCategory, CategoryStatus> getStatus() {
        Map<OperationCategory, CategoryStatus> status = new EnumMap<>(OperationCategory.class);
        synchronized (lock) {
            states.forEach((category, state) ->
                    status.put(category, new CategoryStatus(state.active.size(), state.queue.size())));
        }
        return Collections.unmodifiableMap(status);
    }

    private <T> void dispatch(OperationCategory category, String key, ActiveOperation record,
                              CancellableWork<T> work, CompletableFuture<T> result) {
        try {
            executor.execute(() -> run(category, key, record, work, result));
        } catch (RejectedExecutionException e) {
            LOG.error("Executor rejected {} for {}", category.id(), preview(key));
            release(category, key, record);
            result.completeExceptionally(e);
        }
    }

    private <T> void run(OperationCategory category, String key, ActiveOperation record,
                         CancellableWork<T> work, CompletableFuture<T> result) {
        if (record.token().isCancelled()) {
            // Cancelled between admission and start; the caller already has its failure.
            release(category, key, record);
            return;
        }
        T value = null;
        Exception failure = null;
        try {
            value = work.execute(record.token());
        } catch (Exception e) {
            failure = e;
        } finally {
            release(category, key, record);
        }
        if (failure == null) {
            result.complete(value);
        } else {
            result.completeExceptionally(failure);
        }
    }

    /** Removes the record if it is still the active one for its key, then drains. */
    private void release(OperationCategory category, String key, ActiveOperation record) {
        CategoryState state = states.get(category);
        List<Runnable> starts;
        synchronized (lock) {
            state.active.remove(key, record);
            starts = drainLocked(category, state);
        }
        starts.forEach(Runnable::run);
    }

    /**
     * Promotes queued work into free slots. Must hold {@link #lock}. Returns the dispatch
     * actions to run once the lock is released.
     */
    private List<Runnable> drainLocked(OperationCategory category, CategoryState state) {
        List<Runnable> starts = new ArrayList<>();
        int remaining = state.queue.size();
        while (remaining-- > 0 && state.active.size() < state.ceiling) {
            QueuedOperation<?> next = state.queue.pollFirst();
            if (state.active.containsKey(next.resourceKey())) {
                state.queue.addLast(next);
                continue;
            }
            ActiveOperation record = new ActiveOperation(next.result(), next.token());
            state.active.put(next.resourceKey(), record);
            starts.add(() -> startQueued(category, next, record));
        }
        return starts;
    }

    private <T> void startQueued(OperationCategory category, QueuedOperation<T> op, ActiveOperation record) {
        LOG.debug("Starting queued {} {} after {}", category.id(), op.id(), op.enqueuedAt());
        dispatch(category, op.resourceKey(), record, op.work(), op.result());
    }

    private void rejectQueued(QueuedOperation<?> op, String message) {
        op.token().cancel();
        op.result().completeExceptionally(new OperationCancelledException(op.category(), op.resourceKey(), message));
        publish(new OperationCancelledEvent(op.category(), op.resourceKey(), false, Instant.now()));
    }

    private String nextId(OperationCategory category, String key) {
        return category.id() + ':' + LogSanitizer.truncate(key, KEY_PREVIEW) + ':' + sequence.incrementAndGet();
    }

    private void publish(Object event) {
        if (publisher != null) {
            publisher.publishEvent(event);
        }
    }

    private static String preview(String key) {
        return LogSanitizer.truncate(key, KEY_PREVIEW);
    }

    /** Mutable per-category bookkeeping, guarded by {@link #lock}. */
    private static final class CategoryState {
        private final int ceiling;
        private final Map<String, ActiveOperation> active = new LinkedHashMap<>();
        private final Deque<QueuedOperation<?>> queue = new ArrayDeque<>();

        private CategoryState(int ceiling) {
            this.ceiling = ceiling;
        }
    }
}
