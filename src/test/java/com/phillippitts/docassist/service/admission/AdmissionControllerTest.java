package com.phillippitts.docassist.service.admission;

import com.phillippitts.docassist.config.properties.AdmissionProperties;
import com.phillippitts.docassist.domain.OperationCategory;
import com.phillippitts.docassist.exception.OperationCancelledException;
import com.phillippitts.docassist.service.admission.event.OperationCancelledEvent;
import com.phillippitts.docassist.service.admission.event.OperationQueuedEvent;
import com.phillippitts.docassist.testutil.EventCapturingPublisher;
import com.phillippitts.docassist.testutil.ManualExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class AdmissionControllerTest {

    private static final OperationCategory SUMMARY = OperationCategory.CONTENT_SUMMARIZATION;

    private ManualExecutor executor;
    private EventCapturingPublisher publisher;
    private AdmissionController controller;

    @BeforeEach
    void setUp() {
        executor = new ManualExecutor();
        publisher = new EventCapturingPublisher();
        controller = new AdmissionController(new AdmissionProperties(), executor, publisher);
    }

    @Test
    void usesDefaultCeilings() {
        assertThat(controller.getCeiling(OperationCategory.INTERACTIVE_QUERY)).isEqualTo(3);
        assertThat(controller.getCeiling(OperationCategory.CONTENT_INDEXING)).isEqualTo(3);
        assertThat(controller.getCeiling(SUMMARY)).isEqualTo(2);
    }

    @Test
    void queuesWorkBeyondCeiling() {
        CompletableFuture<String> a = controller.submit(SUMMARY, "a", token -> "A");
        CompletableFuture<String> b = controller.submit(SUMMARY, "b", token -> "B");
        CompletableFuture<String> c = controller.submit(SUMMARY, "c", token -> "C");

        assertThat(controller.getActiveCount(SUMMARY)).isEqualTo(2);
        assertThat(controller.getQueueLength(SUMMARY)).isEqualTo(1);
        assertThat(controller.isRunning(SUMMARY, "c")).isFalse();
        assertThat(executor.pendingCount()).isEqualTo(2);

        OperationQueuedEvent queued = publisher.eventsOfType(OperationQueuedEvent.class).get(0);
        assertThat(queued.resourceKey()).isEqualTo("c");
        assertThat(queued.queueLength()).isEqualTo(1);

        executor.runNext();

        assertThat(a).isCompletedWithValue("A");
        assertThat(controller.isRunning(SUMMARY, "c")).isTrue();
        assertThat(controller.getActiveCount(SUMMARY)).isEqualTo(2);
        assertThat(controller.getQueueLength(SUMMARY)).isZero();

        executor.runAll();

        assertThat(b).isCompletedWithValue("B");
        assertThat(c).isCompletedWithValue("C");
        assertThat(controller.getActiveCount(SUMMARY)).isZero();
    }

    @Test
    void activeCountNeverExceedsCeilingUnderLoad() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            AdmissionController real = new AdmissionController(new AdmissionProperties(), pool, null);
            AtomicInteger running = new AtomicInteger();
            AtomicInteger maxSeen = new AtomicInteger();
            List<CompletableFuture<Integer>> results = new ArrayList<>();

            for (int i = 0; i < 20; i++) {
                int n = i;
                results.add(real.submit(SUMMARY, "key-" + i, token -> {
                    int now = running.incrementAndGet();
                    maxSeen.accumulateAndGet(now, Math::max);
                    Thread.sleep(5);
                    running.decrementAndGet();
                    return n;
                }));
            }

            CompletableFuture.allOf(results.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);
            assertThat(maxSeen.get()).isLessThanOrEqualTo(2);
            assertThat(real.getActiveCount(SUMMARY)).isZero();
            assertThat(real.getQueueLength(SUMMARY)).isZero();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void secondSubmissionForSameKeyWaitsThenRunsAgain() {
        AtomicInteger executions = new AtomicInteger();
        CompletableFuture<Integer> first = controller.submit(SUMMARY, "page", token -> executions.incrementAndGet());
        CompletableFuture<Integer> second = controller.submit(SUMMARY, "page", token -> executions.incrementAndGet());

        // Only one execution dispatched; the second caller is waiting, not queued
        assertThat(executor.pendingCount()).isEqualTo(1);
        assertThat(controller.getActiveCount(SUMMARY)).isEqualTo(1);
        assertThat(controller.getQueueLength(SUMMARY)).isZero();
        assertThat(second).isNotDone();

        executor.runNext();

        assertThat(first).isCompletedWithValue(1);
        assertThat(second).isNotDone();
        assertThat(controller.isRunning(SUMMARY, "page")).isTrue();

        executor.runNext();

        assertThat(second).isCompletedWithValue(2);
        assertThat(executions.get()).isEqualTo(2);
        assertThat(controller.getActiveCount(SUMMARY)).isZero();
    }

    @Test
    void waitingCallerResubmitsEvenWhenFirstFails() {
        CompletableFuture<String> first = controller.submit(SUMMARY, "page", token -> {
            throw new IllegalStateException("model error");
        });
        CompletableFuture<String> second = controller.submit(SUMMARY, "page", token -> "ok");

        executor.runAll();

        assertThat(first).isCompletedExceptionally();
        assertThat(second).isCompletedWithValue("ok");
    }

    @Test
    void identicalSubmissionsNeverRunConcurrently() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            AdmissionController real = new AdmissionController(new AdmissionProperties(), pool, null);
            AtomicInteger running = new AtomicInteger();
            AtomicInteger overlaps = new AtomicInteger();
            CancellableWork<Integer> work = token -> {
                if (running.incrementAndGet() > 1) {
                    overlaps.incrementAndGet();
                }
                Thread.sleep(20);
                running.decrementAndGet();
                return 1;
            };

            CompletableFuture<Integer> a = real.submit(SUMMARY, "same", work);
            CompletableFuture<Integer> b = real.submit(SUMMARY, "same", work);

            assertThat(a.get(5, TimeUnit.SECONDS)).isEqualTo(1);
            assertThat(b.get(5, TimeUnit.SECONDS)).isEqualTo(1);
            assertThat(overlaps.get()).isZero();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void queuedItemCollidingWithActiveKeyIsRequeued() {
        controller.submit(SUMMARY, "a", token -> "a");
        controller.submit(SUMMARY, "c", token -> "c");
        CompletableFuture<String> firstB = controller.submit(SUMMARY, "b", token -> "b1");
        CompletableFuture<String> secondB = controller.submit(SUMMARY, "b", token -> "b2");
        assertThat(controller.getQueueLength(SUMMARY)).isEqualTo(2);

        // "a" finishes: the first "b" starts and the ceiling is reached again
        executor.runNext();
        assertThat(controller.isRunning(SUMMARY, "b")).isTrue();
        assertThat(controller.getQueueLength(SUMMARY)).isEqualTo(1);

        // "c" finishes: the second "b" collides with the active one and goes back to the queue
        executor.runNext();
        assertThat(controller.getActiveCount(SUMMARY)).isEqualTo(1);
        assertThat(controller.getQueueLength(SUMMARY)).isEqualTo(1);
        assertThat(secondB).isNotDone();

        executor.runNext();
        assertThat(firstB).isCompletedWithValue("b1");
        assertThat(controller.getQueueLength(SUMMARY)).isZero();

        executor.runNext();
        assertThat(secondB).isCompletedWithValue("b2");
    }

    @Test
    void cancellingQueuedOperationRejectsItWithoutRunning() {
        AdmissionProperties props = new AdmissionProperties();
        props.setContentSummarizationMax(1);
        controller = new AdmissionController(props, executor, publisher);
        AtomicInteger queuedRuns = new AtomicInteger();

        controller.submit(SUMMARY, "first", token -> "1");
        CompletableFuture<Integer> queued = controller.submit(SUMMARY, "second", token -> queuedRuns.incrementAndGet());

        assertThat(controller.cancel(SUMMARY, "second")).isTrue();

        assertThat(queued).isCompletedExceptionally();
        assertThatThrownBy(queued::join).hasCauseInstanceOf(OperationCancelledException.class);
        assertThat(controller.getQueueLength(SUMMARY)).isZero();

        executor.runAll();
        assertThat(queuedRuns.get()).isZero();

        OperationCancelledEvent event = publisher.eventsOfType(OperationCancelledEvent.class).get(0);
        assertThat(event.wasActive()).isFalse();
        assertThat(event.resourceKey()).isEqualTo("second");
    }

    @Test
    void cancellingActiveOperationFreesSlotForNextQueued() {
        AdmissionProperties props = new AdmissionProperties();
        props.setContentSummarizationMax(1);
        controller = new AdmissionController(props, executor, publisher);
        AtomicInteger activeRuns = new AtomicInteger();

        CompletableFuture<Integer> active = controller.submit(SUMMARY, "first", token -> activeRuns.incrementAndGet());
        CompletableFuture<String> queued = controller.submit(SUMMARY, "second", token -> "second-done");

        assertThat(controller.cancel(SUMMARY, "first")).isTrue();

        assertThatThrownBy(active::join).hasCauseInstanceOf(OperationCancelledException.class);
        assertThat(controller.isRunning(SUMMARY, "first")).isFalse();
        assertThat(controller.isRunning(SUMMARY, "second")).isTrue();
        assertThat(controller.getQueueLength(SUMMARY)).isZero();

        executor.runAll();

        // the cancelled work was never started because its token was already signalled
        assertThat(activeRuns.get()).isZero();
        assertThat(queued).isCompletedWithValue("second-done");
        assertThat(controller.getActiveCount(SUMMARY)).isZero();
    }

    @Test
    void runningWorkObservesCancellationToken() throws Exception {
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            AdmissionController real = new AdmissionController(new AdmissionProperties(), pool, null);
            CountDownLatch started = new CountDownLatch(1);
            CountDownLatch unwound = new CountDownLatch(1);

            CompletableFuture<String> result = real.submit(SUMMARY, "long", token -> {
                started.countDown();
                try {
                    while (!token.isCancelled()) {
                        Thread.sleep(5);
                    }
                    token.throwIfCancelled();
                    return "unreachable";
                } finally {
                    unwound.countDown();
                }
            });

            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(real.cancel(SUMMARY, "long")).isTrue();

            assertThatThrownBy(result::join).hasCauseInstanceOf(OperationCancelledException.class);
            assertThat(unwound.await(5, TimeUnit.SECONDS)).isTrue();
            await().atMost(Duration.ofSeconds(2)).until(() -> real.getActiveCount(SUMMARY) == 0);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void staleCompletionDoesNotRemoveNewerRecord() {
        AtomicInteger runs = new AtomicInteger();
        controller.submit(SUMMARY, "page", token -> runs.incrementAndGet());
        controller.cancel(SUMMARY, "page");
        CompletableFuture<Integer> fresh = controller.submit(SUMMARY, "page", token -> 42);

        // the cancelled task finishes first; the fresh record must survive it
        executor.runNext();
        assertThat(controller.isRunning(SUMMARY, "page")).isTrue();

        executor.runNext();
        assertThat(fresh).isCompletedWithValue(42);
        assertThat(runs.get()).isZero();
    }

    @Test
    void callerCancellingItsFutureDoesNotReleaseTheKey() {
        CompletableFuture<String> first = controller.submit(SUMMARY, "page", token -> "first");
        first.cancel(true);

        CompletableFuture<String> second = controller.submit(SUMMARY, "page", token -> "second");

        assertThat(controller.isRunning(SUMMARY, "page")).isTrue();
        assertThat(second).isNotDone();

        executor.runAll();

        assertThat(second).isCompletedWithValue("second");
        assertThat(controller.getActiveCount(SUMMARY)).isZero();
    }

    @Test
    void callerCompletingItsFutureDoesNotAffectBookkeeping() {
        CompletableFuture<String> first = controller.submit(SUMMARY, "page", token -> "real");
        first.complete("forged");
        CompletableFuture<String> waiter = controller.submit(SUMMARY, "page", token -> "next");

        executor.runNext();
        assertThat(controller.isRunning(SUMMARY, "page")).isTrue();
        assertThat(waiter).isNotDone();

        executor.runAll();
        assertThat(waiter).isCompletedWithValue("next");
    }

    @Test
    void cancelReturnsFalseForUnknownKey() {
        assertThat(controller.cancel(SUMMARY, "nothing")).isFalse();
    }

    @Test
    void cancelAllCancelsActiveAndQueued() {
        CompletableFuture<String> a = controller.submit(SUMMARY, "a", token -> "a");
        CompletableFuture<String> b = controller.submit(SUMMARY, "b", token -> "b");
        CompletableFuture<String> c = controller.submit(SUMMARY, "c", token -> "c");
        CompletableFuture<String> other = controller.submit(OperationCategory.CONTENT_INDEXING, "a", token -> "idx");

        assertThat(controller.cancelAll(SUMMARY)).isEqualTo(3);

        assertThat(a).isCompletedExceptionally();
        assertThat(b).isCompletedExceptionally();
        assertThat(c).isCompletedExceptionally();
        assertThat(controller.getActiveCount(SUMMARY)).isZero();
        assertThat(controller.getQueueLength(SUMMARY)).isZero();

        executor.runAll();
        assertThat(other).isCompletedWithValue("idx");
        assertThat(controller.cancelAll(SUMMARY)).isZero();
    }

    @Test
    void cancelForKeyCoversEveryCategory() {
        CompletableFuture<String> summary = controller.submit(SUMMARY, "doc", token -> "s");
        CompletableFuture<String> index = controller.submit(OperationCategory.CONTENT_INDEXING, "doc", token -> "i");

        assertThat(controller.cancelForKey("doc")).isTrue();

        assertThat(summary).isCompletedExceptionally();
        assertThat(index).isCompletedExceptionally();
        assertThat(controller.cancelForKey("doc")).isFalse();
    }

    @Test
    void statusReportsEveryCategory() {
        controller.submit(SUMMARY, "a", token -> "a");
        controller.submit(SUMMARY, "b", token -> "b");
        controller.submit(SUMMARY, "c", token -> "c");
        controller.submit(OperationCategory.INTERACTIVE_QUERY, "q", token -> "q");

        Map<OperationCategory, CategoryStatus> status = controller.getStatus();

        assertThat(status).hasSize(3);
        assertThat(status.get(SUMMARY)).isEqualTo(new CategoryStatus(2, 1));
        assertThat(status.get(OperationCategory.INTERACTIVE_QUERY)).isEqualTo(new CategoryStatus(1, 0));
        assertThat(status.get(OperationCategory.CONTENT_INDEXING)).isEqualTo(new CategoryStatus(0, 0));
    }

    @Test
    void workFailurePassesThroughAndReleasesSlot() {
        IllegalStateException boom = new IllegalStateException("boom");
        CompletableFuture<String> result = controller.submit(SUMMARY, "a", token -> {
            throw boom;
        });

        executor.runNext();

        assertThatThrownBy(result::join).hasCause(boom);
        assertThat(controller.getActiveCount(SUMMARY)).isZero();
    }

    @Test
    void rejectedDispatchFailsResultAndFreesSlot() {
        controller = new AdmissionController(new AdmissionProperties(), command -> {
            throw new RejectedExecutionException("full");
        }, publisher);

        CompletableFuture<String> result = controller.submit(SUMMARY, "a", token -> "a");

        assertThatThrownBy(result::join).hasCauseInstanceOf(RejectedExecutionException.class);
        assertThat(controller.getActiveCount(SUMMARY)).isZero();
    }
}
