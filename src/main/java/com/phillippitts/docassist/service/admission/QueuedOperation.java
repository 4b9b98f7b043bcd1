package com.phillippitts.docassist.service.admission;

import com.phillippitts.docassist.domain.OperationCategory;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Work waiting for a free slot in its category. Removed from the queue exactly once:
 * either when it is started by a drain or when it is cancelled.
 */
record QueuedOperation<T>(
        String id,
        String resourceKey,
        OperationCategory category,
        CancellableWork<T> work,
        CompletableFuture<T> result,
        CancellationToken token,
        Instant enqueuedAt
) { }
