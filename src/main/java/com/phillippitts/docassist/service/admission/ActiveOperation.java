package com.phillippitts.docassist.service.admission;

import java.util.concurrent.CompletableFuture;

/**
 * Bookkeeping for a running operation. Compared by identity so that a finishing execution
 * only ever removes its own record.
 */
final class ActiveOperation {

    private final CompletableFuture<?> result;
    private final CancellationToken token;

    ActiveOperation(CompletableFuture<?> result, CancellationToken token) {
        this.result = result;
        this.token = token;
    }

    CompletableFuture<?> result() {
        return result;
    }

    CancellationToken token() {
        return token;
    }
}
