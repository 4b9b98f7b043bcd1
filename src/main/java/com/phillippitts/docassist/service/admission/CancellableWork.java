package com.phillippitts.docassist.service.admission;

/**
 * Unit of work admitted by the {@link AdmissionController}.
 *
 * <p>Implementations should observe the token at their checkpoints and unwind when it is
 * cancelled. Whatever they return or throw is passed to the caller untouched.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface CancellableWork<T> {

    T execute(CancellationToken token) throws Exception;
}
