/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend {@link com.phillippitts.docassist.exception.DocAssistException}
 * so the REST boundary can translate them in one place.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.docassist.exception.OperationCancelledException} - a queued or
 *       active operation was cancelled</li>
 *   <li>{@link com.phillippitts.docassist.exception.CapabilityUnavailableException} - no inference
 *       capability is reachable</li>
 *   <li>{@link com.phillippitts.docassist.exception.CandidatesExhaustedException} - every ranked
 *       capability failed; carries the attempt count</li>
 *   <li>{@link com.phillippitts.docassist.exception.CapabilityInvocationException} - one
 *       capability call failed or timed out</li>
 * </ul>
 *
 * <p>Classification skips and waits are not exceptions; they are returned as verdicts.
 *
 * @see com.phillippitts.docassist.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.docassist.exception;
