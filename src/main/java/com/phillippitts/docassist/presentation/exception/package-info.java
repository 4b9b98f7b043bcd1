/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.docassist.exception.CapabilityUnavailableException} → 503 Service Unavailable</li>
 *   <li>{@link com.phillippitts.docassist.exception.CandidatesExhaustedException} → 503 Service Unavailable (retry)</li>
 *   <li>{@link com.phillippitts.docassist.exception.OperationCancelledException} → 409 Conflict</li>
 *   <li>Invalid input and validation failures → 400 Bad Request</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "CandidatesExhaustedException",
 *   "message": "service unavailable, try again",
 *   "details": "3 models tried",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 */
package com.phillippitts.docassist.presentation.exception;
