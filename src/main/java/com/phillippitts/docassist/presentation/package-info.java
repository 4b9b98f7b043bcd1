/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Controllers are thin adapters over the orchestrator, the admission controller and the
 * policy store; exception handlers map domain exceptions to HTTP status codes.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST controllers for API endpoints</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * @see com.phillippitts.docassist.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.docassist.presentation;
