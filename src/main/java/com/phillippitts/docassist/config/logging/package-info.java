/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>Log4j2 is the logging backend. {@link com.phillippitts.docassist.config.logging.MdcFilter}
 * puts request correlation keys into the ThreadContext, and the executors in
 * {@link com.phillippitts.docassist.config.ThreadPoolConfig} copy it onto worker threads so
 * admitted work and capability calls log with the request that caused them.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - Unique identifier for each HTTP request (UUID format)</li>
 *   <li>{@code endpoint} - API resource the request hit, e.g. {@code summaries}</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2025-10-17 15:42:32.529 [admission-pool-1] [requestId endpoint] LEVEL logger.name - message
 * </pre>
 *
 * @see com.phillippitts.docassist.config.logging.MdcFilter
 */
package com.phillippitts.docassist.config.logging;
