/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.docassist.config.ThreadPoolConfig} - executors for admitted
 *       work and timed capability calls</li>
 *   <li>{@link com.phillippitts.docassist.config.ThreadPoolMetricsConfig} - admission and
 *       pool gauges</li>
 *   <li>{@link com.phillippitts.docassist.config.CapabilityConfig} - model-server client,
 *       availability probe, policy store</li>
 *   <li>{@link com.phillippitts.docassist.config.OrchestrationConfig} - orchestrator, summary
 *       cache, content index</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - typed {@code @ConfigurationProperties}</li>
 *   <li>{@code config.logging} - Logging infrastructure configuration (MDC filters)</li>
 * </ul>
 */
package com.phillippitts.docassist.config;
