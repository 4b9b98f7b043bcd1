/**
 * Service layer: admission control, classification, capability fallback and the
 * orchestration that composes them.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code service.admission} - per-category concurrency ceilings, per-key exclusivity,
 *       cancellation</li>
 *   <li>{@code service.classification} - decides whether a document should be processed</li>
 *   <li>{@code service.capability} - capability ranking and fallback over the model server</li>
 *   <li>{@code service.orchestration} - summarise, index, answer and lookup pipelines</li>
 *   <li>{@code service.policy}, {@code service.cache}, {@code service.index} - stores</li>
 *   <li>{@code service.events}, {@code service.metrics}, {@code service.health} - observability</li>
 * </ul>
 */
package com.phillippitts.docassist.service;
