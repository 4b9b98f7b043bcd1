/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/summaries}, {@code POST /api/index}, {@code POST /api/questions},
 *       {@code POST /api/lookups} - content processing, answered asynchronously</li>
 *   <li>{@code GET /api/status} - admission snapshot and available capabilities</li>
 *   <li>{@code DELETE /api/operations/...} - cancellation</li>
 *   <li>{@code GET|PUT /api/policy} - processing policy and capability pin</li>
 * </ul>
 */
package com.phillippitts.docassist.presentation.controller;
