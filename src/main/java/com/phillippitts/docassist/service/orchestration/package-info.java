/**
 * Request pipelines composing the gate, the admission controller and the fallback executor.
 *
 * @see com.phillippitts.docassist.service.orchestration.ContentProcessingOrchestrator
 */
package com.phillippitts.docassist.service.orchestration;
