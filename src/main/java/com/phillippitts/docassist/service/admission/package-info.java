/**
 * Admission control for processing work.
 *
 * <p>{@link com.phillippitts.docassist.service.admission.AdmissionController} bounds how many
 * operations of each {@link com.phillippitts.docassist.domain.OperationCategory} run at once
 * and guarantees a resource key is never processed twice concurrently in one category.
 * Cancellation is cooperative through
 * {@link com.phillippitts.docassist.service.admission.CancellationToken}.
 */
package com.phillippitts.docassist.service.admission;
