/**
 * Capability selection and fallback.
 *
 * <p>A capability is one installed model. {@link com.phillippitts.docassist.service.capability.CandidateRanking}
 * orders the available ones for a task, and
 * {@link com.phillippitts.docassist.service.capability.FallbackExecutor} walks that order
 * until a call succeeds.
 */
package com.phillippitts.docassist.service.capability;
