/**
 * Immutable domain types shared by the admission, classification and capability services.
 *
 * <p>Records validate their invariants in compact constructors; enums carry the stable
 * identifiers used in logs, metrics and the REST surface.
 */
package com.phillippitts.docassist.domain;
