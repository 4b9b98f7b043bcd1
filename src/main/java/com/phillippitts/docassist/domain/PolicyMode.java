package com.phillippitts.docassist.domain;

/**
 * User-selected processing mode.
 *
 * <ul>
 *   <li>MANUAL - never process content automatically</li>
 *   <li>AUTOMATIC - process high-confidence reading content automatically</li>
 *   <li>ASSISTED - like AUTOMATIC, and additionally ask the user about medium-confidence content</li>
 * </ul>
 */
public enum PolicyMode {
    MANUAL,
    AUTOMATIC,
    ASSISTED
}
