package com.phillippitts.docassist.domain;

/** Gating decision for content-triggered work. */
public enum VerdictAction {
    /** Never process this content. */
    SKIP,
    /** Process now without asking. */
    AUTOMATIC,
    /** Ask the user before processing. */
    PROMPT,
    /** Do nothing until the user triggers processing manually. */
    WAIT
}
