package com.phillippitts.docassist.domain;

/** What initiated a content request: an explicit user action or an automatic page event. */
public enum Trigger {
    MANUAL,
    AUTO
}
