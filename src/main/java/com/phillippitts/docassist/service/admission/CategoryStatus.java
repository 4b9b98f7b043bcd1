package com.phillippitts.docassist.service.admission;

/** Point-in-time admission counts for one category. */
public record CategoryStatus(int active, int queued) { }
