package com.phillippitts.docassist.domain;

import java.util.List;
import java.util.Objects;

/**
 * What happened to a content request. Skips, prompts and waits are ordinary outcomes
 * ("nothing happened, here's why"), not errors.
 *
 * @param status     outcome status
 * @param reason     classification reason code, or {@code null} for processed results
 * @param capability capability that produced the result, or {@code null}
 * @param text       raw model output or answer, empty when nothing ran
 * @param bullets    extracted key points, empty when not applicable
 * @param durationMs wall time spent, in milliseconds
 */
public record ProcessingOutcome(
        Status status,
        String reason,
        String capability,
        String text,
        List<String> bullets,
        long durationMs
) {

    public enum Status { PROCESSED, CACHED, SKIPPED, PROMPT, WAITING }

    public ProcessingOutcome {
        Objects.requireNonNull(status, "status");
        text = text == null ? "" : text;
        bullets = bullets == null ? List.of() : List.copyOf(bullets);
    }

    public static ProcessingOutcome processed(String capability, String text, List<String> bullets, long durationMs) {
        return new ProcessingOutcome(Status.PROCESSED, null, capability, text, bullets, durationMs);
    }

    public ProcessingOutcome asCached(long durationMs) {
        return new ProcessingOutcome(Status.CACHED, reason, capability, text, bullets, durationMs);
    }

    /** Maps a non-automatic verdict to the matching outcome. */
    public static ProcessingOutcome notProcessed(ClassificationVerdict verdict) {
        Status status = switch (verdict.action()) {
            case SKIP -> Status.SKIPPED;
            case PROMPT -> Status.PROMPT;
            case WAIT -> Status.WAITING;
            case AUTOMATIC -> throw new IllegalArgumentException("Automatic verdicts are processed");
        };
        return new ProcessingOutcome(status, verdict.reason(), null, "", List.of(), 0L);
    }
}
