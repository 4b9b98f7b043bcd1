package com.phillippitts.docassist.domain;

import java.util.Objects;

/**
 * Result of {@link com.phillippitts.docassist.service.classification.ClassificationGate#classify}.
 *
 * @param action what to do with the content
 * @param reason stable reason code, e.g. {@code denylist} or {@code article_confident}
 */
public record ClassificationVerdict(VerdictAction action, String reason) {

    public static final String DENYLIST = "denylist";
    public static final String NON_TEXT = "non_text";
    public static final String TOO_SHORT = "too_short";
    public static final String MANUAL_TRIGGER = "manual_trigger";
    public static final String NON_READER = "non_reader";
    public static final String MANUAL_MODE = "manual_mode";
    public static final String ALLOWLIST = "allowlist";
    public static final String ARTICLE_CONFIDENT = "article_confident";
    public static final String MEDIUM_CONFIDENCE = "medium_confidence";
    public static final String LOW_CONFIDENCE = "low_confidence";

    public ClassificationVerdict {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(reason, "reason");
    }

    public static ClassificationVerdict skip(String reason) {
        return new ClassificationVerdict(VerdictAction.SKIP, reason);
    }

    public static ClassificationVerdict automatic(String reason) {
        return new ClassificationVerdict(VerdictAction.AUTOMATIC, reason);
    }

    public static ClassificationVerdict prompt(String reason) {
        return new ClassificationVerdict(VerdictAction.PROMPT, reason);
    }

    public static ClassificationVerdict waitFor(String reason) {
        return new ClassificationVerdict(VerdictAction.WAIT, reason);
    }

    public boolean proceeds() {
        return action == VerdictAction.AUTOMATIC;
    }
}
