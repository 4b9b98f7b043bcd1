package com.phillippitts.docassist.service.classification;

import com.phillippitts.docassist.domain.ClassificationSignals;
import com.phillippitts.docassist.domain.ClassificationVerdict;
import com.phillippitts.docassist.domain.ExtractedContent;
import com.phillippitts.docassist.domain.PolicyConfiguration;
import com.phillippitts.docassist.domain.PolicyMode;
import com.phillippitts.docassist.domain.Trigger;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Decides whether a piece of content should be processed, from heuristic signals and the
 * user's policy.
 *
 * <p>Rules are evaluated in priority order; the first match wins:
 * <ol>
 *   <li>deny-listed source: skip {@code denylist}</li>
 *   <li>non-textual content type: skip {@code non_text}</li>
 *   <li>manual trigger or force: skip {@code too_short} below {@value #MANUAL_MIN_WORDS}
 *       words, else automatic {@code manual_trigger}</li>
 *   <li>non-reading surface (app shell, dashboard, search, cart, feed, canvas, button-heavy,
 *       link-dense): skip {@code non_reader}</li>
 *   <li>manual mode: wait {@code manual_mode}</li>
 *   <li>high confidence: automatic {@code allowlist} or {@code article_confident}</li>
 *   <li>assisted mode, medium confidence: prompt {@code medium_confidence}</li>
 *   <li>otherwise: wait {@code low_confidence}</li>
 * </ol>
 *
 * <p>Pure and deterministic; inputs are assumed to be validated already.
 */
@Component
public class ClassificationGate {

    /** Hard floor that even an explicit user request cannot go below. */
    public static final int MANUAL_MIN_WORDS = 80;

    static final double MAX_BUTTON_TO_PARAGRAPH_RATIO = 2.0;
    static final double MAX_LINK_DENSITY = 0.55;
    static final double ARTICLE_TEXT_DENSITY = 0.4;
    static final double MEDIUM_TEXT_DENSITY = 0.25;

    /**
     * Classifies content.
     *
     * @param content extracted content and signals
     * @param policy current user policy
     * @param trigger what initiated the request
     * @param force {@code true} when the user insists on processing
     * @return verdict with reason code, never {@code null}
     */
    public ClassificationVerdict classify(ExtractedContent content, PolicyConfiguration policy,
                                          Trigger trigger, boolean force) {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(policy, "policy");
        String source = content.source();
        ClassificationSignals signals = content.signals();
        int words = content.wordCount();

        if (policy.denies(source)) {
            return ClassificationVerdict.skip(ClassificationVerdict.DENYLIST);
        }
        if (!content.contentType().startsWith("text/")) {
            return ClassificationVerdict.skip(ClassificationVerdict.NON_TEXT);
        }
        if (trigger == Trigger.MANUAL || force) {
            return words < MANUAL_MIN_WORDS
                    ? ClassificationVerdict.skip(ClassificationVerdict.TOO_SHORT)
                    : ClassificationVerdict.automatic(ClassificationVerdict.MANUAL_TRIGGER);
        }
        if (isNonReader(signals)) {
            return ClassificationVerdict.skip(ClassificationVerdict.NON_READER);
        }
        if (policy.mode() == PolicyMode.MANUAL) {
            return ClassificationVerdict.waitFor(ClassificationVerdict.MANUAL_MODE);
        }

        // Allow-list entries are an explicit trust signal, so they only need the lower bar
        boolean allowHit = policy.allows(source);
        boolean highConfidence = allowHit
                ? words >= policy.minPromptWords()
                : (signals.hasArticleMarker() || signals.hasHeading())
                    && signals.textDensity() > ARTICLE_TEXT_DENSITY
                    && words >= policy.minAutoWords();
        if (highConfidence) {
            return ClassificationVerdict.automatic(
                    allowHit ? ClassificationVerdict.ALLOWLIST : ClassificationVerdict.ARTICLE_CONFIDENT);
        }

        boolean mediumConfidence = (signals.hasMainMarker() || signals.hasArticleMarker() || signals.hasHeading())
                && words >= policy.minPromptWords()
                && signals.textDensity() > MEDIUM_TEXT_DENSITY;
        if (policy.mode() == PolicyMode.ASSISTED && mediumConfidence) {
            return ClassificationVerdict.prompt(ClassificationVerdict.MEDIUM_CONFIDENCE);
        }

        return ClassificationVerdict.waitFor(ClassificationVerdict.LOW_CONFIDENCE);
    }

    static boolean isNonReader(ClassificationSignals s) {
        return s.appShell()
                || s.dashboard()
                || s.search()
                || s.cart()
                || s.feed()
                || s.socialFeed()
                || s.canvasHeavy()
                || s.buttonToParagraphRatio() > MAX_BUTTON_TO_PARAGRAPH_RATIO
                || s.linkDensity() > MAX_LINK_DENSITY;
    }
}
