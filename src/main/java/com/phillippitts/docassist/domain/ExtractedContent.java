package com.phillippitts.docassist.domain;

import java.util.Objects;

/**
 * Output of the signal extractor for one document: where it came from, what it is, and
 * the signals the classification gate decides on.
 *
 * @param source      source locator (URL or file path); doubles as the resource key
 * @param contentType MIME type of the fetched content; {@code text/html} when unknown
 * @param title       document title, may be empty
 * @param text        extracted readable text, may be empty
 * @param wordCount   number of words in {@code text}
 * @param signals     structural signals
 */
public record ExtractedContent(
        String source,
        String contentType,
        String title,
        String text,
        int wordCount,
        ClassificationSignals signals
) {

    public static final String DEFAULT_CONTENT_TYPE = "text/html";

    public ExtractedContent {
        Objects.requireNonNull(source, "source");
        if (contentType == null || contentType.isBlank()) {
            contentType = DEFAULT_CONTENT_TYPE;
        }
        title = title == null ? "" : title;
        text = text == null ? "" : text;
        if (wordCount < 0) {
            throw new IllegalArgumentException("Word count must not be negative, got: " + wordCount);
        }
        signals = signals == null ? ClassificationSignals.none() : signals;
    }
}
