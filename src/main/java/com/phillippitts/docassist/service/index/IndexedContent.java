package com.phillippitts.docassist.service.index;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A document held by the {@link ContentIndex}.
 *
 * @param source    source locator the entry is keyed by
 * @param title     document title
 * @param keyPoints key points produced when the document was indexed
 * @param text      extracted text, kept so later questions can use it as context
 * @param indexedAt when the entry was written
 */
public record IndexedContent(String source, String title, List<String> keyPoints, String text, Instant indexedAt) {

    public IndexedContent {
        Objects.requireNonNull(source, "source");
        title = title == null ? "" : title;
        keyPoints = keyPoints == null ? List.of() : List.copyOf(keyPoints);
        text = text == null ? "" : text;
        Objects.requireNonNull(indexedAt, "indexedAt");
    }
}
