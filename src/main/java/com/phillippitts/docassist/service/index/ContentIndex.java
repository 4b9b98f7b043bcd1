package com.phillippitts.docassist.service.index;

import java.util.Optional;

/**
 * Store for indexed documents, keyed by source.
 */
public interface ContentIndex {

    /** Adds or replaces the entry for {@code content.source()}. */
    void put(IndexedContent content);

    Optional<IndexedContent> get(String source);

    boolean remove(String source);

    int size();
}
