package com.phillippitts.docassist.service.index;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link ContentIndex}. Entries last until removed or restart.
 */
public class InMemoryContentIndex implements ContentIndex {

    private static final Logger LOG = LogManager.getLogger(InMemoryContentIndex.class);

    private final Map<String, IndexedContent> entries = new ConcurrentHashMap<>();

    @Override
    public void put(IndexedContent content) {
        Objects.requireNonNull(content, "content");
        entries.put(content.source(), content);
        LOG.debug("Indexed document (keyPoints={}, total={})", content.keyPoints().size(), entries.size());
    }

    @Override
    public Optional<IndexedContent> get(String source) {
        return source == null ? Optional.empty() : Optional.ofNullable(entries.get(source));
    }

    @Override
    public boolean remove(String source) {
        return source != null && entries.remove(source) != null;
    }

    @Override
    public int size() {
        return entries.size();
    }
}
