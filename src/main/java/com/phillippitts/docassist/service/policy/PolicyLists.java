package com.phillippitts.docassist.service.policy;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalization for user-edited allow and deny lists.
 */
public final class PolicyLists {

    private PolicyLists() {
    }

    /**
     * Trims entries and drops blanks. A missing list falls back to the defaults; an explicitly
     * emptied list stays empty.
     */
    public static List<String> normalize(List<String> list, List<String> fallback) {
        if (list == null) {
            return List.copyOf(fallback);
        }
        List<String> out = new ArrayList<>(list.size());
        for (String item : list) {
            if (item == null) {
                continue;
            }
            String trimmed = item.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return List.copyOf(out);
    }

    /**
     * Parses free-text input split on commas and newlines. Blank input, or input with no
     * usable entries, yields the defaults.
     */
    public static List<String> parse(String text, List<String> fallback) {
        if (text == null || text.isBlank()) {
            return List.copyOf(fallback);
        }
        List<String> parts = new ArrayList<>();
        for (String part : text.split("[\\n,]")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                parts.add(trimmed);
            }
        }
        return parts.isEmpty() ? List.copyOf(fallback) : List.copyOf(parts);
    }
}
