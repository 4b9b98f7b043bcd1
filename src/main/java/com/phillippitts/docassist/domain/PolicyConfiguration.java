package com.phillippitts.docassist.domain;

import java.util.List;
import java.util.Objects;

/**
 * User policy consulted by the classification gate.
 *
 * @param mode            processing mode
 * @param allowList       source fragments that are trusted reading content
 * @param denyList        source fragments that are never processed
 * @param minAutoWords    minimum word count for unassisted automatic processing
 * @param minPromptWords  minimum word count for allow-listed automatic processing and assisted prompts
 */
public record PolicyConfiguration(
        PolicyMode mode,
        List<String> allowList,
        List<String> denyList,
        int minAutoWords,
        int minPromptWords
) {

    public PolicyConfiguration {
        Objects.requireNonNull(mode, "mode");
        allowList = allowList == null ? List.of() : List.copyOf(allowList);
        denyList = denyList == null ? List.of() : List.copyOf(denyList);
        if (minAutoWords < 0 || minPromptWords < 0) {
            throw new IllegalArgumentException("Word thresholds must not be negative");
        }
    }

    public boolean denies(String source) {
        return matchesAny(denyList, source);
    }

    public boolean allows(String source) {
        return matchesAny(allowList, source);
    }

    private static boolean matchesAny(List<String> fragments, String source) {
        if (source == null) {
            return false;
        }
        for (String f : fragments) {
            if (!f.isEmpty() && source.contains(f)) {
                return true;
            }
        }
        return false;
    }
}
