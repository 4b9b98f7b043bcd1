package com.phillippitts.docassist.service.capability;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Pure candidate ordering for the fallback executor.
 *
 * <p>A pinned capability is the only candidate. Otherwise, for each hint in order, the first
 * available capability whose id contains the hint is taken (skipping ones already taken),
 * and every remaining available capability follows in its original order.
 */
public final class CandidateRanking {

    private CandidateRanking() {
    }

    /**
     * Builds the ordered, de-duplicated candidate list.
     *
     * @param pinned user-pinned capability, if any
     * @param hints ordered hint fragments for the task type
     * @param available currently available capabilities
     * @return candidates in attempt order
     */
    public static List<String> rank(Optional<String> pinned, List<String> hints, List<String> available) {
        if (pinned.isPresent()) {
            return List.of(pinned.get());
        }
        Set<String> ordered = new LinkedHashSet<>();
        for (String hint : hints) {
            for (String capability : available) {
                if (capability.contains(hint) && !ordered.contains(capability)) {
                    ordered.add(capability);
                    break;
                }
            }
        }
        ordered.addAll(available);
        return new ArrayList<>(ordered);
    }
}
