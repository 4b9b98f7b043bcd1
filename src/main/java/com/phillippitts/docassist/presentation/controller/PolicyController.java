package com.phillippitts.docassist.presentation.controller;

import com.phillippitts.docassist.config.properties.ClassificationProperties;
import com.phillippitts.docassist.domain.PolicyConfiguration;
import com.phillippitts.docassist.domain.PolicyMode;
import com.phillippitts.docassist.service.policy.PolicyLists;
import com.phillippitts.docassist.service.policy.PolicyStore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Reads and edits the processing policy and capability pin.
 */
@RestController
@RequestMapping("/api/policy")
class PolicyController {

    private final PolicyStore policyStore;

    PolicyController(PolicyStore policyStore) {
        this.policyStore = policyStore;
    }

    @GetMapping
    PolicyView get() {
        return view();
    }

    /**
     * Applies the fields present in the update; absent fields keep their value. Lists are free
     * text separated by commas or newlines; blank text restores the default list.
     */
    @PutMapping
    PolicyView update(@Valid @RequestBody PolicyUpdate update) {
        PolicyConfiguration current = policyStore.load();
        PolicyConfiguration next = new PolicyConfiguration(
                update.mode() != null ? update.mode() : current.mode(),
                update.allowList() != null
                        ? PolicyLists.parse(update.allowList(), ClassificationProperties.DEFAULT_ALLOW_LIST)
                        : current.allowList(),
                update.denyList() != null
                        ? PolicyLists.parse(update.denyList(), ClassificationProperties.DEFAULT_DENY_LIST)
                        : current.denyList(),
                update.minAutoWords() != null ? update.minAutoWords() : current.minAutoWords(),
                update.minPromptWords() != null ? update.minPromptWords() : current.minPromptWords());
        policyStore.save(next);
        if (update.pinnedCapability() != null) {
            policyStore.pinCapability(update.pinnedCapability());
        }
        return view();
    }

    private PolicyView view() {
        PolicyConfiguration p = policyStore.load();
        return new PolicyView(p.mode(), p.allowList(), p.denyList(), p.minAutoWords(), p.minPromptWords(),
                policyStore.pinnedCapability().orElse(null));
    }

    record PolicyView(PolicyMode mode, List<String> allowList, List<String> denyList,
                      int minAutoWords, int minPromptWords, String pinnedCapability) {}

    record PolicyUpdate(PolicyMode mode, String allowList, String denyList,
                        @PositiveOrZero Integer minAutoWords, @PositiveOrZero Integer minPromptWords,
                        String pinnedCapability) {}
}
