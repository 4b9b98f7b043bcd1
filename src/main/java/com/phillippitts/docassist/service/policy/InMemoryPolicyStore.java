package com.phillippitts.docassist.service.policy;

import com.phillippitts.docassist.domain.PolicyConfiguration;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-local policy store. Starts from configured defaults; changes last until restart.
 */
public class InMemoryPolicyStore implements PolicyStore {

    private static final Logger LOG = LogManager.getLogger(InMemoryPolicyStore.class);

    private final PolicyConfiguration defaults;
    private final AtomicReference<PolicyConfiguration> policy;
    private final AtomicReference<String> pinned = new AtomicReference<>();

    public InMemoryPolicyStore(PolicyConfiguration defaults, String pinnedCapability) {
        this.defaults = normalized(Objects.requireNonNull(defaults, "defaults"), defaults);
        this.policy = new AtomicReference<>(this.defaults);
        pinCapability(pinnedCapability);
    }

    @Override
    public PolicyConfiguration load() {
        return policy.get();
    }

    @Override
    public void save(PolicyConfiguration updated) {
        PolicyConfiguration clean = normalized(Objects.requireNonNull(updated, "policy"), defaults);
        policy.set(clean);
        LOG.info("Policy updated: mode={}, allow={}, deny={}, minAutoWords={}, minPromptWords={}",
                clean.mode(), clean.allowList().size(), clean.denyList().size(),
                clean.minAutoWords(), clean.minPromptWords());
    }

    @Override
    public Optional<String> pinnedCapability() {
        return Optional.ofNullable(pinned.get());
    }

    @Override
    public void pinCapability(String capabilityId) {
        String value = capabilityId == null || capabilityId.isBlank() ? null : capabilityId.trim();
        String previous = pinned.getAndSet(value);
        if (!Objects.equals(previous, value)) {
            LOG.info("Pinned capability: {}", value == null ? "none" : value);
        }
    }

    private static PolicyConfiguration normalized(PolicyConfiguration p, PolicyConfiguration fallback) {
        return new PolicyConfiguration(p.mode(),
                PolicyLists.normalize(p.allowList(), fallback.allowList()),
                PolicyLists.normalize(p.denyList(), fallback.denyList()),
                p.minAutoWords(), p.minPromptWords());
    }
}
