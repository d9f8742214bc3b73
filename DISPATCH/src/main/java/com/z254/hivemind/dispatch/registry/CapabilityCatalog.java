package com.z254.hivemind.dispatch.registry;

import com.z254.hivemind.dispatch.config.DispatchProperties;
import com.z254.hivemind.dispatch.domain.model.Capability;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * The set of capability tags the dispatcher accepts.
 * Seeded with {@link Capability#BUILT_IN} plus {@code dispatch.capabilities.additional}.
 */
@Component
@Slf4j
public class CapabilityCatalog {

    private final Set<Capability> known = ConcurrentHashMap.newKeySet();

    public CapabilityCatalog(DispatchProperties properties) {
        known.addAll(Capability.BUILT_IN);
        for (String tag : properties.getCapabilities().getAdditional()) {
            known.add(Capability.of(tag));
        }
        log.info("Capability catalog initialized with {} tags", known.size());
    }

    /**
     * Add a tag to the catalog. Registering a known tag is a no-op.
     */
    public Capability register(String tag) {
        Capability capability = Capability.of(tag);
        if (known.add(capability)) {
            log.info("Registered capability: {}", capability);
        }
        return capability;
    }

    /**
     * Resolve a raw tag to a known capability.
     *
     * @throws UnknownCapabilityException if the tag is not in the catalog
     */
    public Capability resolve(String tag) {
        Capability capability;
        try {
            capability = Capability.of(tag);
        } catch (IllegalArgumentException e) {
            throw new UnknownCapabilityException(String.valueOf(tag));
        }
        requireKnown(capability);
        return capability;
    }

    public Set<Capability> resolveAll(Collection<String> tags) {
        Set<Capability> result = new LinkedHashSet<>();
        if (tags != null) {
            for (String tag : tags) {
                result.add(resolve(tag));
            }
        }
        return result;
    }

    public void requireKnown(Capability capability) {
        if (!known.contains(capability)) {
            throw new UnknownCapabilityException(capability.getTag());
        }
    }

    public boolean isKnown(Capability capability) {
        return known.contains(capability);
    }

    public List<Capability> all() {
        return known.stream().sorted().collect(Collectors.toList());
    }
}
