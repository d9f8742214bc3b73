package com.z254.hivemind.dispatch.registry;

import lombok.Getter;

/**
 * A capability tag that is not in the catalog.
 */
@Getter
public class UnknownCapabilityException extends RuntimeException {

    private final String tag;

    public UnknownCapabilityException(String tag) {
        super("Unknown capability: " + tag);
        this.tag = tag;
    }
}
