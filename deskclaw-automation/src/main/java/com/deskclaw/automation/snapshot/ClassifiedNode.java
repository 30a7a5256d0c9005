package com.deskclaw.automation.snapshot;

/**
 * Role and display name of one node. {@code name} is null when the node has
 * neither a display name nor a usable automation id.
 */
public record ClassifiedNode(Role role, String name) {

    public boolean hasName() {
        return name != null && !name.isEmpty();
    }
}
