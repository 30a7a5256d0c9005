package com.deskclaw.automation.node;

import lombok.Builder;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * The optional capabilities one node advertises. A capability accessor is only
 * present when the node supports it, so callers never touch an unsupported one.
 */
@Builder
public final class CapabilitySet {

    private static final CapabilitySet NONE = CapabilitySet.builder().build();

    private final ValueCapability value;
    private final ToggleCapability toggle;
    private final SelectionItemCapability selectionItem;
    private final ExpandCollapseCapability expandCollapse;

    public static CapabilitySet none() {
        return NONE;
    }

    public Optional<ValueCapability> value() {
        return Optional.ofNullable(value);
    }

    public Optional<ToggleCapability> toggle() {
        return Optional.ofNullable(toggle);
    }

    public Optional<SelectionItemCapability> selectionItem() {
        return Optional.ofNullable(selectionItem);
    }

    public Optional<ExpandCollapseCapability> expandCollapse() {
        return Optional.ofNullable(expandCollapse);
    }

    public boolean supports(CapabilityKind kind) {
        return switch (kind) {
            case VALUE -> value != null;
            case TOGGLE -> toggle != null;
            case SELECTION_ITEM -> selectionItem != null;
            case EXPAND_COLLAPSE -> expandCollapse != null;
        };
    }

    public Set<CapabilityKind> kinds() {
        Set<CapabilityKind> kinds = EnumSet.noneOf(CapabilityKind.class);
        for (CapabilityKind kind : CapabilityKind.values()) {
            if (supports(kind)) {
                kinds.add(kind);
            }
        }
        return kinds;
    }

    @Override
    public String toString() {
        return "CapabilitySet" + kinds();
    }
}
