package com.deskclaw.automation.node;

/**
 * Optional behaviours a node may advertise.
 */
public enum CapabilityKind {
    VALUE,
    TOGGLE,
    SELECTION_ITEM,
    EXPAND_COLLAPSE
}
