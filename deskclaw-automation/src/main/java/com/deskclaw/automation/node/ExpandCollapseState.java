package com.deskclaw.automation.node;

public enum ExpandCollapseState {
    COLLAPSED,
    EXPANDED,
    PARTIALLY_EXPANDED,
    LEAF_NODE
}
