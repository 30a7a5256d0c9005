package com.deskclaw.automation.node;

@FunctionalInterface
public interface ExpandCollapseCapability {

    Readout<ExpandCollapseState> expandCollapseState();
}
