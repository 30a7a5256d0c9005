package com.deskclaw.automation.node;

@FunctionalInterface
public interface ToggleCapability {

    Readout<ToggleState> toggleState();
}
