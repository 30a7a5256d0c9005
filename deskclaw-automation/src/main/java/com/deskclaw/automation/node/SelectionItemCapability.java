package com.deskclaw.automation.node;

@FunctionalInterface
public interface SelectionItemCapability {

    Readout<Boolean> isSelected();
}
