package com.deskclaw.automation.node;

public enum ToggleState {
    OFF,
    ON,
    INDETERMINATE
}
