package com.deskclaw.automation.query;

import com.deskclaw.automation.node.AutomationNode;
import com.deskclaw.automation.node.CapabilitySet;
import com.deskclaw.automation.node.Readout;
import com.deskclaw.automation.node.ToggleState;

/**
 * State filter accepted by element search.
 */
public enum StateCriterion {
    ENABLED("enabled"),
    DISABLED("disabled"),
    FOCUSED("focused"),
    CHECKED("checked"),
    SELECTED("selected");

    private final String value;

    StateCriterion(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean matches(AutomationNode node) {
        return switch (this) {
            case ENABLED -> Readout.guard(node::isEnabled).orElse(false);
            case DISABLED -> !Readout.guard(node::isEnabled).orElse(false);
            case FOCUSED -> Readout.guard(node::hasKeyboardFocus).orElse(false);
            case CHECKED -> capabilities(node).toggle()
                    .map(toggle -> Readout.guard(toggle::toggleState).orElse(ToggleState.OFF) == ToggleState.ON)
                    .orElse(false);
            case SELECTED -> capabilities(node).selectionItem()
                    .map(selection -> Readout.guard(selection::isSelected).orElse(false))
                    .orElse(false);
        };
    }

    private static CapabilitySet capabilities(AutomationNode node) {
        return Readout.guard(node::capabilities).orElse(CapabilitySet.none());
    }

    /**
     * Parse a criterion name; null for missing or unknown names.
     */
    public static StateCriterion parse(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase();
        for (StateCriterion criterion : values()) {
            if (criterion.value.equals(normalized)) {
                return criterion;
            }
        }
        return null;
    }
}
