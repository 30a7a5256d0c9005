package com.deskclaw.automation.snapshot;

/**
 * State annotations appended to a snapshot line, declared in output order.
 */
public enum StateTag {
    DISABLED("disabled"),
    OFFSCREEN("offscreen"),
    READONLY("readonly"),
    CHECKED("checked"),
    INDETERMINATE("indeterminate"),
    SELECTED("selected"),
    EXPANDED("expanded"),
    COLLAPSED("collapsed");

    private final String tag;

    StateTag(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
