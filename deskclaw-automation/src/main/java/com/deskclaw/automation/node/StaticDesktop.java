package com.deskclaw.automation.node;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link AutomationDesktop} over a fixed set of {@link StaticNode} windows.
 * Focus is whatever was last passed to {@link #focus(AutomationNode)}.
 * Public test double for replaying recorded desktops; no driver is involved.
 */
public class StaticDesktop implements AutomationDesktop {

    private final List<AutomationNode> windows;
    private volatile AutomationNode focused;

    public StaticDesktop(List<? extends AutomationNode> windows) {
        this.windows = new ArrayList<>(windows);
    }

    public static StaticDesktop of(AutomationNode... windows) {
        return new StaticDesktop(List.of(windows));
    }

    public StaticDesktop focus(AutomationNode node) {
        this.focused = node;
        return this;
    }

    @Override
    public Readout<AutomationNode> focusedElement() {
        AutomationNode current = focused;
        return current != null ? Readout.of(current) : Readout.unavailable("nothing has focus");
    }

    @Override
    public List<AutomationNode> topLevelWindows() {
        return List.copyOf(windows);
    }
}
