package com.deskclaw.automation.node;

import java.util.List;

/**
 * Entry points into the automation driver that are not tied to a single node.
 */
public interface AutomationDesktop {

    /** Element that currently holds keyboard focus. */
    Readout<AutomationNode> focusedElement();

    /** Top-level windows on the desktop, in driver order. */
    List<AutomationNode> topLevelWindows() throws NodeUnavailableException;
}
