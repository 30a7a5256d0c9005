package com.deskclaw.automation.node;

import java.util.List;

/**
 * Handle to one element of a live, externally-owned UI automation tree.
 *
 * <p>Implementations wrap a native driver object. Every property read returns a
 * {@link Readout} so an element that vanished or refuses a query is reported as
 * {@link Readout.Unavailable} rather than an exception. DeskClaw only ever reads
 * through this interface; it never mutates the tree.</p>
 *
 * <p>{@code equals} must identify the same live element, so that a focused node
 * can be told apart from its siblings.</p>
 */
public interface AutomationNode {

    Readout<NodeKind> kind();

    /** Display name as exposed to assistive technology. */
    Readout<String> name();

    /** Stable developer-assigned identifier, if any. */
    Readout<String> automationId();

    Readout<Boolean> isEnabled();

    Readout<Boolean> isOffscreen();

    Readout<Boolean> hasKeyboardFocus();

    Readout<Integer> processId();

    Readout<CapabilitySet> capabilities();

    Readout<AutomationNode> parent();

    /**
     * Enumerate the immediate children, fresh from the driver.
     *
     * @throws NodeUnavailableException when the driver cannot list them
     */
    List<AutomationNode> children() throws NodeUnavailableException;
}
