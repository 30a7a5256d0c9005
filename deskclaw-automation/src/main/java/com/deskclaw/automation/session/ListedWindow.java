package com.deskclaw.automation.session;

/**
 * A titled top-level window as reported by {@link WindowSession#listWindows()}.
 * {@code processName} is null when the owning process could not be identified.
 */
public record ListedWindow(String handle, String title, String processName) {
}
