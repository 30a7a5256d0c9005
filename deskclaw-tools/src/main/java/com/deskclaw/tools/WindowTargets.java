package com.deskclaw.tools;

import com.deskclaw.automation.node.AutomationNode;
import com.deskclaw.automation.session.WindowSession;

/**
 * Picks the window a tool call works on: the one named by {@code handle}, or the
 * window that holds keyboard focus.
 */
public final class WindowTargets {

    /** A window together with its session handle. */
    public record Target(String handle, AutomationNode window) {
    }

    private WindowTargets() {
    }

    /**
     * @throws ToolErrorException with {@link ErrorCodes#WINDOW_NOT_FOUND} when no window matches
     */
    public static Target resolve(WindowSession session, String handle) {
        if (handle != null && !handle.isBlank()) {
            AutomationNode window = session.getWindow(handle).orElseThrow(() -> new ToolErrorException(ToolError.of(
                    ErrorCodes.WINDOW_NOT_FOUND,
                    "Window not found: " + handle,
                    "Check handle is valid from windows_status or windows_list_windows",
                    "Window may have been closed")));
            return new Target(handle, window);
        }
        AutomationNode window = session.focusedWindow().orElseThrow(() -> new ToolErrorException(ToolError.of(
                ErrorCodes.WINDOW_NOT_FOUND,
                "No window found",
                "Ensure a window is active and has focus",
                "Use windows_list_windows to see available windows")));
        return new Target(session.getOrCreateHandle(window), window);
    }
}
