package com.deskclaw.tools.builtin;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Session overview returned by windows_status.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatusResult {
    private WindowInfo window;
    private FocusedElementInfo focused;
    private SessionInfo session;
    /** ISO-8601 UTC instant. */
    private String timestamp;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class WindowInfo {
        private String title;
        private String handle;
        private String process;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FocusedElementInfo {
        private String name;
        private String role;
        private String ref;
        private String value;
        @Builder.Default
        private boolean enabled = true;
        private boolean hasKeyboardFocus;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SessionInfo {
        private int activeWindows;
        private int registeredElements;
    }

    public String toCompactString() {
        StringBuilder sb = new StringBuilder();
        if (window != null) {
            sb.append("Window: ").append(window.getTitle() != null ? window.getTitle() : "none")
                    .append(" [").append(window.getProcess()).append("]\n");
        }
        if (focused != null) {
            sb.append("Focused: ").append(focused.getRole()).append(" \"")
                    .append(focused.getName() != null ? focused.getName() : "").append("\" [")
                    .append(focused.getRef() != null ? focused.getRef() : "").append("]\n");
            if (focused.getValue() != null && !focused.getValue().isEmpty()) {
                sb.append("Value: ").append(focused.getValue()).append('\n');
            }
            if (!focused.isEnabled()) {
                sb.append("State: disabled\n");
            }
        } else {
            sb.append("Focused: none\n");
        }
        if (session != null && session.getActiveWindows() > 1) {
            sb.append("Session: ").append(session.getActiveWindows()).append(" windows\n");
        }
        return sb.toString().stripTrailing();
    }
}
