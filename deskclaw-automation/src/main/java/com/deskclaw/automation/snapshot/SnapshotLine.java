package com.deskclaw.automation.snapshot;

import java.util.List;

/**
 * One emitted snapshot line. {@code name} is already truncated but not yet escaped.
 */
public record SnapshotLine(int depth, Role role, String name, String ref, List<StateTag> states) {

    public SnapshotLine {
        states = states == null ? List.of() : List.copyOf(states);
    }

    /**
     * Render as {@code {indent}- role "name" [ref=token] [state]...}, without a
     * trailing newline.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("  ".repeat(Math.max(0, depth)));
        sb.append("- ").append(role.tag());
        if (name != null && !name.isEmpty()) {
            sb.append(" \"").append(escapeName(name)).append('"');
        }
        sb.append(" [ref=").append(ref).append(']');
        for (StateTag state : states) {
            sb.append(" [").append(state.tag()).append(']');
        }
        return sb.toString();
    }

    /**
     * Escape a name for the quoted field: backslash and double quote are escaped,
     * newline becomes the two characters {@code \n}, carriage return is dropped.
     */
    public static String escapeName(String name) {
        if (name == null) {
            return null;
        }
        StringBuilder sb = new StringBuilder(name.length() + 8);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> {
                }
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
