package com.deskclaw.automation.snapshot;

import java.util.EnumSet;
import java.util.Set;

/**
 * Which roles a snapshot emits. Nodes of other roles are not written, but their
 * children are still visited.
 */
public enum SnapshotFilter {
    ALL("all", EnumSet.allOf(Role.class)),
    INTERACTIVE("interactive", EnumSet.of(
            Role.BUTTON, Role.TEXTBOX, Role.CHECKBOX, Role.RADIO, Role.COMBOBOX,
            Role.LISTITEM, Role.MENUITEM, Role.TAB, Role.LINK, Role.SLIDER)),
    TEXT("text", EnumSet.of(Role.TEXT, Role.TEXTBOX, Role.DOCUMENT)),
    STRUCTURE("structure", EnumSet.of(
            Role.WINDOW, Role.GROUP, Role.LIST, Role.TREE, Role.TABLIST,
            Role.MENU, Role.TOOLBAR, Role.GRID, Role.TABLE));

    private final String value;
    private final Set<Role> roles;

    SnapshotFilter(String value, Set<Role> roles) {
        this.value = value;
        this.roles = roles;
    }

    public String value() {
        return value;
    }

    public boolean accepts(Role role) {
        return roles.contains(role);
    }

    /**
     * Parse a filter name, case-insensitively. Unknown or missing names mean {@link #ALL}.
     */
    public static SnapshotFilter parse(String value) {
        if (value == null) {
            return ALL;
        }
        String normalized = value.trim().toLowerCase();
        for (SnapshotFilter filter : values()) {
            if (filter.value.equals(normalized)) {
                return filter;
            }
        }
        return ALL;
    }
}
