package com.deskclaw.automation.snapshot;

import com.deskclaw.automation.node.AutomationNode;
import com.deskclaw.automation.node.NodeKind;
import com.deskclaw.automation.node.Readout;

/**
 * Maps an automation node to a {@link Role} and a display name.
 * Pure and query-only; never throws for a misbehaving node.
 */
public final class NodeClassifier {

    /** Automation ids at or above this length are treated as generated noise. */
    public static final int MAX_AUTOMATION_ID_LENGTH = 50;

    private NodeClassifier() {
    }

    public static ClassifiedNode classify(AutomationNode node) {
        return new ClassifiedNode(roleOf(node), nameOf(node));
    }

    public static Role roleOf(AutomationNode node) {
        NodeKind kind = Readout.guard(node::kind).orElse(NodeKind.UNKNOWN);
        return roleFor(kind);
    }

    public static Role roleFor(NodeKind kind) {
        if (kind == null) {
            return Role.ELEMENT;
        }
        return switch (kind) {
            case BUTTON -> Role.BUTTON;
            case EDIT -> Role.TEXTBOX;
            case TEXT -> Role.TEXT;
            case CHECK_BOX -> Role.CHECKBOX;
            case RADIO_BUTTON -> Role.RADIO;
            case COMBO_BOX -> Role.COMBOBOX;
            case LIST -> Role.LIST;
            case LIST_ITEM -> Role.LISTITEM;
            case MENU -> Role.MENU;
            case MENU_ITEM -> Role.MENUITEM;
            case MENU_BAR -> Role.MENUBAR;
            case TREE -> Role.TREE;
            case TREE_ITEM -> Role.TREEITEM;
            case TAB -> Role.TABLIST;
            case TAB_ITEM -> Role.TAB;
            case TABLE -> Role.TABLE;
            case DATA_ITEM -> Role.ROW;
            case HEADER -> Role.HEADER;
            case HEADER_ITEM -> Role.COLUMNHEADER;
            case SLIDER -> Role.SLIDER;
            case SPINNER -> Role.SPINBUTTON;
            case PROGRESS_BAR -> Role.PROGRESSBAR;
            case HYPERLINK -> Role.LINK;
            case IMAGE -> Role.IMAGE;
            case PANE, GROUP -> Role.GROUP;
            case WINDOW -> Role.WINDOW;
            case DOCUMENT -> Role.DOCUMENT;
            case TOOL_BAR -> Role.TOOLBAR;
            case TOOL_TIP -> Role.TOOLTIP;
            case SCROLL_BAR -> Role.SCROLLBAR;
            case STATUS_BAR -> Role.STATUS;
            case SEPARATOR -> Role.SEPARATOR;
            case THUMB -> Role.THUMB;
            case TITLE_BAR -> Role.TITLEBAR;
            case DATA_GRID -> Role.GRID;
            case CUSTOM -> Role.CUSTOM;
            default -> Role.ELEMENT;
        };
    }

    /**
     * Display name if non-blank, otherwise {@code [automationId]} when the id is
     * non-blank and short, otherwise null.
     */
    public static String nameOf(AutomationNode node) {
        String name = Readout.guard(node::name).orElse(null);
        if (name != null && !name.isBlank()) {
            return name;
        }
        String automationId = Readout.guard(node::automationId).orElse(null);
        if (automationId != null && !automationId.isBlank()
                && automationId.length() < MAX_AUTOMATION_ID_LENGTH) {
            return "[" + automationId + "]";
        }
        return null;
    }
}
