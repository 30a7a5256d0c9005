package com.deskclaw.automation.node;

/**
 * Control kinds reported by desktop automation drivers.
 */
public enum NodeKind {
    APP_BAR,
    BUTTON,
    CALENDAR,
    CHECK_BOX,
    COMBO_BOX,
    CUSTOM,
    DATA_GRID,
    DATA_ITEM,
    DOCUMENT,
    EDIT,
    GROUP,
    HEADER,
    HEADER_ITEM,
    HYPERLINK,
    IMAGE,
    LIST,
    LIST_ITEM,
    MENU,
    MENU_BAR,
    MENU_ITEM,
    PANE,
    PROGRESS_BAR,
    RADIO_BUTTON,
    SCROLL_BAR,
    SEMANTIC_ZOOM,
    SEPARATOR,
    SLIDER,
    SPINNER,
    SPLIT_BUTTON,
    STATUS_BAR,
    TAB,
    TAB_ITEM,
    TABLE,
    TEXT,
    THUMB,
    TITLE_BAR,
    TOOL_BAR,
    TOOL_TIP,
    TREE,
    TREE_ITEM,
    WINDOW,
    UNKNOWN
}
