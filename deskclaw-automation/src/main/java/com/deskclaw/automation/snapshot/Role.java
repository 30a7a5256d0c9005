package com.deskclaw.automation.snapshot;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed role vocabulary used in snapshot lines. {@link #tag()} is the exact
 * lowercase word written to the line.
 */
public enum Role {
    BUTTON("button"),
    TEXTBOX("textbox"),
    TEXT("text"),
    CHECKBOX("checkbox"),
    RADIO("radio"),
    COMBOBOX("combobox"),
    LIST("list"),
    LISTITEM("listitem"),
    MENU("menu"),
    MENUITEM("menuitem"),
    MENUBAR("menubar"),
    TREE("tree"),
    TREEITEM("treeitem"),
    TABLIST("tablist"),
    TAB("tab"),
    TABLE("table"),
    ROW("row"),
    HEADER("header"),
    COLUMNHEADER("columnheader"),
    SLIDER("slider"),
    SPINBUTTON("spinbutton"),
    PROGRESSBAR("progressbar"),
    LINK("link"),
    IMAGE("image"),
    GROUP("group"),
    WINDOW("window"),
    DOCUMENT("document"),
    TOOLBAR("toolbar"),
    TOOLTIP("tooltip"),
    SCROLLBAR("scrollbar"),
    STATUS("status"),
    SEPARATOR("separator"),
    THUMB("thumb"),
    TITLEBAR("titlebar"),
    GRID("grid"),
    CUSTOM("custom"),
    ELEMENT("element");

    private static final Map<String, Role> BY_TAG = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Role::tag, Function.identity()));

    private final String tag;

    Role(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * Look up a role by its tag, ignoring case. Returns null for unknown tags.
     */
    public static Role fromTag(String tag) {
        if (tag == null) {
            return null;
        }
        return BY_TAG.get(tag.trim().toLowerCase());
    }
}
