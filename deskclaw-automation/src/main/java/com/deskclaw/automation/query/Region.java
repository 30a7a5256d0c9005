package com.deskclaw.automation.query;

/**
 * Named parts of a window that {@link RegionReader} knows how to locate.
 */
public enum Region {
    FOCUSED("focused"),
    MENU("menu"),
    STATUS("status"),
    DIALOG("dialog"),
    TITLEBAR("titlebar"),
    TOOLBAR("toolbar");

    private final String value;

    Region(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Region parse(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase();
        for (Region region : values()) {
            if (region.value.equals(normalized)) {
                return region;
            }
        }
        return null;
    }
}
