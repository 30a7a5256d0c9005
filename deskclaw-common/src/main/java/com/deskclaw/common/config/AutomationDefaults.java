package com.deskclaw.common.config;

/**
 * Default limits for snapshots and the scoped tree queries.
 */
public final class AutomationDefaults {

    private AutomationDefaults() {}

    // ==================== Snapshot ====================

    /** Deepest tree level a snapshot descends to. */
    public static final int SNAPSHOT_MAX_DEPTH = 10;

    /** Depth the snapshot tool uses when the caller gives none. */
    public static final int SNAPSHOT_TOOL_DEFAULT_DEPTH = 5;

    /** Emitted element cap for one snapshot. */
    public static final int SNAPSHOT_MAX_ELEMENTS = 200;

    /** Highest element cap a caller may request. */
    public static final int SNAPSHOT_MAX_ELEMENTS_CEILING = 500;

    /** Names longer than this are cut and suffixed with "...". */
    public static final int SNAPSHOT_NAME_MAX_LENGTH = 50;

    /** Default role filter. */
    public static final String SNAPSHOT_FILTER = "all";

    /** Element count from which the snapshot tool warns about tree size. */
    public static final int SNAPSHOT_LARGE_TREE_THRESHOLD = 100;

    // ==================== Find ====================

    public static final int FIND_DEFAULT_MAX_RESULTS = 10;

    public static final int FIND_MAX_RESULTS_CEILING = 20;

    /** Visit budget for one search. */
    public static final int FIND_MAX_SEARCH = 1000;

    public static final int FIND_NAME_MAX_LENGTH = 40;

    // ==================== Read ====================

    public static final int READ_DEFAULT_DEPTH = 2;

    public static final int READ_MAX_DEPTH = 5;

    public static final int READ_MAX_ELEMENTS = 50;

    public static final int READ_NAME_MAX_LENGTH = 40;

    // ==================== Peek ====================

    public static final int PEEK_DEFAULT_MAX_SIBLINGS = 10;

    public static final int PEEK_MAX_SIBLINGS_CEILING = 15;

    public static final int PEEK_NAME_MAX_LENGTH = 30;

    // ==================== Status ====================

    public static final int STATUS_TITLE_MAX_LENGTH = 50;

    public static final int STATUS_NAME_MAX_LENGTH = 30;

    public static final int STATUS_VALUE_MAX_LENGTH = 20;
}
