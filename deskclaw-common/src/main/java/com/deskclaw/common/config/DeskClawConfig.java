package com.deskclaw.common.config;

import lombok.Data;

/**
 * Root configuration type for DeskClaw.
 * Every field is optional; absent values fall back to {@link AutomationDefaults}.
 */
@Data
public class DeskClawConfig {

    /** Snapshot limits. */
    private SnapshotConfig snapshot;

    /** Element search limits. */
    private FindConfig find;

    /** Region read limits. */
    private ReadConfig read;

    /** Focus peek limits. */
    private PeekConfig peek;

    /** Status report limits. */
    private StatusConfig status;

    @Data
    public static class SnapshotConfig {
        /** Depth used by the snapshot tool when the caller gives none. */
        private Integer defaultDepth;
        private Integer maxDepth;
        private Integer maxElements;
        private Integer maxElementsCeiling;
        private Integer nameMaxLength;
        /** One of all, interactive, text, structure. */
        private String filter;
        private Integer largeTreeThreshold;
    }

    @Data
    public static class FindConfig {
        private Integer defaultMaxResults;
        private Integer maxResultsCeiling;
        private Integer maxSearch;
        private Integer nameMaxLength;
    }

    @Data
    public static class ReadConfig {
        private Integer defaultDepth;
        private Integer maxDepth;
        private Integer maxElements;
        private Integer nameMaxLength;
    }

    @Data
    public static class PeekConfig {
        private Integer defaultMaxSiblings;
        private Integer maxSiblingsCeiling;
        private Integer nameMaxLength;
    }

    @Data
    public static class StatusConfig {
        private Integer titleMaxLength;
        private Integer nameMaxLength;
        private Integer valueMaxLength;
    }
}
