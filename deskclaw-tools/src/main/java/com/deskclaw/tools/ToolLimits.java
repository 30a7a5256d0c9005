package com.deskclaw.tools;

import com.deskclaw.automation.snapshot.SnapshotFilter;
import com.deskclaw.common.config.AutomationDefaults;
import com.deskclaw.common.config.DeskClawConfig;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Limits resolver: turns the optional values of {@link DeskClawConfig} into the
 * effective limits the tools apply. Non-positive configured values are ignored,
 * and every default is kept at or below its ceiling.
 */
public final class ToolLimits {

    private ToolLimits() {
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ResolvedLimits {
        private SnapshotLimits snapshot;
        private FindLimits find;
        private ReadLimits read;
        private PeekLimits peek;
        private StatusLimits status;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SnapshotLimits {
        private int defaultDepth;
        private int maxDepth;
        private int maxElements;
        private int maxElementsCeiling;
        private int nameMaxLength;
        private SnapshotFilter filter;
        private int largeTreeThreshold;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FindLimits {
        private int defaultMaxResults;
        private int maxResultsCeiling;
        private int maxSearch;
        private int nameMaxLength;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ReadLimits {
        private int defaultDepth;
        private int maxDepth;
        private int maxElements;
        private int nameMaxLength;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PeekLimits {
        private int defaultMaxSiblings;
        private int maxSiblingsCeiling;
        private int nameMaxLength;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StatusLimits {
        private int titleMaxLength;
        private int nameMaxLength;
        private int valueMaxLength;
    }

    public static ResolvedLimits defaults() {
        return resolve(null);
    }

    public static ResolvedLimits resolve(DeskClawConfig config) {
        DeskClawConfig.SnapshotConfig snapshot = config != null ? config.getSnapshot() : null;
        DeskClawConfig.FindConfig find = config != null ? config.getFind() : null;
        DeskClawConfig.ReadConfig read = config != null ? config.getRead() : null;
        DeskClawConfig.PeekConfig peek = config != null ? config.getPeek() : null;
        DeskClawConfig.StatusConfig status = config != null ? config.getStatus() : null;

        int snapshotMaxDepth = positive(snapshot != null ? snapshot.getMaxDepth() : null,
                AutomationDefaults.SNAPSHOT_MAX_DEPTH);
        int snapshotCeiling = positive(snapshot != null ? snapshot.getMaxElementsCeiling() : null,
                AutomationDefaults.SNAPSHOT_MAX_ELEMENTS_CEILING);
        int findCeiling = positive(find != null ? find.getMaxResultsCeiling() : null,
                AutomationDefaults.FIND_MAX_RESULTS_CEILING);
        int readMaxDepth = positive(read != null ? read.getMaxDepth() : null, AutomationDefaults.READ_MAX_DEPTH);
        int peekCeiling = positive(peek != null ? peek.getMaxSiblingsCeiling() : null,
                AutomationDefaults.PEEK_MAX_SIBLINGS_CEILING);

        return ResolvedLimits.builder()
                .snapshot(SnapshotLimits.builder()
                        .defaultDepth(Math.min(snapshotMaxDepth, positive(
                                snapshot != null ? snapshot.getDefaultDepth() : null,
                                AutomationDefaults.SNAPSHOT_TOOL_DEFAULT_DEPTH)))
                        .maxDepth(snapshotMaxDepth)
                        .maxElements(Math.min(snapshotCeiling, positive(
                                snapshot != null ? snapshot.getMaxElements() : null,
                                AutomationDefaults.SNAPSHOT_MAX_ELEMENTS)))
                        .maxElementsCeiling(snapshotCeiling)
                        .nameMaxLength(positive(snapshot != null ? snapshot.getNameMaxLength() : null,
                                AutomationDefaults.SNAPSHOT_NAME_MAX_LENGTH))
                        .filter(SnapshotFilter.parse(snapshot != null && snapshot.getFilter() != null
                                ? snapshot.getFilter() : AutomationDefaults.SNAPSHOT_FILTER))
                        .largeTreeThreshold(positive(snapshot != null ? snapshot.getLargeTreeThreshold() : null,
                                AutomationDefaults.SNAPSHOT_LARGE_TREE_THRESHOLD))
                        .build())
                .find(FindLimits.builder()
                        .defaultMaxResults(Math.min(findCeiling, positive(
                                find != null ? find.getDefaultMaxResults() : null,
                                AutomationDefaults.FIND_DEFAULT_MAX_RESULTS)))
                        .maxResultsCeiling(findCeiling)
                        .maxSearch(positive(find != null ? find.getMaxSearch() : null,
                                AutomationDefaults.FIND_MAX_SEARCH))
                        .nameMaxLength(positive(find != null ? find.getNameMaxLength() : null,
                                AutomationDefaults.FIND_NAME_MAX_LENGTH))
                        .build())
                .read(ReadLimits.builder()
                        .defaultDepth(Math.min(readMaxDepth, positive(
                                read != null ? read.getDefaultDepth() : null, AutomationDefaults.READ_DEFAULT_DEPTH)))
                        .maxDepth(readMaxDepth)
                        .maxElements(positive(read != null ? read.getMaxElements() : null,
                                AutomationDefaults.READ_MAX_ELEMENTS))
                        .nameMaxLength(positive(read != null ? read.getNameMaxLength() : null,
                                AutomationDefaults.READ_NAME_MAX_LENGTH))
                        .build())
                .peek(PeekLimits.builder()
                        .defaultMaxSiblings(Math.min(peekCeiling, positive(
                                peek != null ? peek.getDefaultMaxSiblings() : null,
                                AutomationDefaults.PEEK_DEFAULT_MAX_SIBLINGS)))
                        .maxSiblingsCeiling(peekCeiling)
                        .nameMaxLength(positive(peek != null ? peek.getNameMaxLength() : null,
                                AutomationDefaults.PEEK_NAME_MAX_LENGTH))
                        .build())
                .status(StatusLimits.builder()
                        .titleMaxLength(positive(status != null ? status.getTitleMaxLength() : null,
                                AutomationDefaults.STATUS_TITLE_MAX_LENGTH))
                        .nameMaxLength(positive(status != null ? status.getNameMaxLength() : null,
                                AutomationDefaults.STATUS_NAME_MAX_LENGTH))
                        .valueMaxLength(positive(status != null ? status.getValueMaxLength() : null,
                                AutomationDefaults.STATUS_VALUE_MAX_LENGTH))
                        .build())
                .build();
    }

    /**
     * Clamp a caller-supplied value into {@code [min, max]}.
     */
    public static int clamp(int requested, int min, int max) {
        return Math.max(min, Math.min(requested, max));
    }

    private static int positive(Integer value, int fallback) {
        return value != null && value > 0 ? value : fallback;
    }
}
