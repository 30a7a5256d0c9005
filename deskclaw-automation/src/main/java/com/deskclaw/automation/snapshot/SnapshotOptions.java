package com.deskclaw.automation.snapshot;

import com.deskclaw.common.config.AutomationDefaults;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Limits and filter for one snapshot build.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SnapshotOptions {
    /** Deepest level emitted; the root is depth 0. */
    @Builder.Default
    private int maxDepth = AutomationDefaults.SNAPSHOT_MAX_DEPTH;
    /** Global cap on emitted lines. */
    @Builder.Default
    private int maxElements = AutomationDefaults.SNAPSHOT_MAX_ELEMENTS;
    @Builder.Default
    private int nameMaxLength = AutomationDefaults.SNAPSHOT_NAME_MAX_LENGTH;
    @Builder.Default
    private SnapshotFilter filter = SnapshotFilter.ALL;

    public static SnapshotOptions defaults() {
        return SnapshotOptions.builder().build();
    }
}
