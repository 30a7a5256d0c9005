package com.deskclaw.automation.snapshot;

import com.deskclaw.automation.node.AutomationNode;
import com.deskclaw.automation.node.CapabilitySet;
import com.deskclaw.automation.node.ExpandCollapseState;
import com.deskclaw.automation.node.Readout;
import com.deskclaw.automation.node.ToggleState;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Derives {@link StateTag}s from the capabilities a node advertises.
 * <p>
 * Tags come out in declaration order of {@link StateTag}. A node whose state cannot
 * be read completely gets no tags at all, so a half-read node is never reported
 * with a misleading subset.
 */
@Slf4j
public final class StateInspector {

    private StateInspector() {
    }

    public static List<StateTag> inspect(AutomationNode node) {
        Reads reads = new Reads();
        List<StateTag> tags = new ArrayList<>();

        if (!reads.get(node::isEnabled, true)) {
            tags.add(StateTag.DISABLED);
        }
        if (reads.get(node::isOffscreen, false)) {
            tags.add(StateTag.OFFSCREEN);
        }

        CapabilitySet capabilities = reads.get(node::capabilities, CapabilitySet.none());

        capabilities.value().ifPresent(value -> {
            if (reads.get(value::isReadOnly, false)) {
                tags.add(StateTag.READONLY);
            }
        });
        capabilities.toggle().ifPresent(toggle -> {
            ToggleState state = reads.get(toggle::toggleState, ToggleState.OFF);
            if (state == ToggleState.ON) {
                tags.add(StateTag.CHECKED);
            } else if (state == ToggleState.INDETERMINATE) {
                tags.add(StateTag.INDETERMINATE);
            }
        });
        capabilities.selectionItem().ifPresent(selection -> {
            if (reads.get(selection::isSelected, false)) {
                tags.add(StateTag.SELECTED);
            }
        });
        capabilities.expandCollapse().ifPresent(expandCollapse -> {
            ExpandCollapseState state = reads.get(expandCollapse::expandCollapseState,
                    ExpandCollapseState.LEAF_NODE);
            if (state == ExpandCollapseState.EXPANDED) {
                tags.add(StateTag.EXPANDED);
            } else if (state == ExpandCollapseState.COLLAPSED) {
                tags.add(StateTag.COLLAPSED);
            }
        });

        if (reads.failed) {
            log.debug("State read failed for {}: {}", node, reads.reason);
            return List.of();
        }
        return List.copyOf(tags);
    }

    /** Collects whether any read along the way came back unavailable. */
    private static final class Reads {
        private boolean failed;
        private String reason;

        <T> T get(Supplier<Readout<T>> accessor, T fallback) {
            Readout<T> readout = Readout.guard(accessor);
            if (readout instanceof Readout.Unavailable<T> unavailable) {
                if (!failed) {
                    failed = true;
                    reason = unavailable.reason();
                }
                return fallback;
            }
            return readout.orElse(fallback);
        }
    }
}
