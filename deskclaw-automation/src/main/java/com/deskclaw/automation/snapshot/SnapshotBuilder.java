package com.deskclaw.automation.snapshot;

import com.deskclaw.automation.node.AutomationNode;
import com.deskclaw.automation.node.NodeUnavailableException;
import com.deskclaw.common.text.TextTruncation;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Walks a live automation tree depth-first and renders it as a compact snapshot
 * with a fresh reference token per emitted node.
 * <p>
 * Each build first clears the scope in the shared {@link ElementRegistry}, so tokens
 * from an earlier snapshot of the same window stop resolving. The walk is bounded by
 * {@link SnapshotOptions#getMaxDepth()} per branch and by
 * {@link SnapshotOptions#getMaxElements()} globally.
 */
@Slf4j
public class SnapshotBuilder {

    // =========================================================================
    // Noise policy
    // =========================================================================

    private static final Set<Role> ACTIONABLE_ROLES = EnumSet.of(
            Role.BUTTON, Role.TEXTBOX, Role.CHECKBOX, Role.RADIO, Role.COMBOBOX,
            Role.LISTITEM, Role.MENUITEM, Role.TAB, Role.TREEITEM, Role.LINK, Role.SLIDER);

    private static final Set<Role> CONTAINER_ROLES = EnumSet.of(
            Role.WINDOW, Role.GROUP, Role.LIST, Role.TREE, Role.TABLIST,
            Role.MENU, Role.MENUBAR, Role.TOOLBAR, Role.GRID, Role.TABLE);

    private static final Set<Role> NOISE_ROLES = EnumSet.of(
            Role.ELEMENT, Role.THUMB, Role.SCROLLBAR, Role.SEPARATOR, Role.TITLEBAR);

    private final ElementRegistry registry;

    public SnapshotBuilder(ElementRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.registry = registry;
    }

    public ElementRegistry getRegistry() {
        return registry;
    }

    public SnapshotResult build(String scope, AutomationNode root) {
        return build(scope, root, SnapshotOptions.defaults());
    }

    public SnapshotResult build(String scope, AutomationNode root, SnapshotOptions options) {
        if (scope == null || scope.isBlank()) {
            throw new IllegalArgumentException("scope must not be blank");
        }
        if (root == null) {
            throw new IllegalArgumentException("root must not be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options must not be null");
        }

        registry.clear(scope);
        Traversal traversal = new Traversal(scope, options);
        traversal.visit(root, 0);

        StringBuilder text = new StringBuilder();
        for (SnapshotLine line : traversal.lines) {
            text.append(line.render()).append('\n');
        }
        if (traversal.truncated) {
            log.warn("Snapshot of {} truncated at {} elements", scope, options.getMaxElements());
        }
        return new SnapshotResult(text.toString(), traversal.lines, traversal.lines.size(),
                traversal.truncated);
    }

    /**
     * Unnamed decorative nodes are hidden but their children are still walked.
     */
    static boolean isNoise(ClassifiedNode classified) {
        if (classified.hasName()) {
            return false;
        }
        Role role = classified.role();
        if (ACTIONABLE_ROLES.contains(role) || CONTAINER_ROLES.contains(role)) {
            return false;
        }
        return NOISE_ROLES.contains(role);
    }

    /** Mutable state of a single build. */
    private final class Traversal {
        private final String scope;
        private final SnapshotOptions options;
        private final List<SnapshotLine> lines = new ArrayList<>();
        private boolean truncated;

        Traversal(String scope, SnapshotOptions options) {
            this.scope = scope;
            this.options = options;
        }

        void visit(AutomationNode node, int depth) {
            if (lines.size() >= options.getMaxElements()) {
                truncated = true;
                return;
            }
            if (depth > options.getMaxDepth()) {
                return;
            }

            ClassifiedNode classified = NodeClassifier.classify(node);

            if (!options.getFilter().accepts(classified.role())) {
                visitChildren(node, depth);
                return;
            }
            if (isNoise(classified)) {
                visitChildren(node, depth + 1);
                return;
            }

            emit(node, classified, depth);
            visitChildren(node, depth + 1);
        }

        private void emit(AutomationNode node, ClassifiedNode classified, int depth) {
            String ref = registry.register(scope, node);
            List<StateTag> states = StateInspector.inspect(node);
            String name = TextTruncation.truncate(classified.name(), options.getNameMaxLength());
            lines.add(new SnapshotLine(depth, classified.role(), name, ref, states));
        }

        private void visitChildren(AutomationNode node, int childDepth) {
            List<AutomationNode> children;
            try {
                children = node.children();
            } catch (NodeUnavailableException | RuntimeException e) {
                log.debug("Children unavailable for {}: {}", node, e.getMessage());
                return;
            }
            if (children == null) {
                return;
            }
            for (AutomationNode child : children) {
                if (truncated) {
                    return;
                }
                if (child == null) {
                    log.debug("Skipping null child of {}", node);
                    continue;
                }
                visit(child, childDepth);
            }
        }
    }
}
