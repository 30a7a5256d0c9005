package com.deskclaw.automation.query;

import com.deskclaw.automation.node.AutomationNode;
import com.deskclaw.automation.node.NodeKind;
import com.deskclaw.automation.node.NodeUnavailableException;
import com.deskclaw.automation.node.Readout;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Bounded traversal helpers over a live automation tree.
 */
@Slf4j
public final class NodeWalker {

    private NodeWalker() {
    }

    /**
     * Children of a node, or an empty list when the driver cannot enumerate them.
     * Null entries reported by the driver are dropped.
     */
    public static List<AutomationNode> childrenOf(AutomationNode node) {
        List<AutomationNode> children;
        try {
            children = node.children();
        } catch (NodeUnavailableException | RuntimeException e) {
            log.debug("Children unavailable for {}: {}", node, e.getMessage());
            return List.of();
        }
        if (children == null) {
            return List.of();
        }
        List<AutomationNode> present = new ArrayList<>(children.size());
        for (AutomationNode child : children) {
            if (child != null) {
                present.add(child);
            }
        }
        if (present.size() < children.size()) {
            log.debug("Skipped {} null child entries of {}", children.size() - present.size(), node);
        }
        return present;
    }

    /**
     * Push a node's children so that they pop in document order.
     */
    static void pushChildren(Deque<AutomationNode> stack, AutomationNode node) {
        List<AutomationNode> children = childrenOf(node);
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(children.get(i));
        }
    }

    /**
     * First descendant (root excluded) in pre-order that satisfies the predicate,
     * visiting at most {@code maxVisits} nodes.
     */
    public static Optional<AutomationNode> findFirstDescendant(AutomationNode root,
                                                               Predicate<AutomationNode> predicate,
                                                               int maxVisits) {
        Deque<AutomationNode> stack = new ArrayDeque<>();
        pushChildren(stack, root);
        int visited = 0;
        while (!stack.isEmpty() && visited < maxVisits) {
            AutomationNode node = stack.pop();
            visited++;
            if (predicate.test(node)) {
                return Optional.of(node);
            }
            pushChildren(stack, node);
        }
        return Optional.empty();
    }

    public static Optional<AutomationNode> findFirstDescendant(AutomationNode root, NodeKind kind, int maxVisits) {
        return findFirstDescendant(root, node -> isKind(node, kind), maxVisits);
    }

    public static boolean isKind(AutomationNode node, NodeKind kind) {
        return Readout.guard(node::kind).orElse(NodeKind.UNKNOWN) == kind;
    }
}
