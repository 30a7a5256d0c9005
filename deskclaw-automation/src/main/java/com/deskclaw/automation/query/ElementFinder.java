package com.deskclaw.automation.query;

import com.deskclaw.automation.node.AutomationNode;
import com.deskclaw.automation.node.Readout;
import com.deskclaw.automation.snapshot.ElementRegistry;
import com.deskclaw.automation.snapshot.NodeClassifier;
import com.deskclaw.common.text.TextTruncation;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Searches a window subtree for elements matching a {@link FindQuery}.
 * <p>
 * Unlike a snapshot, a search does not clear the scope: matches are added to the
 * tokens already issued for the window.
 */
@Slf4j
public class ElementFinder {

    private final ElementRegistry registry;

    public ElementFinder(ElementRegistry registry) {
        this.registry = registry;
    }

    public FindResult find(String scope, AutomationNode root, FindQuery query) {
        if (query == null || query.getRole() == null) {
            throw new IllegalArgumentException("query role is required");
        }
        int maxResults = Math.max(1, query.getMaxResults());
        int maxSearch = Math.max(1, query.getMaxSearch());

        List<FindResult.Element> matches = new ArrayList<>();
        Deque<AutomationNode> stack = new ArrayDeque<>();
        stack.push(root);
        int searched = 0;

        while (!stack.isEmpty()) {
            AutomationNode node = stack.pop();
            searched++;
            if (searched > maxSearch) {
                break;
            }
            if (matches(node, query)) {
                String name = Readout.guard(node::name).orElse("");
                matches.add(FindResult.Element.builder()
                        .ref(registry.register(scope, node))
                        .name(TextTruncation.truncate(name, query.getNameMaxLength()))
                        .enabled(Readout.guard(node::isEnabled).orElse(false))
                        .build());
                if (matches.size() >= maxResults) {
                    break;
                }
            }
            NodeWalker.pushChildren(stack, node);
        }

        boolean truncated = searched > maxSearch;
        if (truncated) {
            log.debug("Search in {} stopped after {} elements", scope, maxSearch);
        }
        return FindResult.builder()
                .query(FindResult.Query.builder()
                        .role(query.getRole().tag())
                        .nameContains(query.getNameContains())
                        .state(query.getState() != null ? query.getState().value() : null)
                        .build())
                .totalSearched(Math.min(searched, maxSearch))
                .matchCount(matches.size())
                .truncated(truncated)
                .elements(matches)
                .build();
    }

    static boolean matches(AutomationNode node, FindQuery query) {
        if (NodeClassifier.roleOf(node) != query.getRole()) {
            return false;
        }
        String name = Readout.guard(node::name).orElse("");
        String nameExact = query.getNameExact();
        if (nameExact != null && !nameExact.isEmpty() && !name.equals(nameExact)) {
            return false;
        }
        String nameContains = query.getNameContains();
        if (nameContains != null && !nameContains.isEmpty() && !matchesPattern(name, nameContains)) {
            return false;
        }
        return query.getState() == null || query.getState().matches(node);
    }

    /**
     * Case-insensitive name match: {@code *x*} contains, {@code *x} suffix,
     * {@code x*} prefix, anything else contains.
     */
    static boolean matchesPattern(String name, String pattern) {
        String p = pattern.toLowerCase();
        String n = name.toLowerCase();
        boolean leading = p.startsWith("*");
        boolean trailing = p.endsWith("*") && p.length() > 1;
        if (leading && trailing) {
            return n.contains(p.substring(1, p.length() - 1));
        }
        if (leading) {
            return n.endsWith(p.substring(1));
        }
        if (trailing) {
            return n.startsWith(p.substring(0, p.length() - 1));
        }
        return n.contains(p);
    }
}
