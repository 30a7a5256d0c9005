package com.deskclaw.automation.snapshot;

import com.deskclaw.automation.node.AutomationNode;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps reference tokens ({@code w1e4}) to live automation nodes.
 * <p>
 * Tokens are grouped by window scope. Each scope keeps its own sequence starting at 1,
 * and {@link #clear(String)} drops the whole scope entry at once, which is the only way
 * tokens are ever invalidated.
 */
@Slf4j
public class ElementRegistry {

    private static final char SEQUENCE_MARKER = 'e';

    private final Map<String, ScopeEntry> scopes = new HashMap<>();

    /**
     * Register a node in the given scope and return its new token.
     */
    public synchronized String register(String scope, AutomationNode node) {
        requireScope(scope);
        if (node == null) {
            throw new IllegalArgumentException("node must not be null");
        }
        ScopeEntry entry = scopes.computeIfAbsent(scope, s -> new ScopeEntry());
        String token = scope + SEQUENCE_MARKER + (++entry.sequence);
        entry.elements.put(token, node);
        return token;
    }

    /**
     * Resolve a token; empty when it was never issued or its scope has been cleared.
     */
    public synchronized Optional<AutomationNode> resolve(String token) {
        String scope = scopeOf(token);
        if (scope == null) {
            return Optional.empty();
        }
        ScopeEntry entry = scopes.get(scope);
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.elements.get(token));
    }

    public synchronized boolean contains(String token) {
        return resolve(token).isPresent();
    }

    /**
     * Drop every token of a scope and restart its sequence. Clearing an unknown
     * scope does nothing.
     */
    public synchronized void clear(String scope) {
        requireScope(scope);
        ScopeEntry removed = scopes.remove(scope);
        if (removed != null) {
            log.debug("Cleared {} refs for scope {}", removed.elements.size(), scope);
        }
    }

    public synchronized int count() {
        int total = 0;
        for (ScopeEntry entry : scopes.values()) {
            total += entry.elements.size();
        }
        return total;
    }

    public synchronized int scopeSize(String scope) {
        ScopeEntry entry = scopes.get(scope);
        return entry == null ? 0 : entry.elements.size();
    }

    /**
     * Scope part of a token: everything before the last {@code e}, provided what
     * follows it is a positive sequence number.
     */
    static String scopeOf(String token) {
        if (token == null) {
            return null;
        }
        int marker = token.lastIndexOf(SEQUENCE_MARKER);
        if (marker <= 0 || marker == token.length() - 1) {
            return null;
        }
        for (int i = marker + 1; i < token.length(); i++) {
            if (!Character.isDigit(token.charAt(i))) {
                return null;
            }
        }
        return token.substring(0, marker);
    }

    private static void requireScope(String scope) {
        if (scope == null || scope.isBlank()) {
            throw new IllegalArgumentException("scope must not be blank");
        }
    }

    private static final class ScopeEntry {
        private int sequence;
        private final Map<String, AutomationNode> elements = new LinkedHashMap<>();
    }
}
