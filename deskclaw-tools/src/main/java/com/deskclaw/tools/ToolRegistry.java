package com.deskclaw.tools;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Registry for desktop tools.
 */
@Slf4j
public class ToolRegistry {

    private final Map<String, DesktopTool> tools = new ConcurrentHashMap<>();

    /**
     * Register a tool. Overwrites any existing tool with the same name.
     */
    public void register(DesktopTool tool) {
        tools.put(tool.getName(), tool);
        log.debug("Registered tool: {}", tool.getName());
    }

    /**
     * Register multiple tools, skipping names that already exist.
     */
    public void registerAll(Collection<? extends DesktopTool> toolList) {
        for (DesktopTool tool : toolList) {
            tools.putIfAbsent(tool.getName(), tool);
        }
    }

    public Optional<DesktopTool> get(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(tools.get(name));
    }

    public Set<String> getToolNames() {
        return Collections.unmodifiableSet(tools.keySet());
    }

    public List<DesktopTool> listAll() {
        return new ArrayList<>(tools.values());
    }

    /**
     * Tool definitions (name + description + schema), sorted by name.
     */
    public List<Map<String, Object>> toDefinitions() {
        return tools.values().stream()
                .sorted((a, b) -> a.getName().compareTo(b.getName()))
                .map(tool -> {
                    Map<String, Object> def = new LinkedHashMap<>();
                    def.put("name", tool.getName());
                    def.put("description", tool.getDescription());
                    def.put("input_schema", tool.getParameterSchema());
                    return def;
                })
                .collect(Collectors.toList());
    }

    public int size() {
        return tools.size();
    }

    /**
     * Execute a tool by name. Unknown tools and exceptions thrown by a tool come back
     * as failed results rather than exceptionally completed futures.
     */
    public CompletableFuture<DesktopTool.ToolResult> execute(String name, JsonNode parameters) {
        Optional<DesktopTool> tool = get(name);
        if (tool.isEmpty()) {
            log.warn("Unknown tool requested: {}", name);
            return CompletableFuture.completedFuture(DesktopTool.ToolResult.failText("Unknown tool: " + name));
        }
        DesktopTool.ToolContext context = DesktopTool.ToolContext.builder().parameters(parameters).build();
        CompletableFuture<DesktopTool.ToolResult> future;
        try {
            future = tool.get().execute(context);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        return future.exceptionally(e -> {
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            log.error("Tool {} failed: {}", name, cause.getMessage(), cause);
            return DesktopTool.ToolResult.failText("Error: " + cause.getMessage());
        });
    }
}
