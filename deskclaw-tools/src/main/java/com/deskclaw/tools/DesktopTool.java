package com.deskclaw.tools;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.concurrent.CompletableFuture;

/**
 * Desktop automation tool exposed to an agent.
 *
 * <p>
 * Every tool has a name, description, parameter schema, and an
 * execute method that returns a {@link ToolResult}. Tools read the UI tree on
 * the calling thread, so the returned future is normally already complete.
 * </p>
 */
public interface DesktopTool {

    /** Unique tool name (e.g. "windows_snapshot", "windows_find"). */
    String getName();

    /** Human-readable description for the agent. */
    String getDescription();

    /** JSON Schema describing the tool's input parameters. */
    JsonNode getParameterSchema();

    /** Execute the tool with the given context. */
    CompletableFuture<ToolResult> execute(ToolContext context);

    // --- Supporting types ---

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class ToolResult {
        private boolean success;
        /** Primary rendering: JSON for structured results, plain text for snapshots. */
        private String output;
        /** Structured payload behind {@code output}. */
        private Object data;
        /** Short human-readable rendering of {@code data}, when the tool has one. */
        private String compact;
        private ToolError error;

        public static ToolResult ok(String output) {
            return ToolResult.builder().success(true).output(output).build();
        }

        public static ToolResult ok(String output, Object data) {
            return ToolResult.builder().success(true).output(output).data(data).build();
        }

        public static ToolResult ok(String output, Object data, String compact) {
            return ToolResult.builder().success(true).output(output).data(data).compact(compact).build();
        }

        public static ToolResult fail(ToolError error) {
            return ToolResult.builder().success(false).output(error.toJson()).error(error).build();
        }

        /** Failure without a structured error, for problems outside any one tool. */
        public static ToolResult failText(String message) {
            return ToolResult.builder().success(false).output(message).build();
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class ToolContext {
        private JsonNode parameters;
    }
}
