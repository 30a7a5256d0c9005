package com.deskclaw.tools.builtin;

import com.deskclaw.automation.node.NodeUnavailableException;
import com.deskclaw.automation.session.ListedWindow;
import com.deskclaw.automation.session.WindowSession;
import com.deskclaw.tools.DesktopTool;
import com.deskclaw.tools.ErrorCodes;
import com.deskclaw.tools.ToolError;
import com.deskclaw.tools.ToolParamUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Lists titled top-level windows with their session handles.
 */
@Slf4j
public class ListWindowsTool implements DesktopTool {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final WindowSession session;

    public ListWindowsTool(WindowSession session) {
        this.session = session;
    }

    @Override
    public String getName() {
        return "windows_list_windows";
    }

    @Override
    public String getDescription() {
        return "List all visible top-level windows with handles usable by the other windows_* tools.";
    }

    @Override
    public JsonNode getParameterSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        schema.putObject("properties");
        return schema;
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolContext context) {
        return CompletableFuture.completedFuture(doExecute());
    }

    private ToolResult doExecute() {
        try {
            List<ListedWindow> windows = session.listWindows();

            ObjectNode result = MAPPER.createObjectNode();
            ArrayNode arr = result.putArray("windows");
            StringBuilder compact = new StringBuilder();
            compact.append(windows.size()).append(" windows");
            for (ListedWindow window : windows) {
                ObjectNode n = arr.addObject();
                n.put("handle", window.handle());
                n.put("title", window.title());
                if (window.processName() != null)
                    n.put("process", window.processName());
                compact.append("\n  [").append(window.handle()).append("] ").append(window.title());
                if (window.processName() != null)
                    compact.append(" (").append(window.processName()).append(')');
            }
            result.put("count", windows.size());

            return ToolResult.ok(ToolParamUtils.toJsonString(result), result, compact.toString());
        } catch (NodeUnavailableException | RuntimeException e) {
            log.error("windows_list_windows error: {}", e.getMessage(), e);
            return ToolResult.fail(ToolError.of(ErrorCodes.WINDOW_NOT_FOUND,
                    "Failed to list windows: " + e.getMessage(),
                    "Ensure the desktop session is unlocked",
                    "Retry after a moment"));
        }
    }
}
