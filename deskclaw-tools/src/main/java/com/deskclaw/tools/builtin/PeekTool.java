package com.deskclaw.tools.builtin;

import com.deskclaw.automation.node.AutomationNode;
import com.deskclaw.automation.query.FocusPeeker;
import com.deskclaw.automation.query.PeekResult;
import com.deskclaw.automation.session.WindowSession;
import com.deskclaw.tools.DesktopTool;
import com.deskclaw.tools.ErrorCodes;
import com.deskclaw.tools.ToolError;
import com.deskclaw.tools.ToolLimits;
import com.deskclaw.tools.ToolParamUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Lightweight look at the focused element and its siblings (~50 tokens).
 */
@Slf4j
public class PeekTool implements DesktopTool {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final WindowSession session;
    private final ToolLimits.PeekLimits limits;
    private final FocusPeeker peeker;

    public PeekTool(WindowSession session, ToolLimits.PeekLimits limits) {
        this.session = session;
        this.limits = limits;
        this.peeker = new FocusPeeker(session.getRegistry(), limits.getNameMaxLength());
    }

    @Override
    public String getName() {
        return "windows_peek";
    }

    @Override
    public String getDescription() {
        return "Peek at the focused element and its siblings. ~50 tokens. "
                + "Cheapest way to see what is around the cursor.";
    }

    @Override
    public JsonNode getParameterSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");

        ObjectNode includeSiblings = props.putObject("include_siblings");
        includeSiblings.put("type", "boolean");
        includeSiblings.put("description", "Include sibling elements (default: true)");
        includeSiblings.put("default", true);

        ObjectNode maxSiblings = props.putObject("max_siblings");
        maxSiblings.put("type", "integer");
        maxSiblings.put("description", "Max siblings to show (default: " + limits.getDefaultMaxSiblings()
                + ", max: " + limits.getMaxSiblingsCeiling() + ")");
        maxSiblings.put("default", limits.getDefaultMaxSiblings());
        return schema;
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolContext context) {
        return CompletableFuture.completedFuture(doExecute(context));
    }

    private ToolResult doExecute(ToolContext context) {
        JsonNode params = context.getParameters();
        boolean includeSiblings = ToolParamUtils.readBoolParam(params, "include_siblings", true);
        int maxSiblings = ToolLimits.clamp(
                ToolParamUtils.readIntParam(params, "max_siblings", limits.getDefaultMaxSiblings()),
                0, limits.getMaxSiblingsCeiling());

        Optional<AutomationNode> focused = session.focusedElement();
        if (focused.isEmpty()) {
            return ToolResult.fail(ToolError.of(ErrorCodes.ELEMENT_NOT_FOUND,
                    "No element has focus",
                    "Ensure an element has focus",
                    "Try windows_status to check current state"));
        }
        try {
            String handle = session.focusedWindow().map(session::getOrCreateHandle).orElse(null);
            PeekResult result = peeker.peek(handle, focused.get(), includeSiblings, maxSiblings);
            return ToolParamUtils.jsonResult(result, result.toCompactString());
        } catch (RuntimeException e) {
            log.error("windows_peek error: {}", e.getMessage(), e);
            return ToolResult.fail(ToolError.of(ErrorCodes.ELEMENT_NOT_FOUND,
                    "Failed to peek: " + e.getMessage(),
                    "Ensure an element has focus",
                    "Try windows_status to check current state"));
        }
    }
}
