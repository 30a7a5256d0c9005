package com.deskclaw.tools.builtin;

import com.deskclaw.automation.node.AutomationNode;
import com.deskclaw.automation.node.CapabilitySet;
import com.deskclaw.automation.node.Readout;
import com.deskclaw.automation.session.WindowSession;
import com.deskclaw.tools.DesktopTool;
import com.deskclaw.tools.ErrorCodes;
import com.deskclaw.tools.ToolError;
import com.deskclaw.tools.ToolParamUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Text of a previously referenced element: the current value for inputs,
 * otherwise the element's name.
 */
@Slf4j
public class GetTextTool implements DesktopTool {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final WindowSession session;

    public GetTextTool(WindowSession session) {
        this.session = session;
    }

    @Override
    public String getName() {
        return "windows_get_text";
    }

    @Override
    public String getDescription() {
        return "Get the text content of an element. Returns the element's name, "
                + "or for text inputs, the current value.";
    }

    @Override
    public JsonNode getParameterSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");

        ObjectNode ref = props.putObject("ref");
        ref.put("type", "string");
        ref.put("description", "Element ref from windows_snapshot (e.g., 'w1e5')");

        schema.putArray("required").add("ref");
        return schema;
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolContext context) {
        return CompletableFuture.completedFuture(doExecute(context));
    }

    private ToolResult doExecute(ToolContext context) {
        String ref = ToolParamUtils.readStringParam(context.getParameters(), "ref");
        if (ref == null) {
            return ToolResult.fail(ToolError.of(ErrorCodes.ELEMENT_SEARCH_FAILED,
                    "ref parameter is required",
                    "Pass a ref from windows_snapshot, windows_find or windows_status"));
        }
        Optional<AutomationNode> element = session.resolve(ref);
        if (element.isEmpty()) {
            return ToolResult.fail(ToolError.of(ErrorCodes.ELEMENT_NOT_FOUND,
                    "Element not found: " + ref + ". Run windows_snapshot to refresh element refs.",
                    "Refs expire when their window is snapshotted again",
                    "Use windows_find to get a fresh ref"));
        }
        try {
            return ToolResult.ok(textOf(element.get()));
        } catch (RuntimeException e) {
            log.error("windows_get_text error: {}", e.getMessage(), e);
            return ToolResult.fail(ToolError.of(ErrorCodes.ELEMENT_NOT_FOUND,
                    "Failed to get text from " + ref + ": " + e.getMessage(),
                    "The element may have been closed",
                    "Run windows_snapshot to refresh element refs"));
        }
    }

    static String textOf(AutomationNode node) {
        String value = Readout.guard(node::capabilities)
                .orElse(CapabilitySet.none())
                .value()
                .map(capability -> Readout.guard(capability::value).orElse(null))
                .orElse(null);
        if (value != null && !value.isEmpty()) {
            return value;
        }
        return Readout.guard(node::name).orElse("");
    }
}
