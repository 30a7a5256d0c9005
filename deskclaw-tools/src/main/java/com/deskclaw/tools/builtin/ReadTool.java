package com.deskclaw.tools.builtin;

import com.deskclaw.automation.query.ReadResult;
import com.deskclaw.automation.query.Region;
import com.deskclaw.automation.query.RegionReader;
import com.deskclaw.automation.session.WindowSession;
import com.deskclaw.tools.DesktopTool;
import com.deskclaw.tools.ErrorCodes;
import com.deskclaw.tools.ToolError;
import com.deskclaw.tools.ToolErrorException;
import com.deskclaw.tools.ToolLimits;
import com.deskclaw.tools.ToolParamUtils;
import com.deskclaw.tools.WindowTargets;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;

/**
 * Reads one region of a window (focused element, menu, status bar, dialog,
 * title bar, toolbar) instead of the whole tree.
 */
@Slf4j
public class ReadTool implements DesktopTool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String REGION_HINT = "Specify a region: focused, menu, status, dialog, titlebar, toolbar";

    private final WindowSession session;
    private final ToolLimits.ReadLimits limits;
    private final RegionReader reader;

    public ReadTool(WindowSession session, ToolLimits.ReadLimits limits) {
        this.session = session;
        this.limits = limits;
        this.reader = new RegionReader(session.getRegistry(), limits.getMaxElements(), limits.getNameMaxLength());
    }

    @Override
    public String getName() {
        return "windows_read";
    }

    @Override
    public String getDescription() {
        return "Read a specific region of a window. ~100-200 tokens. "
                + "Use instead of windows_snapshot when you only need the menu, status bar, dialog or focused area.";
    }

    @Override
    public JsonNode getParameterSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");

        ObjectNode region = props.putObject("region");
        region.put("type", "string");
        region.put("description", "Region to read");
        ArrayNode regionEnum = region.putArray("enum");
        for (Region value : Region.values()) {
            regionEnum.add(value.value());
        }

        ObjectNode handle = props.putObject("handle");
        handle.put("type", "string");
        handle.put("description", "Window handle (uses focused window if omitted)");

        ObjectNode depth = props.putObject("depth");
        depth.put("type", "integer");
        depth.put("description", "Depth below the region root (default: " + limits.getDefaultDepth()
                + ", max: " + limits.getMaxDepth() + ")");
        depth.put("default", limits.getDefaultDepth());
        depth.put("maximum", limits.getMaxDepth());

        schema.putArray("required").add("region");
        return schema;
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolContext context) {
        return CompletableFuture.completedFuture(doExecute(context));
    }

    private ToolResult doExecute(ToolContext context) {
        JsonNode params = context.getParameters();
        String regionParam = ToolParamUtils.readStringParam(params, "region");
        if (regionParam == null) {
            return ToolResult.fail(ToolError.of(ErrorCodes.ELEMENT_SEARCH_FAILED,
                    "region parameter is required", REGION_HINT));
        }
        Region region = Region.parse(regionParam);
        if (region == null) {
            return ToolResult.fail(ToolError.of(ErrorCodes.ELEMENT_SEARCH_FAILED,
                    "Unknown region: " + regionParam, REGION_HINT));
        }
        int depth = ToolLimits.clamp(ToolParamUtils.readIntParam(params, "depth", limits.getDefaultDepth()),
                0, limits.getMaxDepth());

        try {
            WindowTargets.Target target = WindowTargets.resolve(session,
                    ToolParamUtils.readStringParam(params, "handle"));
            ReadResult result = reader.read(target.handle(), target.window(),
                    session.focusedElement().orElse(null), region, depth);
            return ToolParamUtils.jsonResult(result, result.toCompactString());
        } catch (ToolErrorException e) {
            return ToolResult.fail(e.getError());
        } catch (RuntimeException e) {
            log.error("windows_read error: {}", e.getMessage(), e);
            return ToolResult.fail(ToolError.of(ErrorCodes.ELEMENT_SEARCH_FAILED,
                    "Failed to read region '" + regionParam + "': " + e.getMessage(),
                    "Ensure a window is active",
                    "Try windows_status first to verify window state",
                    "The region may not exist in this window type"));
        }
    }
}
