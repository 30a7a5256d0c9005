package com.deskclaw.tools.builtin;

import com.deskclaw.automation.session.WindowSession;
import com.deskclaw.automation.snapshot.SnapshotBuilder;
import com.deskclaw.automation.snapshot.SnapshotFilter;
import com.deskclaw.automation.snapshot.SnapshotOptions;
import com.deskclaw.automation.snapshot.SnapshotResult;
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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Full accessibility snapshot of one window, one line per surfaced element.
 * Each call replaces every ref previously issued for that window.
 */
@Slf4j
public class SnapshotTool implements DesktopTool {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final WindowSession session;
    private final ToolLimits.SnapshotLimits limits;
    private final SnapshotBuilder builder;

    public SnapshotTool(WindowSession session, ToolLimits.SnapshotLimits limits) {
        this.session = session;
        this.limits = limits;
        this.builder = new SnapshotBuilder(session.getRegistry());
    }

    @Override
    public String getName() {
        return "windows_snapshot";
    }

    @Override
    public String getDescription() {
        return "Full accessibility snapshot of a window. Returns 500-5000+ tokens. "
                + "Prefer windows_status, windows_find or windows_peek; use this only when "
                + "scoped tools are insufficient. Refs from earlier snapshots of the window stop working.";
    }

    @Override
    public JsonNode getParameterSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");

        ObjectNode handle = props.putObject("handle");
        handle.put("type", "string");
        handle.put("description", "Window handle from windows_list_windows or windows_status. "
                + "If omitted, uses the focused window.");

        ObjectNode depth = props.putObject("depth");
        depth.put("type", "integer");
        depth.put("description", "Max tree depth (1-" + limits.getMaxDepth() + ", default: "
                + limits.getDefaultDepth() + ")");
        depth.put("default", limits.getDefaultDepth());
        depth.put("minimum", 1);
        depth.put("maximum", limits.getMaxDepth());

        ObjectNode filter = props.putObject("filter");
        filter.put("type", "string");
        filter.put("description", "Element filter: 'all', 'interactive' (buttons, inputs), "
                + "'text' (labels, text), 'structure' (containers)");
        ArrayNode filterEnum = filter.putArray("enum");
        for (SnapshotFilter value : SnapshotFilter.values()) {
            filterEnum.add(value.value());
        }
        filter.put("default", limits.getFilter().value());

        ObjectNode maxElements = props.putObject("max_elements");
        maxElements.put("type", "integer");
        maxElements.put("description", "Max elements to return (default: " + limits.getMaxElements()
                + ", max: " + limits.getMaxElementsCeiling() + ")");
        maxElements.put("default", limits.getMaxElements());
        maxElements.put("maximum", limits.getMaxElementsCeiling());
        return schema;
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolContext context) {
        return CompletableFuture.completedFuture(doExecute(context));
    }

    private ToolResult doExecute(ToolContext context) {
        JsonNode params = context.getParameters();
        String handle = ToolParamUtils.readStringParam(params, "handle");
        int depth = ToolLimits.clamp(ToolParamUtils.readIntParam(params, "depth", limits.getDefaultDepth()),
                1, limits.getMaxDepth());
        String filterParam = ToolParamUtils.readStringParam(params, "filter");
        SnapshotFilter filter = filterParam != null ? SnapshotFilter.parse(filterParam) : limits.getFilter();
        int maxElements = ToolLimits.clamp(
                ToolParamUtils.readIntParam(params, "max_elements", limits.getMaxElements()),
                1, limits.getMaxElementsCeiling());

        try {
            WindowTargets.Target target = WindowTargets.resolve(session, handle);
            SnapshotResult result = builder.build(target.handle(), target.window(), SnapshotOptions.builder()
                    .maxDepth(depth)
                    .maxElements(maxElements)
                    .nameMaxLength(limits.getNameMaxLength())
                    .filter(filter)
                    .build());

            String text = result.isEmpty() ? "(empty)\n" : result.text();
            String advisory = advisory(result.elementCount(), maxElements);
            if (advisory != null) {
                text = text + "\n" + advisory;
            }
            return ToolResult.ok(text, result);
        } catch (ToolErrorException e) {
            return ToolResult.fail(e.getError());
        } catch (RuntimeException e) {
            log.error("windows_snapshot error: {}", e.getMessage(), e);
            return ToolResult.fail(ToolError.of(ErrorCodes.ELEMENT_SEARCH_FAILED,
                    "Failed to build snapshot: " + e.getMessage(),
                    "Ensure the window is still open",
                    "Use windows_status first to verify window state"));
        }
    }

    /**
     * Size warning appended after the snapshot, or null when the tree is small.
     */
    String advisory(int elementCount, int maxElements) {
        List<String> warnings = new ArrayList<>();
        if (elementCount >= maxElements) {
            warnings.add("TRUNCATED: " + elementCount + "+ elements, showing first " + maxElements);
            warnings.add("Use 'depth' or 'filter' parameters to narrow results");
            warnings.add("Better: Use windows_find for targeted search");
        } else if (elementCount >= limits.getLargeTreeThreshold()) {
            warnings.add("LARGE TREE: " + elementCount + " elements");
            warnings.add("Consider using windows_status, windows_find, or windows_peek");
        }
        return warnings.isEmpty() ? null : "[" + String.join(". ", warnings) + "]";
    }
}
