package com.deskclaw.tools.builtin;

import com.deskclaw.automation.query.ElementFinder;
import com.deskclaw.automation.query.FindQuery;
import com.deskclaw.automation.query.FindResult;
import com.deskclaw.automation.query.StateCriterion;
import com.deskclaw.automation.session.WindowSession;
import com.deskclaw.automation.snapshot.Role;
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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Finds elements by role, name and state. Returns refs only, no hierarchy.
 */
@Slf4j
public class FindTool implements DesktopTool {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final List<Role> SEARCHABLE_ROLES = List.of(
            Role.BUTTON, Role.TEXTBOX, Role.TEXT, Role.CHECKBOX, Role.RADIO, Role.COMBOBOX,
            Role.LISTITEM, Role.MENUITEM, Role.TAB, Role.LINK, Role.IMAGE, Role.GROUP, Role.WINDOW);

    private final WindowSession session;
    private final ToolLimits.FindLimits limits;
    private final ElementFinder finder;

    public FindTool(WindowSession session, ToolLimits.FindLimits limits) {
        this.session = session;
        this.limits = limits;
        this.finder = new ElementFinder(session.getRegistry());
    }

    @Override
    public String getName() {
        return "windows_find";
    }

    @Override
    public String getDescription() {
        return "Find elements matching criteria. Returns refs only, no tree hierarchy. "
                + "~100-200 tokens. Use this when you know what you're looking for. "
                + "Hard limit of " + limits.getMaxResultsCeiling() + " results.";
    }

    @Override
    public JsonNode getParameterSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");

        ObjectNode role = props.putObject("role");
        role.put("type", "string");
        role.put("description", "Element role");
        ArrayNode roleEnum = role.putArray("enum");
        SEARCHABLE_ROLES.forEach(r -> roleEnum.add(r.tag()));

        ObjectNode nameContains = props.putObject("name_contains");
        nameContains.put("type", "string");
        nameContains.put("description", "Element name contains this text (case-insensitive, * wildcards at either end)");

        ObjectNode nameExact = props.putObject("name_exact");
        nameExact.put("type", "string");
        nameExact.put("description", "Element name matches exactly");

        ObjectNode state = props.putObject("state");
        state.put("type", "string");
        state.put("description", "Filter by state");
        ArrayNode stateEnum = state.putArray("enum");
        for (StateCriterion criterion : StateCriterion.values()) {
            stateEnum.add(criterion.value());
        }

        ObjectNode handle = props.putObject("handle");
        handle.put("type", "string");
        handle.put("description", "Window handle to search within (uses focused window if omitted)");

        ObjectNode maxResults = props.putObject("max_results");
        maxResults.put("type", "integer");
        maxResults.put("description", "Maximum results (default: " + limits.getDefaultMaxResults()
                + ", max: " + limits.getMaxResultsCeiling() + ")");
        maxResults.put("default", limits.getDefaultMaxResults());
        maxResults.put("maximum", limits.getMaxResultsCeiling());

        schema.putArray("required").add("role");
        return schema;
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolContext context) {
        return CompletableFuture.completedFuture(doExecute(context));
    }

    private ToolResult doExecute(ToolContext context) {
        JsonNode params = context.getParameters();
        String roleParam = ToolParamUtils.readStringParam(params, "role");
        if (roleParam == null) {
            return ToolResult.fail(ToolError.of(ErrorCodes.ELEMENT_SEARCH_FAILED,
                    "role parameter is required",
                    "Specify a role: button, textbox, text, checkbox, etc."));
        }
        Role role = Role.fromTag(roleParam);
        if (role == null) {
            return ToolResult.fail(ToolError.of(ErrorCodes.ELEMENT_SEARCH_FAILED,
                    "Unknown role: " + roleParam,
                    "Specify a role: button, textbox, text, checkbox, etc."));
        }
        String stateParam = ToolParamUtils.readStringParam(params, "state");
        StateCriterion state = StateCriterion.parse(stateParam);
        if (stateParam != null && state == null) {
            return ToolResult.fail(ToolError.of(ErrorCodes.ELEMENT_SEARCH_FAILED,
                    "Unknown state: " + stateParam,
                    "Use one of: enabled, disabled, focused, checked, selected"));
        }
        int maxResults = ToolLimits.clamp(
                ToolParamUtils.readIntParam(params, "max_results", limits.getDefaultMaxResults()),
                1, limits.getMaxResultsCeiling());

        try {
            WindowTargets.Target target = WindowTargets.resolve(session,
                    ToolParamUtils.readStringParam(params, "handle"));
            FindResult result = finder.find(target.handle(), target.window(), FindQuery.builder()
                    .role(role)
                    .nameContains(ToolParamUtils.readStringParam(params, "name_contains"))
                    .nameExact(ToolParamUtils.readStringParam(params, "name_exact"))
                    .state(state)
                    .maxResults(maxResults)
                    .maxSearch(limits.getMaxSearch())
                    .nameMaxLength(limits.getNameMaxLength())
                    .build());
            return ToolParamUtils.jsonResult(result, result.toCompactString());
        } catch (ToolErrorException e) {
            return ToolResult.fail(e.getError());
        } catch (RuntimeException e) {
            log.error("windows_find error: {}", e.getMessage(), e);
            return ToolResult.fail(ToolError.of(ErrorCodes.ELEMENT_SEARCH_FAILED,
                    "Failed to search for elements: " + e.getMessage(),
                    "Ensure a window is active and accessible",
                    "Try simpler search criteria",
                    "Use windows_status first to verify window state"));
        }
    }
}
