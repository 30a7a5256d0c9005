package com.deskclaw.tools.builtin;

import com.deskclaw.automation.node.AutomationNode;
import com.deskclaw.automation.node.CapabilitySet;
import com.deskclaw.automation.node.Readout;
import com.deskclaw.automation.session.WindowSession;
import com.deskclaw.automation.snapshot.NodeClassifier;
import com.deskclaw.common.text.TextTruncation;
import com.deskclaw.tools.DesktopTool;
import com.deskclaw.tools.ErrorCodes;
import com.deskclaw.tools.ToolError;
import com.deskclaw.tools.ToolLimits;
import com.deskclaw.tools.ToolParamUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Quick session overview: active window, focused element, process name.
 */
@Slf4j
public class StatusTool implements DesktopTool {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final WindowSession session;
    private final ToolLimits.StatusLimits limits;
    private final Clock clock;

    public StatusTool(WindowSession session, ToolLimits.StatusLimits limits, Clock clock) {
        this.session = session;
        this.limits = limits;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "windows_status";
    }

    @Override
    public String getDescription() {
        return "Quick session overview: active window, focused element, process name. "
                + "~80 tokens. CALL THIS FIRST before any other tool to understand current state. "
                + "Returns refs for immediate interaction.";
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
            AutomationNode focused = session.focusedElement().orElse(null);
            AutomationNode window = focused != null ? WindowSession.owningWindow(focused).orElse(null) : null;
            String handle = session.getOrCreateHandle(window);

            StatusResult.WindowInfo windowInfo = null;
            if (window != null) {
                String process = session.processNameOf(window);
                windowInfo = StatusResult.WindowInfo.builder()
                        .title(TextTruncation.truncate(Readout.guard(window::name).orElse(null),
                                limits.getTitleMaxLength()))
                        .handle(handle)
                        .process(process != null ? process : "unknown")
                        .build();
            }

            StatusResult.FocusedElementInfo focusedInfo = null;
            if (focused != null) {
                focusedInfo = StatusResult.FocusedElementInfo.builder()
                        .name(TextTruncation.truncate(Readout.guard(focused::name).orElse(null),
                                limits.getNameMaxLength()))
                        .role(NodeClassifier.roleOf(focused).tag())
                        .ref(handle != null ? session.getRegistry().register(handle, focused) : null)
                        .value(TextTruncation.truncate(valueOf(focused), limits.getValueMaxLength()))
                        .enabled(Readout.guard(focused::isEnabled).orElse(false))
                        .hasKeyboardFocus(Readout.guard(focused::hasKeyboardFocus).orElse(false))
                        .build();
            }

            StatusResult result = StatusResult.builder()
                    .window(windowInfo)
                    .focused(focusedInfo)
                    .session(StatusResult.SessionInfo.builder()
                            .activeWindows(session.activeWindowCount())
                            .registeredElements(session.registeredElementCount())
                            .build())
                    .timestamp(Instant.now(clock).toString())
                    .build();
            return ToolParamUtils.jsonResult(result, result.toCompactString());
        } catch (RuntimeException e) {
            log.error("windows_status error: {}", e.getMessage(), e);
            return ToolResult.fail(ToolError.of(ErrorCodes.WINDOW_NOT_FOUND,
                    "Failed to get window status: " + e.getMessage(),
                    "Ensure an application window has focus",
                    "Check if the target window is minimized",
                    "Try windows_list_windows to see available windows"));
        }
    }

    private static String valueOf(AutomationNode node) {
        return Readout.guard(node::capabilities)
                .orElse(CapabilitySet.none())
                .value()
                .map(capability -> Readout.guard(capability::value))
                .flatMap(Readout::toOptional)
                .orElse(null);
    }
}
