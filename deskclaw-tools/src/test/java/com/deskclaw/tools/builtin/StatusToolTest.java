package com.deskclaw.tools.builtin;

import com.deskclaw.automation.node.NodeKind;
import com.deskclaw.automation.node.StaticDesktop;
import com.deskclaw.automation.node.StaticNode;
import com.deskclaw.automation.session.WindowSession;
import com.deskclaw.tools.DesktopFixtures;
import com.deskclaw.tools.DesktopTool;
import com.deskclaw.tools.ToolLimits;
import com.deskclaw.tools.ToolParamUtils;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class StatusToolTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T09:30:00Z"), ZoneOffset.UTC);

    private DesktopFixtures fixtures;
    private StatusTool tool;

    @BeforeEach
    void setUp() {
        fixtures = new DesktopFixtures();
        tool = new StatusTool(fixtures.session, ToolLimits.defaults().getStatus(), CLOCK);
    }

    @Test
    void execute_reportsWindowAndFocusedElement() throws Exception {
        DesktopTool.ToolResult result = DesktopFixtures.run(tool, DesktopFixtures.params());

        assertTrue(result.isSuccess());
        assertEquals("Window: Calculator [calc]\nFocused: textbox \"Display\" [w1e1]\nValue: 42",
                result.getCompact());

        JsonNode json = ToolParamUtils.mapper().readTree(result.getOutput());
        assertEquals("w1", json.path("window").path("handle").asText());
        assertEquals("2026-03-01T09:30:00Z", json.path("timestamp").asText());
        assertTrue(json.path("focused").path("hasKeyboardFocus").asBoolean());
        assertEquals(1, json.path("session").path("activeWindows").asInt());
        assertSame(fixtures.display, fixtures.session.resolve("w1e1").orElseThrow());
    }

    @Test
    void execute_nothingFocused_reportsNone() throws Exception {
        WindowSession session = new WindowSession(StaticDesktop.of(StaticNode.of(NodeKind.WINDOW, "Idle")));
        StatusTool idle = new StatusTool(session, ToolLimits.defaults().getStatus(), CLOCK);

        DesktopTool.ToolResult result = DesktopFixtures.run(idle, DesktopFixtures.params());

        assertTrue(result.isSuccess());
        assertEquals("Focused: none", result.getCompact());
    }

    @Test
    void execute_multipleWindows_addsSessionLine() throws Exception {
        fixtures.session.registerWindow(StaticNode.of(NodeKind.WINDOW, "Notes"));

        DesktopTool.ToolResult result = DesktopFixtures.run(tool, DesktopFixtures.params());

        assertTrue(result.getCompact().endsWith("Session: 2 windows"));
    }
}
