package com.deskclaw.tools.builtin;

import com.deskclaw.automation.node.NodeKind;
import com.deskclaw.automation.node.StaticDesktop;
import com.deskclaw.automation.node.StaticNode;
import com.deskclaw.automation.session.WindowSession;
import com.deskclaw.automation.snapshot.SnapshotResult;
import com.deskclaw.tools.DesktopFixtures;
import com.deskclaw.tools.DesktopTool;
import com.deskclaw.tools.ErrorCodes;
import com.deskclaw.tools.ToolLimits;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotToolTest {

    private DesktopFixtures fixtures;
    private SnapshotTool tool;

    @BeforeEach
    void setUp() {
        fixtures = new DesktopFixtures();
        tool = new SnapshotTool(fixtures.session, ToolLimits.defaults().getSnapshot());
    }

    @Test
    void execute_focusedWindow_rendersTree() throws Exception {
        DesktopTool.ToolResult result = DesktopFixtures.run(tool, DesktopFixtures.params());

        assertTrue(result.isSuccess());
        assertEquals("- window \"Calculator\" [ref=w1e1]\n"
                + "  - titlebar \"Calculator\" [ref=w1e2]\n"
                + "    - button \"Close\" [ref=w1e3]\n"
                + "  - textbox \"Display\" [ref=w1e4] [readonly]\n"
                + "  - group \"Number pad\" [ref=w1e5]\n"
                + "    - button \"Seven\" [ref=w1e6]\n"
                + "    - button \"Eight\" [ref=w1e7]\n"
                + "    - button \"Nine\" [ref=w1e8] [disabled]\n"
                + "  - status \"Ready\" [ref=w1e9]\n", result.getOutput());
        assertEquals(9, ((SnapshotResult) result.getData()).elementCount());
        assertSame(fixtures.display, fixtures.session.resolve("[ref=w1e4]").orElseThrow());
    }

    @Test
    void execute_interactiveFilter_promotesMatchesToParentDepth() throws Exception {
        ObjectNode params = DesktopFixtures.params();
        params.put("filter", "interactive");

        DesktopTool.ToolResult result = DesktopFixtures.run(tool, params);

        assertEquals("- button \"Close\" [ref=w1e1]\n"
                + "- textbox \"Display\" [ref=w1e2] [readonly]\n"
                + "- button \"Seven\" [ref=w1e3]\n"
                + "- button \"Eight\" [ref=w1e4]\n"
                + "- button \"Nine\" [ref=w1e5] [disabled]\n", result.getOutput());
    }

    @Test
    void execute_depthParameterLimitsTree() throws Exception {
        ObjectNode params = DesktopFixtures.params();
        params.put("depth", 1);

        DesktopTool.ToolResult result = DesktopFixtures.run(tool, params);

        assertEquals(5, ((SnapshotResult) result.getData()).elementCount());
        assertFalse(result.getOutput().contains("Close"));
    }

    @Test
    void execute_truncatedSnapshot_appendsAdvisory() throws Exception {
        ObjectNode params = DesktopFixtures.params();
        params.put("max_elements", 2);

        DesktopTool.ToolResult result = DesktopFixtures.run(tool, params);

        assertTrue(result.getOutput().endsWith("\n\n[TRUNCATED: 2+ elements, showing first 2. "
                + "Use 'depth' or 'filter' parameters to narrow results. "
                + "Better: Use windows_find for targeted search]"));
        assertTrue(((SnapshotResult) result.getData()).truncated());
    }

    @Test
    void execute_unknownHandle_failsWithWindowNotFound() throws Exception {
        ObjectNode params = DesktopFixtures.params();
        params.put("handle", "w99");

        DesktopTool.ToolResult result = DesktopFixtures.run(tool, params);

        assertFalse(result.isSuccess());
        assertEquals(ErrorCodes.WINDOW_NOT_FOUND, result.getError().getCode());
        assertEquals("Window not found: w99", result.getError().getMessage());
    }

    @Test
    void execute_noFocusedWindow_fails() throws Exception {
        WindowSession session = new WindowSession(StaticDesktop.of(StaticNode.of(NodeKind.WINDOW, "Idle")));
        SnapshotTool idle = new SnapshotTool(session, ToolLimits.defaults().getSnapshot());

        DesktopTool.ToolResult result = DesktopFixtures.run(idle, DesktopFixtures.params());

        assertFalse(result.isSuccess());
        assertEquals("No window found", result.getError().getMessage());
    }

    @Test
    void execute_emptyResult_rendersPlaceholder() throws Exception {
        StaticNode blank = StaticNode.builder(NodeKind.WINDOW).name("Blank").build();
        WindowSession session = new WindowSession(StaticDesktop.of(blank));
        String handle = session.registerWindow(blank);
        SnapshotTool textOnly = new SnapshotTool(session, ToolLimits.defaults().getSnapshot());
        ObjectNode params = DesktopFixtures.params();
        params.put("handle", handle);
        params.put("filter", "text");

        DesktopTool.ToolResult result = DesktopFixtures.run(textOnly, params);

        assertEquals("(empty)\n", result.getOutput());
    }

    @Test
    void advisory_largeTreeAndSmallTree() {
        assertEquals("[LARGE TREE: 150 elements. Consider using windows_status, windows_find, or windows_peek]",
                tool.advisory(150, 200));
        assertNull(tool.advisory(99, 200));
        assertTrue(tool.advisory(200, 200).startsWith("[TRUNCATED: 200+ elements, showing first 200"));
    }
}
