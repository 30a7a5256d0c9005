package com.deskclaw.tools;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ToolParamUtilsTest {

    @Test
    void readStringParam_trimsAndTreatsBlankAsMissing() {
        ObjectNode params = DesktopFixtures.params();
        params.put("handle", "  w1 ");
        params.put("blank", "   ");
        params.put("number", 3);

        assertEquals("w1", ToolParamUtils.readStringParam(params, "handle"));
        assertNull(ToolParamUtils.readStringParam(params, "blank"));
        assertNull(ToolParamUtils.readStringParam(params, "number"));
        assertThrows(IllegalArgumentException.class, () -> ToolParamUtils.readStringParam(params, "missing", true));
    }

    @Test
    void readIntParam_acceptsNumbersAndNumericStrings() {
        ObjectNode params = DesktopFixtures.params();
        params.put("depth", 4);
        params.put("max", "12");
        params.put("bad", "lots");

        assertEquals(4, ToolParamUtils.readIntParam(params, "depth", 2));
        assertEquals(12, ToolParamUtils.readIntParam(params, "max", 2));
        assertEquals(2, ToolParamUtils.readIntParam(params, "bad", 2));
        assertEquals(2, ToolParamUtils.readIntParam(null, "depth", 2));
    }

    @Test
    void readBoolParam_acceptsBooleansAndStrings() {
        ObjectNode params = DesktopFixtures.params();
        params.put("a", false);
        params.put("b", "TRUE");

        assertFalse(ToolParamUtils.readBoolParam(params, "a", true));
        assertTrue(ToolParamUtils.readBoolParam(params, "b", false));
        assertTrue(ToolParamUtils.readBoolParam(params, "c", true));
    }

    @Test
    void toolError_serialisesUnderErrorKey() throws Exception {
        ToolError error = ToolError.of(ErrorCodes.WINDOW_NOT_FOUND, "Window not found: w9", "Check handle");

        var json = ToolParamUtils.mapper().readTree(error.toJson());

        assertEquals("FW1001", json.path("error").path("code").asText());
        assertEquals("Window not found: w9", json.path("error").path("message").asText());
        assertEquals("Check handle", json.path("error").path("recovery").get(0).asText());
        assertFalse(json.path("error").has("context"));
        assertEquals("[FW1001] Window not found: w9\nRecovery steps:\n  - Check handle", error.toString());
    }
}
