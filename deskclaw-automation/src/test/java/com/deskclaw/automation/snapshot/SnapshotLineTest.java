package com.deskclaw.automation.snapshot;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotLineTest {

    @Test
    void render_withNameAndStates() {
        SnapshotLine line = new SnapshotLine(2, Role.CHECKBOX, "Bold", "w1e3",
                List.of(StateTag.DISABLED, StateTag.CHECKED));

        assertEquals("    - checkbox \"Bold\" [ref=w1e3] [disabled] [checked]", line.render());
    }

    @Test
    void render_withoutName_omitsQuotes() {
        SnapshotLine line = new SnapshotLine(0, Role.GROUP, null, "w1e1", List.of());

        assertEquals("- group [ref=w1e1]", line.render());
    }

    @Test
    void escapeName_handlesQuotesBackslashesAndLineBreaks() {
        assertEquals("say \\\"hi\\\"", SnapshotLine.escapeName("say \"hi\""));
        assertEquals("C:\\\\temp", SnapshotLine.escapeName("C:\\temp"));
        assertEquals("a\\nb", SnapshotLine.escapeName("a\r\nb"));
        assertEquals("ab", SnapshotLine.escapeName("a\rb"));
    }
}
