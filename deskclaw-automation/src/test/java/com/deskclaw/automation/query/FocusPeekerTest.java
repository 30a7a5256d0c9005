package com.deskclaw.automation.query;

import com.deskclaw.automation.node.AutomationNode;
import com.deskclaw.automation.node.NodeKind;
import com.deskclaw.automation.node.NodeUnavailableException;
import com.deskclaw.automation.node.StaticNode;
import com.deskclaw.automation.snapshot.ElementRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class FocusPeekerTest {

    private ElementRegistry registry;
    private FocusPeeker peeker;
    private AutomationNode focused;

    @BeforeEach
    void setUp() throws NodeUnavailableException {
        registry = new ElementRegistry();
        peeker = new FocusPeeker(registry);
        StaticNode.Builder form = StaticNode.builder(NodeKind.GROUP).name("Login");
        form.child(StaticNode.builder(NodeKind.EDIT).name("User name"));
        form.child(StaticNode.builder(NodeKind.EDIT).name("Password").keyboardFocus(true));
        form.child(StaticNode.builder(NodeKind.BUTTON).name("Sign in").enabled(false));
        form.child(StaticNode.builder(NodeKind.HYPERLINK).name("Forgot your password? Reset it here"));
        StaticNode root = form.build();
        focused = root.children().get(1);
    }

    @Test
    void peek_listsFocusedFirstThenSiblings() {
        PeekResult result = peeker.peek("w1", focused, true, 10);

        List<String> names = result.getChildren().stream()
                .map(PeekResult.PeekElement::getName).collect(Collectors.toList());
        assertEquals(List.of("Password", "User name", "Sign in", "Forgot your password? Reset..."), names);
        assertEquals(4, result.getChildCount());
        assertEquals("textbox", result.getRole());
        assertEquals("w1e1", result.getRef());
        assertSame(focused, registry.resolve("w1e1").orElseThrow());
    }

    @Test
    void peek_respectsSiblingLimitAndToggle() {
        assertEquals(2, peeker.peek("w1", focused, true, 1).getChildren().size());
        assertEquals(1, peeker.peek("w1", focused, false, 10).getChildren().size());
    }

    @Test
    void peek_withoutScope_leavesRefsEmpty() {
        PeekResult result = peeker.peek(null, focused, true, 10);

        assertEquals("", result.getRef());
        assertEquals(0, registry.count());
    }

    @Test
    void compactString_marksDisabledSiblings() {
        String text = peeker.peek("w1", focused, true, 2).toCompactString();

        assertEquals("textbox \"Password\" [w1e1] - 4 children\n"
                + "  [w1e1] textbox \"Password\"\n"
                + "  [w1e2] textbox \"User name\"\n"
                + "  [w1e3] button \"Sign in\" [disabled]", text);
    }
}
