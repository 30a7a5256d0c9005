package com.deskclaw.automation.snapshot;

import com.deskclaw.automation.node.AutomationNode;
import com.deskclaw.automation.node.NodeKind;
import com.deskclaw.automation.node.StaticNode;
import com.deskclaw.automation.node.ToggleState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotBuilderTest {

    private ElementRegistry registry;
    private SnapshotBuilder builder;

    @BeforeEach
    void setUp() {
        registry = new ElementRegistry();
        builder = new SnapshotBuilder(registry);
    }

    private static StaticNode calculator() {
        return StaticNode.builder(NodeKind.WINDOW).name("Calc")
                .child(StaticNode.builder(NodeKind.BUTTON).name("Seven"))
                .build();
    }

    private static StaticNode.Builder buttons(NodeKind containerKind, int count) {
        StaticNode.Builder container = StaticNode.builder(containerKind).name("Container");
        for (int i = 1; i <= count; i++) {
            container.child(StaticNode.builder(NodeKind.BUTTON).name("B" + i));
        }
        return container;
    }

    @Test
    void calculatorWindow_rendersExactText() {
        SnapshotResult result = builder.build("w1", calculator());

        assertEquals("- window \"Calc\" [ref=w1e1]\n  - button \"Seven\" [ref=w1e2]\n", result.text());
        assertEquals(2, result.elementCount());
        assertFalse(result.truncated());
    }

    @Test
    void unnamedChildlessSeparator_producesNoLine() {
        StaticNode root = StaticNode.builder(NodeKind.WINDOW).name("Editor")
                .child(StaticNode.builder(NodeKind.SEPARATOR))
                .build();

        SnapshotResult result = builder.build("w1", root);

        assertEquals("- window \"Editor\" [ref=w1e1]\n", result.text());
        assertEquals(1, registry.scopeSize("w1"));
    }

    @Test
    void namedSeparator_isEmitted() {
        StaticNode root = StaticNode.builder(NodeKind.WINDOW).name("Editor")
                .child(StaticNode.builder(NodeKind.SEPARATOR).name("Divider"))
                .build();

        assertTrue(builder.build("w1", root).text().contains("  - separator \"Divider\" [ref=w1e2]"));
    }

    @Test
    void registeredTokens_resolveToTheirNodes() throws Exception {
        StaticNode root = calculator();

        SnapshotResult result = builder.build("w1", root);

        assertSame(root, registry.resolve(result.lines().get(0).ref()).orElseThrow());
        assertSame(root.children().get(0), registry.resolve("w1e2").orElseThrow());
    }

    @Test
    void rebuild_invalidatesPreviousTokensAndIsDeterministic() {
        StaticNode root = calculator();
        SnapshotResult first = builder.build("w1", root);
        registry.register("w1", StaticNode.of(NodeKind.TEXT, "extra"));

        SnapshotResult second = builder.build("w1", root);

        assertEquals(first.text(), second.text());
        assertTrue(registry.resolve("w1e3").isEmpty());
        assertEquals(2, registry.scopeSize("w1"));
    }

    @Test
    void otherScopes_surviveRebuild() {
        builder.build("w2", calculator());

        builder.build("w1", calculator());

        assertEquals(2, registry.scopeSize("w2"));
        assertEquals(4, registry.count());
    }

    @Test
    void states_areAppendedToLines() {
        StaticNode root = StaticNode.builder(NodeKind.WINDOW).name("Prefs")
                .child(StaticNode.builder(NodeKind.CHECK_BOX).name("Wrap").toggle(ToggleState.ON).enabled(false))
                .build();

        String text = builder.build("w1", root).text();

        assertTrue(text.contains("  - checkbox \"Wrap\" [ref=w1e2] [disabled] [checked]\n"));
    }

    @Test
    void longNames_areTruncatedBeforeEscaping() {
        StaticNode root = StaticNode.builder(NodeKind.TEXT).name("abcdefghij\"klm").build();
        SnapshotOptions options = SnapshotOptions.builder().nameMaxLength(8).build();

        assertEquals("- text \"abcde...\" [ref=w1e1]\n", builder.build("w1", root, options).text());
    }

    @Test
    void nameLimitShorterThanEllipsis_staysWithinLimit() {
        StaticNode root = StaticNode.builder(NodeKind.BUTTON).name("Submit").build();
        SnapshotOptions options = SnapshotOptions.builder().nameMaxLength(2).build();

        assertEquals("- button \"Su\" [ref=w1e1]\n", builder.build("w1", root, options).text());
    }

    @Test
    void namesWithQuotesAndNewlines_areEscaped() {
        StaticNode root = StaticNode.builder(NodeKind.TEXT).name("line \"one\"\r\nline two").build();

        assertEquals("- text \"line \\\"one\\\"\\nline two\" [ref=w1e1]\n", builder.build("w1", root).text());
    }

    @Test
    void automationIdFallback_isUsedAsName() {
        StaticNode root = StaticNode.builder(NodeKind.EDIT).automationId("txtQuery").build();

        assertEquals("- textbox \"[txtQuery]\" [ref=w1e1]\n", builder.build("w1", root).text());
    }

    @Test
    void invalidArguments_areRejected() {
        StaticNode root = calculator();

        assertThrows(IllegalArgumentException.class, () -> builder.build(" ", root));
        assertThrows(IllegalArgumentException.class, () -> builder.build("w1", null));
        assertThrows(IllegalArgumentException.class, () -> builder.build("w1", root, null));
    }

    @Nested
    class DepthHandling {

        @Test
        void filterSkippedNode_keepsItsDepthForChildren() {
            StaticNode root = StaticNode.builder(NodeKind.WINDOW).name("App")
                    .child(StaticNode.builder(NodeKind.PANE).name("Body")
                            .child(StaticNode.builder(NodeKind.BUTTON).name("Go")))
                    .build();
            SnapshotOptions options = SnapshotOptions.builder().filter(SnapshotFilter.INTERACTIVE).build();

            SnapshotResult result = builder.build("w1", root, options);

            assertEquals("- button \"Go\" [ref=w1e1]\n", result.text());
            assertEquals(0, result.lines().get(0).depth());
        }

        @Test
        void noiseSkippedNode_addsOneLevelForChildren() {
            StaticNode root = StaticNode.builder(NodeKind.WINDOW).name("App")
                    .child(StaticNode.builder(NodeKind.SCROLL_BAR)
                            .child(StaticNode.builder(NodeKind.BUTTON).name("Line down")))
                    .build();

            SnapshotResult result = builder.build("w1", root);

            assertEquals("- window \"App\" [ref=w1e1]\n    - button \"Line down\" [ref=w1e2]\n", result.text());
        }

        @Test
        void unnamedContainer_isStillEmitted() {
            StaticNode root = StaticNode.builder(NodeKind.PANE)
                    .child(StaticNode.builder(NodeKind.BUTTON).name("OK"))
                    .build();

            assertEquals("- group [ref=w1e1]\n  - button \"OK\" [ref=w1e2]\n", builder.build("w1", root).text());
        }

        @Test
        void nodesBeyondMaxDepth_areNotEmitted() {
            StaticNode root = StaticNode.builder(NodeKind.WINDOW).name("L0")
                    .child(StaticNode.builder(NodeKind.GROUP).name("L1")
                            .child(StaticNode.builder(NodeKind.GROUP).name("L2")
                                    .child(StaticNode.builder(NodeKind.BUTTON).name("L3"))))
                    .build();
            SnapshotOptions options = SnapshotOptions.builder().maxDepth(1).build();

            SnapshotResult result = builder.build("w1", root, options);

            assertEquals(2, result.elementCount());
            assertFalse(result.truncated());
            assertFalse(result.text().contains("L2"));
        }
    }

    @Nested
    class Capacity {

        @Test
        void cap_limitsLinesAndFlagsTruncation() {
            StaticNode root = buttons(NodeKind.WINDOW, 10).build();
            SnapshotOptions options = SnapshotOptions.builder().maxElements(4).build();

            SnapshotResult result = builder.build("w1", root, options);

            assertEquals(4, result.elementCount());
            assertEquals(4, result.text().lines().count());
            assertTrue(result.truncated());
            assertEquals(4, registry.scopeSize("w1"));
        }

        @Test
        void treeExactlyAtCap_isNotTruncated() {
            StaticNode root = buttons(NodeKind.WINDOW, 3).build();
            SnapshotOptions options = SnapshotOptions.builder().maxElements(4).build();

            SnapshotResult result = builder.build("w1", root, options);

            assertEquals(4, result.elementCount());
            assertFalse(result.truncated());
        }

        @Test
        void cap_isGlobalAcrossBranches() {
            StaticNode root = StaticNode.builder(NodeKind.WINDOW).name("App")
                    .child(buttons(NodeKind.GROUP, 3))
                    .child(buttons(NodeKind.GROUP, 3))
                    .build();
            SnapshotOptions options = SnapshotOptions.builder().maxElements(5).build();

            SnapshotResult result = builder.build("w1", root, options);

            List<String> names = result.lines().stream().map(SnapshotLine::name).collect(Collectors.toList());
            assertEquals(List.of("App", "Container", "B1", "B2", "B3"), names);
            assertTrue(result.truncated());
        }
    }

    @Nested
    class FilterMonotonicity {

        @Test
        void interactiveLines_areSubsetOfAllLines() {
            StaticNode root = StaticNode.builder(NodeKind.WINDOW).name("Form")
                    .child(StaticNode.builder(NodeKind.TEXT).name("Label"))
                    .child(StaticNode.builder(NodeKind.EDIT).name("Field"))
                    .child(StaticNode.builder(NodeKind.GROUP).name("Actions")
                            .child(StaticNode.builder(NodeKind.BUTTON).name("Save"))
                            .child(StaticNode.builder(NodeKind.HYPERLINK).name("Help")))
                    .build();

            List<String> all = signatures(builder.build("w1", root));
            List<String> interactive = signatures(builder.build("w1", root,
                    SnapshotOptions.builder().filter(SnapshotFilter.INTERACTIVE).build()));

            assertEquals(List.of("textbox Field", "button Save", "link Help"), interactive);
            assertTrue(all.containsAll(interactive));
        }

        private List<String> signatures(SnapshotResult result) {
            return result.lines().stream()
                    .map(line -> line.role().tag() + " " + line.name())
                    .collect(Collectors.toList());
        }
    }

    @Nested
    class Resilience {

        @Test
        void failingChildEnumeration_rendersLeafAndContinuesWithSiblings() {
            StaticNode root = StaticNode.builder(NodeKind.WINDOW).name("App")
                    .child(StaticNode.builder(NodeKind.LIST).name("Broken").failChildren())
                    .child(StaticNode.builder(NodeKind.BUTTON).name("Next"))
                    .build();

            SnapshotResult result = builder.build("w1", root);

            assertEquals("- window \"App\" [ref=w1e1]\n"
                    + "  - list \"Broken\" [ref=w1e2]\n"
                    + "  - button \"Next\" [ref=w1e3]\n", result.text());
        }

        @Test
        void throwingNode_isRenderedAsUnnamedElementAndSkipped() {
            StaticNode root = StaticNode.builder(NodeKind.WINDOW).name("App")
                    .child(StaticNode.builder(NodeKind.BUTTON).name("Ghost").throwOnRead()
                            .child(StaticNode.builder(NodeKind.BUTTON).name("Inner")))
                    .build();

            SnapshotResult result = builder.build("w1", root);

            assertEquals("- window \"App\" [ref=w1e1]\n    - button \"Inner\" [ref=w1e2]\n", result.text());
        }

        @Test
        void rootEnumerationFailure_yieldsSingleLine() {
            AutomationNode root = StaticNode.builder(NodeKind.WINDOW).name("Frozen").failChildren().build();

            SnapshotResult result = builder.build("w1", root);

            assertEquals(1, result.elementCount());
            assertFalse(result.truncated());
        }

        @Test
        void nullChildEntry_isSkippedAndSiblingsStillRendered() {
            StaticNode root = StaticNode.builder(NodeKind.WINDOW).name("App")
                    .missingChild()
                    .child(StaticNode.builder(NodeKind.BUTTON).name("Ok"))
                    .child(StaticNode.builder(NodeKind.GROUP).name("Tail")
                            .missingChild())
                    .build();

            SnapshotResult result = builder.build("w1", root);

            assertEquals("- window \"App\" [ref=w1e1]\n"
                    + "  - button \"Ok\" [ref=w1e2]\n"
                    + "  - group \"Tail\" [ref=w1e3]\n", result.text());
            assertFalse(result.truncated());
        }
    }
}
