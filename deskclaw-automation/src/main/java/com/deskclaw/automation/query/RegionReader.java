package com.deskclaw.automation.query;

import com.deskclaw.automation.node.AutomationNode;
import com.deskclaw.automation.node.NodeKind;
import com.deskclaw.automation.node.Readout;
import com.deskclaw.automation.snapshot.ClassifiedNode;
import com.deskclaw.automation.snapshot.ElementRegistry;
import com.deskclaw.automation.snapshot.NodeClassifier;
import com.deskclaw.automation.snapshot.Role;
import com.deskclaw.automation.snapshot.StateInspector;
import com.deskclaw.automation.snapshot.StateTag;
import com.deskclaw.common.config.AutomationDefaults;
import com.deskclaw.common.text.TextTruncation;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reads one region of a window (menu bar, status bar, dialog...) without walking
 * the rest of it. Like element search, reading does not clear the window's tokens.
 */
@Slf4j
public class RegionReader {

    private static final Set<Role> SIGNIFICANT_ROLES = EnumSet.of(
            Role.BUTTON, Role.TEXTBOX, Role.CHECKBOX, Role.RADIO, Role.COMBOBOX,
            Role.LISTITEM, Role.MENUITEM, Role.TAB, Role.LINK, Role.MENU, Role.MENUBAR,
            Role.TOOLBAR, Role.LIST, Role.GROUP, Role.WINDOW);

    private final ElementRegistry registry;
    private final int maxElements;
    private final int nameMaxLength;
    private final int locateBudget;

    public RegionReader(ElementRegistry registry) {
        this(registry, AutomationDefaults.READ_MAX_ELEMENTS, AutomationDefaults.READ_NAME_MAX_LENGTH);
    }

    public RegionReader(ElementRegistry registry, int maxElements, int nameMaxLength) {
        this.registry = registry;
        this.maxElements = maxElements;
        this.nameMaxLength = nameMaxLength;
        this.locateBudget = AutomationDefaults.FIND_MAX_SEARCH;
    }

    /**
     * @param window  window the region belongs to
     * @param focused currently focused element, used by {@link Region#FOCUSED}; may be null
     * @param depth   levels below the region root to include
     */
    public ReadResult read(String scope, AutomationNode window, AutomationNode focused, Region region, int depth) {
        if (region == null) {
            throw new IllegalArgumentException("region is required");
        }
        Optional<AutomationNode> regionRoot = locate(window, focused, region);
        if (regionRoot.isEmpty()) {
            return ReadResult.notFound(region.value());
        }

        List<ReadResult.Element> elements = new ArrayList<>();
        walk(scope, regionRoot.get(), elements, 0, Math.max(0, depth));
        return ReadResult.builder()
                .region(region.value())
                .found(true)
                .elementCount(elements.size())
                .elements(elements)
                .build();
    }

    Optional<AutomationNode> locate(AutomationNode window, AutomationNode focused, Region region) {
        return switch (region) {
            case FOCUSED -> Optional.ofNullable(focused);
            case MENU -> NodeWalker.findFirstDescendant(window, NodeKind.MENU_BAR, locateBudget);
            case STATUS -> NodeWalker.findFirstDescendant(window, NodeKind.STATUS_BAR, locateBudget);
            case TITLEBAR -> NodeWalker.findFirstDescendant(window, NodeKind.TITLE_BAR, locateBudget);
            case TOOLBAR -> NodeWalker.findFirstDescendant(window, NodeKind.TOOL_BAR, locateBudget);
            case DIALOG -> locateDialog(window);
        };
    }

    /**
     * A nested window if there is one, otherwise the first pane that holds both a
     * button and a text label.
     */
    private Optional<AutomationNode> locateDialog(AutomationNode window) {
        Optional<AutomationNode> childWindow = NodeWalker.findFirstDescendant(window, NodeKind.WINDOW, locateBudget);
        if (childWindow.isPresent()) {
            return childWindow;
        }
        return NodeWalker.findFirstDescendant(window, node -> NodeWalker.isKind(node, NodeKind.PANE)
                && NodeWalker.findFirstDescendant(node, NodeKind.BUTTON, locateBudget).isPresent()
                && NodeWalker.findFirstDescendant(node, NodeKind.TEXT, locateBudget).isPresent(), locateBudget);
    }

    private void walk(String scope, AutomationNode node, List<ReadResult.Element> elements,
                      int currentDepth, int maxDepth) {
        if (elements.size() >= maxElements || currentDepth > maxDepth) {
            return;
        }

        ClassifiedNode classified = NodeClassifier.classify(node);
        if (classified.hasName() || SIGNIFICANT_ROLES.contains(classified.role())) {
            List<String> states = new ArrayList<>();
            for (StateTag tag : StateInspector.inspect(node)) {
                states.add(tag.tag());
            }
            elements.add(ReadResult.Element.builder()
                    .ref(registry.register(scope, node))
                    .role(classified.role().tag())
                    .name(TextTruncation.truncate(classified.name(), nameMaxLength))
                    .depth(currentDepth)
                    .enabled(Readout.guard(node::isEnabled).orElse(false))
                    .states(states)
                    .build());
        }

        for (AutomationNode child : NodeWalker.childrenOf(node)) {
            if (elements.size() >= maxElements) {
                log.debug("Region read in {} stopped at {} elements", scope, maxElements);
                return;
            }
            walk(scope, child, elements, currentDepth + 1, maxDepth);
        }
    }
}
