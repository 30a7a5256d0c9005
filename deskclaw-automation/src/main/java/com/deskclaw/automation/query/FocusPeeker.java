package com.deskclaw.automation.query;

import com.deskclaw.automation.node.AutomationNode;
import com.deskclaw.automation.node.Readout;
import com.deskclaw.automation.snapshot.ElementRegistry;
import com.deskclaw.automation.snapshot.NodeClassifier;
import com.deskclaw.common.config.AutomationDefaults;
import com.deskclaw.common.text.TextTruncation;

import java.util.ArrayList;
import java.util.List;

/**
 * Cheap look around the focused element: the element itself plus a few siblings.
 */
public class FocusPeeker {

    private final ElementRegistry registry;
    private final int nameMaxLength;

    public FocusPeeker(ElementRegistry registry) {
        this(registry, AutomationDefaults.PEEK_NAME_MAX_LENGTH);
    }

    public FocusPeeker(ElementRegistry registry, int nameMaxLength) {
        this.registry = registry;
        this.nameMaxLength = nameMaxLength;
    }

    /**
     * @param scope window handle to register refs under; when null, refs are left empty
     */
    public PeekResult peek(String scope, AutomationNode focused, boolean includeSiblings, int maxSiblings) {
        if (focused == null) {
            throw new IllegalArgumentException("focused element is required");
        }
        List<PeekResult.PeekElement> children = new ArrayList<>();
        PeekResult.PeekElement self = describe(scope, focused);
        children.add(self);

        AutomationNode parent = Readout.guard(focused::parent).orElse(null);
        List<AutomationNode> siblings = parent != null ? NodeWalker.childrenOf(parent) : List.of();
        if (includeSiblings) {
            int added = 0;
            for (AutomationNode sibling : siblings) {
                if (sibling.equals(focused)) {
                    continue;
                }
                if (added >= maxSiblings) {
                    break;
                }
                children.add(describe(scope, sibling));
                added++;
            }
        }

        return PeekResult.builder()
                .ref(self.getRef())
                .role(self.getRole())
                .name(self.getName())
                .childCount(siblings.size())
                .children(children)
                .build();
    }

    private PeekResult.PeekElement describe(String scope, AutomationNode node) {
        String name = Readout.guard(node::name).orElse("");
        return PeekResult.PeekElement.builder()
                .ref(scope != null && !scope.isBlank() ? registry.register(scope, node) : "")
                .role(NodeClassifier.roleOf(node).tag())
                .name(TextTruncation.truncate(name, nameMaxLength))
                .enabled(Readout.guard(node::isEnabled).orElse(false))
                .build();
    }
}
