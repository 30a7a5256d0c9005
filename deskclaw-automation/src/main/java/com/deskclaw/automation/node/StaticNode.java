package com.deskclaw.automation.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * In-memory {@link AutomationNode} for replaying captured trees and for tests.
 * Nodes are immutable once built; the builder wires parent links.
 *
 * <p>This is a public test double: the engine never creates one, callers use it
 * to replay recorded trees or to exercise code built on {@link AutomationNode}
 * without a live desktop.</p>
 *
 * <p>Failure switches reproduce misbehaving drivers: {@code failChildren}
 * makes {@link #children()} throw, {@code throwOnRead} makes every property
 * accessor throw an unchecked exception instead of returning a readout, and
 * {@code missingChild} leaves a null entry in the child list.</p>
 */
public final class StaticNode implements AutomationNode {

    private final NodeKind kind;
    private final String name;
    private final String automationId;
    private final boolean enabled;
    private final boolean offscreen;
    private final boolean keyboardFocus;
    private final Integer processId;
    private final CapabilitySet capabilities;
    private final List<AutomationNode> children;
    private final boolean failChildren;
    private final boolean throwOnRead;
    private AutomationNode parent;

    private StaticNode(Builder builder) {
        this.kind = builder.kind;
        this.name = builder.name;
        this.automationId = builder.automationId;
        this.enabled = builder.enabled;
        this.offscreen = builder.offscreen;
        this.keyboardFocus = builder.keyboardFocus;
        this.processId = builder.processId;
        this.capabilities = builder.capabilities.build();
        this.failChildren = builder.failChildren;
        this.throwOnRead = builder.throwOnRead;
        List<AutomationNode> built = new ArrayList<>(builder.children.size());
        for (Builder child : builder.children) {
            if (child == null) {
                built.add(null);
                continue;
            }
            StaticNode node = child.build();
            node.parent = this;
            built.add(node);
        }
        this.children = Collections.unmodifiableList(built);
    }

    public static Builder builder(NodeKind kind) {
        return new Builder(kind);
    }

    public static StaticNode of(NodeKind kind, String name) {
        return builder(kind).name(name).build();
    }

    @Override
    public Readout<NodeKind> kind() {
        checkRead();
        return Readout.of(kind);
    }

    @Override
    public Readout<String> name() {
        checkRead();
        return Readout.of(name);
    }

    @Override
    public Readout<String> automationId() {
        checkRead();
        return Readout.of(automationId);
    }

    @Override
    public Readout<Boolean> isEnabled() {
        checkRead();
        return Readout.of(enabled);
    }

    @Override
    public Readout<Boolean> isOffscreen() {
        checkRead();
        return Readout.of(offscreen);
    }

    @Override
    public Readout<Boolean> hasKeyboardFocus() {
        checkRead();
        return Readout.of(keyboardFocus);
    }

    @Override
    public Readout<Integer> processId() {
        checkRead();
        return Readout.of(processId);
    }

    @Override
    public Readout<CapabilitySet> capabilities() {
        checkRead();
        return Readout.of(capabilities);
    }

    @Override
    public Readout<AutomationNode> parent() {
        return Readout.of(parent);
    }

    @Override
    public List<AutomationNode> children() throws NodeUnavailableException {
        if (failChildren) {
            throw new NodeUnavailableException("children of " + kind + " are not available");
        }
        return children;
    }

    private void checkRead() {
        if (throwOnRead) {
            throw new IllegalStateException("element is no longer available");
        }
    }

    @Override
    public String toString() {
        return "StaticNode{" + kind + (name != null ? " \"" + name + "\"" : "") + "}";
    }

    public static final class Builder {
        private final NodeKind kind;
        private String name;
        private String automationId;
        private boolean enabled = true;
        private boolean offscreen;
        private boolean keyboardFocus;
        private Integer processId;
        private final CapabilitySet.CapabilitySetBuilder capabilities = CapabilitySet.builder();
        private final List<Builder> children = new ArrayList<>();
        private boolean failChildren;
        private boolean throwOnRead;

        private Builder(NodeKind kind) {
            this.kind = kind;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder automationId(String automationId) {
            this.automationId = automationId;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder offscreen(boolean offscreen) {
            this.offscreen = offscreen;
            return this;
        }

        public Builder keyboardFocus(boolean keyboardFocus) {
            this.keyboardFocus = keyboardFocus;
            return this;
        }

        public Builder processId(Integer processId) {
            this.processId = processId;
            return this;
        }

        public Builder value(String value, boolean readOnly) {
            capabilities.value(ValueCapability.of(value, readOnly));
            return this;
        }

        public Builder value(ValueCapability value) {
            capabilities.value(value);
            return this;
        }

        public Builder toggle(ToggleState state) {
            capabilities.toggle(() -> Readout.of(state));
            return this;
        }

        public Builder toggle(ToggleCapability toggle) {
            capabilities.toggle(toggle);
            return this;
        }

        public Builder selected(boolean selected) {
            capabilities.selectionItem(() -> Readout.of(selected));
            return this;
        }

        public Builder expandCollapse(ExpandCollapseState state) {
            capabilities.expandCollapse(() -> Readout.of(state));
            return this;
        }

        public Builder child(Builder child) {
            children.add(child);
            return this;
        }

        public Builder children(Builder... more) {
            Collections.addAll(children, more);
            return this;
        }

        /**
         * Append a null entry to the child list, as some drivers report for
         * elements that vanished during enumeration.
         */
        public Builder missingChild() {
            children.add(null);
            return this;
        }

        public Builder failChildren() {
            this.failChildren = true;
            return this;
        }

        public Builder throwOnRead() {
            this.throwOnRead = true;
            return this;
        }

        public StaticNode build() {
            return new StaticNode(this);
        }
    }
}
