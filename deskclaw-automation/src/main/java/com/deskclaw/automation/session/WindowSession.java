package com.deskclaw.automation.session;

import com.deskclaw.automation.node.AutomationDesktop;
import com.deskclaw.automation.node.AutomationNode;
import com.deskclaw.automation.node.NodeKind;
import com.deskclaw.automation.node.NodeUnavailableException;
import com.deskclaw.automation.node.Readout;
import com.deskclaw.automation.query.NodeWalker;
import com.deskclaw.automation.snapshot.ElementRef;
import com.deskclaw.automation.snapshot.ElementRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Tracks the windows an agent has seen and the element tokens issued for them.
 * <p>
 * Window handles are {@code w1}, {@code w2}, ... and double as the registry scope
 * for that window's element tokens. Launching, focusing and closing windows is left
 * to the driver; the session only names them.
 */
@Slf4j
public class WindowSession {

    /** Parent hops allowed when looking for the window that owns an element. */
    static final int MAX_PARENT_HOPS = 64;

    private final AutomationDesktop desktop;
    private final ElementRegistry registry;
    private final Function<Integer, String> processNameResolver;
    private final Map<String, AutomationNode> windows = new LinkedHashMap<>();
    private int windowCounter;

    public WindowSession(AutomationDesktop desktop) {
        this(desktop, new ElementRegistry(), ProcessNames::nameOf);
    }

    public WindowSession(AutomationDesktop desktop, ElementRegistry registry,
                         Function<Integer, String> processNameResolver) {
        this.desktop = desktop;
        this.registry = registry;
        this.processNameResolver = processNameResolver;
    }

    public AutomationDesktop getDesktop() {
        return desktop;
    }

    public ElementRegistry getRegistry() {
        return registry;
    }

    /**
     * Give a window a new handle, even if it already has one.
     */
    public synchronized String registerWindow(AutomationNode window) {
        String handle = "w" + (++windowCounter);
        windows.put(handle, window);
        log.info("Registered window {} as {}", Readout.guard(window::name).orElse("(untitled)"), handle);
        return handle;
    }

    /**
     * Existing handle of a window, or a new one. Returns null for a null window.
     */
    public synchronized String getOrCreateHandle(AutomationNode window) {
        if (window == null) {
            return null;
        }
        for (Map.Entry<String, AutomationNode> entry : windows.entrySet()) {
            if (entry.getValue().equals(window)) {
                return entry.getKey();
            }
        }
        return registerWindow(window);
    }

    public synchronized Optional<AutomationNode> getWindow(String handle) {
        return handle == null ? Optional.empty() : Optional.ofNullable(windows.get(handle));
    }

    /**
     * Drop a window handle together with every element token issued under it.
     */
    public synchronized boolean forget(String handle) {
        if (handle == null || windows.remove(handle) == null) {
            return false;
        }
        registry.clear(handle);
        log.info("Forgot window {}", handle);
        return true;
    }

    /**
     * Titled top-level windows, each with its session handle.
     */
    public List<ListedWindow> listWindows() throws NodeUnavailableException {
        List<ListedWindow> result = new ArrayList<>();
        for (AutomationNode window : desktop.topLevelWindows()) {
            String title = Readout.guard(window::name).orElse("");
            if (title.isEmpty()) {
                continue;
            }
            String handle = getOrCreateHandle(window);
            result.add(new ListedWindow(handle, title, processNameOf(window)));
        }
        return result;
    }

    public String processNameOf(AutomationNode node) {
        Integer pid = Readout.guard(node::processId).orElse(null);
        if (pid == null) {
            return null;
        }
        try {
            return processNameResolver.apply(pid);
        } catch (RuntimeException e) {
            log.debug("Process name unavailable for pid {}: {}", pid, e.getMessage());
            return null;
        }
    }

    public Optional<AutomationNode> focusedElement() {
        return Readout.guard(desktop::focusedElement).toOptional();
    }

    /**
     * Window that contains the focused element.
     */
    public Optional<AutomationNode> focusedWindow() {
        return focusedElement().flatMap(WindowSession::owningWindow);
    }

    /**
     * Nearest ancestor-or-self of kind {@link NodeKind#WINDOW}.
     */
    public static Optional<AutomationNode> owningWindow(AutomationNode node) {
        AutomationNode current = node;
        for (int hops = 0; current != null && hops <= MAX_PARENT_HOPS; hops++) {
            if (NodeWalker.isKind(current, NodeKind.WINDOW)) {
                return Optional.of(current);
            }
            current = Readout.guard(current::parent).orElse(null);
        }
        return Optional.empty();
    }

    /**
     * Resolve a reference as an agent wrote it ({@code w1e4}, {@code @w1e4},
     * {@code [ref=w1e4]}).
     */
    public Optional<AutomationNode> resolve(String ref) {
        String token = ElementRef.parse(ref);
        return token == null ? Optional.empty() : registry.resolve(token);
    }

    public synchronized int activeWindowCount() {
        return windows.size();
    }

    public int registeredElementCount() {
        return registry.count();
    }
}
