package com.deskclaw.tools;

import com.deskclaw.automation.session.WindowSession;
import com.deskclaw.common.config.ConfigService;
import com.deskclaw.common.config.DeskClawConfig;
import com.deskclaw.tools.builtin.FindTool;
import com.deskclaw.tools.builtin.GetTextTool;
import com.deskclaw.tools.builtin.ListWindowsTool;
import com.deskclaw.tools.builtin.PeekTool;
import com.deskclaw.tools.builtin.ReadTool;
import com.deskclaw.tools.builtin.SnapshotTool;
import com.deskclaw.tools.builtin.StatusTool;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Factory for assembling the desktop tools around one {@link WindowSession}.
 */
@Slf4j
public class DesktopToolFactory {

    @Data
    @Builder
    public static class DesktopToolOptions {
        private WindowSession session;
        /** Optional; missing sections fall back to defaults. */
        private DeskClawConfig config;
        @Builder.Default
        private Clock clock = Clock.systemUTC();
    }

    public static List<DesktopTool> createTools(DesktopToolOptions options) {
        if (options.getSession() == null) {
            throw new IllegalArgumentException("session is required");
        }
        WindowSession session = options.getSession();
        ToolLimits.ResolvedLimits limits = ToolLimits.resolve(options.getConfig());

        List<DesktopTool> tools = new ArrayList<>();
        tools.add(new StatusTool(session, limits.getStatus(), options.getClock()));
        tools.add(new FindTool(session, limits.getFind()));
        tools.add(new ReadTool(session, limits.getRead()));
        tools.add(new PeekTool(session, limits.getPeek()));
        tools.add(new SnapshotTool(session, limits.getSnapshot()));
        tools.add(new ListWindowsTool(session));
        tools.add(new GetTextTool(session));

        log.info("Assembled {} desktop tools", tools.size());
        return Collections.unmodifiableList(tools);
    }

    public static ToolRegistry createRegistry(DesktopToolOptions options) {
        ToolRegistry registry = new ToolRegistry();
        registry.registerAll(createTools(options));
        return registry;
    }

    /**
     * Registry whose limits come from the given config service. The config is
     * read once, when the tools are built.
     */
    public static ToolRegistry createRegistry(WindowSession session, ConfigService configService) {
        return createRegistry(DesktopToolOptions.builder()
                .session(session)
                .config(configService.loadConfig())
                .build());
    }
}
