package com.deskclaw.automation.session;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Resolves process ids to short executable names ({@code notepad}, {@code calc}).
 */
public final class ProcessNames {

    private ProcessNames() {
    }

    public static String nameOf(Integer pid) {
        if (pid == null || pid <= 0) {
            return null;
        }
        Optional<ProcessHandle> handle;
        try {
            handle = ProcessHandle.of(pid);
        } catch (SecurityException | UnsupportedOperationException e) {
            return null;
        }
        return handle.flatMap(h -> h.info().command())
                .map(ProcessNames::executableName)
                .orElse(null);
    }

    static String executableName(String command) {
        Path fileName = Path.of(command.replace('\\', '/')).getFileName();
        String name = fileName != null ? fileName.toString() : command;
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
