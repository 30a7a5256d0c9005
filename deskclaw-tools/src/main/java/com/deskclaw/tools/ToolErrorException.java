package com.deskclaw.tools;

/**
 * Carries a {@link ToolError} out of helper code to the tool that reports it.
 */
public class ToolErrorException extends RuntimeException {

    private final ToolError error;

    public ToolErrorException(ToolError error) {
        super(error.getMessage());
        this.error = error;
    }

    public ToolError getError() {
        return error;
    }
}
