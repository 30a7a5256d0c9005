package com.deskclaw.tools;

/**
 * Error codes carried by {@link ToolError}.
 * FW1xxx are window and element errors, FW3xxx session errors.
 */
public final class ErrorCodes {

    private ErrorCodes() {
    }

    public static final String WINDOW_NOT_FOUND = "FW1001";
    public static final String ELEMENT_SEARCH_FAILED = "FW1002";
    public static final String ELEMENT_NOT_FOUND = "FW1003";
    public static final String ELEMENT_NOT_INTERACTABLE = "FW1004";
    public static final String TIMEOUT = "FW1005";

    public static final String SESSION_NOT_INITIALIZED = "FW3001";
    public static final String SESSION_EXPIRED = "FW3002";
}
