package com.deskclaw.automation.node;

/**
 * Thrown when the automation driver cannot enumerate or reach a node, typically
 * because the element disappeared between two calls.
 */
public class NodeUnavailableException extends Exception {

    public NodeUnavailableException(String message) {
        super(message);
    }

    public NodeUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
