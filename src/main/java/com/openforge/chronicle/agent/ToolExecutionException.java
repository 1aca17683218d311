package com.openforge.chronicle.agent;

/**
 * A tool call could not be carried out: unknown tool name or malformed arguments.
 * The tool-call loop turns it into a {@code [ToolError]} result instead of aborting.
 */
public class ToolExecutionException extends RuntimeException {

    private final String toolName;

    public ToolExecutionException(String toolName, String message) {
        super(message);
        this.toolName = toolName;
    }

    public ToolExecutionException(String toolName, String message, Throwable cause) {
        super(message, cause);
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
