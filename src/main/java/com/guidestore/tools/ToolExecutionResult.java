package com.guidestore.tools;

/**
 * JSON output of a tool run. On failure {@code error} holds the error code
 * and {@code output} the structured error body.
 */
public class ToolExecutionResult {
    private final String output;
    private final boolean ok;
    private final String error;

    public ToolExecutionResult(String output, boolean ok, String error) {
        this.output = output;
        this.ok = ok;
        this.error = error;
    }

    public static ToolExecutionResult ok(String output) {
        return new ToolExecutionResult(output, true, null);
    }

    public static ToolExecutionResult error(String output, String error) {
        return new ToolExecutionResult(output, false, error);
    }

    public String getOutput() {
        return output;
    }

    public boolean isOk() {
        return ok;
    }

    public String getError() {
        return error;
    }
}
