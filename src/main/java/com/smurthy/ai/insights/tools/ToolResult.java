package com.smurthy.ai.insights.tools;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.smurthy.ai.insights.exception.ErrorKind;
import com.smurthy.ai.insights.exception.InsightsException;

/**
 * Uniform tool response: either data with a skipped-row count, or a typed error with a remediation hint.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolResult(
        String tool,
        boolean success,
        Object data,
        Integer skippedRows,
        ErrorKind errorKind,
        String message,
        String remediation
) {

    public static ToolResult success(String tool, Object data, int skippedRows) {
        return new ToolResult(tool, true, data, skippedRows, null, null, null);
    }

    public static ToolResult error(String tool, InsightsException e) {
        return new ToolResult(tool, false, null, null, e.kind(), e.getMessage(), e.remediation());
    }

    public static ToolResult error(String tool, ErrorKind kind, String message) {
        return new ToolResult(tool, false, null, null, kind, message, kind.defaultRemediation());
    }
}
