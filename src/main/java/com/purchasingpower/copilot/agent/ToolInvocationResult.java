package com.purchasingpower.copilot.agent;

import lombok.Value;

/**
 * Outcome of one attempted tool within a query.
 *
 * <p>Only results that both succeeded and are informative take part in fusion. A failed
 * invocation keeps the failure reason in {@code outputText}.
 */
@Value
public class ToolInvocationResult {

    String toolId;
    String label;
    boolean succeeded;
    String outputText;
    boolean informative;

    public static ToolInvocationResult success(String toolId, String label, String outputText, boolean informative) {
        return new ToolInvocationResult(toolId, label, true, outputText, informative);
    }

    public static ToolInvocationResult failure(String toolId, String label, String reason) {
        return new ToolInvocationResult(toolId, label, false, reason, false);
    }

    public boolean isUsable() {
        return succeeded && informative;
    }
}
