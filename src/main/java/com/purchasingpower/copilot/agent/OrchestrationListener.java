package com.purchasingpower.copilot.agent;

import com.purchasingpower.copilot.model.dto.OrchestrationResult;
import com.purchasingpower.copilot.query.QueryCategory;

/**
 * Progress callbacks for one orchestrated query.
 *
 * <p>Tool callbacks arrive on executor threads and may interleave across tools. Implementations
 * must not throw; a failing callback fails the query.
 */
public interface OrchestrationListener {

    OrchestrationListener NOOP = new OrchestrationListener() {
    };

    default void onStarted(String question, QueryCategory category) {
    }

    default void onToolStarted(String toolId) {
    }

    default void onToolFinished(ToolInvocationResult result) {
    }

    default void onCompleted(OrchestrationResult result) {
    }

    default void onFailed(RuntimeException failure) {
    }
}
