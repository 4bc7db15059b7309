package com.purchasingpower.copilot.service;

import com.purchasingpower.copilot.model.metrics.UsageAnalytics;
import com.purchasingpower.copilot.query.QueryCategory;

/**
 * Usage counters shared by all queries of the process.
 */
public interface UsageStatsRecorder {

    /**
     * Record one finished query, successful or not.
     */
    void recordQuery(QueryCategory category, boolean succeeded, double elapsedSeconds);

    /**
     * Record that a query attempted the given tool.
     */
    void recordToolUsage(String toolId);

    /**
     * Mean processing time in seconds, 0 when nothing was recorded.
     */
    double averageResponseTime();

    /**
     * Get a consistent copy of all counters.
     */
    UsageAnalytics snapshot();

    /**
     * Clear all counters and samples.
     */
    void reset();
}
