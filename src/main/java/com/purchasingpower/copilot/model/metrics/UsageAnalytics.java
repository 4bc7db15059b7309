package com.purchasingpower.copilot.model.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Point-in-time copy of the usage counters.
 * Used for the analytics payload.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageAnalytics {

    @JsonProperty("total_queries")
    private long totalQueries;

    @JsonProperty("successful_queries")
    private long successfulQueries;

    @JsonProperty("failed_queries")
    private long failedQueries;

    /**
     * Mean processing time in seconds over all recorded queries, 0 when none
     */
    @JsonProperty("average_response_time")
    private double averageResponseTime;

    /**
     * Tool id to number of queries that attempted it
     */
    @JsonProperty("most_used_tools")
    private Map<String, Long> mostUsedTools;

    /**
     * Category wire value to query count
     */
    @JsonProperty("query_categories")
    private Map<String, Long> queryCategories;
}
