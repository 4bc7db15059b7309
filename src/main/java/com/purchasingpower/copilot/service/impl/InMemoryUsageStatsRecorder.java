package com.purchasingpower.copilot.service.impl;

import com.google.common.collect.ImmutableMap;
import com.purchasingpower.copilot.model.metrics.UsageAnalytics;
import com.purchasingpower.copilot.query.QueryCategory;
import com.purchasingpower.copilot.service.UsageStatsRecorder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Process-local implementation of UsageStatsRecorder.
 *
 * All state is guarded by the instance monitor. Samples are kept individually and the mean is
 * recomputed in decimal on every read, so it matches the exact arithmetic mean of the recorded
 * values.
 */
@Slf4j
@Service
public class InMemoryUsageStatsRecorder implements UsageStatsRecorder {

    private long totalQueries;
    private long successfulQueries;
    private long failedQueries;
    private final Map<String, Long> categoryCounts = new LinkedHashMap<>();
    private final Map<String, Long> toolCounts = new LinkedHashMap<>();
    private final List<Double> responseTimes = new ArrayList<>();

    @Override
    public synchronized void recordQuery(QueryCategory category, boolean succeeded, double elapsedSeconds) {
        totalQueries++;
        if (succeeded) {
            successfulQueries++;
        } else {
            failedQueries++;
        }
        categoryCounts.merge(category.getValue(), 1L, Long::sum);
        responseTimes.add(elapsedSeconds);

        log.debug("Recorded {} query ({}, {}s), total {}",
                succeeded ? "successful" : "failed", category, elapsedSeconds, totalQueries);
    }

    @Override
    public synchronized void recordToolUsage(String toolId) {
        toolCounts.merge(toolId, 1L, Long::sum);
    }

    @Override
    public synchronized double averageResponseTime() {
        if (responseTimes.isEmpty()) {
            return 0.0;
        }
        BigDecimal sum = BigDecimal.ZERO;
        for (Double sample : responseTimes) {
            sum = sum.add(BigDecimal.valueOf(sample));
        }
        return sum.divide(BigDecimal.valueOf(responseTimes.size()), MathContext.DECIMAL64).doubleValue();
    }

    @Override
    public synchronized UsageAnalytics snapshot() {
        return UsageAnalytics.builder()
                .totalQueries(totalQueries)
                .successfulQueries(successfulQueries)
                .failedQueries(failedQueries)
                .averageResponseTime(averageResponseTime())
                .mostUsedTools(ImmutableMap.copyOf(toolCounts))
                .queryCategories(ImmutableMap.copyOf(categoryCounts))
                .build();
    }

    @Override
    public synchronized void reset() {
        totalQueries = 0;
        successfulQueries = 0;
        failedQueries = 0;
        categoryCounts.clear();
        toolCounts.clear();
        responseTimes.clear();
        log.info("Usage stats reset");
    }
}
