package com.purchasingpower.copilot.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.purchasingpower.copilot.agent.ToolInvocationResult;
import com.purchasingpower.copilot.query.QueryCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Answer to one orchestrated question.
 *
 * <p>{@code toolsAttempted} lists every source that was called, including those that failed or
 * contributed nothing. The per-tool outcomes stay available in {@code toolResults} but are not
 * part of the wire payload.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrchestrationResult {

    private String question;

    @JsonProperty("response")
    private String responseText;

    @JsonProperty("context")
    private List<String> contextSnippets;

    @JsonProperty("tools_used")
    private List<String> toolsAttempted;

    /**
     * 0.0-1.0, the knowledge base retrieval score when it reported one.
     */
    private double confidence;

    private QueryCategory category;

    @JsonProperty("processing_time")
    private double processingTimeSeconds;

    @JsonIgnore
    private List<ToolInvocationResult> toolResults;
}
