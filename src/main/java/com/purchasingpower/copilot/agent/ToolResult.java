package com.purchasingpower.copilot.agent;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Output of one source call.
 *
 * <p>Plain-text sources only set {@code text}. The knowledge base also returns the passages it
 * answered from, their sources, its best retrieval score and an explicit {@code informative}
 * verdict. When {@code informative} is {@code null} the orchestrator judges the text itself.
 */
@Value
@Builder
public class ToolResult {

    String text;

    @Singular("contextPassage")
    List<String> context;

    @Singular
    List<String> sources;

    Double retrievalScore;

    Boolean informative;

    public static ToolResult of(String text) {
        return ToolResult.builder().text(text).build();
    }
}
