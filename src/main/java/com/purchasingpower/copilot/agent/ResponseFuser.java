package com.purchasingpower.copilot.agent;

import com.purchasingpower.copilot.agent.Tool.ToolCategory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Merges source outputs into one narrative.
 *
 * <p>Only succeeded, informative results are used. The knowledge base fragment goes first, the
 * others follow in invocation order; nothing is re-ranked or truncated. When no source produced
 * anything useful, a fixed fallback answer that repeats the question is returned.
 */
@Component
public class ResponseFuser {

    static final String INTRO = "Based on my analysis using multiple sources:";

    private static final String FALLBACK_TEMPLATE = "I understand you're asking about '%s'. "
            + "I've searched multiple sources including current information, academic research, market data, "
            + "and our knowledge base, but don't have specific information about this topic. "
            + "I can help you with general wealth management advice or try searching for different aspects of this topic.";

    public String fuse(String question, List<ToolInvocationResult> results) {
        List<ToolInvocationResult> ordered = new ArrayList<>();
        String knowledgeBaseId = ToolCategory.KNOWLEDGE_BASE.getToolId();

        results.stream()
                .filter(ToolInvocationResult::isUsable)
                .filter(result -> knowledgeBaseId.equals(result.getToolId()))
                .forEach(ordered::add);
        results.stream()
                .filter(ToolInvocationResult::isUsable)
                .filter(result -> !knowledgeBaseId.equals(result.getToolId()))
                .forEach(ordered::add);

        if (ordered.isEmpty()) {
            return fallback(question);
        }

        String fragments = ordered.stream()
                .map(result -> result.getLabel() + " " + result.getOutputText())
                .collect(Collectors.joining("\n\n"));
        return INTRO + "\n\n" + fragments;
    }

    public String fallback(String question) {
        return String.format(FALLBACK_TEMPLATE, question);
    }
}
