package com.purchasingpower.copilot.agent;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.purchasingpower.copilot.agent.Tool.ToolCategory;
import com.purchasingpower.copilot.configuration.AdvisorProperties;
import com.purchasingpower.copilot.exception.OrchestrationException;
import com.purchasingpower.copilot.model.dto.OrchestrationResult;
import com.purchasingpower.copilot.query.CandidateSymbol;
import com.purchasingpower.copilot.query.EntityDetector;
import com.purchasingpower.copilot.query.QueryCategorizer;
import com.purchasingpower.copilot.query.QueryCategory;
import com.purchasingpower.copilot.service.UsageStatsRecorder;
import com.purchasingpower.copilot.util.TextPreview;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * Fans a question out to the registered source tools and fuses what comes back.
 *
 * <p>Sources are consulted in a fixed order: web search, academic search, market data (only
 * when the question contains a symbol candidate) and the knowledge base. All calls run
 * concurrently on the {@code toolExecutor} pool and the answer is built once every call has
 * finished. A failing, empty or uninformative source is logged and left out of the answer; it
 * never aborts the others. There are no timeouts or retries.
 *
 * <p>Only a failure of the invocation mechanism itself (the executor refusing work, or a listener
 * callback throwing) fails the whole query, as an {@link OrchestrationException}. The query is
 * then recorded once as failed.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class ToolOrchestrator {

    private static final List<ToolCategory> POLICY_ORDER = ImmutableList.of(
            ToolCategory.WEB_SEARCH,
            ToolCategory.ACADEMIC_SEARCH,
            ToolCategory.MARKET_DATA,
            ToolCategory.KNOWLEDGE_BASE);

    private final Map<ToolCategory, Tool> tools;
    private final EntityDetector entityDetector;
    private final QueryCategorizer queryCategorizer;
    private final ResponseFuser responseFuser;
    private final UsageStatsRecorder usageStats;
    private final Executor toolExecutor;
    private final AdvisorProperties properties;

    public ToolOrchestrator(List<Tool> tools,
                            EntityDetector entityDetector,
                            QueryCategorizer queryCategorizer,
                            ResponseFuser responseFuser,
                            UsageStatsRecorder usageStats,
                            @Qualifier("toolExecutor") Executor toolExecutor,
                            AdvisorProperties properties) {
        this.tools = register(tools);
        this.entityDetector = entityDetector;
        this.queryCategorizer = queryCategorizer;
        this.responseFuser = responseFuser;
        this.usageStats = usageStats;
        this.toolExecutor = toolExecutor;
        this.properties = properties;
    }

    public OrchestrationResult process(String question) {
        return process(question, OrchestrationListener.NOOP);
    }

    /**
     * Answer a question, reporting progress to the listener as it happens.
     *
     * @throws OrchestrationException if the tool executor rejects an invocation or a listener
     *                                callback throws
     */
    public OrchestrationResult process(String question, OrchestrationListener listener) {
        Preconditions.checkArgument(question != null && !question.isBlank(), "Question cannot be blank");
        Preconditions.checkNotNull(listener, "Listener cannot be null");

        long startTime = System.nanoTime();
        QueryCategory category = queryCategorizer.categorize(question);
        log.info("Processing query [{}] with {} available tools {}: {}",
                category, tools.size(), availableToolIds(), TextPreview.preview(question, 100));
        try {
            listener.onStarted(question, category);
        } catch (RuntimeException e) {
            throw fail(question, category, startTime, List.of(), listener, "Listener failed for query", e);
        }

        List<PlannedCall> plan = plan(question);
        List<CompletableFuture<Invocation>> futures = new ArrayList<>();
        List<Invocation> invocations;

        try {
            for (PlannedCall call : plan) {
                futures.add(CompletableFuture.supplyAsync(() -> invoke(call, listener), toolExecutor));
            }
            // Barrier: fusion starts only after every source has answered or failed
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            invocations = futures.stream()
                    .map(CompletableFuture::join)
                    .collect(Collectors.toList());
        } catch (RejectedExecutionException | CompletionException e) {
            throw fail(question, category, startTime, plan.subList(0, futures.size()), listener,
                    "Tool invocation failed for query", e);
        }

        List<ToolInvocationResult> results = invocations.stream()
                .map(Invocation::getResult)
                .collect(Collectors.toList());
        List<String> toolsAttempted = plan.stream()
                .map(call -> call.getCategory().getToolId())
                .collect(Collectors.toList());

        String response = responseFuser.fuse(question, results);
        double elapsed = elapsedSeconds(startTime);

        OrchestrationResult result = OrchestrationResult.builder()
                .question(question)
                .responseText(response)
                .contextSnippets(contextSnippets(invocations))
                .toolsAttempted(toolsAttempted)
                .confidence(confidence(invocations))
                .category(category)
                .processingTimeSeconds(elapsed)
                .toolResults(results)
                .build();

        try {
            listener.onCompleted(result);
        } catch (RuntimeException e) {
            throw fail(question, category, startTime, plan, listener, "Listener failed for query", e);
        }

        usageStats.recordQuery(category, true, elapsed);
        toolsAttempted.forEach(usageStats::recordToolUsage);

        long informative = results.stream().filter(ToolInvocationResult::isUsable).count();
        log.info("Query completed in {}s: {} of {} sources informative, confidence {}",
                String.format("%.3f", elapsed), informative, results.size(), result.getConfidence());
        log.debug("Final response: {}", TextPreview.preview(response, 200));
        return result;
    }

    /**
     * Call a single source directly, with the same failure isolation as a full query.
     * Runs on the calling thread and records no usage stats.
     */
    public ToolInvocationResult invokeTool(ToolCategory category, String input) {
        Preconditions.checkNotNull(category, "Tool category cannot be null");
        Preconditions.checkArgument(input != null && !input.isBlank(), "Tool input cannot be blank");

        Tool tool = tools.get(category);
        if (tool == null) {
            log.warn("{} tool not available", category.getToolId());
            return ToolInvocationResult.failure(category.getToolId(), category.label(input),
                    category.getToolId() + " tool not available");
        }
        return invoke(new PlannedCall(category, tool, input), OrchestrationListener.NOOP).getResult();
    }

    /**
     * Availability of every source slot, keyed by tool id, plus {@code total_tools}.
     */
    public Map<String, Object> getToolStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        for (ToolCategory category : POLICY_ORDER) {
            status.put(category.getToolId(), tools.containsKey(category));
        }
        status.put("total_tools", tools.size());
        return Collections.unmodifiableMap(status);
    }

    private List<PlannedCall> plan(String question) {
        List<PlannedCall> plan = new ArrayList<>();
        for (ToolCategory category : POLICY_ORDER) {
            Tool tool = tools.get(category);
            if (tool == null) {
                log.warn("{} tool not available", category.getToolId());
                continue;
            }
            if (category == ToolCategory.MARKET_DATA) {
                Optional<CandidateSymbol> symbol = entityDetector.firstCandidate(question);
                if (symbol.isEmpty()) {
                    log.info("No valid stock symbols found in query");
                    continue;
                }
                log.info("Detected stock symbol: {}", symbol.get().getSymbol());
                plan.add(new PlannedCall(category, tool, symbol.get().getSymbol()));
            } else {
                plan.add(new PlannedCall(category, tool, question));
            }
        }
        return plan;
    }

    private Invocation invoke(PlannedCall call, OrchestrationListener listener) {
        ToolCategory category = call.getCategory();
        String toolId = category.getToolId();
        String label = category.label(call.getInput());

        listener.onToolStarted(toolId);
        log.info("Using {} tool", toolId);

        ToolResult output = null;
        ToolInvocationResult result;
        try {
            output = call.getTool().execute(call.getInput());
            result = interpret(category, label, output);
        } catch (Exception e) {
            log.warn("Tool {} failed: {}", toolId, e.getMessage(), e);
            result = ToolInvocationResult.failure(toolId, label, "Tool execution failed: " + e.getMessage());
        } catch (LinkageError | AssertionError e) {
            // Broken client library or tripped assertion inside one source
            log.error("Tool {} failed with {}: {}", toolId, e.getClass().getSimpleName(), e.getMessage(), e);
            result = ToolInvocationResult.failure(toolId, label, "Tool execution failed: " + e);
        }

        listener.onToolFinished(result);
        return new Invocation(call, output, result);
    }

    private ToolInvocationResult interpret(ToolCategory category, String label, ToolResult output) {
        String toolId = category.getToolId();
        if (output == null || output.getText() == null || output.getText().isBlank()) {
            log.warn("Tool {} returned no output", toolId);
            return ToolInvocationResult.failure(toolId, label, "No output");
        }

        String text = output.getText();
        log.debug("Tool {} result: {}", toolId, TextPreview.preview(text, 100));

        if (output.getInformative() != null) {
            if (!output.getInformative()) {
                log.info("Tool {} found no relevant information", toolId);
            }
            return ToolInvocationResult.success(toolId, label, text, output.getInformative());
        }
        if (category.indicatesFailure(text)) {
            log.warn("Tool {} reported a failure: {}", toolId, TextPreview.preview(text, 100));
            return ToolInvocationResult.success(toolId, label, text, false);
        }
        return ToolInvocationResult.success(toolId, label, text, true);
    }

    private List<String> contextSnippets(List<Invocation> invocations) {
        List<String> snippets = new ArrayList<>();
        for (Invocation invocation : invocations) {
            ToolCategory category = invocation.getCall().getCategory();
            if (category != ToolCategory.KNOWLEDGE_BASE && invocation.getResult().isUsable()) {
                snippets.add(category.provenance(invocation.getCall().getInput()));
            }
        }
        knowledgeBaseOutput(invocations).ifPresent(output -> snippets.addAll(output.getContext()));
        return snippets;
    }

    private double confidence(List<Invocation> invocations) {
        return knowledgeBaseOutput(invocations)
                .map(ToolResult::getRetrievalScore)
                .filter(ToolOrchestrator::isFiniteScore)
                .map(score -> Math.max(0.0, Math.min(1.0, score)))
                .orElse(properties.getDefaultConfidence());
    }

    private static boolean isFiniteScore(Double score) {
        if (!Double.isFinite(score)) {
            log.warn("Ignoring non-finite retrieval score {}", score);
            return false;
        }
        return true;
    }

    private Optional<ToolResult> knowledgeBaseOutput(List<Invocation> invocations) {
        return invocations.stream()
                .filter(invocation -> invocation.getCall().getCategory() == ToolCategory.KNOWLEDGE_BASE)
                .filter(invocation -> invocation.getResult().isSucceeded())
                .map(Invocation::getOutput)
                .findFirst();
    }

    private OrchestrationException fail(String question, QueryCategory category, long startTime,
                                        List<PlannedCall> submitted, OrchestrationListener listener,
                                        String reason, RuntimeException cause) {
        usageStats.recordQuery(category, false, elapsedSeconds(startTime));
        submitted.forEach(call -> usageStats.recordToolUsage(call.getCategory().getToolId()));

        OrchestrationException failure = new OrchestrationException(question,
                reason + ": " + cause.getMessage(), cause);
        log.error("Error processing query: {}", TextPreview.preview(question, 100), cause);
        try {
            listener.onFailed(failure);
        } catch (RuntimeException e) {
            log.error("Listener failed while reporting query failure", e);
            failure.addSuppressed(e);
        }
        return failure;
    }

    private List<String> availableToolIds() {
        return tools.keySet().stream().map(ToolCategory::getToolId).collect(Collectors.toList());
    }

    private static double elapsedSeconds(long startTime) {
        return (System.nanoTime() - startTime) / 1_000_000_000.0;
    }

    private static Map<ToolCategory, Tool> register(List<Tool> candidates) {
        Map<ToolCategory, Tool> registered = new EnumMap<>(ToolCategory.class);
        for (Tool tool : candidates) {
            Tool existing = registered.putIfAbsent(tool.getCategory(), tool);
            if (existing != null) {
                log.warn("Duplicate {} tool {} ignored, keeping {}",
                        tool.getCategory().getToolId(),
                        tool.getClass().getSimpleName(),
                        existing.getClass().getSimpleName());
            }
        }
        log.info("Registered source tools: {}", registered.keySet());
        return Collections.unmodifiableMap(registered);
    }

    @Value
    private static class PlannedCall {
        ToolCategory category;
        Tool tool;
        String input;
    }

    @Value
    private static class Invocation {
        PlannedCall call;
        ToolResult output;
        ToolInvocationResult result;
    }
}
